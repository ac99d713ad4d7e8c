package com.sarkari.jobfeed.scrape.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sarkari.jobfeed.config.ScraperProperties;
import com.sarkari.jobfeed.scrape.error.InvalidSourceConfigException;
import com.sarkari.jobfeed.scrape.model.FetchStrategyType;
import com.sarkari.jobfeed.scrape.model.JobField;
import com.sarkari.jobfeed.scrape.model.PaginationConfig;
import com.sarkari.jobfeed.scrape.model.SelectorMap;
import com.sarkari.jobfeed.scrape.model.SourceConfig;
import com.sarkari.jobfeed.scrape.model.SourceRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the per-source {@code config_json} blob into a {@link SourceConfig}.
 */
@Component
public class SourceConfigParser {
    private static final Logger log = LoggerFactory.getLogger(SourceConfigParser.class);

    private final ObjectMapper objectMapper;
    private final ScraperProperties properties;

    public SourceConfigParser(ObjectMapper objectMapper, ScraperProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public SourceConfig parse(SourceRow row) {
        JsonNode root = readTree(row.id(), row.configJson());
        SelectorMap selectors = parseSelectors(row.id(), root.path("selectors"));
        if (!selectors.hasContainer()) {
            throw new InvalidSourceConfigException("Source " + row.id() + " config has no selectors.job_container");
        }
        String baseUrl = firstNonBlank(row.baseUrl(), text(root, "base_url"));
        if (baseUrl == null) {
            throw new InvalidSourceConfigException("Source " + row.id() + " has no base_url");
        }
        String rawType = text(root, "scraper_type");
        FetchStrategyType scraperType = FetchStrategyType.fromValue(rawType);
        if (rawType != null && scraperType == null) {
            log.warn("Source {} has unknown scraper_type '{}', using automatic selection", row.id(), rawType);
        }

        return new SourceConfig(
            row.id(),
            row.name(),
            row.displayName(),
            baseUrl,
            selectors,
            parsePagination(root.path("pagination")),
            firstBoolean(root, "requires_js", "requires_javascript"),
            firstBoolean(root, "complex_structure"),
            scraperType,
            row.frequencyHours(),
            positiveInt(root, "requests_per_minute"),
            positiveInt(root, "max_retries"),
            positiveInt(root, "timeout_seconds"),
            firstBoolean(root, "use_proxy"),
            stringList(root.path("user_agents")),
            !root.has("block_resources") || root.path("block_resources").asBoolean(true),
            text(root, "wait_for_selector"),
            row.active(),
            row.status(),
            row.lastScrapedAt()
        );
    }

    private JsonNode readTree(long sourceId, String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidSourceConfigException("Source " + sourceId + " has empty config_json");
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new InvalidSourceConfigException("Source " + sourceId + " config_json is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new InvalidSourceConfigException("Source " + sourceId + " config_json is malformed", e);
        }
    }

    private SelectorMap parseSelectors(long sourceId, JsonNode node) {
        Map<String, List<String>> selectors = new LinkedHashMap<>();
        if (!node.isObject()) {
            return new SelectorMap(selectors);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String key;
            if (SelectorMap.JOB_CONTAINER.equals(entry.getKey())) {
                key = SelectorMap.JOB_CONTAINER;
            } else {
                JobField field = JobField.fromKey(entry.getKey());
                if (field == null) {
                    log.debug("Source {} selector '{}' is not a known field, ignoring", sourceId, entry.getKey());
                    continue;
                }
                key = field.key();
            }
            List<String> chain = stringList(entry.getValue());
            if (!chain.isEmpty()) {
                selectors.merge(key, chain, (existing, extra) -> {
                    List<String> merged = new ArrayList<>(existing);
                    merged.addAll(extra);
                    return merged;
                });
            }
        }
        return new SelectorMap(selectors);
    }

    private PaginationConfig parsePagination(JsonNode node) {
        int defaultMaxPages = properties.getPagination().getDefaultMaxPages();
        if (!node.isObject()) {
            return new PaginationConfig(null, null, 1, defaultMaxPages);
        }
        String nextPage = firstNonBlank(text(node, "next_page"), text(node, "next_page_selector"));
        String pattern = text(node, "url_pattern");
        Integer startPage = positiveInt(node, "start_page");
        Integer maxPages = positiveInt(node, "max_pages");
        return new PaginationConfig(
            nextPage,
            pattern,
            startPage == null ? 1 : startPage,
            maxPages == null ? defaultMaxPages : maxPages
        );
    }

    private List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isMissingNode() || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isTextual() && !item.asText().isBlank()) {
                    values.add(item.asText().trim());
                }
            }
        } else if (node.isTextual() && !node.asText().isBlank()) {
            values.add(node.asText().trim());
        }
        return values;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText().trim();
    }

    private boolean firstBoolean(JsonNode node, String... fields) {
        for (String field : fields) {
            if (node.has(field)) {
                return node.path(field).asBoolean(false);
            }
        }
        return false;
    }

    private Integer positiveInt(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.canConvertToInt() && !value.isTextual()) {
            return null;
        }
        int parsed = value.asInt(0);
        return parsed > 0 ? parsed : null;
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}

package com.sarkari.jobfeed.scrape.extract;

import com.sarkari.jobfeed.scrape.model.ExtractedPage;
import com.sarkari.jobfeed.scrape.model.ExtractionIssue;
import com.sarkari.jobfeed.scrape.model.JobField;
import com.sarkari.jobfeed.scrape.model.PaginationConfig;
import com.sarkari.jobfeed.scrape.model.RawJobRecord;
import com.sarkari.jobfeed.scrape.model.ScrapeErrorType;
import com.sarkari.jobfeed.scrape.model.SelectorMap;
import com.sarkari.jobfeed.scrape.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class FieldExtractor {
    private static final Logger log = LoggerFactory.getLogger(FieldExtractor.class);

    static final List<String> FALLBACK_CONTAINERS = List.of(
        "tr:has(a)",
        "li:has(a)",
        ".item:has(a)",
        "div:has(a[href*=notification])"
    );

    public ExtractedPage extract(String html, String pageUrl, SelectorMap selectors, PaginationConfig pagination) {
        List<ExtractionIssue> issues = new ArrayList<>();
        if (html == null || html.isBlank()) {
            issues.add(new ExtractionIssue(ScrapeErrorType.PARSING, "Empty page markup", null));
            return new ExtractedPage(pageUrl, 0, List.of(), null, issues);
        }

        Document document = Jsoup.parse(html, pageUrl == null ? "" : pageUrl);
        Set<String> badSelectors = new LinkedHashSet<>();
        Elements containers = locateContainers(document, selectors, badSelectors);
        List<RawJobRecord> records = new ArrayList<>();
        if (containers.isEmpty()) {
            issues.add(new ExtractionIssue(
                ScrapeErrorType.PARSING,
                "No job containers matched on page",
                String.join(", ", selectors.containerChain())
            ));
        } else {
            int discarded = 0;
            for (Element container : containers) {
                RawJobRecord record = extractContainer(container, pageUrl, selectors, badSelectors);
                if (record == null) {
                    discarded++;
                    continue;
                }
                records.add(record);
            }
            if (discarded > 0) {
                log.debug("Discarded {} containers without a title on {}", discarded, pageUrl);
            }
        }

        String nextPageUrl = resolveNextPageUrl(document, pageUrl, pagination, badSelectors);
        for (String selector : badSelectors) {
            issues.add(new ExtractionIssue(ScrapeErrorType.PARSING, "Invalid CSS selector", selector));
        }
        return new ExtractedPage(pageUrl, containers.size(), records, nextPageUrl, issues);
    }

    private Elements locateContainers(Document document, SelectorMap selectors, Set<String> badSelectors) {
        for (String selector : selectors.containerChain()) {
            Elements found = select(document, selector, badSelectors);
            if (!found.isEmpty()) {
                return found;
            }
        }
        for (String selector : FALLBACK_CONTAINERS) {
            Elements found = select(document, selector, badSelectors);
            if (!found.isEmpty()) {
                log.debug("Using fallback container selector {} on {}", selector, document.location());
                return innermost(found);
            }
        }
        return new Elements();
    }

    private RawJobRecord extractContainer(
        Element container,
        String pageUrl,
        SelectorMap selectors,
        Set<String> badSelectors
    ) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (JobField field : JobField.values()) {
            List<String> chain = selectors.chain(field.key());
            if (chain.isEmpty()) {
                chain = field.defaultSelectors();
            }
            String value = firstValue(container, field, chain, badSelectors);
            if (value != null) {
                fields.put(field.key(), value);
            }
        }
        if (!fields.containsKey(JobField.TITLE.key())) {
            return null;
        }
        String link = fields.get(JobField.SOURCE_LINK.key());
        String sourceUrl = UrlUtils.isHttpUrl(link) ? link : pageUrl;
        return new RawJobRecord(fields, pageUrl, sourceUrl, null);
    }

    private String firstValue(Element container, JobField field, List<String> chain, Set<String> badSelectors) {
        for (String selector : chain) {
            for (Element element : select(container, selector, badSelectors)) {
                String value = field.isLink() ? link(element) : element.text();
                if (value != null && !value.isBlank()) {
                    return value.trim();
                }
            }
        }
        return null;
    }

    private String link(Element element) {
        String href = element.absUrl("href");
        if (href.isBlank()) {
            Element anchor = element.selectFirst("a[href]");
            href = anchor == null ? "" : anchor.absUrl("href");
        }
        return href.isBlank() ? null : href;
    }

    private String resolveNextPageUrl(
        Document document,
        String pageUrl,
        PaginationConfig pagination,
        Set<String> badSelectors
    ) {
        if (pagination == null || !pagination.usesNextPageSelector()) {
            return null;
        }
        for (Element element : select(document, pagination.nextPageSelector(), badSelectors)) {
            String href = link(element);
            if (href != null && UrlUtils.isHttpUrl(href) && !href.equals(pageUrl)) {
                return href;
            }
        }
        return null;
    }

    private Elements select(Element root, String selector, Set<String> badSelectors) {
        if (selector == null || selector.isBlank() || badSelectors.contains(selector)) {
            return new Elements();
        }
        try {
            return root.select(selector);
        } catch (Selector.SelectorParseException e) {
            badSelectors.add(selector);
            return new Elements();
        }
    }

    // Fallback patterns like li:has(a) also match wrapping lists; keep only the leaf-most matches.
    private Elements innermost(Elements found) {
        Elements leaves = new Elements();
        for (Element candidate : found) {
            boolean hasNestedMatch = false;
            for (Element other : found) {
                if (other != candidate && other.parents().contains(candidate)) {
                    hasNestedMatch = true;
                    break;
                }
            }
            if (!hasNestedMatch) {
                leaves.add(candidate);
            }
        }
        return leaves;
    }
}

package com.sarkari.jobfeed.scrape.service;

import com.sarkari.jobfeed.scrape.error.InvalidSourceConfigException;
import com.sarkari.jobfeed.scrape.model.SourceCatalogImportSummary;
import com.sarkari.jobfeed.scrape.model.SourceRow;
import com.sarkari.jobfeed.scrape.model.SourceStatus;
import com.sarkari.jobfeed.scrape.persistence.SourceConfigParser;
import com.sarkari.jobfeed.scrape.persistence.SourceJdbcRepository;
import com.sarkari.jobfeed.scrape.util.UrlUtils;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Seeds or refreshes the source registry from a CSV catalog with the columns
 * {@code name, display_name, base_url, frequency_hours, config_json, active}. Rows are matched by name.
 */
@Service
public class SourceCatalogImporter {
    private static final Logger log = LoggerFactory.getLogger(SourceCatalogImporter.class);
    private static final int DEFAULT_FREQUENCY_HOURS = 24;

    private final SourceJdbcRepository sourceRepository;
    private final SourceConfigParser configParser;

    public SourceCatalogImporter(SourceJdbcRepository sourceRepository, SourceConfigParser configParser) {
        this.sourceRepository = sourceRepository;
        this.configParser = configParser;
    }

    public SourceCatalogImportSummary importCatalog(String configuredPath) {
        Path path = resolvePath(configuredPath);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return importCatalog(reader);
        } catch (IOException e) {
            log.warn("Failed to read source catalog {}", path, e);
            return new SourceCatalogImportSummary(0, 0, 0, List.of("failed to read catalog at " + path + ": " + e.getMessage()));
        }
    }

    public SourceCatalogImportSummary importCatalog(Reader reader) throws IOException {
        int rowsRead = 0;
        int inserted = 0;
        int updated = 0;
        List<String> errors = new ArrayList<>();
        try (CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                rowsRead++;
                String name = getColumn(record, "name");
                String baseUrl = UrlUtils.normalizeHttpUrl(getColumn(record, "base_url"));
                String configJson = getColumn(record, "config_json");
                if (name == null || baseUrl == null || configJson == null) {
                    errors.add("catalog row " + record.getRecordNumber() + " missing name, base_url or config_json");
                    continue;
                }
                String displayName = Optional.ofNullable(getColumn(record, "display_name")).orElse(name);
                int frequencyHours = parseFrequency(getColumn(record, "frequency_hours"));
                boolean active = parseActive(getColumn(record, "active"));
                try {
                    configParser.parse(new SourceRow(
                        0L, name, displayName, baseUrl, active, SourceStatus.ACTIVE, frequencyHours, configJson, null, null, 0L
                    ));
                } catch (InvalidSourceConfigException e) {
                    errors.add("catalog row " + record.getRecordNumber() + " (" + name + "): " + e.getMessage());
                    continue;
                }

                Optional<SourceRow> existing = sourceRepository.findByName(name);
                if (existing.isPresent()) {
                    sourceRepository.updateSource(existing.get().id(), displayName, baseUrl, frequencyHours, configJson, active);
                    updated++;
                } else {
                    sourceRepository.insertSource(name, displayName, baseUrl, frequencyHours, configJson, active);
                    inserted++;
                }
            }
        }
        log.info("Source catalog import: rows={} inserted={} updated={} errors={}", rowsRead, inserted, updated, errors.size());
        return new SourceCatalogImportSummary(rowsRead, inserted, updated, errors);
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String name) {
        for (String header : record.toMap().keySet()) {
            if (header != null && header.trim().equalsIgnoreCase(name) && record.isSet(header)) {
                String value = record.get(header).trim();
                return value.isEmpty() ? null : value;
            }
        }
        return null;
    }

    private int parseFrequency(String raw) {
        if (raw == null) {
            return DEFAULT_FREQUENCY_HOURS;
        }
        try {
            return Math.max(1, Integer.parseInt(raw));
        } catch (NumberFormatException e) {
            log.debug("Invalid frequency_hours '{}', using default", raw);
            return DEFAULT_FREQUENCY_HOURS;
        }
    }

    private boolean parseActive(String raw) {
        if (raw == null) {
            return true;
        }
        String value = raw.toLowerCase(Locale.ROOT);
        return !(value.equals("false") || value.equals("0") || value.equals("no") || value.equals("n"));
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}

package com.sarkari.jobfeed.scrape.model;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Canonical listing fields with their built-in fallback selectors and the config aliases they accept.
 */
public enum JobField {
    TITLE("title", false, List.of("a", "h2", "h3", ".title"), List.of("job_title", "name")),
    DESCRIPTION("description", false, List.of(".description", ".summary", ".details"), List.of("summary")),
    DEPARTMENT("department", false, List.of(".department", ".organization", ".ministry"),
        List.of("organization", "ministry", "board", "commission")),
    POSTS("posts", false, List.of(".posts", ".vacancies", ".positions"), List.of("vacancies", "total_posts")),
    QUALIFICATION("qualification", false, List.of(".qualification", ".eligibility", ".education"),
        List.of("eligibility", "education")),
    NOTIFICATION_DATE("notification_date", false, List.of(".notification-date", ".published", ".date"),
        List.of("published_date", "post_date")),
    LAST_DATE("last_date", false, List.of(".last-date", ".deadline", ".end-date"),
        List.of("application_end_date", "deadline", "end_date")),
    EXAM_DATE("exam_date", false, List.of(".exam-date"), List.of()),
    FEE("fee", false, List.of(".fee", ".application-fee"), List.of("application_fee")),
    SALARY("salary", false, List.of(".salary", ".pay", ".compensation"), List.of("pay_scale")),
    AGE_LIMIT("age_limit", false, List.of(".age-limit", ".age", ".age-criteria"), List.of("age")),
    LOCATION("location", false, List.of(".location", ".place", ".state"), List.of("place")),
    APPLICATION_LINK("application_link", true, List.of("a.apply", "a[href*=apply]"), List.of("apply_link")),
    NOTIFICATION_PDF("notification_pdf", true, List.of("a[href$=.pdf]"), List.of("pdf_link")),
    SOURCE_LINK("source_link", true, List.of("a[href]"), List.of("url", "link", "detail_link"));

    private static final Map<String, JobField> BY_KEY = new HashMap<>();

    static {
        for (JobField field : values()) {
            BY_KEY.put(field.key, field);
            for (String alias : field.aliases) {
                BY_KEY.put(alias, field);
            }
        }
    }

    private final String key;
    private final boolean link;
    private final List<String> defaultSelectors;
    private final List<String> aliases;

    JobField(String key, boolean link, List<String> defaultSelectors, List<String> aliases) {
        this.key = key;
        this.link = link;
        this.defaultSelectors = defaultSelectors;
        this.aliases = aliases;
    }

    public String key() {
        return key;
    }

    public boolean isLink() {
        return link;
    }

    public List<String> defaultSelectors() {
        return defaultSelectors;
    }

    public static JobField fromKey(String raw) {
        if (raw == null) {
            return null;
        }
        return BY_KEY.get(raw.trim().toLowerCase(Locale.ROOT));
    }
}

package com.sarkari.jobfeed.scrape.normalize;

import org.jsoup.Jsoup;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class TextCleaner {
    public static final int MAX_TITLE_LENGTH = 255;

    private static final Pattern HTML_TAG = Pattern.compile("<[a-zA-Z/!][^>]*>");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0\\u2007\\u202F]+");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern LEADING_PUNCTUATION = Pattern.compile("^[\\s:\\-–—|]+");
    private static final List<String> TITLE_PREFIXES = List.of(
        "recruitment for",
        "recruitment of",
        "notification for",
        "advertisement for",
        "vacancy for",
        "apply for"
    );

    private TextCleaner() {
    }

    public static String clean(String value) {
        if (value == null) {
            return null;
        }
        String text = value;
        if (HTML_TAG.matcher(text).find()) {
            text = Jsoup.parse(text).text();
        }
        text = WHITESPACE.matcher(text).replaceAll(" ").trim();
        return text.isEmpty() ? null : text;
    }

    public static String cleanTitle(String value) {
        String title = clean(value);
        if (title == null) {
            return null;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        for (String prefix : TITLE_PREFIXES) {
            if (lower.startsWith(prefix)) {
                title = LEADING_PUNCTUATION.matcher(title.substring(prefix.length())).replaceFirst("").trim();
                break;
            }
        }
        title = truncate(title, MAX_TITLE_LENGTH);
        return title.isEmpty() ? null : title;
    }

    public static String cleanDescription(String value) {
        String text = clean(value);
        if (text == null) {
            return null;
        }
        Set<String> seen = new LinkedHashSet<>();
        List<String> kept = new ArrayList<>();
        for (String sentence : SENTENCE_BREAK.split(text)) {
            String trimmed = sentence.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                kept.add(trimmed);
            }
        }
        return kept.isEmpty() ? null : String.join(" ", kept);
    }

    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength).trim();
    }

    public static String hashComponent(String value) {
        String cleaned = clean(value);
        return cleaned == null ? "" : cleaned.toLowerCase(Locale.ROOT);
    }
}

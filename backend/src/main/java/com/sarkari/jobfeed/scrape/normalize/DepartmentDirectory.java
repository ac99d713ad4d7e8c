package com.sarkari.jobfeed.scrape.normalize;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

public final class DepartmentDirectory {
    private static final Map<String, String> ABBREVIATIONS = new LinkedHashMap<>();
    private static final Map<String, Pattern> WORD_PATTERNS = new LinkedHashMap<>();

    static {
        ABBREVIATIONS.put("SSC", "Staff Selection Commission");
        ABBREVIATIONS.put("UPSC", "Union Public Service Commission");
        ABBREVIATIONS.put("RRB", "Railway Recruitment Board");
        ABBREVIATIONS.put("IBPS", "Institute of Banking Personnel Selection");
        ABBREVIATIONS.put("SBI", "State Bank of India");
        ABBREVIATIONS.put("LIC", "Life Insurance Corporation");
        ABBREVIATIONS.put("DRDO", "Defence Research and Development Organisation");
        ABBREVIATIONS.put("ISRO", "Indian Space Research Organisation");
        ABBREVIATIONS.put("ONGC", "Oil and Natural Gas Corporation");
        ABBREVIATIONS.put("BHEL", "Bharat Heavy Electricals Limited");
        ABBREVIATIONS.put("SAIL", "Steel Authority of India Limited");
        ABBREVIATIONS.put("NTPC", "National Thermal Power Corporation");
        ABBREVIATIONS.put("BSNL", "Bharat Sanchar Nigam Limited");
        ABBREVIATIONS.put("NHM", "National Health Mission");
        ABBREVIATIONS.put("AIIMS", "All India Institute of Medical Sciences");
        for (String abbreviation : ABBREVIATIONS.keySet()) {
            WORD_PATTERNS.put(abbreviation, Pattern.compile("\\b" + abbreviation + "\\b"));
        }
    }

    private DepartmentDirectory() {
    }

    public static String expand(String department) {
        String cleaned = TextCleaner.clean(department);
        if (cleaned == null) {
            return null;
        }
        String full = ABBREVIATIONS.get(cleaned.toUpperCase(Locale.ROOT).replace(".", ""));
        return full != null ? full : cleaned;
    }

    /**
     * Abbreviations are only recognised as whole upper-case words, so "sail" inside ordinary prose is ignored.
     */
    public static String detectInText(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        for (Map.Entry<String, Pattern> entry : WORD_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                return ABBREVIATIONS.get(entry.getKey());
            }
        }
        return null;
    }
}

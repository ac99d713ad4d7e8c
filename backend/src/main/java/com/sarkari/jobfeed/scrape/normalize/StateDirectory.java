package com.sarkari.jobfeed.scrape.normalize;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class StateDirectory {
    private static final List<String> STATES = List.of(
        "Andhra Pradesh", "Arunachal Pradesh", "Assam", "Bihar", "Chhattisgarh",
        "Goa", "Gujarat", "Haryana", "Himachal Pradesh", "Jharkhand", "Karnataka",
        "Kerala", "Madhya Pradesh", "Maharashtra", "Manipur", "Meghalaya",
        "Mizoram", "Nagaland", "Odisha", "Punjab", "Rajasthan", "Sikkim",
        "Tamil Nadu", "Telangana", "Tripura", "Uttar Pradesh", "Uttarakhand",
        "West Bengal", "Andaman and Nicobar Islands", "Chandigarh",
        "Dadra and Nagar Haveli", "Daman and Diu", "Delhi", "Jammu and Kashmir",
        "Ladakh", "Lakshadweep", "Puducherry"
    );
    private static final List<Pattern> PATTERNS = STATES.stream()
        .map(state -> Pattern.compile("\\b" + Pattern.quote(state.toLowerCase(Locale.ROOT)) + "\\b"))
        .toList();

    private StateDirectory() {
    }

    public static String detect(String location) {
        if (location == null || location.isBlank()) {
            return null;
        }
        String lower = location.toLowerCase(Locale.ROOT);
        for (int i = 0; i < STATES.size(); i++) {
            if (PATTERNS.get(i).matcher(lower).find()) {
                return STATES.get(i);
            }
        }
        return null;
    }
}

package com.sarkari.jobfeed.scrape.normalize;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class MoneyParser {
    private static final List<String> ZERO_FEE_WORDS = List.of("free", "no fee", "nil", "exempt", "not applicable");
    private static final Pattern AMOUNT = Pattern.compile("(\\d[\\d,]*(?:\\.\\d+)?)");

    private MoneyParser() {
    }

    public static BigDecimal parseFee(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String text = raw.toLowerCase(Locale.ROOT).trim();
        for (String word : ZERO_FEE_WORDS) {
            if (text.contains(word)) {
                return BigDecimal.ZERO.setScale(2, RoundingMode.UNNECESSARY);
            }
        }
        return firstAmount(text);
    }

    static BigDecimal firstAmount(String text) {
        Matcher matcher = AMOUNT.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        return toAmount(matcher.group(1));
    }

    static BigDecimal toAmount(String digits) {
        if (digits == null) {
            return null;
        }
        String cleaned = digits.replace(",", "");
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(cleaned).setScale(2, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

package com.sarkari.jobfeed.scrape.normalize;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads salary and age texts. Precedence is explicit range, then maximum-only, then minimum-only,
 * then a bare value.
 */
public final class RangeParser {
    private static final String NUMBER = "(\\d[\\d,]*(?:\\.\\d+)?)";
    private static final List<Pattern> RANGE_PATTERNS = List.of(
        Pattern.compile("between\\s+(?:rs\\.?|inr|₹)?\\s*" + NUMBER + "\\s+and\\s+(?:rs\\.?|inr|₹)?\\s*" + NUMBER),
        Pattern.compile("from\\s+(?:rs\\.?|inr|₹)?\\s*" + NUMBER + "\\s+to\\s+(?:rs\\.?|inr|₹)?\\s*" + NUMBER),
        Pattern.compile("(?:minimum|min\\.?)\\s*:?\\s*" + NUMBER + ".*?(?:maximum|max\\.?)\\s*:?\\s*" + NUMBER),
        Pattern.compile(NUMBER + "\\s*(?:-|–|—|to)\\s*(?:rs\\.?|inr|₹)?\\s*" + NUMBER)
    );
    private static final List<Pattern> MAX_PATTERNS = List.of(
        Pattern.compile("(?:maximum|max\\.?|up\\s*to|upto|below|under|not\\s+more\\s+than)\\s*(?:age|of)?\\s*:?\\s*" + NUMBER)
    );
    private static final List<Pattern> MIN_PATTERNS = List.of(
        Pattern.compile("(?:minimum|min\\.?|above|over|at\\s+least|not\\s+less\\s+than)\\s*(?:age|of)?\\s*:?\\s*" + NUMBER)
    );
    private static final Pattern SINGLE = Pattern.compile(NUMBER);

    public enum Bound {
        RANGE,
        MAX_ONLY,
        MIN_ONLY,
        SINGLE
    }

    public record Range(BigDecimal min, BigDecimal max, Bound bound) {
        public static final Range EMPTY = new Range(null, null, null);

        public boolean isEmpty() {
            return min == null && max == null;
        }

        public Integer minAsInt() {
            return min == null ? null : min.intValue();
        }

        public Integer maxAsInt() {
            return max == null ? null : max.intValue();
        }
    }

    private RangeParser() {
    }

    public static Range parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Range.EMPTY;
        }
        String text = raw.toLowerCase(Locale.ROOT).trim();
        for (Pattern pattern : RANGE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                BigDecimal low = MoneyParser.toAmount(matcher.group(1));
                BigDecimal high = MoneyParser.toAmount(matcher.group(2));
                if (low != null && high != null) {
                    return low.compareTo(high) <= 0
                        ? new Range(low, high, Bound.RANGE)
                        : new Range(high, low, Bound.RANGE);
                }
            }
        }
        BigDecimal max = firstGroup(MAX_PATTERNS, text);
        if (max != null) {
            return new Range(null, max, Bound.MAX_ONLY);
        }
        BigDecimal min = firstGroup(MIN_PATTERNS, text);
        if (min != null) {
            return new Range(min, null, Bound.MIN_ONLY);
        }
        BigDecimal single = firstGroup(List.of(SINGLE), text);
        if (single != null) {
            return new Range(single, single, Bound.SINGLE);
        }
        return Range.EMPTY;
    }

    /**
     * Age fields quoting a single number state the upper limit, so a bare value becomes the maximum.
     */
    public static Range parseAge(String raw) {
        Range range = parse(raw);
        if (range.bound() == Bound.SINGLE) {
            return new Range(null, range.max(), Bound.MAX_ONLY);
        }
        return range;
    }

    private static BigDecimal firstGroup(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                BigDecimal value = MoneyParser.toAmount(matcher.group(1));
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }
}

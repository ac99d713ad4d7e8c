package com.sarkari.jobfeed.scrape.normalize;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses notice dates. Pattern families are tried in a fixed order and the first match that forms a
 * real calendar date wins.
 */
public final class DateParser {
    private static final Pattern DAY_MONTH_YEAR = Pattern.compile("\\b(\\d{1,2})[/.-](\\d{1,2})[/.-](\\d{4})\\b");
    private static final Pattern YEAR_MONTH_DAY = Pattern.compile("\\b(\\d{4})[/.-](\\d{1,2})[/.-](\\d{1,2})\\b");
    private static final Pattern DAY_MONTHNAME_YEAR = Pattern.compile(
        "\\b(\\d{1,2})(?:st|nd|rd|th)?[\\s-]+([A-Za-z]{3,9})\\.?,?[\\s-]+(\\d{4})\\b"
    );
    private static final Pattern MONTHNAME_DAY_YEAR = Pattern.compile(
        "\\b([A-Za-z]{3,9})\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(\\d{4})\\b"
    );
    private static final Map<String, Integer> MONTHS = Map.ofEntries(
        Map.entry("january", 1), Map.entry("jan", 1),
        Map.entry("february", 2), Map.entry("feb", 2),
        Map.entry("march", 3), Map.entry("mar", 3),
        Map.entry("april", 4), Map.entry("apr", 4),
        Map.entry("may", 5),
        Map.entry("june", 6), Map.entry("jun", 6),
        Map.entry("july", 7), Map.entry("jul", 7),
        Map.entry("august", 8), Map.entry("aug", 8),
        Map.entry("september", 9), Map.entry("sep", 9), Map.entry("sept", 9),
        Map.entry("october", 10), Map.entry("oct", 10),
        Map.entry("november", 11), Map.entry("nov", 11),
        Map.entry("december", 12), Map.entry("dec", 12)
    );

    private enum Family {
        DMY(DAY_MONTH_YEAR),
        YMD(YEAR_MONTH_DAY),
        D_MONTH_Y(DAY_MONTHNAME_YEAR),
        MONTH_D_Y(MONTHNAME_DAY_YEAR);

        private final Pattern pattern;

        Family(Pattern pattern) {
            this.pattern = pattern;
        }
    }

    private static final List<Family> ORDER = List.of(Family.DMY, Family.YMD, Family.D_MONTH_Y, Family.MONTH_D_Y);

    private DateParser() {
    }

    public static LocalDate parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String text = raw.trim();
        for (Family family : ORDER) {
            Matcher matcher = family.pattern.matcher(text);
            while (matcher.find()) {
                LocalDate date = toDate(family, matcher);
                if (date != null) {
                    return date;
                }
            }
        }
        return null;
    }

    private static LocalDate toDate(Family family, Matcher matcher) {
        return switch (family) {
            case DMY -> of(matcher.group(3), matcher.group(2), matcher.group(1));
            case YMD -> of(matcher.group(1), matcher.group(2), matcher.group(3));
            case D_MONTH_Y -> ofMonthName(matcher.group(3), matcher.group(2), matcher.group(1));
            case MONTH_D_Y -> ofMonthName(matcher.group(3), matcher.group(1), matcher.group(2));
        };
    }

    private static LocalDate ofMonthName(String year, String monthName, String day) {
        Integer month = MONTHS.get(monthName.toLowerCase(Locale.ROOT));
        if (month == null) {
            return null;
        }
        return of(year, month.toString(), day);
    }

    private static LocalDate of(String year, String month, String day) {
        try {
            return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
        } catch (DateTimeException | NumberFormatException e) {
            return null;
        }
    }
}

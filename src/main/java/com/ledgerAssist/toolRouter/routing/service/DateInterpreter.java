package com.ledgerAssist.toolRouter.routing.service;

import com.ledgerAssist.toolRouter.routing.model.DateRange;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves natural-language temporal expressions (English and Indonesian) to date ranges.
 *
 * Calendar-anchored phrases ("last week", "bulan lalu", "q3", "oktober 2025") snap to the
 * boundaries of their calendar unit; weeks are ISO weeks starting on Monday. Rolling phrases
 * ("7 days", "30 hari terakhir") end today and start N units earlier. The reference date is
 * always passed in; the wall clock is never read here.
 */
@Slf4j
public final class DateInterpreter {

    private static final String YEAR = "20\\d{2}";

    /**
     * Optional "tahun"/"year" before the year that follows a quarter or month.
     */
    private static final String YEAR_SUFFIX = "(?:\\s+(?:tahun|year))?\\s+" + YEAR;

    /**
     * Words that mark a bare month name as a date ("bulan mei", "in may"). Without one of
     * these or a year, "may" is the English modal verb.
     */
    private static final String MONTH_CUES = "bulan|pada|selama|in|during|for";

    /**
     * Rolling counts are capped at four digits; longer runs of digits are not a date.
     */
    private static final int MAX_COUNT_DIGITS = 4;

    private static final Map<String, Integer> MONTHS = months();

    private static final Map<String, Integer> NUMBER_WORDS = numberWords();

    private static final String FIXED_PHRASES = String.join("|",
            "last week", "minggu lalu", "minggu kemarin", "this week", "minggu ini",
            "last month", "bulan lalu", "bulan kemarin", "this month", "bulan ini",
            "last quarter", "kuartal lalu", "this quarter", "kuartal ini",
            "last year", "tahun lalu", "tahun kemarin", "this year", "tahun ini",
            "yesterday", "kemarin", "today", "hari ini");

    private static final Pattern ISO_RANGE = Pattern.compile(
            "(\\d{4}-\\d{2}-\\d{2})\\s*(?:to|until|sampai|s/d|-)\\s*(\\d{4}-\\d{2}-\\d{2})");
    private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4}-\\d{2}-\\d{2})\\b");
    private static final Pattern QUARTER = Pattern.compile("(?:\\bq|\\b(?:kuartal|quarter|triwulan)\\s*)([1-4])\\b");
    private static final Pattern YEAR_IN_PHRASE = Pattern.compile("\\b(" + YEAR + ")\\b");
    private static final Pattern YEAR_ONLY = Pattern.compile("(?:(?:year|tahun)\\s+)?(" + YEAR + ")");
    private static final Pattern ROLLING_NUMERIC = Pattern.compile(
            "\\b(\\d{1," + MAX_COUNT_DIGITS + "})\\s*(days?|hari|weeks?|minggu|months?|bulan)\\b");
    private static final Pattern ROLLING_WORDS = Pattern.compile(
            "\\b(" + String.join("|", NUMBER_WORDS.keySet()) + ")\\s+(days|hari)\\b");

    /**
     * Expressions searched for inside a longer query; the longest hit is used.
     */
    private static final List<Pattern> EXPRESSIONS = List.of(
            Pattern.compile("\\d{4}-\\d{2}-\\d{2}\\s*(?:to|until|sampai|s/d|-)\\s*\\d{4}-\\d{2}-\\d{2}"),
            Pattern.compile("\\b\\d{4}-\\d{2}-\\d{2}\\b"),
            Pattern.compile("\\b(?:" + FIXED_PHRASES + ")\\b"),
            Pattern.compile("\\b(?:q[1-4]|(?:kuartal|quarter|triwulan)\\s*[1-4])(?:" + YEAR_SUFFIX + ")?\\b"),
            Pattern.compile("\\b(?:(?:" + MONTH_CUES + ")\\s+)?(?:" + String.join("|", MONTHS.keySet()) + ")"
                    + YEAR_SUFFIX + "\\b"),
            Pattern.compile("\\b(?:" + MONTH_CUES + ")\\s+(?:" + String.join("|", MONTHS.keySet()) + ")\\b"),
            Pattern.compile("\\b(?:(?:last|past)\\s+)?\\d{1," + MAX_COUNT_DIGITS + "}\\s*(?:days?|hari|weeks?|minggu|months?|bulan)"
                    + "(?:\\s+(?:ago|terakhir|lalu|yang lalu))?\\b"),
            Pattern.compile("\\b(?:(?:last|past)\\s+)?(?:" + String.join("|", NUMBER_WORDS.keySet()) + ")\\s+(?:days|hari)"
                    + "(?:\\s+(?:ago|terakhir|lalu|yang lalu))?\\b"),
            Pattern.compile("(?<![\\d-])(?:(?:year|tahun)\\s+)?" + YEAR + "(?![\\d-])")
    );

    /**
     * Finds the temporal phrase inside a query.
     *
     * @param query Free-text query
     * @return The literal phrase (lower-case), or null when the query has none
     */
    public String extractExpression(String query) {
        if (query == null || query.isBlank()) {
            return null;
        }
        String text = query.toLowerCase().replaceAll("\\s+", " ");

        String best = null;
        for (Pattern expression : EXPRESSIONS) {
            Matcher matcher = expression.matcher(text);
            while (matcher.find()) {
                String candidate = matcher.group().trim();
                if (best == null || candidate.length() > best.length()) {
                    best = candidate;
                }
            }
        }
        return best;
    }

    /**
     * Parses a temporal phrase into a date range.
     *
     * @param phrase Temporal phrase, e.g. "last week", "30 hari", "q2 2025"
     * @param today Reference date
     * @return Resolved range, or null when the phrase is not recognized
     */
    public DateRange parse(String phrase, LocalDate today) {
        if (phrase == null || phrase.isBlank()) {
            return null;
        }
        String text = phrase.trim().toLowerCase().replaceAll("\\s+", " ");

        DateRange fixed = parseFixedPhrase(text, today);
        if (fixed != null) {
            return fixed;
        }

        DateRange explicit = parseExplicitDates(text);
        if (explicit != null) {
            return explicit;
        }

        int year = extractYear(text, today.getYear());

        Matcher quarter = QUARTER.matcher(text);
        if (quarter.find()) {
            int startMonth = (Integer.parseInt(quarter.group(1)) - 1) * 3 + 1;
            LocalDate start = LocalDate.of(year, startMonth, 1);
            return DateRange.calendar(start, start.plusMonths(3).minusDays(1));
        }

        for (Map.Entry<String, Integer> month : MONTHS.entrySet()) {
            if (Pattern.compile("\\b" + month.getKey() + "\\b").matcher(text).find()) {
                YearMonth yearMonth = YearMonth.of(year, month.getValue());
                return DateRange.calendar(yearMonth.atDay(1), yearMonth.atEndOfMonth());
            }
        }

        DateRange rolling = parseRollingWindow(text, today);
        if (rolling != null) {
            return rolling;
        }

        Matcher yearOnly = YEAR_ONLY.matcher(text);
        if (yearOnly.matches()) {
            int bareYear = Integer.parseInt(yearOnly.group(1));
            return DateRange.calendar(LocalDate.of(bareYear, 1, 1), LocalDate.of(bareYear, 12, 31));
        }

        log.debug("Date phrase '{}' not recognized", phrase);
        return null;
    }

    private DateRange parseFixedPhrase(String text, LocalDate today) {
        LocalDate monday = today.minusDays(today.getDayOfWeek().getValue() - 1L);
        LocalDate monthStart = today.withDayOfMonth(1);
        LocalDate quarterStart = LocalDate.of(today.getYear(), ((today.getMonthValue() - 1) / 3) * 3 + 1, 1);

        return switch (text) {
            case "today", "hari ini" -> DateRange.calendar(today, today);
            case "yesterday", "kemarin" -> DateRange.calendar(today.minusDays(1), today.minusDays(1));
            case "this week", "minggu ini" -> DateRange.calendar(monday, today);
            // previous ISO week, Monday to Sunday
            case "last week", "minggu lalu", "minggu kemarin" -> DateRange.calendar(monday.minusWeeks(1), monday.minusDays(1));
            case "this month", "bulan ini" -> DateRange.calendar(monthStart, today);
            case "last month", "bulan lalu", "bulan kemarin" -> DateRange.calendar(monthStart.minusMonths(1), monthStart.minusDays(1));
            case "this quarter", "kuartal ini" -> DateRange.calendar(quarterStart, today);
            case "last quarter", "kuartal lalu" -> DateRange.calendar(quarterStart.minusMonths(3), quarterStart.minusDays(1));
            case "this year", "tahun ini" -> DateRange.calendar(today.withDayOfYear(1), today);
            case "last year", "tahun lalu", "tahun kemarin" -> DateRange.calendar(
                    LocalDate.of(today.getYear() - 1, 1, 1), LocalDate.of(today.getYear() - 1, 12, 31));
            default -> null;
        };
    }

    /**
     * Parses "2024-01-01 to 2024-01-31" or a single "2024-01-05".
     */
    private DateRange parseExplicitDates(String text) {
        try {
            Matcher range = ISO_RANGE.matcher(text);
            if (range.find()) {
                LocalDate from = LocalDate.parse(range.group(1));
                LocalDate to = LocalDate.parse(range.group(2));
                return from.isAfter(to) ? null : DateRange.explicit(from, to);
            }
            Matcher single = ISO_DATE.matcher(text);
            if (single.find()) {
                LocalDate date = LocalDate.parse(single.group(1));
                return DateRange.explicit(date, date);
            }
        } catch (DateTimeParseException e) {
            log.debug("Failed to parse explicit date in '{}'", text);
        }
        return null;
    }

    private DateRange parseRollingWindow(String text, LocalDate today) {
        Matcher numeric = ROLLING_NUMERIC.matcher(text);
        if (numeric.find()) {
            int count = Integer.parseInt(numeric.group(1));
            String unit = numeric.group(2);
            LocalDate start = switch (unit) {
                case "week", "weeks", "minggu" -> today.minusWeeks(count);
                case "month", "months", "bulan" -> today.minusMonths(count);
                default -> today.minusDays(count);
            };
            return DateRange.rolling(start, today);
        }

        Matcher words = ROLLING_WORDS.matcher(text);
        if (words.find()) {
            return DateRange.rolling(today.minusDays(NUMBER_WORDS.get(words.group(1))), today);
        }
        return null;
    }

    private int extractYear(String text, int defaultYear) {
        Matcher matcher = YEAR_IN_PHRASE.matcher(text);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : defaultYear;
    }

    private static Map<String, Integer> months() {
        Map<String, Integer> months = new LinkedHashMap<>();
        String[] english = {"january", "february", "march", "april", "may", "june", "july",
                "august", "september", "october", "november", "december"};
        for (int i = 0; i < english.length; i++) {
            months.put(english[i], i + 1);
        }
        months.put("januari", 1);
        months.put("februari", 2);
        months.put("maret", 3);
        months.put("mei", 5);
        months.put("juni", 6);
        months.put("juli", 7);
        months.put("agustus", 8);
        months.put("oktober", 10);
        months.put("desember", 12);
        return months;
    }

    private static Map<String, Integer> numberWords() {
        // multi-word entries first so "empat belas" is not read as a shorter word
        Map<String, Integer> words = new LinkedHashMap<>();
        words.put("sembilan puluh", 90);
        words.put("enam puluh", 60);
        words.put("tiga puluh", 30);
        words.put("dua puluh", 20);
        words.put("lima belas", 15);
        words.put("empat belas", 14);
        words.put("sepuluh", 10);
        words.put("tujuh", 7);
        words.put("seven", 7);
        words.put("fourteen", 14);
        words.put("thirty", 30);
        words.put("sixty", 60);
        words.put("ninety", 90);
        return words;
    }
}

package dev.pekelund.docroute.numbers;

import dev.pekelund.docroute.model.NumberFormat;
import dev.pekelund.docroute.model.NumberMatch;
import dev.pekelund.docroute.model.NumberPosition;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises numeric literals in plain text.
 * <p>
 * Each format has its own pattern and every pattern is scanned over the whole text, so the same token
 * may be reported under more than one format (for example {@code $1,500.00} as currency and its
 * {@code 1,500} as integer). Consumers that need one entry per token deduplicate on their side.
 * Instances are immutable and thread-safe.
 */
public class NumberExtractor {

    public static final int DEFAULT_CONTEXT_WINDOW = 50;
    public static final String EXTRACTION_METHOD = "regex_pattern";

    private static final Map<NumberFormat, Pattern> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put(NumberFormat.CURRENCY, Pattern.compile("\\$\\s*\\d{1,3}(?:,\\d{3})*(?:\\.\\d{2})?"));
        // no trailing \b: '%' followed by a space or punctuation is not a word boundary
        PATTERNS.put(NumberFormat.PERCENTAGE, Pattern.compile("\\b\\d+(?:\\.\\d+)?%"));
        PATTERNS.put(NumberFormat.DECIMAL, Pattern.compile("\\b\\d+\\.\\d+\\b"));
        PATTERNS.put(NumberFormat.SCIENTIFIC_NOTATION, Pattern.compile("\\b\\d+(?:\\.\\d+)?[eE][+-]?\\d+\\b"));
        PATTERNS.put(NumberFormat.INTEGER, Pattern.compile("\\b\\d{1,3}(?:,\\d{3})*\\b"));
    }

    private static final List<String> BUSINESS_TERMS = List.of(
        "revenue", "income", "profit", "loss", "cost", "expense", "price",
        "amount", "total", "sum", "million", "billion", "thousand",
        "rate", "percentage", "margin", "growth", "increase", "decrease");

    private static final List<String> NON_BUSINESS_TERMS = List.of("page", "section", "figure", "table", "chapter");

    private static final Map<Pattern, String> UNIT_PATTERNS = new LinkedHashMap<>();

    static {
        UNIT_PATTERNS.put(Pattern.compile("\\b(million|mil|m)\\b"), "million");
        UNIT_PATTERNS.put(Pattern.compile("\\b(billion|bil|b)\\b"), "billion");
        UNIT_PATTERNS.put(Pattern.compile("\\b(thousand|k)\\b"), "thousand");
        UNIT_PATTERNS.put(Pattern.compile("\\b(dollars?|usd)\\b"), "dollars");
        UNIT_PATTERNS.put(Pattern.compile("\\b(cents?)\\b"), "cents");
        UNIT_PATTERNS.put(Pattern.compile("\\b(years?|yrs?)\\b"), "years");
        UNIT_PATTERNS.put(Pattern.compile("\\b(months?|mos?)\\b"), "months");
        UNIT_PATTERNS.put(Pattern.compile("\\b(days?)\\b"), "days");
        UNIT_PATTERNS.put(Pattern.compile("\\b(hours?|hrs?)\\b"), "hours");
        UNIT_PATTERNS.put(Pattern.compile("\\b(minutes?|mins?)\\b"), "minutes");
        UNIT_PATTERNS.put(Pattern.compile("\\b(seconds?|secs?)\\b"), "seconds");
        UNIT_PATTERNS.put(Pattern.compile("\\b(percent|percentage)\\b"), "percent");
    }

    private final int contextWindow;

    public NumberExtractor() {
        this(DEFAULT_CONTEXT_WINDOW);
    }

    public NumberExtractor(int contextWindow) {
        if (contextWindow < 0) {
            throw new IllegalArgumentException("Context window must not be negative");
        }
        this.contextWindow = contextWindow;
    }

    /**
     * Returns every match of every format, grouped by format in the order currency, percentage,
     * decimal, scientific notation, integer, and by position within a format.
     */
    public List<NumberMatch> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<NumberMatch> matches = new ArrayList<>();
        for (Map.Entry<NumberFormat, Pattern> entry : PATTERNS.entrySet()) {
            Matcher matcher = entry.getValue().matcher(text);
            while (matcher.find()) {
                matches.add(toMatch(text, matcher, entry.getKey()));
            }
        }
        return matches;
    }

    /**
     * Counts matches without building them.
     */
    public int count(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        int count = 0;
        for (Pattern pattern : PATTERNS.values()) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                count++;
            }
        }
        return count;
    }

    private NumberMatch toMatch(String text, Matcher matcher, NumberFormat format) {
        String original = matcher.group();
        int start = matcher.start();
        int end = matcher.end();
        String context = text.substring(Math.max(0, start - contextWindow), Math.min(text.length(), end + contextWindow));
        return new NumberMatch(
            parseValue(original),
            original,
            context,
            format,
            resolveUnit(context, format),
            resolveCurrency(original, format),
            scoreConfidence(original, format, context),
            EXTRACTION_METHOD,
            new NumberPosition(lineNumber(text, start), start, end));
    }

    static double parseValue(String original) {
        String cleaned = original.replace("$", "").replace(",", "").replace("%", "").strip();
        try {
            return Double.parseDouble(cleaned);
        } catch (NumberFormatException ex) {
            return 0.0;
        }
    }

    static double scoreConfidence(String original, NumberFormat format, String context) {
        double confidence = 0.7;
        if (format == NumberFormat.CURRENCY && original.contains("$")) {
            confidence += 0.2;
        } else if (format == NumberFormat.PERCENTAGE && original.contains("%")) {
            confidence += 0.2;
        } else if (format == NumberFormat.INTEGER && original.contains(",")) {
            confidence += 0.1;
        }

        String lowered = context.toLowerCase(Locale.ROOT);
        long businessTerms = BUSINESS_TERMS.stream().filter(lowered::contains).count();
        if (businessTerms > 0) {
            confidence += Math.min(0.1 * businessTerms, 0.2);
        }
        long otherTerms = NON_BUSINESS_TERMS.stream().filter(lowered::contains).count();
        if (otherTerms > 0) {
            confidence -= Math.min(0.1 * otherTerms, 0.3);
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    static String resolveUnit(String context, NumberFormat format) {
        if (format == NumberFormat.PERCENTAGE) {
            return "percent";
        }
        String lowered = context.toLowerCase(Locale.ROOT);
        for (Map.Entry<Pattern, String> entry : UNIT_PATTERNS.entrySet()) {
            if (entry.getKey().matcher(lowered).find()) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String resolveCurrency(String original, NumberFormat format) {
        return format == NumberFormat.CURRENCY && original.contains("$") ? "USD" : null;
    }

    private static int lineNumber(String text, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}

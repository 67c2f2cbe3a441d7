package dev.oppscanner.service;

import dev.oppscanner.model.ValueOrigin;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort money estimate from free text.
 * Tries a range, then a single amount, then an hourly rate; falls back to {@link #DEFAULT_VALUE}.
 * Never throws and never returns a negative value.
 */
@Component
public class BudgetExtractor {

    public static final int DEFAULT_VALUE = 500;
    public static final int HOURS_PER_WEEK = 40;

    private static final String AMOUNT = "(\\d[\\d,]*+)(?:\\.\\d+)?+";
    private static final String HOURLY_SUFFIX = "\\s*(?:/\\s*(?:hr|hour)\\b|per\\s+hour\\b)";

    private static final Pattern RANGE = Pattern.compile(
            "\\$\\s*" + AMOUNT + "\\s*[-\u2013]\\s*\\$?\\s*" + AMOUNT);

    // An amount directly followed by an hourly marker is left to HOURLY
    private static final Pattern SINGLE = Pattern.compile(
            "\\$\\s*" + AMOUNT + "(?!" + HOURLY_SUFFIX + ")",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern HOURLY = Pattern.compile(
            "\\$\\s*" + AMOUNT + HOURLY_SUFFIX,
            Pattern.CASE_INSENSITIVE);

    public record Estimate(int amount, ValueOrigin origin) {
    }

    public int extract(String text) {
        return estimate(text).amount();
    }

    public Estimate estimate(String text) {
        if (text == null || text.isBlank()) {
            return new Estimate(DEFAULT_VALUE, ValueOrigin.DEFAULT);
        }

        Matcher range = RANGE.matcher(text);
        if (range.find()) {
            long low = parseAmount(range.group(1));
            long high = parseAmount(range.group(2));
            return extracted((low + high) / 2);
        }

        Matcher single = SINGLE.matcher(text);
        if (single.find()) {
            return extracted(parseAmount(single.group(1)));
        }

        Matcher hourly = HOURLY.matcher(text);
        if (hourly.find()) {
            return extracted(parseAmount(hourly.group(1)) * HOURS_PER_WEEK);
        }

        return new Estimate(DEFAULT_VALUE, ValueOrigin.DEFAULT);
    }

    private Estimate extracted(long amount) {
        return new Estimate(clamp(amount), ValueOrigin.EXTRACTED);
    }

    private long parseAmount(String raw) {
        String digits = raw.replace(",", "");
        if (digits.isEmpty()) {
            return 0;
        }
        // Anything longer than this cannot fit an int anyway
        if (digits.length() > 12) {
            return Integer.MAX_VALUE;
        }
        return Long.parseLong(digits);
    }

    private int clamp(long amount) {
        if (amount < 0) {
            return 0;
        }
        return (int) Math.min(amount, Integer.MAX_VALUE);
    }
}

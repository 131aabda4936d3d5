package com.shlawgathon.drawcheck.backend.extraction;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing of drawing-style numbers: decimals, fractions and mixed numbers
 * such as {@code 1-1/8} or {@code 1 1/8}.
 */
public final class Measurements {

    private static final Pattern MIXED = Pattern.compile("^(\\d+)\\s*[- ]\\s*(\\d+)\\s*/\\s*(\\d+)$");
    private static final Pattern FRACTION = Pattern.compile("^(\\d+)\\s*/\\s*(\\d+)$");

    private Measurements() {
    }

    public static Optional<Double> parse(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String value = token.trim().replace("\"", "");
        if (value.isEmpty()) {
            return Optional.empty();
        }
        Matcher mixed = MIXED.matcher(value);
        if (mixed.matches()) {
            double denominator = Double.parseDouble(mixed.group(3));
            if (denominator == 0) {
                return Optional.empty();
            }
            return Optional.of(Double.parseDouble(mixed.group(1)) + Double.parseDouble(mixed.group(2)) / denominator);
        }
        Matcher fraction = FRACTION.matcher(value);
        if (fraction.matches()) {
            double denominator = Double.parseDouble(fraction.group(2));
            if (denominator == 0) {
                return Optional.empty();
            }
            return Optional.of(Double.parseDouble(fraction.group(1)) / denominator);
        }
        try {
            return Optional.of(Double.parseDouble(value));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Format inches the way they are printed on drawings, e.g. 0.1875.
     */
    public static String inches(double value) {
        String text = String.format(Locale.ROOT, "%.4f", value);
        text = text.replaceAll("0+$", "");
        return text.endsWith(".") ? text.substring(0, text.length() - 1) : text;
    }
}

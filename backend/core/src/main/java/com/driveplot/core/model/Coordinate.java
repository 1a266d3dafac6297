package com.driveplot.core.model;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

public record Coordinate(double lat, double lng) {
    // Plain decimals only: no exponents, type suffixes or hex floats.
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");

    public Coordinate {
        if (!Double.isFinite(lat) || !Double.isFinite(lng)) {
            throw new IllegalArgumentException("Coordinate values must be finite: " + lat + "," + lng);
        }
    }

    public static Optional<Coordinate> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String[] parts = text.trim().split(",");
        if (parts.length != 2) {
            return Optional.empty();
        }
        String latText = parts[0].trim();
        String lngText = parts[1].trim();
        if (!DECIMAL.matcher(latText).matches() || !DECIMAL.matcher(lngText).matches()) {
            return Optional.empty();
        }
        try {
            double lat = Double.parseDouble(latText);
            double lng = Double.parseDouble(lngText);
            if (!Double.isFinite(lat) || !Double.isFinite(lng) || Math.abs(lat) > 90 || Math.abs(lng) > 180) {
                return Optional.empty();
            }
            return Optional.of(new Coordinate(lat, lng));
        } catch (NumberFormatException ignored) {
            return Optional.empty();
        }
    }

    public String asQueryValue() {
        return plain(lat) + "," + plain(lng);
    }

    public String display() {
        return String.format(Locale.ROOT, "%.6f,%.6f", lat, lng);
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}

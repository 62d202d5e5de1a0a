package com.proposalmind.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.io.Serializable;
import java.util.Map;

/**
 * A rate as extracted from the user's words, before normalisation to hourly.
 *
 * @param value the numeric amount
 * @param unit  time unit ("hour", "day", "week", "month"); {@code null} for a bare number
 */
public record RateSpec(
    double value,
    String unit
) implements Serializable {

    /**
     * Accepts either a bare number ({@code 40}, {@code "40"}) or an object
     * ({@code {"value": 100, "unit": "week"}}). Returns {@code null} for anything
     * without a usable numeric value.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RateSpec fromJson(Object raw) {
        if (raw instanceof Number n) {
            return new RateSpec(n.doubleValue(), null);
        }
        if (raw instanceof String s) {
            Double parsed = parseAmount(s);
            return parsed != null ? new RateSpec(parsed, null) : null;
        }
        if (raw instanceof Map<?, ?> map) {
            Object value = map.get("value");
            Double amount = value instanceof Number n ? Double.valueOf(n.doubleValue())
                    : value instanceof String s ? parseAmount(s) : null;
            if (amount == null) {
                return null;
            }
            Object unit = map.get("unit");
            return new RateSpec(amount, unit != null ? unit.toString() : null);
        }
        return null;
    }

    private static Double parseAmount(String raw) {
        String cleaned = raw.replace("$", "").replace(",", "").trim();
        try {
            return Double.parseDouble(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

package com.proposalmind.core.settings;

import com.proposalmind.core.model.RateSpec;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Converts rates quoted per day, week or month into hourly figures.
 * An unknown unit, or no unit at all, is taken to be hourly already.
 */
public final class RateNormalizer {

    private static final Map<String, Double> HOURS_PER_UNIT = Map.of(
            "hour", 1.0,
            "day", 8.0,
            "week", 40.0,
            "month", 160.0
    );

    private RateNormalizer() {}

    public static double toHourly(RateSpec rate) {
        return rate.value() / hoursPer(rate.unit());
    }

    public static Map<String, Double> toHourly(Map<String, RateSpec> rates) {
        var hourly = new LinkedHashMap<String, Double>();
        rates.forEach((role, rate) -> hourly.put(role, toHourly(rate)));
        return hourly;
    }

    static double hoursPer(String unit) {
        if (unit == null) {
            return 1.0;
        }
        String key = unit.trim().toLowerCase(Locale.ROOT);
        if (key.startsWith("per ")) {
            key = key.substring(4);
        }
        key = switch (key) {
            case "hourly", "hours", "hr", "hrs" -> "hour";
            case "daily", "days" -> "day";
            case "weekly", "weeks" -> "week";
            case "monthly", "months" -> "month";
            default -> key;
        };
        return HOURS_PER_UNIT.getOrDefault(key, 1.0);
    }
}

package com.proposalmind.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings the classifier pulled out of the current utterance.
 *
 * @param rates    role to rate, still carrying the user's time unit
 * @param budget   free-form budget, e.g. "2500" or "$10k"
 * @param timeline free-form timeline, e.g. "3 months"
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractedSettings(
    Map<String, RateSpec> rates,
    String budget,
    String timeline
) implements Serializable {

    public static final ExtractedSettings EMPTY = new ExtractedSettings(Map.of(), null, null);

    public ExtractedSettings {
        var cleaned = new LinkedHashMap<String, RateSpec>();
        if (rates != null) {
            rates.forEach((role, rate) -> {
                if (role != null && rate != null) {
                    cleaned.put(role, rate);
                }
            });
        }
        rates = Map.copyOf(cleaned);
    }

    public boolean hasRates() {
        return !rates.isEmpty();
    }

    public boolean hasBudget() {
        return budget != null && !budget.isBlank();
    }

    public boolean hasTimeline() {
        return timeline != null && !timeline.isBlank();
    }
}

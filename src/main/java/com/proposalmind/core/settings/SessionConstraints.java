package com.proposalmind.core.settings;

import com.proposalmind.core.model.ExtractedSettings;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Constraints remembered for one document across turns. Budget and timeline are
 * proposal-specific and never become persisted defaults.
 *
 * @param rates    role to hourly rate overrides from earlier turns
 * @param budget   last budget the user gave, or {@code ""}
 * @param timeline last timeline the user gave, or {@code ""}
 */
public record SessionConstraints(
    Map<String, Double> rates,
    String budget,
    String timeline
) implements Serializable {

    public static final SessionConstraints EMPTY = new SessionConstraints(Map.of(), "", "");

    public SessionConstraints {
        rates = rates != null ? Map.copyOf(rates) : Map.of();
        budget = budget != null ? budget.trim() : "";
        timeline = timeline != null ? timeline.trim() : "";
    }

    /**
     * Folds a turn's extracted settings in. Rates are normalised to hourly and
     * override earlier ones per role; a budget or timeline only replaces the
     * remembered value when the turn actually mentions one.
     */
    public SessionConstraints withTurn(ExtractedSettings turn) {
        var merged = new LinkedHashMap<>(rates);
        merged.putAll(RateNormalizer.toHourly(turn.rates()));
        return new SessionConstraints(
                merged,
                turn.hasBudget() ? turn.budget() : budget,
                turn.hasTimeline() ? turn.timeline() : timeline);
    }
}

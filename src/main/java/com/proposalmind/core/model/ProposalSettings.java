package com.proposalmind.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Merged settings handed to agents. Budget and timeline are deliberately absent:
 * they live in the session-scoped constraint slot.
 *
 * @param rates                  role to hourly rate
 * @param currency               ISO currency code used when presenting costs
 * @param freeTextInstructions   standing instructions from the persisted defaults
 */
public record ProposalSettings(
    Map<String, Double> rates,
    String currency,
    String freeTextInstructions
) implements Serializable {

    public ProposalSettings {
        rates = rates != null ? Map.copyOf(rates) : Map.of();
        currency = currency != null && !currency.isBlank() ? currency : "USD";
        freeTextInstructions = freeTextInstructions != null ? freeTextInstructions : "";
    }

    public static ProposalSettings empty() {
        return new ProposalSettings(Map.of(), "USD", "");
    }
}

package com.proposalmind.core.settings;

import com.proposalmind.config.ProposalmindProperties;
import com.proposalmind.core.model.ExtractedSettings;
import com.proposalmind.core.model.ProposalSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;

/**
 * Layers settings in ascending priority: configured defaults, then rates the
 * session remembers, then rates extracted from the current turn.
 */
@Service
public class SettingsMerger {

    private static final Logger log = LoggerFactory.getLogger(SettingsMerger.class);

    private final ProposalmindProperties properties;

    public SettingsMerger(ProposalmindProperties properties) {
        this.properties = properties;
    }

    public ProposalSettings merge(SessionConstraints session, ExtractedSettings turn) {
        var rates = new LinkedHashMap<String, Double>(properties.getDefaultRates());
        rates.putAll(session.rates());
        var turnRates = RateNormalizer.toHourly(turn.rates());
        rates.putAll(turnRates);
        if (!session.rates().isEmpty() || !turnRates.isEmpty()) {
            log.debug("Rate overrides: session={}, turn={}", session.rates(), turnRates);
        }
        return new ProposalSettings(rates, properties.getCurrency(), properties.getInstructions());
    }
}

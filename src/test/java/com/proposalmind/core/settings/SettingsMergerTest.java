package com.proposalmind.core.settings;

import com.proposalmind.config.ProposalmindProperties;
import com.proposalmind.core.model.ExtractedSettings;
import com.proposalmind.core.model.RateSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SettingsMergerTest {

    private SettingsMerger merger;

    @BeforeEach
    void setUp() {
        merger = new SettingsMerger(new ProposalmindProperties());
    }

    @Test
    @DisplayName("Defaults < session < turn")
    void layering() {
        var session = new SessionConstraints(Map.of("senior_engineer", 70.0, "mid_level_engineer", 50.0), "", "");
        var turn = new ExtractedSettings(Map.of("senior_engineer", new RateSpec(4000, "week")), null, null);

        var settings = merger.merge(session, turn);

        assertEquals(100.0, settings.rates().get("senior_engineer"), 1e-9);
        assertEquals(50.0, settings.rates().get("mid_level_engineer"), 1e-9);
        assertEquals(30.0, settings.rates().get("junior_engineer"), 1e-9);
        assertEquals(65.0, settings.rates().get("ai_engineer"), 1e-9);
        assertEquals("USD", settings.currency());
    }

    @Test
    @DisplayName("With nothing remembered the defaults are used as-is")
    void defaultsOnly() {
        var settings = merger.merge(SessionConstraints.EMPTY, ExtractedSettings.EMPTY);
        assertEquals(new ProposalmindProperties().getDefaultRates(), settings.rates());
    }

    @Test
    @DisplayName("A new role from the turn is added to the table")
    void newRole() {
        var turn = new ExtractedSettings(Map.of("data_scientist", new RateSpec(90, "hour")), null, null);
        assertEquals(90.0, merger.merge(SessionConstraints.EMPTY, turn).rates().get("data_scientist"), 1e-9);
    }
}

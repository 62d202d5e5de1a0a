package com.proposalmind.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "proposalmind")
public class ProposalmindProperties {

    private Pipeline pipeline = new Pipeline();
    private Settings settings = new Settings();
    private Routing routing = new Routing();

    // -- Delegating accessors --
    public int getMaxParallel() { return pipeline.maxParallel; }
    public int getRecursionLimit() { return pipeline.recursionLimit; }
    public String getCurrency() { return settings.currency; }
    public Map<String, Double> getDefaultRates() { return settings.defaultRates; }
    public String getInstructions() { return settings.instructions; }
    public int getHistoryWindow() { return routing.historyWindow; }

    public Pipeline getPipeline() { return pipeline; }
    public void setPipeline(Pipeline pipeline) { this.pipeline = pipeline; }
    public Settings getSettings() { return settings; }
    public void setSettings(Settings settings) { this.settings = settings; }
    public Routing getRouting() { return routing; }
    public void setRouting(Routing routing) { this.routing = routing; }

    public static class Pipeline {
        private int maxParallel = 8;
        private int recursionLimit = 50;

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public int getRecursionLimit() { return recursionLimit; }
        public void setRecursionLimit(int recursionLimit) { this.recursionLimit = recursionLimit; }
    }

    public static class Settings {
        private String currency = "USD";
        private String instructions = "";
        private Map<String, Double> defaultRates = defaultRateTable();

        public String getCurrency() { return currency; }
        public void setCurrency(String currency) { this.currency = currency; }
        public String getInstructions() { return instructions; }
        public void setInstructions(String instructions) { this.instructions = instructions; }
        public Map<String, Double> getDefaultRates() { return defaultRates; }
        public void setDefaultRates(Map<String, Double> defaultRates) { this.defaultRates = defaultRates; }

        private static Map<String, Double> defaultRateTable() {
            var rates = new LinkedHashMap<String, Double>();
            rates.put("senior_engineer", 60.0);
            rates.put("mid_level_engineer", 45.0);
            rates.put("junior_engineer", 30.0);
            rates.put("ui_ux_designer", 40.0);
            rates.put("devops_engineer", 50.0);
            rates.put("ai_engineer", 65.0);
            rates.put("project_manager", 50.0);
            return rates;
        }
    }

    public static class Routing {
        /** Number of recent conversation entries handed to the classifier. */
        private int historyWindow = 5;

        public int getHistoryWindow() { return historyWindow; }
        public void setHistoryWindow(int historyWindow) { this.historyWindow = historyWindow; }
    }
}

package com.ivamare.transition;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the Transition Engine.
 *
 * <p>Example configuration:
 * <pre>
 * transition:
 *   enabled: true
 *   rules-location: classpath:transition-rules.json
 *   reload-on-startup: true
 *   rules:
 *     task:
 *       pending: [in_progress, cancelled]
 *       "[in_progress]": [completed, blocked]
 *   history:
 *     default-limit: 50
 *     max-limit: 500
 * </pre>
 */
@ConfigurationProperties(prefix = "transition")
public class TransitionEngineProperties {

    /**
     * Enable/disable Transition Engine auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Location of a JSON rule file (Spring resource syntax). Entity types defined
     * there override the ones in {@link #rules}.
     */
    private String rulesLocation;

    /**
     * Load rules when the rule store is created.
     */
    private boolean reloadOnStartup = true;

    /**
     * Inline rules: entity type to (from-state to list of to-states). Names containing
     * characters other than letters, digits, '-' and '.' need bracket notation.
     */
    private Map<String, Map<String, List<String>>> rules = new LinkedHashMap<>();

    /**
     * History query configuration.
     */
    private HistoryProperties history = new HistoryProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getRulesLocation() {
        return rulesLocation;
    }

    public void setRulesLocation(String rulesLocation) {
        this.rulesLocation = rulesLocation;
    }

    public boolean isReloadOnStartup() {
        return reloadOnStartup;
    }

    public void setReloadOnStartup(boolean reloadOnStartup) {
        this.reloadOnStartup = reloadOnStartup;
    }

    public Map<String, Map<String, List<String>>> getRules() {
        return rules;
    }

    public void setRules(Map<String, Map<String, List<String>>> rules) {
        this.rules = rules;
    }

    public HistoryProperties getHistory() {
        return history;
    }

    public void setHistory(HistoryProperties history) {
        this.history = history;
    }

    /**
     * History query configuration properties.
     */
    public static class HistoryProperties {

        /**
         * Number of attempts returned when the caller does not pass a limit.
         */
        private int defaultLimit = 50;

        /**
         * Upper bound applied to any requested limit.
         */
        private int maxLimit = 500;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }
    }
}

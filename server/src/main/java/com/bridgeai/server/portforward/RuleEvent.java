package com.bridgeai.server.portforward;

public enum RuleEvent {
    RULE_ADDED("rule_added"),
    RULE_REMOVED("rule_removed"),
    RULE_UPDATED("rule_updated"),
    RULE_ENABLED("rule_enabled"),
    RULE_DISABLED("rule_disabled");

    private final String label;

    RuleEvent(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}

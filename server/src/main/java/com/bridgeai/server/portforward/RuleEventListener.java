package com.bridgeai.server.portforward;

@FunctionalInterface
public interface RuleEventListener {
    void onRuleEvent(int ruleId, RuleEvent event);
}

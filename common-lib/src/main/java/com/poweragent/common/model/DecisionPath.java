package com.poweragent.common.model;

/**
 * Which strategy produced a decision batch.
 */
public enum DecisionPath {
    LEARNED,
    RULE,
    EMERGENCY
}

package com.poweragent.common.exception;

/**
 * Failure taxonomy surfaced through status counters. None of these stops the control loop.
 */
public enum FailureKind {
    SENSOR_UNAVAILABLE,
    MODEL_UNAVAILABLE,
    ACTUATION_FAILURE,
    STALE_SNAPSHOT,
    RETRAIN_FAILURE
}

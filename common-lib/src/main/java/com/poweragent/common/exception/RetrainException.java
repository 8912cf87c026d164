package com.poweragent.common.exception;

/**
 * A retraining pass failed. The previous model stays in service.
 */
public class RetrainException extends PowerAgentException {

    public RetrainException(String message) {
        super("FeedbackLearner", message);
    }

    public RetrainException(String message, Throwable cause) {
        super("FeedbackLearner", message, cause);
    }
}

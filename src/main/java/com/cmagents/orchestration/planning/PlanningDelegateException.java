package com.cmagents.orchestration.planning;

/**
 * The planning delegate could not produce a proposal. Always recovered by falling back to rules.
 */
public class PlanningDelegateException extends RuntimeException {

    public PlanningDelegateException(String message) {
        super(message);
    }

    public PlanningDelegateException(String message, Throwable cause) {
        super(message, cause);
    }
}

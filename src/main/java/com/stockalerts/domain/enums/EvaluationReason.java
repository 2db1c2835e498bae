package com.stockalerts.domain.enums;

/**
 * Why the condition evaluator returned what it did. Used for logging and the audit trail.
 */
public enum EvaluationReason {
    FIRED,
    THRESHOLD_NOT_MET,
    NO_REFERENCE,
    OUTSIDE_SESSION_OPEN_WINDOW,
    AT_WINDOW_EXTREME
}

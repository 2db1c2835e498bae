package com.stockalerts.domain.enums;

/**
 * States of one evaluation cycle: IDLE -> GATING -> FETCHING -> EVALUATING -> DISPATCHING -> IDLE.
 */
public enum CyclePhase {
    IDLE,
    GATING,
    FETCHING,
    EVALUATING,
    DISPATCHING
}

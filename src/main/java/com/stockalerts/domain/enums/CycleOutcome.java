package com.stockalerts.domain.enums;

public enum CycleOutcome {

    /** Every symbol was fetched (or failed in isolation) and evaluated. */
    COMPLETED,

    /** Outside trading hours; nothing fetched or evaluated. */
    SKIPPED_MARKET_CLOSED,

    /** Active alerts could not be listed; retried on the next tick. */
    SKIPPED_REPOSITORY_UNAVAILABLE,

    /** Another cycle held the lock. */
    SKIPPED_OVERLAP,

    /** Hard deadline hit; remaining symbols were abandoned. */
    DEADLINE_EXCEEDED,

    /** Unexpected error escaped per-symbol isolation. */
    FAILED
}

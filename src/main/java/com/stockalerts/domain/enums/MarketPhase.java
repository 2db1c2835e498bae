package com.stockalerts.domain.enums;

/**
 * Coarse market phases derived from the configured trading calendar.
 *
 * <pre>
 * preOpen-open    PRE_OPEN    - indicative prices only, no evaluation
 * open-close      OPEN        - regular session, alerts evaluated (close inclusive)
 * close-postClose POST_CLOSE  - closing session, no evaluation
 * otherwise       CLOSED      - includes weekends and configured holidays
 * </pre>
 */
public enum MarketPhase {
    PRE_OPEN,
    OPEN,
    POST_CLOSE,
    CLOSED
}

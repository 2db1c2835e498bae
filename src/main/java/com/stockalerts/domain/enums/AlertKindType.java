package com.stockalerts.domain.enums;

/**
 * The closed set of alert conditions the engine evaluates.
 *
 * <p>Gap kinds compare against the session reference and are only evaluable right after
 * the open. Window kinds compare against the rolling high/low of their window duration.
 */
public enum AlertKindType {

    /** Opening gap above the session reference. */
    GAP_UP(false, "Gap up"),

    /** Opening gap below the session reference. */
    GAP_DOWN(false, "Gap down"),

    /** Drop from the rolling-window high. */
    DROP_WINDOW(true, "Drop from high"),

    /** Spike from the rolling-window low. */
    SPIKE_WINDOW(true, "Spike from low");

    private final boolean windowed;
    private final String label;

    AlertKindType(boolean windowed, String label) {
        this.windowed = windowed;
        this.label = label;
    }

    public boolean isWindowed() {
        return windowed;
    }

    public boolean isGap() {
        return !windowed;
    }

    public String getLabel() {
        return label;
    }
}

package com.stockalerts.domain.model;

import com.stockalerts.domain.enums.AlertKindType;
import java.time.Duration;
import lombok.Value;

/**
 * Tagged alert condition: one of GapUp, GapDown, DropWindow(minutes) or SpikeWindow(minutes).
 *
 * <p>{@code windowMinutes} is present exactly for the windowed kinds. Instances are created
 * through the factories so that invariant always holds.
 */
@Value
public class AlertKind {

    AlertKindType type;
    Integer windowMinutes;

    private AlertKind(AlertKindType type, Integer windowMinutes) {
        this.type = type;
        this.windowMinutes = windowMinutes;
    }

    public static AlertKind gapUp() {
        return new AlertKind(AlertKindType.GAP_UP, null);
    }

    public static AlertKind gapDown() {
        return new AlertKind(AlertKindType.GAP_DOWN, null);
    }

    public static AlertKind dropWindow(int minutes) {
        return of(AlertKindType.DROP_WINDOW, minutes);
    }

    public static AlertKind spikeWindow(int minutes) {
        return of(AlertKindType.SPIKE_WINDOW, minutes);
    }

    public static AlertKind of(AlertKindType type, Integer windowMinutes) {
        if (type == null) {
            throw new IllegalArgumentException("Alert kind type is required");
        }
        if (!type.isWindowed()) {
            return new AlertKind(type, null);
        }
        if (windowMinutes == null || windowMinutes <= 0) {
            throw new IllegalArgumentException(type + " requires a positive window duration, got " + windowMinutes);
        }
        return new AlertKind(type, windowMinutes);
    }

    public boolean isGap() {
        return type.isGap();
    }

    public Duration getWindow() {
        return windowMinutes == null ? null : Duration.ofMinutes(windowMinutes);
    }

    /** Short human-readable form, e.g. "Drop from high (60m)". */
    public String describe() {
        return windowMinutes == null ? type.getLabel() : type.getLabel() + " (" + windowMinutes + "m)";
    }
}

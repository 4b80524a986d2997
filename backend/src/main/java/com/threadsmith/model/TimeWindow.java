package com.threadsmith.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Time filter applied to {@link SortMode#TOP} listings.
 */
public enum TimeWindow {
    HOUR("hour"),
    DAY("day"),
    WEEK("week"),
    MONTH("month"),
    YEAR("year"),
    ALL("all");

    private final String value;

    TimeWindow(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<TimeWindow> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TimeWindow window : values()) {
            if (window.value.equals(normalized)) {
                return Optional.of(window);
            }
        }
        return Optional.empty();
    }
}

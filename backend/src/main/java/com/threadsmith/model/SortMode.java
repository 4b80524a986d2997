package com.threadsmith.model;

import java.util.Locale;

/**
 * Listing order supported by the subreddit fetcher.
 */
public enum SortMode {
    HOT("hot"),
    NEW("new"),
    TOP("top"),
    RISING("rising");

    private final String value;

    SortMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolves a listing name, falling back to {@link #HOT} for anything unrecognized.
     */
    public static SortMode fromValue(String raw) {
        if (raw == null) {
            return HOT;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (SortMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        return HOT;
    }
}

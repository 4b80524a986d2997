package com.threadsmith.model;

/**
 * Title substituted when a rewrite call fails.
 */
public enum FallbackPolicy {
    ORIGINAL,
    ORIGINAL_WITH_MARKER
}

package com.threadsmith.model;

/**
 * Outcome of one rewrite call. {@code error} is set when the fallback title was substituted.
 */
public record RewriteResult(
        String originalText,
        String rewrittenText,
        String personalityName,
        String error
) {
    public static RewriteResult success(String originalText, String rewrittenText, String personalityName) {
        return new RewriteResult(originalText, rewrittenText, personalityName, null);
    }

    public static RewriteResult fallback(String originalText, String fallbackText, String personalityName, String error) {
        return new RewriteResult(originalText, fallbackText, personalityName, error);
    }

    public boolean failed() {
        return error != null;
    }
}

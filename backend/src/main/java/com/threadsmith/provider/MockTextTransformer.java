package com.threadsmith.provider;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Deterministic transformer used for local runs without a model key. Prefixes the last
 * non-blank prompt line with a hook picked from the prompt hash.
 */
@Component
@ConditionalOnProperty(prefix = "threadsmith.rewrite", name = "mode", havingValue = "mock")
public class MockTextTransformer implements TextTransformer {

    private static final List<String> HOOKS = List.of(
            "You won't believe this:",
            "Hot take:",
            "Big news:",
            "Everyone is talking about this:",
            "Quick read:"
    );

    @Override
    public String transform(String prompt, double temperature, int maxTokens) {
        String subject = lastLine(prompt);
        if (subject.isEmpty()) {
            throw new TextTransformException("Mock transformer received an empty prompt");
        }
        String hook = HOOKS.get(stableIndex(prompt + "|" + temperature, HOOKS.size()));
        String rewritten = hook + " " + subject;
        int maxChars = Math.max(1, maxTokens) * 4;
        return rewritten.length() > maxChars ? rewritten.substring(0, maxChars) : rewritten;
    }

    private static String lastLine(String prompt) {
        if (prompt == null) {
            return "";
        }
        String[] lines = prompt.strip().split("\\R");
        String line = lines[lines.length - 1].strip();
        int colon = line.indexOf(':');
        // "Title: ..." style lines keep only the title
        if (colon > 0 && colon < 20) {
            line = line.substring(colon + 1).strip();
        }
        return line;
    }

    private static int stableIndex(String seed, int bound) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(seed.getBytes(StandardCharsets.UTF_8));
            return Math.floorMod(ByteBuffer.wrap(hash).getInt(), bound);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 digest algorithm is required", ex);
        }
    }
}

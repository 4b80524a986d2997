package com.threadsmith.provider;

/**
 * Provider abstraction for prompt-to-text generation.
 */
public interface TextTransformer {

    /**
     * @throws TextTransformException when the provider fails or returns nothing usable
     */
    String transform(String prompt, double temperature, int maxTokens);
}

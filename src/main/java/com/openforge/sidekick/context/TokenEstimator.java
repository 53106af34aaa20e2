package com.openforge.sidekick.context;

/**
 * Coarse token model: one token per four characters, rounded down.
 * Not a real tokenizer; only used to bound what the context store holds.
 */
public final class TokenEstimator {

    private static final int CHARS_PER_TOKEN = 4;

    private TokenEstimator() {}

    public static int estimate(String text) {
        return text == null ? 0 : text.length() / CHARS_PER_TOKEN;
    }
}

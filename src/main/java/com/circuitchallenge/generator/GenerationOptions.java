package com.circuitchallenge.generator;

public record GenerationOptions(int maxAttempts, boolean validateResult) {

    public static final int DEFAULT_MAX_ATTEMPTS = 30;

    public GenerationOptions {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("Max attempts must be positive");
        }
    }

    public static GenerationOptions defaults() {
        return new GenerationOptions(DEFAULT_MAX_ATTEMPTS, true);
    }
}

package com.circuitchallenge.config;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.circuitchallenge.generator.GenerationOptions;

@Component
public class AppProperties {

    static final int DEFAULT_BATCH_MAX_COUNT = 100;

    private final int maxAttempts;
    private final boolean validate;
    private final int batchMaxCount;

    public AppProperties(Environment environment) {
        this.maxAttempts = resolvePositiveInt(environment, "app.generation.max-attempts", "PUZZLE_MAX_ATTEMPTS",
                GenerationOptions.DEFAULT_MAX_ATTEMPTS);
        this.validate = resolveBoolean(environment, "app.generation.validate", "PUZZLE_VALIDATE", true);
        this.batchMaxCount = resolvePositiveInt(environment, "app.batch.max-count", "PUZZLE_BATCH_MAX_COUNT",
                DEFAULT_BATCH_MAX_COUNT);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public boolean isValidate() {
        return validate;
    }

    public int getBatchMaxCount() {
        return batchMaxCount;
    }

    public GenerationOptions generationOptions() {
        return new GenerationOptions(maxAttempts, validate);
    }

    private int resolvePositiveInt(Environment environment, String propertyKey, String envKey, int defaultValue) {
        String value = resolveOptional(environment, propertyKey, envKey);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed <= 0) {
                throw new IllegalArgumentException();
            }
            return parsed;
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Invalid " + envKey + " value: " + value, ex);
        }
    }

    private boolean resolveBoolean(Environment environment, String propertyKey, String envKey, boolean defaultValue) {
        String value = resolveOptional(environment, propertyKey, envKey);
        if (value == null) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(value) || "1".equals(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value) || "0".equals(value)) {
            return false;
        }
        throw new IllegalStateException("Invalid " + envKey + " value: " + value);
    }

    private String resolveOptional(Environment environment, String propertyKey, String envKey) {
        String value = environment.getProperty(propertyKey);
        if (StringUtils.hasText(value)) {
            return value.trim();
        }
        value = environment.getProperty(envKey);
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}

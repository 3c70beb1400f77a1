package com.circuitchallenge.generator;

public enum GenerationFailure {
    PATH_GENERATION_FAILED("path"),
    CONNECTOR_ASSIGNMENT_FAILED("connector"),
    EXPRESSION_GENERATION_FAILED("expression"),
    VALIDATION_FAILED("validation");

    private final String label;

    GenerationFailure(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}

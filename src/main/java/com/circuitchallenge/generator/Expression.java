package com.circuitchallenge.generator;

import java.util.Objects;

public record Expression(String text, Operation operation, int operandA, int operandB, int result) {

    public Expression {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(operation, "operation");
    }

    public static Expression of(Operation operation, int operandA, int operandB, int result) {
        return new Expression(operation.format(operandA, operandB), operation, operandA, operandB, result);
    }
}

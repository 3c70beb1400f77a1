package com.circuitchallenge.generator;

import java.util.Optional;
import java.util.OptionalInt;

public enum Operation {
    ADDITION("+", "+"),
    SUBTRACTION("−", "-"),
    MULTIPLICATION("×", "*"),
    DIVISION("÷", "/");

    private final String symbol;
    private final String asciiSymbol;

    Operation(String symbol, String asciiSymbol) {
        this.symbol = symbol;
        this.asciiSymbol = asciiSymbol;
    }

    public String symbol() {
        return symbol;
    }

    public String asciiSymbol() {
        return asciiSymbol;
    }

    public String format(int operandA, int operandB) {
        return operandA + " " + symbol + " " + operandB;
    }

    /**
     * Exact integer result, or empty on overflow, division by zero or a division that leaves a remainder.
     */
    public OptionalInt apply(int operandA, int operandB) {
        try {
            return switch (this) {
                case ADDITION -> OptionalInt.of(Math.addExact(operandA, operandB));
                case SUBTRACTION -> OptionalInt.of(Math.subtractExact(operandA, operandB));
                case MULTIPLICATION -> OptionalInt.of(Math.multiplyExact(operandA, operandB));
                case DIVISION -> operandB == 0 || operandA % operandB != 0
                        ? OptionalInt.empty()
                        : OptionalInt.of(operandA / operandB);
            };
        } catch (ArithmeticException ex) {
            return OptionalInt.empty();
        }
    }

    public static Optional<Operation> fromSymbol(String token) {
        for (Operation operation : values()) {
            if (operation.symbol.equals(token) || operation.asciiSymbol.equals(token)) {
                return Optional.of(operation);
            }
        }
        return Optional.empty();
    }
}

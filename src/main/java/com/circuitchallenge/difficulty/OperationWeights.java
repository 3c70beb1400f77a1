package com.circuitchallenge.difficulty;

import com.circuitchallenge.generator.Operation;

public record OperationWeights(int addition, int subtraction, int multiplication, int division) {

    public OperationWeights {
        if (addition < 0 || subtraction < 0 || multiplication < 0 || division < 0) {
            throw new IllegalArgumentException("Operation weights must not be negative");
        }
    }

    public static OperationWeights of(int addition, int subtraction, int multiplication, int division) {
        return new OperationWeights(addition, subtraction, multiplication, division);
    }

    /**
     * floor(100 / enabledCount) for each enabled operation, 0 elsewhere.
     */
    public static OperationWeights evenlySplit(boolean addition, boolean subtraction, boolean multiplication, boolean division) {
        int enabled = (addition ? 1 : 0) + (subtraction ? 1 : 0) + (multiplication ? 1 : 0) + (division ? 1 : 0);
        if (enabled == 0) {
            return new OperationWeights(0, 0, 0, 0);
        }
        int share = 100 / enabled;
        return new OperationWeights(
                addition ? share : 0,
                subtraction ? share : 0,
                multiplication ? share : 0,
                division ? share : 0);
    }

    public int weightOf(Operation operation) {
        return switch (operation) {
            case ADDITION -> addition;
            case SUBTRACTION -> subtraction;
            case MULTIPLICATION -> multiplication;
            case DIVISION -> division;
        };
    }

    public int total() {
        return addition + subtraction + multiplication + division;
    }
}

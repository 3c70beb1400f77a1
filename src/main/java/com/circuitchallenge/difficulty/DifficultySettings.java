package com.circuitchallenge.difficulty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.circuitchallenge.generator.Operation;

public record DifficultySettings(
        String name,
        boolean additionEnabled,
        boolean subtractionEnabled,
        boolean multiplicationEnabled,
        boolean divisionEnabled,
        int addSubRange,
        int multDivRange,
        int connectorMin,
        int connectorMax,
        int gridRows,
        int gridCols,
        int minPathLength,
        int maxPathLength,
        OperationWeights weights,
        boolean hiddenMode,
        int secondsPerStep) {

    public DifficultySettings {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(weights, "weights");
    }

    public boolean isEnabled(Operation operation) {
        return switch (operation) {
            case ADDITION -> additionEnabled;
            case SUBTRACTION -> subtractionEnabled;
            case MULTIPLICATION -> multiplicationEnabled;
            case DIVISION -> divisionEnabled;
        };
    }

    public List<Operation> enabledOperations() {
        List<Operation> enabled = new ArrayList<>(4);
        for (Operation operation : Operation.values()) {
            if (isEnabled(operation)) {
                enabled.add(operation);
            }
        }
        return enabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .additionEnabled(additionEnabled)
                .subtractionEnabled(subtractionEnabled)
                .multiplicationEnabled(multiplicationEnabled)
                .divisionEnabled(divisionEnabled)
                .addSubRange(addSubRange)
                .multDivRange(multDivRange)
                .connectorRange(connectorMin, connectorMax)
                .grid(gridRows, gridCols)
                .pathLengths(minPathLength, maxPathLength)
                .weights(weights)
                .hiddenMode(hiddenMode)
                .secondsPerStep(secondsPerStep);
    }

    public static final class Builder {
        private String name = "Custom";
        private boolean additionEnabled = true;
        private boolean subtractionEnabled;
        private boolean multiplicationEnabled;
        private boolean divisionEnabled;
        private int addSubRange = 10;
        private int multDivRange;
        private int connectorMin = 5;
        private int connectorMax = 10;
        private int gridRows = 4;
        private int gridCols = 5;
        private int minPathLength;
        private int maxPathLength;
        private OperationWeights weights = OperationWeights.of(100, 0, 0, 0);
        private boolean hiddenMode;
        private int secondsPerStep = 5;

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        public Builder additionEnabled(boolean enabled) {
            this.additionEnabled = enabled;
            return this;
        }

        public Builder subtractionEnabled(boolean enabled) {
            this.subtractionEnabled = enabled;
            return this;
        }

        public Builder multiplicationEnabled(boolean enabled) {
            this.multiplicationEnabled = enabled;
            return this;
        }

        public Builder divisionEnabled(boolean enabled) {
            this.divisionEnabled = enabled;
            return this;
        }

        public Builder operations(boolean addition, boolean subtraction, boolean multiplication, boolean division) {
            this.additionEnabled = addition;
            this.subtractionEnabled = subtraction;
            this.multiplicationEnabled = multiplication;
            this.divisionEnabled = division;
            return this;
        }

        public Builder addSubRange(int addSubRange) {
            this.addSubRange = addSubRange;
            return this;
        }

        public Builder multDivRange(int multDivRange) {
            this.multDivRange = multDivRange;
            return this;
        }

        public Builder connectorRange(int connectorMin, int connectorMax) {
            this.connectorMin = connectorMin;
            this.connectorMax = connectorMax;
            return this;
        }

        public Builder grid(int gridRows, int gridCols) {
            this.gridRows = gridRows;
            this.gridCols = gridCols;
            return this;
        }

        /**
         * Leaving both at 0 derives them from the grid area on {@link #build()}.
         */
        public Builder pathLengths(int minPathLength, int maxPathLength) {
            this.minPathLength = minPathLength;
            this.maxPathLength = maxPathLength;
            return this;
        }

        public Builder weights(OperationWeights weights) {
            this.weights = Objects.requireNonNull(weights, "weights");
            return this;
        }

        public Builder hiddenMode(boolean hiddenMode) {
            this.hiddenMode = hiddenMode;
            return this;
        }

        public Builder secondsPerStep(int secondsPerStep) {
            this.secondsPerStep = secondsPerStep;
            return this;
        }

        public DifficultySettings build() {
            int minPath = minPathLength;
            int maxPath = maxPathLength;
            if (minPath == 0 && maxPath == 0) {
                minPath = DifficultyPresets.calculateMinPathLength(gridRows, gridCols);
                maxPath = DifficultyPresets.calculateMaxPathLength(gridRows, gridCols);
            }
            return new DifficultySettings(
                    name,
                    additionEnabled,
                    subtractionEnabled,
                    multiplicationEnabled,
                    divisionEnabled,
                    addSubRange,
                    multDivRange,
                    connectorMin,
                    connectorMax,
                    gridRows,
                    gridCols,
                    minPath,
                    maxPath,
                    weights,
                    hiddenMode,
                    secondsPerStep);
        }
    }
}

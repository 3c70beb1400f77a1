package com.circuitchallenge.difficulty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.circuitchallenge.generator.ValidationResult;

public final class DifficultyPresets {

    public static final int LEVEL_COUNT = 10;
    public static final int CUSTOM_BASE_LEVEL = 5;
    public static final String CUSTOM_NAME = "Custom";

    private static final List<DifficultySettings> PRESETS = List.of(
            preset("Tiny Tot", 10, 0, 10, 3, 4, OperationWeights.of(100, 0, 0, 0), 10),
            preset("Beginner", 15, 0, 15, 4, 4, OperationWeights.of(100, 0, 0, 0), 9),
            preset("Easy", 15, 0, 15, 4, 5, OperationWeights.of(60, 40, 0, 0), 8),
            preset("Getting There", 20, 0, 20, 4, 5, OperationWeights.of(55, 45, 0, 0), 7),
            preset("Times Tables", 20, 5, 25, 4, 5, OperationWeights.of(40, 35, 25, 0), 7),
            preset("Confident", 25, 6, 36, 5, 5, OperationWeights.of(35, 30, 35, 0), 6),
            preset("Adventurous", 30, 8, 64, 5, 6, OperationWeights.of(30, 30, 40, 0), 6),
            preset("Division Intro", 30, 6, 36, 5, 6, OperationWeights.of(30, 25, 30, 15), 6),
            preset("Challenge", 50, 10, 100, 6, 7, OperationWeights.of(25, 25, 30, 20), 5),
            preset("Expert", 100, 12, 144, 6, 8, OperationWeights.of(25, 25, 30, 20), 5));

    private DifficultyPresets() {
    }

    public static List<DifficultySettings> all() {
        return PRESETS;
    }

    /**
     * Preset for a 1-based level; out-of-range levels are clamped into 1..10.
     */
    public static DifficultySettings byLevel(int level) {
        int clamped = Math.max(1, Math.min(LEVEL_COUNT, level));
        return PRESETS.get(clamped - 1);
    }

    public static Optional<DifficultySettings> byName(String name) {
        Objects.requireNonNull(name, "name");
        for (DifficultySettings preset : PRESETS) {
            if (preset.name().equalsIgnoreCase(name.trim())) {
                return Optional.of(preset);
            }
        }
        return Optional.empty();
    }

    /**
     * 1..10 for a preset name, 0 for anything else.
     */
    public static int levelNumber(DifficultySettings settings) {
        for (int i = 0; i < PRESETS.size(); i++) {
            if (PRESETS.get(i).name().equals(settings.name())) {
                return i + 1;
            }
        }
        return 0;
    }

    public static int calculateMinPathLength(int rows, int cols) {
        int area = rows * cols;
        double ratio;
        if (area <= 16) {
            ratio = 0.50;
        } else if (area <= 25) {
            ratio = 0.55;
        } else if (area <= 42) {
            ratio = 0.50;
        } else {
            ratio = 0.45;
        }
        return Math.max(4, (int) Math.floor(area * ratio));
    }

    public static int calculateMaxPathLength(int rows, int cols) {
        return (int) Math.floor(rows * cols * 0.85);
    }

    public static DifficultySettings createCustomDifficulty(DifficultyOverrides overrides) {
        Objects.requireNonNull(overrides, "overrides");
        DifficultySettings base = byLevel(CUSTOM_BASE_LEVEL);
        boolean addition = valueOr(overrides.additionEnabled(), base.additionEnabled());
        boolean subtraction = valueOr(overrides.subtractionEnabled(), base.subtractionEnabled());
        boolean multiplication = valueOr(overrides.multiplicationEnabled(), base.multiplicationEnabled());
        boolean division = valueOr(overrides.divisionEnabled(), base.divisionEnabled());
        int rows = valueOr(overrides.gridRows(), base.gridRows());
        int cols = valueOr(overrides.gridCols(), base.gridCols());
        OperationWeights weights = overrides.weights() != null
                ? overrides.weights()
                : OperationWeights.evenlySplit(addition, subtraction, multiplication, division);

        return base.toBuilder()
                .name(overrides.name() != null && !overrides.name().isBlank() ? overrides.name() : CUSTOM_NAME)
                .operations(addition, subtraction, multiplication, division)
                .addSubRange(valueOr(overrides.addSubRange(), base.addSubRange()))
                .multDivRange(valueOr(overrides.multDivRange(), base.multDivRange()))
                .connectorRange(
                        valueOr(overrides.connectorMin(), base.connectorMin()),
                        valueOr(overrides.connectorMax(), base.connectorMax()))
                .grid(rows, cols)
                .pathLengths(calculateMinPathLength(rows, cols), calculateMaxPathLength(rows, cols))
                .weights(weights)
                .hiddenMode(valueOr(overrides.hiddenMode(), base.hiddenMode()))
                .secondsPerStep(valueOr(overrides.secondsPerStep(), base.secondsPerStep()))
                .build();
    }

    public static ValidationResult validateDifficultySettings(DifficultySettings settings) {
        Objects.requireNonNull(settings, "settings");
        List<String> errors = new ArrayList<>();
        if (settings.enabledOperations().isEmpty()) {
            errors.add("At least one operation must be enabled");
        }
        if (settings.addSubRange() < 1) {
            errors.add("Addition/subtraction range must be at least 1");
        }
        if ((settings.multiplicationEnabled() || settings.divisionEnabled()) && settings.multDivRange() < 2) {
            errors.add("Multiplication/division range must be at least 2");
        }
        if (settings.connectorMin() < 1) {
            errors.add("Minimum connector value must be at least 1");
        }
        if (settings.connectorMax() <= settings.connectorMin()) {
            errors.add("Maximum connector value must be greater than minimum");
        }
        if (settings.gridRows() < 3) {
            errors.add("Grid must have at least 3 rows");
        }
        if (settings.gridCols() < 4) {
            errors.add("Grid must have at least 4 columns");
        }
        if (settings.minPathLength() < 4) {
            errors.add("Minimum path length must be at least 4");
        }
        if (settings.maxPathLength() < settings.minPathLength()) {
            errors.add("Maximum path length must be at least the minimum path length");
        }
        if (settings.additionEnabled() && settings.weights().addition() <= 0) {
            errors.add("Addition is enabled but has no weight");
        }
        if (settings.subtractionEnabled() && settings.weights().subtraction() <= 0) {
            errors.add("Subtraction is enabled but has no weight");
        }
        if (settings.multiplicationEnabled() && settings.weights().multiplication() <= 0) {
            errors.add("Multiplication is enabled but has no weight");
        }
        if (settings.divisionEnabled() && settings.weights().division() <= 0) {
            errors.add("Division is enabled but has no weight");
        }
        if (settings.secondsPerStep() < 1) {
            errors.add("Seconds per step must be at least 1");
        }
        return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
    }

    private static DifficultySettings preset(
            String name,
            int addSubRange,
            int multDivRange,
            int connectorMax,
            int rows,
            int cols,
            OperationWeights weights,
            int secondsPerStep) {
        return DifficultySettings.builder()
                .name(name)
                .operations(weights.addition() > 0, weights.subtraction() > 0,
                        weights.multiplication() > 0, weights.division() > 0)
                .addSubRange(addSubRange)
                .multDivRange(multDivRange)
                .connectorRange(5, connectorMax)
                .grid(rows, cols)
                .pathLengths(calculateMinPathLength(rows, cols), calculateMaxPathLength(rows, cols))
                .weights(weights)
                .hiddenMode(false)
                .secondsPerStep(secondsPerStep)
                .build();
    }

    private static int valueOr(Integer value, int fallback) {
        return value != null ? value : fallback;
    }

    private static boolean valueOr(Boolean value, boolean fallback) {
        return value != null ? value : fallback;
    }
}

package com.circuitchallenge.difficulty;

/**
 * Partial settings merged onto a base preset. Every field is optional.
 */
public record DifficultyOverrides(
        String name,
        Boolean additionEnabled,
        Boolean subtractionEnabled,
        Boolean multiplicationEnabled,
        Boolean divisionEnabled,
        Integer addSubRange,
        Integer multDivRange,
        Integer connectorMin,
        Integer connectorMax,
        Integer gridRows,
        Integer gridCols,
        OperationWeights weights,
        Boolean hiddenMode,
        Integer secondsPerStep) {

    public static DifficultyOverrides none() {
        return new DifficultyOverrides(null, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public boolean touchesOperations() {
        return additionEnabled != null || subtractionEnabled != null
                || multiplicationEnabled != null || divisionEnabled != null;
    }
}

package com.circuitchallenge.difficulty;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.circuitchallenge.generator.Operation;
import com.circuitchallenge.generator.ValidationResult;

class DifficultyPresetsTest {

    @Test
    void levelsAreClamped() {
        assertEquals("Tiny Tot", DifficultyPresets.byLevel(0).name());
        assertEquals("Tiny Tot", DifficultyPresets.byLevel(-3).name());
        assertEquals("Expert", DifficultyPresets.byLevel(11).name());
        assertEquals("Division Intro", DifficultyPresets.byLevel(8).name());
    }

    @Test
    void presetPathLengthsFollowGridArea() {
        assertPathLengths(DifficultyPresets.byLevel(1), 6, 10);
        assertPathLengths(DifficultyPresets.byLevel(5), 11, 17);
        assertPathLengths(DifficultyPresets.byLevel(10), 21, 40);
    }

    @Test
    void pathLengthFormulas() {
        assertEquals(4, DifficultyPresets.calculateMinPathLength(2, 3));
        assertEquals(8, DifficultyPresets.calculateMinPathLength(4, 4));
        assertEquals(15, DifficultyPresets.calculateMinPathLength(5, 6));
        assertEquals(13, DifficultyPresets.calculateMaxPathLength(4, 4));
    }

    @Test
    void presetsAreConsistent() {
        List<DifficultySettings> presets = DifficultyPresets.all();
        assertEquals(DifficultyPresets.LEVEL_COUNT, presets.size());
        for (int i = 0; i < presets.size(); i++) {
            DifficultySettings preset = presets.get(i);
            ValidationResult result = DifficultyPresets.validateDifficultySettings(preset);
            assertTrue(result.valid(), preset.name() + ": " + result.errors());
            assertEquals(i + 1, DifficultyPresets.levelNumber(preset));
            assertEquals(5, preset.connectorMin());
            for (Operation operation : Operation.values()) {
                assertEquals(preset.isEnabled(operation), preset.weights().weightOf(operation) > 0);
            }
        }
        assertTrue(DifficultyPresets.byLevel(8).divisionEnabled());
        assertFalse(DifficultyPresets.byLevel(7).divisionEnabled());
        assertEquals(List.of(Operation.ADDITION), DifficultyPresets.byLevel(1).enabledOperations());
    }

    @Test
    void lookupByName() {
        assertEquals(9, DifficultyPresets.levelNumber(DifficultyPresets.byName(" challenge ").orElseThrow()));
        assertTrue(DifficultyPresets.byName("Impossible").isEmpty());
        assertEquals(0, DifficultyPresets.levelNumber(DifficultySettings.builder().build()));
    }

    @Test
    void customDefaultsComeFromTimesTables() {
        DifficultySettings custom = DifficultyPresets.createCustomDifficulty(DifficultyOverrides.none());
        assertEquals(DifficultyPresets.CUSTOM_NAME, custom.name());
        assertEquals(4, custom.gridRows());
        assertEquals(5, custom.gridCols());
        assertEquals(OperationWeights.of(33, 33, 33, 0), custom.weights());
        assertTrue(DifficultyPresets.validateDifficultySettings(custom).valid());
    }

    @Test
    void customGridRecomputesPathLengths() {
        DifficultyOverrides overrides = new DifficultyOverrides(
                "Big", null, null, null, true, null, 12, null, 144, 6, 8, null, null, null);
        DifficultySettings custom = DifficultyPresets.createCustomDifficulty(overrides);
        assertEquals("Big", custom.name());
        assertPathLengths(custom, 21, 40);
        assertEquals(OperationWeights.of(25, 25, 25, 25), custom.weights());
        assertTrue(overrides.touchesOperations());
        assertFalse(DifficultyOverrides.none().touchesOperations());
    }

    @Test
    void customKeepsExplicitWeights() {
        OperationWeights weights = OperationWeights.of(70, 30, 0, 0);
        DifficultyOverrides overrides = new DifficultyOverrides(
                null, true, true, false, false, null, null, null, null, null, null, weights, null, null);
        DifficultySettings custom = DifficultyPresets.createCustomDifficulty(overrides);
        assertEquals(weights, custom.weights());
        assertEquals(List.of(Operation.ADDITION, Operation.SUBTRACTION), custom.enabledOperations());
    }

    @Test
    void invalidSettingsReportEveryProblem() {
        DifficultySettings settings = DifficultySettings.builder()
                .operations(false, false, false, false)
                .connectorRange(0, 0)
                .grid(2, 3)
                .pathLengths(3, 2)
                .secondsPerStep(0)
                .build();
        ValidationResult result = DifficultyPresets.validateDifficultySettings(settings);
        assertFalse(result.valid());
        assertTrue(result.errors().containsAll(List.of(
                "At least one operation must be enabled",
                "Minimum connector value must be at least 1",
                "Maximum connector value must be greater than minimum",
                "Grid must have at least 3 rows",
                "Grid must have at least 4 columns",
                "Minimum path length must be at least 4",
                "Maximum path length must be at least the minimum path length",
                "Seconds per step must be at least 1")), result.errors().toString());
    }

    @Test
    void enabledOperationNeedsWeight() {
        DifficultySettings settings = DifficultySettings.builder()
                .operations(true, true, false, false)
                .weights(OperationWeights.of(100, 0, 0, 0))
                .build();
        assertEquals(List.of("Subtraction is enabled but has no weight"),
                DifficultyPresets.validateDifficultySettings(settings).errors());
    }

    @Test
    void negativeWeightsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> OperationWeights.of(-1, 0, 0, 0));
        assertEquals(OperationWeights.of(0, 0, 0, 0), OperationWeights.evenlySplit(false, false, false, false));
        assertEquals(100, OperationWeights.of(40, 35, 25, 0).total());
    }

    private static void assertPathLengths(DifficultySettings settings, int min, int max) {
        assertEquals(min, settings.minPathLength(), settings.name());
        assertEquals(max, settings.maxPathLength(), settings.name());
    }
}

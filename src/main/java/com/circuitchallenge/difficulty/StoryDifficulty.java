package com.circuitchallenge.difficulty;

import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.circuitchallenge.generator.Operation;

public final class StoryDifficulty {

    public static final int CHAPTER_COUNT = 10;
    static final int CONNECTOR_MIN = 5;
    static final int SECONDS_PER_STEP = 5;

    private static final Logger log = LoggerFactory.getLogger(StoryDifficulty.class);

    private static final Set<Operation> ADD = EnumSet.of(Operation.ADDITION);
    private static final Set<Operation> ADD_SUB = EnumSet.of(Operation.ADDITION, Operation.SUBTRACTION);
    private static final Set<Operation> ADD_SUB_MUL =
            EnumSet.of(Operation.ADDITION, Operation.SUBTRACTION, Operation.MULTIPLICATION);
    private static final Set<Operation> ALL = EnumSet.allOf(Operation.class);

    private static final Map<Integer, ChapterConfig> CHAPTERS = Map.of(
            1, new ChapterConfig(ADD, 10, 0, new GridSize(3, 4), new GridSize(6, 7), false),
            2, new ChapterConfig(ADD_SUB, 15, 0, new GridSize(4, 5), new GridSize(6, 7), false),
            3, new ChapterConfig(ADD_SUB, 20, 0, new GridSize(4, 5), new GridSize(6, 7), false),
            4, new ChapterConfig(ADD_SUB, 35, 0, new GridSize(4, 5), new GridSize(6, 7), false),
            5, new ChapterConfig(ADD_SUB_MUL, 20, 20, new GridSize(4, 5), new GridSize(6, 7), false),
            6, new ChapterConfig(ADD_SUB_MUL, 30, 50, new GridSize(4, 5), new GridSize(6, 7), false),
            7, new ChapterConfig(ADD_SUB_MUL, 40, 100, new GridSize(4, 5), new GridSize(6, 7), false),
            8, new ChapterConfig(ALL, 50, 100, new GridSize(4, 5), new GridSize(6, 7), false),
            9, new ChapterConfig(ALL, 100, 144, new GridSize(6, 7), new GridSize(6, 7), false),
            10, new ChapterConfig(ALL, 100, 144, new GridSize(8, 9), new GridSize(8, 9), true));

    private StoryDifficulty() {
    }

    public static DifficultySettings settings(StoryLevel storyLevel) {
        Objects.requireNonNull(storyLevel, "storyLevel");
        ChapterConfig config = CHAPTERS.get(storyLevel.chapter());
        if (config == null) {
            log.debug("Unknown story chapter {}, falling back to 1-A", storyLevel.chapter());
            return settings(new StoryLevel(1, 1));
        }
        GridSize grid = calculateGrid(storyLevel.level(), config.startGrid(), config.endGrid());
        Set<Operation> operations = config.operations();
        return DifficultySettings.builder()
                .name("Story " + storyLevel.displayName())
                .operations(
                        operations.contains(Operation.ADDITION),
                        operations.contains(Operation.SUBTRACTION),
                        operations.contains(Operation.MULTIPLICATION),
                        operations.contains(Operation.DIVISION))
                .addSubRange(config.addSubMax())
                .multDivRange(config.multDivMax() > 0 ? (int) Math.sqrt(config.multDivMax()) : 0)
                .connectorRange(CONNECTOR_MIN, Math.max(config.addSubMax(), config.multDivMax()))
                .grid(grid.rows(), grid.cols())
                .pathLengths(
                        DifficultyPresets.calculateMinPathLength(grid.rows(), grid.cols()),
                        DifficultyPresets.calculateMaxPathLength(grid.rows(), grid.cols()))
                .weights(OperationWeights.evenlySplit(
                        operations.contains(Operation.ADDITION),
                        operations.contains(Operation.SUBTRACTION),
                        operations.contains(Operation.MULTIPLICATION),
                        operations.contains(Operation.DIVISION)))
                .hiddenMode(config.allHidden() || storyLevel.level() == StoryLevel.LEVELS_PER_CHAPTER)
                .secondsPerStep(SECONDS_PER_STEP)
                .build();
    }

    // Levels 1-4 grow from the start grid towards the end grid, alternating rows and columns.
    static GridSize calculateGrid(int level, GridSize start, GridSize end) {
        if (level == StoryLevel.LEVELS_PER_CHAPTER || start.equals(end)) {
            return level == StoryLevel.LEVELS_PER_CHAPTER ? end : start;
        }
        int totalGrowth = (end.rows() - start.rows()) + (end.cols() - start.cols());
        int growthPerLevel = totalGrowth / 4;
        int growthForLevel = (level - 1) * growthPerLevel;
        int rows = start.rows();
        int cols = start.cols();
        for (int i = 0; i < growthForLevel; i++) {
            if (i % 2 == 0 && rows < end.rows()) {
                rows++;
            } else if (cols < end.cols()) {
                cols++;
            } else if (rows < end.rows()) {
                rows++;
            }
        }
        return new GridSize(rows, cols);
    }

    record GridSize(int rows, int cols) {
    }

    private record ChapterConfig(
            Set<Operation> operations,
            int addSubMax,
            int multDivMax,
            GridSize startGrid,
            GridSize endGrid,
            boolean allHidden) {
    }
}

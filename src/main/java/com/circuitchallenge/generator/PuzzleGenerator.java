package com.circuitchallenge.generator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.StringJoiner;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.circuitchallenge.difficulty.DifficultyPresets;
import com.circuitchallenge.difficulty.DifficultySettings;

@Service
public class PuzzleGenerator {

    private static final Logger log = LoggerFactory.getLogger(PuzzleGenerator.class);

    public GenerationResult generatePuzzle(DifficultySettings settings, Random random) {
        return generatePuzzle(settings, GenerationOptions.defaults(), random);
    }

    /**
     * Runs path search, connector build, value assignment, expression fill and the validator
     * self-check, retrying the whole pipeline until a puzzle passes or the attempt ceiling is hit.
     */
    public GenerationResult generatePuzzle(DifficultySettings settings, GenerationOptions options, Random random) {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(random, "random");
        requireGeneratable(settings);

        long start = System.nanoTime();
        Map<GenerationFailure, Integer> failures = new EnumMap<>(GenerationFailure.class);
        Attempt last = null;
        for (int attempt = 1; attempt <= options.maxAttempts(); attempt++) {
            Attempt outcome = runAttempt(settings, options, random);
            if (outcome.puzzle() != null) {
                Puzzle puzzle = outcome.puzzle();
                log.info(
                        "Puzzle {} for '{}': {}x{} grid, path {} cells, {} connectors (attempts={}, spent={})",
                        puzzle.id(),
                        settings.name(),
                        puzzle.rows(),
                        puzzle.cols(),
                        puzzle.solution().path().size(),
                        puzzle.connectors().size(),
                        attempt,
                        elapsedLabel(start));
                return GenerationResult.succeeded(puzzle, attempt);
            }
            failures.merge(outcome.failure(), 1, Integer::sum);
            log.debug("Attempt {}/{} for '{}' failed at {} stage: {}",
                    attempt, options.maxAttempts(), settings.name(), outcome.failure().label(), outcome.reason());
            last = outcome;
        }

        String breakdown = describe(failures);
        log.warn("No puzzle for '{}' after {} attempts ({}), last error: {}",
                settings.name(), options.maxAttempts(), breakdown, last.reason());
        return GenerationResult.failed(
                last.failure(),
                "Failed to generate puzzle after " + options.maxAttempts() + " attempts (" + breakdown + "): " + last.reason(),
                options.maxAttempts());
    }

    private Attempt runAttempt(DifficultySettings settings, GenerationOptions options, Random random) {
        int rows = settings.gridRows();
        int cols = settings.gridCols();

        PathResult path = PathFinder.generatePath(rows, cols, settings.minPathLength(), settings.maxPathLength(), random);
        if (!path.success()) {
            return Attempt.failed(GenerationFailure.PATH_GENERATION_FAILED, path.error());
        }

        DiagonalGrid diagonals = ConnectorBuilder.buildDiagonalGrid(rows, cols, path.diagonalCommitments(), random);
        List<UnvaluedConnector> graph = ConnectorBuilder.buildConnectorGraph(rows, cols, diagonals);
        ValueAssignmentResult values = ConnectorBuilder.assignConnectorValues(
                graph,
                settings.connectorMin(),
                settings.connectorMax(),
                settings.divisionEnabled(),
                path.path(),
                settings.multDivRange(),
                random);
        if (!values.success()) {
            return Attempt.failed(GenerationFailure.CONNECTOR_ASSIGNMENT_FAILED, values.error());
        }

        CellAssigner.CellAnswers answers = CellAssigner.assignCellAnswers(
                rows, cols, path.path(), values.connectors(), values.divisionConnectorIndices(), random);
        Coordinate finish = new Coordinate(rows - 1, cols - 1);
        List<List<Cell>> grid = new ArrayList<>(rows);
        for (int row = 0; row < rows; row++) {
            List<Cell> cells = new ArrayList<>(cols);
            for (int col = 0; col < cols; col++) {
                Coordinate coordinate = new Coordinate(row, col);
                if (coordinate.equals(finish)) {
                    cells.add(Cell.finish(row, col));
                    continue;
                }
                int answer = answers.answerFor(coordinate);
                Optional<Expression> expression = ExpressionGenerator.generateExpression(
                        answer, settings, answers.prefersDivision(coordinate), random);
                if (expression.isEmpty()) {
                    return Attempt.failed(GenerationFailure.EXPRESSION_GENERATION_FAILED,
                            "No expression for target " + answer + " at " + coordinate);
                }
                cells.add(new Cell(row, col, expression.get().text(), answer, row == 0 && col == 0, false));
            }
            grid.add(cells);
        }

        Puzzle puzzle = new Puzzle(
                new UUID(random.nextLong(), random.nextLong()).toString(),
                DifficultyPresets.levelNumber(settings),
                grid,
                values.connectors(),
                new Solution(path.path()));

        if (options.validateResult()) {
            ValidationResult validation = PuzzleValidator.validatePuzzle(puzzle, settings);
            if (!validation.valid()) {
                return Attempt.failed(GenerationFailure.VALIDATION_FAILED, String.join("; ", validation.errors()));
            }
        }
        return Attempt.succeeded(puzzle);
    }

    /**
     * Rejects settings no number of attempts could satisfy.
     *
     * @throws IllegalArgumentException for a grid under two cells or an inverted connector or path range
     */
    public static void requireGeneratable(DifficultySettings settings) {
        if (settings.gridRows() < 1 || settings.gridCols() < 1 || settings.gridRows() * settings.gridCols() < 2) {
            throw new IllegalArgumentException("Grid must contain at least two cells but was "
                    + settings.gridRows() + "x" + settings.gridCols());
        }
        if (settings.connectorMin() > settings.connectorMax()) {
            throw new IllegalArgumentException("Connector range is inverted: "
                    + settings.connectorMin() + "-" + settings.connectorMax());
        }
        if (settings.minPathLength() > settings.maxPathLength()) {
            throw new IllegalArgumentException("Path length range is inverted: "
                    + settings.minPathLength() + "-" + settings.maxPathLength());
        }
    }

    private static String describe(Map<GenerationFailure, Integer> failures) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Map.Entry<GenerationFailure, Integer> entry : failures.entrySet()) {
            joiner.add(entry.getKey().label() + "=" + entry.getValue());
        }
        return joiner.toString();
    }

    private static String elapsedLabel(long startNanos) {
        Duration spent = Duration.ofNanos(System.nanoTime() - startNanos);
        return String.format(Locale.US, "%.1f ms", spent.toNanos() / 1_000_000.0);
    }

    private record Attempt(Puzzle puzzle, GenerationFailure failure, String reason) {

        static Attempt succeeded(Puzzle puzzle) {
            return new Attempt(puzzle, null, null);
        }

        static Attempt failed(GenerationFailure failure, String reason) {
            return new Attempt(null, failure, reason);
        }
    }
}

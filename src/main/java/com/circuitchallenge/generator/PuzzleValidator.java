package com.circuitchallenge.generator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.circuitchallenge.difficulty.DifficultySettings;

/**
 * Re-checks a finished puzzle from its public shape only. Every violation is reported; nothing fails fast.
 */
public final class PuzzleValidator {

    private static final Pattern OPERANDS = Pattern.compile("^\\s*(\\d+)\\s*(\\S)\\s*(\\d+)\\s*$");

    private PuzzleValidator() {
    }

    public static ValidationResult validatePuzzle(Puzzle puzzle) {
        Objects.requireNonNull(puzzle, "puzzle");
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        ValidationResult shape = validateGridShape(puzzle);
        errors.addAll(shape.errors());
        if (!shape.valid()) {
            return ValidationResult.of(errors, warnings);
        }
        int rows = puzzle.rows();
        int cols = puzzle.cols();
        for (ValidationResult part : List.of(
                validatePath(puzzle.solution().path(), rows, cols),
                validateConnectorGraph(puzzle.connectors(), rows, cols),
                validateConnectorUniqueness(puzzle.connectors()),
                validateCellAnswers(puzzle),
                validateSolutionPath(puzzle),
                validateExpressions(puzzle))) {
            errors.addAll(part.errors());
            warnings.addAll(part.warnings());
        }
        return ValidationResult.of(errors, warnings);
    }

    public static ValidationResult validatePuzzle(Puzzle puzzle, DifficultySettings settings) {
        Objects.requireNonNull(settings, "settings");
        ValidationResult base = validatePuzzle(puzzle);
        List<String> errors = new ArrayList<>(base.errors());
        errors.addAll(validatePathLength(puzzle.solution().path(), settings.minPathLength(), settings.maxPathLength()).errors());
        errors.addAll(validateConnectorRange(puzzle.connectors(), settings.connectorMin(), settings.connectorMax()).errors());
        return ValidationResult.of(errors, base.warnings());
    }

    public static ValidationResult validateGridShape(Puzzle puzzle) {
        List<String> errors = new ArrayList<>();
        if (puzzle.grid().isEmpty() || puzzle.grid().get(0).isEmpty()) {
            errors.add("Grid has no cells");
            return ValidationResult.failure(errors);
        }
        int cols = puzzle.cols();
        for (int row = 0; row < puzzle.rows(); row++) {
            List<Cell> cells = puzzle.grid().get(row);
            if (cells.size() != cols) {
                errors.add("Row " + row + " has " + cells.size() + " cells but row 0 has " + cols);
                continue;
            }
            for (int col = 0; col < cells.size(); col++) {
                Cell cell = cells.get(col);
                if (cell.row() != row || cell.col() != col) {
                    errors.add("Cell at (" + row + "," + col + ") reports position (" + cell.row() + "," + cell.col() + ")");
                }
            }
        }
        return ValidationResult.failure(errors);
    }

    public static ValidationResult validatePath(List<Coordinate> path, int rows, int cols) {
        List<String> errors = new ArrayList<>();
        if (path.isEmpty()) {
            errors.add("Path is empty");
            return ValidationResult.failure(errors);
        }
        if (!path.get(0).equals(new Coordinate(0, 0))) {
            errors.add("Path must start at (0,0), but starts at " + path.get(0).key());
        }
        Coordinate last = path.get(path.size() - 1);
        if (!last.equals(new Coordinate(rows - 1, cols - 1))) {
            errors.add("Path must end at (" + (rows - 1) + "," + (cols - 1) + "), but ends at " + last.key());
        }
        Set<Coordinate> seen = new HashSet<>();
        for (int i = 0; i < path.size(); i++) {
            Coordinate coordinate = path.get(i);
            if (!coordinate.isWithin(rows, cols)) {
                errors.add("Path coordinate " + coordinate.key() + " is out of bounds");
            }
            if (!seen.add(coordinate)) {
                errors.add("Duplicate coordinate in path: " + coordinate.key());
            }
            if (i > 0) {
                Coordinate previous = path.get(i - 1);
                int rowGap = Math.abs(previous.row() - coordinate.row());
                int colGap = Math.abs(previous.col() - coordinate.col());
                if (Math.max(rowGap, colGap) != 1) {
                    errors.add("Non-adjacent cells in path: " + previous.key() + " to " + coordinate.key());
                }
            }
        }
        return ValidationResult.failure(errors);
    }

    public static ValidationResult validatePathLength(List<Coordinate> path, int minLength, int maxLength) {
        List<String> errors = new ArrayList<>();
        if (path.size() < minLength || path.size() > maxLength) {
            errors.add("Path length " + path.size() + " is outside " + minLength + "-" + maxLength);
        }
        return ValidationResult.failure(errors);
    }

    public static ValidationResult validateConnectorGraph(List<Connector> connectors, int rows, int cols) {
        List<String> errors = new ArrayList<>();
        int horizontal = 0;
        int vertical = 0;
        int diagonal = 0;
        Map<Coordinate, Integer> diagonalsPerSquare = new HashMap<>();
        for (Connector connector : connectors) {
            Coordinate a = connector.cellA();
            Coordinate b = connector.cellB();
            if (!a.isWithin(rows, cols) || !b.isWithin(rows, cols)) {
                errors.add("Connector " + a.key() + "-" + b.key() + " leaves the grid");
                continue;
            }
            int rowGap = Math.abs(a.row() - b.row());
            int colGap = Math.abs(a.col() - b.col());
            switch (connector.type()) {
                case HORIZONTAL -> {
                    horizontal++;
                    if (rowGap != 0 || colGap != 1) {
                        errors.add("Horizontal connector " + a.key() + "-" + b.key() + " does not join row neighbours");
                    }
                }
                case VERTICAL -> {
                    vertical++;
                    if (rowGap != 1 || colGap != 0) {
                        errors.add("Vertical connector " + a.key() + "-" + b.key() + " does not join column neighbours");
                    }
                }
                case DIAGONAL -> {
                    diagonal++;
                    if (rowGap != 1 || colGap != 1) {
                        errors.add("Diagonal connector " + a.key() + "-" + b.key() + " does not join diagonal neighbours");
                    } else {
                        Coordinate square = new Coordinate(Math.min(a.row(), b.row()), Math.min(a.col(), b.col()));
                        diagonalsPerSquare.merge(square, 1, Integer::sum);
                    }
                }
            }
        }
        int expectedHorizontal = rows * (cols - 1);
        int expectedVertical = (rows - 1) * cols;
        int expectedDiagonal = (rows - 1) * (cols - 1);
        if (horizontal != expectedHorizontal) {
            errors.add("Expected " + expectedHorizontal + " horizontal connectors but found " + horizontal);
        }
        if (vertical != expectedVertical) {
            errors.add("Expected " + expectedVertical + " vertical connectors but found " + vertical);
        }
        if (diagonal != expectedDiagonal) {
            errors.add("Expected " + expectedDiagonal + " diagonal connectors but found " + diagonal);
        }
        for (Map.Entry<Coordinate, Integer> entry : diagonalsPerSquare.entrySet()) {
            if (entry.getValue() > 1) {
                errors.add("Square " + entry.getKey().key() + " has " + entry.getValue() + " diagonal connectors");
            }
        }
        return ValidationResult.failure(errors);
    }

    public static ValidationResult validateConnectorUniqueness(List<Connector> connectors) {
        List<String> errors = new ArrayList<>();
        Map<Coordinate, Set<Integer>> valuesByCell = new HashMap<>();
        Set<Coordinate> reported = new HashSet<>();
        for (Connector connector : connectors) {
            for (Coordinate cell : List.of(connector.cellA(), connector.cellB())) {
                boolean added = valuesByCell.computeIfAbsent(cell, key -> new HashSet<>()).add(connector.value());
                if (!added && reported.add(cell)) {
                    errors.add("Duplicate connector value " + connector.value() + " at cell " + cell.key());
                }
            }
        }
        return ValidationResult.failure(errors);
    }

    public static ValidationResult validateConnectorRange(List<Connector> connectors, int minValue, int maxValue) {
        List<String> errors = new ArrayList<>();
        for (Connector connector : connectors) {
            if (connector.value() < minValue || connector.value() > maxValue) {
                errors.add("Connector " + connector.cellA().key() + "-" + connector.cellB().key() + " value "
                        + connector.value() + " is outside " + minValue + "-" + maxValue);
            }
        }
        return ValidationResult.failure(errors);
    }

    public static ValidationResult validateCellAnswers(Puzzle puzzle) {
        List<String> errors = new ArrayList<>();
        for (List<Cell> row : puzzle.grid()) {
            for (Cell cell : row) {
                String key = cell.coordinate().key();
                if (cell.isFinish()) {
                    if (cell.answer() != null) {
                        errors.add("FINISH cell should have no answer");
                    }
                    continue;
                }
                if (cell.answer() == null) {
                    errors.add("Cell " + key + " has no answer but is not FINISH");
                    continue;
                }
                int matching = 0;
                for (Connector connector : puzzle.connectors()) {
                    if (connector.touches(cell.coordinate()) && connector.value() == cell.answer()) {
                        matching++;
                    }
                }
                if (matching == 0) {
                    errors.add("Cell " + key + " has answer " + cell.answer() + " but no matching connector");
                } else if (matching > 1) {
                    errors.add("Cell " + key + " has answer " + cell.answer() + " matching " + matching + " connectors");
                }
            }
        }
        return ValidationResult.failure(errors);
    }

    public static ValidationResult validateSolutionPath(Puzzle puzzle) {
        List<String> errors = new ArrayList<>();
        List<Coordinate> path = puzzle.solution().path();
        for (int i = 0; i < path.size() - 1; i++) {
            Coordinate current = path.get(i);
            Coordinate next = path.get(i + 1);
            Connector between = null;
            for (Connector connector : puzzle.connectors()) {
                if (connector.connects(current, next)) {
                    between = connector;
                    break;
                }
            }
            if (between == null) {
                errors.add("No connector between path cells " + current.key() + " and " + next.key());
                continue;
            }
            Integer answer = puzzle.cell(current).map(Cell::answer).orElse(null);
            if (answer == null || answer != between.value()) {
                errors.add("Cell " + current.key() + " answer " + answer + " doesn't match connector value " + between.value());
            }
        }
        return ValidationResult.failure(errors);
    }

    public static ValidationResult validateExpressions(Puzzle puzzle) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (List<Cell> row : puzzle.grid()) {
            for (Cell cell : row) {
                String key = cell.coordinate().key();
                if (cell.isFinish()) {
                    if (!cell.expression().isEmpty()) {
                        errors.add("FINISH cell should have an empty expression");
                    }
                    continue;
                }
                if (cell.expression().isBlank()) {
                    errors.add("Cell " + key + " has empty expression");
                    continue;
                }
                OptionalInt result = ExpressionGenerator.evaluateExpression(cell.expression());
                if (result.isEmpty()) {
                    errors.add("Cannot evaluate expression '" + cell.expression() + "' at " + key);
                    continue;
                }
                if (cell.answer() == null || result.getAsInt() != cell.answer()) {
                    errors.add("Expression '" + cell.expression() + "' = " + result.getAsInt()
                            + ", but cell answer is " + cell.answer() + " at " + key);
                }
                if (hasTrivialOperand(cell.expression())) {
                    warnings.add("Expression '" + cell.expression() + "' at " + key + " uses a trivial operand");
                }
            }
        }
        return ValidationResult.of(errors, warnings);
    }

    // 0 in a sum or 1 as a factor only appears when operand limits had to be ignored.
    private static boolean hasTrivialOperand(String expression) {
        Matcher matcher = OPERANDS.matcher(expression);
        if (!matcher.matches()) {
            return false;
        }
        String operator = matcher.group(2);
        String a = matcher.group(1);
        String b = matcher.group(3);
        return switch (operator) {
            case "+" -> "0".equals(a) || "0".equals(b);
            case "×", "*" -> "1".equals(a) || "1".equals(b);
            default -> false;
        };
    }
}

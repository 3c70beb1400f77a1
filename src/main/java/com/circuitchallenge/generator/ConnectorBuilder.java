package com.circuitchallenge.generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.IntStream;

public final class ConnectorBuilder {

    static final double DIVISION_CONNECTOR_RATIO = 0.25;
    static final int MAX_DIAGONALS_PER_CELL = 2;
    static final int DIAGONAL_SEARCH_BUDGET = 20_000;

    private ConnectorBuilder() {
    }

    /**
     * Picks one diagonal per unit square. Committed squares keep the direction the solution path took;
     * the rest are chosen so that no cell ends up touching more than two diagonals where possible.
     */
    public static DiagonalGrid buildDiagonalGrid(
            int rows,
            int cols,
            Map<Coordinate, DiagonalDirection> commitments,
            Random random) {
        Objects.requireNonNull(commitments, "commitments");
        Objects.requireNonNull(random, "random");
        if (rows < 1 || cols < 1) {
            throw new IllegalArgumentException("Grid dimensions must be positive");
        }
        DiagonalGrid grid = DiagonalGrid.forCells(rows, cols);
        for (Coordinate square : commitments.keySet()) {
            if (square.row() < 0 || square.row() >= grid.rows() || square.col() < 0 || square.col() >= grid.cols()) {
                throw new IllegalArgumentException("Diagonal commitment " + square + " lies outside the grid");
            }
        }

        int[][] diagonalDegree = new int[rows][cols];
        boolean[][] committed = new boolean[grid.rows()][grid.cols()];
        List<Coordinate> open = new ArrayList<>();
        for (int row = 0; row < grid.rows(); row++) {
            for (int col = 0; col < grid.cols(); col++) {
                DiagonalDirection direction = commitments.get(new Coordinate(row, col));
                if (direction == null) {
                    open.add(new Coordinate(row, col));
                    continue;
                }
                grid.set(row, col, direction);
                committed[row][col] = true;
                addDegree(diagonalDegree, row, col, direction, 1);
            }
        }

        if (placeDiagonals(grid, open, 0, diagonalDegree, random, new SearchBudget(DIAGONAL_SEARCH_BUDGET))) {
            return grid;
        }

        Collections.shuffle(open, random);
        for (Coordinate square : open) {
            int drCost = endpointCost(diagonalDegree, square.row(), square.col(), DiagonalDirection.DR);
            int dlCost = endpointCost(diagonalDegree, square.row(), square.col(), DiagonalDirection.DL);
            DiagonalDirection direction;
            if (drCost == dlCost) {
                direction = random.nextBoolean() ? DiagonalDirection.DR : DiagonalDirection.DL;
            } else {
                direction = drCost < dlCost ? DiagonalDirection.DR : DiagonalDirection.DL;
            }
            grid.set(square.row(), square.col(), direction);
            addDegree(diagonalDegree, square.row(), square.col(), direction, 1);
        }

        rebalance(grid, committed, diagonalDegree);
        return grid;
    }

    public static List<UnvaluedConnector> buildConnectorGraph(int rows, int cols, DiagonalGrid diagonals) {
        Objects.requireNonNull(diagonals, "diagonals");
        if (rows < 1 || cols < 1) {
            throw new IllegalArgumentException("Grid dimensions must be positive");
        }
        if (diagonals.rows() != Math.max(rows - 1, 0) || diagonals.cols() != Math.max(cols - 1, 0)) {
            throw new IllegalArgumentException("Diagonal grid " + diagonals.rows() + "x" + diagonals.cols()
                    + " does not match a " + rows + "x" + cols + " cell grid");
        }
        List<UnvaluedConnector> connectors = new ArrayList<>();
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols - 1; col++) {
                connectors.add(new UnvaluedConnector(ConnectorType.HORIZONTAL,
                        new Coordinate(row, col), new Coordinate(row, col + 1), null));
            }
        }
        for (int row = 0; row < rows - 1; row++) {
            for (int col = 0; col < cols; col++) {
                connectors.add(new UnvaluedConnector(ConnectorType.VERTICAL,
                        new Coordinate(row, col), new Coordinate(row + 1, col), null));
            }
        }
        for (int row = 0; row < rows - 1; row++) {
            for (int col = 0; col < cols - 1; col++) {
                DiagonalDirection direction = diagonals.get(row, col);
                connectors.add(direction == DiagonalDirection.DR
                        ? new UnvaluedConnector(ConnectorType.DIAGONAL,
                                new Coordinate(row, col), new Coordinate(row + 1, col + 1), direction)
                        : new UnvaluedConnector(ConnectorType.DIAGONAL,
                                new Coordinate(row, col + 1), new Coordinate(row + 1, col), direction));
            }
        }
        return connectors;
    }

    public static ValueAssignmentResult assignConnectorValues(
            List<UnvaluedConnector> connectors,
            int minValue,
            int maxValue,
            Random random) {
        return assignConnectorValues(connectors, minValue, maxValue, false, List.of(), 0, random);
    }

    public static ValueAssignmentResult assignConnectorValues(
            List<UnvaluedConnector> connectors,
            int minValue,
            int maxValue,
            boolean divisionEnabled,
            List<Coordinate> solutionPath,
            int multDivRange,
            Random random) {
        Objects.requireNonNull(connectors, "connectors");
        Objects.requireNonNull(random, "random");
        if (minValue > maxValue) {
            throw new IllegalArgumentException("Connector range is inverted: " + minValue + "-" + maxValue);
        }
        if (connectors.isEmpty()) {
            return ValueAssignmentResult.assigned(List.of(), Set.of());
        }

        int rangeSize = maxValue - minValue + 1;
        for (Map.Entry<Coordinate, Integer> entry : cellDegrees(connectors).entrySet()) {
            if (entry.getValue() > rangeSize) {
                return ValueAssignmentResult.failure("Cell " + entry.getKey() + " has " + entry.getValue()
                        + " connectors but only " + rangeSize + " values fit in " + minValue + "-" + maxValue);
            }
        }

        int[] fullRange = IntStream.rangeClosed(minValue, maxValue).toArray();
        int[][] domains = new int[connectors.size()][];
        for (int i = 0; i < domains.length; i++) {
            domains[i] = fullRange;
        }

        Set<Integer> divisionIndices = new HashSet<>();
        if (divisionEnabled && solutionPath != null && solutionPath.size() >= 2) {
            int low = Math.max(1, minValue);
            int high = Math.min(multDivRange, maxValue);
            if (low <= high) {
                List<Integer> pathIndices = pathConnectorIndices(connectors, solutionPath);
                Collections.shuffle(pathIndices, random);
                int reserved = Math.min(pathIndices.size(),
                        Math.max(1, (int) Math.floor(pathIndices.size() * DIVISION_CONNECTOR_RATIO)));
                int[] quotientRange = IntStream.rangeClosed(low, high).toArray();
                for (int i = 0; i < reserved; i++) {
                    int index = pathIndices.get(i);
                    divisionIndices.add(index);
                    domains[index] = quotientRange;
                }
            }
        }

        Optional<int[]> solved = new ConnectorValueSolver(connectors, domains, minValue, maxValue, random).solve();
        if (solved.isEmpty()) {
            return ValueAssignmentResult.failure("No conflict-free assignment of values " + minValue + "-" + maxValue
                    + " to " + connectors.size() + " connectors after " + ConnectorValueSolver.MAX_RESTARTS + " restarts");
        }
        int[] values = solved.get();
        List<Connector> valued = new ArrayList<>(connectors.size());
        for (int i = 0; i < connectors.size(); i++) {
            valued.add(connectors.get(i).withValue(values[i]));
        }
        return ValueAssignmentResult.assigned(valued, divisionIndices);
    }

    public static List<Connector> getConnectors(List<Connector> connectors, Coordinate cell) {
        List<Connector> incident = new ArrayList<>();
        for (Connector connector : connectors) {
            if (connector.touches(cell)) {
                incident.add(connector);
            }
        }
        return incident;
    }

    public static Optional<Connector> getConnector(List<Connector> connectors, Coordinate a, Coordinate b) {
        for (Connector connector : connectors) {
            if (connector.connects(a, b)) {
                return Optional.of(connector);
            }
        }
        return Optional.empty();
    }

    static Map<Coordinate, Integer> cellDegrees(List<UnvaluedConnector> connectors) {
        Map<Coordinate, Integer> degrees = new LinkedHashMap<>();
        for (UnvaluedConnector connector : connectors) {
            degrees.merge(connector.cellA(), 1, Integer::sum);
            degrees.merge(connector.cellB(), 1, Integer::sum);
        }
        return degrees;
    }

    private static List<Integer> pathConnectorIndices(List<UnvaluedConnector> connectors, List<Coordinate> path) {
        List<Integer> indices = new ArrayList<>();
        for (int step = 0; step < path.size() - 1; step++) {
            Coordinate from = path.get(step);
            Coordinate to = path.get(step + 1);
            for (int i = 0; i < connectors.size(); i++) {
                if (connectors.get(i).connects(from, to)) {
                    indices.add(i);
                    break;
                }
            }
        }
        return indices;
    }

    // Depth-first over the open squares in row-major order, so every cell is closed off soon after its
    // first square is placed. Degrees are restored on the way back out.
    private static boolean placeDiagonals(
            DiagonalGrid grid,
            List<Coordinate> open,
            int index,
            int[][] degree,
            Random random,
            SearchBudget budget) {
        if (index == open.size()) {
            return true;
        }
        if (!budget.spend()) {
            return false;
        }
        Coordinate square = open.get(index);
        DiagonalDirection first = random.nextBoolean() ? DiagonalDirection.DR : DiagonalDirection.DL;
        for (DiagonalDirection direction : List.of(first, first.opposite())) {
            if (!fits(degree, square.row(), square.col(), direction)) {
                continue;
            }
            addDegree(degree, square.row(), square.col(), direction, 1);
            grid.set(square.row(), square.col(), direction);
            if (placeDiagonals(grid, open, index + 1, degree, random, budget)) {
                return true;
            }
            addDegree(degree, square.row(), square.col(), direction, -1);
        }
        return false;
    }

    private static boolean fits(int[][] degree, int row, int col, DiagonalDirection direction) {
        for (int[] cell : endpoints(row, col, direction)) {
            if (degreeAt(degree, cell) >= MAX_DIAGONALS_PER_CELL) {
                return false;
            }
        }
        return true;
    }

    // Flips uncommitted squares away from cells touching more than two diagonals.
    private static void rebalance(DiagonalGrid grid, boolean[][] committed, int[][] degree) {
        int maxSweeps = grid.rows() * grid.cols() + 1;
        boolean changed = true;
        for (int sweep = 0; changed && sweep < maxSweeps; sweep++) {
            changed = false;
            for (int row = 0; row < grid.rows(); row++) {
                for (int col = 0; col < grid.cols(); col++) {
                    if (committed[row][col]) {
                        continue;
                    }
                    DiagonalDirection current = grid.get(row, col);
                    int[][] held = endpoints(row, col, current);
                    int[][] alternative = endpoints(row, col, current.opposite());
                    boolean overloaded = degreeAt(degree, held[0]) > MAX_DIAGONALS_PER_CELL
                            || degreeAt(degree, held[1]) > MAX_DIAGONALS_PER_CELL;
                    boolean roomOpposite = degreeAt(degree, alternative[0]) < MAX_DIAGONALS_PER_CELL
                            && degreeAt(degree, alternative[1]) < MAX_DIAGONALS_PER_CELL;
                    if (overloaded && roomOpposite) {
                        addDegree(degree, row, col, current, -1);
                        grid.set(row, col, current.opposite());
                        addDegree(degree, row, col, current.opposite(), 1);
                        changed = true;
                    }
                }
            }
        }
    }

    private static int endpointCost(int[][] degree, int row, int col, DiagonalDirection direction) {
        int[][] cells = endpoints(row, col, direction);
        int first = degreeAt(degree, cells[0]);
        int second = degreeAt(degree, cells[1]);
        return Math.max(first, second) * 10 + first + second;
    }

    private static void addDegree(int[][] degree, int row, int col, DiagonalDirection direction, int delta) {
        for (int[] cell : endpoints(row, col, direction)) {
            degree[cell[0]][cell[1]] += delta;
        }
    }

    private static int degreeAt(int[][] degree, int[] cell) {
        return degree[cell[0]][cell[1]];
    }

    private static final class SearchBudget {
        private int remaining;

        private SearchBudget(int steps) {
            this.remaining = steps;
        }

        boolean spend() {
            return remaining-- > 0;
        }
    }

    private static int[][] endpoints(int row, int col, DiagonalDirection direction) {
        return direction == DiagonalDirection.DR
                ? new int[][] {{row, col}, {row + 1, col + 1}}
                : new int[][] {{row, col + 1}, {row + 1, col}};
    }
}

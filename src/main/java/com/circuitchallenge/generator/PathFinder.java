package com.circuitchallenge.generator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Randomised backtracking search for a START to FINISH path over the 8-connected grid.
 * The search runs on an explicit stack and gives up after a fixed iteration ceiling per restart.
 */
public final class PathFinder {

    public static final int DEFAULT_MAX_RESTARTS = 50;
    static final int ITERATIONS_PER_CELL = 200;

    private static final int[][] DIRECTIONS = {
        {-1, 0}, {1, 0}, {0, -1}, {0, 1},
        {-1, -1}, {-1, 1}, {1, -1}, {1, 1}
    };

    private PathFinder() {
    }

    public static PathResult generatePath(int rows, int cols, int minLength, int maxLength, Random random) {
        return generatePath(rows, cols, minLength, maxLength, PathShapePolicy.minimumTurns(), random);
    }

    public static PathResult generatePath(
            int rows,
            int cols,
            int minLength,
            int maxLength,
            PathShapePolicy shapePolicy,
            Random random) {
        Objects.requireNonNull(shapePolicy, "shapePolicy");
        Objects.requireNonNull(random, "random");
        if (rows < 1 || cols < 1 || rows * cols < 2) {
            throw new IllegalArgumentException("Grid must contain at least two cells but was " + rows + "x" + cols);
        }
        if (minLength > maxLength) {
            throw new IllegalArgumentException("Minimum path length " + minLength + " exceeds maximum " + maxLength);
        }
        Coordinate start = new Coordinate(0, 0);
        Coordinate finish = new Coordinate(rows - 1, cols - 1);
        int effectiveMin = Math.max(minLength, start.chebyshevDistance(finish) + 1);
        int effectiveMax = Math.min(maxLength, rows * cols);
        if (effectiveMin > effectiveMax) {
            return PathResult.failure("No path of length " + minLength + "-" + maxLength
                    + " fits a " + rows + "x" + cols + " grid");
        }
        int iterationCeiling = rows * cols * ITERATIONS_PER_CELL;
        String lastError = null;
        for (int restart = 0; restart < DEFAULT_MAX_RESTARTS; restart++) {
            Search search = new Search(rows, cols, effectiveMin, effectiveMax, shapePolicy, random);
            PathResult result = search.run(iterationCeiling);
            if (result.success()) {
                return result;
            }
            lastError = result.error();
        }
        return PathResult.failure("No path of length " + minLength + "-" + maxLength + " found in a "
                + rows + "x" + cols + " grid after " + DEFAULT_MAX_RESTARTS + " restarts (" + lastError + ")");
    }

    public static boolean areAdjacent(Coordinate a, Coordinate b) {
        return a.chebyshevDistance(b) == 1;
    }

    public static List<Coordinate> getAdjacent(Coordinate position, int rows, int cols) {
        List<Coordinate> adjacent = new ArrayList<>(DIRECTIONS.length);
        for (int[] direction : DIRECTIONS) {
            int row = position.row() + direction[0];
            int col = position.col() + direction[1];
            if (row >= 0 && row < rows && col >= 0 && col < cols) {
                adjacent.add(new Coordinate(row, col));
            }
        }
        return adjacent;
    }

    public static int manhattanDistance(Coordinate a, Coordinate b) {
        return Math.abs(a.row() - b.row()) + Math.abs(a.col() - b.col());
    }

    public static boolean isDiagonalMove(Coordinate from, Coordinate to) {
        return Math.abs(from.row() - to.row()) == 1 && Math.abs(from.col() - to.col()) == 1;
    }

    public static DiagonalDirection getDiagonalDirection(Coordinate from, Coordinate to) {
        int rowStep = to.row() - from.row();
        int colStep = to.col() - from.col();
        return rowStep * colStep > 0 ? DiagonalDirection.DR : DiagonalDirection.DL;
    }

    public static Coordinate diagonalSquare(Coordinate a, Coordinate b) {
        return new Coordinate(Math.min(a.row(), b.row()), Math.min(a.col(), b.col()));
    }

    public static boolean isInterestingPath(List<Coordinate> path) {
        return PathShapePolicy.minimumTurns().accepts(path);
    }

    private static final class Search {
        private final int rows;
        private final int cols;
        private final int minLength;
        private final int maxLength;
        private final Coordinate finish;
        private final PathShapePolicy shapePolicy;
        private final Random random;
        private final boolean[][] visited;
        private final Deque<Frame> stack = new ArrayDeque<>();
        private final Map<Coordinate, DiagonalDirection> commitments = new HashMap<>();

        Search(int rows, int cols, int minLength, int maxLength, PathShapePolicy shapePolicy, Random random) {
            this.rows = rows;
            this.cols = cols;
            this.minLength = minLength;
            this.maxLength = maxLength;
            this.finish = new Coordinate(rows - 1, cols - 1);
            this.shapePolicy = shapePolicy;
            this.random = random;
            this.visited = new boolean[rows][cols];
        }

        PathResult run(int iterationCeiling) {
            push(new Coordinate(0, 0), null);
            int iterations = 0;
            while (!stack.isEmpty()) {
                if (++iterations > iterationCeiling) {
                    return PathResult.failure("iteration ceiling " + iterationCeiling + " reached");
                }
                Frame top = stack.peek();
                if (top.cell.equals(finish)) {
                    List<Coordinate> path = currentPath();
                    if (path.size() >= minLength && shapePolicy.accepts(path)) {
                        return PathResult.found(path, commitments);
                    }
                    pop();
                    continue;
                }
                Coordinate next = nextViable(top);
                if (next == null) {
                    pop();
                    continue;
                }
                Coordinate square = null;
                if (isDiagonalMove(top.cell, next)) {
                    square = diagonalSquare(top.cell, next);
                    commitments.put(square, getDiagonalDirection(top.cell, next));
                }
                push(next, square);
            }
            return PathResult.failure("search space exhausted");
        }

        private void push(Coordinate cell, Coordinate committedSquare) {
            visited[cell.row()][cell.col()] = true;
            int length = stack.size() + 1;
            stack.push(new Frame(cell, committedSquare, orderCandidates(cell, length)));
        }

        private void pop() {
            Frame frame = stack.pop();
            visited[frame.cell.row()][frame.cell.col()] = false;
            if (frame.committedSquare != null) {
                commitments.remove(frame.committedSquare);
            }
        }

        private List<Coordinate> currentPath() {
            List<Coordinate> path = new ArrayList<>(stack.size());
            Iterator<Frame> iterator = stack.descendingIterator();
            while (iterator.hasNext()) {
                path.add(iterator.next().cell);
            }
            return path;
        }

        private Coordinate nextViable(Frame frame) {
            while (frame.cursor < frame.candidates.size()) {
                Coordinate candidate = frame.candidates.get(frame.cursor++);
                if (isViable(frame.cell, candidate)) {
                    return candidate;
                }
            }
            return null;
        }

        private boolean isViable(Coordinate from, Coordinate candidate) {
            if (visited[candidate.row()][candidate.col()]) {
                return false;
            }
            if (isDiagonalMove(from, candidate)
                    && (commitments.containsKey(diagonalSquare(from, candidate)) || strandsOpenSquare(from, candidate))) {
                return false;
            }
            int length = stack.size() + 1;
            if (candidate.equals(finish)) {
                return length >= minLength && length <= maxLength;
            }
            if (length + candidate.chebyshevDistance(finish) > maxLength) {
                return false;
            }
            visited[candidate.row()][candidate.col()] = true;
            int reachable = reachableCellsIncludingFinish(candidate);
            visited[candidate.row()][candidate.col()] = false;
            return reachable > 0 && length + reachable >= minLength;
        }

        // Leaving on a second diagonal saturates the cell; an uncommitted square around it then needs a
        // direction whose endpoints both still hold fewer than two diagonals.
        private boolean strandsOpenSquare(Coordinate from, Coordinate candidate) {
            Coordinate newSquare = diagonalSquare(from, candidate);
            if (committedDiagonalsAt(from) + 1 < ConnectorBuilder.MAX_DIAGONALS_PER_CELL) {
                return false;
            }
            for (Coordinate square : squaresAround(from)) {
                if (square.equals(newSquare) || commitments.containsKey(square)) {
                    continue;
                }
                if (touchesSaturated(square, DiagonalDirection.DR, from) && touchesSaturated(square, DiagonalDirection.DL, from)) {
                    return true;
                }
            }
            return false;
        }

        private boolean touchesSaturated(Coordinate square, DiagonalDirection direction, Coordinate from) {
            for (Coordinate end : diagonalEndpoints(square, direction)) {
                int held = committedDiagonalsAt(end) + (end.equals(from) ? 1 : 0);
                if (held >= ConnectorBuilder.MAX_DIAGONALS_PER_CELL) {
                    return true;
                }
            }
            return false;
        }

        private int committedDiagonalsAt(Coordinate cell) {
            int count = 0;
            for (Coordinate square : squaresAround(cell)) {
                DiagonalDirection direction = commitments.get(square);
                if (direction != null && diagonalEndpoints(square, direction).contains(cell)) {
                    count++;
                }
            }
            return count;
        }

        private List<Coordinate> squaresAround(Coordinate cell) {
            List<Coordinate> squares = new ArrayList<>(4);
            for (int row = cell.row() - 1; row <= cell.row(); row++) {
                for (int col = cell.col() - 1; col <= cell.col(); col++) {
                    if (row >= 0 && col >= 0 && row < rows - 1 && col < cols - 1) {
                        squares.add(new Coordinate(row, col));
                    }
                }
            }
            return squares;
        }

        // Unvisited cells reachable from origin, or 0 when FINISH is cut off.
        private int reachableCellsIncludingFinish(Coordinate origin) {
            boolean[][] seen = new boolean[rows][cols];
            Deque<Coordinate> queue = new ArrayDeque<>();
            queue.add(origin);
            seen[origin.row()][origin.col()] = true;
            int count = 0;
            boolean finishReached = false;
            while (!queue.isEmpty()) {
                Coordinate current = queue.poll();
                for (Coordinate neighbor : getAdjacent(current, rows, cols)) {
                    if (seen[neighbor.row()][neighbor.col()] || visited[neighbor.row()][neighbor.col()]) {
                        continue;
                    }
                    seen[neighbor.row()][neighbor.col()] = true;
                    count++;
                    if (neighbor.equals(finish)) {
                        finishReached = true;
                        continue;
                    }
                    queue.add(neighbor);
                }
            }
            return finishReached ? count : 0;
        }

        private List<Coordinate> orderCandidates(Coordinate cell, int length) {
            List<ScoredCandidate> scored = new ArrayList<>();
            for (Coordinate neighbor : getAdjacent(cell, rows, cols)) {
                if (visited[neighbor.row()][neighbor.col()]) {
                    continue;
                }
                scored.add(new ScoredCandidate(neighbor, score(neighbor, length)));
            }
            scored.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed());
            List<Coordinate> ordered = new ArrayList<>(scored.size());
            for (ScoredCandidate candidate : scored) {
                ordered.add(candidate.cell());
            }
            return ordered;
        }

        private double score(Coordinate neighbor, int length) {
            double jitter = random.nextDouble() * 2.0;
            int distance = neighbor.chebyshevDistance(finish);
            boolean lengthBanked = length + 1 + distance >= minLength;
            if (lengthBanked) {
                return jitter - 0.6 * distance;
            }
            return jitter - 0.25 * onwardOptions(neighbor) + 0.15 * distance;
        }

        private int onwardOptions(Coordinate cell) {
            int options = 0;
            for (Coordinate next : getAdjacent(cell, rows, cols)) {
                if (!visited[next.row()][next.col()]) {
                    options++;
                }
            }
            return options;
        }
    }

    static List<Coordinate> diagonalEndpoints(Coordinate square, DiagonalDirection direction) {
        return direction == DiagonalDirection.DR
                ? List.of(square, new Coordinate(square.row() + 1, square.col() + 1))
                : List.of(new Coordinate(square.row(), square.col() + 1), new Coordinate(square.row() + 1, square.col()));
    }

    private static final class Frame {
        private final Coordinate cell;
        private final Coordinate committedSquare;
        private final List<Coordinate> candidates;
        private int cursor;

        private Frame(Coordinate cell, Coordinate committedSquare, List<Coordinate> candidates) {
            this.cell = cell;
            this.committedSquare = committedSquare;
            this.candidates = candidates;
        }
    }

    private record ScoredCandidate(Coordinate cell, double score) {
    }
}

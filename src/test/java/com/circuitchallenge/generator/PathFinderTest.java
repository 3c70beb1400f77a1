package com.circuitchallenge.generator;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;

class PathFinderTest {

    @Test
    void generatedPathsSatisfyShapeAndLengthBounds() {
        int[][] cases = {
            {3, 4, 6, 10},
            {4, 5, 11, 17},
            {5, 6, 15, 25},
            {6, 7, 21, 35},
            {8, 9, 32, 61}
        };
        for (int[] c : cases) {
            for (long seed = 0; seed < 10; seed++) {
                PathResult result = PathFinder.generatePath(c[0], c[1], c[2], c[3], new Random(seed));
                assertTrue(result.success(), () -> "No path for " + c[0] + "x" + c[1] + ": " + result.error());
                assertPathInvariants(result.path(), c[0], c[1], c[2], c[3]);
                assertTrue(PathFinder.isInterestingPath(result.path()));
            }
        }
    }

    @Test
    void diagonalMovesAreCommitted() {
        PathResult result = PathFinder.generatePath(6, 7, 21, 35, new Random(11));
        assertTrue(result.success());
        List<Coordinate> path = result.path();
        int diagonalSteps = 0;
        for (int i = 0; i < path.size() - 1; i++) {
            Coordinate from = path.get(i);
            Coordinate to = path.get(i + 1);
            if (PathFinder.isDiagonalMove(from, to)) {
                diagonalSteps++;
                Coordinate square = PathFinder.diagonalSquare(from, to);
                assertEquals(PathFinder.getDiagonalDirection(from, to), result.diagonalCommitments().get(square));
            }
        }
        assertEquals(diagonalSteps, result.diagonalCommitments().size());
    }

    @Test
    void sameSeedGivesSamePath() {
        PathResult first = PathFinder.generatePath(5, 6, 15, 25, new Random(99));
        PathResult second = PathFinder.generatePath(5, 6, 15, 25, new Random(99));
        assertEquals(first.path(), second.path());
        assertEquals(first.diagonalCommitments(), second.diagonalCommitments());
    }

    @Test
    void unsatisfiableLengthsFail() {
        PathResult tooLong = PathFinder.generatePath(3, 4, 13, 13, new Random(1));
        assertFalse(tooLong.success());
        assertNotNull(tooLong.error());
        assertTrue(tooLong.path().isEmpty());

        PathResult tooShort = PathFinder.generatePath(3, 4, 2, 3, new Random(1));
        assertFalse(tooShort.success());
    }

    @Test
    void invertedBoundsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> PathFinder.generatePath(4, 5, 10, 8, new Random(1)));
        assertThrows(IllegalArgumentException.class, () -> PathFinder.generatePath(1, 1, 1, 1, new Random(1)));
    }

    @Test
    void customShapePolicyIsHonoured() {
        PathResult straight = PathFinder.generatePath(1, 2, 2, 2, PathShapePolicy.any(), new Random(3));
        assertTrue(straight.success());
        assertEquals(List.of(new Coordinate(0, 0), new Coordinate(0, 1)), straight.path());

        PathResult rejected = PathFinder.generatePath(1, 2, 2, 2, PathShapePolicy.minimumTurns(), new Random(3));
        assertFalse(rejected.success());
    }

    @Test
    void manhattanDistanceSumsAxisGaps() {
        assertEquals(7, PathFinder.manhattanDistance(new Coordinate(0, 0), new Coordinate(3, 4)));
        assertEquals(0, PathFinder.manhattanDistance(new Coordinate(2, 2), new Coordinate(2, 2)));
    }

    @Test
    void adjacencyUsesChebyshevDistance() {
        Coordinate centre = new Coordinate(1, 1);
        assertTrue(PathFinder.areAdjacent(centre, new Coordinate(0, 0)));
        assertTrue(PathFinder.areAdjacent(centre, new Coordinate(1, 2)));
        assertFalse(PathFinder.areAdjacent(centre, centre));
        assertFalse(PathFinder.areAdjacent(centre, new Coordinate(3, 1)));
    }

    @Test
    void neighbourCountsDependOnPosition() {
        assertEquals(3, PathFinder.getAdjacent(new Coordinate(0, 0), 4, 5).size());
        assertEquals(5, PathFinder.getAdjacent(new Coordinate(0, 2), 4, 5).size());
        assertEquals(8, PathFinder.getAdjacent(new Coordinate(2, 2), 4, 5).size());
    }

    @Test
    void diagonalDirectionIsSymmetric() {
        Coordinate a = new Coordinate(0, 0);
        Coordinate b = new Coordinate(1, 1);
        Coordinate c = new Coordinate(0, 1);
        Coordinate d = new Coordinate(1, 0);
        assertEquals(DiagonalDirection.DR, PathFinder.getDiagonalDirection(a, b));
        assertEquals(DiagonalDirection.DR, PathFinder.getDiagonalDirection(b, a));
        assertEquals(DiagonalDirection.DL, PathFinder.getDiagonalDirection(c, d));
        assertEquals(DiagonalDirection.DL, PathFinder.getDiagonalDirection(d, c));
        assertEquals(new Coordinate(0, 0), PathFinder.diagonalSquare(c, d));
    }

    static void assertPathInvariants(List<Coordinate> path, int rows, int cols, int minLength, int maxLength) {
        assertEquals(new Coordinate(0, 0), path.get(0));
        assertEquals(new Coordinate(rows - 1, cols - 1), path.get(path.size() - 1));
        assertTrue(path.size() >= minLength, "path shorter than " + minLength + ": " + path.size());
        assertTrue(path.size() <= maxLength, "path longer than " + maxLength + ": " + path.size());
        Set<Coordinate> seen = new HashSet<>();
        for (int i = 0; i < path.size(); i++) {
            Coordinate coordinate = path.get(i);
            assertTrue(coordinate.isWithin(rows, cols));
            assertTrue(seen.add(coordinate), "duplicate " + coordinate);
            if (i > 0) {
                assertTrue(PathFinder.areAdjacent(path.get(i - 1), coordinate));
            }
        }
    }

    @Test
    void commitmentsNeverCrossInsideOneSquare() {
        for (long seed = 0; seed < 20; seed++) {
            PathResult result = PathFinder.generatePath(6, 7, 21, 35, new Random(seed));
            assertTrue(result.success());
            Map<Coordinate, DiagonalDirection> commitments = result.diagonalCommitments();
            int diagonalSteps = 0;
            for (int i = 0; i < result.path().size() - 1; i++) {
                if (PathFinder.isDiagonalMove(result.path().get(i), result.path().get(i + 1))) {
                    diagonalSteps++;
                }
            }
            assertEquals(diagonalSteps, commitments.size());
        }
    }

    @Test
    void diagonalCommitmentsLeaveEveryOpenSquareAWayOut() {
        for (long seed = 0; seed < 200; seed++) {
            PathResult result = PathFinder.generatePath(6, 7, 21, 35, new Random(seed));
            assertTrue(result.success(), result.error());
            Map<Coordinate, DiagonalDirection> commitments = result.diagonalCommitments();
            for (int row = 0; row < 5; row++) {
                for (int col = 0; col < 6; col++) {
                    Coordinate square = new Coordinate(row, col);
                    if (commitments.containsKey(square)) {
                        continue;
                    }
                    boolean drBlocked = touchesFullCell(square, DiagonalDirection.DR, commitments);
                    boolean dlBlocked = touchesFullCell(square, DiagonalDirection.DL, commitments);
                    assertFalse(drBlocked && dlBlocked, "seed " + seed + " strands square " + square);
                }
            }
        }
    }

    private static boolean touchesFullCell(
            Coordinate square, DiagonalDirection direction, Map<Coordinate, DiagonalDirection> commitments) {
        for (Coordinate end : PathFinder.diagonalEndpoints(square, direction)) {
            int held = 0;
            for (Map.Entry<Coordinate, DiagonalDirection> commitment : commitments.entrySet()) {
                if (PathFinder.diagonalEndpoints(commitment.getKey(), commitment.getValue()).contains(end)) {
                    held++;
                }
            }
            if (held >= 2) {
                return true;
            }
        }
        return false;
    }
}

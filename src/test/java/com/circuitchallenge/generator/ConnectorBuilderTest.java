package com.circuitchallenge.generator;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;

class ConnectorBuilderTest {

    private static long countOf(List<UnvaluedConnector> connectors, ConnectorType type) {
        return connectors.stream().filter(connector -> connector.type() == type).count();
    }

    static void assertUniquePerCell(List<Connector> connectors) {
        Map<Coordinate, Set<Integer>> valuesByCell = new HashMap<>();
        for (Connector connector : connectors) {
            assertTrue(valuesByCell.computeIfAbsent(connector.cellA(), key -> new HashSet<>()).add(connector.value()),
                    "duplicate value at " + connector.cellA());
            assertTrue(valuesByCell.computeIfAbsent(connector.cellB(), key -> new HashSet<>()).add(connector.value()),
                    "duplicate value at " + connector.cellB());
        }
    }

    @Test
    void graphHasExpectedConnectorCounts() {
        List<UnvaluedConnector> fourByFive = ConnectorBuilder.buildConnectorGraph(4, 5, DiagonalGrid.forCells(4, 5));
        assertEquals(16, countOf(fourByFive, ConnectorType.HORIZONTAL));
        assertEquals(15, countOf(fourByFive, ConnectorType.VERTICAL));
        assertEquals(12, countOf(fourByFive, ConnectorType.DIAGONAL));
        assertEquals(43, fourByFive.size());

        List<UnvaluedConnector> threeByFour = ConnectorBuilder.buildConnectorGraph(3, 4, DiagonalGrid.forCells(3, 4));
        assertEquals(9, countOf(threeByFour, ConnectorType.HORIZONTAL));
        assertEquals(8, countOf(threeByFour, ConnectorType.VERTICAL));
        assertEquals(6, countOf(threeByFour, ConnectorType.DIAGONAL));
        assertEquals(23, threeByFour.size());
    }

    @Test
    void diagonalDirectionsPickTheRightCorners() {
        DiagonalGrid diagonals = DiagonalGrid.forCells(2, 3);
        diagonals.set(0, 1, DiagonalDirection.DL);
        List<UnvaluedConnector> connectors = ConnectorBuilder.buildConnectorGraph(2, 3, diagonals);
        List<UnvaluedConnector> diagonal = connectors.stream()
                .filter(connector -> connector.type() == ConnectorType.DIAGONAL)
                .toList();
        assertEquals(2, diagonal.size());
        assertTrue(diagonal.get(0).connects(new Coordinate(0, 0), new Coordinate(1, 1)));
        assertEquals(DiagonalDirection.DR, diagonal.get(0).direction());
        assertTrue(diagonal.get(1).connects(new Coordinate(0, 2), new Coordinate(1, 1)));
        assertEquals(DiagonalDirection.DL, diagonal.get(1).direction());
    }

    @Test
    void mismatchedDiagonalGridIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> ConnectorBuilder.buildConnectorGraph(4, 5, DiagonalGrid.forCells(3, 5)));
    }

    @Test
    void diagonalGridHonoursPathCommitments() {
        for (long seed = 0; seed < 20; seed++) {
            Random random = new Random(seed);
            PathResult path = PathFinder.generatePath(6, 7, 21, 35, random);
            assertTrue(path.success());
            DiagonalGrid grid = ConnectorBuilder.buildDiagonalGrid(6, 7, path.diagonalCommitments(), random);
            assertEquals(5, grid.rows());
            assertEquals(6, grid.cols());
            for (Map.Entry<Coordinate, DiagonalDirection> commitment : path.diagonalCommitments().entrySet()) {
                assertEquals(commitment.getValue(), grid.get(commitment.getKey().row(), commitment.getKey().col()));
            }
        }
    }

    @Test
    void commitmentOutsideGridIsRejected() {
        Map<Coordinate, DiagonalDirection> commitments = Map.of(new Coordinate(3, 0), DiagonalDirection.DR);
        assertThrows(IllegalArgumentException.class,
                () -> ConnectorBuilder.buildDiagonalGrid(3, 4, commitments, new Random(1)));
    }

    @Test
    void valuesStayInRangeAndDistinctPerCell() {
        for (long seed = 0; seed < 10; seed++) {
            List<UnvaluedConnector> graph = ConnectorBuilder.buildConnectorGraph(4, 5, DiagonalGrid.forCells(4, 5));
            ValueAssignmentResult result = ConnectorBuilder.assignConnectorValues(graph, 10, 40, new Random(seed));
            assertTrue(result.success(), result.error());
            assertEquals(graph.size(), result.connectors().size());
            for (Connector connector : result.connectors()) {
                assertTrue(connector.value() >= 10 && connector.value() <= 40, "out of range: " + connector);
            }
            assertUniquePerCell(result.connectors());
            assertTrue(result.divisionConnectorIndices().isEmpty());
        }
    }

    @Test
    void sixValuesAreEnoughWhenEachCellTouchesTwoDiagonals() {
        List<UnvaluedConnector> graph = ConnectorBuilder.buildConnectorGraph(6, 7, DiagonalGrid.forCells(6, 7));
        for (long seed = 0; seed < 5; seed++) {
            ValueAssignmentResult result = ConnectorBuilder.assignConnectorValues(graph, 5, 10, new Random(seed));
            assertTrue(result.success(), result.error());
            assertUniquePerCell(result.connectors());
        }
    }

    @Test
    void tooNarrowRangeFailsWithReason() {
        List<UnvaluedConnector> graph = ConnectorBuilder.buildConnectorGraph(4, 5, DiagonalGrid.forCells(4, 5));
        ValueAssignmentResult result = ConnectorBuilder.assignConnectorValues(graph, 1, 3, new Random(5));
        assertFalse(result.success());
        assertTrue(result.connectors().isEmpty());
        assertTrue(result.error().contains("connectors"));
    }

    @Test
    void divisionConnectorsSitOnThePathWithSmallQuotients() {
        Random random = new Random(21);
        PathResult path = PathFinder.generatePath(5, 6, 15, 25, random);
        assertTrue(path.success());
        DiagonalGrid diagonals = ConnectorBuilder.buildDiagonalGrid(5, 6, path.diagonalCommitments(), random);
        List<UnvaluedConnector> graph = ConnectorBuilder.buildConnectorGraph(5, 6, diagonals);

        ValueAssignmentResult result = ConnectorBuilder.assignConnectorValues(graph, 5, 36, true, path.path(), 6, random);

        assertTrue(result.success(), result.error());
        assertFalse(result.divisionConnectorIndices().isEmpty());
        int expected = Math.max(1, (path.path().size() - 1) / 4);
        assertEquals(expected, result.divisionConnectorIndices().size());
        for (int index : result.divisionConnectorIndices()) {
            Connector connector = result.connectors().get(index);
            assertTrue(connector.value() >= 5 && connector.value() <= 6, "quotient out of range: " + connector);
            boolean onPath = false;
            for (int i = 0; i < path.path().size() - 1; i++) {
                if (connector.connects(path.path().get(i), path.path().get(i + 1))) {
                    onPath = true;
                    break;
                }
            }
            assertTrue(onPath, "division connector off the path: " + connector);
        }
        assertUniquePerCell(result.connectors());
    }

    @Test
    void lookupsIgnoreEndpointOrder() {
        List<UnvaluedConnector> graph = ConnectorBuilder.buildConnectorGraph(3, 4, DiagonalGrid.forCells(3, 4));
        ValueAssignmentResult result = ConnectorBuilder.assignConnectorValues(graph, 5, 20, new Random(2));
        assertTrue(result.success());
        List<Connector> connectors = result.connectors();

        Coordinate a = new Coordinate(1, 1);
        Coordinate b = new Coordinate(1, 2);
        assertEquals(ConnectorBuilder.getConnector(connectors, a, b), ConnectorBuilder.getConnector(connectors, b, a));
        assertTrue(ConnectorBuilder.getConnector(connectors, a, b).isPresent());
        assertTrue(ConnectorBuilder.getConnector(connectors, new Coordinate(0, 0), new Coordinate(2, 2)).isEmpty());

        assertEquals(3, ConnectorBuilder.getConnectors(connectors, new Coordinate(0, 0)).size());
        assertEquals(6, ConnectorBuilder.getConnectors(connectors, new Coordinate(1, 1)).size());
    }

    @Test
    void tightGridKeepsDiagonalsAtTwoPerCell() {
        int overloaded = 0;
        for (long seed = 0; seed < 200; seed++) {
            Random random = new Random(seed);
            PathResult path = PathFinder.generatePath(6, 7, 21, 35, random);
            assertTrue(path.success());
            DiagonalGrid diagonals = ConnectorBuilder.buildDiagonalGrid(6, 7, path.diagonalCommitments(), random);
            List<UnvaluedConnector> graph = ConnectorBuilder.buildConnectorGraph(6, 7, diagonals);
            int maxDegree = ConnectorBuilder.cellDegrees(graph).values().stream().mapToInt(Integer::intValue).max().orElse(0);
            if (maxDegree > 6) {
                overloaded++;
            }
        }
        assertTrue(overloaded <= 2, "overloaded grids: " + overloaded);
    }

    @Test
    void openSquaresStepAroundCellsAlreadyHoldingTwoDiagonals() {
        Map<Coordinate, DiagonalDirection> commitments = Map.of(
                new Coordinate(0, 0), DiagonalDirection.DR,
                new Coordinate(1, 1), DiagonalDirection.DR);
        for (long seed = 0; seed < 20; seed++) {
            DiagonalGrid grid = ConnectorBuilder.buildDiagonalGrid(4, 4, commitments, new Random(seed));
            assertEquals(DiagonalDirection.DR, grid.get(0, 1));
            assertEquals(DiagonalDirection.DR, grid.get(1, 0));
            assertEquals(DiagonalDirection.DR, grid.get(0, 0));
            assertEquals(DiagonalDirection.DR, grid.get(1, 1));
        }
    }
}

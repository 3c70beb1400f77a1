package com.circuitchallenge.generator;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;

class CellAssignerTest {

    @Test
    void everyCellPointsAtOneOfItsConnectors() {
        for (long seed = 0; seed < 10; seed++) {
            Random random = new Random(seed);
            PathResult path = PathFinder.generatePath(4, 5, 11, 17, random);
            assertTrue(path.success(), path.error());
            DiagonalGrid diagonals = ConnectorBuilder.buildDiagonalGrid(4, 5, path.diagonalCommitments(), random);
            ValueAssignmentResult values = ConnectorBuilder.assignConnectorValues(
                    ConnectorBuilder.buildConnectorGraph(4, 5, diagonals), 5, 30, random);
            assertTrue(values.success(), values.error());

            CellAssigner.CellAnswers answers = CellAssigner.assignCellAnswers(
                    4, 5, path.path(), values.connectors(), values.divisionConnectorIndices(), random);

            List<Coordinate> solution = path.path();
            for (int i = 0; i < solution.size() - 1; i++) {
                Connector outgoing = ConnectorBuilder.getConnector(values.connectors(), solution.get(i), solution.get(i + 1))
                        .orElseThrow();
                assertEquals(outgoing.value(), answers.answerFor(solution.get(i)));
            }
            for (int row = 0; row < 4; row++) {
                for (int col = 0; col < 5; col++) {
                    Coordinate cell = new Coordinate(row, col);
                    if (row == 3 && col == 4) {
                        assertNull(answers.answerFor(cell));
                        continue;
                    }
                    Integer answer = answers.answerFor(cell);
                    long matches = ConnectorBuilder.getConnectors(values.connectors(), cell).stream()
                            .filter(connector -> connector.value() == answer)
                            .count();
                    assertEquals(1, matches, "cell " + cell);
                }
            }
            assertTrue(answers.divisionCells().isEmpty());
        }
    }

    @Test
    void divisionConnectorsMarkTheirPathCell() {
        List<Coordinate> path = List.of(new Coordinate(0, 0), new Coordinate(0, 1), new Coordinate(1, 1));
        List<Connector> connectors = List.of(
                new Connector(ConnectorType.HORIZONTAL, new Coordinate(0, 0), new Coordinate(0, 1), 6, null),
                new Connector(ConnectorType.HORIZONTAL, new Coordinate(1, 0), new Coordinate(1, 1), 7, null),
                new Connector(ConnectorType.VERTICAL, new Coordinate(0, 0), new Coordinate(1, 0), 8, null),
                new Connector(ConnectorType.VERTICAL, new Coordinate(0, 1), new Coordinate(1, 1), 9, null),
                new Connector(ConnectorType.DIAGONAL, new Coordinate(0, 0), new Coordinate(1, 1), 10, DiagonalDirection.DR));

        CellAssigner.CellAnswers answers = CellAssigner.assignCellAnswers(2, 2, path, connectors, Set.of(0), new Random(3));
        assertEquals(6, answers.answerFor(new Coordinate(0, 0)));
        assertEquals(9, answers.answerFor(new Coordinate(0, 1)));
        assertTrue(answers.prefersDivision(new Coordinate(0, 0)));
        assertFalse(answers.prefersDivision(new Coordinate(0, 1)));
        assertTrue(List.of(7, 8).contains(answers.answerFor(new Coordinate(1, 0))));
    }

    @Test
    void brokenPathIsRejected() {
        List<Coordinate> path = List.of(new Coordinate(0, 0), new Coordinate(1, 1));
        List<Connector> connectors = List.of(
                new Connector(ConnectorType.HORIZONTAL, new Coordinate(0, 0), new Coordinate(0, 1), 6, null));
        assertThrows(IllegalStateException.class,
                () -> CellAssigner.assignCellAnswers(2, 2, path, connectors, Set.of(), new Random(1)));
    }
}

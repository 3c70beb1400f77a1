package com.circuitchallenge.generator;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Scores a single player move against a puzzle: a move is correct when the connector
 * to the chosen neighbour carries the answer of the cell being left.
 */
public final class MoveValidator {

    private MoveValidator() {
    }

    public static boolean isAdjacent(Coordinate from, Coordinate to) {
        return from.chebyshevDistance(to) == 1;
    }

    public static MoveCheckResult checkMoveCorrectness(Cell fromCell, Coordinate to, List<Connector> connectors) {
        Objects.requireNonNull(fromCell, "fromCell");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(connectors, "connectors");
        Optional<Connector> connector = ConnectorBuilder.getConnector(connectors, fromCell.coordinate(), to);
        if (connector.isEmpty()) {
            return new MoveCheckResult(false, null);
        }
        boolean correct = fromCell.answer() != null && fromCell.answer() == connector.get().value();
        return new MoveCheckResult(correct, connector.get());
    }

    public static boolean isFinishCell(Coordinate coordinate, int rows, int cols) {
        return coordinate.row() == rows - 1 && coordinate.col() == cols - 1;
    }

    public record MoveCheckResult(boolean correct, Connector connector) {

        public Optional<Connector> connectorIfPresent() {
            return Optional.ofNullable(connector);
        }
    }
}

package com.circuitchallenge.generator;

import java.util.Objects;

public record UnvaluedConnector(ConnectorType type, Coordinate cellA, Coordinate cellB, DiagonalDirection direction) {

    public UnvaluedConnector {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(cellA, "cellA");
        Objects.requireNonNull(cellB, "cellB");
        if (type == ConnectorType.DIAGONAL && direction == null) {
            throw new IllegalArgumentException("Diagonal connector requires a direction");
        }
    }

    public boolean touches(Coordinate cell) {
        return cellA.equals(cell) || cellB.equals(cell);
    }

    public boolean connects(Coordinate a, Coordinate b) {
        return (cellA.equals(a) && cellB.equals(b)) || (cellA.equals(b) && cellB.equals(a));
    }

    public Connector withValue(int value) {
        return new Connector(type, cellA, cellB, value, direction);
    }
}

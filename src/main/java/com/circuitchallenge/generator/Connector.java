package com.circuitchallenge.generator;

import java.util.Objects;

/**
 * Weighted edge between two adjacent cells. Lookups ignore the cellA/cellB order.
 */
public record Connector(ConnectorType type, Coordinate cellA, Coordinate cellB, int value, DiagonalDirection direction) {

    public Connector {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(cellA, "cellA");
        Objects.requireNonNull(cellB, "cellB");
    }

    public boolean touches(Coordinate cell) {
        return cellA.equals(cell) || cellB.equals(cell);
    }

    public boolean connects(Coordinate a, Coordinate b) {
        return (cellA.equals(a) && cellB.equals(b)) || (cellA.equals(b) && cellB.equals(a));
    }

    public Coordinate otherCell(Coordinate cell) {
        if (cellA.equals(cell)) {
            return cellB;
        }
        if (cellB.equals(cell)) {
            return cellA;
        }
        throw new IllegalArgumentException("Connector " + this + " does not touch " + cell);
    }

    @Override
    public String toString() {
        return type + " " + cellA + "-" + cellB + "=" + value;
    }
}

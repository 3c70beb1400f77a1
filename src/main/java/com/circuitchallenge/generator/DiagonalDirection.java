package com.circuitchallenge.generator;

/**
 * Which of the two crossing diagonals of a unit square carries the connector.
 * DR joins (row, col) to (row + 1, col + 1); DL joins (row, col + 1) to (row + 1, col).
 */
public enum DiagonalDirection {
    DR,
    DL;

    public DiagonalDirection opposite() {
        return this == DR ? DL : DR;
    }
}

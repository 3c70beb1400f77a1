package com.circuitchallenge.generator;

public record Coordinate(int row, int col) {

    public static Coordinate of(int row, int col) {
        return new Coordinate(row, col);
    }

    public String key() {
        return row + "," + col;
    }

    public int chebyshevDistance(Coordinate other) {
        return Math.max(Math.abs(row - other.row), Math.abs(col - other.col));
    }

    public boolean isWithin(int rows, int cols) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }

    @Override
    public String toString() {
        return "(" + key() + ")";
    }
}

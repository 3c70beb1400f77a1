package com.circuitchallenge.generator;

import java.util.Arrays;

/**
 * One diagonal direction per unit square; square (row, col) sits between cells
 * (row, col) and (row + 1, col + 1).
 */
public final class DiagonalGrid {

    private final int rows;
    private final int cols;
    private final DiagonalDirection[] squares;

    public DiagonalGrid(int rows, int cols) {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("Diagonal grid dimensions must not be negative");
        }
        this.rows = rows;
        this.cols = cols;
        this.squares = new DiagonalDirection[rows * cols];
        Arrays.fill(squares, DiagonalDirection.DR);
    }

    public static DiagonalGrid forCells(int cellRows, int cellCols) {
        return new DiagonalGrid(Math.max(cellRows - 1, 0), Math.max(cellCols - 1, 0));
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public void set(int row, int col, DiagonalDirection direction) {
        if (direction == null) {
            throw new IllegalArgumentException("Diagonal direction must not be null");
        }
        squares[index(row, col)] = direction;
    }

    public DiagonalDirection get(int row, int col) {
        return squares[index(row, col)];
    }

    public int count(DiagonalDirection direction) {
        int count = 0;
        for (DiagonalDirection square : squares) {
            if (square == direction) {
                count++;
            }
        }
        return count;
    }

    private int index(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            throw new IndexOutOfBoundsException("Square out of range: (" + row + ", " + col + ")");
        }
        return row * cols + col;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DiagonalGrid other)) {
            return false;
        }
        return rows == other.rows && cols == other.cols && Arrays.equals(squares, other.squares);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(rows);
        result = 31 * result + Integer.hashCode(cols);
        result = 31 * result + Arrays.hashCode(squares);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (int row = 0; row < rows; row++) {
            if (row > 0) {
                builder.append('\n');
            }
            for (int col = 0; col < cols; col++) {
                builder.append(get(row, col) == DiagonalDirection.DR ? '\\' : '/');
            }
        }
        return builder.toString();
    }
}

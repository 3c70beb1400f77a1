package com.circuitchallenge.generator;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class DiagonalGridTest {

    @Test
    void forCellsHasOneSquarePerInteriorCrossing() {
        DiagonalGrid grid = DiagonalGrid.forCells(4, 5);
        assertEquals(3, grid.rows());
        assertEquals(4, grid.cols());
        assertEquals(12, grid.count(DiagonalDirection.DR));
    }

    @Test
    void setAndGetRoundTrip() {
        DiagonalGrid grid = new DiagonalGrid(2, 3);
        grid.set(1, 2, DiagonalDirection.DL);
        assertEquals(DiagonalDirection.DL, grid.get(1, 2));
        assertEquals(DiagonalDirection.DR, grid.get(0, 0));
        assertEquals(1, grid.count(DiagonalDirection.DL));
    }

    @Test
    void rejectsOutOfRangeSquares() {
        DiagonalGrid grid = new DiagonalGrid(2, 2);
        assertThrows(IndexOutOfBoundsException.class, () -> grid.get(2, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> grid.set(0, -1, DiagonalDirection.DR));
        assertThrows(IllegalArgumentException.class, () -> grid.set(0, 0, null));
    }

    @Test
    void equalityFollowsContents() {
        DiagonalGrid first = new DiagonalGrid(2, 2);
        DiagonalGrid second = new DiagonalGrid(2, 2);
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        second.set(0, 1, DiagonalDirection.DL);
        assertNotEquals(first, second);
        assertEquals("\\/\n\\\\", second.toString());
    }
}

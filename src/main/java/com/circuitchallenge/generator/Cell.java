package com.circuitchallenge.generator;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record Cell(
        int row,
        int col,
        String expression,
        Integer answer,
        @JsonProperty("isStart") boolean isStart,
        @JsonProperty("isFinish") boolean isFinish) {

    public Cell {
        Objects.requireNonNull(expression, "expression");
    }

    public static Cell finish(int row, int col) {
        return new Cell(row, col, "", null, false, true);
    }

    @JsonIgnore
    public Coordinate coordinate() {
        return new Coordinate(row, col);
    }
}

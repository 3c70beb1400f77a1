package com.circuitchallenge.generator;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Solution(List<Coordinate> path) {

    public Solution {
        Objects.requireNonNull(path, "path");
        path = List.copyOf(path);
    }

    @JsonProperty("steps")
    public int steps() {
        return Math.max(path.size() - 1, 0);
    }
}

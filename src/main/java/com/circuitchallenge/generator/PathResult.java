package com.circuitchallenge.generator;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a path search. Diagonal commitments are keyed by the top-left cell of the unit square.
 */
public record PathResult(boolean success, List<Coordinate> path, Map<Coordinate, DiagonalDirection> diagonalCommitments, String error) {

    public PathResult {
        path = List.copyOf(path);
        diagonalCommitments = Map.copyOf(diagonalCommitments);
    }

    public static PathResult found(List<Coordinate> path, Map<Coordinate, DiagonalDirection> diagonalCommitments) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(diagonalCommitments, "diagonalCommitments");
        return new PathResult(true, path, diagonalCommitments, null);
    }

    public static PathResult failure(String error) {
        return new PathResult(false, List.of(), Map.of(), error);
    }
}

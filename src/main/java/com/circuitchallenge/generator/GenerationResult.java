package com.circuitchallenge.generator;

import java.util.Objects;
import java.util.Optional;

public record GenerationResult(boolean success, Puzzle puzzle, GenerationFailure failure, String error, int attempts) {

    public static GenerationResult succeeded(Puzzle puzzle, int attempts) {
        Objects.requireNonNull(puzzle, "puzzle");
        return new GenerationResult(true, puzzle, null, null, attempts);
    }

    public static GenerationResult failed(GenerationFailure failure, String error, int attempts) {
        Objects.requireNonNull(failure, "failure");
        return new GenerationResult(false, null, failure, error, attempts);
    }

    public Optional<Puzzle> puzzleIfPresent() {
        return Optional.ofNullable(puzzle);
    }
}

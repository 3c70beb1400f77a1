package com.circuitchallenge.batch;

import java.util.List;

import com.circuitchallenge.generator.Puzzle;

public record BatchResult(int requested, List<Puzzle> puzzles, List<String> failures) {

    public BatchResult {
        puzzles = List.copyOf(puzzles);
        failures = List.copyOf(failures);
    }

    public int shortfall() {
        return requested - puzzles.size();
    }
}

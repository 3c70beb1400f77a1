package com.circuitchallenge.web;

import java.util.List;

import com.circuitchallenge.generator.Puzzle;

public record BatchResponse(
        String settingsName,
        long seed,
        int requested,
        int generated,
        int shortfall,
        List<Puzzle> puzzles,
        List<String> failures
) {
}

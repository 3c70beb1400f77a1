package com.circuitchallenge.web;

import com.circuitchallenge.generator.Puzzle;

public record GenerateResponse(
        String settingsName,
        long seed,
        int attempts,
        Puzzle puzzle
) {
}

package com.circuitchallenge.web;

import com.circuitchallenge.difficulty.DifficultyOverrides;

public record GenerateRequest(
        Integer level,
        Integer chapter,
        Integer storyLevel,
        DifficultyOverrides custom,
        Long seed
) {
}

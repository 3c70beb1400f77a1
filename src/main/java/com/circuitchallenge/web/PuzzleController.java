package com.circuitchallenge.web;

import com.circuitchallenge.batch.BatchResult;
import com.circuitchallenge.batch.PuzzleBatchService;
import com.circuitchallenge.config.AppProperties;
import com.circuitchallenge.difficulty.DifficultyOverrides;
import com.circuitchallenge.difficulty.DifficultyPresets;
import com.circuitchallenge.difficulty.DifficultySettings;
import com.circuitchallenge.difficulty.StoryDifficulty;
import com.circuitchallenge.difficulty.StoryLevel;
import com.circuitchallenge.generator.GenerationResult;
import com.circuitchallenge.generator.PuzzleGenerator;
import com.circuitchallenge.generator.ValidationResult;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping
public class PuzzleController {

    static final int DEFAULT_LEVEL = 3;
    static final int DEFAULT_BATCH_COUNT = 10;

    private static final Logger log = LoggerFactory.getLogger(PuzzleController.class);

    private final PuzzleGenerator puzzleGenerator;
    private final PuzzleBatchService batchService;
    private final AppProperties properties;

    public PuzzleController(PuzzleGenerator puzzleGenerator, PuzzleBatchService batchService, AppProperties properties) {
        this.puzzleGenerator = puzzleGenerator;
        this.batchService = batchService;
        this.properties = properties;
    }

    @PostMapping(path = "/puzzles/generate", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public GenerateResponse generate(@RequestBody GenerateRequest request) {
        DifficultySettings settings = resolveSettings(request);
        long seed = request.seed() != null ? request.seed() : ThreadLocalRandom.current().nextLong();

        GenerationResult result;
        try {
            result = puzzleGenerator.generatePuzzle(settings, properties.generationOptions(), new Random(seed));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
        if (!result.success()) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY,
                    "Couldn't generate a puzzle, try again: " + result.error());
        }
        log.debug("Served puzzle {} for '{}' (seed={})", result.puzzle().id(), settings.name(), seed);
        return new GenerateResponse(settings.name(), seed, result.attempts(), result.puzzle());
    }

    @PostMapping(path = "/puzzles/batch", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public BatchResponse batch(@RequestBody BatchRequest request) {
        DifficultySettings settings = DifficultyPresets.byLevel(request.level() != null ? request.level() : DEFAULT_LEVEL);
        int count = request.count() != null ? request.count() : DEFAULT_BATCH_COUNT;
        long seed = request.seed() != null ? request.seed() : ThreadLocalRandom.current().nextLong();

        BatchResult result;
        try {
            result = batchService.generateBatch(count, settings, seed);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
        return new BatchResponse(
                settings.name(),
                seed,
                result.requested(),
                result.puzzles().size(),
                result.shortfall(),
                result.puzzles(),
                result.failures());
    }

    @GetMapping(path = "/difficulty/presets", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<DifficultySettings> presets() {
        return DifficultyPresets.all();
    }

    @PostMapping(path = "/difficulty/validate", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ValidationResult validate(@RequestBody DifficultyOverrides overrides) {
        return DifficultyPresets.validateDifficultySettings(DifficultyPresets.createCustomDifficulty(overrides));
    }

    private DifficultySettings resolveSettings(GenerateRequest request) {
        if (request.custom() != null) {
            DifficultySettings custom = DifficultyPresets.createCustomDifficulty(request.custom());
            ValidationResult validation = DifficultyPresets.validateDifficultySettings(custom);
            if (!validation.valid()) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "Invalid difficulty: " + String.join("; ", validation.errors()));
            }
            return custom;
        }
        if (request.chapter() != null) {
            int level = request.storyLevel() != null ? request.storyLevel() : 1;
            try {
                return StoryDifficulty.settings(new StoryLevel(request.chapter(), level));
            } catch (IllegalArgumentException ex) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
            }
        }
        return DifficultyPresets.byLevel(request.level() != null ? request.level() : DEFAULT_LEVEL);
    }
}

package com.circuitchallenge.batch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import com.circuitchallenge.config.AppProperties;
import com.circuitchallenge.difficulty.DifficultySettings;
import com.circuitchallenge.generator.GenerationOptions;
import com.circuitchallenge.generator.GenerationResult;
import com.circuitchallenge.generator.Puzzle;
import com.circuitchallenge.generator.PuzzleGenerator;

@Service
public class PuzzleBatchService {

    private static final Logger log = LoggerFactory.getLogger(PuzzleBatchService.class);

    private final PuzzleGenerator puzzleGenerator;
    private final AppProperties properties;
    private final TaskExecutor taskExecutor;

    public PuzzleBatchService(
            PuzzleGenerator puzzleGenerator,
            AppProperties properties,
            @Qualifier("applicationTaskExecutor") TaskExecutor taskExecutor) {
        this.puzzleGenerator = puzzleGenerator;
        this.properties = properties;
        this.taskExecutor = taskExecutor;
    }

    /**
     * Generates up to {@code count} puzzles, one random stream per slot. A slot that fails is
     * regenerated once and then dropped; the result keeps slot order.
     */
    public BatchResult generateBatch(int count, DifficultySettings settings, long seed) {
        Objects.requireNonNull(settings, "settings");
        if (count <= 0 || count > properties.getBatchMaxCount()) {
            throw new IllegalArgumentException("Batch count must be between 1 and " + properties.getBatchMaxCount());
        }
        PuzzleGenerator.requireGeneratable(settings);
        GenerationOptions options = properties.generationOptions();
        List<CompletableFuture<SlotOutcome>> slots = new ArrayList<>(count);
        for (int index = 0; index < count; index++) {
            int slot = index;
            slots.add(CompletableFuture.supplyAsync(() -> generateSlot(slot, settings, options, seed), taskExecutor));
        }

        List<SlotOutcome> outcomes = new ArrayList<>(count);
        for (CompletableFuture<SlotOutcome> slot : slots) {
            try {
                outcomes.add(slot.join());
            } catch (CompletionException ex) {
                if (ex.getCause() instanceof RuntimeException cause) {
                    throw cause;
                }
                throw ex;
            }
        }

        List<Puzzle> puzzles = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (SlotOutcome outcome : outcomes) {
            if (outcome.result().success()) {
                puzzles.add(outcome.result().puzzle());
            } else {
                failures.add("Puzzle " + (outcome.slot() + 1) + ": " + outcome.result().error());
            }
        }
        BatchResult result = new BatchResult(count, puzzles, failures);
        if (result.shortfall() > 0) {
            log.warn("Batch for '{}' produced {} of {} puzzles (seed={})",
                    settings.name(), puzzles.size(), count, seed);
        } else {
            log.info("Batch for '{}' produced {} puzzles (seed={})", settings.name(), puzzles.size(), seed);
        }
        return result;
    }

    private SlotOutcome generateSlot(int slot, DifficultySettings settings, GenerationOptions options, long seed) {
        Random random = new Random(seed + slot);
        GenerationResult result = puzzleGenerator.generatePuzzle(settings, options, random);
        if (!result.success()) {
            log.debug("Puzzle {} of batch failed, regenerating once: {}", slot + 1, result.error());
            result = puzzleGenerator.generatePuzzle(settings, options, random);
        }
        return new SlotOutcome(slot, result);
    }

    private record SlotOutcome(int slot, GenerationResult result) {
    }
}

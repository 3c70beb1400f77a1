package com.circuitchallenge.difficulty;

import java.util.Locale;
import java.util.Optional;

/**
 * A story-mode stage, displayed as chapter plus letter ("3-C" is chapter 3, level 3).
 */
public record StoryLevel(int chapter, int level) {

    public static final int LEVELS_PER_CHAPTER = 5;
    private static final String LETTERS = "ABCDE";

    public StoryLevel {
        if (level < 1 || level > LEVELS_PER_CHAPTER) {
            throw new IllegalArgumentException("Story level must be between 1 and " + LEVELS_PER_CHAPTER + " but was " + level);
        }
    }

    public static Optional<StoryLevel> from(int chapter, String letter) {
        if (letter == null || letter.trim().length() != 1) {
            return Optional.empty();
        }
        int index = LETTERS.indexOf(letter.trim().toUpperCase(Locale.ROOT));
        return index < 0 ? Optional.empty() : Optional.of(new StoryLevel(chapter, index + 1));
    }

    public String levelLetter() {
        return String.valueOf(LETTERS.charAt(level - 1));
    }

    public String displayName() {
        return chapter + "-" + levelLetter();
    }
}

package com.circuitchallenge.generator;

import java.util.List;

/**
 * Decides whether a complete START to FINISH path is varied enough to be worth playing.
 */
@FunctionalInterface
public interface PathShapePolicy {

    boolean accepts(List<Coordinate> path);

    static PathShapePolicy minimumTurns() {
        return path -> countTurns(path) >= requiredTurns(path.size());
    }

    static PathShapePolicy any() {
        return path -> true;
    }

    static int requiredTurns(int pathLength) {
        if (pathLength < 6) {
            return 1;
        }
        if (pathLength < 8) {
            return 2;
        }
        return 3;
    }

    static int countTurns(List<Coordinate> path) {
        if (path.size() < 3) {
            return 0;
        }
        int turns = 0;
        int previousRowStep = path.get(1).row() - path.get(0).row();
        int previousColStep = path.get(1).col() - path.get(0).col();
        for (int i = 2; i < path.size(); i++) {
            int rowStep = path.get(i).row() - path.get(i - 1).row();
            int colStep = path.get(i).col() - path.get(i - 1).col();
            if (rowStep != previousRowStep || colStep != previousColStep) {
                turns++;
            }
            previousRowStep = rowStep;
            previousColStep = colStep;
        }
        return turns;
    }
}

package com.circuitchallenge.generator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Colours the connector graph so that connectors sharing a cell never share a value.
 * Greedy most-constrained-first seeding, then min-conflicts repair with a random walk,
 * restarted a bounded number of times.
 */
final class ConnectorValueSolver {

    static final int MAX_RESTARTS = 8;
    private static final int TIGHT_RANGE = 8;
    private static final int STRUCTURED_CLASSES = 6;
    private static final int MIN_REPAIR_STEPS = 2_000;
    private static final int REPAIR_STEPS_PER_CONNECTOR = 60;
    private static final double RANDOM_WALK_PROBABILITY = 0.1;
    private static final int UNASSIGNED = Integer.MIN_VALUE;

    private final List<UnvaluedConnector> connectors;
    private final int[][] domains;
    private final int[][] neighbors;
    private final int minValue;
    private final int maxValue;
    private final Random random;

    ConnectorValueSolver(List<UnvaluedConnector> connectors, int[][] domains, int minValue, int maxValue, Random random) {
        if (domains.length != connectors.size()) {
            throw new IllegalArgumentException("Expected one domain per connector");
        }
        this.connectors = connectors;
        this.domains = domains;
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.random = random;
        this.neighbors = buildNeighbors(connectors);
    }

    Optional<int[]> solve() {
        // Near the six-value floor the structured colouring is tried first.
        int structuredRestart = rangeSize() <= TIGHT_RANGE ? 0 : 1;
        for (int restart = 0; restart < MAX_RESTARTS; restart++) {
            boolean structured = restart == structuredRestart && rangeSize() >= STRUCTURED_CLASSES;
            int[] values = structured ? structuredSeed() : greedySeed();
            if (repair(values)) {
                if (structured) {
                    diversify(values);
                }
                return Optional.of(values);
            }
        }
        return Optional.empty();
    }

    private int rangeSize() {
        return maxValue - minValue + 1;
    }

    private int[] greedySeed() {
        int size = connectors.size();
        int[] values = new int[size];
        Arrays.fill(values, UNASSIGNED);
        List<Integer> ties = new ArrayList<>();
        for (int step = 0; step < size; step++) {
            int fewest = Integer.MAX_VALUE;
            ties.clear();
            for (int i = 0; i < size; i++) {
                if (values[i] != UNASSIGNED) {
                    continue;
                }
                int available = availableValues(i, values).size();
                if (available < fewest) {
                    fewest = available;
                    ties.clear();
                    ties.add(i);
                } else if (available == fewest) {
                    ties.add(i);
                }
            }
            int chosen = ties.get(random.nextInt(ties.size()));
            List<Integer> options = availableValues(chosen, values);
            values[chosen] = options.isEmpty()
                    ? randomDomainValue(chosen)
                    : options.get(random.nextInt(options.size()));
        }
        return values;
    }

    // Horizontal edges by column parity, vertical by row parity, diagonals alternating along their chains.
    private int[] structuredSeed() {
        int size = connectors.size();
        int[] diagonalClass = new int[size];
        Arrays.fill(diagonalClass, -1);
        for (int i = 0; i < size; i++) {
            if (connectors.get(i).type() != ConnectorType.DIAGONAL || diagonalClass[i] >= 0) {
                continue;
            }
            diagonalClass[i] = 0;
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(i);
            while (!queue.isEmpty()) {
                int current = queue.poll();
                for (int neighbor : neighbors[current]) {
                    if (connectors.get(neighbor).type() == ConnectorType.DIAGONAL && diagonalClass[neighbor] < 0) {
                        diagonalClass[neighbor] = 1 - diagonalClass[current];
                        queue.add(neighbor);
                    }
                }
            }
        }

        List<Integer> palette = new ArrayList<>(rangeSize());
        for (int value = minValue; value <= maxValue; value++) {
            palette.add(value);
        }
        Collections.shuffle(palette, random);

        int[] values = new int[size];
        for (int i = 0; i < size; i++) {
            UnvaluedConnector connector = connectors.get(i);
            int colourClass = switch (connector.type()) {
                case HORIZONTAL -> Math.min(connector.cellA().col(), connector.cellB().col()) % 2;
                case VERTICAL -> 2 + Math.min(connector.cellA().row(), connector.cellB().row()) % 2;
                case DIAGONAL -> 4 + diagonalClass[i];
            };
            values[i] = palette.get(colourClass);
        }
        return values;
    }

    private boolean repair(int[] values) {
        int budget = Math.max(MIN_REPAIR_STEPS, connectors.size() * REPAIR_STEPS_PER_CONNECTOR);
        int[] counts = new int[rangeSize()];
        List<Integer> ties = new ArrayList<>();
        for (int step = 0; step < budget; step++) {
            List<Integer> conflicted = conflicted(values);
            if (conflicted.isEmpty()) {
                return true;
            }
            int index = conflicted.get(random.nextInt(conflicted.size()));
            if (random.nextDouble() < RANDOM_WALK_PROBABILITY) {
                values[index] = randomDomainValue(index);
                continue;
            }
            Arrays.fill(counts, 0);
            for (int neighbor : neighbors[index]) {
                counts[values[neighbor] - minValue]++;
            }
            int fewest = Integer.MAX_VALUE;
            ties.clear();
            for (int value : domains[index]) {
                if (value == values[index] && domains[index].length > 1) {
                    continue;
                }
                int clashes = counts[value - minValue];
                if (clashes < fewest) {
                    fewest = clashes;
                    ties.clear();
                    ties.add(value);
                } else if (clashes == fewest) {
                    ties.add(value);
                }
            }
            values[index] = ties.get(random.nextInt(ties.size()));
        }
        return conflicted(values).isEmpty();
    }

    private void diversify(int[] values) {
        int passes = connectors.size() * 2;
        for (int pass = 0; pass < passes; pass++) {
            int index = random.nextInt(values.length);
            List<Integer> options = availableValues(index, values);
            if (!options.isEmpty()) {
                values[index] = options.get(random.nextInt(options.size()));
            }
        }
    }

    private List<Integer> conflicted(int[] values) {
        List<Integer> conflicted = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (!inDomain(i, values[i])) {
                conflicted.add(i);
                continue;
            }
            for (int neighbor : neighbors[i]) {
                if (values[neighbor] == values[i]) {
                    conflicted.add(i);
                    break;
                }
            }
        }
        return conflicted;
    }

    private List<Integer> availableValues(int index, int[] values) {
        boolean[] used = new boolean[rangeSize()];
        for (int neighbor : neighbors[index]) {
            int value = values[neighbor];
            if (value != UNASSIGNED) {
                used[value - minValue] = true;
            }
        }
        List<Integer> available = new ArrayList<>();
        for (int value : domains[index]) {
            if (!used[value - minValue]) {
                available.add(value);
            }
        }
        return available;
    }

    private boolean inDomain(int index, int value) {
        return Arrays.binarySearch(domains[index], value) >= 0;
    }

    private int randomDomainValue(int index) {
        int[] domain = domains[index];
        return domain[random.nextInt(domain.length)];
    }

    private static int[][] buildNeighbors(List<UnvaluedConnector> connectors) {
        Map<Coordinate, List<Integer>> incident = new LinkedHashMap<>();
        for (int i = 0; i < connectors.size(); i++) {
            UnvaluedConnector connector = connectors.get(i);
            incident.computeIfAbsent(connector.cellA(), key -> new ArrayList<>()).add(i);
            incident.computeIfAbsent(connector.cellB(), key -> new ArrayList<>()).add(i);
        }
        int[][] neighbors = new int[connectors.size()][];
        for (int i = 0; i < connectors.size(); i++) {
            UnvaluedConnector connector = connectors.get(i);
            Set<Integer> adjacent = new LinkedHashSet<>(incident.get(connector.cellA()));
            adjacent.addAll(incident.get(connector.cellB()));
            adjacent.remove(i);
            neighbors[i] = adjacent.stream().mapToInt(Integer::intValue).toArray();
        }
        return neighbors;
    }
}

package com.circuitchallenge.generator;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Decides the answer every cell must show. Path cells answer with the value of the connector
 * leading to the next path cell; off-path cells answer with one randomly chosen incident connector,
 * so each of them still points to exactly one neighbour.
 */
public final class CellAssigner {

    private CellAssigner() {
    }

    public static CellAnswers assignCellAnswers(
            int rows,
            int cols,
            List<Coordinate> path,
            List<Connector> connectors,
            Set<Integer> divisionConnectorIndices,
            Random random) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(connectors, "connectors");
        Objects.requireNonNull(divisionConnectorIndices, "divisionConnectorIndices");
        Objects.requireNonNull(random, "random");
        if (path.size() < 2) {
            throw new IllegalArgumentException("Solution path needs at least two cells");
        }

        Map<Coordinate, Integer> answers = new LinkedHashMap<>();
        Set<Coordinate> divisionCells = new HashSet<>();
        Set<Connector> divisionConnectors = new HashSet<>();
        for (int index : divisionConnectorIndices) {
            divisionConnectors.add(connectors.get(index));
        }

        for (int step = 0; step < path.size() - 1; step++) {
            Coordinate current = path.get(step);
            Coordinate next = path.get(step + 1);
            Optional<Connector> outgoing = ConnectorBuilder.getConnector(connectors, current, next);
            if (outgoing.isEmpty()) {
                throw new IllegalStateException("No connector between consecutive path cells " + current + " and " + next);
            }
            answers.put(current, outgoing.get().value());
            if (divisionConnectors.contains(outgoing.get())) {
                divisionCells.add(current);
            }
        }

        Coordinate finish = new Coordinate(rows - 1, cols - 1);
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                Coordinate cell = new Coordinate(row, col);
                if (cell.equals(finish) || answers.containsKey(cell)) {
                    continue;
                }
                List<Connector> incident = ConnectorBuilder.getConnectors(connectors, cell);
                if (incident.isEmpty()) {
                    throw new IllegalStateException("Cell " + cell + " has no connectors");
                }
                answers.put(cell, incident.get(random.nextInt(incident.size())).value());
            }
        }
        return new CellAnswers(answers, divisionCells);
    }

    public record CellAnswers(Map<Coordinate, Integer> answers, Set<Coordinate> divisionCells) {

        public CellAnswers {
            answers = Map.copyOf(answers);
            divisionCells = Set.copyOf(divisionCells);
        }

        public Integer answerFor(Coordinate cell) {
            return answers.get(cell);
        }

        public boolean prefersDivision(Coordinate cell) {
            return divisionCells.contains(cell);
        }
    }
}

package com.circuitchallenge.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record Puzzle(String id, int difficultyLevel, List<List<Cell>> grid, List<Connector> connectors, Solution solution) {

    public Puzzle {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(connectors, "connectors");
        Objects.requireNonNull(solution, "solution");
        List<List<Cell>> rowsCopy = new ArrayList<>(grid.size());
        for (List<Cell> row : grid) {
            rowsCopy.add(List.copyOf(row));
        }
        grid = List.copyOf(rowsCopy);
        connectors = List.copyOf(connectors);
    }

    public int rows() {
        return grid.size();
    }

    public int cols() {
        return grid.isEmpty() ? 0 : grid.get(0).size();
    }

    public Optional<Cell> cell(Coordinate coordinate) {
        if (coordinate.row() < 0 || coordinate.row() >= grid.size()) {
            return Optional.empty();
        }
        List<Cell> row = grid.get(coordinate.row());
        if (coordinate.col() < 0 || coordinate.col() >= row.size()) {
            return Optional.empty();
        }
        return Optional.of(row.get(coordinate.col()));
    }

    public List<Connector> connectorsFor(Coordinate coordinate) {
        return ConnectorBuilder.getConnectors(connectors, coordinate);
    }

    public Optional<Connector> connectorBetween(Coordinate a, Coordinate b) {
        return ConnectorBuilder.getConnector(connectors, a, b);
    }
}

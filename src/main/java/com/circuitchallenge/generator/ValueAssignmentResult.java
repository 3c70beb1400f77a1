package com.circuitchallenge.generator;

import java.util.List;
import java.util.Objects;
import java.util.Set;

public record ValueAssignmentResult(boolean success, List<Connector> connectors, Set<Integer> divisionConnectorIndices, String error) {

    public ValueAssignmentResult {
        connectors = List.copyOf(connectors);
        divisionConnectorIndices = Set.copyOf(divisionConnectorIndices);
    }

    public static ValueAssignmentResult assigned(List<Connector> connectors, Set<Integer> divisionConnectorIndices) {
        Objects.requireNonNull(connectors, "connectors");
        Objects.requireNonNull(divisionConnectorIndices, "divisionConnectorIndices");
        return new ValueAssignmentResult(true, connectors, divisionConnectorIndices, null);
    }

    public static ValueAssignmentResult failure(String error) {
        return new ValueAssignmentResult(false, List.of(), Set.of(), error);
    }
}

package com.circuitchallenge.generator;

public enum ConnectorType {
    HORIZONTAL,
    VERTICAL,
    DIAGONAL
}

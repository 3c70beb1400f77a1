package com.circuitchallenge.web;

public record BatchRequest(
        Integer count,
        Integer level,
        Long seed
) {
}

package com.circuitchallenge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CircuitChallengeGeneratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CircuitChallengeGeneratorApplication.class, args);
    }
}

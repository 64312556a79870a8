package com.di.tablenova.resilience;

public class CircuitOpenException extends RuntimeException {

    public CircuitOpenException(String operationName) {
        super("Circuit breaker open for operation " + operationName);
    }
}

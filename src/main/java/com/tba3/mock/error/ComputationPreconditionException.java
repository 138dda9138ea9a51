package com.tba3.mock.error;

public class ComputationPreconditionException extends RuntimeException {
    public ComputationPreconditionException(String message) {
        super(message);
    }
}

package com.bank.monitor.engine;

/**
 * Raised when a batch cannot be read as a mapping of metric name to count.
 * Monitor state is left untouched.
 */
public class InvalidBatchException extends IllegalArgumentException {

    public InvalidBatchException(String message) {
        super(message);
    }
}

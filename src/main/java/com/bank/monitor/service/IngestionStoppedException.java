package com.bank.monitor.service;

/**
 * Raised when a batch arrives after the ingestion service has stopped accepting work.
 */
public class IngestionStoppedException extends IllegalStateException {

    public IngestionStoppedException(String message) {
        super(message);
    }
}

package com.bank.monitor.engine;

public class AlertDeliveryException extends RuntimeException {

    public AlertDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}

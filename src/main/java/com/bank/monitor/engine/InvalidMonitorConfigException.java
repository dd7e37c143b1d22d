package com.bank.monitor.engine;

/**
 * Raised when an {@link AnomalyMonitor} is built from unusable settings.
 */
public class InvalidMonitorConfigException extends IllegalArgumentException {

    public InvalidMonitorConfigException(String message) {
        super(message);
    }
}

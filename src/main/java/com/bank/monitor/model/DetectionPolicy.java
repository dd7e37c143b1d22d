package com.bank.monitor.model;

/**
 * How a tracked metric is judged.
 */
public enum DetectionPolicy {
    /** Fixed ceiling, history is ignored. Used for zero-tolerance metrics such as failures. */
    STATIC_CEILING,
    /** Z-score against the metric's own rolling window. */
    ADAPTIVE_ZSCORE
}

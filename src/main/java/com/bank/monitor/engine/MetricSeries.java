package com.bank.monitor.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity rolling history of per-minute counts for one metric.
 *
 * Backed by a circular buffer: appending at capacity overwrites the oldest sample,
 * so memory stays bounded no matter how long the monitor runs. Statistics are
 * recomputed on demand, which is cheap for windows of a few hundred samples.
 *
 * Not thread-safe; {@link AnomalyMonitor} guards access.
 */
public class MetricSeries {

    private final String metric;
    private final long[] buffer;
    private int head;   // index of the oldest sample
    private int size;

    public MetricSeries(String metric, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        }
        this.metric = metric;
        this.buffer = new long[capacity];
    }

    public String getMetric() {
        return metric;
    }

    public int capacity() {
        return buffer.length;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isFull() {
        return size == buffer.length;
    }

    /**
     * Append the newest sample, evicting the oldest one when at capacity.
     */
    public void append(long value) {
        if (!isFull()) {
            buffer[(head + size) % buffer.length] = value;
            size++;
        } else {
            buffer[head] = value;
            head = (head + 1) % buffer.length;
        }
    }

    /**
     * Arithmetic mean of the held samples, 0 when empty.
     */
    public double mean() {
        if (isEmpty()) return 0.0;
        double sum = 0.0;
        for (int i = 0; i < size; i++) {
            sum += buffer[(head + i) % buffer.length];
        }
        return sum / size;
    }

    /**
     * Population standard deviation of the held samples, 0 when empty.
     */
    public double stdDev() {
        if (isEmpty()) return 0.0;
        double mean = mean();
        double squares = 0.0;
        for (int i = 0; i < size; i++) {
            double diff = buffer[(head + i) % buffer.length] - mean;
            squares += diff * diff;
        }
        return Math.sqrt(squares / size);
    }

    /**
     * Copy of the held samples, oldest first.
     */
    public List<Long> snapshot() {
        List<Long> values = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            values.add(buffer[(head + i) % buffer.length]);
        }
        return values;
    }
}

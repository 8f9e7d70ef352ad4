package com.streamfleet.core.metrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Rolling, time-windowed store of numeric samples keyed by metric name.
 * <p>
 * Samples older than the window are pruned whenever a new sample for the same
 * metric arrives. Queries look at a trailing period that is usually shorter
 * than the retention window (e.g. the scaling evaluation interval).
 * </p>
 * <p>
 * <b>Thread-safety:</b> all access is serialized on the collector's monitor.
 * </p>
 */
public class MetricsCollector {
    public static final String DEFAULT_SOURCE = "default";

    private final Duration window;
    private final Clock clock;
    private final Map<String, Deque<MetricSample>> samples = new HashMap<>();

    public MetricsCollector(Duration window) {
        this(window, Clock.systemUTC());
    }

    public MetricsCollector(Duration window, Clock clock) {
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Metrics window must be positive, got " + window);
        }
        this.window = window;
        this.clock = clock;
    }

    public void addMetric(String name, double value) {
        addMetric(name, value, DEFAULT_SOURCE);
    }

    public synchronized void addMetric(String name, double value, String source) {
        Instant now = clock.instant();
        Deque<MetricSample> series = samples.computeIfAbsent(name, n -> new ArrayDeque<>());
        series.addLast(new MetricSample(now, value, source));

        Instant cutoff = now.minus(window);
        while (!series.isEmpty() && !series.peekFirst().getTimestamp().isAfter(cutoff)) {
            series.removeFirst();
        }
    }

    /**
     * Average of the samples recorded within the trailing period.
     *
     * @return the average, or empty when no sample falls inside the period
     */
    public synchronized OptionalDouble getMetricAverage(String name, Duration period) {
        return recent(name, period).stream().mapToDouble(MetricSample::getValue).average();
    }

    /**
     * Maximum of the samples recorded within the trailing period.
     *
     * @return the maximum, or empty when no sample falls inside the period
     */
    public synchronized OptionalDouble getMetricMax(String name, Duration period) {
        return recent(name, period).stream().mapToDouble(MetricSample::getValue).max();
    }

    /**
     * Copy of every retained sample, grouped by metric name.
     */
    public synchronized Map<String, List<MetricSample>> getAllMetrics() {
        Map<String, List<MetricSample>> copy = new LinkedHashMap<>();
        samples.forEach((name, series) -> copy.put(name, List.copyOf(series)));
        return Collections.unmodifiableMap(copy);
    }

    public Duration getWindow() {
        return window;
    }

    private List<MetricSample> recent(String name, Duration period) {
        Deque<MetricSample> series = samples.get(name);
        if (series == null || series.isEmpty()) {
            return Collections.emptyList();
        }

        Instant cutoff = clock.instant().minus(period);
        return series.stream()
                .filter(sample -> sample.getTimestamp().isAfter(cutoff))
                .collect(Collectors.toList());
    }
}

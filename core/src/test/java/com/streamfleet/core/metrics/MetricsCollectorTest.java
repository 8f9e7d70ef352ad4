package com.streamfleet.core.metrics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricsCollectorTest {

    private SteppingClock clock;
    private MetricsCollector collector;

    @BeforeEach
    void setUp() {
        clock = new SteppingClock(Instant.parse("2024-01-01T00:00:00Z"));
        collector = new MetricsCollector(Duration.ofMinutes(5), clock);
    }

    @Test
    @DisplayName("Average and max only consider samples inside the trailing period")
    void testTrailingPeriodQueries() {
        collector.addMetric("cpu_usage", 90.0);
        clock.advance(Duration.ofSeconds(90));
        collector.addMetric("cpu_usage", 40.0);
        clock.advance(Duration.ofSeconds(10));
        collector.addMetric("cpu_usage", 60.0);

        assertEquals(50.0, collector.getMetricAverage("cpu_usage", Duration.ofSeconds(60)).getAsDouble(), 1e-9);
        assertEquals(60.0, collector.getMetricMax("cpu_usage", Duration.ofSeconds(60)).getAsDouble(), 1e-9);

        assertEquals(90.0, collector.getMetricMax("cpu_usage", Duration.ofMinutes(5)).getAsDouble(), 1e-9);
    }

    @Test
    @DisplayName("Unknown metric or empty period yields no value")
    void testNoSamples() {
        assertTrue(collector.getMetricAverage("missing", Duration.ofMinutes(1)).isEmpty());

        collector.addMetric("memory_usage", 10.0);
        clock.advance(Duration.ofMinutes(2));

        assertTrue(collector.getMetricAverage("memory_usage", Duration.ofMinutes(1)).isEmpty());
        assertTrue(collector.getMetricMax("memory_usage", Duration.ofMinutes(1)).isEmpty());
    }

    @Test
    @DisplayName("Samples older than the window are pruned when new ones arrive")
    void testPruning() {
        collector.addMetric("connections", 1.0, "lb");
        clock.advance(Duration.ofMinutes(4));
        collector.addMetric("connections", 2.0, "lb");
        clock.advance(Duration.ofMinutes(2));
        collector.addMetric("connections", 3.0, "lb");

        Map<String, List<MetricSample>> all = collector.getAllMetrics();
        List<MetricSample> series = all.get("connections");

        assertEquals(2, series.size());
        assertEquals(2.0, series.get(0).getValue());
        assertEquals("lb", series.get(1).getSource());
    }

    @Test
    void testInvalidWindow() {
        assertThrows(IllegalArgumentException.class, () -> new MetricsCollector(Duration.ZERO));
    }

    private static final class SteppingClock extends Clock {
        private Instant now;

        SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}

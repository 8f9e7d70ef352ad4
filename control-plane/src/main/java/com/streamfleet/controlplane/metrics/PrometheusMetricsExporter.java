package com.streamfleet.controlplane.metrics;

import com.streamfleet.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Attaches a Prometheus registry to reactor-netty's global composite so that control plane
 * meters and netty's own meters are exported from one scrape endpoint.
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this.registry = Metrics.REGISTRY;
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (registry instanceof CompositeMeterRegistry) {
            ((CompositeMeterRegistry) registry).add(prometheusRegistry);
        }

        registry.config().commonTags(MetricsTags.NODE_ID, nodeId);
        log.info("Metrics exporter initialized for {}", nodeId);
    }

    /**
     * Text exposition format for {@code GET /metrics}.
     */
    public String scrape() {
        return prometheusRegistry.scrape();
    }

    public void close() {
        if (registry instanceof CompositeMeterRegistry) {
            ((CompositeMeterRegistry) registry).remove(prometheusRegistry);
        }
        prometheusRegistry.close();
    }
}

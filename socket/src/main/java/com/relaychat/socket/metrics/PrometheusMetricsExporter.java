package com.relaychat.socket.metrics;

import com.relaychat.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Prometheus exporter attached to the global registry that Reactor Netty reports into,
 * so HTTP server metrics and pipeline metrics are scraped from one endpoint.
 * <p>
 * Every meter registered afterwards, Reactor Netty's included, carries the {@code node_id} tag.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this(Metrics.REGISTRY, nodeId);
    }

    public PrometheusMetricsExporter(MeterRegistry registry, String nodeId) {
        this.registry = registry;

        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.add(prometheusRegistry);
        }

        registry.config().commonTags(MetricsTags.NODE_ID, nodeId);
        log.info("Metrics exporter initialized for node {} (global registry + Prometheus)", nodeId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}

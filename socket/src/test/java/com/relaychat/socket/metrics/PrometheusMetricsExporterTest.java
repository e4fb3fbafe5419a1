package com.relaychat.socket.metrics;

import com.relaychat.socket.support.TestConfigs;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PrometheusMetricsExporterTest {

    @Test
    void testScrape_ForeignMetersCarryNodeId() {
        PrometheusMetricsExporter exporter = new PrometheusMetricsExporter(new CompositeMeterRegistry(), "node-m");

        // registered without tags, the way Reactor Netty registers its HTTP meters
        Counter.builder("reactor.netty.http.server.data.received").register(exporter.getRegistry()).increment();

        List<String> lines = samples(exporter.scrape(), "reactor_netty_http_server_data_received");
        assertFalse(lines.isEmpty());
        lines.forEach(line -> assertTrue(line.contains("node_id=\"node-m\""), line));
    }

    @Test
    void testScrape_PipelineMetersTaggedOnce() {
        PrometheusMetricsExporter exporter = new PrometheusMetricsExporter(new CompositeMeterRegistry(), "node-m");
        MetricsService metricsService = new MetricsService(exporter.getRegistry(),
            TestConfigs.defaults("node-m").build());

        metricsService.recordBusFailed();

        List<String> lines = samples(exporter.scrape(), "relay_bus_total");
        assertFalse(lines.isEmpty());
        for (String line : lines) {
            assertTrue(line.contains("node_id=\"node-m\""), line);
            assertEquals(line.indexOf("node_id"), line.lastIndexOf("node_id"), line);
        }
    }

    private static List<String> samples(String scrape, String metric) {
        return Arrays.stream(scrape.split("\n"))
            .filter(line -> line.startsWith(metric) && line.contains("{"))
            .collect(Collectors.toList());
    }
}

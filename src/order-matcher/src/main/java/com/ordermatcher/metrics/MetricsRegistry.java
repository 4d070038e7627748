package com.ordermatcher.metrics;

import io.prometheus.metrics.core.metrics.Counter;
import io.prometheus.metrics.core.metrics.Gauge;
import io.prometheus.metrics.core.metrics.Histogram;
import io.prometheus.metrics.exporter.httpserver.HTTPServer;
import io.prometheus.metrics.instrumentation.jvm.JvmMetrics;
import io.prometheus.metrics.model.registry.PrometheusRegistry;

import java.io.IOException;

/**
 * All Prometheus metrics for the order matcher, defined in one place.
 */
public class MetricsRegistry {

    // ---- Latency ----
    public final Histogram commandDuration;
    // name: om_command_duration_seconds

    public final Histogram matchPassDuration;
    // name: om_match_pass_duration_seconds

    // ---- Throughput ----
    public final Counter ordersAddedTotal;
    // name: om_orders_added_total

    public final Counter ordersCancelledTotal;
    // name: om_orders_cancelled_total

    public final Counter tradesTotal;
    // name: om_trades_total

    public final Counter tradeIntentsSkippedTotal;
    // name: om_trade_intents_skipped_total

    public final Counter ordersDroppedTotal;
    // name: om_orders_dropped_total

    public final Counter commandsRejectedTotal;
    // name: om_commands_rejected_total

    // ---- Book health ----
    public final Gauge bookDepth;
    // name: om_book_depth

    private final PrometheusRegistry registry;
    private HTTPServer httpServer;

    public MetricsRegistry() {
        this(PrometheusRegistry.defaultRegistry);
    }

    public MetricsRegistry(PrometheusRegistry registry) {
        this.registry = registry;

        commandDuration = Histogram.builder()
                .name("om_command_duration_seconds")
                .help("Time from command publication to command applied")
                .labelNames("command")
                .classicOnly()
                .classicUpperBounds(0.0001, 0.0005, 0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0)
                .register(registry);

        matchPassDuration = Histogram.builder()
                .name("om_match_pass_duration_seconds")
                .help("Time spent in one match pass over a product")
                .classicOnly()
                .classicUpperBounds(0.0001, 0.0005, 0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0)
                .register(registry);

        ordersAddedTotal = Counter.builder()
                .name("om_orders_added_total")
                .help("Orders added to the book")
                .labelNames("side")
                .register(registry);

        ordersCancelledTotal = Counter.builder()
                .name("om_orders_cancelled_total")
                .help("Orders removed by explicit cancellation")
                .labelNames("side")
                .register(registry);

        tradesTotal = Counter.builder()
                .name("om_trades_total")
                .help("Trades applied")
                .register(registry);

        tradeIntentsSkippedTotal = Counter.builder()
                .name("om_trade_intents_skipped_total")
                .help("Discovered crossing pairs skipped because an order was already gone")
                .register(registry);

        ordersDroppedTotal = Counter.builder()
                .name("om_orders_dropped_total")
                .help("Orders dropped by the price tolerance filter")
                .register(registry);

        commandsRejectedTotal = Counter.builder()
                .name("om_commands_rejected_total")
                .help("Commands rejected because the ring buffer was full")
                .register(registry);

        bookDepth = Gauge.builder()
                .name("om_book_depth")
                .help("Resting orders across all products")
                .labelNames("side")
                .register(registry);
    }

    /**
     * Register JVM metrics (GC, memory, threads).
     */
    public void registerJvmMetrics() {
        JvmMetrics.builder().register(registry);
    }

    /**
     * Start the Prometheus HTTP server on the given port.
     * Exposes /metrics endpoint for Prometheus scraping.
     */
    public void startHttpServer(int port) throws IOException {
        httpServer = HTTPServer.builder()
                .port(port)
                .registry(registry)
                .buildAndStart();
    }

    public PrometheusRegistry getRegistry() {
        return registry;
    }

    /**
     * Stop the Prometheus HTTP server.
     */
    public void close() {
        if (httpServer != null) {
            httpServer.close();
        }
    }
}

package com.ordermatcher;

import com.ordermatcher.codec.GsonOrderCodec;
import com.ordermatcher.config.EngineConfig;
import com.ordermatcher.disruptor.CommandSequencer;
import com.ordermatcher.disruptor.EngineCommandHandler;
import com.ordermatcher.engine.MatchingEngine;
import com.ordermatcher.logging.PeriodicStatsLogger;
import com.ordermatcher.metrics.MetricsRegistry;
import com.ordermatcher.publishing.TradeEventPublisher;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Wires a running order matcher from configuration.
 *
 * Startup sequence:
 * 1. Initialize MetricsRegistry (+ Prometheus HTTP server when METRICS_PORT is set)
 * 2. Initialize TradeEventPublisher when KAFKA_BOOTSTRAP is set
 * 3. Create the MatchingEngine with the Gson codec
 * 4. Create and start the CommandSequencer (LMAX Disruptor)
 * 5. Start the periodic stats logger
 *
 * {@link #close()} tears down in reverse order, draining published commands first.
 */
public class EngineRuntime implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EngineRuntime.class);

    private final EngineConfig config;
    private final MetricsRegistry metrics;
    private final TradeEventPublisher publisher;
    private final MatchingEngine engine;
    private final CommandSequencer sequencer;
    private final PeriodicStatsLogger statsLogger;
    private volatile boolean closed;

    private EngineRuntime(EngineConfig config, MetricsRegistry metrics, TradeEventPublisher publisher,
                          MatchingEngine engine, CommandSequencer sequencer,
                          PeriodicStatsLogger statsLogger) {
        this.config = config;
        this.metrics = metrics;
        this.publisher = publisher;
        this.engine = engine;
        this.sequencer = sequencer;
        this.statsLogger = statsLogger;
    }

    public static EngineRuntime start(EngineConfig config) {
        return start(config, PrometheusRegistry.defaultRegistry);
    }

    public static EngineRuntime start(EngineConfig config, PrometheusRegistry registry) {
        logger.info("Starting order matcher...");
        logger.info("Configuration: {}", config);

        // 1. Metrics
        MetricsRegistry metrics = new MetricsRegistry(registry);
        if (config.isMetricsServerEnabled()) {
            metrics.registerJvmMetrics();
            try {
                metrics.startHttpServer(config.getMetricsPort());
                logger.info("Prometheus metrics HTTP server started on port {}", config.getMetricsPort());
            } catch (IOException e) {
                throw new UncheckedIOException(
                    "Failed to start Prometheus HTTP server on port " + config.getMetricsPort(), e);
            }
        }

        // 2. Kafka publisher
        TradeEventPublisher publisher = null;
        if (config.isKafkaEnabled()) {
            publisher = new TradeEventPublisher(config.getKafkaBootstrap());
        } else {
            logger.info("KAFKA_BOOTSTRAP not set. Trade events will not be published.");
        }

        // 3. Engine
        MatchingEngine engine = new MatchingEngine(config.getPriceTolerance(), new GsonOrderCodec(), publisher);

        // 4. Command sequencer
        EngineCommandHandler handler = new EngineCommandHandler(engine, metrics, publisher);
        CommandSequencer sequencer = new CommandSequencer(handler, config.getRingBufferSize(), metrics);
        sequencer.start();

        // 5. Stats logger
        PeriodicStatsLogger statsLogger = new PeriodicStatsLogger(
                engine.getStats(), engine.getStore(), config.getStatsIntervalSeconds());
        statsLogger.start();

        logger.info("Order matcher is ready. Tolerance: {}, ring buffer: {}, metrics port: {}",
                config.getPriceTolerance(), config.getRingBufferSize(), config.getMetricsPort());
        return new EngineRuntime(config, metrics, publisher, engine, sequencer, statsLogger);
    }

    public MatchingEngine getEngine() {
        return engine;
    }

    public CommandSequencer getSequencer() {
        return sequencer;
    }

    public MetricsRegistry getMetrics() {
        return metrics;
    }

    public EngineConfig getConfig() {
        return config;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.info("Shutting down order matcher...");
        try {
            sequencer.shutdown();
        } catch (Exception e) {
            logger.warn("Error shutting down command sequencer: {}", e.getMessage());
        }
        if (publisher != null) {
            publisher.close();
        }

        statsLogger.logShutdownSummary();
        statsLogger.stop();

        metrics.close();
        logger.info("Order matcher shut down complete.");
    }
}

package com.ordermatcher.config;

import java.util.Map;

/**
 * Configuration parsed from environment variables.
 *
 * <ul>
 *   <li>{@code PRICE_TOLERANCE} - max deviation from the estimated market price
 *       kept on a price update (default 0.05, must be >= 0)</li>
 *   <li>{@code RING_BUFFER_SIZE} - command ring buffer slots, power of two (default 1024)</li>
 *   <li>{@code KAFKA_BOOTSTRAP} - Kafka bootstrap servers; empty disables trade publishing</li>
 *   <li>{@code METRICS_PORT} - Prometheus exporter port; 0 disables it (default 0)</li>
 *   <li>{@code STATS_INTERVAL_SECONDS} - periodic stats log interval (default 10)</li>
 * </ul>
 */
public class EngineConfig {

    private final double priceTolerance;
    private final int ringBufferSize;
    private final String kafkaBootstrap;
    private final int metricsPort;
    private final int statsIntervalSeconds;

    public EngineConfig(double priceTolerance, int ringBufferSize, String kafkaBootstrap,
                        int metricsPort, int statsIntervalSeconds) {
        if (!(priceTolerance >= 0)) {
            throw new IllegalArgumentException("PRICE_TOLERANCE must be >= 0: " + priceTolerance);
        }
        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1) {
            throw new IllegalArgumentException("RING_BUFFER_SIZE must be a power of two: " + ringBufferSize);
        }
        this.priceTolerance = priceTolerance;
        this.ringBufferSize = ringBufferSize;
        this.kafkaBootstrap = kafkaBootstrap == null ? "" : kafkaBootstrap;
        this.metricsPort = metricsPort;
        this.statsIntervalSeconds = statsIntervalSeconds;
    }

    /**
     * Parse configuration from environment variables with sensible defaults.
     */
    public static EngineConfig fromEnv() {
        return fromMap(System.getenv());
    }

    public static EngineConfig fromMap(Map<String, String> env) {
        double priceTolerance = getDouble(env, "PRICE_TOLERANCE", 0.05);
        int ringBufferSize = getInt(env, "RING_BUFFER_SIZE", 1024);
        String kafkaBootstrap = get(env, "KAFKA_BOOTSTRAP", "");
        int metricsPort = getInt(env, "METRICS_PORT", 0);
        int statsIntervalSeconds = getInt(env, "STATS_INTERVAL_SECONDS", 10);

        return new EngineConfig(priceTolerance, ringBufferSize, kafkaBootstrap,
                metricsPort, statsIntervalSeconds);
    }

    private static String get(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return (value != null && !value.isEmpty()) ? value : defaultValue;
    }

    private static int getInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value != null && !value.isEmpty()) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, String> env, String key, double defaultValue) {
        String value = env.get(key);
        if (value != null && !value.isEmpty()) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public double getPriceTolerance() {
        return priceTolerance;
    }

    public int getRingBufferSize() {
        return ringBufferSize;
    }

    public String getKafkaBootstrap() {
        return kafkaBootstrap;
    }

    public boolean isKafkaEnabled() {
        return !kafkaBootstrap.isEmpty();
    }

    public int getMetricsPort() {
        return metricsPort;
    }

    public boolean isMetricsServerEnabled() {
        return metricsPort > 0;
    }

    public int getStatsIntervalSeconds() {
        return statsIntervalSeconds;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "priceTolerance=" + priceTolerance +
                ", ringBufferSize=" + ringBufferSize +
                ", kafkaBootstrap='" + kafkaBootstrap + '\'' +
                ", metricsPort=" + metricsPort +
                ", statsIntervalSeconds=" + statsIntervalSeconds +
                '}';
    }
}

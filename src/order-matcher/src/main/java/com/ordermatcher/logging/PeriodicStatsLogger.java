package com.ordermatcher.logging;

import com.ordermatcher.book.OrderStore;
import com.ordermatcher.domain.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * Logs aggregate matching statistics every N seconds on a separate daemon thread.
 * Only reads atomic counters and per-book depth, so it never holds a book lock
 * for longer than a size read.
 */
public class PeriodicStatsLogger {

    private static final Logger logger = LoggerFactory.getLogger(PeriodicStatsLogger.class);

    private final MatchingStats stats;
    private final OrderStore store;
    private final int intervalSeconds;
    private final ScheduledExecutorService scheduler;

    private long lastBuyOrders;
    private long lastSellOrders;
    private long lastCancels;
    private long lastTrades;
    private long lastSkipped;
    private long lastDropped;

    public PeriodicStatsLogger(MatchingStats stats, OrderStore store, int intervalSeconds) {
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("Stats interval must be positive: " + intervalSeconds);
        }
        this.stats = stats;
        this.store = store;
        this.intervalSeconds = intervalSeconds;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "periodic-stats-logger");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        scheduler.scheduleAtFixedRate(this::logSummary, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        logger.info("Periodic stats logger started",
                keyValue("event", "STATS_LOGGER_STARTED"),
                keyValue("intervalSeconds", intervalSeconds));
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Log a final lifetime summary on shutdown.
     */
    public void logShutdownSummary() {
        long totalBuy = stats.buyOrdersAdded.get();
        long totalSell = stats.sellOrdersAdded.get();
        long totalTrades = stats.tradesExecuted.get();
        long totalOrders = totalBuy + totalSell;

        logger.info("Shutdown summary",
                keyValue("event", "SHUTDOWN_SUMMARY"),
                keyValue("totalBuyOrders", totalBuy),
                keyValue("totalSellOrders", totalSell),
                keyValue("totalOrders", totalOrders),
                keyValue("totalCancels", stats.ordersCancelled.get()),
                keyValue("totalMatchPasses", stats.matchPasses.get()),
                keyValue("totalTrades", totalTrades),
                keyValue("totalIntentsSkipped", stats.intentsSkipped.get()),
                keyValue("totalPriceUpdates", stats.priceUpdates.get()),
                keyValue("totalOrdersDropped", stats.ordersDropped.get()));
    }

    void logSummary() {
        try {
            long currentBuy = stats.buyOrdersAdded.get();
            long currentSell = stats.sellOrdersAdded.get();
            long currentCancels = stats.ordersCancelled.get();
            long currentTrades = stats.tradesExecuted.get();
            long currentSkipped = stats.intentsSkipped.get();
            long currentDropped = stats.ordersDropped.get();

            long deltaBuy = currentBuy - lastBuyOrders;
            long deltaSell = currentSell - lastSellOrders;
            long deltaCancels = currentCancels - lastCancels;
            long deltaTrades = currentTrades - lastTrades;
            long deltaSkipped = currentSkipped - lastSkipped;
            long deltaDropped = currentDropped - lastDropped;

            lastBuyOrders = currentBuy;
            lastSellOrders = currentSell;
            lastCancels = currentCancels;
            lastTrades = currentTrades;
            lastSkipped = currentSkipped;
            lastDropped = currentDropped;

            logger.info("Periodic summary",
                    keyValue("event", "PERIODIC_SUMMARY"),
                    keyValue("intervalSeconds", intervalSeconds),
                    keyValue("buyOrders", deltaBuy),
                    keyValue("sellOrders", deltaSell),
                    keyValue("cancels", deltaCancels),
                    keyValue("trades", deltaTrades),
                    keyValue("intentsSkipped", deltaSkipped),
                    keyValue("ordersDropped", deltaDropped),
                    keyValue("products", store.productIds().size()),
                    keyValue("buyDepth", store.depth(Side.BUY)),
                    keyValue("sellDepth", store.depth(Side.SELL)));
        } catch (Exception e) {
            logger.error("Error in periodic stats logging", e);
        }
    }
}

package com.ordermatcher.disruptor;

import com.lmax.disruptor.EventHandler;
import com.ordermatcher.domain.Order;
import com.ordermatcher.domain.Side;
import com.ordermatcher.engine.MatchingEngine;
import com.ordermatcher.matching.MatchPass;
import com.ordermatcher.metrics.MetricsRegistry;
import com.ordermatcher.pricing.RepriceResult;
import com.ordermatcher.publishing.TradeEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-threaded command processor. Runs on the one thread managed by the
 * Disruptor's BatchEventProcessor, so commands are applied strictly in
 * publication order.
 *
 * Processing per command:
 * 1. Apply the command to the engine
 * 2. Publish accepted orders (async, never blocks)
 * 3. Record metrics
 * 4. Clear the slot
 *
 * A failing command (for example an order with a non-positive amount) is
 * logged and skipped; the processor keeps running.
 */
public class EngineCommandHandler implements EventHandler<EngineCommand> {

    private static final Logger logger = LoggerFactory.getLogger(EngineCommandHandler.class);

    private final MatchingEngine engine;
    private final MetricsRegistry metrics;
    private final TradeEventPublisher publisher;

    public EngineCommandHandler(MatchingEngine engine, MetricsRegistry metrics,
                                TradeEventPublisher publisher) {
        this.engine = engine;
        this.metrics = metrics;
        this.publisher = publisher;
    }

    @Override
    public void onEvent(EngineCommand command, long sequence, boolean endOfBatch) {
        if (command.type == null) {
            // Slot was cleared or never populated
            return;
        }

        CommandType type = command.type;
        try {
            switch (type) {
                case ADD_BUY:
                    add(Side.BUY, command);
                    break;
                case ADD_SELL:
                    add(Side.SELL, command);
                    break;
                case CANCEL_BUY:
                    cancel(Side.BUY, command);
                    break;
                case CANCEL_SELL:
                    cancel(Side.SELL, command);
                    break;
                case MATCH:
                    match(command);
                    break;
                case UPDATE_PRICE:
                    updatePrice(command);
                    break;
                default:
                    logger.warn("Ignoring unknown command type {} at sequence {}", type, sequence);
                    return;
            }

            if (metrics != null) {
                metrics.commandDuration.labelValues(type.name().toLowerCase())
                        .observe(nanosToSeconds(System.nanoTime() - command.publishedNanos));
            }
        } catch (Exception e) {
            logger.error("Error processing {} command at sequence {}: {}",
                    type, sequence, e.getMessage(), e);
        } finally {
            command.clear();

            if (endOfBatch) {
                updateDepthGauges();
            }
        }
    }

    private void add(Side side, EngineCommand command) {
        Order order = new Order(command.orderId, command.kind, command.price, command.amount,
                command.priority, command.createdAt, command.productId);
        if (side == Side.BUY) {
            engine.addBuy(order);
        } else {
            engine.addSell(order);
        }
        if (metrics != null) {
            metrics.ordersAddedTotal.labelValues(side.name().toLowerCase()).inc();
        }
        if (publisher != null) {
            publisher.publishOrderAccepted(order, side);
        }
    }

    private void cancel(Side side, EngineCommand command) {
        boolean removed = side == Side.BUY
                ? engine.cancelBuy(command.productId, command.orderId)
                : engine.cancelSell(command.productId, command.orderId);
        if (removed && metrics != null) {
            metrics.ordersCancelledTotal.labelValues(side.name().toLowerCase()).inc();
        }
    }

    private void match(EngineCommand command) {
        long start = System.nanoTime();
        MatchPass pass = engine.match(command.productId);
        long end = System.nanoTime();
        if (metrics != null) {
            metrics.matchPassDuration.observe(nanosToSeconds(end - start));
            metrics.tradesTotal.inc(pass.getTradeCount());
            metrics.tradeIntentsSkippedTotal.inc(pass.getIntentsSkipped());
        }
    }

    private void updatePrice(EngineCommand command) {
        RepriceResult result = engine.updatePrice(command.productId, command.price);
        if (metrics != null) {
            metrics.ordersDroppedTotal.inc(result.getDroppedCount());
        }
    }

    private void updateDepthGauges() {
        if (metrics == null) {
            return;
        }
        metrics.bookDepth.labelValues("buy").set(engine.getStore().depth(Side.BUY));
        metrics.bookDepth.labelValues("sell").set(engine.getStore().depth(Side.SELL));
    }

    private static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }
}

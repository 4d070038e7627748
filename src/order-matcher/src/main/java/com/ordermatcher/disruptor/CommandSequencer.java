package com.ordermatcher.disruptor;

import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.ordermatcher.domain.Order;
import com.ordermatcher.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequenced command intake in front of the engine.
 *
 * Any number of threads may publish; a single consumer applies commands in
 * publication order. Publishing never blocks: when the ring buffer is full
 * the command is rejected and the tryXxx method returns false.
 */
public class CommandSequencer {

    private static final Logger logger = LoggerFactory.getLogger(CommandSequencer.class);

    private final Disruptor<EngineCommand> disruptor;
    private final EngineCommandHandler handler;
    private final MetricsRegistry metrics;
    private RingBuffer<EngineCommand> ringBuffer;

    public CommandSequencer(EngineCommandHandler handler, int ringBufferSize, MetricsRegistry metrics) {
        this.handler = handler;
        this.metrics = metrics;
        this.disruptor = new Disruptor<>(
                new EngineCommandFactory(),
                ringBufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new YieldingWaitStrategy()
        );
        disruptor.handleEventsWith(handler);
    }

    public void start() {
        ringBuffer = disruptor.start();
        logger.info("Command sequencer started. Ring buffer size: {}", ringBuffer.getBufferSize());
    }

    public boolean tryAddBuy(Order order) {
        return tryAdd(CommandType.ADD_BUY, order);
    }

    public boolean tryAddSell(Order order) {
        return tryAdd(CommandType.ADD_SELL, order);
    }

    public boolean tryCancelBuy(int productId, int orderId) {
        return tryCancel(CommandType.CANCEL_BUY, productId, orderId);
    }

    public boolean tryCancelSell(int productId, int orderId) {
        return tryCancel(CommandType.CANCEL_SELL, productId, orderId);
    }

    public boolean tryMatch(int productId) {
        long publishedNanos = System.nanoTime();
        long sequence = claim(CommandType.MATCH);
        if (sequence < 0) {
            return false;
        }
        try {
            EngineCommandTranslator.translateMatch(ringBuffer.get(sequence), productId, publishedNanos);
        } finally {
            ringBuffer.publish(sequence);
        }
        return true;
    }

    public boolean tryUpdatePrice(int productId, double newPrice) {
        long publishedNanos = System.nanoTime();
        long sequence = claim(CommandType.UPDATE_PRICE);
        if (sequence < 0) {
            return false;
        }
        try {
            EngineCommandTranslator.translatePriceUpdate(ringBuffer.get(sequence), productId,
                    newPrice, publishedNanos);
        } finally {
            ringBuffer.publish(sequence);
        }
        return true;
    }

    /**
     * Apply every command already published, then halt the consumer thread.
     * Callers must stop publishing first.
     */
    public void shutdown() {
        if (ringBuffer != null) {
            awaitDrained();
        }
        disruptor.shutdown();
        logger.info("Command sequencer shut down.");
    }

    private boolean tryAdd(CommandType type, Order order) {
        long publishedNanos = System.nanoTime();
        long sequence = claim(type);
        if (sequence < 0) {
            return false;
        }
        try {
            EngineCommandTranslator.translateAdd(ringBuffer.get(sequence), type, order, publishedNanos);
        } finally {
            ringBuffer.publish(sequence);
        }
        return true;
    }

    private boolean tryCancel(CommandType type, int productId, int orderId) {
        long publishedNanos = System.nanoTime();
        long sequence = claim(type);
        if (sequence < 0) {
            return false;
        }
        try {
            EngineCommandTranslator.translateCancel(ringBuffer.get(sequence), type,
                    productId, orderId, publishedNanos);
        } finally {
            ringBuffer.publish(sequence);
        }
        return true;
    }

    /**
     * Wait until the handler has consumed up to the publish cursor. The
     * consumer thread may not have started running yet, which the
     * Disruptor's own backlog check does not account for.
     */
    private void awaitDrained() {
        long cursor = ringBuffer.getCursor();
        while (disruptor.getSequenceValueFor(handler) < cursor) {
            Thread.yield();
        }
    }

    /**
     * Claim the next slot, or -1 when the ring buffer is full.
     */
    private long claim(CommandType type) {
        if (ringBuffer == null) {
            throw new IllegalStateException("Command sequencer has not been started");
        }
        try {
            return ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            logger.warn("Ring buffer full. Rejecting {} command", type);
            if (metrics != null) {
                metrics.commandsRejectedTotal.inc();
            }
            return -1;
        }
    }
}

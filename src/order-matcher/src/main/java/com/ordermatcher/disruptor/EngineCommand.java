package com.ordermatcher.disruptor;

import com.ordermatcher.domain.OrderKind;

/**
 * Pre-allocated mutable command slot in the Disruptor ring buffer.
 *
 * Fields are public for zero-overhead access on the critical path. Which
 * fields are meaningful depends on the command type: adds use all order
 * fields, cancels use productId and orderId, a match uses productId, a price
 * update uses productId and price.
 */
public class EngineCommand {

    public long publishedNanos;    // System.nanoTime() when the command was published
    public CommandType type;
    public int productId;
    public int orderId;
    public OrderKind kind;
    public double price;
    public double amount;
    public int priority;
    public long createdAt;         // epoch millis

    /**
     * Reset all fields to defaults. Called after the command has been applied
     * to prevent stale data from persisting in the ring buffer slot.
     */
    public void clear() {
        publishedNanos = 0;
        type = null;
        productId = 0;
        orderId = 0;
        kind = null;
        price = 0;
        amount = 0;
        priority = 0;
        createdAt = 0;
    }
}

package com.ordermatcher.logging;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Lock-free counters shared between engine callers (writers) and the
 * periodic stats logger thread (reader).
 */
public class MatchingStats {

    public final AtomicLong buyOrdersAdded = new AtomicLong();
    public final AtomicLong sellOrdersAdded = new AtomicLong();
    public final AtomicLong ordersCancelled = new AtomicLong();
    public final AtomicLong matchPasses = new AtomicLong();
    public final AtomicLong tradesExecuted = new AtomicLong();
    public final AtomicLong intentsSkipped = new AtomicLong();
    public final AtomicLong priceUpdates = new AtomicLong();
    public final AtomicLong ordersDropped = new AtomicLong();
}

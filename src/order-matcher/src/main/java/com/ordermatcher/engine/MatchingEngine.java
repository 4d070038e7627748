package com.ordermatcher.engine;

import com.ordermatcher.book.OrderStore;
import com.ordermatcher.codec.DecodingException;
import com.ordermatcher.codec.EncodingException;
import com.ordermatcher.codec.OrderCodec;
import com.ordermatcher.domain.BookSnapshot;
import com.ordermatcher.domain.Order;
import com.ordermatcher.domain.Side;
import com.ordermatcher.domain.TradeReport;
import com.ordermatcher.logging.MatchingStats;
import com.ordermatcher.matching.MatchCoordinator;
import com.ordermatcher.matching.MatchPass;
import com.ordermatcher.matching.TradeListener;
import com.ordermatcher.pricing.MarketPriceEstimator;
import com.ordermatcher.pricing.PriceToleranceFilter;
import com.ordermatcher.pricing.RepriceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Entry point for callers: add and cancel orders, run match passes, apply
 * price updates.
 *
 * Safe to call from any thread. Each operation is atomic with respect to every
 * other operation on the same product; operations on different products run
 * in parallel.
 */
public class MatchingEngine {

    private static final Logger logger = LoggerFactory.getLogger(MatchingEngine.class);

    private final OrderStore store;
    private final MarketPriceEstimator estimator;
    private final PriceToleranceFilter toleranceFilter;
    private final MatchCoordinator coordinator;
    private final OrderCodec codec;
    private final List<TradeListener> listeners = new CopyOnWriteArrayList<>();
    private final MatchingStats stats = new MatchingStats();

    public MatchingEngine(double tolerance, OrderCodec codec) {
        this(tolerance, codec, null);
    }

    public MatchingEngine(double tolerance, OrderCodec codec, TradeListener listener) {
        if (codec == null) {
            throw new IllegalArgumentException("Codec is required");
        }
        this.store = new OrderStore();
        this.estimator = new MarketPriceEstimator(store);
        this.toleranceFilter = new PriceToleranceFilter(store, tolerance);
        this.coordinator = new MatchCoordinator(store, this::fanOut);
        this.codec = codec;
        if (listener != null) {
            listeners.add(listener);
        }
        logger.info("Matching engine created with price tolerance {}", tolerance);
    }

    public void addTradeListener(TradeListener listener) {
        listeners.add(listener);
    }

    public void addBuy(Order order) {
        store.addBuy(order);
        stats.buyOrdersAdded.incrementAndGet();
    }

    public void addSell(Order order) {
        store.addSell(order);
        stats.sellOrdersAdded.incrementAndGet();
    }

    /**
     * @return true if a resting buy order was removed; false (no-op) if absent
     */
    public boolean cancelBuy(int productId, int orderId) {
        return countCancel(store.cancelBuy(productId, orderId));
    }

    /**
     * @return true if a resting sell order was removed; false (no-op) if absent
     */
    public boolean cancelSell(int productId, int orderId) {
        return countCancel(store.cancelSell(productId, orderId));
    }

    public MatchPass match(int productId) {
        MatchPass pass = coordinator.match(productId);
        stats.matchPasses.incrementAndGet();
        stats.tradesExecuted.addAndGet(pass.getTradeCount());
        stats.intentsSkipped.addAndGet(pass.getIntentsSkipped());
        return pass;
    }

    public RepriceResult updatePrice(int productId, double newPrice) {
        RepriceResult result = toleranceFilter.applyToleranceAndReprice(productId, newPrice);
        stats.priceUpdates.incrementAndGet();
        stats.ordersDropped.addAndGet(result.getDroppedCount());
        return result;
    }

    public double estimateMarketPrice(int productId) {
        return estimator.estimate(productId);
    }

    /**
     * Encode a consistent snapshot of one product's book. The snapshot is taken
     * under the product's lock and encoded after it is released, so a failing
     * codec never leaves the book half-modified.
     */
    public byte[] encodeBook(int productId) throws EncodingException {
        return codec.encode(snapshot(productId));
    }

    /**
     * Decode a snapshot produced by {@link #encodeBook(int)}. Nothing is loaded
     * into this engine's book.
     *
     * Orders are rebuilt by the codec without going through the {@link Order}
     * constructor, so their ids and amounts are not validated. Bytes from an
     * untrusted source may yield negative ids or non-positive amounts.
     */
    public BookSnapshot decodeBook(byte[] data) throws DecodingException {
        return codec.decode(data, BookSnapshot.class);
    }

    public BookSnapshot snapshot(int productId) {
        return store.withBook(productId, book -> new BookSnapshot(
                productId,
                toleranceFilter.getTolerance(),
                book.snapshot(Side.BUY),
                book.snapshot(Side.SELL)));
    }

    public List<Order> buyOrders(int productId) {
        return store.buyOrders(productId);
    }

    public List<Order> sellOrders(int productId) {
        return store.sellOrders(productId);
    }

    public double getTolerance() {
        return toleranceFilter.getTolerance();
    }

    public OrderStore getStore() {
        return store;
    }

    public MatchingStats getStats() {
        return stats;
    }

    private boolean countCancel(boolean removed) {
        if (removed) {
            stats.ordersCancelled.incrementAndGet();
        }
        return removed;
    }

    private void fanOut(TradeReport report) {
        for (TradeListener listener : listeners) {
            try {
                listener.onTrade(report);
            } catch (RuntimeException e) {
                logger.warn("Trade listener {} failed for trade {}: {}",
                        listener, report.getTradeId(), e.getMessage(), e);
            }
        }
    }
}

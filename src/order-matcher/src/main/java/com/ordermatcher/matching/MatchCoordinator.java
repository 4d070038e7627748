package com.ordermatcher.matching;

import com.ordermatcher.book.OrderStore;
import com.ordermatcher.book.ProductBook;
import com.ordermatcher.domain.Order;
import com.ordermatcher.domain.Side;
import com.ordermatcher.domain.TradeReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cross-product matcher.
 *
 * A pass runs in two phases under the product's lock:
 * <ol>
 *   <li>Discovery: every (buy, sell) pair of the sequences as they stood when
 *       the pass began is tested with {@link #crosses(Order, Order)}, buys
 *       outer, sells inner, in stored order. Each crossing pair becomes a
 *       {@link TradeIntent}.</li>
 *   <li>Application: intents are applied one at a time, in discovery order,
 *       against the live book. An intent whose buy or sell order has already
 *       been filled by an earlier intent is skipped.</li>
 * </ol>
 *
 * Discovery order, not price or time, decides which counterparties an order
 * trades against when it crosses several of them. priority and createdAt are
 * not consulted.
 */
public class MatchCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(MatchCoordinator.class);

    private final OrderStore store;
    private final TradeListener listener;
    private final AtomicLong tradeSequence = new AtomicLong(0);

    public MatchCoordinator(OrderStore store, TradeListener listener) {
        this.store = store;
        this.listener = listener != null ? listener : TradeListener.NONE;
    }

    /**
     * Match the product's resting orders. Blocks until every discovered
     * intent has been applied or skipped.
     */
    public MatchPass match(int productId) {
        return store.withBook(productId, this::matchLocked);
    }

    /**
     * buy.price >= sell.price. A market order gets no exemption: with its
     * conventional price of 0 it only crosses sells priced at or below 0.
     */
    public static boolean crosses(Order buy, Order sell) {
        return buy.getPrice() >= sell.getPrice();
    }

    private MatchPass matchLocked(ProductBook book) {
        List<TradeIntent> intents = discover(book);

        List<TradeReport> trades = new ArrayList<>();
        int skipped = 0;
        for (TradeIntent intent : intents) {
            TradeReport trade = apply(book, intent);
            if (trade == null) {
                skipped++;
            } else {
                trades.add(trade);
            }
        }

        if (!intents.isEmpty()) {
            logger.debug("Match pass for product {}: {} intents, {} trades, {} skipped",
                    book.getProductId(), intents.size(), trades.size(), skipped);
        }
        return new MatchPass(book.getProductId(), trades, intents.size(), skipped);
    }

    private List<TradeIntent> discover(ProductBook book) {
        List<Order> buys = book.snapshot(Side.BUY);
        List<Order> sells = book.snapshot(Side.SELL);

        List<TradeIntent> intents = new ArrayList<>();
        for (Order buy : buys) {
            for (Order sell : sells) {
                if (crosses(buy, sell)) {
                    intents.add(new TradeIntent(book.getProductId(), buy.getId(), sell.getId()));
                }
            }
        }
        return intents;
    }

    /**
     * Apply one intent to the live book. Returns null when the intent is stale.
     */
    private TradeReport apply(ProductBook book, TradeIntent intent) {
        int productId = intent.productId();
        Order buy = store.lookupById(Side.BUY, productId, intent.buyOrderId());
        Order sell = store.lookupById(Side.SELL, productId, intent.sellOrderId());
        if (buy == null || sell == null) {
            return null;
        }

        // buy side checked first: when both are market orders the buy adopts the sell price
        if (buy.isMarket()) {
            buy.setPrice(sell.getPrice());
        } else if (sell.isMarket()) {
            sell.setPrice(buy.getPrice());
        }

        double tradeAmount = Math.min(buy.getAmount(), sell.getAmount());
        buy.fill(tradeAmount);
        sell.fill(tradeAmount);

        TradeReport trade = new TradeReport(
                generateTradeId(),
                buy.getId(),
                sell.getId(),
                productId,
                buy.getPrice(),
                tradeAmount,
                System.currentTimeMillis());

        logger.debug("Trade: buy order {} and sell order {} for product {} at price {}, amount {}",
                buy.getId(), sell.getId(), productId, trade.getPrice(), tradeAmount);

        // filled orders leave the book before anyone hears about the trade
        if (buy.isFilled()) {
            store.cancelBuy(productId, buy.getId());
        }
        if (sell.isFilled()) {
            store.cancelSell(productId, sell.getId());
        }
        report(trade);
        return trade;
    }

    private void report(TradeReport trade) {
        try {
            listener.onTrade(trade);
        } catch (RuntimeException e) {
            logger.warn("Trade listener failed for trade {}: {}", trade.getTradeId(), e.getMessage(), e);
        }
    }

    private String generateTradeId() {
        return "t-" + String.format("%05d", tradeSequence.incrementAndGet());
    }
}

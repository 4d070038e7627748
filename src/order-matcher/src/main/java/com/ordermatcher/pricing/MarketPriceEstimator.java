package com.ordermatcher.pricing;

import com.ordermatcher.book.OrderStore;
import com.ordermatcher.book.ProductBook;
import com.ordermatcher.domain.Order;
import com.ordermatcher.domain.Side;

import java.util.List;

/**
 * Coarse reference price for a product, taken from the head of each side.
 *
 * Both sides resting: mean of the two head prices. One side resting: that
 * side's head price. Empty book: {@link #NO_MARKET_DATA}, which callers must
 * tell apart from a genuine zero price themselves.
 */
public class MarketPriceEstimator {

    public static final double NO_MARKET_DATA = 0;

    private final OrderStore store;

    public MarketPriceEstimator(OrderStore store) {
        this.store = store;
    }

    public double estimate(int productId) {
        return store.withBook(productId, MarketPriceEstimator::estimateLocked);
    }

    /**
     * Estimate from a book whose lock the caller already holds.
     */
    static double estimateLocked(ProductBook book) {
        List<Order> buys = book.orders(Side.BUY);
        List<Order> sells = book.orders(Side.SELL);

        if (!buys.isEmpty() && !sells.isEmpty()) {
            return (buys.get(0).getPrice() + sells.get(0).getPrice()) / 2;
        } else if (!buys.isEmpty()) {
            return buys.get(0).getPrice();
        } else if (!sells.isEmpty()) {
            return sells.get(0).getPrice();
        }
        return NO_MARKET_DATA;
    }
}

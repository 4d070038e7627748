package com.ordermatcher.pricing;

import com.ordermatcher.book.OrderStore;
import com.ordermatcher.book.ProductBook;
import com.ordermatcher.domain.Order;
import com.ordermatcher.domain.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies an external price update to one product.
 *
 * Orders further than the tolerance from the estimated market price are
 * dropped from the book for good; they are not parked anywhere. Every
 * retained order, limit or market, is then repriced to the new price. Both
 * steps run under the product's lock, so no match or cancel can see a book
 * that is filtered but not yet repriced.
 */
public class PriceToleranceFilter {

    private static final Logger logger = LoggerFactory.getLogger(PriceToleranceFilter.class);

    private final OrderStore store;
    private final double tolerance;

    public PriceToleranceFilter(OrderStore store, double tolerance) {
        if (!(tolerance >= 0)) {
            throw new IllegalArgumentException("Price tolerance must be >= 0: " + tolerance);
        }
        this.store = store;
        this.tolerance = tolerance;
    }

    public RepriceResult applyToleranceAndReprice(int productId, double newPrice) {
        return store.withBook(productId, book -> filterAndReprice(book, newPrice));
    }

    public double getTolerance() {
        return tolerance;
    }

    private RepriceResult filterAndReprice(ProductBook book, double newPrice) {
        double reference = MarketPriceEstimator.estimateLocked(book);

        int buysBefore = book.orders(Side.BUY).size();
        int sellsBefore = book.orders(Side.SELL).size();

        book.replace(Side.BUY, withinTolerance(book.orders(Side.BUY), reference));
        book.replace(Side.SELL, withinTolerance(book.orders(Side.SELL), reference));

        for (Order order : book.orders(Side.BUY)) {
            order.setPrice(newPrice);
        }
        for (Order order : book.orders(Side.SELL)) {
            order.setPrice(newPrice);
        }

        int retainedBuys = book.orders(Side.BUY).size();
        int retainedSells = book.orders(Side.SELL).size();
        RepriceResult result = new RepriceResult(book.getProductId(), reference, newPrice,
                retainedBuys, retainedSells,
                buysBefore - retainedBuys, sellsBefore - retainedSells);

        if (result.getDroppedCount() > 0) {
            logger.warn("Dropped {} orders outside tolerance {} of reference {} for product {}",
                    result.getDroppedCount(), tolerance, reference, book.getProductId());
        }
        return result;
    }

    private List<Order> withinTolerance(List<Order> orders, double reference) {
        List<Order> retained = new ArrayList<>(orders.size());
        for (Order order : orders) {
            if (Math.abs(order.getPrice() - reference) <= tolerance) {
                retained.add(order);
            }
        }
        return retained;
    }
}

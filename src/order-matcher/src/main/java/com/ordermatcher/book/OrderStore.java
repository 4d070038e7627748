package com.ordermatcher.book;

import com.ordermatcher.domain.Order;
import com.ordermatcher.domain.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the resting orders of every product.
 *
 * Each product gets its own {@link ProductBook} with its own lock, so
 * operations on different products never block each other while every
 * operation on the same product is one critical section. Books are created by
 * the first add and never discarded.
 *
 * No duplicate-id check is made on insert. Inserting the same id twice on one
 * side of a product leaves lookups and cancels acting on the first one only.
 */
public class OrderStore {

    private static final Logger logger = LoggerFactory.getLogger(OrderStore.class);

    private final ConcurrentHashMap<Integer, ProductBook> books = new ConcurrentHashMap<>();

    public void addBuy(Order order) {
        add(Side.BUY, order);
    }

    public void addSell(Order order) {
        add(Side.SELL, order);
    }

    /**
     * Remove the first buy order with the given id. No-op when it is absent.
     *
     * @return true if an order was removed
     */
    public boolean cancelBuy(int productId, int orderId) {
        return cancel(Side.BUY, productId, orderId);
    }

    /**
     * Remove the first sell order with the given id. No-op when it is absent.
     *
     * @return true if an order was removed
     */
    public boolean cancelSell(int productId, int orderId) {
        return cancel(Side.SELL, productId, orderId);
    }

    /**
     * Live order with the given id, or null when it is not resting (never
     * inserted, cancelled, or already filled). The returned instance may only
     * be used while the product's lock is held.
     */
    public Order lookupById(Side side, int productId, int orderId) {
        ProductBook book = books.get(productId);
        if (book == null) {
            return null;
        }
        book.lock();
        try {
            return book.find(side, orderId);
        } finally {
            book.unlock();
        }
    }

    /**
     * Run an action as a single critical section on the product's book.
     * A product that never had an order added runs against a detached empty
     * book, so reads and passes on unknown products do not register them.
     */
    public <T> T withBook(int productId, BookAction<T> action) {
        ProductBook book = books.get(productId);
        if (book == null) {
            book = new ProductBook(productId);
        }
        book.lock();
        try {
            return action.apply(book);
        } finally {
            book.unlock();
        }
    }

    public ProductBook getOrCreateBook(int productId) {
        return books.computeIfAbsent(productId, ProductBook::new);
    }

    public List<Order> buyOrders(int productId) {
        return snapshot(Side.BUY, productId);
    }

    public List<Order> sellOrders(int productId) {
        return snapshot(Side.SELL, productId);
    }

    public List<Integer> productIds() {
        List<Integer> ids = new ArrayList<>(books.keySet());
        Collections.sort(ids);
        return ids;
    }

    /**
     * Total resting orders on one side across all products.
     */
    public int depth(Side side) {
        int depth = 0;
        for (ProductBook book : books.values()) {
            depth += book.depth(side);
        }
        return depth;
    }

    private void add(Side side, Order order) {
        if (order == null) {
            throw new IllegalArgumentException("Order is required");
        }
        ProductBook book = getOrCreateBook(order.getProductId());
        book.lock();
        try {
            book.append(side, order);
        } finally {
            book.unlock();
        }
        if (logger.isTraceEnabled()) {
            logger.trace("Added {} order {} for product {}", side, order.getId(), order.getProductId());
        }
    }

    private boolean cancel(Side side, int productId, int orderId) {
        ProductBook book = books.get(productId);
        if (book == null) {
            return false;
        }
        book.lock();
        try {
            return book.remove(side, orderId);
        } finally {
            book.unlock();
        }
    }

    private List<Order> snapshot(Side side, int productId) {
        ProductBook book = books.get(productId);
        if (book == null) {
            return List.of();
        }
        return book.snapshot(side);
    }

    /**
     * Work done while holding a product's lock.
     */
    @FunctionalInterface
    public interface BookAction<T> {
        T apply(ProductBook book);
    }
}

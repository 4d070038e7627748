package com.ordermatcher.book;

import com.ordermatcher.domain.Order;
import com.ordermatcher.domain.Side;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Buy and sell sequences for a single product, guarded by one lock.
 *
 * Both sequences keep insertion order; nothing reorders them. Lookups and
 * removals are linear scans by order id.
 *
 * The lock is reentrant so that a match pass holding it can remove filled
 * orders through the regular cancel path. Every accessor of the live
 * sequences requires the calling thread to hold the lock.
 */
public class ProductBook {

    private final int productId;
    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayList<Order> buyOrders = new ArrayList<>();
    private final ArrayList<Order> sellOrders = new ArrayList<>();

    public ProductBook(int productId) {
        this.productId = productId;
    }

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    public void append(Side side, Order order) {
        checkLocked();
        orders(side).add(order);
    }

    /**
     * Remove the first order with the given id, keeping the relative order of
     * the rest. Returns false if no such order rests on this side.
     */
    public boolean remove(Side side, int orderId) {
        checkLocked();
        Iterator<Order> it = orders(side).iterator();
        while (it.hasNext()) {
            if (it.next().getId() == orderId) {
                it.remove();
                return true;
            }
        }
        return false;
    }

    /**
     * First order with the given id, or null if it is not resting.
     */
    public Order find(Side side, int orderId) {
        checkLocked();
        for (Order order : orders(side)) {
            if (order.getId() == orderId) {
                return order;
            }
        }
        return null;
    }

    /**
     * Live sequence for one side. Callers must hold the lock for as long as
     * they use the returned list.
     */
    public List<Order> orders(Side side) {
        checkLocked();
        return side == Side.BUY ? buyOrders : sellOrders;
    }

    /**
     * Replace the contents of one side with the given orders, in order.
     */
    public void replace(Side side, List<Order> retained) {
        List<Order> target = orders(side);
        List<Order> copy = new ArrayList<>(retained);
        target.clear();
        target.addAll(copy);
    }

    /**
     * Detached copies of one side's orders, in stored order.
     */
    public List<Order> snapshot(Side side) {
        lock.lock();
        try {
            List<Order> source = side == Side.BUY ? buyOrders : sellOrders;
            List<Order> copies = new ArrayList<>(source.size());
            for (Order order : source) {
                copies.add(order.copy());
            }
            return copies;
        } finally {
            lock.unlock();
        }
    }

    public int depth(Side side) {
        lock.lock();
        try {
            return side == Side.BUY ? buyOrders.size() : sellOrders.size();
        } finally {
            lock.unlock();
        }
    }

    public int getProductId() {
        return productId;
    }

    private void checkLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException(
                "Book for product " + productId + " accessed without holding its lock");
        }
    }
}

package com.ordermatcher.domain;

import java.util.List;

/**
 * Detached view of one product's book, built from order copies. Plain fields
 * only, so any codec can serialize it.
 */
public class BookSnapshot {

    private final int productId;
    private final double tolerance;
    private final List<Order> buyOrders;
    private final List<Order> sellOrders;

    public BookSnapshot(int productId, double tolerance,
                        List<Order> buyOrders, List<Order> sellOrders) {
        this.productId = productId;
        this.tolerance = tolerance;
        this.buyOrders = buyOrders;
        this.sellOrders = sellOrders;
    }

    public int getProductId() {
        return productId;
    }

    public double getTolerance() {
        return tolerance;
    }

    public List<Order> getBuyOrders() {
        return buyOrders;
    }

    public List<Order> getSellOrders() {
        return sellOrders;
    }
}

package com.ordermatcher.domain;

/**
 * Resting order. Mutable: price and amount change in place while the order
 * sits in the book (trade fills, market price adoption, repricing).
 *
 * Once handed to the order store the store owns the instance; callers must not
 * keep a reference around and read it later. Use {@link #copy()} for a
 * detached view.
 *
 * priority and createdAt are carried as inert metadata. Nothing in matching,
 * cancellation or pricing reads them.
 */
public class Order {

    private final int id;
    private final OrderKind kind;
    private double price;
    private double amount;
    private final int priority;
    private final long createdAt;       // epoch millis
    private final int productId;

    public Order(int id, OrderKind kind, double price, double amount,
                 int priority, long createdAt, int productId) {
        if (id < 0) {
            throw new IllegalArgumentException("Order id must be non-negative: " + id);
        }
        if (kind == null) {
            throw new IllegalArgumentException("Order kind is required");
        }
        if (!(amount > 0)) {
            throw new IllegalArgumentException("Order amount must be positive: " + amount);
        }
        this.id = id;
        this.kind = kind;
        this.price = price;
        this.amount = amount;
        this.priority = priority;
        this.createdAt = createdAt;
        this.productId = productId;
    }

    private Order(Order other) {
        this.id = other.id;
        this.kind = other.kind;
        this.price = other.price;
        this.amount = other.amount;
        this.priority = other.priority;
        this.createdAt = other.createdAt;
        this.productId = other.productId;
    }

    public static Order limit(int id, int productId, double price, double amount) {
        return new Order(id, OrderKind.LIMIT, price, amount, 0,
                System.currentTimeMillis(), productId);
    }

    /**
     * Market orders are created with price 0 by convention.
     */
    public static Order market(int id, int productId, double amount) {
        return new Order(id, OrderKind.MARKET, 0, amount, 0,
                System.currentTimeMillis(), productId);
    }

    /**
     * Reduce the remaining amount by a traded quantity.
     */
    public void fill(double qty) {
        if (!(qty > 0)) {
            throw new IllegalArgumentException("Fill amount must be positive: " + qty);
        }
        if (qty > amount) {
            throw new IllegalArgumentException(
                "Fill amount " + qty + " exceeds remaining " + amount);
        }
        amount -= qty;
    }

    public boolean isFilled() {
        return amount == 0;
    }

    public boolean isMarket() {
        return kind == OrderKind.MARKET;
    }

    public Order copy() {
        return new Order(this);
    }

    public int getId() {
        return id;
    }

    public OrderKind getKind() {
        return kind;
    }

    public double getPrice() {
        return price;
    }

    public void setPrice(double price) {
        this.price = price;
    }

    public double getAmount() {
        return amount;
    }

    public int getPriority() {
        return priority;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public int getProductId() {
        return productId;
    }

    @Override
    public String toString() {
        return "Order{" +
                "id=" + id +
                ", kind=" + kind +
                ", price=" + price +
                ", amount=" + amount +
                ", priority=" + priority +
                ", productId=" + productId +
                '}';
    }
}

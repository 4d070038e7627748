package com.ordermatcher.domain;

/**
 * A single applied trade between a resting buy order and a resting sell order.
 * The price is the buy order's price after any market price adoption.
 */
public class TradeReport {

    private final String tradeId;
    private final int buyOrderId;
    private final int sellOrderId;
    private final int productId;
    private final double price;
    private final double amount;
    private final long timestamp;          // epoch millis

    public TradeReport(String tradeId, int buyOrderId, int sellOrderId, int productId,
                       double price, double amount, long timestamp) {
        this.tradeId = tradeId;
        this.buyOrderId = buyOrderId;
        this.sellOrderId = sellOrderId;
        this.productId = productId;
        this.price = price;
        this.amount = amount;
        this.timestamp = timestamp;
    }

    public String getTradeId() {
        return tradeId;
    }

    public int getBuyOrderId() {
        return buyOrderId;
    }

    public int getSellOrderId() {
        return sellOrderId;
    }

    public int getProductId() {
        return productId;
    }

    public double getPrice() {
        return price;
    }

    public double getAmount() {
        return amount;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "TradeReport{" +
                "tradeId='" + tradeId + '\'' +
                ", buyOrderId=" + buyOrderId +
                ", sellOrderId=" + sellOrderId +
                ", productId=" + productId +
                ", price=" + price +
                ", amount=" + amount +
                '}';
    }
}

package com.ordermatcher.matching;

import com.ordermatcher.domain.TradeReport;

import java.util.List;

/**
 * Result of one match pass over a product.
 * Contains the applied trades and how many discovered intents were skipped
 * because one of their orders was already gone.
 */
public class MatchPass {

    private final int productId;
    private final List<TradeReport> trades;
    private final int intentsDiscovered;
    private final int intentsSkipped;

    public MatchPass(int productId, List<TradeReport> trades,
                     int intentsDiscovered, int intentsSkipped) {
        this.productId = productId;
        this.trades = trades;
        this.intentsDiscovered = intentsDiscovered;
        this.intentsSkipped = intentsSkipped;
    }

    public int getProductId() {
        return productId;
    }

    public List<TradeReport> getTrades() {
        return trades;
    }

    public int getIntentsDiscovered() {
        return intentsDiscovered;
    }

    public int getIntentsSkipped() {
        return intentsSkipped;
    }

    public int getTradeCount() {
        return trades.size();
    }

    public double getTradedAmount() {
        double total = 0;
        for (TradeReport trade : trades) {
            total += trade.getAmount();
        }
        return total;
    }

    public boolean hasTrades() {
        return !trades.isEmpty();
    }
}

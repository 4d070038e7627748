package com.ordermatcher.matching;

import com.ordermatcher.domain.TradeReport;

/**
 * Receives one report per applied trade. Called while the product's lock is
 * held, so implementations must not block or call back into the engine.
 */
@FunctionalInterface
public interface TradeListener {

    TradeListener NONE = report -> { };

    void onTrade(TradeReport report);
}

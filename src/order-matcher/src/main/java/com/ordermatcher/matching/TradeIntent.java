package com.ordermatcher.matching;

/**
 * A crossing buy/sell pair found during discovery, waiting to be applied.
 * Holds ids only; both orders are re-resolved against the live book when
 * the intent is applied.
 */
public record TradeIntent(int productId, int buyOrderId, int sellOrderId) {}

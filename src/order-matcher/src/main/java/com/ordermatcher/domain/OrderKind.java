package com.ordermatcher.domain;

/**
 * Order kind. Market orders carry no meaningful resting price until they are
 * matched, at which point they adopt the counterparty's price.
 */
public enum OrderKind {
    LIMIT,
    MARKET
}

package com.ordermatcher.disruptor;

public enum CommandType {
    ADD_BUY,
    ADD_SELL,
    CANCEL_BUY,
    CANCEL_SELL,
    MATCH,
    UPDATE_PRICE
}

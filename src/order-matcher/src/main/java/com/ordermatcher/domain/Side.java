package com.ordermatcher.domain;

public enum Side {
    BUY,
    SELL
}

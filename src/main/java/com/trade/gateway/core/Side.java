package com.trade.gateway.core;

/**
 * 订单方向
 */
public enum Side {
    BUY,
    SELL;

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }
}

package com.trade.gateway.exchange;

/**
 * {@link CommonOps} 可以实现的通用操作
 */
public enum CommonOperation {
    GET_TICKERS,
    GET_TRADES,
    GET_ORDERBOOK,
    GET_ORDERS,
    GET_ALL_ORDERS,
    PLACE_ORDER,
    CANCEL_ORDER,
    CANCEL_ALL_ORDERS,
    GET_BALANCE,
    GET_POSITION
}

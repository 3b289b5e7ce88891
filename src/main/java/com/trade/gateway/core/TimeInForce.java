package com.trade.gateway.core;

/**
 * 限价单有效方式
 */
public enum TimeInForce {
    GTC,  // 撤销前有效
    IOC,  // 立即成交剩余撤销
    FOK   // 全部成交或撤销
}

package com.trade.gateway.core;

/**
 * 订单类型
 */
public enum OrderType {
    MARKET,  // 市价单，立即成交
    LIMIT    // 限价单，指定价格
}

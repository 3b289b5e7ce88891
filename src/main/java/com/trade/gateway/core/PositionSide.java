package com.trade.gateway.core;

/**
 * 持仓方向
 */
public enum PositionSide {
    LONG,   // 多头持仓
    SHORT   // 空头持仓
}

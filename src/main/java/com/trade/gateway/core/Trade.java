package com.trade.gateway.core;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 公开成交记录
 */
public class Trade {
    private final String tradeId;
    private final BigDecimal price;
    private final BigDecimal quantity;
    private final Side takerSide;     // 主动成交方向，交易所未提供时为 null
    private final Instant timestamp;

    public Trade(String tradeId, BigDecimal price, BigDecimal quantity, Side takerSide, Instant timestamp) {
        this.tradeId = tradeId;
        this.price = price;
        this.quantity = quantity;
        this.takerSide = takerSide;
        this.timestamp = timestamp;
    }

    public String getTradeId() { return tradeId; }
    public BigDecimal getPrice() { return price; }
    public BigDecimal getQuantity() { return quantity; }
    public Side getTakerSide() { return takerSide; }
    public Instant getTimestamp() { return timestamp; }
}

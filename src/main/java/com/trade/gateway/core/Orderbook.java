package com.trade.gateway.core;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

/**
 * 订单簿快照
 * bids 按价格从高到低，asks 按价格从低到高
 */
public class Orderbook {
    private final List<OrderbookLevel> bids;
    private final List<OrderbookLevel> asks;
    private final Instant timestamp;  // 交易所时间戳，可能为 null

    public Orderbook(List<OrderbookLevel> bids, List<OrderbookLevel> asks, Instant timestamp) {
        this.bids = List.copyOf(bids);
        this.asks = List.copyOf(asks);
        this.timestamp = timestamp;
    }

    public List<OrderbookLevel> getBids() { return bids; }
    public List<OrderbookLevel> getAsks() { return asks; }
    public Instant getTimestamp() { return timestamp; }

    /**
     * 买一档，空盘口返回 null
     */
    public OrderbookLevel getBestBid() {
        return bids.isEmpty() ? null : bids.get(0);
    }

    /**
     * 卖一档，空盘口返回 null
     */
    public OrderbookLevel getBestAsk() {
        return asks.isEmpty() ? null : asks.get(0);
    }

    /**
     * 获取中间价
     */
    public BigDecimal getMidPrice() {
        OrderbookLevel bid = getBestBid();
        OrderbookLevel ask = getBestAsk();
        if (bid == null || ask == null) {
            return null;
        }
        return bid.getPrice().add(ask.getPrice()).divide(BigDecimal.valueOf(2), 8, RoundingMode.HALF_UP);
    }
}

package com.trade.gateway.core;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 实时行情快照
 */
public class Ticker {
    private final Market market;
    private final BigDecimal bidPrice;       // 最优买一价，可能为 null
    private final BigDecimal askPrice;       // 最优卖一价，可能为 null
    private final BigDecimal lastPrice;      // 最新成交价，可能为 null

    public Ticker(Market market, BigDecimal bidPrice, BigDecimal askPrice, BigDecimal lastPrice) {
        this.market = market;
        this.bidPrice = bidPrice;
        this.askPrice = askPrice;
        this.lastPrice = lastPrice;
    }

    public Market getMarket() { return market; }
    public BigDecimal getBidPrice() { return bidPrice; }
    public BigDecimal getAskPrice() { return askPrice; }
    public BigDecimal getLastPrice() { return lastPrice; }

    /**
     * 获取中间价
     */
    public BigDecimal getMidPrice() {
        if (bidPrice == null || askPrice == null) {
            return lastPrice;
        }
        return bidPrice.add(askPrice).divide(BigDecimal.valueOf(2), 8, RoundingMode.HALF_UP);
    }
}

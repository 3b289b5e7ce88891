package com.trade.gateway.core;

import java.util.Objects;

/**
 * 交易市场
 * 文本格式: kind:BASE/QUOTE，例如 spot:BTC/USDT、perp:ETH/USDT
 */
public final class Market {
    private final String base;      // 基础货币，如 BTC
    private final String quote;     // 报价货币，如 USDT
    private final MarketKind kind;

    public Market(String base, String quote, MarketKind kind) {
        if (base == null || base.isBlank() || quote == null || quote.isBlank()) {
            throw new IllegalArgumentException("基础货币和报价货币不能为空");
        }
        this.base = base.toUpperCase();
        this.quote = quote.toUpperCase();
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static Market spot(String base, String quote) {
        return new Market(base, quote, MarketKind.SPOT);
    }

    public static Market of(String market) {
        int colon = market.indexOf(':');
        int slash = market.indexOf('/', colon + 1);
        if (colon <= 0 || slash < 0 || market.indexOf('/', slash + 1) >= 0) {
            throw new IllegalArgumentException("无效的市场格式: " + market);
        }
        MarketKind kind = MarketKind.fromCode(market.substring(0, colon));
        return new Market(market.substring(colon + 1, slash), market.substring(slash + 1), kind);
    }

    public String getBase() {
        return base;
    }

    public String getQuote() {
        return quote;
    }

    public MarketKind getKind() {
        return kind;
    }

    public boolean isSpot() {
        return kind == MarketKind.SPOT;
    }

    /**
     * 拼接交易对，如 joined("-") → BTC-USDT
     */
    public String joined(String separator) {
        return base + separator + quote;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Market market = (Market) o;
        return base.equals(market.base) && quote.equals(market.quote) && kind == market.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, quote, kind);
    }

    @Override
    public String toString() {
        return kind.getCode() + ":" + base + "/" + quote;
    }
}

package com.trade.gateway.core;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 合约持仓
 * 数量为绝对值，方向由 side 表示
 */
public final class Position {
    private final Market market;
    private final PositionSide side;
    private final BigDecimal quantity;        // 持仓数量
    private final BigDecimal entryPrice;      // 开仓均价
    private final BigDecimal markPrice;       // 标记价格
    private final BigDecimal unrealizedPnl;   // 未实现盈亏
    private final BigDecimal leverage;        // 杠杆倍数

    public Position(Market market, PositionSide side, BigDecimal quantity, BigDecimal entryPrice,
                    BigDecimal markPrice, BigDecimal unrealizedPnl, BigDecimal leverage) {
        this.market = Objects.requireNonNull(market, "market");
        this.side = Objects.requireNonNull(side, "side");
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        this.entryPrice = entryPrice;
        this.markPrice = markPrice;
        this.unrealizedPnl = unrealizedPnl;
        this.leverage = leverage;
    }

    public Market getMarket() { return market; }
    public PositionSide getSide() { return side; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getEntryPrice() { return entryPrice; }
    public BigDecimal getMarkPrice() { return markPrice; }
    public BigDecimal getUnrealizedPnl() { return unrealizedPnl; }
    public BigDecimal getLeverage() { return leverage; }

    @Override
    public String toString() {
        return "Position{" + market + " " + side + " " + quantity.toPlainString() + " @ " + entryPrice + "}";
    }
}

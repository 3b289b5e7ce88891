package com.trade.gateway.core;

import java.math.BigDecimal;

/**
 * 交易所挂单
 */
public class OpenOrder {
    private final String orderId;
    private final Side side;
    private final BigDecimal price;
    private final BigDecimal quantity;
    private final BigDecimal remainingQuantity;

    public OpenOrder(String orderId, Side side, BigDecimal price, BigDecimal quantity, BigDecimal remainingQuantity) {
        this.orderId = orderId;
        this.side = side;
        this.price = price;
        this.quantity = quantity;
        this.remainingQuantity = remainingQuantity;
    }

    public String getOrderId() { return orderId; }
    public Side getSide() { return side; }
    public BigDecimal getPrice() { return price; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getRemainingQuantity() { return remainingQuantity; }
}

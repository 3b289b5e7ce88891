package com.trade.gateway.core;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 盘口档位
 */
public final class OrderbookLevel {
    private final BigDecimal price;
    private final BigDecimal quantity;

    public OrderbookLevel(BigDecimal price, BigDecimal quantity) {
        this.price = Objects.requireNonNull(price, "price");
        this.quantity = Objects.requireNonNull(quantity, "quantity");
    }

    public BigDecimal getPrice() { return price; }
    public BigDecimal getQuantity() { return quantity; }

    @Override
    public String toString() {
        return quantity.toPlainString() + "@" + price.toPlainString();
    }
}

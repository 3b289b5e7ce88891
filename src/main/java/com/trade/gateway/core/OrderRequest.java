package com.trade.gateway.core;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 下单请求
 * 交易所无关的订单意图，由各交易所映射为具体接口参数
 */
public class OrderRequest {
    private final Side side;                // 方向
    private final OrderType type;           // 订单类型
    private final BigDecimal quantity;      // 数量（基础货币）
    private final BigDecimal price;         // 价格（仅限价单）
    private final TimeInForce timeInForce;  // 有效方式（仅限价单）
    private final String clientOrderId;     // 客户端订单ID（可选）

    private OrderRequest(Builder builder) {
        this.side = Objects.requireNonNull(builder.side, "side");
        this.type = Objects.requireNonNull(builder.type, "type");
        this.quantity = Objects.requireNonNull(builder.quantity, "quantity");
        if (type == OrderType.LIMIT && builder.price == null) {
            throw new IllegalArgumentException("限价单必须指定价格");
        }
        this.price = builder.price;
        this.timeInForce = builder.timeInForce == null ? TimeInForce.GTC : builder.timeInForce;
        this.clientOrderId = builder.clientOrderId;
    }

    public static OrderRequest market(Side side, BigDecimal quantity) {
        return builder().side(side).type(OrderType.MARKET).quantity(quantity).build();
    }

    public static OrderRequest limit(Side side, BigDecimal quantity, BigDecimal price) {
        return builder().side(side).type(OrderType.LIMIT).quantity(quantity).price(price).build();
    }

    public Side getSide() { return side; }
    public OrderType getType() { return type; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getPrice() { return price; }
    public TimeInForce getTimeInForce() { return timeInForce; }
    public String getClientOrderId() { return clientOrderId; }

    /**
     * 是否为限价单
     */
    public boolean isLimit() {
        return type == OrderType.LIMIT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Side side;
        private OrderType type;
        private BigDecimal quantity;
        private BigDecimal price;
        private TimeInForce timeInForce;
        private String clientOrderId;

        public Builder side(Side side) {
            this.side = side;
            return this;
        }

        public Builder type(OrderType type) {
            this.type = type;
            return this;
        }

        public Builder quantity(BigDecimal quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder price(BigDecimal price) {
            this.price = price;
            return this;
        }

        public Builder timeInForce(TimeInForce timeInForce) {
            this.timeInForce = timeInForce;
            return this;
        }

        public Builder clientOrderId(String clientOrderId) {
            this.clientOrderId = clientOrderId;
            return this;
        }

        public OrderRequest build() {
            return new OrderRequest(this);
        }
    }
}

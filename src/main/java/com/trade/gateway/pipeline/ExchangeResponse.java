package com.trade.gateway.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.gateway.exchange.ExchangeId;

import java.util.Objects;

/**
 * 成功响应，已去掉外层包装
 */
public final class ExchangeResponse {

    private final ExchangeId exchange;
    private final int status;
    private final JsonNode payload;

    public ExchangeResponse(ExchangeId exchange, int status, JsonNode payload) {
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.status = status;
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    public ExchangeId getExchange() {
        return exchange;
    }

    public int getStatus() {
        return status;
    }

    public JsonNode getPayload() {
        return payload;
    }
}

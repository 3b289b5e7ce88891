package com.trade.gateway.pipeline;

import com.trade.gateway.core.Operation;
import com.trade.gateway.exchange.ExchangeId;

import java.net.URI;
import java.util.Objects;

/**
 * 标记了交易所、已按基础地址解析 URI 的操作
 */
public final class ExchangeRequest {

    private final ExchangeId exchange;
    private final Operation<?> operation;
    private final URI uri;

    public ExchangeRequest(ExchangeId exchange, Operation<?> operation, URI uri) {
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.operation = Objects.requireNonNull(operation, "operation");
        this.uri = Objects.requireNonNull(uri, "uri");
    }

    public ExchangeId getExchange() {
        return exchange;
    }

    public Operation<?> getOperation() {
        return operation;
    }

    public URI getUri() {
        return uri;
    }

    @Override
    public String toString() {
        return exchange + " " + operation.getMethod() + " " + uri.getRawPath();
    }
}

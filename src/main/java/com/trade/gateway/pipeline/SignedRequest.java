package com.trade.gateway.pipeline;

import com.trade.gateway.sign.SignedPayload;

import java.util.Objects;

/**
 * 已签名请求，参数串不可再编码
 */
public final class SignedRequest {

    private final ExchangeRequest request;
    private final SignedPayload payload;

    public SignedRequest(ExchangeRequest request, SignedPayload payload) {
        this.request = Objects.requireNonNull(request, "request");
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    public ExchangeRequest getRequest() {
        return request;
    }

    public SignedPayload getPayload() {
        return payload;
    }
}

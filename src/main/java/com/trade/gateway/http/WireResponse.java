package com.trade.gateway.http;

import java.nio.charset.StandardCharsets;

/**
 * 原始 HTTP 响应：状态码和响应体字节
 */
public final class WireResponse {

    private final int status;
    private final byte[] body;

    public WireResponse(int status, byte[] body) {
        this.status = status;
        this.body = body == null ? new byte[0] : body.clone();
    }

    public static WireResponse of(int status, String body) {
        return new WireResponse(status, body.getBytes(StandardCharsets.UTF_8));
    }

    public int getStatus() {
        return status;
    }

    public byte[] getBody() {
        return body.clone();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}

package com.trade.gateway.sign;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 签名策略的输出
 *
 * <p>{@code params} 即最终发送的参数串（GET 为 URL 参数，表单类写请求为请求体），签名后不得再编码。
 * 其余字段仅供检查。
 */
public final class SignedPayload {

    private final String params;
    private final Map<String, String> headers;
    private final String timestamp;
    private final Long recvWindow;
    private final String nonce;
    private final String signature;

    private SignedPayload(Builder builder) {
        this.params = builder.params;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.timestamp = builder.timestamp;
        this.recvWindow = builder.recvWindow;
        this.nonce = builder.nonce;
        this.signature = builder.signature;
    }

    /**
     * 不带任何认证信息的结果
     */
    public static SignedPayload unsigned(String params) {
        return builder(params).build();
    }

    public static Builder builder(String params) {
        return new Builder(params);
    }

    public String getParams() {
        return params;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public Long getRecvWindow() {
        return recvWindow;
    }

    public String getNonce() {
        return nonce;
    }

    public String getSignature() {
        return signature;
    }

    public boolean isSigned() {
        return signature != null;
    }

    @Override
    public String toString() {
        return "SignedPayload{headers=" + headers.keySet() + ", signed=" + isSigned() + "}";
    }

    public static final class Builder {
        private final String params;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String timestamp;
        private Long recvWindow;
        private String nonce;
        private String signature;

        private Builder(String params) {
            this.params = params == null ? "" : params;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder timestamp(String timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder recvWindow(long recvWindow) {
            this.recvWindow = recvWindow;
            return this;
        }

        public Builder nonce(String nonce) {
            this.nonce = nonce;
            return this;
        }

        public Builder signature(String signature) {
            this.signature = signature;
            return this;
        }

        public SignedPayload build() {
            return new SignedPayload(this);
        }
    }
}

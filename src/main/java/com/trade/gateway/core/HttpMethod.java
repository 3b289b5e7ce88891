package com.trade.gateway.core;

/**
 * HTTP 方法
 * 交易所 REST 接口只用到 GET / POST / DELETE
 */
public enum HttpMethod {
    GET,
    POST,
    DELETE;

    /**
     * 写操作（参数放在请求体中）
     */
    public boolean hasBody() {
        return this != GET;
    }
}

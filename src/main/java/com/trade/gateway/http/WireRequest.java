package com.trade.gateway.http;

import com.trade.gateway.core.HttpMethod;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 编码完成、可交给 {@link Transport} 发送的 HTTP 请求
 */
public final class WireRequest {

    private final HttpMethod method;
    private final String url;
    private final Map<String, String> headers;
    private final byte[] body;          // GET 时为 null
    private final String contentType;   // 请求体未声明类型时为 null

    public WireRequest(HttpMethod method, String url, Map<String, String> headers, byte[] body, String contentType) {
        this.method = Objects.requireNonNull(method, "method");
        this.url = Objects.requireNonNull(url, "url");
        if (method == HttpMethod.GET && body != null) {
            throw new IllegalArgumentException("GET request must not carry a body");
        }
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body == null ? null : body.clone();
        this.contentType = contentType;
    }

    public HttpMethod getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * 按名称查找请求头，不区分大小写
     */
    public String header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public byte[] getBody() {
        return body == null ? null : body.clone();
    }

    public String bodyAsString() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    public String getContentType() {
        return contentType;
    }

    @Override
    public String toString() {
        return method + " " + url;
    }
}

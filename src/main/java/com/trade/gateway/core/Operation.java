package com.trade.gateway.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 一次 REST 调用的描述（编码、签名之前）
 *
 * <p>路径模板相对交易所基础地址，可包含 {@code {name}} 占位符，由路径参数填充。
 * 字段按加入顺序编码和签名，值为 null 的字段不加入。
 * 个别接口位于另一个域名（如 Binance U 本位合约），此时由 baseUrl 指定，覆盖客户端地址。
 *
 * <p>Operation 不含时间戳和随机数，重试时可直接再次执行。
 */
public final class Operation<T> {

    private final HttpMethod method;
    private final String pathTemplate;
    private final String baseUrl;           // null 表示使用客户端地址
    private final Map<String, String> pathParams;
    private final Map<String, Object> fields;
    private final AuthTag authTag;
    private final ResponseReader<T> reader;

    private Operation(Builder<T> builder) {
        this.method = builder.method;
        this.pathTemplate = builder.pathTemplate;
        this.baseUrl = builder.baseUrl;
        this.pathParams = Collections.unmodifiableMap(new LinkedHashMap<>(builder.pathParams));
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.authTag = builder.authTag;
        this.reader = builder.reader;
    }

    public static <T> Builder<T> get(String pathTemplate, ResponseReader<T> reader) {
        return new Builder<>(HttpMethod.GET, pathTemplate, reader);
    }

    public static <T> Builder<T> post(String pathTemplate, ResponseReader<T> reader) {
        return new Builder<>(HttpMethod.POST, pathTemplate, reader);
    }

    public static <T> Builder<T> delete(String pathTemplate, ResponseReader<T> reader) {
        return new Builder<>(HttpMethod.DELETE, pathTemplate, reader);
    }

    public HttpMethod getMethod() {
        return method;
    }

    public String getPathTemplate() {
        return pathTemplate;
    }

    /**
     * @return 该调用专用的基础地址，未指定时为 null
     */
    public String getBaseUrl() {
        return baseUrl;
    }

    public Map<String, String> getPathParams() {
        return pathParams;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public AuthTag getAuthTag() {
        return authTag;
    }

    public boolean isPrivate() {
        return authTag == AuthTag.PRIVATE;
    }

    public ResponseReader<T> getReader() {
        return reader;
    }

    @Override
    public String toString() {
        return method + " " + (baseUrl == null ? "" : baseUrl) + pathTemplate
                + " " + fields.keySet() + " (" + authTag + ")";
    }

    public static final class Builder<T> {
        private final HttpMethod method;
        private final String pathTemplate;
        private final ResponseReader<T> reader;
        private final Map<String, String> pathParams = new LinkedHashMap<>();
        private final Map<String, Object> fields = new LinkedHashMap<>();
        private String baseUrl;
        private AuthTag authTag = AuthTag.DISABLED;

        private Builder(HttpMethod method, String pathTemplate, ResponseReader<T> reader) {
            this.method = Objects.requireNonNull(method, "method");
            if (pathTemplate == null || pathTemplate.isBlank()) {
                throw new IllegalArgumentException("路径模板不能为空");
            }
            this.pathTemplate = pathTemplate;
            this.reader = Objects.requireNonNull(reader, "reader");
        }

        public Builder<T> baseUrl(String baseUrl) {
            this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
            return this;
        }

        public Builder<T> pathParam(String name, String value) {
            pathParams.put(name, Objects.requireNonNull(value, name));
            return this;
        }

        /**
         * 添加字段，值为 null 时忽略
         */
        public Builder<T> field(String name, Object value) {
            if (value != null) {
                fields.put(name, value);
            }
            return this;
        }

        /**
         * 标记为私有接口，需要签名
         */
        public Builder<T> signed() {
            this.authTag = AuthTag.PRIVATE;
            return this;
        }

        public Operation<T> build() {
            return new Operation<>(this);
        }
    }
}

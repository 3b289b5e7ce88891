package com.trade.gateway.pipeline;

import com.trade.gateway.core.Operation;
import com.trade.gateway.exchange.ExchangeException;
import com.trade.gateway.exchange.ExchangeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * 最外层：把 {@link Operation} 解析为完整 URI，并用其 reader 读取解包后的响应
 * 路径参数逐段转义；Operation 自带 baseUrl 时使用它，否则使用客户端地址
 */
public class ExchangeTypingStage {

    private static final Logger logger = LoggerFactory.getLogger(ExchangeTypingStage.class);

    private final ExchangeId exchange;
    private final String baseUrl;
    private final Stage<ExchangeRequest, ExchangeResponse> next;

    public ExchangeTypingStage(ExchangeId exchange, String baseUrl, Stage<ExchangeRequest, ExchangeResponse> next) {
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.next = Objects.requireNonNull(next, "next");
    }

    public <T> T call(Operation<T> operation) throws ExchangeException {
        ExchangeRequest request = new ExchangeRequest(exchange, operation, resolve(operation));
        ExchangeResponse response = next.call(request);
        try {
            return operation.getReader().read(response.getPayload());
        } catch (IOException | RuntimeException e) {
            logger.debug("{} {} response did not match: {}", exchange, operation.getPathTemplate(), e.getMessage());
            throw ExchangeException.undecodable(response.getStatus(),
                    "cannot read " + exchange + " response for " + operation.getPathTemplate()
                            + ": " + e.getMessage(), e);
        }
    }

    URI resolve(Operation<?> operation) throws ExchangeException {
        String path = operation.getPathTemplate();
        for (Map.Entry<String, String> param : operation.getPathParams().entrySet()) {
            path = path.replace("{" + param.getKey() + "}", encodeSegment(param.getValue()));
        }
        if (path.indexOf('{') >= 0 || path.indexOf('}') >= 0) {
            throw new ExchangeException(ExchangeException.ErrorCode.CONSTRUCT_REQUEST,
                    "unresolved path parameter in " + operation.getPathTemplate());
        }
        if (!path.startsWith("/")) {
            path = "/" + path;
        }

        URI uri;
        try {
            String base = operation.getBaseUrl() == null ? baseUrl : stripTrailingSlash(operation.getBaseUrl());
            uri = new URI(base + path);
        } catch (URISyntaxException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.CONSTRUCT_REQUEST,
                    "invalid URI for " + operation.getPathTemplate() + ": " + e.getMessage(), e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new ExchangeException(ExchangeException.ErrorCode.CONSTRUCT_REQUEST,
                    "URI is not absolute: " + uri);
        }
        // 参数只能由签名阶段追加
        if (uri.getRawQuery() != null || uri.getRawFragment() != null) {
            throw new ExchangeException(ExchangeException.ErrorCode.CONSTRUCT_REQUEST,
                    "endpoint URI must not carry a query: " + uri);
        }
        return uri;
    }

    private static String encodeSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}

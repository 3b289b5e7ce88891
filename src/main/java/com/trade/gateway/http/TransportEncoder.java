package com.trade.gateway.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.gateway.core.HttpMethod;
import com.trade.gateway.exchange.ExchangeException;
import com.trade.gateway.sign.SignedPayload;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 把签名结果组装为 {@link WireRequest}
 *
 * <p>GET 把签名后的参数串放在 URL 上，不带请求体。写请求按交易所的 {@link BodyEncoding}
 * 放入请求体；JSON 请求体直接由字段序列化，与签名串无关。
 */
public class TransportEncoder {

    public static final String ACCEPT_HEADER = "Accept";
    public static final String APPLICATION_JSON = "application/json";
    public static final String FORM_URLENCODED = "application/x-www-form-urlencoded";

    private final BodyEncoding bodyEncoding;
    private final ObjectMapper objectMapper;

    public TransportEncoder(BodyEncoding bodyEncoding, ObjectMapper objectMapper) {
        this.bodyEncoding = Objects.requireNonNull(bodyEncoding, "bodyEncoding");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * @param url     已解析的接口地址，不含参数
     * @param fields  操作字段，仅 JSON 请求体使用
     * @param payload 签名策略的输出
     */
    public WireRequest encode(HttpMethod method, String url, Map<String, Object> fields, SignedPayload payload)
            throws ExchangeException {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(ACCEPT_HEADER, APPLICATION_JSON);
        headers.putAll(payload.getHeaders());

        String params = payload.getParams();
        if (!method.hasBody()) {
            String target = params.isEmpty() ? url : url + "?" + params;
            return new WireRequest(method, target, headers, null, null);
        }

        switch (bodyEncoding) {
            case FORM:
                return new WireRequest(method, url, headers, bytes(params), FORM_URLENCODED);
            case JSON:
                return new WireRequest(method, url, headers, toJson(fields), APPLICATION_JSON);
            default:
                return new WireRequest(method, url, headers, bytes(params), null);
        }
    }

    private byte[] toJson(Map<String, Object> fields) throws ExchangeException {
        Map<String, Object> body = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            if (entry.getValue() != null) {
                body.put(entry.getKey(), jsonValue(entry.getValue()));
            }
        }
        try {
            return objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.SERIALIZE_BODY,
                    "cannot serialize request body: " + e.getOriginalMessage(), e);
        }
    }

    // 数值按字符串发送，避免精度丢失
    private static Object jsonValue(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Enum<?>) {
            return value.toString();
        }
        if (value instanceof Collection<?> items) {
            List<Object> converted = new ArrayList<>(items.size());
            for (Object item : items) {
                converted.add(jsonValue(item));
            }
            return converted;
        }
        return value;
    }

    private static byte[] bytes(String params) {
        return params.getBytes(StandardCharsets.UTF_8);
    }
}

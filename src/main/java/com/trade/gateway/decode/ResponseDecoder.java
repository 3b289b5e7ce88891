package com.trade.gateway.decode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.gateway.exchange.ExchangeException;
import com.trade.gateway.http.WireResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * 判定原始响应成功与否，并解出成功时的数据
 *
 * <p>失败状态只按错误结构解析，成功状态只按数据解析，两条路径都不回退到默认值。
 * 响应体无法解析时抛出的 DESERIALIZE_RESPONSE 带上 HTTP 状态码。
 */
public class ResponseDecoder {

    private static final Logger logger = LoggerFactory.getLogger(ResponseDecoder.class);

    private final SuccessRule successRule;
    private final String envelopeField;   // null 表示响应体即为数据
    private final ErrorEnvelope errorEnvelope;
    private final ObjectMapper objectMapper;

    public ResponseDecoder(SuccessRule successRule, String envelopeField, ErrorEnvelope errorEnvelope,
                           ObjectMapper objectMapper) {
        this.successRule = Objects.requireNonNull(successRule, "successRule");
        this.envelopeField = envelopeField;
        this.errorEnvelope = Objects.requireNonNull(errorEnvelope, "errorEnvelope");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public JsonNode decode(WireResponse response) throws ExchangeException {
        int status = response.getStatus();
        if (!successRule.isSuccess(status)) {
            throw classifyFailure(response);
        }

        JsonNode root = parse(response, "success");
        if (envelopeField == null) {
            return root;
        }
        JsonNode data = root.get(envelopeField);
        if (data == null || data.isNull()) {
            throw ExchangeException.undecodable(status,
                    "response has no '" + envelopeField + "' field, status=" + status, null);
        }
        return data;
    }

    private ExchangeException classifyFailure(WireResponse response) {
        int status = response.getStatus();
        JsonNode root;
        try {
            root = parse(response, "error");
        } catch (ExchangeException e) {
            return e;
        }
        ErrorEnvelope.Fields fields = errorEnvelope.extract(root);
        if (fields == null) {
            logger.debug("Error body with status {} does not match {}", status, errorEnvelope);
            return ExchangeException.undecodable(status, "unrecognized error body, status=" + status, null);
        }
        return ExchangeException.requestFailed(status, fields.getCode(), fields.getMessage());
    }

    private JsonNode parse(WireResponse response, String kind) throws ExchangeException {
        try {
            JsonNode root = objectMapper.readTree(response.getBody());
            if (root == null || root.isMissingNode()) {
                throw new IOException("empty body");
            }
            return root;
        } catch (IOException e) {
            throw ExchangeException.undecodable(response.getStatus(),
                    "cannot parse " + kind + " body, status=" + response.getStatus(), e);
        }
    }
}

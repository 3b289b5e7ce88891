package com.trade.gateway.exchange;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.gateway.decode.ErrorEnvelope;
import com.trade.gateway.decode.ResponseDecoder;
import com.trade.gateway.decode.SuccessRule;
import com.trade.gateway.http.BodyEncoding;
import com.trade.gateway.http.QueryEncoder;
import com.trade.gateway.http.TransportEncoder;
import com.trade.gateway.sign.SignerKind;

/**
 * 支持的交易所及其协议特征
 * 签名方式、写请求编码、成功判定、响应包装字段、错误结构
 */
public enum ExchangeId {
    BINANCE("binance", "https://api.binance.com",
            SignerKind.QUERY_HMAC, BodyEncoding.FORM, QueryEncoder.STANDARD,
            SuccessRule.STATUS_200, null, ErrorEnvelope.CODE_MSG),
    OKX("okx", "https://aws.okx.com",
            SignerKind.HEADER_HMAC, BodyEncoding.RAW_QUERY, QueryEncoder.STANDARD,
            SuccessRule.ANY_2XX, "data", ErrorEnvelope.CODE_MSG),
    UPBIT("upbit", "https://api.upbit.com",
            SignerKind.BEARER_TOKEN, BodyEncoding.JSON, QueryEncoder.BRACKETED_LISTS,
            SuccessRule.ANY_2XX, null, ErrorEnvelope.NESTED_ERROR),
    BITHUMB("bithumb", "https://api.bithumb.com",
            SignerKind.NONE, BodyEncoding.RAW_QUERY, QueryEncoder.STANDARD,
            SuccessRule.ANY_2XX, "data", ErrorEnvelope.STATUS_MESSAGE),
    CRYPTOCOM("cryptocom", "https://api.crypto.com",
            SignerKind.NONE, BodyEncoding.RAW_QUERY, QueryEncoder.STANDARD,
            SuccessRule.ANY_2XX, "data", ErrorEnvelope.CODE_MESSAGE);

    private final String code;
    private final String defaultBaseUrl;
    private final SignerKind signerKind;
    private final BodyEncoding bodyEncoding;
    private final QueryEncoder queryEncoder;
    private final SuccessRule successRule;
    private final String envelopeField;
    private final ErrorEnvelope errorEnvelope;

    ExchangeId(String code, String defaultBaseUrl, SignerKind signerKind, BodyEncoding bodyEncoding,
               QueryEncoder queryEncoder, SuccessRule successRule, String envelopeField,
               ErrorEnvelope errorEnvelope) {
        this.code = code;
        this.defaultBaseUrl = defaultBaseUrl;
        this.signerKind = signerKind;
        this.bodyEncoding = bodyEncoding;
        this.queryEncoder = queryEncoder;
        this.successRule = successRule;
        this.envelopeField = envelopeField;
        this.errorEnvelope = errorEnvelope;
    }

    /**
     * 配置键前缀，如 binance
     */
    public String getCode() {
        return code;
    }

    public String getDefaultBaseUrl() {
        return defaultBaseUrl;
    }

    public SignerKind getSignerKind() {
        return signerKind;
    }

    public QueryEncoder getQueryEncoder() {
        return queryEncoder;
    }

    public SuccessRule getSuccessRule() {
        return successRule;
    }

    public ErrorEnvelope getErrorEnvelope() {
        return errorEnvelope;
    }

    public TransportEncoder transportEncoder(ObjectMapper objectMapper) {
        return new TransportEncoder(bodyEncoding, objectMapper);
    }

    public ResponseDecoder responseDecoder(ObjectMapper objectMapper) {
        return new ResponseDecoder(successRule, envelopeField, errorEnvelope, objectMapper);
    }
}

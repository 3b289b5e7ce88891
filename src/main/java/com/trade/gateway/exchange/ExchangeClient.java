package com.trade.gateway.exchange;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.gateway.core.Credential;
import com.trade.gateway.core.Operation;
import com.trade.gateway.http.Transport;
import com.trade.gateway.pipeline.AuthenticationStage;
import com.trade.gateway.pipeline.ExchangeTypingStage;
import com.trade.gateway.pipeline.RawTransportStage;
import com.trade.gateway.sign.SigningContext;

import java.util.Objects;

/**
 * 单个交易所的客户端
 * 没有密钥时为公共客户端，只能执行公开接口；线程安全，可在多个调用间共享
 */
public class ExchangeClient {

    private final ExchangeId exchange;
    private final String baseUrl;
    private final Transport transport;
    private final SigningContext signingContext;
    private final ObjectMapper objectMapper;
    private final Credential credential;
    private final CommonOps ops;
    private final ExchangeTypingStage pipeline;

    ExchangeClient(ExchangeId exchange, String baseUrl, Transport transport, SigningContext signingContext,
                   ObjectMapper objectMapper, Credential credential, CommonOps ops) {
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.signingContext = Objects.requireNonNull(signingContext, "signingContext");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.credential = credential;
        this.ops = Objects.requireNonNull(ops, "ops");

        RawTransportStage raw = new RawTransportStage(
                exchange.transportEncoder(objectMapper), transport, exchange.responseDecoder(objectMapper));
        AuthenticationStage auth = new AuthenticationStage(
                exchange.getQueryEncoder(), exchange.getSignerKind().create(signingContext), credential, raw);
        this.pipeline = new ExchangeTypingStage(exchange, baseUrl, auth);
    }

    /**
     * 执行操作
     * @throws ExchangeException 任一阶段失败，不重试
     */
    public <T> T execute(Operation<T> operation) throws ExchangeException {
        return pipeline.call(operation);
    }

    /**
     * 执行操作，失败以 Outcome 返回而不抛出
     */
    public <T> Outcome<T> attempt(Operation<T> operation) {
        try {
            return Outcome.success(execute(operation));
        } catch (ExchangeException e) {
            return Outcome.failure(e);
        }
    }

    public CommonOps ops() {
        return ops;
    }

    /**
     * 用同样的配置创建带密钥的客户端
     */
    public ExchangeClient withCredential(Credential credential) {
        Objects.requireNonNull(credential, "credential");
        return new ExchangeClient(exchange, baseUrl, transport, signingContext, objectMapper, credential, ops);
    }

    public boolean isPrivate() {
        return credential != null;
    }

    public ExchangeId getExchangeId() {
        return exchange;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public String toString() {
        return "ExchangeClient{" + exchange + ", " + baseUrl + (isPrivate() ? ", private" : "") + "}";
    }
}

package com.trade.gateway.pipeline;

import com.trade.gateway.core.Credential;
import com.trade.gateway.core.Operation;
import com.trade.gateway.exchange.ExchangeException;
import com.trade.gateway.http.QueryEncoder;
import com.trade.gateway.sign.NoopSigner;
import com.trade.gateway.sign.SignedPayload;
import com.trade.gateway.sign.SigningStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 编码字段并签名
 *
 * <p>公共接口一律走 {@link NoopSigner}；私有接口使用交易所的签名策略，
 * 客户端没有密钥时抛出 {@code CREDENTIAL_REQUIRED}。
 */
public class AuthenticationStage implements Stage<ExchangeRequest, ExchangeResponse> {

    private static final Logger logger = LoggerFactory.getLogger(AuthenticationStage.class);

    private final QueryEncoder queryEncoder;
    private final SigningStrategy strategy;
    private final Credential credential;   // 公共客户端为 null
    private final Stage<SignedRequest, ExchangeResponse> next;

    public AuthenticationStage(QueryEncoder queryEncoder, SigningStrategy strategy, Credential credential,
                               Stage<SignedRequest, ExchangeResponse> next) {
        this.queryEncoder = Objects.requireNonNull(queryEncoder, "queryEncoder");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.credential = credential;
        this.next = Objects.requireNonNull(next, "next");
    }

    @Override
    public ExchangeResponse call(ExchangeRequest request) throws ExchangeException {
        return next.call(sign(request));
    }

    SignedRequest sign(ExchangeRequest request) throws ExchangeException {
        Operation<?> operation = request.getOperation();
        SigningStrategy selected = operation.isPrivate() ? strategy : NoopSigner.INSTANCE;
        if (selected.requiresCredential() && credential == null) {
            throw new ExchangeException(ExchangeException.ErrorCode.CREDENTIAL_REQUIRED,
                    request.getExchange() + " " + operation.getPathTemplate() + " requires API credentials");
        }

        String query = queryEncoder.encode(operation.getFields());
        SignedPayload payload = selected.sign(operation.getMethod(), request.getUri(), query, credential);
        logger.debug("{} {} signed={}", request.getExchange(), operation.getPathTemplate(), payload.isSigned());
        return new SignedRequest(request, payload);
    }
}

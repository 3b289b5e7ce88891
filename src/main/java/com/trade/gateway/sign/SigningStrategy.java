package com.trade.gateway.sign;

import com.trade.gateway.core.Credential;
import com.trade.gateway.core.HttpMethod;
import com.trade.gateway.exchange.ExchangeException;

import java.net.URI;

/**
 * 把编码后的请求变为可发送的已认证结果
 */
public interface SigningStrategy {

    /**
     * @param method     HTTP 方法
     * @param uri        已解析的接口地址，不含参数
     * @param query      按声明顺序 URL 编码后的字段
     * @param credential 密钥；{@link #requiresCredential()} 为 false 时可为 {@code null}
     */
    SignedPayload sign(HttpMethod method, URI uri, String query, Credential credential) throws ExchangeException;

    boolean requiresCredential();
}

package com.trade.gateway.sign;

import com.trade.gateway.core.Credential;
import com.trade.gateway.core.HttpMethod;

import java.net.URI;

/**
 * 原样发送编码后的字段，不做认证
 * 所有公共接口都用它；Bithumb 和 Crypto.com 不论标记一律使用
 */
public final class NoopSigner implements SigningStrategy {

    public static final NoopSigner INSTANCE = new NoopSigner();

    private NoopSigner() {}

    @Override
    public SignedPayload sign(HttpMethod method, URI uri, String query, Credential credential) {
        return SignedPayload.unsigned(query);
    }

    @Override
    public boolean requiresCredential() {
        return false;
    }
}

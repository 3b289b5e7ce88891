package com.trade.gateway.sign;

/**
 * 签名方式（封闭集合）
 */
public enum SignerKind {
    QUERY_HMAC,
    HEADER_HMAC,
    BEARER_TOKEN,
    // TODO: Bithumb 和 Crypto.com 私有接口需要各自的签名器（api-sign HMAC-SHA512 / JSON 体中的 sig）
    NONE;

    public SigningStrategy create(SigningContext context) {
        switch (this) {
            case QUERY_HMAC:
                return new QueryHmacSigner(context);
            case HEADER_HMAC:
                return new HeaderHmacSigner(context);
            case BEARER_TOKEN:
                return new BearerTokenSigner(context);
            default:
                return NoopSigner.INSTANCE;
        }
    }
}

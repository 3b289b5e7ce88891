package com.trade.gateway.sign;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.gateway.core.Credential;
import com.trade.gateway.core.HttpMethod;
import com.trade.gateway.exchange.ExchangeException;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Upbit 签名：HS256 JWT，放在 {@code Authorization: Bearer <token>} 头
 *
 * <p>声明包含 access key、新的 UUID nonce，有参数时再加参数查询串的 SHA-512。
 * 写请求体是 JSON，所以哈希覆盖的字节与实际发送的不同（Upbit 要求如此）。
 */
public class BearerTokenSigner implements SigningStrategy {

    public static final String AUTHORIZATION_HEADER = "Authorization";
    static final String QUERY_HASH_ALG = "SHA512";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SigningContext context;

    public BearerTokenSigner(SigningContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public SignedPayload sign(HttpMethod method, URI uri, String query, Credential credential) throws ExchangeException {
        Objects.requireNonNull(credential, "credential");
        String nonce = context.nextNonce().toString();

        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("access_key", credential.getApiKey());
        claims.put("nonce", nonce);
        if (!query.isEmpty()) {
            claims.put("query_hash", Digests.sha512Hex(query));
            claims.put("query_hash_alg", QUERY_HASH_ALG);
        }

        String token = compactToken(claims, credential.getSecretKey());
        return SignedPayload.builder(query)
                .header(AUTHORIZATION_HEADER, "Bearer " + token)
                .nonce(nonce)
                .signature(token)
                .build();
    }

    @Override
    public boolean requiresCredential() {
        return true;
    }

    static String compactToken(Map<String, Object> claims, String secret) throws ExchangeException {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("alg", "HS256");
        header.put("typ", "JWT");
        try {
            String signingInput = Digests.base64Url(MAPPER.writeValueAsBytes(header))
                    + "." + Digests.base64Url(MAPPER.writeValueAsBytes(claims));
            return signingInput + "." + Digests.base64Url(Digests.hmacSha256(secret, signingInput));
        } catch (JsonProcessingException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.SERIALIZE_BODY,
                    "cannot serialize token claims", e);
        }
    }
}

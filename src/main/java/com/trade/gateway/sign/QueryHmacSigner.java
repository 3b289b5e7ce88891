package com.trade.gateway.sign;

import com.trade.gateway.core.Credential;
import com.trade.gateway.core.HttpMethod;

import java.net.URI;
import java.util.Objects;

/**
 * Binance USER_DATA 签名
 *
 * <p>在编码后的字段后追加 {@code recvWindow} 和 {@code timestamp}，对整串做 HMAC-SHA256
 * （小写十六进制），签名作为最后一个参数。GET 放在 URL 上，其余作为表单请求体。
 */
public class QueryHmacSigner implements SigningStrategy {

    public static final String API_KEY_HEADER = "X-MBX-APIKEY";

    private final SigningContext context;

    public QueryHmacSigner(SigningContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public SignedPayload sign(HttpMethod method, URI uri, String query, Credential credential) {
        Objects.requireNonNull(credential, "credential");
        long timestamp = context.getClock().millis();
        long recvWindow = context.recvWindowMillis();

        StringBuilder combined = new StringBuilder(query);
        if (combined.length() > 0) {
            combined.append('&');
        }
        combined.append("recvWindow=").append(recvWindow)
                .append("&timestamp=").append(timestamp);

        String signature = sign(combined.toString(), credential.getSecretKey());
        return SignedPayload.builder(appendSignature(combined.toString(), signature))
                .header(API_KEY_HEADER, credential.getApiKey())
                .timestamp(String.valueOf(timestamp))
                .recvWindow(recvWindow)
                .signature(signature)
                .build();
    }

    @Override
    public boolean requiresCredential() {
        return true;
    }

    /**
     * 参数串的 HMAC-SHA256，小写十六进制
     */
    public static String sign(String data, String secret) {
        return Digests.toHex(Digests.hmacSha256(secret, data));
    }

    static String appendSignature(String combined, String signature) {
        return combined.isEmpty()
                ? "signature=" + signature
                : combined + "&signature=" + signature;
    }
}

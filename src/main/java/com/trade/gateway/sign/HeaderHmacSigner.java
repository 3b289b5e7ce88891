package com.trade.gateway.sign;

import com.trade.gateway.core.Credential;
import com.trade.gateway.core.HttpMethod;

import java.net.URI;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * OKX v5 签名
 *
 * <p>待签名串为 {@code timestamp + METHOD + requestPath}，GET 请求的 requestPath 带参数。
 * 签名取 HMAC-SHA256 的 base64，和时间戳、密钥一起放在 {@code OK-ACCESS-*} 请求头中。
 */
public class HeaderHmacSigner implements SigningStrategy {

    public static final String KEY_HEADER = "OK-ACCESS-KEY";
    public static final String SIGN_HEADER = "OK-ACCESS-SIGN";
    public static final String TIMESTAMP_HEADER = "OK-ACCESS-TIMESTAMP";
    public static final String PASSPHRASE_HEADER = "OK-ACCESS-PASSPHRASE";

    // 毫秒为 0 时 Instant#toString 会省略，OKX 要求固定三位
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final SigningContext context;

    public HeaderHmacSigner(SigningContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public SignedPayload sign(HttpMethod method, URI uri, String query, Credential credential) {
        Objects.requireNonNull(credential, "credential");
        String timestamp = TIMESTAMP_FORMAT.format(context.getClock().instant());
        String requestPath = requestPath(method, uri, query);
        String preHash = timestamp + method.name() + requestPath;
        String signature = Digests.base64(Digests.hmacSha256(credential.getSecretKey(), preHash));

        String passphrase = credential.getPassphrase();
        return SignedPayload.builder(query)
                .header(KEY_HEADER, credential.getApiKey())
                .header(TIMESTAMP_HEADER, timestamp)
                .header(PASSPHRASE_HEADER, passphrase == null ? "" : passphrase)
                .header(SIGN_HEADER, signature)
                .timestamp(timestamp)
                .signature(signature)
                .build();
    }

    @Override
    public boolean requiresCredential() {
        return true;
    }

    static String requestPath(HttpMethod method, URI uri, String query) {
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (method == HttpMethod.GET && !query.isEmpty()) {
            return path + "?" + query;
        }
        return path;
    }
}

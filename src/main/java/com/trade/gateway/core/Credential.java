package com.trade.gateway.core;

import java.util.Objects;

/**
 * API 密钥
 * 创建后不可变，toString 不输出明文
 */
public final class Credential {

    private final String apiKey;
    private final String secretKey;
    private final String passphrase;  // 仅 OKX 需要

    private Credential(String apiKey, String secretKey, String passphrase) {
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.secretKey = Objects.requireNonNull(secretKey, "secretKey");
        this.passphrase = passphrase;
    }

    public static Credential of(String apiKey, String secretKey) {
        return new Credential(apiKey, secretKey, null);
    }

    public static Credential of(String apiKey, String secretKey, String passphrase) {
        return new Credential(apiKey, secretKey, passphrase);
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getSecretKey() {
        return secretKey;
    }

    /**
     * @return passphrase，未设置时返回 null
     */
    public String getPassphrase() {
        return passphrase;
    }

    @Override
    public String toString() {
        return "Credential{apiKey=***, secretKey=***"
                + (passphrase == null ? "" : ", passphrase=***") + "}";
    }
}

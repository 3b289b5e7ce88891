package com.trade.gateway.config;

import com.trade.gateway.core.Credential;
import com.trade.gateway.exchange.ExchangeId;
import com.trade.gateway.sign.SigningContext;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;

/**
 * 网关配置 - 从 properties 文件读取密钥、地址覆盖和 HTTP 参数
 *
 * <pre>
 * binance.api.key=...
 * binance.api.secret=...
 * okx.api.passphrase=...
 * okx.base-url=https://www.okx.com
 * binance.futures-base-url=https://fapi.binance.com
 * binance.recv-window=5000
 * http.connect-timeout-ms=30000
 * http.read-timeout-ms=30000
 * http.proxy.host=127.0.0.1
 * http.proxy.port=7890
 * </pre>
 *
 * 以 YOUR_ 开头的值视为未配置
 */
public final class GatewayConfig {

    public static final String DEFAULT_RESOURCE = "trade-gateway.properties";

    private static final int DEFAULT_TIMEOUT_MS = 30_000;

    private final Properties properties;

    private GatewayConfig(Properties properties) {
        this.properties = properties;
    }

    public static GatewayConfig empty() {
        return new GatewayConfig(new Properties());
    }

    public static GatewayConfig fromProperties(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new GatewayConfig(copy);
    }

    /**
     * 从文件加载（UTF-8）
     */
    public static GatewayConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Properties properties = new Properties();
            properties.load(reader);
            return new GatewayConfig(properties);
        }
    }

    /**
     * 从 classpath 加载 trade-gateway.properties，不存在时返回空配置
     */
    public static GatewayConfig loadDefault() throws IOException {
        try (InputStream in = GatewayConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return empty();
            }
            Properties properties = new Properties();
            properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            return new GatewayConfig(properties);
        }
    }

    /**
     * 获取交易所密钥，key 或 secret 未配置时返回 empty
     */
    public Optional<Credential> credential(ExchangeId exchange) {
        String prefix = exchange.getCode() + ".api.";
        if (!hasProperty(prefix + "key") || !hasProperty(prefix + "secret")) {
            return Optional.empty();
        }
        String passphrase = hasProperty(prefix + "passphrase") ? getProperty(prefix + "passphrase") : null;
        return Optional.of(Credential.of(getProperty(prefix + "key"), getProperty(prefix + "secret"), passphrase));
    }

    public String baseUrl(ExchangeId exchange) {
        String key = exchange.getCode() + ".base-url";
        return hasProperty(key) ? getProperty(key) : exchange.getDefaultBaseUrl();
    }

    /**
     * 合约接口地址覆盖，未配置时为 empty
     */
    public Optional<String> futuresBaseUrl(ExchangeId exchange) {
        String key = exchange.getCode() + ".futures-base-url";
        return hasProperty(key) ? Optional.of(getProperty(key)) : Optional.empty();
    }

    public long recvWindowMillis() {
        return getLongProperty("binance.recv-window", SigningContext.DEFAULT_RECV_WINDOW_MILLIS);
    }

    public Duration connectTimeout() {
        return Duration.ofMillis(getIntProperty("http.connect-timeout-ms", DEFAULT_TIMEOUT_MS));
    }

    public Duration readTimeout() {
        return Duration.ofMillis(getIntProperty("http.read-timeout-ms", DEFAULT_TIMEOUT_MS));
    }

    public Optional<String> proxyHost() {
        return hasProperty("http.proxy.host") ? Optional.of(getProperty("http.proxy.host")) : Optional.empty();
    }

    public int proxyPort() {
        return getIntProperty("http.proxy.port", 0);
    }

    /**
     * 获取配置属性
     */
    public String getProperty(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalStateException("配置项缺失: " + key);
        }
        return value.trim();
    }

    /**
     * 检查属性是否存在
     */
    public boolean hasProperty(String key) {
        String value = properties.getProperty(key);
        return value != null && !value.trim().isEmpty() && !value.trim().startsWith("YOUR_");
    }

    /**
     * 获取整数配置，缺失或格式错误时返回默认值
     */
    public int getIntProperty(String key, int defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(getProperty(key));
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public long getLongProperty(String key, long defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }
        try {
            return Long.parseLong(getProperty(key));
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}

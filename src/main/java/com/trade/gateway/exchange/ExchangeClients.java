package com.trade.gateway.exchange;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.gateway.config.GatewayConfig;
import com.trade.gateway.core.Credential;
import com.trade.gateway.exchange.binance.BinanceOps;
import com.trade.gateway.exchange.bithumb.BithumbOps;
import com.trade.gateway.exchange.cryptocom.CryptocomOps;
import com.trade.gateway.exchange.okx.OkxOps;
import com.trade.gateway.exchange.upbit.UpbitOps;
import com.trade.gateway.http.OkHttpTransport;
import com.trade.gateway.http.Transport;
import com.trade.gateway.sign.SigningContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 交易所客户端工厂
 */
public final class ExchangeClients {

    private static final Logger logger = LoggerFactory.getLogger(ExchangeClients.class);

    private ExchangeClients() {}

    /**
     * 使用默认地址和默认 HTTP 设置创建公共客户端
     */
    public static ExchangeClient create(ExchangeId exchange) {
        return builder(exchange).build();
    }

    /**
     * 按配置创建客户端，配置了密钥时返回私有客户端
     */
    public static ExchangeClient create(ExchangeId exchange, GatewayConfig config) {
        Transport transport = new OkHttpTransport(config.connectTimeout(), config.readTimeout(),
                config.proxyHost().map(host -> OkHttpTransport.httpProxy(host, config.proxyPort())).orElse(null));
        Builder builder = builder(exchange)
                .baseUrl(config.baseUrl(exchange))
                .transport(transport)
                .signingContext(SigningContext.systemDefault().withRecvWindow(config.recvWindowMillis()));
        config.credential(exchange).ifPresent(builder::credential);
        config.futuresBaseUrl(exchange).ifPresent(builder::futuresBaseUrl);
        ExchangeClient client = builder.build();
        logger.info("Created {} client, base url {}, private={}", exchange, client.getBaseUrl(), client.isPrivate());
        return client;
    }

    public static Builder builder(ExchangeId exchange) {
        return new Builder(exchange);
    }

    /**
     * 交易所对应的通用操作实现
     */
    public static CommonOps opsFor(ExchangeId exchange) {
        return opsFor(exchange, null);
    }

    private static CommonOps opsFor(ExchangeId exchange, String futuresBaseUrl) {
        switch (exchange) {
            case BINANCE:
                return futuresBaseUrl == null ? new BinanceOps() : new BinanceOps(futuresBaseUrl);
            case OKX:
                return new OkxOps();
            case UPBIT:
                return new UpbitOps();
            case BITHUMB:
                return new BithumbOps();
            case CRYPTOCOM:
                return new CryptocomOps();
            default:
                throw new IllegalArgumentException("不支持的交易所: " + exchange);
        }
    }

    public static final class Builder {
        private final ExchangeId exchange;
        private String baseUrl;
        private String futuresBaseUrl;
        private Transport transport;
        private SigningContext signingContext;
        private ObjectMapper objectMapper;
        private Credential credential;

        private Builder(ExchangeId exchange) {
            this.exchange = Objects.requireNonNull(exchange, "exchange");
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        /**
         * 合约接口地址（目前仅 Binance U 本位合约使用）
         */
        public Builder futuresBaseUrl(String futuresBaseUrl) {
            this.futuresBaseUrl = futuresBaseUrl;
            return this;
        }

        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public Builder signingContext(SigningContext signingContext) {
            this.signingContext = signingContext;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder credential(Credential credential) {
            this.credential = credential;
            return this;
        }

        public ExchangeClient build() {
            return new ExchangeClient(
                    exchange,
                    baseUrl == null ? exchange.getDefaultBaseUrl() : baseUrl,
                    transport == null ? new OkHttpTransport() : transport,
                    signingContext == null ? SigningContext.systemDefault() : signingContext,
                    objectMapper == null ? new ObjectMapper() : objectMapper,
                    credential,
                    opsFor(exchange, futuresBaseUrl));
        }
    }
}

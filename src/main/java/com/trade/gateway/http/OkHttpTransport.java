package com.trade.gateway.http;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * 基于共享 {@link OkHttpClient} 的 {@link Transport}
 * 非 2xx 状态照常返回响应，只有网络故障才抛 {@link IOException}
 */
public class OkHttpTransport implements Transport {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private static final byte[] EMPTY = new byte[0];

    private final OkHttpClient httpClient;

    public OkHttpTransport() {
        this(DEFAULT_TIMEOUT, DEFAULT_TIMEOUT, null);
    }

    public OkHttpTransport(Duration connectTimeout, Duration readTimeout, Proxy proxy) {
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout)
                .writeTimeout(readTimeout);
        if (proxy != null) {
            builder.proxy(proxy);
        }
        this.httpClient = builder.build();
    }

    public OkHttpTransport(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static Proxy httpProxy(String host, int port) {
        return new Proxy(Proxy.Type.HTTP, new InetSocketAddress(host, port));
    }

    @Override
    public WireResponse execute(WireRequest request) throws IOException {
        Request.Builder builder = new Request.Builder().url(request.getUrl());
        for (Map.Entry<String, String> header : request.getHeaders().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }

        switch (request.getMethod()) {
            case GET:
                builder.get();
                break;
            case POST:
                builder.post(body(request));
                break;
            case DELETE:
                if (request.getBody() == null) {
                    builder.delete();
                } else {
                    builder.delete(body(request));
                }
                break;
            default:
                throw new IllegalArgumentException("Unsupported method: " + request.getMethod());
        }

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            ResponseBody body = response.body();
            return new WireResponse(response.code(), body == null ? EMPTY : body.bytes());
        }
    }

    private static RequestBody body(WireRequest request) {
        byte[] bytes = request.getBody();
        MediaType mediaType = request.getContentType() == null ? null : MediaType.parse(request.getContentType());
        return RequestBody.create(bytes == null ? EMPTY : bytes, mediaType);
    }
}

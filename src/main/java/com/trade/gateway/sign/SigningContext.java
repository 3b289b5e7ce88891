package com.trade.gateway.sign;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 签名用的时钟、随机数来源和 Binance recvWindow
 * 每次调用只在签名时读取一次
 */
public final class SigningContext {

    public static final long DEFAULT_RECV_WINDOW_MILLIS = 5000L;

    private final Clock clock;
    private final Supplier<UUID> nonceSupplier;
    private final long recvWindowMillis;

    public SigningContext(Clock clock, Supplier<UUID> nonceSupplier, long recvWindowMillis) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.nonceSupplier = Objects.requireNonNull(nonceSupplier, "nonceSupplier");
        if (recvWindowMillis <= 0) {
            throw new IllegalArgumentException("recvWindow must be positive: " + recvWindowMillis);
        }
        this.recvWindowMillis = recvWindowMillis;
    }

    public static SigningContext systemDefault() {
        return new SigningContext(Clock.systemUTC(), UUID::randomUUID, DEFAULT_RECV_WINDOW_MILLIS);
    }

    public SigningContext withRecvWindow(long recvWindowMillis) {
        return new SigningContext(clock, nonceSupplier, recvWindowMillis);
    }

    public Clock getClock() {
        return clock;
    }

    public long recvWindowMillis() {
        return recvWindowMillis;
    }

    UUID nextNonce() {
        return nonceSupplier.get();
    }
}

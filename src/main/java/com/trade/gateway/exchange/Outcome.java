package com.trade.gateway.exchange;

import java.util.Objects;

/**
 * 一次调用的结果：成功值或已分类的失败
 */
public final class Outcome<T> {

    private final T value;
    private final ExchangeException failure;

    private Outcome(T value, ExchangeException failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(value, null);
    }

    public static <T> Outcome<T> failure(ExchangeException failure) {
        return new Outcome<>(null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * @throws IllegalStateException 结果为失败时
     */
    public T getValue() {
        if (failure != null) {
            throw new IllegalStateException("Outcome is a failure: " + failure.getErrorCode(), failure);
        }
        return value;
    }

    /**
     * @return 失败异常，成功时为 {@code null}
     */
    public ExchangeException getFailure() {
        return failure;
    }

    /**
     * 交易所拒绝了请求（区别于网络或解析失败）
     */
    public boolean isRejected() {
        return failure != null && failure.getErrorCode() == ExchangeException.ErrorCode.REQUEST_FAILED;
    }

    public T orElseThrow() throws ExchangeException {
        if (failure != null) {
            throw failure;
        }
        return value;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Outcome{success}" : "Outcome{failure=" + failure.getErrorCode() + "}";
    }
}

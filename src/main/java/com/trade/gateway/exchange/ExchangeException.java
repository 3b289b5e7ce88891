package com.trade.gateway.exchange;

/**
 * 交易所异常
 * 每个阶段的失败都以此异常抛给调用方，内部不做重试
 */
public class ExchangeException extends Exception {

    private final ErrorCode errorCode;
    private final int httpStatus;          // 无 HTTP 响应时为 -1
    private final String exchangeCode;     // 交易所返回的错误码，可能为 null
    private final String exchangeMessage;  // 交易所返回的错误信息，可能为 null

    public ExchangeException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public ExchangeException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, -1, null, null);
    }

    private ExchangeException(ErrorCode errorCode, String message, Throwable cause,
                              int httpStatus, String exchangeCode, String exchangeMessage) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
        this.exchangeCode = exchangeCode;
        this.exchangeMessage = exchangeMessage;
    }

    /**
     * 交易所返回非成功状态，且错误体可解析
     */
    public static ExchangeException requestFailed(int httpStatus, String exchangeCode, String exchangeMessage) {
        return new ExchangeException(ErrorCode.REQUEST_FAILED,
                "request to API server returned error, status=" + httpStatus
                        + ", code=" + exchangeCode + ", msg=" + exchangeMessage,
                null, httpStatus, exchangeCode, exchangeMessage);
    }

    /**
     * 收到了 HTTP 响应但响应体无法解析，保留状态码以区分成功体和错误体
     */
    public static ExchangeException undecodable(int httpStatus, String message, Throwable cause) {
        return new ExchangeException(ErrorCode.DESERIALIZE_RESPONSE, message, cause, httpStatus, null, null);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public String getExchangeCode() {
        return exchangeCode;
    }

    public String getExchangeMessage() {
        return exchangeMessage;
    }

    public enum ErrorCode {
        CONSTRUCT_REQUEST,      // URI/方法组装失败
        SERIALIZE_BODY,         // 参数编码失败
        TRANSPORT,              // 网络/连接/TLS 错误
        REQUEST_FAILED,         // 交易所拒绝请求
        DESERIALIZE_RESPONSE,   // 成功响应无法解析
        NOT_SUPPORTED,          // 交易所不支持该操作
        CREDENTIAL_REQUIRED     // 私有接口缺少密钥
    }
}

package com.trade.gateway.decode;

/**
 * 哪些 HTTP 状态码算成功
 */
public enum SuccessRule {
    ANY_2XX {
        @Override
        public boolean isSuccess(int status) {
            return status >= 200 && status < 300;
        }
    },
    STATUS_200 {
        @Override
        public boolean isSuccess(int status) {
            return status == 200;
        }
    };

    public abstract boolean isSuccess(int status);
}

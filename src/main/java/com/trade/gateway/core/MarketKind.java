package com.trade.gateway.core;

/**
 * 市场类型
 */
public enum MarketKind {
    SPOT("spot"),                      // 现货
    USD_MARGINED_PERPETUAL("perp"),    // U 本位永续
    COIN_MARGINED_PERPETUAL("inverse"); // 币本位永续

    private final String code;

    MarketKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static MarketKind fromCode(String code) {
        for (MarketKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("无效的市场类型: " + code);
    }
}

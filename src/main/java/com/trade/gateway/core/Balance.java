package com.trade.gateway.core;

import java.math.BigDecimal;

/**
 * 单币种余额
 */
public class Balance {
    private final String asset;
    private final BigDecimal free;     // 可用
    private final BigDecimal locked;   // 冻结

    public Balance(String asset, BigDecimal free, BigDecimal locked) {
        this.asset = asset;
        this.free = free;
        this.locked = locked;
    }

    public String getAsset() { return asset; }
    public BigDecimal getFree() { return free; }
    public BigDecimal getLocked() { return locked; }

    public BigDecimal getTotal() {
        return free.add(locked);
    }
}

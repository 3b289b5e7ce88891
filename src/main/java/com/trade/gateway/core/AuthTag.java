package com.trade.gateway.core;

/**
 * 接口鉴权类型
 */
public enum AuthTag {
    DISABLED,  // 公共接口，不签名
    PRIVATE    // 私有接口，需要签名
}

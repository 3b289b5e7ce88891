package com.trade.gateway.http;

/**
 * 写请求的参数在请求体中的形式
 */
public enum BodyEncoding {
    /** 编码后的参数串，{@code application/x-www-form-urlencoded} */
    FORM,
    /** 编码后的参数串，不声明 Content-Type */
    RAW_QUERY,
    /** 由字段构造的 JSON 对象 */
    JSON
}

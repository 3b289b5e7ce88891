package com.trade.gateway.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * 把成功响应解包后的 JSON 转为操作的结果类型
 * 结构不符时可抛出任意运行时异常，管道统一报告为反序列化失败
 */
@FunctionalInterface
public interface ResponseReader<T> {

    T read(JsonNode payload) throws IOException;

    static ResponseReader<JsonNode> tree() {
        return payload -> payload;
    }
}

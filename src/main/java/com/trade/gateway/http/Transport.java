package com.trade.gateway.http;

import java.io.IOException;

/**
 * 执行一次网络请求
 * 连接复用、超时和取消都由实现负责
 */
public interface Transport {

    WireResponse execute(WireRequest request) throws IOException;
}

package com.trade.gateway.pipeline;

import com.trade.gateway.exchange.ExchangeException;

/**
 * 请求管道中的一层，失败原样抛给调用方
 */
@FunctionalInterface
public interface Stage<I, O> {

    O call(I input) throws ExchangeException;
}

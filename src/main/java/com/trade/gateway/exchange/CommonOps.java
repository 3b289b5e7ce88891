package com.trade.gateway.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.gateway.core.Balance;
import com.trade.gateway.core.Market;
import com.trade.gateway.core.OpenOrder;
import com.trade.gateway.core.Operation;
import com.trade.gateway.core.OrderRequest;
import com.trade.gateway.core.Orderbook;
import com.trade.gateway.core.Position;
import com.trade.gateway.core.Ticker;
import com.trade.gateway.core.Trade;

import java.util.List;
import java.util.Set;

/**
 * 交易所无关的通用操作
 * 每个方法只构造 Operation，不发请求；交易所未实现的操作抛出 NOT_SUPPORTED
 */
public interface CommonOps {

    ExchangeId exchange();

    Set<CommonOperation> supportedOperations();

    default boolean supports(CommonOperation operation) {
        return supportedOperations().contains(operation);
    }

    default Operation<List<Ticker>> getTickers() throws ExchangeException {
        throw unsupported(CommonOperation.GET_TICKERS);
    }

    default Operation<List<Trade>> getTrades(Market market) throws ExchangeException {
        throw unsupported(CommonOperation.GET_TRADES);
    }

    /**
     * @param ticks 档位数量，null 表示交易所默认值
     */
    default Operation<Orderbook> getOrderbook(Market market, Integer ticks) throws ExchangeException {
        throw unsupported(CommonOperation.GET_ORDERBOOK);
    }

    default Operation<List<OpenOrder>> getOrders(Market market) throws ExchangeException {
        throw unsupported(CommonOperation.GET_ORDERS);
    }

    default Operation<List<OpenOrder>> getAllOrders() throws ExchangeException {
        throw unsupported(CommonOperation.GET_ALL_ORDERS);
    }

    /**
     * @return 交易所订单ID
     */
    default Operation<String> placeOrder(Market market, OrderRequest order) throws ExchangeException {
        throw unsupported(CommonOperation.PLACE_ORDER);
    }

    default Operation<String> cancelOrder(Market market, String orderId) throws ExchangeException {
        throw unsupported(CommonOperation.CANCEL_ORDER);
    }

    /**
     * 撤销该市场全部挂单，返回交易所原始响应
     */
    default Operation<JsonNode> cancelAllOrders(Market market) throws ExchangeException {
        throw unsupported(CommonOperation.CANCEL_ALL_ORDERS);
    }

    default Operation<List<Balance>> getBalance() throws ExchangeException {
        throw unsupported(CommonOperation.GET_BALANCE);
    }

    /**
     * 合约持仓，无持仓的方向不返回
     */
    default Operation<List<Position>> getPosition(Market market) throws ExchangeException {
        throw unsupported(CommonOperation.GET_POSITION);
    }

    private ExchangeException unsupported(CommonOperation operation) {
        return new ExchangeException(ExchangeException.ErrorCode.NOT_SUPPORTED,
                exchange() + " does not support " + operation);
    }

    /**
     * 现货以外的市场直接拒绝
     */
    static void requireSpot(ExchangeId exchange, Market market) throws ExchangeException {
        if (!market.isSpot()) {
            throw new ExchangeException(ExchangeException.ErrorCode.NOT_SUPPORTED,
                    exchange + " supports spot markets only: " + market);
        }
    }
}

package com.trade.gateway.exchange.bithumb;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.gateway.core.Market;
import com.trade.gateway.core.OpenOrder;
import com.trade.gateway.core.Operation;
import com.trade.gateway.core.OrderRequest;
import com.trade.gateway.core.Orderbook;
import com.trade.gateway.core.Side;
import com.trade.gateway.exchange.CommonOperation;
import com.trade.gateway.exchange.CommonOps;
import com.trade.gateway.exchange.ExchangeException;
import com.trade.gateway.exchange.ExchangeId;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.trade.gateway.exchange.JsonReaders.array;
import static com.trade.gateway.exchange.JsonReaders.decimal;
import static com.trade.gateway.exchange.JsonReaders.epochMillis;
import static com.trade.gateway.exchange.JsonReaders.namedLevels;
import static com.trade.gateway.exchange.JsonReaders.require;
import static com.trade.gateway.exchange.JsonReaders.text;

/**
 * Bithumb 接口，交易对路径为 {order}_{payment}
 *
 * <p>私有接口不带签名发送，在有签名器之前会被交易所拒绝。
 * 撤单需要原订单方向，通用调用不带该信息，因此不提供。
 */
public class BithumbOps implements CommonOps {

    static final int ORDER_QUERY_COUNT = 100;

    private static final Set<CommonOperation> SUPPORTED = EnumSet.of(
            CommonOperation.GET_ORDERBOOK,
            CommonOperation.GET_ORDERS,
            CommonOperation.PLACE_ORDER);

    @Override
    public ExchangeId exchange() {
        return ExchangeId.BITHUMB;
    }

    @Override
    public Set<CommonOperation> supportedOperations() {
        return SUPPORTED;
    }

    @Override
    public Operation<Orderbook> getOrderbook(Market market, Integer ticks) throws ExchangeException {
        CommonOps.requireSpot(exchange(), market);
        return Operation.get("/public/orderbook/{order_currency}_{payment_currency}", BithumbOps::readOrderbook)
                .pathParam("order_currency", market.getBase())
                .pathParam("payment_currency", market.getQuote())
                .field("count", ticks)
                .build();
    }

    @Override
    public Operation<List<OpenOrder>> getOrders(Market market) throws ExchangeException {
        CommonOps.requireSpot(exchange(), market);
        return Operation.post("/info/orders", BithumbOps::readOpenOrders)
                .field("count", ORDER_QUERY_COUNT)
                .field("order_currency", market.getBase())
                .field("payment_currency", market.getQuote())
                .signed()
                .build();
    }

    @Override
    public Operation<String> placeOrder(Market market, OrderRequest order) throws ExchangeException {
        CommonOps.requireSpot(exchange(), market);
        String endpoint;
        if (order.isLimit()) {
            endpoint = "place";
        } else {
            endpoint = order.getSide() == Side.BUY ? "market_buy" : "market_sell";
        }
        return Operation.post("/trade/{place_or_market}", BithumbOps::readOrderId)
                .pathParam("place_or_market", endpoint)
                .field("order_currency", market.getBase())
                .field("payment_currency", market.getQuote())
                .field("units", order.getQuantity())
                .field("price", order.isLimit() ? order.getPrice() : null)
                .field("type", order.isLimit() ? orderType(order.getSide()) : null)
                .signed()
                .build();
    }

    static String orderType(Side side) {
        return side == Side.BUY ? "bid" : "ask";
    }

    static Orderbook readOrderbook(JsonNode payload) throws IOException {
        return new Orderbook(
                namedLevels(require(payload, "bids"), "price", "quantity"),
                namedLevels(require(payload, "asks"), "price", "quantity"),
                epochMillis(payload, "timestamp"));
    }

    static List<OpenOrder> readOpenOrders(JsonNode payload) throws IOException {
        List<OpenOrder> orders = new ArrayList<>();
        for (JsonNode item : array(payload)) {
            String type = text(item, "type");
            Side side;
            if ("bid".equals(type)) {
                side = Side.BUY;
            } else if ("ask".equals(type)) {
                side = Side.SELL;
            } else {
                throw new IOException("unknown order type: " + type);
            }
            orders.add(new OpenOrder(
                    text(item, "order_id"),
                    side,
                    decimal(item, "price"),
                    decimal(item, "units"),
                    decimal(item, "units_remaining")));
        }
        return orders;
    }

    static String readOrderId(JsonNode payload) throws IOException {
        return text(payload, "order_id");
    }
}

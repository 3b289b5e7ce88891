package com.trade.gateway.exchange.upbit;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.gateway.core.Balance;
import com.trade.gateway.core.Market;
import com.trade.gateway.core.OpenOrder;
import com.trade.gateway.core.Operation;
import com.trade.gateway.core.OrderRequest;
import com.trade.gateway.core.Orderbook;
import com.trade.gateway.core.OrderbookLevel;
import com.trade.gateway.core.Side;
import com.trade.gateway.core.TimeInForce;
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
import static com.trade.gateway.exchange.JsonReaders.single;
import static com.trade.gateway.exchange.JsonReaders.text;

/**
 * Upbit 现货接口 (v1)
 * 市场代码为 QUOTE-BASE，例如 KRW-BTC
 *
 * <p>注意：市价买单的数量是计价货币数量（花多少 KRW），不是基础货币数量。
 */
public class UpbitOps implements CommonOps {

    private static final Set<CommonOperation> SUPPORTED = EnumSet.of(
            CommonOperation.GET_ORDERBOOK,
            CommonOperation.GET_ORDERS,
            CommonOperation.PLACE_ORDER,
            CommonOperation.CANCEL_ORDER,
            CommonOperation.GET_BALANCE);

    @Override
    public ExchangeId exchange() {
        return ExchangeId.UPBIT;
    }

    @Override
    public Set<CommonOperation> supportedOperations() {
        return SUPPORTED;
    }

    public static String marketCode(Market market) {
        return market.getQuote() + "-" + market.getBase();
    }

    /**
     * Upbit 不支持指定档位数量，ticks 被忽略
     */
    @Override
    public Operation<Orderbook> getOrderbook(Market market, Integer ticks) throws ExchangeException {
        CommonOps.requireSpot(exchange(), market);
        return Operation.get("/v1/orderbook", UpbitOps::readOrderbook)
                .field("markets", marketCode(market))
                .build();
    }

    @Override
    public Operation<List<OpenOrder>> getOrders(Market market) throws ExchangeException {
        CommonOps.requireSpot(exchange(), market);
        return Operation.get("/v1/orders", UpbitOps::readOpenOrders)
                .field("market", marketCode(market))
                .field("state", "wait")
                .field("order_by", "desc")
                .signed()
                .build();
    }

    @Override
    public Operation<String> placeOrder(Market market, OrderRequest order) throws ExchangeException {
        CommonOps.requireSpot(exchange(), market);
        Operation.Builder<String> builder = Operation.post("/v1/orders", UpbitOps::readUuid)
                .field("market", marketCode(market))
                .field("side", side(order.getSide()));

        if (order.isLimit()) {
            if (order.getTimeInForce() != TimeInForce.GTC) {
                throw new ExchangeException(ExchangeException.ErrorCode.NOT_SUPPORTED,
                        "Upbit does not support time in force " + order.getTimeInForce());
            }
            builder.field("volume", order.getQuantity())
                    .field("price", order.getPrice())
                    .field("ord_type", "limit");
        } else if (order.getSide() == Side.BUY) {
            // 市价买：price 为花费的计价货币数量
            builder.field("price", order.getQuantity())
                    .field("ord_type", "price");
        } else {
            builder.field("volume", order.getQuantity())
                    .field("ord_type", "market");
        }

        return builder.field("identifier", order.getClientOrderId())
                .signed()
                .build();
    }

    @Override
    public Operation<String> cancelOrder(Market market, String orderId) {
        return Operation.delete("/v1/order", UpbitOps::readUuid)
                .field("uuid", orderId)
                .signed()
                .build();
    }

    @Override
    public Operation<List<Balance>> getBalance() {
        return Operation.get("/v1/accounts", UpbitOps::readBalances)
                .signed()
                .build();
    }

    static String side(Side side) {
        return side == Side.BUY ? "bid" : "ask";
    }

    static Side side(String side) throws IOException {
        switch (side) {
            case "bid":
                return Side.BUY;
            case "ask":
                return Side.SELL;
            default:
                throw new IOException("unknown side: " + side);
        }
    }

    static Orderbook readOrderbook(JsonNode payload) throws IOException {
        JsonNode book = single(payload);
        List<OrderbookLevel> bids = new ArrayList<>();
        List<OrderbookLevel> asks = new ArrayList<>();
        for (JsonNode unit : array(book, "orderbook_units")) {
            bids.add(new OrderbookLevel(decimal(unit, "bid_price"), decimal(unit, "bid_size")));
            asks.add(new OrderbookLevel(decimal(unit, "ask_price"), decimal(unit, "ask_size")));
        }
        return new Orderbook(bids, asks, epochMillis(book, "timestamp"));
    }

    static List<OpenOrder> readOpenOrders(JsonNode payload) throws IOException {
        List<OpenOrder> orders = new ArrayList<>();
        for (JsonNode item : array(payload)) {
            orders.add(new OpenOrder(
                    text(item, "uuid"),
                    side(text(item, "side")),
                    decimal(item, "price"),
                    decimal(item, "volume"),
                    decimal(item, "remaining_volume")));
        }
        return orders;
    }

    static String readUuid(JsonNode payload) throws IOException {
        return text(payload, "uuid");
    }

    static List<Balance> readBalances(JsonNode payload) throws IOException {
        List<Balance> balances = new ArrayList<>();
        for (JsonNode item : array(payload)) {
            balances.add(new Balance(text(item, "currency"), decimal(item, "balance"), decimal(item, "locked")));
        }
        return balances;
    }
}

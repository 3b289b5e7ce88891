package com.trade.gateway.exchange.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.gateway.core.Balance;
import com.trade.gateway.core.Market;
import com.trade.gateway.core.OpenOrder;
import com.trade.gateway.core.Operation;
import com.trade.gateway.core.OrderRequest;
import com.trade.gateway.core.Orderbook;
import com.trade.gateway.core.Position;
import com.trade.gateway.core.PositionSide;
import com.trade.gateway.core.ResponseReader;
import com.trade.gateway.core.Side;
import com.trade.gateway.core.Trade;
import com.trade.gateway.exchange.CommonOperation;
import com.trade.gateway.exchange.CommonOps;
import com.trade.gateway.exchange.ExchangeException;
import com.trade.gateway.exchange.ExchangeId;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.trade.gateway.exchange.JsonReaders.array;
import static com.trade.gateway.exchange.JsonReaders.decimal;
import static com.trade.gateway.exchange.JsonReaders.epochMillis;
import static com.trade.gateway.exchange.JsonReaders.optionalDecimal;
import static com.trade.gateway.exchange.JsonReaders.positionalLevels;
import static com.trade.gateway.exchange.JsonReaders.require;
import static com.trade.gateway.exchange.JsonReaders.text;

/**
 * Binance 现货 (api/v3) 与 U 本位合约 (fapi) 接口
 * 交易对格式 BTCUSDT；perp 市场的调用发往合约域名，签名方式相同
 */
public class BinanceOps implements CommonOps {

    public static final String DEFAULT_FUTURES_BASE_URL = "https://fapi.binance.com";

    private static final Set<CommonOperation> SUPPORTED = EnumSet.of(
            CommonOperation.GET_TRADES,
            CommonOperation.GET_ORDERBOOK,
            CommonOperation.GET_ORDERS,
            CommonOperation.GET_ALL_ORDERS,
            CommonOperation.PLACE_ORDER,
            CommonOperation.CANCEL_ORDER,
            CommonOperation.CANCEL_ALL_ORDERS,
            CommonOperation.GET_BALANCE,
            CommonOperation.GET_POSITION);

    private final String futuresBaseUrl;

    public BinanceOps() {
        this(DEFAULT_FUTURES_BASE_URL);
    }

    public BinanceOps(String futuresBaseUrl) {
        this.futuresBaseUrl = Objects.requireNonNull(futuresBaseUrl, "futuresBaseUrl");
    }

    @Override
    public ExchangeId exchange() {
        return ExchangeId.BINANCE;
    }

    @Override
    public Set<CommonOperation> supportedOperations() {
        return SUPPORTED;
    }

    public String getFuturesBaseUrl() {
        return futuresBaseUrl;
    }

    public static String symbol(Market market) {
        return market.joined("");
    }

    @Override
    public Operation<List<Trade>> getTrades(Market market) throws ExchangeException {
        if (isFutures(market)) {
            return Operation.get("/fapi/v1/trades", BinanceOps::readTrades)
                    .baseUrl(futuresBaseUrl)
                    .field("symbol", symbol(market))
                    .build();
        }
        return Operation.get("/api/v3/trades", BinanceOps::readTrades)
                .field("symbol", symbol(market))
                .build();
    }

    @Override
    public Operation<Orderbook> getOrderbook(Market market, Integer ticks) throws ExchangeException {
        if (isFutures(market)) {
            return Operation.get("/fapi/v1/depth", BinanceOps::readFuturesOrderbook)
                    .baseUrl(futuresBaseUrl)
                    .field("symbol", symbol(market))
                    .field("limit", ticks)
                    .build();
        }
        return Operation.get("/api/v3/depth", BinanceOps::readOrderbook)
                .field("symbol", symbol(market))
                .field("limit", ticks)
                .build();
    }

    @Override
    public Operation<List<OpenOrder>> getOrders(Market market) throws ExchangeException {
        if (isFutures(market)) {
            return Operation.get("/fapi/v1/openOrders", BinanceOps::readOpenOrders)
                    .baseUrl(futuresBaseUrl)
                    .field("symbol", symbol(market))
                    .signed()
                    .build();
        }
        return Operation.get("/api/v3/openOrders", BinanceOps::readOpenOrders)
                .field("symbol", symbol(market))
                .signed()
                .build();
    }

    /**
     * 现货全部挂单
     */
    @Override
    public Operation<List<OpenOrder>> getAllOrders() {
        return Operation.get("/api/v3/openOrders", BinanceOps::readOpenOrders)
                .signed()
                .build();
    }

    /**
     * 合约下单使用单向持仓模式 (positionSide=BOTH)，合约不支持 FULL 响应，使用 RESULT
     */
    @Override
    public Operation<String> placeOrder(Market market, OrderRequest order) throws ExchangeException {
        boolean futures = isFutures(market);
        Operation.Builder<String> builder = futures
                ? Operation.post("/fapi/v1/order", BinanceOps::readOrderId).baseUrl(futuresBaseUrl)
                : Operation.post("/api/v3/order", BinanceOps::readOrderId);
        return builder.field("symbol", symbol(market))
                .field("side", order.getSide())
                .field("positionSide", futures ? "BOTH" : null)
                .field("type", order.getType())
                .field("timeInForce", order.isLimit() ? order.getTimeInForce() : null)
                .field("quantity", order.getQuantity())
                .field("price", order.isLimit() ? order.getPrice() : null)
                .field("newClientOrderId", order.getClientOrderId())
                .field("newOrderRespType", futures ? "RESULT" : "FULL")
                .signed()
                .build();
    }

    @Override
    public Operation<String> cancelOrder(Market market, String orderId) throws ExchangeException {
        boolean futures = isFutures(market);
        long id;
        try {
            id = Long.parseLong(orderId);
        } catch (NumberFormatException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.SERIALIZE_BODY,
                    "Binance order id must be numeric: " + orderId, e);
        }
        Operation.Builder<String> builder = futures
                ? Operation.delete("/fapi/v1/order", BinanceOps::readOrderId).baseUrl(futuresBaseUrl)
                : Operation.delete("/api/v3/order", BinanceOps::readOrderId);
        return builder.field("symbol", symbol(market))
                .field("orderId", id)
                .signed()
                .build();
    }

    /**
     * 现货返回被撤订单数组，合约返回 {"code":200,"msg":...}
     */
    @Override
    public Operation<JsonNode> cancelAllOrders(Market market) throws ExchangeException {
        Operation.Builder<JsonNode> builder = isFutures(market)
                ? Operation.delete("/fapi/v1/allOpenOrders", ResponseReader.tree()).baseUrl(futuresBaseUrl)
                : Operation.delete("/api/v3/openOrders", ResponseReader.tree());
        return builder.field("symbol", symbol(market))
                .signed()
                .build();
    }

    /**
     * 现货账户余额
     */
    @Override
    public Operation<List<Balance>> getBalance() {
        return Operation.get("/api/v3/account", BinanceOps::readBalances)
                .signed()
                .build();
    }

    /**
     * 仅 U 本位合约有持仓
     */
    @Override
    public Operation<List<Position>> getPosition(Market market) throws ExchangeException {
        if (!isFutures(market)) {
            throw new ExchangeException(ExchangeException.ErrorCode.NOT_SUPPORTED,
                    "Binance positions exist for perpetual markets only: " + market);
        }
        return Operation.<List<Position>>get("/fapi/v2/positionRisk", payload -> readPositions(payload, market))
                .baseUrl(futuresBaseUrl)
                .field("symbol", symbol(market))
                .signed()
                .build();
    }

    /**
     * 现货 → false，U 本位永续 → true，币本位 (dapi) 不支持
     */
    private static boolean isFutures(Market market) throws ExchangeException {
        switch (market.getKind()) {
            case SPOT:
                return false;
            case USD_MARGINED_PERPETUAL:
                return true;
            default:
                throw new ExchangeException(ExchangeException.ErrorCode.NOT_SUPPORTED,
                        "Binance coin-margined futures are not supported: " + market);
        }
    }

    static List<Trade> readTrades(JsonNode payload) throws IOException {
        List<Trade> trades = new ArrayList<>();
        for (JsonNode item : array(payload)) {
            // 买方是挂单方，则主动方为卖
            Side takerSide = require(item, "isBuyerMaker").asBoolean() ? Side.SELL : Side.BUY;
            trades.add(new Trade(
                    text(item, "id"),
                    decimal(item, "price"),
                    decimal(item, "qty"),
                    takerSide,
                    epochMillis(item, "time")));
        }
        return trades;
    }

    static Orderbook readOrderbook(JsonNode payload) throws IOException {
        return new Orderbook(
                positionalLevels(require(payload, "bids")),
                positionalLevels(require(payload, "asks")),
                null);
    }

    static List<OpenOrder> readOpenOrders(JsonNode payload) throws IOException {
        List<OpenOrder> orders = new ArrayList<>();
        for (JsonNode item : array(payload)) {
            orders.add(new OpenOrder(
                    text(item, "orderId"),
                    Side.valueOf(text(item, "side")),
                    decimal(item, "price"),
                    decimal(item, "origQty"),
                    decimal(item, "origQty").subtract(decimal(item, "executedQty"))));
        }
        return orders;
    }

    static String readOrderId(JsonNode payload) throws IOException {
        return text(payload, "orderId");
    }

    static List<Balance> readBalances(JsonNode payload) throws IOException {
        List<Balance> balances = new ArrayList<>();
        for (JsonNode item : array(payload, "balances")) {
            balances.add(new Balance(text(item, "asset"), decimal(item, "free"), decimal(item, "locked")));
        }
        return balances;
    }

    static Orderbook readFuturesOrderbook(JsonNode payload) throws IOException {
        return new Orderbook(
                positionalLevels(require(payload, "bids")),
                positionalLevels(require(payload, "asks")),
                epochMillis(payload, "T"));
    }

    static List<Position> readPositions(JsonNode payload, Market market) throws IOException {
        List<Position> positions = new ArrayList<>();
        for (JsonNode item : array(payload)) {
            BigDecimal positionAmt = decimal(item, "positionAmt");
            if (positionAmt.signum() == 0) {
                continue;
            }
            PositionSide side = positionAmt.signum() > 0 ? PositionSide.LONG : PositionSide.SHORT;
            positions.add(new Position(
                    market,
                    side,
                    positionAmt.abs(),
                    decimal(item, "entryPrice"),
                    optionalDecimal(item, "markPrice"),
                    optionalDecimal(item, "unRealizedProfit"),
                    optionalDecimal(item, "leverage")));
        }
        return positions;
    }
}

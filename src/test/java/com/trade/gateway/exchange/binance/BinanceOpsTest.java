package com.trade.gateway.exchange.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.gateway.core.HttpMethod;
import com.trade.gateway.core.Market;
import com.trade.gateway.core.MarketKind;
import com.trade.gateway.core.OpenOrder;
import com.trade.gateway.core.Operation;
import com.trade.gateway.core.OrderRequest;
import com.trade.gateway.core.OrderType;
import com.trade.gateway.core.Orderbook;
import com.trade.gateway.core.Position;
import com.trade.gateway.core.PositionSide;
import com.trade.gateway.core.Side;
import com.trade.gateway.core.TimeInForce;
import com.trade.gateway.core.Trade;
import com.trade.gateway.exchange.CommonOperation;
import com.trade.gateway.exchange.ExchangeException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BinanceOpsTest {

    private static final Market BTC_USDT = Market.spot("btc", "usdt");
    private static final Market BTC_USDT_PERP = new Market("BTC", "USDT", MarketKind.USD_MARGINED_PERPETUAL);

    private final BinanceOps ops = new BinanceOps();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void placeOrder_limitShouldMapAllFieldsInOrder() throws Exception {
        OrderRequest order = OrderRequest.builder()
                .side(Side.SELL)
                .type(OrderType.LIMIT)
                .quantity(new BigDecimal("0.5"))
                .price(new BigDecimal("65000"))
                .timeInForce(TimeInForce.IOC)
                .clientOrderId("my-1")
                .build();

        Operation<String> op = ops.placeOrder(BTC_USDT, order);

        assertEquals(HttpMethod.POST, op.getMethod());
        assertEquals("/api/v3/order", op.getPathTemplate());
        assertTrue(op.isPrivate());
        assertEquals(List.of("symbol", "side", "type", "timeInForce", "quantity", "price",
                "newClientOrderId", "newOrderRespType"), List.copyOf(op.getFields().keySet()));
        assertEquals("BTCUSDT", op.getFields().get("symbol"));
        assertEquals(TimeInForce.IOC, op.getFields().get("timeInForce"));
    }

    @Test
    void placeOrder_marketShouldOmitPriceAndTimeInForce() throws Exception {
        Operation<String> op = ops.placeOrder(BTC_USDT, OrderRequest.market(Side.BUY, new BigDecimal("1")));

        assertFalse(op.getFields().containsKey("price"));
        assertFalse(op.getFields().containsKey("timeInForce"));
    }

    @Test
    void cancelOrder_shouldRequireNumericId() throws Exception {
        assertEquals(123L, ops.cancelOrder(BTC_USDT, "123").getFields().get("orderId"));

        ExchangeException e = assertThrows(ExchangeException.class, () -> ops.cancelOrder(BTC_USDT, "abc"));
        assertEquals(ExchangeException.ErrorCode.SERIALIZE_BODY, e.getErrorCode());
    }

    @Test
    void coinMarginedMarkets_shouldNotBeSupported() {
        Market inverse = new Market("BTC", "USD", MarketKind.COIN_MARGINED_PERPETUAL);

        ExchangeException e = assertThrows(ExchangeException.class, () -> ops.getOrderbook(inverse, 10));
        assertEquals(ExchangeException.ErrorCode.NOT_SUPPORTED, e.getErrorCode());
        assertThrows(ExchangeException.class,
                () -> ops.placeOrder(inverse, OrderRequest.market(Side.BUY, BigDecimal.ONE)));
    }

    @Test
    void perpetualMarketData_shouldGoToFuturesHost() throws Exception {
        Operation<Orderbook> book = ops.getOrderbook(BTC_USDT_PERP, 20);
        Operation<List<Trade>> trades = ops.getTrades(BTC_USDT_PERP);

        assertEquals(BinanceOps.DEFAULT_FUTURES_BASE_URL, book.getBaseUrl());
        assertEquals("/fapi/v1/depth", book.getPathTemplate());
        assertEquals("BTCUSDT", book.getFields().get("symbol"));
        assertEquals("/fapi/v1/trades", trades.getPathTemplate());
        assertEquals(BinanceOps.DEFAULT_FUTURES_BASE_URL, trades.getBaseUrl());
        assertNull(ops.getOrderbook(BTC_USDT, 20).getBaseUrl());
    }

    @Test
    void placeOrder_perpetualShouldUseOneWayModeAndResultResponse() throws Exception {
        Operation<String> op = ops.placeOrder(BTC_USDT_PERP,
                OrderRequest.limit(Side.BUY, new BigDecimal("0.01"), new BigDecimal("60000")));

        assertEquals("/fapi/v1/order", op.getPathTemplate());
        assertEquals(BinanceOps.DEFAULT_FUTURES_BASE_URL, op.getBaseUrl());
        assertEquals(List.of("symbol", "side", "positionSide", "type", "timeInForce", "quantity", "price",
                "newOrderRespType"), List.copyOf(op.getFields().keySet()));
        assertEquals("BOTH", op.getFields().get("positionSide"));
        assertEquals("RESULT", op.getFields().get("newOrderRespType"));
    }

    @Test
    void cancelAllOrders_shouldRouteByMarketKind() throws Exception {
        Operation<JsonNode> spot = ops.cancelAllOrders(BTC_USDT);
        Operation<JsonNode> perp = ops.cancelAllOrders(BTC_USDT_PERP);

        assertEquals(HttpMethod.DELETE, spot.getMethod());
        assertEquals("/api/v3/openOrders", spot.getPathTemplate());
        assertNull(spot.getBaseUrl());
        assertTrue(spot.isPrivate());
        assertEquals("/fapi/v1/allOpenOrders", perp.getPathTemplate());
        assertEquals(BinanceOps.DEFAULT_FUTURES_BASE_URL, perp.getBaseUrl());
        assertTrue(perp.isPrivate());
    }

    @Test
    void getPosition_shouldExistForPerpetualsOnly() throws Exception {
        assertTrue(ops.supports(CommonOperation.GET_POSITION));

        Operation<List<Position>> op = new BinanceOps("https://fapi.test").getPosition(BTC_USDT_PERP);
        assertEquals("https://fapi.test", op.getBaseUrl());
        assertEquals("/fapi/v2/positionRisk", op.getPathTemplate());
        assertTrue(op.isPrivate());

        ExchangeException e = assertThrows(ExchangeException.class, () -> ops.getPosition(BTC_USDT));
        assertEquals(ExchangeException.ErrorCode.NOT_SUPPORTED, e.getErrorCode());
    }

    @Test
    void readPositions_shouldSkipFlatAndSignShorts() throws Exception {
        JsonNode payload = mapper.readTree("[{\"symbol\":\"BTCUSDT\",\"positionAmt\":\"0.000\","
                + "\"entryPrice\":\"0.0\"},"
                + "{\"symbol\":\"BTCUSDT\",\"positionAmt\":\"-0.250\",\"entryPrice\":\"61000.5\","
                + "\"markPrice\":\"60500.0\",\"unRealizedProfit\":\"125.125\",\"leverage\":\"10\"}]");

        List<Position> positions = BinanceOps.readPositions(payload, BTC_USDT_PERP);

        assertEquals(1, positions.size());
        Position position = positions.get(0);
        assertEquals(PositionSide.SHORT, position.getSide());
        assertEquals(new BigDecimal("0.250"), position.getQuantity());
        assertEquals(new BigDecimal("61000.5"), position.getEntryPrice());
        assertEquals(new BigDecimal("125.125"), position.getUnrealizedPnl());
        assertEquals(new BigDecimal("10"), position.getLeverage());
        assertEquals(BTC_USDT_PERP, position.getMarket());
    }

    @Test
    void readFuturesOrderbook_shouldTakeTransactionTime() throws Exception {
        JsonNode payload = mapper.readTree("{\"lastUpdateId\":1027024,\"E\":1589436922972,"
                + "\"T\":1589436922959,\"bids\":[[\"4.00000000\",\"431.00000000\"]],"
                + "\"asks\":[[\"4.00000200\",\"12.00000000\"]]}");

        Orderbook book = BinanceOps.readFuturesOrderbook(payload);

        assertEquals(Instant.ofEpochMilli(1589436922959L), book.getTimestamp());
        assertEquals(new BigDecimal("4.00000200"), book.getBestAsk().getPrice());
    }

    @Test
    void getOrderbook_publicWithLimit() throws Exception {
        Operation<Orderbook> op = ops.getOrderbook(BTC_USDT, 5);

        assertFalse(op.isPrivate());
        assertEquals(5, op.getFields().get("limit"));
        assertNull(ops.getOrderbook(BTC_USDT, null).getFields().get("limit"));
    }

    @Test
    void supportedOperations_shouldNotIncludeTickers() {
        assertTrue(ops.supports(CommonOperation.GET_TRADES));
        assertFalse(ops.supports(CommonOperation.GET_TICKERS));
        assertThrows(ExchangeException.class, ops::getTickers);
    }

    @Test
    void readOrderbook_shouldParsePositionalLevels() throws Exception {
        JsonNode payload = mapper.readTree("{\"lastUpdateId\":1027024,"
                + "\"bids\":[[\"4.00000000\",\"431.00000000\"]],"
                + "\"asks\":[[\"4.00000200\",\"12.00000000\"],[\"4.1\",\"1\"]]}");

        Orderbook book = BinanceOps.readOrderbook(payload);

        assertEquals(1, book.getBids().size());
        assertEquals(2, book.getAsks().size());
        assertEquals(new BigDecimal("4.00000000"), book.getBestBid().getPrice());
        assertEquals(new BigDecimal("12.00000000"), book.getBestAsk().getQuantity());
    }

    @Test
    void readTrades_buyerMakerMeansSellTaker() throws Exception {
        JsonNode payload = mapper.readTree("[{\"id\":28457,\"price\":\"4.00000100\",\"qty\":\"12.00000000\","
                + "\"quoteQty\":\"48.000012\",\"time\":1499865549590,\"isBuyerMaker\":true,\"isBestMatch\":true}]");

        List<Trade> trades = BinanceOps.readTrades(payload);

        assertEquals("28457", trades.get(0).getTradeId());
        assertEquals(Side.SELL, trades.get(0).getTakerSide());
        assertEquals(Instant.ofEpochMilli(1499865549590L), trades.get(0).getTimestamp());
    }

    @Test
    void readOpenOrders_shouldComputeRemaining() throws Exception {
        JsonNode payload = mapper.readTree("[{\"symbol\":\"LTCBTC\",\"orderId\":1,\"price\":\"0.1\","
                + "\"origQty\":\"1.0\",\"executedQty\":\"0.25\",\"side\":\"BUY\"}]");

        OpenOrder order = BinanceOps.readOpenOrders(payload).get(0);

        assertEquals("1", order.getOrderId());
        assertEquals(Side.BUY, order.getSide());
        assertEquals(0, new BigDecimal("0.75").compareTo(order.getRemainingQuantity()));
    }

    @Test
    void readBalances_missingFieldShouldFail() throws Exception {
        JsonNode payload = mapper.readTree("{\"balances\":[{\"asset\":\"BTC\",\"free\":\"1\"}]}");

        assertThrows(IOException.class, () -> BinanceOps.readBalances(payload));
    }
}

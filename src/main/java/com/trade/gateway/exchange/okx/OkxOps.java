package com.trade.gateway.exchange.okx;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.gateway.core.Balance;
import com.trade.gateway.core.Market;
import com.trade.gateway.core.Operation;
import com.trade.gateway.core.Orderbook;
import com.trade.gateway.core.Ticker;
import com.trade.gateway.exchange.CommonOperation;
import com.trade.gateway.exchange.CommonOps;
import com.trade.gateway.exchange.ExchangeException;
import com.trade.gateway.exchange.ExchangeId;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.trade.gateway.exchange.JsonReaders.array;
import static com.trade.gateway.exchange.JsonReaders.epochMillis;
import static com.trade.gateway.exchange.JsonReaders.optionalDecimal;
import static com.trade.gateway.exchange.JsonReaders.positionalLevels;
import static com.trade.gateway.exchange.JsonReaders.require;
import static com.trade.gateway.exchange.JsonReaders.single;
import static com.trade.gateway.exchange.JsonReaders.text;

/**
 * OKX v5 REST 接口
 * 产品 ID：现货 BASE-QUOTE，U 本位永续 BASE-QUOTE-SWAP
 */
public class OkxOps implements CommonOps {

    private static final Set<CommonOperation> SUPPORTED = EnumSet.of(
            CommonOperation.GET_TICKERS,
            CommonOperation.GET_ORDERBOOK,
            CommonOperation.GET_BALANCE);

    @Override
    public ExchangeId exchange() {
        return ExchangeId.OKX;
    }

    @Override
    public Set<CommonOperation> supportedOperations() {
        return SUPPORTED;
    }

    public static String instId(Market market) throws ExchangeException {
        switch (market.getKind()) {
            case SPOT:
                return market.joined("-");
            case USD_MARGINED_PERPETUAL:
                return market.joined("-") + "-SWAP";
            default:
                throw new ExchangeException(ExchangeException.ErrorCode.NOT_SUPPORTED,
                        "OKX market kind not supported: " + market);
        }
    }

    /**
     * 仅现货行情
     */
    @Override
    public Operation<List<Ticker>> getTickers() {
        return Operation.get("/api/v5/market/tickers", OkxOps::readTickers)
                .field("instType", "SPOT")
                .build();
    }

    @Override
    public Operation<Orderbook> getOrderbook(Market market, Integer ticks) throws ExchangeException {
        return Operation.get("/api/v5/market/books", OkxOps::readOrderbook)
                .field("instId", instId(market))
                .field("sz", ticks)
                .build();
    }

    @Override
    public Operation<List<Balance>> getBalance() {
        return Operation.get("/api/v5/account/balance", OkxOps::readBalances)
                .signed()
                .build();
    }

    static List<Ticker> readTickers(JsonNode payload) throws IOException {
        List<Ticker> tickers = new ArrayList<>();
        for (JsonNode item : array(payload)) {
            String[] parts = text(item, "instId").split("-");
            if (parts.length != 2) {
                continue;
            }
            tickers.add(new Ticker(
                    Market.spot(parts[0], parts[1]),
                    optionalDecimal(item, "bidPx"),
                    optionalDecimal(item, "askPx"),
                    optionalDecimal(item, "last")));
        }
        return tickers;
    }

    static Orderbook readOrderbook(JsonNode payload) throws IOException {
        JsonNode book = single(payload);
        return new Orderbook(
                positionalLevels(require(book, "bids")),
                positionalLevels(require(book, "asks")),
                epochMillis(book, "ts"));
    }

    static List<Balance> readBalances(JsonNode payload) throws IOException {
        List<Balance> balances = new ArrayList<>();
        for (JsonNode detail : array(single(payload), "details")) {
            balances.add(new Balance(
                    text(detail, "ccy"),
                    zeroIfBlank(optionalDecimal(detail, "availBal")),
                    zeroIfBlank(optionalDecimal(detail, "frozenBal"))));
        }
        return balances;
    }

    // OKX 对未使用的字段返回空字符串
    private static BigDecimal zeroIfBlank(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}

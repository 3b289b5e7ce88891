package com.trade.gateway.exchange.cryptocom;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.gateway.core.Market;
import com.trade.gateway.core.Operation;
import com.trade.gateway.core.Orderbook;
import com.trade.gateway.core.Side;
import com.trade.gateway.core.Ticker;
import com.trade.gateway.core.Trade;
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
import static com.trade.gateway.exchange.JsonReaders.optionalDecimal;
import static com.trade.gateway.exchange.JsonReaders.positionalLevels;
import static com.trade.gateway.exchange.JsonReaders.require;
import static com.trade.gateway.exchange.JsonReaders.single;
import static com.trade.gateway.exchange.JsonReaders.text;

/**
 * Crypto.com 交易所公共接口 (v2)，产品名为 BASE_QUOTE
 */
public class CryptocomOps implements CommonOps {

    private static final Set<CommonOperation> SUPPORTED = EnumSet.of(
            CommonOperation.GET_TICKERS,
            CommonOperation.GET_TRADES,
            CommonOperation.GET_ORDERBOOK);

    @Override
    public ExchangeId exchange() {
        return ExchangeId.CRYPTOCOM;
    }

    @Override
    public Set<CommonOperation> supportedOperations() {
        return SUPPORTED;
    }

    public static String instrumentName(Market market) {
        return market.joined("_");
    }

    @Override
    public Operation<List<Ticker>> getTickers() {
        return Operation.get("/v2/public/get-ticker", CryptocomOps::readTickers).build();
    }

    @Override
    public Operation<List<Trade>> getTrades(Market market) throws ExchangeException {
        CommonOps.requireSpot(exchange(), market);
        return Operation.get("/v2/public/get-trades", CryptocomOps::readTrades)
                .field("instrument_name", instrumentName(market))
                .build();
    }

    @Override
    public Operation<Orderbook> getOrderbook(Market market, Integer ticks) throws ExchangeException {
        CommonOps.requireSpot(exchange(), market);
        return Operation.get("/v2/public/get-book", CryptocomOps::readOrderbook)
                .field("instrument_name", instrumentName(market))
                .field("depth", ticks)
                .build();
    }

    static List<Ticker> readTickers(JsonNode payload) throws IOException {
        List<Ticker> tickers = new ArrayList<>();
        for (JsonNode item : array(payload)) {
            String[] parts = text(item, "i").split("_");
            if (parts.length != 2) {
                continue;
            }
            // b/k 在盘口为空时为 null
            tickers.add(new Ticker(
                    Market.spot(parts[0], parts[1]),
                    optionalDecimal(item, "b"),
                    optionalDecimal(item, "k"),
                    optionalDecimal(item, "a")));
        }
        return tickers;
    }

    static List<Trade> readTrades(JsonNode payload) throws IOException {
        List<Trade> trades = new ArrayList<>();
        for (JsonNode item : array(payload)) {
            trades.add(new Trade(
                    text(item, "d"),
                    decimal(item, "p"),
                    decimal(item, "q"),
                    Side.valueOf(text(item, "s")),
                    epochMillis(item, "t")));
        }
        return trades;
    }

    static Orderbook readOrderbook(JsonNode payload) throws IOException {
        JsonNode book = single(payload);
        return new Orderbook(
                positionalLevels(require(book, "bids")),
                positionalLevels(require(book, "asks")),
                epochMillis(book, "t"));
    }
}

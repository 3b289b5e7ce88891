package com.trade.gateway.pipeline;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.trade.gateway.core.Operation;
import com.trade.gateway.core.ResponseReader;
import com.trade.gateway.exchange.ExchangeException;
import com.trade.gateway.exchange.ExchangeId;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExchangeTypingStageTest {

    private final List<ExchangeRequest> seen = new ArrayList<>();

    private Stage<ExchangeRequest, ExchangeResponse> echo() {
        return request -> {
            seen.add(request);
            return new ExchangeResponse(request.getExchange(), 200, JsonNodeFactory.instance.textNode("ok"));
        };
    }

    @Test
    void call_shouldResolvePathParamsAgainstBaseUrl() throws Exception {
        ExchangeTypingStage stage = new ExchangeTypingStage(ExchangeId.BITHUMB, "https://api.bithumb.com/", echo());
        Operation<String> op = Operation.get("/public/orderbook/{order}_{payment}", node -> node.asText())
                .pathParam("order", "BTC")
                .pathParam("payment", "KRW")
                .build();

        assertEquals("ok", stage.call(op));
        assertEquals(URI.create("https://api.bithumb.com/public/orderbook/BTC_KRW"), seen.get(0).getUri());
        assertEquals(ExchangeId.BITHUMB, seen.get(0).getExchange());
    }

    @Test
    void call_operationBaseUrlShouldOverrideClientBaseUrl() throws Exception {
        ExchangeTypingStage stage = new ExchangeTypingStage(ExchangeId.BINANCE, "https://api.binance.com", echo());
        Operation<String> op = Operation.get("/fapi/v1/depth", node -> node.asText())
                .baseUrl("https://fapi.binance.com/")
                .build();

        stage.call(op);
        assertEquals(URI.create("https://fapi.binance.com/fapi/v1/depth"), seen.get(0).getUri());
    }

    @Test
    void call_shouldEscapePathParamValues() throws Exception {
        ExchangeTypingStage stage = new ExchangeTypingStage(ExchangeId.BITHUMB, "https://api.bithumb.com", echo());
        Operation<String> op = Operation.get("/x/{id}", node -> node.asText()).pathParam("id", "a b/c").build();

        stage.call(op);
        assertEquals("/x/a%20b%2Fc", seen.get(0).getUri().getRawPath());
    }

    @Test
    void call_unresolvedPlaceholderShouldFailConstruction() {
        ExchangeTypingStage stage = new ExchangeTypingStage(ExchangeId.BITHUMB, "https://api.bithumb.com", echo());
        Operation<String> op = Operation.get("/x/{id}", node -> node.asText()).build();

        ExchangeException e = assertThrows(ExchangeException.class, () -> stage.call(op));
        assertEquals(ExchangeException.ErrorCode.CONSTRUCT_REQUEST, e.getErrorCode());
        assertTrue(seen.isEmpty());
    }

    @Test
    void call_baseUrlWithQueryShouldFailConstruction() {
        ExchangeTypingStage stage = new ExchangeTypingStage(ExchangeId.BINANCE, "https://api.binance.com?x=1", echo());
        Operation<String> op = Operation.get("/api/v3/account", node -> node.asText()).build();

        ExchangeException e = assertThrows(ExchangeException.class, () -> stage.call(op));
        assertEquals(ExchangeException.ErrorCode.CONSTRUCT_REQUEST, e.getErrorCode());
    }

    @Test
    void call_malformedBaseUrlShouldFailConstruction() {
        ExchangeTypingStage stage = new ExchangeTypingStage(ExchangeId.BINANCE, "not a url", echo());
        Operation<String> op = Operation.get("/api/v3/account", node -> node.asText()).build();

        ExchangeException e = assertThrows(ExchangeException.class, () -> stage.call(op));
        assertEquals(ExchangeException.ErrorCode.CONSTRUCT_REQUEST, e.getErrorCode());
    }

    @Test
    void call_readerFailureShouldBeDeserializationError() {
        ExchangeTypingStage stage = new ExchangeTypingStage(ExchangeId.OKX, "https://aws.okx.com", echo());
        ResponseReader<String> failing = node -> {
            throw new IOException("missing field 'data'");
        };
        Operation<String> op = Operation.get("/api/v5/market/books", failing).build();

        ExchangeException e = assertThrows(ExchangeException.class, () -> stage.call(op));
        assertEquals(ExchangeException.ErrorCode.DESERIALIZE_RESPONSE, e.getErrorCode());
        assertEquals(200, e.getHttpStatus());
    }

    @Test
    void call_readerRuntimeExceptionShouldBeDeserializationError() {
        ExchangeTypingStage stage = new ExchangeTypingStage(ExchangeId.OKX, "https://aws.okx.com", echo());
        Operation<Integer> op = Operation.get("/api/v5/market/books", node -> node.get("missing").asInt()).build();

        ExchangeException e = assertThrows(ExchangeException.class, () -> stage.call(op));
        assertEquals(ExchangeException.ErrorCode.DESERIALIZE_RESPONSE, e.getErrorCode());
    }

    @Test
    void call_innerFailureShouldPropagateUnchanged() {
        ExchangeException rejected = ExchangeException.requestFailed(400, "-1", "bad");
        ExchangeTypingStage stage = new ExchangeTypingStage(ExchangeId.BINANCE, "https://api.binance.com",
                request -> {
                    throw rejected;
                });
        Operation<String> op = Operation.get("/api/v3/depth", node -> node.asText()).build();

        ExchangeException e = assertThrows(ExchangeException.class, () -> stage.call(op));
        assertSame(rejected, e);
    }
}

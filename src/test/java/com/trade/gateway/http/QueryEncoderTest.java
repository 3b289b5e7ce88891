package com.trade.gateway.http;

import com.trade.gateway.core.Side;
import com.trade.gateway.exchange.ExchangeException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryEncoderTest {

    @Test
    void encode_shouldKeepDeclaredOrder() throws Exception {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("symbol", "LTCBTC");
        fields.put("side", Side.BUY);
        fields.put("quantity", new BigDecimal("1"));
        fields.put("price", new BigDecimal("0.1"));

        assertEquals("symbol=LTCBTC&side=BUY&quantity=1&price=0.1", QueryEncoder.STANDARD.encode(fields));
    }

    @Test
    void encode_shouldRenderDecimalsPlain() throws Exception {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("quantity", new BigDecimal("1E-8"));

        assertEquals("quantity=0.00000001", QueryEncoder.STANDARD.encode(fields));
    }

    @Test
    void encode_shouldEscapeSpacesAsPercent20() throws Exception {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("note", "a b&c");

        assertEquals("note=a%20b%26c", QueryEncoder.STANDARD.encode(fields));
    }

    @Test
    void encode_emptyFieldsShouldGiveEmptyString() throws Exception {
        assertEquals("", QueryEncoder.STANDARD.encode(new LinkedHashMap<>()));
    }

    @Test
    void encode_standardShouldRejectLists() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("uuids", List.of("a", "b"));

        ExchangeException e = assertThrows(ExchangeException.class, () -> QueryEncoder.STANDARD.encode(fields));
        assertEquals(ExchangeException.ErrorCode.SERIALIZE_BODY, e.getErrorCode());
    }

    @Test
    void encode_bracketedShouldRepeatNameWithLiteralBrackets() throws Exception {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("market", "KRW-BTC");
        fields.put("uuids", List.of("u1", "u2"));

        assertEquals("market=KRW-BTC&uuids[]=u1&uuids[]=u2", QueryEncoder.BRACKETED_LISTS.encode(fields));
    }

    @Test
    void encode_bracketedShouldKeepEscapedBracketsInValues() throws Exception {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("identifier", "[x]");

        assertEquals("identifier=%5Bx%5D", QueryEncoder.BRACKETED_LISTS.encode(fields));
    }

    @Test
    void encode_emptyListShouldEmitNothing() throws Exception {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("market", "KRW-BTC");
        fields.put("uuids", List.of());

        assertEquals("market=KRW-BTC", QueryEncoder.BRACKETED_LISTS.encode(fields));
    }

    @Test
    void revertBracketsInNames_shouldBeIdempotent() {
        String query = "states%5B%5D=wait&states%5B%5D=done&id=%5Bx%5D";
        String once = QueryEncoder.revertBracketsInNames(query);

        assertEquals("states[]=wait&states[]=done&id=%5Bx%5D", once);
        assertEquals(once, QueryEncoder.revertBracketsInNames(once));
    }

    @Test
    void revertBracketsInNames_shouldLeaveOtherContentAlone() {
        String query = "a=1&b=%2F%20&c";
        assertEquals(query, QueryEncoder.revertBracketsInNames(query));
    }

    @Test
    void decode_shouldRoundTripEncodedFields() throws Exception {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("symbol", "BTC USDT");
        fields.put("price", new BigDecimal("100.50"));
        fields.put("tags", List.of("a/b", "c"));

        List<Map.Entry<String, String>> pairs = QueryEncoder.decode(QueryEncoder.BRACKETED_LISTS.encode(fields));

        assertEquals(4, pairs.size());
        assertEquals(Map.entry("symbol", "BTC USDT"), pairs.get(0));
        assertEquals(Map.entry("price", "100.50"), pairs.get(1));
        assertEquals(Map.entry("tags[]", "a/b"), pairs.get(2));
        assertEquals(Map.entry("tags[]", "c"), pairs.get(3));
    }

    @Test
    void decode_standardShouldRoundTripScalarFieldsInOrder() throws Exception {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("symbol", "BTC USDT");
        fields.put("clientOid", "a+b=c&d");
        fields.put("memo", "100%_~*中文");
        fields.put("quantity", new BigDecimal("0.00100"));
        fields.put("side", Side.SELL);
        fields.put("empty", "");

        List<Map.Entry<String, String>> pairs = QueryEncoder.decode(QueryEncoder.STANDARD.encode(fields));

        assertEquals(List.of(
                Map.entry("symbol", "BTC USDT"),
                Map.entry("clientOid", "a+b=c&d"),
                Map.entry("memo", "100%_~*中文"),
                Map.entry("quantity", "0.00100"),
                Map.entry("side", "SELL"),
                Map.entry("empty", "")), pairs);
    }

    @Test
    void formatScalar_shouldRejectNestedValues() {
        assertThrows(ExchangeException.class, () -> QueryEncoder.formatScalar("x", Map.of("a", 1)));
        assertThrows(ExchangeException.class, () -> QueryEncoder.formatScalar("x", null));
    }
}

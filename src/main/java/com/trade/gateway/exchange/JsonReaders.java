package com.trade.gateway.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.gateway.core.OrderbookLevel;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 响应解析工具
 * 交易所普遍用字符串表示数值，统一按字符串转 BigDecimal
 */
public final class JsonReaders {

    private JsonReaders() {}

    public static JsonNode require(JsonNode node, String field) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IOException("missing field '" + field + "'");
        }
        return value;
    }

    public static String text(JsonNode node, String field) throws IOException {
        return require(node, field).asText();
    }

    public static BigDecimal decimal(JsonNode node, String field) throws IOException {
        return toDecimal(require(node, field), field);
    }

    /**
     * 字段缺失或为 null 时返回 null
     */
    public static BigDecimal optionalDecimal(JsonNode node, String field) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isEmpty()) {
            return null;
        }
        return toDecimal(value, field);
    }

    public static Instant epochMillis(JsonNode node, String field) throws IOException {
        JsonNode value = require(node, field);
        try {
            return Instant.ofEpochMilli(Long.parseLong(value.asText()));
        } catch (NumberFormatException e) {
            throw new IOException("field '" + field + "' is not epoch millis: " + value.asText(), e);
        }
    }

    public static JsonNode array(JsonNode node) throws IOException {
        if (node == null || !node.isArray()) {
            throw new IOException("expected JSON array");
        }
        return node;
    }

    public static JsonNode array(JsonNode node, String field) throws IOException {
        JsonNode value = require(node, field);
        if (!value.isArray()) {
            throw new IOException("field '" + field + "' is not an array");
        }
        return value;
    }

    /**
     * 单元素数组取第一个元素，如 OKX books、Crypto.com get-book
     */
    public static JsonNode single(JsonNode node) throws IOException {
        JsonNode items = array(node);
        if (items.size() != 1) {
            throw new IOException("expected exactly one element, got " + items.size());
        }
        return items.get(0);
    }

    /**
     * [[price, qty, ...], ...] 形式的档位
     */
    public static List<OrderbookLevel> positionalLevels(JsonNode levels) throws IOException {
        List<OrderbookLevel> result = new ArrayList<>(array(levels).size());
        for (JsonNode level : levels) {
            if (!level.isArray() || level.size() < 2) {
                throw new IOException("malformed order book level: " + level);
            }
            result.add(new OrderbookLevel(toDecimal(level.get(0), "price"), toDecimal(level.get(1), "quantity")));
        }
        return result;
    }

    /**
     * [{"price":..., "quantity":...}, ...] 形式的档位
     */
    public static List<OrderbookLevel> namedLevels(JsonNode levels, String priceField, String quantityField)
            throws IOException {
        List<OrderbookLevel> result = new ArrayList<>(array(levels).size());
        for (JsonNode level : levels) {
            result.add(new OrderbookLevel(decimal(level, priceField), decimal(level, quantityField)));
        }
        return result;
    }

    private static BigDecimal toDecimal(JsonNode value, String field) throws IOException {
        try {
            return new BigDecimal(value.asText());
        } catch (NumberFormatException e) {
            throw new IOException("field '" + field + "' is not a number: " + value.asText(), e);
        }
    }
}

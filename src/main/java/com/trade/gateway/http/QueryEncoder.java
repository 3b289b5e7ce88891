package com.trade.gateway.http;

import com.trade.gateway.exchange.ExchangeException;

import java.math.BigDecimal;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 按字段声明顺序做 URL 编码
 *
 * <p>空格编码为 {@code %20}。列表字段在 STANDARD 下拒绝，在 BRACKETED_LISTS 下展开为
 * 重复的 {@code name[]=value}，并把参数名中转义的方括号还原；值里的方括号保持转义。
 */
public final class QueryEncoder {

    public static final QueryEncoder STANDARD = new QueryEncoder(false);
    public static final QueryEncoder BRACKETED_LISTS = new QueryEncoder(true);

    private final boolean bracketedLists;

    private QueryEncoder(boolean bracketedLists) {
        this.bracketedLists = bracketedLists;
    }

    public String encode(Map<String, Object> fields) throws ExchangeException {
        if (fields == null || fields.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            if (value instanceof Collection<?> list) {
                if (!bracketedLists) {
                    throw new ExchangeException(ExchangeException.ErrorCode.SERIALIZE_BODY,
                            "cannot encode list field '" + entry.getKey() + "' as URL parameters");
                }
                for (Object item : list) {
                    append(sb, entry.getKey() + "[]", formatScalar(entry.getKey(), item));
                }
            } else {
                append(sb, entry.getKey(), formatScalar(entry.getKey(), value));
            }
        }
        String query = sb.toString();
        return bracketedLists ? revertBracketsInNames(query) : query;
    }

    /**
     * 标量字段的线上文本，BigDecimal 不用科学计数法
     */
    public static String formatScalar(String name, Object value) throws ExchangeException {
        if (value == null || value instanceof Map<?, ?> || value instanceof Collection<?>) {
            throw new ExchangeException(ExchangeException.ErrorCode.SERIALIZE_BODY,
                    "field '" + name + "' is not a scalar value");
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return value.toString();
    }

    /**
     * 仅在参数名中把 {@code %5B}/{@code %5D} 还原为方括号，重复调用结果不变
     */
    public static String revertBracketsInNames(String query) {
        if (query.isEmpty()) {
            return query;
        }
        StringBuilder sb = new StringBuilder(query.length());
        String[] pairs = query.split("&", -1);
        for (int i = 0; i < pairs.length; i++) {
            if (i > 0) {
                sb.append('&');
            }
            String pair = pairs[i];
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            sb.append(name.replace("%5B", "[").replace("%5D", "]"));
            if (eq >= 0) {
                sb.append(pair, eq, pair.length());
            }
        }
        return sb.toString();
    }

    /**
     * 把已编码的参数串按顺序拆回解码后的名值对
     */
    public static List<Map.Entry<String, String>> decode(String query) {
        List<Map.Entry<String, String>> pairs = new ArrayList<>();
        if (query == null || query.isEmpty()) {
            return pairs;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            pairs.add(new AbstractMap.SimpleImmutableEntry<>(urlDecode(name), urlDecode(value)));
        }
        return pairs;
    }

    private static void append(StringBuilder sb, String name, String value) {
        if (sb.length() > 0) {
            sb.append('&');
        }
        sb.append(urlEncode(name)).append('=').append(urlEncode(value));
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20");
    }

    private static String urlDecode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}

package com.trade.gateway.decode;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 错误响应结构
 * 每个交易所的错误体格式不同，这里只取 code 和 message 两个字段
 */
public enum ErrorEnvelope {
    CODE_MSG(null, "code", "msg"),                 // {"code":-1121,"msg":"Invalid symbol."}
    STATUS_MESSAGE(null, "status", "message"),     // {"status":"5600","message":"..."}
    CODE_MESSAGE(null, "code", "message"),         // {"code":10004,"message":"BAD_REQUEST"}
    NESTED_ERROR("error", "name", "message");      // {"error":{"name":"...","message":"..."}}

    private final String container;
    private final String codeField;
    private final String messageField;

    ErrorEnvelope(String container, String codeField, String messageField) {
        this.container = container;
        this.codeField = codeField;
        this.messageField = messageField;
    }

    /**
     * @return 错误码和错误信息，响应体不含相应字段时返回 null
     */
    public Fields extract(JsonNode root) {
        JsonNode node = container == null ? root : root.get(container);
        if (node == null || !node.isObject()) {
            return null;
        }
        String code = text(node.get(codeField));
        String message = text(node.get(messageField));
        if (code == null && message == null) {
            return null;
        }
        return new Fields(code, message);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    public static final class Fields {
        private final String code;
        private final String message;

        Fields(String code, String message) {
            this.code = code;
            this.message = message;
        }

        public String getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }
    }
}

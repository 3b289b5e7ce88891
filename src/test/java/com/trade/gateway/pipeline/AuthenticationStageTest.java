package com.trade.gateway.pipeline;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.trade.gateway.core.Credential;
import com.trade.gateway.core.Operation;
import com.trade.gateway.core.ResponseReader;
import com.trade.gateway.exchange.ExchangeException;
import com.trade.gateway.exchange.ExchangeId;
import com.trade.gateway.http.QueryEncoder;
import com.trade.gateway.sign.SignerKind;
import com.trade.gateway.sign.SigningContext;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.net.URI;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuthenticationStageTest {

    private static final URI URI_ORDER = URI.create("https://api.binance.com/api/v3/order");

    private static AuthenticationStage stage(Credential credential) {
        Stage<SignedRequest, ExchangeResponse> sink = signed -> new ExchangeResponse(
                signed.getRequest().getExchange(), 200, JsonNodeFactory.instance.objectNode());
        return new AuthenticationStage(QueryEncoder.STANDARD,
                SignerKind.QUERY_HMAC.create(SigningContext.systemDefault()), credential, sink);
    }

    private static ExchangeRequest request(Operation<?> op) {
        return new ExchangeRequest(ExchangeId.BINANCE, op, URI_ORDER);
    }

    @Test
    void sign_publicOperationShouldStayUnsignedEvenWithCredential() throws Exception {
        Operation<?> op = Operation.get("/api/v3/depth", ResponseReader.tree()).field("symbol", "BTCUSDT").build();

        SignedRequest signed = stage(Credential.of("k", "s")).sign(request(op));

        assertFalse(signed.getPayload().isSigned());
        assertTrue(signed.getPayload().getHeaders().isEmpty());
        assertEquals("symbol=BTCUSDT", signed.getPayload().getParams());
    }

    @Test
    void sign_privateOperationShouldUseExchangeSigner() throws Exception {
        Operation<?> op = Operation.post("/api/v3/order", ResponseReader.tree())
                .field("symbol", "BTCUSDT")
                .field("quantity", new BigDecimal("0.5"))
                .signed()
                .build();

        SignedRequest signed = stage(Credential.of("k", "s")).sign(request(op));

        assertTrue(signed.getPayload().isSigned());
        assertTrue(signed.getPayload().getParams().startsWith("symbol=BTCUSDT&quantity=0.5&recvWindow=5000&timestamp="));
        assertEquals("k", signed.getPayload().getHeaders().get("X-MBX-APIKEY"));
    }

    @Test
    void call_privateOperationWithoutCredentialShouldFail() {
        Operation<?> op = Operation.get("/api/v3/account", ResponseReader.tree()).signed().build();

        ExchangeException e = assertThrows(ExchangeException.class, () -> stage(null).call(request(op)));
        assertEquals(ExchangeException.ErrorCode.CREDENTIAL_REQUIRED, e.getErrorCode());
    }

    @Test
    void call_unencodableFieldShouldFailBeforeSigning() {
        Operation<?> op = Operation.get("/api/v3/depth", ResponseReader.tree())
                .field("symbols", List.of("BTCUSDT", "ETHUSDT"))
                .build();

        ExchangeException e = assertThrows(ExchangeException.class, () -> stage(null).call(request(op)));
        assertEquals(ExchangeException.ErrorCode.SERIALIZE_BODY, e.getErrorCode());
    }
}

package com.trade.gateway.sign;

import com.trade.gateway.core.Credential;
import com.trade.gateway.core.HttpMethod;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class HeaderHmacSignerTest {

    private static final Credential CREDENTIAL = Credential.of("okx-key", "okx-secret", "okx-pass");

    private static HeaderHmacSigner signerAt(String instant) {
        Clock clock = Clock.fixed(Instant.parse(instant), ZoneOffset.UTC);
        return new HeaderHmacSigner(new SigningContext(clock, UUID::randomUUID, 5000));
    }

    @Test
    void sign_getShouldIncludeQueryInPrehash() {
        SignedPayload payload = signerAt("2020-12-08T09:08:57.715Z").sign(HttpMethod.GET,
                URI.create("https://aws.okx.com/api/v5/account/balance"), "ccy=BTC", CREDENTIAL);

        assertEquals("bcaop0CD6XyPPEF8Hrl2ytRKjQL3KE6d4aQOfeEr+kw=",
                payload.getHeaders().get(HeaderHmacSigner.SIGN_HEADER));
        assertEquals("2020-12-08T09:08:57.715Z", payload.getHeaders().get(HeaderHmacSigner.TIMESTAMP_HEADER));
        assertEquals("okx-key", payload.getHeaders().get(HeaderHmacSigner.KEY_HEADER));
        assertEquals("okx-pass", payload.getHeaders().get(HeaderHmacSigner.PASSPHRASE_HEADER));
        assertEquals("ccy=BTC", payload.getParams());
    }

    @Test
    void sign_postShouldSignPathOnly() {
        SignedPayload payload = signerAt("2020-12-08T09:08:57.715Z").sign(HttpMethod.POST,
                URI.create("https://aws.okx.com/api/v5/trade/order"), "instId=BTC-USDT&sz=1", CREDENTIAL);

        assertEquals("EYPYQzDdOn2cur6lBLY4fTJOkfR1txgRQZAktTWWFK8=",
                payload.getHeaders().get(HeaderHmacSigner.SIGN_HEADER));
        assertEquals("instId=BTC-USDT&sz=1", payload.getParams());
    }

    @Test
    void sign_getWithoutQueryShouldNotAppendQuestionMark() {
        SignedPayload payload = signerAt("2020-12-08T09:08:57.715Z").sign(HttpMethod.GET,
                URI.create("https://aws.okx.com/api/v5/account/balance"), "", CREDENTIAL);

        assertEquals("LCWCLwpqXxY1+A5RdBwNPh9ST9nuaMOpVq0ae4qwaAM=",
                payload.getHeaders().get(HeaderHmacSigner.SIGN_HEADER));
    }

    @Test
    void sign_shouldAlwaysRenderMilliseconds() {
        SignedPayload payload = signerAt("2021-01-01T00:00:00Z").sign(HttpMethod.GET,
                URI.create("https://aws.okx.com/api/v5/account/balance"), "", CREDENTIAL);

        assertEquals("2021-01-01T00:00:00.000Z", payload.getTimestamp());
    }

    @Test
    void sign_missingPassphraseShouldSendEmptyHeader() {
        SignedPayload payload = signerAt("2020-12-08T09:08:57.715Z").sign(HttpMethod.GET,
                URI.create("https://aws.okx.com/api/v5/account/balance"), "", Credential.of("k", "s"));

        assertEquals("", payload.getHeaders().get(HeaderHmacSigner.PASSPHRASE_HEADER));
    }

    @Test
    void requestPath_shouldFollowMethod() {
        URI uri = URI.create("https://aws.okx.com/api/v5/market/books");
        assertEquals("/api/v5/market/books?instId=BTC-USDT",
                HeaderHmacSigner.requestPath(HttpMethod.GET, uri, "instId=BTC-USDT"));
        assertEquals("/api/v5/market/books",
                HeaderHmacSigner.requestPath(HttpMethod.DELETE, uri, "instId=BTC-USDT"));
    }
}

package com.trade.gateway.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.gateway.core.Operation;
import com.trade.gateway.decode.ResponseDecoder;
import com.trade.gateway.exchange.ExchangeException;
import com.trade.gateway.http.Transport;
import com.trade.gateway.http.TransportEncoder;
import com.trade.gateway.http.WireRequest;
import com.trade.gateway.http.WireResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * 最内层：编码、发送、解码
 */
public class RawTransportStage implements Stage<SignedRequest, ExchangeResponse> {

    private static final Logger logger = LoggerFactory.getLogger(RawTransportStage.class);

    private final TransportEncoder encoder;
    private final Transport transport;
    private final ResponseDecoder decoder;

    public RawTransportStage(TransportEncoder encoder, Transport transport, ResponseDecoder decoder) {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    @Override
    public ExchangeResponse call(SignedRequest signed) throws ExchangeException {
        ExchangeRequest request = signed.getRequest();
        Operation<?> operation = request.getOperation();
        WireRequest wire = encoder.encode(operation.getMethod(), request.getUri().toString(),
                operation.getFields(), signed.getPayload());

        WireResponse response;
        try {
            response = transport.execute(wire);
        } catch (IOException e) {
            logger.debug("{} {} transport failure: {}", request.getExchange(), wire.getMethod(), e.getMessage());
            throw new ExchangeException(ExchangeException.ErrorCode.TRANSPORT,
                    "request to " + request.getExchange() + " failed: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.CONSTRUCT_REQUEST,
                    "invalid request for " + request.getExchange() + ": " + e.getMessage(), e);
        }

        logger.debug("{} {} {} -> {}", request.getExchange(), wire.getMethod(),
                request.getUri().getRawPath(), response.getStatus());
        JsonNode payload = decoder.decode(response);
        return new ExchangeResponse(request.getExchange(), response.getStatus(), payload);
    }
}

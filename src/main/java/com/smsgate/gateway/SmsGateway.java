package com.smsgate.gateway;

import reactor.core.publisher.Mono;

public interface SmsGateway {

    /**
     * Hands the message to the carrier. Errors with {@link GatewayException} when the carrier rejects it.
     */
    Mono<GatewayReceipt> send(String from, String to, String body);

    boolean isConfigured();
}

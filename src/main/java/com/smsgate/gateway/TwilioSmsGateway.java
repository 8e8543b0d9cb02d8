package com.smsgate.gateway;

import com.smsgate.config.SmsGateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Sends SMS through the Twilio Messages REST API.
 */
@Component
public class TwilioSmsGateway implements SmsGateway {

    private static final Logger log = LoggerFactory.getLogger(TwilioSmsGateway.class);

    private final WebClient webClient;
    private final SmsGateProperties.GatewayProperties gatewayProperties;

    public TwilioSmsGateway(WebClient.Builder webClientBuilder, SmsGateProperties properties) {
        this.gatewayProperties = properties.getGateway();
        this.webClient = webClientBuilder
                .baseUrl(gatewayProperties.getBaseUrl())
                .build();
    }

    @Override
    public boolean isConfigured() {
        return notBlank(gatewayProperties.getAccountSid()) && notBlank(gatewayProperties.getAuthToken());
    }

    @Override
    public Mono<GatewayReceipt> send(String from, String to, String body) {
        if (!isConfigured()) {
            return Mono.error(new GatewayException("gateway_not_configured",
                    "Twilio account SID or auth token is not configured"));
        }

        BodyInserters.FormInserter<String> form = BodyInserters.fromFormData("To", to)
                .with("From", from)
                .with("Body", body);
        if (notBlank(gatewayProperties.getStatusCallbackUrl())) {
            form = form.with("StatusCallback", gatewayProperties.getStatusCallbackUrl());
        }

        return webClient.post()
                .uri("/2010-04-01/Accounts/{accountSid}/Messages.json", gatewayProperties.getAccountSid())
                .headers(h -> h.setBasicAuth(gatewayProperties.getAccountSid(), gatewayProperties.getAuthToken()))
                .body(form)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(Map.class)
                        .defaultIfEmpty(Map.of())
                        .map(error -> toException(response.statusCode(), error)))
                .bodyToMono(Map.class)
                .map(response -> new GatewayReceipt((String) response.get("sid"), (String) response.get("status")))
                .doOnSuccess(receipt -> log.debug("Twilio accepted message sid={}", receipt.externalId()))
                .doOnError(e -> log.warn("Twilio send failed: {}", e.getMessage()));
    }

    private GatewayException toException(HttpStatusCode status, Map<?, ?> error) {
        Object code = error.get("code");
        Object message = error.get("message");
        return new GatewayException(
                code != null ? String.valueOf(code) : String.valueOf(status.value()),
                message != null ? String.valueOf(message) : "Twilio returned HTTP " + status.value());
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}

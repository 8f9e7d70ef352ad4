package com.streamfleet.controlplane.registry.backend;

import lombok.Value;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Status code and body of one HTTP exchange with a discovery backend.
 */
@Value
class BackendResponse {
    int status;
    String body;

    boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    boolean isNotFound() {
        return status == 404;
    }

    /**
     * Sends the request and collects the whole response, bounded by {@code timeout}.
     */
    static Mono<BackendResponse> exchange(HttpClient.ResponseReceiver<?> request, Duration timeout) {
        return request
            .responseSingle((res, body) -> body.asString(StandardCharsets.UTF_8)
                .defaultIfEmpty("")
                .map(text -> new BackendResponse(res.status().code(), text)))
            .timeout(timeout);
    }
}

package com.streamfleet.controlplane.registry;

import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Health probe using reactor-netty HttpClient: GET the URL, 200 means healthy.
 */
public class HttpHealthProbe implements IHealthProbe {
    private static final Logger log = LoggerFactory.getLogger(HttpHealthProbe.class);

    private final HttpClient httpClient;
    private final Duration timeout;

    public HttpHealthProbe(Duration timeout) {
        this.timeout = timeout;
        this.httpClient = HttpClient.create()
            .responseTimeout(timeout);
    }

    @Override
    public Mono<Boolean> probe(String healthCheckUrl) {
        return httpClient.get()
            .uri(healthCheckUrl)
            .responseSingle((res, body) -> body.asString(StandardCharsets.UTF_8)
                .defaultIfEmpty("")
                .map(ignored -> res.status().code() == HttpResponseStatus.OK.code()))
            .timeout(timeout)
            .doOnError(err -> log.debug("Health probe {} failed: {}", healthCheckUrl, err.toString()))
            .onErrorReturn(false);
    }
}

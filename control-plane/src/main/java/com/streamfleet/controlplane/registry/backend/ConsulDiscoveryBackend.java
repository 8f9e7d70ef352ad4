package com.streamfleet.controlplane.registry.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.streamfleet.controlplane.registry.BackendUnavailableException;
import com.streamfleet.controlplane.registry.RegistrationException;
import com.streamfleet.controlplane.registry.ServiceInstance;
import com.streamfleet.controlplane.registry.ServiceStatus;
import com.streamfleet.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consul agent HTTP API backend.
 * <p>
 * Instances with a health URL get an HTTP check run by Consul itself; the others
 * get a TTL check that the heartbeat loop passes.
 * Discovery asks for passing instances only.
 * </p>
 */
public class ConsulDiscoveryBackend implements IDiscoveryBackend {
    private static final Logger log = LoggerFactory.getLogger(ConsulDiscoveryBackend.class);

    private static final String CHECK_TIMEOUT = "5s";

    private final HttpClient httpClient;
    private final Duration timeout;
    private final Duration checkInterval;
    private final Clock clock;

    /**
     * @param checkInterval how often Consul runs the HTTP check of a registered instance
     */
    public ConsulDiscoveryBackend(String host, int port, Duration timeout, Duration checkInterval, Clock clock) {
        this.timeout = timeout;
        this.checkInterval = checkInterval;
        this.clock = clock;
        this.httpClient = HttpClient.create()
            .host(host)
            .port(port)
            .headers(h -> h.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON))
            .responseTimeout(timeout);

        log.info("Consul discovery backend initialized with {}:{}", host, port);
    }

    @Override
    public String getName() {
        return "consul";
    }

    @Override
    public Mono<Void> register(ServiceInstance instance) {
        String payload = JsonUtils.writeValueAsString(registrationDocument(instance));

        return BackendResponse.exchange(
                httpClient.put()
                    .uri("/v1/agent/service/register")
                    .send(ByteBufFlux.fromString(Mono.just(payload))),
                timeout)
            .onErrorMap(err -> new RegistrationException(
                "Consul unreachable while registering " + instance.getId(), err))
            .flatMap(response -> {
                if (!response.isSuccess()) {
                    return Mono.error(new RegistrationException(
                        "Consul rejected " + instance.getId() + ": " + response.getStatus() + " " + response.getBody()));
                }
                log.info("Registered {} with Consul", instance.getId());
                return Mono.<Void>empty();
            });
    }

    @Override
    public Mono<Void> deregister(String serviceName, String serviceId) {
        return BackendResponse.exchange(
                httpClient.put()
                    .uri("/v1/agent/service/deregister/" + encode(serviceId))
                    .send(ByteBufFlux.fromString(Mono.just(""))),
                timeout)
            .onErrorMap(err -> new BackendUnavailableException("Consul unreachable", err))
            .flatMap(response -> {
                if (response.isSuccess() || response.isNotFound()) {
                    log.info("Deregistered {} from Consul", serviceId);
                    return Mono.<Void>empty();
                }
                return Mono.error(new BackendUnavailableException(
                    "Consul deregister of " + serviceId + " failed: " + response.getStatus()));
            });
    }

    @Override
    public Mono<List<ServiceInstance>> discover(String serviceName) {
        return BackendResponse.exchange(
                httpClient.get().uri("/v1/health/service/" + encode(serviceName) + "?passing=true"),
                timeout)
            .onErrorMap(err -> new BackendUnavailableException("Consul unreachable", err))
            .flatMap(response -> {
                if (!response.isSuccess()) {
                    return Mono.error(new BackendUnavailableException(
                        "Consul discovery of " + serviceName + " failed: " + response.getStatus()));
                }
                return Mono.fromCallable(() -> parseHealthEntries(serviceName, response.getBody()));
            });
    }

    @Override
    public Mono<Void> heartbeat(ServiceInstance instance) {
        if (instance.getHealthCheckUrl() != null) {
            // Consul runs the HTTP check itself
            return Mono.empty();
        }

        return BackendResponse.exchange(
                httpClient.put()
                    .uri("/v1/agent/check/pass/service:" + encode(instance.getId()))
                    .send(ByteBufFlux.fromString(Mono.just(""))),
                timeout)
            .onErrorMap(err -> new BackendUnavailableException("Consul unreachable", err))
            .flatMap(response -> response.isSuccess()
                ? Mono.<Void>empty()
                : Mono.error(new BackendUnavailableException(
                    "Consul TTL pass for " + instance.getId() + " failed: " + response.getStatus())));
    }

    private Map<String, Object> registrationDocument(ServiceInstance instance) {
        Map<String, Object> check = new LinkedHashMap<>();
        if (instance.getHealthCheckUrl() != null) {
            check.put("HTTP", instance.getHealthCheckUrl());
            check.put("Interval", checkInterval.getSeconds() + "s");
            check.put("Timeout", CHECK_TIMEOUT);
        } else {
            check.put("TTL", instance.getTtl().getSeconds() + "s");
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("ID", instance.getId());
        document.put("Name", instance.getName());
        document.put("Tags", instance.getTags());
        document.put("Address", instance.getHost());
        document.put("Port", instance.getPort());
        document.put("Meta", instance.getMetadata());
        document.put("Check", check);
        return document;
    }

    private List<ServiceInstance> parseHealthEntries(String serviceName, String body) {
        List<ServiceInstance> instances = new ArrayList<>();
        JsonNode entries = JsonUtils.readTree(body);
        Instant now = clock.instant();

        for (JsonNode entry : entries) {
            JsonNode service = entry.path("Service");
            if (service.isMissingNode()) {
                continue;
            }

            String address = service.path("Address").asText("");
            if (address.isEmpty()) {
                address = entry.path("Node").path("Address").asText("");
            }

            List<String> tags = new ArrayList<>();
            service.path("Tags").forEach(tag -> tags.add(tag.asText()));

            Map<String, String> metadata = new LinkedHashMap<>();
            service.path("Meta").fields().forEachRemaining(field -> metadata.put(field.getKey(), field.getValue().asText()));

            instances.add(ServiceInstance.builder()
                .id(service.path("ID").asText())
                .name(service.path("Service").asText(serviceName))
                .host(address)
                .port(service.path("Port").asInt())
                .tags(List.copyOf(tags))
                .metadata(Map.copyOf(metadata))
                .status(ServiceStatus.HEALTHY)
                .registeredAt(now)
                .lastHeartbeat(now)
                .build());
        }

        log.debug("Consul returned {} passing instances of {}", instances.size(), serviceName);
        return instances;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}

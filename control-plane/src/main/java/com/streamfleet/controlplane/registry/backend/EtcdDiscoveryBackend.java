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
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * etcd v2 keys API backend.
 * <p>
 * Each instance is a key {@code /v2/keys/services/{name}/{id}} holding the instance
 * document, written with a TTL. A heartbeat rewrites the key, which refreshes the TTL.
 * </p>
 */
public class EtcdDiscoveryBackend implements IDiscoveryBackend {
    private static final Logger log = LoggerFactory.getLogger(EtcdDiscoveryBackend.class);

    private static final String KEY_PREFIX = "/v2/keys/services/";

    private final HttpClient httpClient;
    private final Duration timeout;

    public EtcdDiscoveryBackend(String host, int port, Duration timeout) {
        this.timeout = timeout;
        this.httpClient = HttpClient.create()
            .host(host)
            .port(port)
            .responseTimeout(timeout);

        log.info("etcd discovery backend initialized with {}:{}", host, port);
    }

    @Override
    public String getName() {
        return "etcd";
    }

    @Override
    public Mono<Void> register(ServiceInstance instance) {
        String form = "value=" + encode(JsonUtils.writeValueAsString(instance))
            + "&ttl=" + instance.getTtl().getSeconds();

        return BackendResponse.exchange(
                httpClient
                    .headers(h -> h.set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_X_WWW_FORM_URLENCODED))
                    .put()
                    .uri(instanceKey(instance.getName(), instance.getId()))
                    .send(ByteBufFlux.fromString(Mono.just(form))),
                timeout)
            .onErrorMap(err -> new RegistrationException(
                "etcd unreachable while registering " + instance.getId(), err))
            .flatMap(response -> {
                // 200 on update, 201 on create
                if (response.getStatus() != 200 && response.getStatus() != 201) {
                    return Mono.error(new RegistrationException(
                        "etcd rejected " + instance.getId() + ": " + response.getStatus() + " " + response.getBody()));
                }
                log.debug("Wrote {} to etcd", instance.getId());
                return Mono.<Void>empty();
            });
    }

    @Override
    public Mono<Void> deregister(String serviceName, String serviceId) {
        return BackendResponse.exchange(
                httpClient.delete().uri(instanceKey(serviceName, serviceId)),
                timeout)
            .onErrorMap(err -> new BackendUnavailableException("etcd unreachable", err))
            .flatMap(response -> {
                if (response.getStatus() == 200 || response.isNotFound()) {
                    log.info("Deregistered {} from etcd", serviceId);
                    return Mono.<Void>empty();
                }
                return Mono.error(new BackendUnavailableException(
                    "etcd delete of " + serviceId + " failed: " + response.getStatus()));
            });
    }

    @Override
    public Mono<List<ServiceInstance>> discover(String serviceName) {
        return BackendResponse.exchange(
                httpClient.get().uri(KEY_PREFIX + encode(serviceName) + "?recursive=true"),
                timeout)
            .onErrorMap(err -> new BackendUnavailableException("etcd unreachable", err))
            .flatMap(response -> {
                if (response.isNotFound()) {
                    return Mono.just(List.<ServiceInstance>of());
                }
                if (response.getStatus() != 200) {
                    return Mono.error(new BackendUnavailableException(
                        "etcd discovery of " + serviceName + " failed: " + response.getStatus()));
                }
                return Mono.fromCallable(() -> parseNodes(serviceName, response.getBody()));
            });
    }

    @Override
    public Mono<Void> heartbeat(ServiceInstance instance) {
        return register(instance)
            .onErrorMap(RegistrationException.class,
                err -> new BackendUnavailableException("etcd lease refresh failed for " + instance.getId(), err));
    }

    private List<ServiceInstance> parseNodes(String serviceName, String body) {
        List<ServiceInstance> instances = new ArrayList<>();
        JsonNode nodes = JsonUtils.readTree(body).path("node").path("nodes");

        for (JsonNode node : nodes) {
            String value = node.path("value").asText(null);
            if (value == null) {
                continue;
            }
            try {
                ServiceInstance instance = JsonUtils.readValue(value, ServiceInstance.class);
                if (instance.getStatus() != ServiceStatus.STOPPING && instance.getStatus() != ServiceStatus.STOPPED) {
                    instances.add(instance);
                }
            } catch (RuntimeException e) {
                log.warn("Skipping unparseable etcd entry {} of {}: {}",
                    node.path("key").asText(), serviceName, e.getMessage());
            }
        }

        return instances;
    }

    private static String instanceKey(String serviceName, String serviceId) {
        return KEY_PREFIX + encode(serviceName) + "/" + encode(serviceId);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}

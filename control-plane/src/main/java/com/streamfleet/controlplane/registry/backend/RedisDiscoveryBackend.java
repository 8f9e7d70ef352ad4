package com.streamfleet.controlplane.registry.backend;

import com.streamfleet.controlplane.registry.BackendUnavailableException;
import com.streamfleet.controlplane.registry.RegistrationException;
import com.streamfleet.controlplane.registry.ServiceInstance;
import com.streamfleet.controlplane.registry.ServiceStatus;
import com.streamfleet.core.util.JsonUtils;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Redis backend using the Lettuce reactive API.
 * <p>
 * Each instance document lives under its own key with a TTL; a set per service
 * holds the ids. Ids whose key has expired are removed from the set on discovery.
 * </p>
 */
public class RedisDiscoveryBackend implements IDiscoveryBackend {
    private static final Logger log = LoggerFactory.getLogger(RedisDiscoveryBackend.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;
    private final Duration timeout;

    public RedisDiscoveryBackend(String redisUrl, Duration timeout) {
        this.client = RedisClient.create(redisUrl);
        this.connection = client.connect();
        this.commands = connection.reactive();
        this.timeout = timeout;
        log.info("Connected to Redis: {}", redisUrl);
    }

    static String membersKey(String serviceName) {
        return "fleet:services:" + serviceName;
    }

    static String instanceKey(String serviceName, String serviceId) {
        return "fleet:services:" + serviceName + ":" + serviceId;
    }

    @Override
    public String getName() {
        return "redis";
    }

    @Override
    public Mono<Void> register(ServiceInstance instance) {
        return write(instance)
            .onErrorMap(err -> new RegistrationException("Redis write of " + instance.getId() + " failed", err));
    }

    @Override
    public Mono<Void> deregister(String serviceName, String serviceId) {
        return commands.del(instanceKey(serviceName, serviceId))
            .then(commands.srem(membersKey(serviceName), serviceId))
            .timeout(timeout)
            .doOnNext(removed -> log.info("Deregistered {} from Redis", serviceId))
            .onErrorMap(err -> new BackendUnavailableException("Redis unreachable", err))
            .then();
    }

    @Override
    public Mono<List<ServiceInstance>> discover(String serviceName) {
        return commands.smembers(membersKey(serviceName))
            .flatMap(serviceId -> commands.get(instanceKey(serviceName, serviceId))
                .map(json -> parse(serviceId, json))
                .switchIfEmpty(Mono.defer(() -> pruneExpired(serviceName, serviceId))))
            .filter(Optional::isPresent)
            .map(Optional::get)
            .filter(instance -> instance.getStatus() != ServiceStatus.STOPPING
                && instance.getStatus() != ServiceStatus.STOPPED)
            .collectList()
            .timeout(timeout)
            .onErrorMap(err -> new BackendUnavailableException("Redis unreachable", err));
    }

    @Override
    public Mono<Void> heartbeat(ServiceInstance instance) {
        return write(instance)
            .onErrorMap(err -> new BackendUnavailableException("Redis lease refresh failed for " + instance.getId(), err));
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }

    private Mono<Void> write(ServiceInstance instance) {
        String json = JsonUtils.writeValueAsString(instance);
        return commands.setex(instanceKey(instance.getName(), instance.getId()), instance.getTtl().getSeconds(), json)
            .then(commands.sadd(membersKey(instance.getName()), instance.getId()))
            .timeout(timeout)
            .then();
    }

    private Optional<ServiceInstance> parse(String serviceId, String json) {
        try {
            return Optional.of(JsonUtils.readValue(json, ServiceInstance.class));
        } catch (RuntimeException e) {
            log.warn("Skipping unparseable Redis entry {}: {}", serviceId, e.getMessage());
            return Optional.empty();
        }
    }

    private Mono<Optional<ServiceInstance>> pruneExpired(String serviceName, String serviceId) {
        log.debug("Pruning expired instance {} of {}", serviceId, serviceName);
        return commands.srem(membersKey(serviceName), serviceId)
            .thenReturn(Optional.empty());
    }
}

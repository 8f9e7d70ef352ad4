package com.streamfleet.controlplane.registry.backend;

import com.streamfleet.controlplane.registry.ServiceInstance;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Pluggable transport to a discovery backend.
 * <p>
 * Failures are signalled as {@code RegistrationException} from {@link #register}
 * and {@code BackendUnavailableException} from the other operations. A missing
 * instance on {@link #deregister} is not a failure.
 * </p>
 */
public interface IDiscoveryBackend {

    /**
     * Short name used in logs and stats.
     */
    String getName();

    Mono<Void> register(ServiceInstance instance);

    Mono<Void> deregister(String serviceName, String serviceId);

    /**
     * Instances of a service that the backend currently considers alive.
     */
    Mono<List<ServiceInstance>> discover(String serviceName);

    /**
     * Renews the instance's TTL or lease.
     */
    Mono<Void> heartbeat(ServiceInstance instance);

    default void close() {
    }
}

package com.streamfleet.controlplane.registry;

import reactor.core.publisher.Mono;

/**
 * Checks a service instance's health endpoint.
 */
public interface IHealthProbe {

    /**
     * @return true when the endpoint answered 200, false on any other status, error or timeout
     */
    Mono<Boolean> probe(String healthCheckUrl);
}

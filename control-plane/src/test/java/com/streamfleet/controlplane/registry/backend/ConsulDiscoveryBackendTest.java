package com.streamfleet.controlplane.registry.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.streamfleet.controlplane.registry.BackendUnavailableException;
import com.streamfleet.controlplane.registry.RegistrationException;
import com.streamfleet.controlplane.registry.ServiceInstance;
import com.streamfleet.controlplane.support.MutableClock;
import com.streamfleet.core.util.JsonUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs the backend against a minimal in-process Consul agent.
 */
class ConsulDiscoveryBackendTest {

    private final Map<String, JsonNode> services = new ConcurrentHashMap<>();
    private final List<String> passedChecks = new CopyOnWriteArrayList<>();
    private volatile boolean rejectRegistrations;

    private DisposableServer consul;
    private ConsulDiscoveryBackend backend;

    @BeforeEach
    void setUp() {
        consul = HttpServer.create()
            .host("localhost")
            .port(0)
            .route(routes -> routes
                .put("/v1/agent/service/register", (req, res) -> req.receive().aggregate().asString()
                    .flatMap(body -> {
                        if (rejectRegistrations) {
                            return res.status(500).sendString(Mono.just("Invalid check")).then();
                        }
                        JsonNode document = JsonUtils.readTree(body);
                        services.put(document.path("ID").asText(), document);
                        return res.status(200).send().then();
                    }))
                .put("/v1/agent/service/deregister/{id}", (req, res) ->
                    res.status(services.remove(req.param("id")) != null ? 200 : 404).send())
                .put("/v1/agent/check/pass/{checkId}", (req, res) -> {
                    passedChecks.add(req.param("checkId"));
                    return res.status(200).send();
                })
                .get("/v1/health/service/{name}", (req, res) ->
                    res.status(200)
                        .header("Content-Type", "application/json")
                        .sendString(Mono.just(healthEntries(req.param("name"))))))
            .bindNow();

        backend = new ConsulDiscoveryBackend(
            "localhost", consul.port(), Duration.ofSeconds(5), Duration.ofSeconds(10), new MutableClock());
    }

    @AfterEach
    void tearDown() {
        consul.disposeNow();
    }

    private String healthEntries(String serviceName) {
        ArrayNode entries = JsonUtils.mapper().createArrayNode();
        services.values().stream()
            .filter(document -> document.path("Name").asText().equals(serviceName))
            .forEach(document -> {
                ObjectNode entry = entries.addObject();
                entry.putObject("Node").put("Address", "192.168.1.10");
                ObjectNode service = entry.putObject("Service");
                service.put("ID", document.path("ID").asText());
                service.put("Service", document.path("Name").asText());
                service.put("Address", document.path("Address").asText());
                service.put("Port", document.path("Port").asInt());
                service.set("Tags", document.path("Tags"));
                service.set("Meta", document.path("Meta"));
            });
        return entries.toString();
    }

    private static ServiceInstance instance(String id, String host, String healthUrl) {
        return ServiceInstance.builder()
            .id(id)
            .name("ws")
            .host(host)
            .port(8080)
            .tags(List.of("v1"))
            .metadata(Map.of("weight", "2"))
            .healthCheckUrl(healthUrl)
            .build();
    }

    @Test
    void testRegister_SendsHttpCheckWhenHealthUrlPresent() {
        StepVerifier.create(backend.register(instance("ws-1", "10.0.0.1", "http://10.0.0.1:8080/health")))
            .verifyComplete();

        JsonNode check = services.get("ws-1").path("Check");
        assertEquals("http://10.0.0.1:8080/health", check.path("HTTP").asText());
        assertEquals("10s", check.path("Interval").asText());
        assertTrue(check.path("TTL").isMissingNode());
    }

    @Test
    void testRegister_SendsTtlCheckWithoutHealthUrl() {
        backend.register(instance("ws-1", "10.0.0.1", null)).block();

        assertEquals("30s", services.get("ws-1").path("Check").path("TTL").asText());
    }

    @Test
    void testRegister_RejectedByAgent() {
        rejectRegistrations = true;

        StepVerifier.create(backend.register(instance("ws-1", "10.0.0.1", null)))
            .expectError(RegistrationException.class)
            .verify();
    }

    @Test
    void testDiscover_ParsesPassingInstances() {
        backend.register(instance("ws-1", "10.0.0.1", null)).block();
        backend.register(instance("ws-2", "", null)).block();

        StepVerifier.create(backend.discover("ws"))
            .assertNext(instances -> {
                assertEquals(2, instances.size());
                ServiceInstance first = instances.stream().filter(i -> i.getId().equals("ws-1")).findFirst().orElseThrow();
                assertEquals("10.0.0.1", first.getHost());
                assertEquals(8080, first.getPort());
                assertEquals(List.of("v1"), first.getTags());
                assertEquals("2", first.getMetadata().get("weight"));

                ServiceInstance second = instances.stream().filter(i -> i.getId().equals("ws-2")).findFirst().orElseThrow();
                assertEquals("192.168.1.10", second.getHost());
            })
            .verifyComplete();
    }

    @Test
    void testDeregister_ToleratesUnknownInstance() {
        backend.register(instance("ws-1", "10.0.0.1", null)).block();

        StepVerifier.create(backend.deregister("ws", "ws-1")).verifyComplete();
        StepVerifier.create(backend.deregister("ws", "ws-1")).verifyComplete();
        assertFalse(services.containsKey("ws-1"));
    }

    @Test
    void testHeartbeat_PassesTtlCheckOnly() {
        backend.heartbeat(instance("ws-1", "10.0.0.1", null)).block();
        backend.heartbeat(instance("ws-2", "10.0.0.2", "http://10.0.0.2:8080/health")).block();

        assertEquals(List.of("service:ws-1"), passedChecks);
    }

    @Test
    void testDiscover_AgentDown() {
        consul.disposeNow();

        StepVerifier.create(backend.discover("ws"))
            .expectError(BackendUnavailableException.class)
            .verify(Duration.ofSeconds(10));
    }
}

package com.streamfleet.controlplane.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.streamfleet.controlplane.balancer.LoadBalancer;
import com.streamfleet.controlplane.balancer.Node;
import com.streamfleet.controlplane.config.BalancerConfig;
import com.streamfleet.controlplane.config.DiscoveryConfig;
import com.streamfleet.controlplane.config.ScalingConfig;
import com.streamfleet.controlplane.registry.ServiceRegistry;
import com.streamfleet.controlplane.registry.backend.MemoryDiscoveryBackend;
import com.streamfleet.controlplane.scale.ScalingManager;
import com.streamfleet.controlplane.support.MutableClock;
import com.streamfleet.core.util.JsonUtils;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.Value;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.client.HttpClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpServerTest {

    private final MutableClock clock = new MutableClock();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private LoadBalancer loadBalancer;
    private HttpServer httpServer;
    private HttpClient client;

    @BeforeEach
    void setUp() {
        ServiceRegistry registry = new ServiceRegistry(
            DiscoveryConfig.builder().build(),
            new MemoryDiscoveryBackend(clock),
            url -> Mono.just(true),
            meterRegistry,
            clock
        );
        loadBalancer = new LoadBalancer(BalancerConfig.builder().requestsPerMinute(1).build(), meterRegistry, clock);
        ScalingManager scalingManager = new ScalingManager(
            ScalingConfig.builder().build(), registry, loadBalancer, meterRegistry, clock);

        httpServer = new HttpServer(0, registry, loadBalancer, scalingManager, null);
        DisposableServer server = httpServer.start();
        client = HttpClient.create().host("localhost").port(server.port());
    }

    @AfterEach
    void tearDown() {
        httpServer.stop();
    }

    private Reply get(String uri) {
        return client.get().uri(uri)
            .responseSingle((res, body) -> body.asString(StandardCharsets.UTF_8).defaultIfEmpty("")
                .map(text -> new Reply(res.status().code(), text)))
            .block(Duration.ofSeconds(10));
    }

    private Reply post(String uri) {
        return client.post().uri(uri)
            .responseSingle((res, body) -> body.asString(StandardCharsets.UTF_8).defaultIfEmpty("")
                .map(text -> new Reply(res.status().code(), text)))
            .block(Duration.ofSeconds(10));
    }

    @Test
    void testHealthz() {
        Reply reply = get("/healthz");
        assertEquals(200, reply.getStatus());
        assertEquals("OK", reply.getBody());
    }

    @Test
    void testRoute_StatusCodes() {
        assertEquals(503, get("/api/v1/route?clientId=a").getStatus());

        loadBalancer.addNode(Node.builder().host("10.0.0.1").port(9000).build());

        Reply routed = get("/api/v1/route?clientId=b");
        assertEquals(200, routed.getStatus());
        assertEquals("10.0.0.1:9000", JsonUtils.readTree(routed.getBody()).path("nodeId").asText());

        Reply limited = get("/api/v1/route?clientId=b");
        assertEquals(429, limited.getStatus());
        assertEquals("rate_limited", JsonUtils.readTree(limited.getBody()).path("error").asText());

        assertEquals(400, get("/api/v1/route").getStatus());
    }

    @Test
    void testReleaseAndPriority() {
        loadBalancer.addNode(Node.builder().host("10.0.0.1").port(9000).build());
        get("/api/v1/route?clientId=c");

        assertEquals(204, post("/api/v1/release?clientId=c").getStatus());
        assertEquals(0, loadBalancer.getNodes().get(0).getCurrentConnections());

        assertEquals(204, post("/api/v1/clients/c/priority?priority=critical").getStatus());
        assertEquals(400, post("/api/v1/clients/c/priority?priority=urgent").getStatus());
    }

    @Test
    void testNodeStats() {
        loadBalancer.addNode(Node.builder().host("10.0.0.1").port(9000).build());

        assertEquals(204, post("/api/v1/nodes/10.0.0.1:9000/stats?connections=12&cpu=95&memory=40").getStatus());
        assertEquals(0, loadBalancer.getHealthyNodes().size());

        assertEquals(404, post("/api/v1/nodes/unknown:1/stats?connections=1&cpu=1&memory=1").getStatus());
        assertEquals(400, post("/api/v1/nodes/10.0.0.1:9000/stats?connections=x").getStatus());

        JsonNode nodes = JsonUtils.readTree(get("/api/v1/nodes").getBody());
        assertEquals(12, nodes.get(0).path("currentConnections").asInt());
    }

    @Test
    void testScalingEndpoints() {
        Reply up = post("/api/v1/scaling/up?count=1");
        assertEquals(200, up.getStatus());
        assertTrue(JsonUtils.readTree(up.getBody()).path("success").asBoolean());

        assertEquals(400, post("/api/v1/scaling/down?count=0").getStatus());

        JsonNode scaling = JsonUtils.readTree(get("/api/v1/scaling").getBody());
        assertEquals(1, scaling.path("totalEvents").asInt());
    }

    @Test
    void testStatsAndServices() {
        JsonNode stats = JsonUtils.readTree(get("/api/v1/stats").getBody());
        assertEquals("memory", stats.path("registry").path("backend").asText());
        assertEquals("LEAST_CONNECTIONS", stats.path("balancer").path("strategy").asText());

        Reply services = get("/api/v1/services");
        assertEquals(200, services.getStatus());
        assertEquals(0, JsonUtils.readTree(services.getBody()).size());

        assertEquals(404, get("/metrics").getStatus());
    }

    @Value
    static class Reply {
        int status;
        String body;
    }
}

package com.streamfleet.controlplane.http;

import com.streamfleet.controlplane.balancer.ClientPriority;
import com.streamfleet.controlplane.balancer.ILoadBalancer;
import com.streamfleet.controlplane.balancer.RejectionKind;
import com.streamfleet.controlplane.balancer.RoutingResult;
import com.streamfleet.controlplane.metrics.PrometheusMetricsExporter;
import com.streamfleet.controlplane.registry.IServiceRegistry;
import com.streamfleet.controlplane.scale.ScalingManager;
import com.streamfleet.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * HTTP server for operator and routing endpoints.
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final int port;
    private final IServiceRegistry registry;
    private final ILoadBalancer loadBalancer;
    private final ScalingManager scalingManager;
    private final PrometheusMetricsExporter metricsExporter;

    private DisposableServer server;

    public HttpServer(
        int port,
        IServiceRegistry registry,
        ILoadBalancer loadBalancer,
        ScalingManager scalingManager,
        PrometheusMetricsExporter metricsExporter
    ) {
        this.port = port;
        this.registry = registry;
        this.loadBalancer = loadBalancer;
        this.scalingManager = scalingManager;
        this.metricsExporter = metricsExporter;
    }

    /**
     * Binds the server, blocking until it is listening.
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(port)
            .route(this::configureRoutes)
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            .get("/metrics", (req, res) -> {
                if (metricsExporter == null) {
                    return res.status(HttpResponseStatus.NOT_FOUND).send();
                }
                return res.addHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.just(metricsExporter.scrape()));
            })
            .get("/api/v1/stats", (req, res) ->
                sendJson(res, HttpResponseStatus.OK, () -> {
                    Map<String, Object> stats = new LinkedHashMap<>();
                    stats.put("registry", registry.getStats());
                    stats.put("balancer", loadBalancer.getStats());
                    stats.put("scaling", scalingManager.getScalingStats());
                    return stats;
                })
            )
            .get("/api/v1/nodes", (req, res) ->
                sendJson(res, HttpResponseStatus.OK, loadBalancer::getNodes)
            )
            .get("/api/v1/services", (req, res) ->
                registry.discoverServices(queryParam(req, "name"))
                    .flatMap(instances -> Mono.fromCallable(() -> JsonUtils.writeValueAsString(instances)))
                    .flatMap(json -> res.header("Content-Type", "application/json")
                        .sendString(Mono.just(json)).then())
                    .onErrorResume(err -> {
                        log.error("Failed to list services", err);
                        return sendError(res, HttpResponseStatus.INTERNAL_SERVER_ERROR, "Discovery failed").then();
                    })
            )
            .get("/api/v1/scaling", (req, res) ->
                sendJson(res, HttpResponseStatus.OK, scalingManager::getScalingStats)
            )
            .post("/api/v1/scaling/up", (req, res) -> scale(req, res, true))
            .post("/api/v1/scaling/down", (req, res) -> scale(req, res, false))
            .get("/api/v1/route", (req, res) -> {
                String clientId = queryParam(req, "clientId");
                if (clientId == null || clientId.isEmpty()) {
                    return sendError(res, HttpResponseStatus.BAD_REQUEST, "Missing clientId parameter");
                }

                RoutingResult result = loadBalancer.getNodeForClient(clientId);
                if (result.isRouted()) {
                    return sendJson(res, HttpResponseStatus.OK, result::getNode);
                }
                HttpResponseStatus status = result.getRejection() == RejectionKind.RATE_LIMITED
                    ? HttpResponseStatus.TOO_MANY_REQUESTS
                    : HttpResponseStatus.SERVICE_UNAVAILABLE;
                return sendError(res, status, result.getRejection().name().toLowerCase(Locale.ROOT));
            })
            .post("/api/v1/release", (req, res) -> {
                String clientId = queryParam(req, "clientId");
                if (clientId == null || clientId.isEmpty()) {
                    return sendError(res, HttpResponseStatus.BAD_REQUEST, "Missing clientId parameter");
                }
                loadBalancer.releaseClient(clientId);
                return res.status(HttpResponseStatus.NO_CONTENT).send();
            })
            .post("/api/v1/clients/{clientId}/priority", (req, res) -> {
                String clientId = req.param("clientId");
                ClientPriority priority;
                try {
                    priority = ClientPriority.valueOf(String.valueOf(queryParam(req, "priority")).toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    return sendError(res, HttpResponseStatus.BAD_REQUEST, "Invalid priority parameter");
                }
                loadBalancer.setClientPriority(clientId, priority);
                return res.status(HttpResponseStatus.NO_CONTENT).send();
            })
            .post("/api/v1/nodes/{nodeId}/stats", (req, res) -> {
                String nodeId = req.param("nodeId");
                int connections;
                double cpu;
                double memory;
                try {
                    connections = Integer.parseInt(queryParam(req, "connections"));
                    cpu = Double.parseDouble(queryParam(req, "cpu"));
                    memory = Double.parseDouble(queryParam(req, "memory"));
                } catch (NumberFormatException | NullPointerException e) {
                    return sendError(res, HttpResponseStatus.BAD_REQUEST, "connections, cpu and memory are required numbers");
                }

                if (!loadBalancer.updateNodeStats(nodeId, connections, cpu, memory)) {
                    return sendError(res, HttpResponseStatus.NOT_FOUND, "Unknown node " + nodeId);
                }
                return res.status(HttpResponseStatus.NO_CONTENT).send();
            });
    }

    private Publisher<Void> scale(HttpServerRequest req, HttpServerResponse res, boolean up) {
        int count;
        try {
            String raw = queryParam(req, "count");
            count = raw == null ? 1 : Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            return sendError(res, HttpResponseStatus.BAD_REQUEST, "Invalid count parameter");
        }
        if (count < 1) {
            return sendError(res, HttpResponseStatus.BAD_REQUEST, "count must be at least 1");
        }

        Mono<Boolean> action = up ? scalingManager.scaleUp(count) : scalingManager.scaleDown(count);
        return action
            .flatMap(success -> Mono.fromCallable(() -> JsonUtils.writeValueAsString(Map.of("success", success))))
            .flatMap(json -> res.header("Content-Type", "application/json")
                .sendString(Mono.just(json)).then())
            .onErrorResume(err -> {
                log.error("Manual scaling failed", err);
                return sendError(res, HttpResponseStatus.INTERNAL_SERVER_ERROR, "Scaling failed").then();
            });
    }

    private static String queryParam(HttpServerRequest req, String name) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static Publisher<Void> sendJson(HttpServerResponse res, HttpResponseStatus status, Supplier<Object> body) {
        return Mono.fromCallable(() -> JsonUtils.writeValueAsString(body.get()))
            .flatMap(json -> res.status(status)
                .header("Content-Type", "application/json")
                .sendString(Mono.just(json)).then())
            .onErrorResume(err -> {
                log.error("Failed to serialize response", err);
                return sendError(res, HttpResponseStatus.INTERNAL_SERVER_ERROR, "Serialization failed").then();
            });
    }

    private static Mono<Void> sendError(HttpServerResponse res, HttpResponseStatus status, String message) {
        String json = JsonUtils.writeValueAsString(Map.of("error", message));
        return res.status(status)
            .header("Content-Type", "application/json")
            .sendString(Mono.just(json))
            .then();
    }
}

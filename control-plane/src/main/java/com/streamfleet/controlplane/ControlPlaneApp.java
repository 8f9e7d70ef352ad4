package com.streamfleet.controlplane;

import com.streamfleet.controlplane.balancer.LoadBalancer;
import com.streamfleet.controlplane.balancer.RegistryNodeSync;
import com.streamfleet.controlplane.config.ControlPlaneConfig;
import com.streamfleet.controlplane.http.HttpServer;
import com.streamfleet.controlplane.k8s.KubernetesScaleHook;
import com.streamfleet.controlplane.metrics.PrometheusMetricsExporter;
import com.streamfleet.controlplane.registry.HttpHealthProbe;
import com.streamfleet.controlplane.registry.ServiceRegistry;
import com.streamfleet.controlplane.registry.backend.DiscoveryBackends;
import com.streamfleet.controlplane.registry.backend.IDiscoveryBackend;
import com.streamfleet.controlplane.scale.ScalingManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.DisposableServer;

import java.time.Clock;
import java.time.Duration;

public class ControlPlaneApp {
    private static final Logger log = LoggerFactory.getLogger(ControlPlaneApp.class);

    public static void main(String[] args) {
        ControlPlaneConfig config = ControlPlaneConfig.fromEnv();
        config.validate();

        log.info("Starting control plane {}", config.getNodeId());
        log.info("  Discovery: {} (service {})", config.getDiscovery().getBackend(), config.getDiscovery().getServiceName());
        log.info("  Strategy: {}", config.getBalancer().getStrategy());
        log.info("  Kubernetes: {}", config.isKubernetesEnabled());

        Clock clock = Clock.systemUTC();
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());

        IDiscoveryBackend backend = DiscoveryBackends.create(config.getDiscovery(), clock);
        ServiceRegistry registry = new ServiceRegistry(
            config.getDiscovery(),
            backend,
            new HttpHealthProbe(config.getDiscovery().getProbeTimeout()),
            metricsExporter.getRegistry(),
            clock
        );

        LoadBalancer loadBalancer = new LoadBalancer(config.getBalancer(), metricsExporter.getRegistry(), clock);
        registry.addServiceListener(new RegistryNodeSync(loadBalancer, config.getBalancer()));

        ScalingManager scalingManager = new ScalingManager(
            config.getScaling(),
            registry,
            loadBalancer,
            metricsExporter.getRegistry(),
            clock
        );

        KubernetesScaleHook scaleHook = null;
        if (config.isKubernetesEnabled()) {
            scaleHook = new KubernetesScaleHook(
                config.getKubernetesNamespace(),
                config.getWorkloadName(),
                config.getWorkloadPodLabel(),
                config.getScaling().getMinInstances(),
                config.getScaling().getMaxInstances()
            );
            scalingManager.addScaleUpHook(scaleHook);
            scalingManager.addScaleDownHook(scaleHook);
        }

        HttpServer httpServer = new HttpServer(
            config.getHttpPort(),
            registry,
            loadBalancer,
            scalingManager,
            metricsExporter
        );
        DisposableServer disposableServer = httpServer.start();

        registry.start();
        loadBalancer.start();
        scalingManager.start();

        if (config.isRegisterSelf()) {
            registry.registerService(config.getAdvertisedHost(), disposableServer.port())
                .subscribe(
                    instance -> log.info("Registered as {}", instance.getId()),
                    err -> log.error("Self-registration failed", err)
                );
        }

        log.info("Control plane is ready");

        handleShutDown(httpServer, registry, loadBalancer, scalingManager, scaleHook, metricsExporter);

        disposableServer.onDispose().block();
    }

    private static void handleShutDown(
        HttpServer httpServer,
        ServiceRegistry registry,
        LoadBalancer loadBalancer,
        ScalingManager scalingManager,
        KubernetesScaleHook scaleHook,
        PrometheusMetricsExporter metricsExporter
    ) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");

            scalingManager.stop();
            loadBalancer.stop();

            try {
                registry.stop().block(Duration.ofSeconds(15));
            } catch (RuntimeException e) {
                log.warn("Registry did not stop cleanly: {}", e.getMessage());
            }

            httpServer.stop();

            if (scaleHook != null) {
                scaleHook.close();
            }
            metricsExporter.close();

            log.info("Shutdown complete");
        }));
    }
}

package com.streamfleet.controlplane.config;

import lombok.Builder;
import lombok.Value;

import static com.streamfleet.controlplane.config.EnvSupport.getBoolean;
import static com.streamfleet.controlplane.config.EnvSupport.getEnv;
import static com.streamfleet.controlplane.config.EnvSupport.getInt;

/**
 * Configuration for the control plane process, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class ControlPlaneConfig {

    String nodeId;
    int httpPort;

    // Registers this process in discovery under the advertised address
    boolean registerSelf;
    String advertisedHost;

    // Kubernetes scale hook
    boolean kubernetesEnabled;
    String kubernetesNamespace;
    String workloadName;
    String workloadPodLabel;

    DiscoveryConfig discovery;
    BalancerConfig balancer;
    ScalingConfig scaling;

    public static ControlPlaneConfig fromEnv() {
        return ControlPlaneConfig.builder()
            .nodeId(getEnv("NODE_ID", "control-plane-1"))
            .httpPort(getInt("HTTP_PORT", 8080))
            .registerSelf(getBoolean("REGISTER_SELF", false))
            .advertisedHost(getEnv("ADVERTISED_HOST", "localhost"))
            .kubernetesEnabled(getBoolean("KUBERNETES_ENABLED", false))
            .kubernetesNamespace(getEnv("KUBERNETES_NAMESPACE", "default"))
            .workloadName(getEnv("WORKLOAD_NAME", "websocket-server"))
            .workloadPodLabel(getEnv("WORKLOAD_POD_LABEL", "websocket-server"))
            .discovery(DiscoveryConfig.fromEnv())
            .balancer(BalancerConfig.fromEnv())
            .scaling(ScalingConfig.fromEnv())
            .build();
    }

    public void validate() {
        if (httpPort < 0 || httpPort > 65535) {
            throw new ConfigurationException("Invalid HTTP port " + httpPort);
        }
        discovery.validate();
        balancer.validate();
        scaling.validate();
    }
}

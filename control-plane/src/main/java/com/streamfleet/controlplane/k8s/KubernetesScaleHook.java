package com.streamfleet.controlplane.k8s;

import com.streamfleet.controlplane.scale.ScaleDownHook;
import com.streamfleet.controlplane.scale.ScaleUpHook;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies scaling actions to the backend Deployment.
 * <p>
 * Scale-up raises the replica count. Scale-down first marks the chosen pods with the lowest
 * {@code pod-deletion-cost} so the ReplicaSet controller removes exactly those, then lowers
 * the replica count. Backend instances register with their pod name as instance id.
 * </p>
 * Calls are blocking; the scaling manager invokes hooks on the bounded elastic scheduler.
 */
public class KubernetesScaleHook implements ScaleUpHook, ScaleDownHook, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KubernetesScaleHook.class);

    static final String DELETION_COST_ANNOTATION = "controller.kubernetes.io/pod-deletion-cost";
    static final String VICTIM_DELETION_COST = "-1000";

    private final KubernetesClient client;
    private final String namespace;
    private final String workloadName;
    private final String podLabel;
    private final int minReplicas;
    private final int maxReplicas;

    public KubernetesScaleHook(String namespace, String workloadName, String podLabel, int minReplicas, int maxReplicas) {
        this(new KubernetesClientBuilder().build(), namespace, workloadName, podLabel, minReplicas, maxReplicas);
    }

    public KubernetesScaleHook(
        KubernetesClient client,
        String namespace,
        String workloadName,
        String podLabel,
        int minReplicas,
        int maxReplicas
    ) {
        this.client = client;
        this.namespace = namespace;
        this.workloadName = workloadName;
        this.podLabel = podLabel;
        this.minReplicas = minReplicas;
        this.maxReplicas = maxReplicas;

        log.info("Kubernetes scale hook initialized: namespace={}, deployment={}, replicas=[{}, {}]",
            namespace, workloadName, minReplicas, maxReplicas);
    }

    @Override
    public void onScaleUp(int count) {
        scaleBy(count);
    }

    @Override
    public void onScaleDown(List<String> instanceIds) {
        markForDeletion(instanceIds);
        scaleBy(-instanceIds.size());
    }

    private void markForDeletion(List<String> instanceIds) {
        Set<String> victims = new HashSet<>(instanceIds);
        List<Pod> pods = client.pods()
            .inNamespace(namespace)
            .withLabel("app", podLabel)
            .list()
            .getItems();

        int marked = 0;
        for (Pod pod : pods) {
            String podName = pod.getMetadata().getName();
            if (!victims.contains(podName)) {
                continue;
            }

            pod.getMetadata().setAnnotations(withDeletionCost(pod.getMetadata().getAnnotations()));

            client.pods()
                .inNamespace(namespace)
                .resource(pod)
                .update();
            marked++;
            log.debug("Marked pod {} for removal", podName);
        }

        if (marked < victims.size()) {
            log.warn("Only {} of {} instances matched pods labelled app={}", marked, victims.size(), podLabel);
        }
    }

    private void scaleBy(int delta) {
        Deployment deployment = client.apps().deployments()
            .inNamespace(namespace)
            .withName(workloadName)
            .get();
        if (deployment == null) {
            throw new IllegalStateException("Deployment " + workloadName + " not found in namespace " + namespace);
        }

        Integer currentReplicas = deployment.getSpec().getReplicas();
        int current = currentReplicas != null ? currentReplicas : 0;
        int desired = desiredReplicas(current, delta, minReplicas, maxReplicas);

        if (desired == current) {
            log.info("Scaling skipped: Deployment {} already at {} replicas", workloadName, current);
            return;
        }

        log.info("Scaling Deployment {} from {} to {} replicas", workloadName, current, desired);
        client.apps().deployments()
            .inNamespace(namespace)
            .withName(workloadName)
            .scale(desired);
    }

    static int desiredReplicas(int current, int delta, int minReplicas, int maxReplicas) {
        return Math.max(minReplicas, Math.min(maxReplicas, current + delta));
    }

    static Map<String, String> withDeletionCost(Map<String, String> annotations) {
        Map<String, String> updated = annotations != null ? new HashMap<>(annotations) : new HashMap<>();
        updated.put(DELETION_COST_ANNOTATION, VICTIM_DELETION_COST);
        return updated;
    }

    @Override
    public void close() {
        client.close();
        log.info("Kubernetes scale hook closed");
    }
}

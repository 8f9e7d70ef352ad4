package com.streamfleet.controlplane.scale;

import com.google.common.collect.EvictingQueue;
import com.streamfleet.controlplane.balancer.ILoadBalancer;
import com.streamfleet.controlplane.balancer.Node;
import com.streamfleet.controlplane.balancer.NodeRef;
import com.streamfleet.controlplane.config.ConfigurationException;
import com.streamfleet.controlplane.config.ScalingConfig;
import com.streamfleet.controlplane.registry.IServiceRegistry;
import com.streamfleet.controlplane.registry.ServiceInstance;
import com.streamfleet.core.metrics.MetricsCollector;
import com.streamfleet.core.metrics.MetricsNames;
import com.streamfleet.core.metrics.MetricsTags;
import com.streamfleet.core.util.BackgroundLoop;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Rule-driven autoscaler for the backend fleet.
 * <p>
 * <b>Decision</b> ({@link #evaluateScaling()}): every enabled rule votes independently.
 * Scale-up is checked first: any up vote, room below {@code maxInstances} and an elapsed
 * up-cooldown give SCALE_UP. Otherwise more down votes than up votes, room above
 * {@code minInstances} and an elapsed down-cooldown give SCALE_DOWN. Anything else is
 * NO_ACTION. With no healthy instance the answer is always NO_ACTION.
 * </p>
 * <p>
 * <b>Execution</b> ({@link #scaleUp(int)} / {@link #scaleDown(int)}): the count is clamped to
 * the bounds, every registered hook runs (a failing hook is logged and does not stop the
 * others), and a {@link ScalingEvent} is recorded. The direction's cooldown starts only when
 * all hooks succeeded. Only one action per direction runs at a time.
 * </p>
 */
public class ScalingManager {
    private static final Logger log = LoggerFactory.getLogger(ScalingManager.class);

    public static final String CPU_METRIC = "cpu_usage";
    public static final String MEMORY_METRIC = "memory_usage";
    public static final String CONNECTIONS_METRIC = "connections_per_instance";

    private static final int RECENT_EVENTS = 10;
    // Default scale-down threshold of the connection rule, as a fraction of the target
    private static final double CONNECTION_SCALE_DOWN_RATIO = 0.3;

    private final ScalingConfig config;
    private final IServiceRegistry registry;
    private final ILoadBalancer loadBalancer;
    private final MetricsCollector metricsCollector;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ScalingRule> rules = new LinkedHashMap<>();
    private final EvictingQueue<ScalingEvent> events;
    private int totalEvents;
    private Instant lastScaleUp;
    private Instant lastScaleDown;
    private boolean scaleUpInProgress;
    private boolean scaleDownInProgress;

    private final List<ScaleUpHook> scaleUpHooks = new CopyOnWriteArrayList<>();
    private final List<ScaleDownHook> scaleDownHooks = new CopyOnWriteArrayList<>();

    private final BackgroundLoop evaluationLoop;
    private final BackgroundLoop samplingLoop;

    public ScalingManager(
        ScalingConfig config,
        IServiceRegistry registry,
        ILoadBalancer loadBalancer,
        MeterRegistry meterRegistry,
        Clock clock
    ) {
        config.validate();
        this.config = config;
        this.registry = registry;
        this.loadBalancer = loadBalancer;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.metricsCollector = new MetricsCollector(config.getMetricsWindow(), clock);
        this.events = EvictingQueue.create(config.getMaxEvents());

        setupDefaultRules();

        this.evaluationLoop = new BackgroundLoop("scaling-evaluation", config.getEvaluationInterval(),
            () -> decide().flatMap(this::apply).then());
        this.samplingLoop = new BackgroundLoop("scaling-metrics", config.getMetricsSampleInterval(),
            this::sampleOnce);

        log.info("Scaling manager initialized: instances=[{}, {}], cooldowns up={} down={}",
            config.getMinInstances(), config.getMaxInstances(),
            config.getScaleUpCooldown(), config.getScaleDownCooldown());
    }

    private void setupDefaultRules() {
        addScalingRule(ScalingRule.builder()
            .name("cpu_based_scaling")
            .trigger(ScalingTrigger.CPU_USAGE)
            .metricName(CPU_METRIC)
            .scaleUpThreshold(config.getTargetCpuUtilization())
            .scaleDownThreshold(config.getTargetCpuUtilization() * 0.5)
            .build());
        addScalingRule(ScalingRule.builder()
            .name("memory_based_scaling")
            .trigger(ScalingTrigger.MEMORY_USAGE)
            .metricName(MEMORY_METRIC)
            .scaleUpThreshold(config.getTargetMemoryUtilization())
            .scaleDownThreshold(config.getTargetMemoryUtilization() * 0.5)
            .build());
        addScalingRule(ScalingRule.builder()
            .name("connection_based_scaling")
            .trigger(ScalingTrigger.CONNECTION_COUNT)
            .metricName(CONNECTIONS_METRIC)
            .scaleUpThreshold(config.getTargetConnectionsPerInstance())
            .scaleDownThreshold(config.getTargetConnectionsPerInstance() * CONNECTION_SCALE_DOWN_RATIO)
            .build());
    }

    public void start() {
        samplingLoop.start();
        evaluationLoop.start();
        log.info("Scaling manager started");
    }

    public void stop() {
        evaluationLoop.stop();
        samplingLoop.stop();
        log.info("Scaling manager stopped");
    }

    /**
     * @throws ConfigurationException if the rule is invalid or its name is taken
     */
    public void addScalingRule(ScalingRule rule) {
        rule.validate();
        lock.lock();
        try {
            if (rules.containsKey(rule.getName())) {
                throw new ConfigurationException("Scaling rule " + rule.getName() + " already exists");
            }
            rules.put(rule.getName(), rule);
        } finally {
            lock.unlock();
        }
        log.info("Added scaling rule {}", rule.getName());
    }

    public boolean removeScalingRule(String name) {
        boolean removed;
        lock.lock();
        try {
            removed = rules.remove(name) != null;
        } finally {
            lock.unlock();
        }
        if (removed) {
            log.info("Removed scaling rule {}", name);
        }
        return removed;
    }

    /**
     * Replaces the rule with the same name.
     *
     * @return false if no such rule exists
     * @throws ConfigurationException if the new rule is invalid
     */
    public boolean updateScalingRule(ScalingRule rule) {
        rule.validate();
        lock.lock();
        try {
            if (!rules.containsKey(rule.getName())) {
                return false;
            }
            rules.put(rule.getName(), rule);
        } finally {
            lock.unlock();
        }
        log.info("Updated scaling rule {}", rule.getName());
        return true;
    }

    public List<ScalingRule> getScalingRules() {
        lock.lock();
        try {
            return List.copyOf(rules.values());
        } finally {
            lock.unlock();
        }
    }

    public void addScaleUpHook(ScaleUpHook hook) {
        scaleUpHooks.add(hook);
    }

    public void addScaleDownHook(ScaleDownHook hook) {
        scaleDownHooks.add(hook);
    }

    /**
     * Samples current load and returns what the rules vote for. Never fails;
     * errors degrade to NO_ACTION.
     */
    public Mono<ScalingAction> evaluateScaling() {
        return decide().map(ScalingDecision::getAction);
    }

    /**
     * Manual override: add up to {@code count} instances.
     *
     * @return true if the hooks ran and all succeeded
     */
    public Mono<Boolean> scaleUp(int count) {
        return executeScaleUp(count, ScalingEvent.TRIGGER_MANUAL, "Manual scale up by " + count);
    }

    /**
     * Manual override: remove up to {@code count} instances, least connected first.
     *
     * @return true if the hooks ran and all succeeded
     */
    public Mono<Boolean> scaleDown(int count) {
        return executeScaleDown(count, ScalingEvent.TRIGGER_MANUAL, "Manual scale down by " + count);
    }

    public ScalingStats getScalingStats() {
        lock.lock();
        try {
            List<ScalingEvent> all = new ArrayList<>(events);
            List<ScalingEvent> recent = List.copyOf(all.subList(Math.max(0, all.size() - RECENT_EVENTS), all.size()));

            return ScalingStats.builder()
                .config(config)
                .rules(List.copyOf(rules.values()))
                .recentEvents(recent)
                .totalEvents(totalEvents)
                .lastScaleUp(lastScaleUp)
                .lastScaleDown(lastScaleDown)
                .metrics(metricsCollector.getAllMetrics())
                .build();
        } finally {
            lock.unlock();
        }
    }

    public MetricsCollector getMetricsCollector() {
        return metricsCollector;
    }

    Mono<ScalingDecision> decide() {
        return registry.getHealthyInstances(null)
            .map(this::decide)
            .onErrorResume(err -> {
                log.error("Error evaluating scaling", err);
                return Mono.just(ScalingDecision.noAction("evaluation failed: " + err.getMessage()));
            })
            .doOnNext(decision -> meterRegistry.counter(MetricsNames.SCALING_DECISIONS_TOTAL,
                MetricsTags.ACTION, decision.getAction().name().toLowerCase(Locale.ROOT)).increment());
    }

    private ScalingDecision decide(List<ServiceInstance> instances) {
        int currentCount = instances.size();
        if (currentCount == 0) {
            log.warn("No healthy instances found, skipping scaling evaluation");
            return ScalingDecision.noAction("no healthy instances");
        }

        LoadSample sample = sample(instances);

        int upVotes = 0;
        int downVotes = 0;
        int upAdjustment = 0;
        int downAdjustment = 0;
        List<String> voters = new ArrayList<>();

        for (ScalingRule rule : getScalingRules()) {
            if (!rule.isEnabled()) {
                continue;
            }

            OptionalDouble value = rule.getTrigger() == ScalingTrigger.CONNECTION_COUNT
                ? OptionalDouble.of(sample.getConnectionsPerInstance())
                : metricsCollector.getMetricAverage(rule.getMetricName(), config.getEvaluationInterval());
            if (value.isEmpty()) {
                continue;
            }

            ScalingAction vote = rule.vote(value.getAsDouble());
            if (vote == ScalingAction.SCALE_UP) {
                upVotes++;
                upAdjustment = Math.max(upAdjustment, rule.getScaleUpAdjustment());
                voters.add(String.format(Locale.ROOT, "%s=%.1f>%.1f", rule.getName(), value.getAsDouble(), rule.getScaleUpThreshold()));
            } else if (vote == ScalingAction.SCALE_DOWN) {
                downVotes++;
                downAdjustment = Math.max(downAdjustment, rule.getScaleDownAdjustment());
                voters.add(String.format(Locale.ROOT, "%s=%.1f<%.1f", rule.getName(), value.getAsDouble(), rule.getScaleDownThreshold()));
            }
        }

        String reason = "votes up=" + upVotes + " down=" + downVotes + " " + voters;

        // Up is checked first; a blocked up-vote does not turn into a scale-down
        if (upVotes > 0 && currentCount < config.getMaxInstances()) {
            if (cooldownElapsed(ScalingAction.SCALE_UP)) {
                log.info("Scaling decision SCALE_UP by {} ({} instances): {}", upAdjustment, currentCount, reason);
                return new ScalingDecision(ScalingAction.SCALE_UP, upAdjustment, reason);
            }
            log.debug("Scale up wanted but cooling down: {}", reason);
        } else if (downVotes > upVotes && currentCount > config.getMinInstances()) {
            if (cooldownElapsed(ScalingAction.SCALE_DOWN)) {
                log.info("Scaling decision SCALE_DOWN by {} ({} instances): {}", downAdjustment, currentCount, reason);
                return new ScalingDecision(ScalingAction.SCALE_DOWN, downAdjustment, reason);
            }
            log.debug("Scale down wanted but cooling down: {}", reason);
        }

        return ScalingDecision.noAction(reason);
    }

    private Mono<Boolean> apply(ScalingDecision decision) {
        switch (decision.getAction()) {
            case SCALE_UP:
                return executeScaleUp(decision.getAdjustment(), ScalingEvent.TRIGGER_AUTO, decision.getReason());
            case SCALE_DOWN:
                return executeScaleDown(decision.getAdjustment(), ScalingEvent.TRIGGER_AUTO, decision.getReason());
            default:
                return Mono.just(false);
        }
    }

    private Mono<Boolean> executeScaleUp(int count, String trigger, String reason) {
        if (count < 1) {
            return Mono.error(new IllegalArgumentException("Scale count must be at least 1, got " + count));
        }

        return registry.getHealthyInstances(null).flatMap(instances -> {
            int oldCount = instances.size();
            int newCount = Math.min(config.getMaxInstances(), oldCount + count);
            int actual = newCount - oldCount;

            if (actual <= 0) {
                log.warn("Cannot scale up: already at maximum of {} instances", config.getMaxInstances());
                return Mono.just(false);
            }
            if (!reserve(ScalingAction.SCALE_UP)) {
                return Mono.just(false);
            }

            log.info("Scaling up by {} instances ({} -> {})", actual, oldCount, newCount);
            return runReserved(ScalingAction.SCALE_UP, runHooks(scaleUpHooks, hook -> {
                hook.onScaleUp(actual);
                return null;
            }).map(errors -> complete(ScalingAction.SCALE_UP, trigger, reason, oldCount, newCount, errors)));
        });
    }

    private Mono<Boolean> executeScaleDown(int count, String trigger, String reason) {
        if (count < 1) {
            return Mono.error(new IllegalArgumentException("Scale count must be at least 1, got " + count));
        }

        return registry.getHealthyInstances(null).flatMap(instances -> {
            int oldCount = instances.size();
            int newCount = Math.max(config.getMinInstances(), oldCount - count);
            int actual = oldCount - newCount;

            if (actual <= 0) {
                log.warn("Cannot scale down: already at minimum of {} instances", config.getMinInstances());
                return Mono.just(false);
            }
            if (!reserve(ScalingAction.SCALE_DOWN)) {
                return Mono.just(false);
            }

            List<String> victims = selectInstancesToRemove(instances, actual);
            log.info("Scaling down by {} instances ({} -> {}): {}", actual, oldCount, newCount, victims);
            return runReserved(ScalingAction.SCALE_DOWN, runHooks(scaleDownHooks, hook -> {
                hook.onScaleDown(victims);
                return null;
            }).map(errors -> complete(ScalingAction.SCALE_DOWN, trigger, reason, oldCount, newCount, errors)));
        });
    }

    /**
     * Instances with the fewest current connections, so removal disrupts the fewest clients.
     */
    List<String> selectInstancesToRemove(List<ServiceInstance> instances, int count) {
        Map<String, Integer> connectionsByNode = loadBalancer.getNodes().stream()
            .collect(Collectors.toMap(NodeRef::getNodeId, NodeRef::getCurrentConnections, (a, b) -> a));

        return instances.stream()
            .sorted(Comparator.comparingInt(instance ->
                connectionsByNode.getOrDefault(Node.nodeIdFor(instance.getHost(), instance.getPort()), 0)))
            .limit(count)
            .map(ServiceInstance::getId)
            .collect(Collectors.toList());
    }

    Mono<Void> sampleOnce() {
        return registry.getHealthyInstances(null)
            .doOnNext(instances -> {
                if (!instances.isEmpty()) {
                    sample(instances);
                }
            })
            .then();
    }

    /**
     * Averages node telemetry over the healthy instances and records it.
     */
    private LoadSample sample(List<ServiceInstance> instances) {
        Map<String, NodeRef> nodes = loadBalancer.getNodes().stream()
            .collect(Collectors.toMap(NodeRef::getNodeId, Function.identity(), (a, b) -> a));

        double totalCpu = 0;
        double totalMemory = 0;
        double totalConnections = 0;
        for (ServiceInstance instance : instances) {
            NodeRef node = nodes.get(Node.nodeIdFor(instance.getHost(), instance.getPort()));
            if (node != null) {
                totalCpu += node.getCpuUsage();
                totalMemory += node.getMemoryUsage();
                totalConnections += node.getCurrentConnections();
            }
        }

        int count = instances.size();
        LoadSample sample = new LoadSample(totalCpu / count, totalMemory / count, totalConnections / count);

        metricsCollector.addMetric(CPU_METRIC, sample.getCpuUsage());
        metricsCollector.addMetric(MEMORY_METRIC, sample.getMemoryUsage());
        metricsCollector.addMetric(CONNECTIONS_METRIC, sample.getConnectionsPerInstance());

        log.debug("Sampled load over {} instances: {}", count, sample);
        return sample;
    }

    private boolean cooldownElapsed(ScalingAction direction) {
        lock.lock();
        try {
            return cooldownElapsedLocked(direction, clock.instant());
        } finally {
            lock.unlock();
        }
    }

    private boolean cooldownElapsedLocked(ScalingAction direction, Instant now) {
        Instant last = direction == ScalingAction.SCALE_UP ? lastScaleUp : lastScaleDown;
        Duration cooldown = direction == ScalingAction.SCALE_UP
            ? config.getScaleUpCooldown()
            : config.getScaleDownCooldown();
        return last == null || Duration.between(last, now).compareTo(cooldown) >= 0;
    }

    /**
     * Claims the direction for one action if its cooldown has elapsed and no other
     * action of that direction is running.
     */
    private boolean reserve(ScalingAction direction) {
        lock.lock();
        try {
            boolean inProgress = direction == ScalingAction.SCALE_UP ? scaleUpInProgress : scaleDownInProgress;
            if (inProgress) {
                log.warn("Cannot {}: another action of the same direction is running", direction);
                return false;
            }
            if (!cooldownElapsedLocked(direction, clock.instant())) {
                log.warn("Cannot {}: cooldown has not elapsed", direction);
                return false;
            }

            if (direction == ScalingAction.SCALE_UP) {
                scaleUpInProgress = true;
            } else {
                scaleDownInProgress = true;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs a reserved action to the end independently of the caller.
     * <p>
     * A caller that cancels (for example a dropped HTTP connection) only stops waiting.
     * The hooks still finish and {@link #complete} still releases the reservation.
     * </p>
     */
    private Mono<Boolean> runReserved(ScalingAction direction, Mono<Boolean> action) {
        Mono<Boolean> shared = action
            .doOnError(err -> release(direction))
            .cache();
        shared.subscribe(
            ignored -> {
            },
            err -> log.error("{} aborted", direction, err));
        return shared;
    }

    private void release(ScalingAction direction) {
        lock.lock();
        try {
            if (direction == ScalingAction.SCALE_UP) {
                scaleUpInProgress = false;
            } else {
                scaleDownInProgress = false;
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean complete(
        ScalingAction direction,
        String trigger,
        String reason,
        int oldCount,
        int newCount,
        List<String> errors
    ) {
        boolean success = errors.isEmpty();
        Instant now = clock.instant();

        ScalingEvent event = ScalingEvent.builder()
            .timestamp(now)
            .action(direction)
            .trigger(trigger)
            .reason(reason)
            .oldCount(oldCount)
            .newCount(newCount)
            .success(success)
            .error(success ? null : String.join("; ", errors))
            .build();

        lock.lock();
        try {
            events.add(event);
            totalEvents++;
            if (direction == ScalingAction.SCALE_UP) {
                scaleUpInProgress = false;
                if (success) {
                    lastScaleUp = now;
                }
            } else {
                scaleDownInProgress = false;
                if (success) {
                    lastScaleDown = now;
                }
            }
        } finally {
            lock.unlock();
        }

        meterRegistry.counter(MetricsNames.SCALING_ACTIONS_TOTAL,
            MetricsTags.ACTION, direction.name().toLowerCase(Locale.ROOT),
            MetricsTags.OUTCOME, success ? "success" : "failure").increment();

        if (success) {
            log.info("Successfully completed {} from {} to {} instances", direction, oldCount, newCount);
        } else {
            log.error("{} from {} to {} instances failed: {}", direction, oldCount, newCount, event.getError());
        }
        return success;
    }

    /**
     * Runs every hook on the bounded elastic scheduler and collects the failure messages.
     */
    private <H> Mono<List<String>> runHooks(List<H> hooks, HookCall<H> call) {
        return Mono.fromCallable(() -> {
                if (hooks.isEmpty()) {
                    log.warn("No scale hooks registered");
                }
                List<String> errors = new ArrayList<>();
                for (H hook : hooks) {
                    try {
                        call.invoke(hook);
                    } catch (Throwable t) {
                        Exceptions.throwIfJvmFatal(t);
                        log.error("Scale hook {} failed", hook.getClass().getSimpleName(), t);
                        errors.add(t.getClass().getSimpleName() + ": " + t.getMessage());
                    }
                }
                return errors;
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    @FunctionalInterface
    private interface HookCall<H> {
        Void invoke(H hook) throws Exception;
    }
}

package com.streamfleet.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Periodic background task: wait {@code interval}, run the body to completion, repeat.
 * <p>
 * Iterations never overlap because the next delay only starts once the body's
 * {@link Mono} has terminated. Errors are logged and the loop carries on with the
 * next iteration; there is no inline retry.
 * </p>
 * <p>
 * {@link #stop()} is cooperative: an iteration that is already running (for
 * example waiting on a network call) is allowed to finish or hit its own timeout,
 * after which the loop ends. A loop that is only sleeping is cancelled at once.
 * </p>
 */
public final class BackgroundLoop {
    private static final Logger log = LoggerFactory.getLogger(BackgroundLoop.class);

    private final String name;
    private final Duration interval;
    private final Supplier<Mono<Void>> body;

    // One flag per start(), so a chain still finishing its last iteration after
    // stop() never sees the flag of a later run
    private volatile AtomicBoolean currentRun = new AtomicBoolean(false);
    private volatile AtomicBoolean currentInFlight = new AtomicBoolean(false);
    private volatile Disposable subscription;

    public BackgroundLoop(String name, Duration interval, Supplier<Mono<Void>> body) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Interval of loop '" + name + "' must be positive, got " + interval);
        }
        this.name = name;
        this.interval = interval;
        this.body = body;
    }

    public synchronized void start() {
        if (currentRun.get()) {
            return;
        }

        AtomicBoolean run = new AtomicBoolean(true);
        AtomicBoolean inFlight = new AtomicBoolean(false);
        currentRun = run;
        currentInFlight = inFlight;
        log.debug("Starting {} loop (interval={})", name, interval);

        subscription = Mono.delay(interval)
                .filter(tick -> run.get())
                .flatMap(tick -> runIteration(inFlight))
                .repeat(run::get)
                .subscribe(
                        ignored -> {
                        },
                        err -> log.error("Loop {} terminated unexpectedly", name, err),
                        () -> log.debug("Loop {} stopped", name)
                );
    }

    public synchronized void stop() {
        if (!currentRun.compareAndSet(true, false)) {
            return;
        }

        Disposable current = subscription;
        if (current != null && !currentInFlight.get()) {
            current.dispose();
        }
        log.debug("Stop requested for {} loop", name);
    }

    public boolean isRunning() {
        return currentRun.get();
    }

    public String getName() {
        return name;
    }

    private Mono<Void> runIteration(AtomicBoolean inFlight) {
        return Mono.defer(() -> {
                    inFlight.set(true);
                    return body.get();
                })
                .doOnError(err -> log.error("Error in {} loop", name, err))
                .onErrorResume(err -> Mono.empty())
                .doFinally(signal -> inFlight.set(false));
    }
}

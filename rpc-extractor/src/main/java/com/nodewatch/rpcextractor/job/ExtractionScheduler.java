package com.nodewatch.rpcextractor.job;

import com.nodewatch.rpcextractor.catalog.MethodCatalog;
import com.nodewatch.rpcextractor.catalog.RpcMethodSpec;
import com.nodewatch.rpcextractor.fetch.FetchOutcome;
import com.nodewatch.rpcextractor.fetch.RpcFetcher;
import com.nodewatch.rpcextractor.metrics.RpcMetricsRecorder;
import com.nodewatch.rpcextractor.publish.EventPublisher;
import com.nodewatch.rpcextractor.publish.PublishException;
import com.nodewatch.rpcextractor.publish.RpcEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives the extraction loop. On every base tick it works out which enabled methods are due, dispatches
 * one fetch per due method onto the fetch executor, and for each outcome records metrics and publishes
 * successful results. A failure of one method is recorded and logged, never propagated.
 * <p>
 * Per-method state lives in arrays indexed by catalog position. {@code dueState} is only touched by the
 * tick thread; {@code inFlight} guarantees at most one outstanding fetch per method.
 * <p>
 * Shutdown is cooperative: after {@link #shutdown()} no tick dispatches anything, in-flight fetches run
 * to completion (bounded by the RPC timeout) and the state moves through DRAINING to STOPPED.
 */
@Slf4j
public class ExtractionScheduler implements SmartLifecycle {

    private final List<RpcMethodSpec> methods;
    private final RpcFetcher fetcher;
    private final EventPublisher publisher;
    private final RpcMetricsRecorder metrics;
    private final TaskScheduler tickScheduler;
    private final Executor fetchExecutor;
    private final ShutdownSignal shutdownSignal;
    private final Duration queryInterval;
    private final Duration shutdownTimeout;
    private final Clock clock;

    private final int[] dueState;
    private final AtomicBoolean[] inFlight;
    private final Object stateLock = new Object();
    private final CountDownLatch stoppedLatch = new CountDownLatch(1);
    private final AtomicLong tickCount = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private int inFlightCount;
    private volatile SchedulerState state = SchedulerState.IDLE;
    private volatile ScheduledFuture<?> tickFuture;

    public ExtractionScheduler(MethodCatalog catalog,
                               RpcFetcher fetcher,
                               EventPublisher publisher,
                               RpcMetricsRecorder metrics,
                               TaskScheduler tickScheduler,
                               Executor fetchExecutor,
                               ShutdownSignal shutdownSignal,
                               Duration queryInterval,
                               Duration shutdownTimeout,
                               Clock clock) {
        this.methods = catalog.methods();
        this.fetcher = fetcher;
        this.publisher = publisher;
        this.metrics = metrics;
        this.tickScheduler = tickScheduler;
        this.fetchExecutor = fetchExecutor;
        this.shutdownSignal = shutdownSignal;
        this.queryInterval = queryInterval;
        this.shutdownTimeout = shutdownTimeout;
        this.clock = clock;
        this.dueState = new int[methods.size()];
        this.inFlight = new AtomicBoolean[methods.size()];
        for (int i = 0; i < inFlight.length; i++) {
            inFlight[i] = new AtomicBoolean(false);
        }
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        List<String> enabled = methods.stream().filter(RpcMethodSpec::enabled).map(RpcMethodSpec::name).toList();
        metrics.registerMethods(enabled);
        if (enabled.isEmpty()) {
            log.warn("All RPC methods are disabled; extractor will only serve metrics");
        }
        log.info("Starting RPC extraction every {} ms for methods {}", queryInterval.toMillis(), enabled);
        tickFuture = tickScheduler.scheduleAtFixedRate(this::runTick, clock.instant().plus(queryInterval), queryInterval);
    }

    @Override
    public void stop() {
        shutdown();
        if (awaitStopped(shutdownTimeout)) {
            log.info("RPC extraction stopped after {} tick(s)", tickCount.get());
        } else {
            log.warn("RPC extraction did not drain within {} ms; {} fetch(es) still in flight",
                    shutdownTimeout.toMillis(), inFlightCount());
        }
    }

    @Override
    public boolean isRunning() {
        return started.get() && state != SchedulerState.STOPPED;
    }

    /**
     * Sets the shutdown signal and stops scheduling ticks. Returns immediately; see {@link #awaitStopped(Duration)}.
     */
    public void shutdown() {
        if (!shutdownSignal.trigger()) {
            log.debug("Shutdown already signalled");
        }
        ScheduledFuture<?> future = tickFuture;
        if (future != null) {
            future.cancel(false);
        }
        synchronized (stateLock) {
            if (state == SchedulerState.STOPPED) {
                return;
            }
            if (inFlightCount == 0) {
                markStopped();
            } else {
                state = SchedulerState.DRAINING;
                log.info("Shutdown requested, draining {} in-flight fetch(es)", inFlightCount);
            }
        }
    }

    public boolean awaitStopped(Duration timeout) {
        try {
            return stoppedLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public SchedulerState getState() {
        return state;
    }

    public long getTickCount() {
        return tickCount.get();
    }

    private void runTick() {
        try {
            tick();
        } catch (Exception e) {
            // an exception escaping a fixed-rate task would cancel all further ticks
            log.error("Extraction tick failed", e);
        }
    }

    /**
     * One base tick: advance every enabled method's counter and dispatch those that are due and free.
     */
    void tick() {
        if (shutdownSignal.isTriggered()) {
            shutdown();
            return;
        }
        long tick = tickCount.incrementAndGet();
        for (int i = 0; i < methods.size(); i++) {
            RpcMethodSpec method = methods.get(i);
            if (!method.enabled()) {
                continue;
            }
            dueState[i]++;
            if (dueState[i] < method.cadenceMultiplier()) {
                continue;
            }
            if (inFlight[i].get()) {
                log.debug("Tick {}: skipping {}, previous call still in flight", tick, method.name());
                continue;
            }
            if (dispatch(i, method)) {
                dueState[i] = 0;
            } else if (shutdownSignal.isTriggered()) {
                return;
            }
        }
    }

    /**
     * Returns false when nothing was handed to the executor; the method keeps its due counter and fires on a later tick.
     */
    private boolean dispatch(int index, RpcMethodSpec method) {
        synchronized (stateLock) {
            if (shutdownSignal.isTriggered()) {
                return false;
            }
            inFlight[index].set(true);
            inFlightCount++;
            state = SchedulerState.DISPATCHING;
        }
        try {
            fetchExecutor.execute(() -> runFetch(index, method));
        } catch (RejectedExecutionException e) {
            log.warn("Fetch executor rejected {}: {}", method.name(), e.getMessage());
            complete(index);
            return false;
        }
        return true;
    }

    private void runFetch(int index, RpcMethodSpec method) {
        try {
            process(method);
        } catch (Exception e) {
            log.error("Unexpected failure while processing {}", method.name(), e);
        } finally {
            complete(index);
        }
    }

    private void process(RpcMethodSpec method) {
        String name = method.name();
        FetchOutcome outcome = fetcher.fetch(method);
        metrics.recordDuration(name, outcome.elapsed());
        if (outcome instanceof FetchOutcome.Success success) {
            try {
                publisher.publish(new RpcEvent(name, success.payload(), clock.instant()));
            } catch (PublishException e) {
                metrics.recordPublishError(name);
                log.warn("Could not publish {} event: {}", name, e.getMessage());
            }
        } else if (outcome instanceof FetchOutcome.Failure failure) {
            metrics.recordError(name);
            log.warn("RPC {} failed ({}) after {} ms: {}",
                    name, failure.kind(), failure.elapsed().toMillis(), failure.message());
        }
    }

    private void complete(int index) {
        synchronized (stateLock) {
            inFlight[index].set(false);
            inFlightCount--;
            if (inFlightCount > 0) {
                return;
            }
            if (shutdownSignal.isTriggered()) {
                markStopped();
            } else {
                state = SchedulerState.IDLE;
            }
        }
    }

    private void markStopped() {
        state = SchedulerState.STOPPED;
        stoppedLatch.countDown();
    }

    private int inFlightCount() {
        synchronized (stateLock) {
            return inFlightCount;
        }
    }
}

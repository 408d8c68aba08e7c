package com.nodewatch.rpcextractor.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-method RPC metrics, registered on an explicitly supplied registry.
 *
 * Exposes (Prometheus names):
 * - rpcextractor_rpc_fetch_duration_seconds (histogram)
 * - rpcextractor_rpc_fetch_errors_total (counter)
 * - rpcextractor_nats_publish_errors_total (counter)
 * each labeled by rpc_method only.
 */
public class RpcMetricsRecorder {

    public static final String NAMESPACE = "rpcextractor";
    public static final String LABEL_RPC_METHOD = "rpc_method";

    public static final String FETCH_DURATION = NAMESPACE + ".rpc.fetch.duration";
    public static final String FETCH_ERRORS = NAMESPACE + ".rpc.fetch.errors";
    public static final String PUBLISH_ERRORS = NAMESPACE + ".nats.publish.errors";

    static final Duration[] DURATION_BUCKETS = {
            Duration.ofMillis(1), Duration.ofMillis(5), Duration.ofMillis(10), Duration.ofMillis(25),
            Duration.ofMillis(50), Duration.ofMillis(100), Duration.ofMillis(250), Duration.ofMillis(500),
            Duration.ofSeconds(1), Duration.ofMillis(2_500), Duration.ofSeconds(5), Duration.ofSeconds(10)
    };

    private final MeterRegistry registry;
    private final Map<String, Timer> durations = new ConcurrentHashMap<>();
    private final Map<String, Counter> fetchErrors = new ConcurrentHashMap<>();
    private final Map<String, Counter> publishErrors = new ConcurrentHashMap<>();

    public RpcMetricsRecorder(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Registers all three instruments for the given methods up front so they appear in the scrape at zero.
     */
    public void registerMethods(Iterable<String> methods) {
        for (String method : methods) {
            durationTimer(method);
            fetchErrorCounter(method);
            publishErrorCounter(method);
        }
    }

    public void recordDuration(String method, Duration elapsed) {
        durationTimer(method).record(elapsed);
    }

    public void recordError(String method) {
        fetchErrorCounter(method).increment();
    }

    public void recordPublishError(String method) {
        publishErrorCounter(method).increment();
    }

    private Timer durationTimer(String method) {
        return durations.computeIfAbsent(method, m -> Timer.builder(FETCH_DURATION)
                .description("Time it took to fetch data from the RPC endpoint.")
                .tag(LABEL_RPC_METHOD, m)
                .serviceLevelObjectives(DURATION_BUCKETS)
                .register(registry));
    }

    private Counter fetchErrorCounter(String method) {
        return fetchErrors.computeIfAbsent(method, m -> Counter.builder(FETCH_ERRORS)
                .description("Number of errors while fetching data from the RPC endpoint.")
                .tag(LABEL_RPC_METHOD, m)
                .register(registry));
    }

    private Counter publishErrorCounter(String method) {
        return publishErrors.computeIfAbsent(method, m -> Counter.builder(PUBLISH_ERRORS)
                .description("Number of errors while publishing events to NATS.")
                .tag(LABEL_RPC_METHOD, m)
                .register(registry));
    }
}

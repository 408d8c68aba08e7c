package com.nodewatch.rpcextractor.fetch;

import java.time.Duration;

/**
 * Result of a single fetch. Consumed immediately by the scheduler, never retained.
 */
public sealed interface FetchOutcome permits FetchOutcome.Success, FetchOutcome.Failure {

    String method();

    Duration elapsed();

    /**
     * @param payload raw JSON of the RPC {@code result} member
     */
    record Success(String method, byte[] payload, Duration elapsed) implements FetchOutcome {}

    record Failure(String method, FetchFailureKind kind, Duration elapsed, String message) implements FetchOutcome {}
}

package com.nodewatch.rpcextractor.fetch;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nodewatch.rpcextractor.adapter.NodeRpcClient;
import com.nodewatch.rpcextractor.adapter.RpcAuthException;
import com.nodewatch.rpcextractor.adapter.RpcException;
import com.nodewatch.rpcextractor.catalog.RpcMethodSpec;
import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.timeout.ReadTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Invokes one RPC method with a bounded timeout and turns the result into a {@link FetchOutcome}.
 * Never throws: every failure is classified into a {@link FetchFailureKind}.
 */
@Slf4j
public class RpcFetcher {

    private final NodeRpcClient rpcClient;
    private final ObjectMapper objectMapper;
    private final Duration rpcTimeout;

    public RpcFetcher(NodeRpcClient rpcClient, ObjectMapper objectMapper, Duration rpcTimeout) {
        this.rpcClient = rpcClient;
        this.objectMapper = objectMapper;
        this.rpcTimeout = rpcTimeout;
    }

    public FetchOutcome fetch(RpcMethodSpec method) {
        String name = method.name();
        long start = System.nanoTime();
        try {
            String body = rpcClient.call(name).timeout(rpcTimeout).block();
            byte[] payload = extractResult(name, body);
            return new FetchOutcome.Success(name, payload, elapsedSince(start));
        } catch (Exception e) {
            Duration elapsed = elapsedSince(start);
            FetchFailureKind kind = classify(e);
            log.debug("Fetch of {} failed after {} ms as {}", name, elapsed.toMillis(), kind, e);
            return new FetchOutcome.Failure(name, kind, elapsed, messageOf(e));
        }
    }

    private byte[] extractResult(String method, String body) throws IOException {
        if (body == null || body.isBlank()) {
            throw new RpcException("Empty RPC response for " + method);
        }
        JsonNode root = objectMapper.readTree(body);
        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            throw new RpcException("RPC error for " + method + ": " + error);
        }
        JsonNode result = root.get("result");
        if (result == null || result.isNull()) {
            throw new RpcException("RPC result is null for " + method);
        }
        return objectMapper.writeValueAsBytes(result);
    }

    /**
     * Walks the cause chain; reactor wraps checked exceptions such as {@link TimeoutException} when blocking.
     */
    static FetchFailureKind classify(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof TimeoutException) {
                return FetchFailureKind.TIMEOUT;
            }
            if (current instanceof RpcAuthException) {
                return FetchFailureKind.AUTH;
            }
            if (current instanceof RpcException || current instanceof JacksonException) {
                return FetchFailureKind.DECODE;
            }
            if (current instanceof WebClientRequestException || current instanceof IOException) {
                return hasTimeoutCause(current) ? FetchFailureKind.TIMEOUT : FetchFailureKind.NETWORK;
            }
            current = current.getCause();
        }
        return FetchFailureKind.NETWORK;
    }

    private static boolean hasTimeoutCause(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException
                    || t instanceof ReadTimeoutException
                    || t instanceof ConnectTimeoutException
                    || t instanceof SocketTimeoutException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}

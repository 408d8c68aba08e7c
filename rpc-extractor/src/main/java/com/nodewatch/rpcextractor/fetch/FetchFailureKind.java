package com.nodewatch.rpcextractor.fetch;

/**
 * Classification of a failed RPC fetch.
 */
public enum FetchFailureKind {
    /** Connection refused, reset, DNS or other transport error. */
    NETWORK,
    /** Credentials rejected by the node. */
    AUTH,
    /** Body missing, not JSON, or carrying a JSON-RPC error object. */
    DECODE,
    /** Call did not complete within the configured RPC timeout. */
    TIMEOUT
}

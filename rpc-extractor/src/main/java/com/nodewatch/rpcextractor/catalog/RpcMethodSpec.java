package com.nodewatch.rpcextractor.catalog;

/**
 * One catalog entry: method name, whether it is queried at all, and how many base ticks pass between fires.
 */
public record RpcMethodSpec(String name, boolean enabled, int cadenceMultiplier) {

    public RpcMethodSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Method name required");
        }
        if (cadenceMultiplier < 1) {
            throw new IllegalArgumentException("cadenceMultiplier must be >= 1 for " + name);
        }
    }
}

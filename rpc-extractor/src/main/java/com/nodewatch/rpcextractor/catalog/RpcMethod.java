package com.nodewatch.rpcextractor.catalog;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-only node RPC diagnostics the extractor knows how to query.
 * Cadence multiplier reflects call cost: chain-wide statistics are fired every 10th base tick.
 */
public enum RpcMethod {

    GETPEERINFO("getpeerinfo", 1),
    GETMEMPOOLINFO("getmempoolinfo", 1),
    UPTIME("uptime", 1),
    GETNETTOTALS("getnettotals", 1),
    GETMEMORYINFO("getmemoryinfo", 1),
    GETADDRMANINFO("getaddrmaninfo", 1),
    GETCHAINTXSTATS("getchaintxstats", 10),
    GETNETWORKINFO("getnetworkinfo", 1),
    GETBLOCKCHAININFO("getblockchaininfo", 10);

    private final String rpcName;
    private final int cadenceMultiplier;

    RpcMethod(String rpcName, int cadenceMultiplier) {
        this.rpcName = rpcName;
        this.cadenceMultiplier = cadenceMultiplier;
    }

    /** Method name as sent on the wire; also used as metric label and bus subject. */
    public String rpcName() {
        return rpcName;
    }

    public int cadenceMultiplier() {
        return cadenceMultiplier;
    }

    public static Optional<RpcMethod> fromRpcName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(m -> m.rpcName.equals(normalized)).findFirst();
    }
}

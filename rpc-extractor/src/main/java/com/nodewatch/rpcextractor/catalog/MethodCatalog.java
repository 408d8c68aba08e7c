package com.nodewatch.rpcextractor.catalog;

import com.nodewatch.rpcextractor.common.ExtractorConfigException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, immutable table of RPC methods. Position in {@link #methods()} is stable and used by the
 * scheduler to index its per-method state.
 */
public final class MethodCatalog {

    private final List<RpcMethodSpec> methods;

    public MethodCatalog(List<RpcMethodSpec> methods) {
        if (methods == null) {
            throw new IllegalArgumentException("methods must not be null");
        }
        Set<String> seen = new LinkedHashSet<>();
        for (RpcMethodSpec spec : methods) {
            if (!seen.add(spec.name())) {
                throw new IllegalArgumentException("Duplicate method in catalog: " + spec.name());
            }
        }
        this.methods = List.copyOf(methods);
    }

    /**
     * Builds the catalog of all known {@link RpcMethod}s, disabling the names listed.
     *
     * @throws ExtractorConfigException when a disabled name is not a known method
     */
    public static MethodCatalog fromDisabled(Collection<String> disabledMethods) {
        Set<RpcMethod> disabled = new LinkedHashSet<>();
        if (disabledMethods != null) {
            for (String name : disabledMethods) {
                RpcMethod method = RpcMethod.fromRpcName(name)
                        .orElseThrow(() -> new ExtractorConfigException("Unknown RPC method in disabled-methods: " + name));
                disabled.add(method);
            }
        }
        List<RpcMethodSpec> specs = new ArrayList<>();
        for (RpcMethod method : RpcMethod.values()) {
            specs.add(new RpcMethodSpec(method.rpcName(), !disabled.contains(method), method.cadenceMultiplier()));
        }
        return new MethodCatalog(specs);
    }

    public List<RpcMethodSpec> methods() {
        return methods;
    }

    public List<RpcMethodSpec> enabledMethods() {
        return methods.stream().filter(RpcMethodSpec::enabled).toList();
    }

    public Optional<RpcMethodSpec> find(String name) {
        return methods.stream().filter(m -> m.name().equals(name)).findFirst();
    }

    public int size() {
        return methods.size();
    }
}

package com.nodewatch.rpcextractor.config;

import com.nodewatch.rpcextractor.common.ExtractorConfigException;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Node RPC connection, query cadence and per-method switches.
 */
@ConfigurationProperties(prefix = "nodewatch.rpc-extractor")
@NoArgsConstructor
@Getter
@Setter
public class ExtractorProperties {

    /** RPC host:port of the node, without scheme. */
    private String rpcHost = "127.0.0.1:8332";

    /** Node cookie file ({@code __cookie__:<password>}). Takes precedence over rpcUser/rpcPassword. */
    private String rpcCookieFile;

    private String rpcUser;

    private String rpcPassword;

    /** Base tick: how often due methods are re-evaluated. */
    private Duration queryInterval = Duration.ofSeconds(10);

    /** Upper bound for a single RPC call; also bounds shutdown latency. */
    private Duration rpcTimeout = Duration.ofSeconds(10);

    /** Extra wait on shutdown on top of rpcTimeout before giving up on in-flight calls. */
    private Duration shutdownGrace = Duration.ofSeconds(2);

    /** RPC method names that are never queried, e.g. getpeerinfo. */
    private List<String> disabledMethods = new ArrayList<>();

    /** Prepended to the method name to form the bus subject. Empty: subject is the method name. */
    private String subjectPrefix = "";

    public void setDisabledMethods(List<String> disabledMethods) {
        this.disabledMethods = disabledMethods != null ? disabledMethods : new ArrayList<>();
    }

    /**
     * Rejects settings that would make the scheduler or the RPC client unusable.
     */
    public void validate() {
        if (rpcHost == null || rpcHost.isBlank()) {
            throw new ExtractorConfigException("nodewatch.rpc-extractor.rpc-host is required");
        }
        if (queryInterval == null || queryInterval.isZero() || queryInterval.isNegative()) {
            throw new ExtractorConfigException("nodewatch.rpc-extractor.query-interval must be positive");
        }
        if (rpcTimeout == null || rpcTimeout.isZero() || rpcTimeout.isNegative()) {
            throw new ExtractorConfigException("nodewatch.rpc-extractor.rpc-timeout must be positive");
        }
        boolean hasCookie = rpcCookieFile != null && !rpcCookieFile.isBlank();
        boolean hasUser = rpcUser != null && !rpcUser.isBlank();
        if (!hasCookie && !hasUser) {
            throw new ExtractorConfigException("Either rpc-cookie-file or rpc-user/rpc-password must be configured");
        }
    }
}

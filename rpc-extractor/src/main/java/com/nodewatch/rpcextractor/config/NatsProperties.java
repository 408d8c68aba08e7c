package com.nodewatch.rpcextractor.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection to the NATS server shared by all extractors.
 */
@ConfigurationProperties(prefix = "nodewatch.nats")
@NoArgsConstructor
@Getter
@Setter
public class NatsProperties {

    /** host:port of the NATS server. */
    private String address = "127.0.0.1:4222";

    /** Optional; when absent the connection is unauthenticated. */
    private String username;

    private String password;

    /** File holding the password; used when password is not set. Content is trimmed. */
    private String passwordFile;

    /** Connection timeout for the initial connect. */
    private Duration connectionTimeout = Duration.ofSeconds(5);
}

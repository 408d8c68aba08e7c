package com.nodewatch.rpcextractor.config;

import com.nodewatch.rpcextractor.common.ExtractorConfigException;
import io.nats.client.Connection;
import io.nats.client.Nats;
import io.nats.client.Options;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

/**
 * NATS connection for publishing events. A failed initial connect is fatal at startup; afterwards the
 * client reconnects on its own.
 */
@Configuration
@Slf4j
public class NatsConfig {

    @Bean(destroyMethod = "close")
    public Connection natsConnection(NatsProperties properties) {
        Options options = natsOptions(properties);
        log.info("Connecting to NATS server {}", properties.getAddress());
        try {
            return Nats.connect(options);
        } catch (IOException e) {
            throw new ExtractorConfigException("Could not connect to NATS server " + properties.getAddress(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractorConfigException("Interrupted while connecting to NATS server " + properties.getAddress(), e);
        }
    }

    static Options natsOptions(NatsProperties properties) {
        Options.Builder builder = new Options.Builder()
                .server(serverUrl(properties.getAddress()))
                .connectionName("rpc-extractor")
                .connectionTimeout(properties.getConnectionTimeout())
                .maxReconnects(-1);
        NatsCredentials.resolve(properties).ifPresent(c -> builder.userInfo(c.user(), c.password()));
        return builder.build();
    }

    static String serverUrl(String address) {
        if (address == null || address.isBlank()) {
            throw new ExtractorConfigException("nodewatch.nats.address is required");
        }
        return address.contains("://") ? address : "nats://" + address;
    }
}

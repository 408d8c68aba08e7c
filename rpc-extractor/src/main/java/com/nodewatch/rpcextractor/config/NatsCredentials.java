package com.nodewatch.rpcextractor.config;

import com.nodewatch.rpcextractor.common.ExtractorConfigException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * User/password for the NATS connection, resolved from {@link NatsProperties}.
 */
@Slf4j
public record NatsCredentials(String user, String password) {

    @Override
    public String toString() {
        return "NatsCredentials[user=" + user + ", password=***]";
    }

    /**
     * No username: unauthenticated. Otherwise the password comes from {@code password}, then from
     * {@code password-file} (trimmed). A username without any password is allowed but logged.
     */
    public static Optional<NatsCredentials> resolve(NatsProperties properties) {
        String user = properties.getUsername();
        if (user == null || user.isBlank()) {
            log.debug("Connecting to NATS server at {} without authentication", properties.getAddress());
            return Optional.empty();
        }
        String password = null;
        if (properties.getPassword() != null) {
            password = properties.getPassword();
            log.info("Using supplied NATS user={} with password", user);
        } else if (properties.getPasswordFile() != null && !properties.getPasswordFile().isBlank()) {
            password = readPasswordFile(properties.getPasswordFile());
            log.info("Using supplied NATS user={} with password from file {}", user, properties.getPasswordFile());
        }
        if (password == null) {
            log.warn("No NATS password supplied for connection to NATS server {} with user={}", properties.getAddress(), user);
            password = "";
        }
        return Optional.of(new NatsCredentials(user, password));
    }

    private static String readPasswordFile(String file) {
        try {
            return Files.readString(Path.of(file), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new ExtractorConfigException("Could not read NATS password file " + file, e);
        }
    }
}

package com.nodewatch.rpcextractor.publish;

import io.nats.client.Connection;

/**
 * {@link EventBus} on a core NATS connection. The jnats connection buffers outgoing messages and
 * reconnects on its own; a closed connection or invalid subject surfaces as {@link PublishException}.
 */
public class NatsEventBus implements EventBus {

    private final Connection connection;

    public NatsEventBus(Connection connection) {
        this.connection = connection;
    }

    @Override
    public void publish(String subject, byte[] payload) throws PublishException {
        try {
            connection.publish(subject, payload);
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw new PublishException("NATS publish to " + subject + " failed: " + e.getMessage(), e);
        }
    }
}

package com.nodewatch.rpcextractor.publish;

/**
 * Message bus the extractors publish to. Implementations must be safe for concurrent use.
 */
public interface EventBus {

    /**
     * Fire-and-forget publish; no acknowledgement is awaited.
     */
    void publish(String subject, byte[] payload) throws PublishException;
}

package com.nodewatch.rpcextractor.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Locale;

/**
 * Serializes an {@link RpcEvent} into the JSON envelope and publishes it on the method's subject.
 * Envelope: {@code {"method": "...", "timestamp": "<ISO-8601>", "payload": <rpc result>}}.
 */
@Slf4j
public class EventPublisher {

    private final EventBus eventBus;
    private final ObjectMapper objectMapper;
    private final String subjectPrefix;

    public EventPublisher(EventBus eventBus, ObjectMapper objectMapper, String subjectPrefix) {
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
        this.subjectPrefix = subjectPrefix != null ? subjectPrefix : "";
    }

    public void publish(RpcEvent event) throws PublishException {
        String subject = subjectFor(event.method());
        byte[] envelope = serialize(event);
        eventBus.publish(subject, envelope);
        log.debug("Published {} ({} bytes) on {}", event.method(), envelope.length, subject);
    }

    /** Stable, lowercase subject per method so consumers can subscribe selectively. */
    public String subjectFor(String method) {
        return subjectPrefix + method.toLowerCase(Locale.ROOT);
    }

    byte[] serialize(RpcEvent event) throws PublishException {
        try {
            ObjectNode envelope = objectMapper.createObjectNode();
            envelope.put("method", event.method());
            envelope.put("timestamp", event.timestamp().toString());
            envelope.set("payload", objectMapper.readTree(event.payload()));
            return objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new PublishException("Could not serialize event for " + event.method(), e);
        } catch (IOException e) {
            throw new PublishException("Could not read payload for " + event.method(), e);
        }
    }
}

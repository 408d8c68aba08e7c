package com.nodewatch.rpcextractor.publish;

/**
 * An event could not be serialized or handed to the bus client.
 */
public class PublishException extends Exception {

    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.nodewatch.rpcextractor.common;

/**
 * Invalid or unusable startup configuration. Fatal: fails context creation.
 */
public class ExtractorConfigException extends RuntimeException {

    public ExtractorConfigException(String message) {
        super(message);
    }

    public ExtractorConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}

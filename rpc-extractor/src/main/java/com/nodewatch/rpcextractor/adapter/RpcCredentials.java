package com.nodewatch.rpcextractor.adapter;

import com.nodewatch.rpcextractor.common.ExtractorConfigException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * HTTP basic credentials for the node RPC interface.
 */
public record RpcCredentials(String user, String password) {

    @Override
    public String toString() {
        return "RpcCredentials[user=" + user + ", password=***]";
    }

    /**
     * Cookie file wins over user/password, matching how the node itself prefers cookie auth.
     */
    public static RpcCredentials resolve(String cookieFile, String user, String password) {
        if (cookieFile != null && !cookieFile.isBlank()) {
            return fromCookieFile(Path.of(cookieFile));
        }
        if (user == null || user.isBlank()) {
            throw new ExtractorConfigException("No RPC credentials configured");
        }
        return new RpcCredentials(user, password != null ? password : "");
    }

    /**
     * Reads a node cookie file of the form {@code user:password} (usually {@code __cookie__:<hex>}).
     */
    public static RpcCredentials fromCookieFile(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new ExtractorConfigException("Could not read RPC cookie file " + path, e);
        }
        int sep = content.indexOf(':');
        if (sep <= 0) {
            throw new ExtractorConfigException("Malformed RPC cookie file " + path + ": expected user:password");
        }
        return new RpcCredentials(content.substring(0, sep), content.substring(sep + 1));
    }
}

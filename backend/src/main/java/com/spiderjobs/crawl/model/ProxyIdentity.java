package com.spiderjobs.crawl.model;

import java.util.Map;

/**
 * An egress configuration. {@code proxyHost} is null for direct connections.
 */
public record ProxyIdentity(
    String id,
    String proxyHost,
    Integer proxyPort,
    Map<String, String> headers
) {
    public ProxyIdentity {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public boolean isDirect() {
        return proxyHost == null || proxyHost.isBlank() || proxyPort == null;
    }
}

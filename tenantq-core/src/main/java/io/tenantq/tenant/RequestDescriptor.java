package io.tenantq.tenant;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * What the web/API layer knows about an inbound request: host, headers and the claims of an
 * already authenticated token.
 *
 * @param host        request host, optionally with port
 * @param headers     request headers; looked up case-insensitively
 * @param tokenClaims claims of the verified token (empty when unauthenticated)
 * @param privileged  whether the caller may name a tenant explicitly through the tenant header
 */
public record RequestDescriptor(
        String host,
        Map<String, String> headers,
        Map<String, Object> tokenClaims,
        boolean privileged
) {
    public RequestDescriptor {
        TreeMap<String, String> normalized = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((k, v) -> {
                if (k != null && v != null) {
                    normalized.put(k, v);
                }
            });
        }
        headers = normalized;
        tokenClaims = tokenClaims == null ? Map.of() : Map.copyOf(tokenClaims);
    }

    public String header(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return headers.get(name);
    }

    public String claim(String name) {
        Object value = tokenClaims.get(name);
        return value == null ? null : value.toString();
    }

    /**
     * Host in lower case without port, or null.
     */
    public String normalizedHost() {
        if (host == null || host.isBlank()) {
            return null;
        }
        String h = host.trim().toLowerCase(Locale.ROOT);
        int colon = h.indexOf(':');
        return colon >= 0 ? h.substring(0, colon) : h;
    }
}

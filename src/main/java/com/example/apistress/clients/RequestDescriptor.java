package com.example.apistress.clients;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable parameters of one HTTP call. A single descriptor is built per run and shared read-only by
 * every worker.
 */
@Value
public class RequestDescriptor {
    HttpMethod method;
    String url;
    Map<String, String> headers;
    Map<String, String> params;
    Duration timeout;

    @Builder
    private RequestDescriptor(HttpMethod method,
                              String url,
                              Map<String, String> headers,
                              Map<String, String> params,
                              Duration timeout) {
        this.method = method != null ? method : HttpMethod.GET;
        this.url = url;
        this.headers = copyOf(headers);
        this.params = copyOf(params);
        this.timeout = timeout;
    }

    private static Map<String, String> copyOf(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}

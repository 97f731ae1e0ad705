package com.example.apistress.clients;

import java.util.Arrays;

public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE,
    PATCH,
    HEAD,
    OPTIONS;

    public static HttpMethod fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("HTTP method must be provided");
        }
        return Arrays.stream(values())
                .filter(method -> method.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported HTTP method: " + value));
    }
}

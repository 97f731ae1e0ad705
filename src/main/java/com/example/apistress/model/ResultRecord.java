package com.example.apistress.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Map;

/**
 * Outcome of one executed attempt, persisted as a single JSON line. Absent values are omitted from the
 * serialized form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
        "request_id", "timestamp", "url", "method", "headers", "params", "status_code",
        "response_time_ms", "success", "response_headers", "content_length", "response_body", "error"
})
public record ResultRecord(
        @JsonProperty("request_id") long requestId,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("url") String url,
        @JsonProperty("method") String method,
        @JsonProperty("headers") Map<String, String> headers,
        @JsonProperty("params") Map<String, String> params,
        @JsonProperty("status_code") Integer statusCode,
        @JsonProperty("response_time_ms") double responseTimeMs,
        @JsonProperty("success") boolean success,
        @JsonProperty("response_headers") Map<String, String> responseHeaders,
        @JsonProperty("content_length") Long contentLength,
        @JsonProperty("response_body") JsonNode responseBody,
        @JsonProperty("error") String error
) {

    public static boolean isSuccessStatus(int statusCode) {
        return statusCode >= 200 && statusCode < 400;
    }

    public static ResultRecord completed(long requestId,
                                         Instant timestamp,
                                         String url,
                                         String method,
                                         Map<String, String> headers,
                                         Map<String, String> params,
                                         int statusCode,
                                         double responseTimeMs,
                                         Map<String, String> responseHeaders,
                                         long contentLength,
                                         JsonNode responseBody) {
        return new ResultRecord(requestId, timestamp, url, method, headers, params, statusCode,
                round(responseTimeMs), isSuccessStatus(statusCode), responseHeaders, contentLength,
                responseBody, null);
    }

    public static ResultRecord failed(long requestId,
                                      Instant timestamp,
                                      String url,
                                      String method,
                                      Map<String, String> headers,
                                      Map<String, String> params,
                                      double responseTimeMs,
                                      String error) {
        return new ResultRecord(requestId, timestamp, url, method, headers, params, null,
                round(responseTimeMs), false, null, null, null, error);
    }

    private static double round(double millis) {
        return Math.round(millis * 100.0) / 100.0;
    }
}

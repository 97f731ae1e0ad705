package com.example.apistress.config;

import com.example.apistress.clients.HttpMethod;
import com.example.apistress.sink.LogWriteMode;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Everything one stress run needs. Defaults match the entry point: 100 requests, 10 concurrent, GET,
 * {@code api_stress_test.jsonl}, 60 second timeout, fresh log file per run.
 */
@Value
@Builder(toBuilder = true)
public class StressTestConfig {

    public static final int DEFAULT_TOTAL_REQUESTS = 100;
    public static final int DEFAULT_CONCURRENT_REQUESTS = 10;
    public static final String DEFAULT_LOG_FILE = "api_stress_test.jsonl";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    /** Headers the JDK HTTP client manages itself and refuses to accept from callers. */
    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host", "upgrade");

    private static final String TOKEN_CHARS = "!#$%&'*+-.^_`|~";

    String url;

    @Builder.Default
    int totalRequests = DEFAULT_TOTAL_REQUESTS;

    @Builder.Default
    int concurrentRequests = DEFAULT_CONCURRENT_REQUESTS;

    @Builder.Default
    Map<String, String> headers = Map.of();

    @Builder.Default
    Map<String, String> params = Map.of();

    @Builder.Default
    HttpMethod method = HttpMethod.GET;

    @Builder.Default
    String logFile = DEFAULT_LOG_FILE;

    @Builder.Default
    Duration timeout = DEFAULT_TIMEOUT;

    @Builder.Default
    LogWriteMode writeMode = LogWriteMode.TRUNCATE;

    /** Rejects anything that would make the run unable to start. */
    public void validate() {
        if (totalRequests < 1) {
            throw new ConfigurationException("total_requests must be >= 1 (was " + totalRequests + ")");
        }
        if (concurrentRequests < 1) {
            throw new ConfigurationException("concurrent_requests must be >= 1 (was " + concurrentRequests + ")");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new ConfigurationException("timeout must be > 0 (was " + timeout + ")");
        }
        if (method == null) {
            throw new ConfigurationException("method must be provided");
        }
        validateUrl(url);
        validateHeaders(headers);
        if (logFile == null || logFile.isBlank()) {
            throw new ConfigurationException("log_file must be provided");
        }
        try {
            Path.of(logFile);
        } catch (InvalidPathException e) {
            throw new ConfigurationException("log_file is not a valid path: " + e.getMessage());
        }
    }

    public Path logPath() {
        return Path.of(logFile);
    }

    private static void validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new ConfigurationException("url must be provided");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new ConfigurationException("url is not a valid URI: " + e.getMessage());
        }
        String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new ConfigurationException("url must use http or https: " + url);
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new ConfigurationException("url must include a host: " + url);
        }
    }

    private static void validateHeaders(Map<String, String> headers) {
        if (headers == null) {
            return;
        }
        headers.forEach((name, value) -> {
            if (name == null || !isToken(name)) {
                throw new ConfigurationException("header name is not a valid token: " + name);
            }
            if (RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                throw new ConfigurationException("header " + name + " is set by the HTTP client and cannot be configured");
            }
            if (value != null && !isValidHeaderValue(value)) {
                throw new ConfigurationException("header " + name + " has an invalid value");
            }
        });
    }

    private static boolean isToken(String name) {
        if (name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean alphaNumeric = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
            if (!alphaNumeric && TOKEN_CHARS.indexOf(c) < 0) {
                return false;
            }
        }
        return true;
    }

    // visible ASCII, obs-text, space and tab; no CR, LF or other controls
    private static boolean isValidHeaderValue(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if ((c < 0x20 && c != '\t') || c == 0x7F || c > 0xFF) {
                return false;
            }
        }
        return true;
    }

    public static Duration timeoutOfSeconds(double seconds) {
        if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds <= 0) {
            throw new ConfigurationException("timeout must be > 0 (was " + seconds + ")");
        }
        return Duration.ofNanos(Math.max(1L, Math.round(seconds * 1_000_000_000L)));
    }
}

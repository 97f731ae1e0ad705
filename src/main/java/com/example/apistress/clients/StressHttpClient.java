package com.example.apistress.clients;

import com.example.apistress.clients.utils.JsonUtil;
import com.example.apistress.model.ResultRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP executor backed by a single shared {@link HttpClient}, so connections to the target are pooled
 * across every worker of a run. Each call performs exactly one attempt and converts the outcome into a
 * {@link ResultRecord}; no exception escapes {@link #execute(RequestDescriptor, long)}. The descriptor
 * timeout bounds the whole attempt, body included.
 *
 * <p>There is nothing to close: the JDK 17 client releases its pool once it is unreachable.
 */
@Getter
public class StressHttpClient implements RequestExecutor {
  private static final Logger log = LoggerFactory.getLogger(StressHttpClient.class);

  private final HttpClient httpClient;
  private final Duration connectTimeout;

  public StressHttpClient(Duration connectTimeout) {
    this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();

    log.info("StressHttpClient initialized - Connection timeout: {} ms", connectTimeout.toMillis());
  }

  @Override
  public ResultRecord execute(RequestDescriptor descriptor, long requestId) {
    Objects.requireNonNull(descriptor, "descriptor cannot be null");

    var deadline = descriptor.getTimeout() != null ? descriptor.getTimeout() : connectTimeout;
    var startTime = System.nanoTime();
    CompletableFuture<HttpResponse<byte[]>> inFlight = null;
    try {
      var httpRequest = buildHttpRequest(descriptor);

      log.debug("Executing request {}: {} {}", requestId, descriptor.getMethod(), httpRequest.uri());

      // the request timeout stops at the response headers; the deadline here also covers the body
      inFlight = httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
      var response = inFlight.get(deadline.toNanos(), TimeUnit.NANOSECONDS);
      var durationMs = elapsedMillis(startTime);

      var result = buildCompletedRecord(descriptor, requestId, response, durationMs);

      log.debug(
          "Request {} completed in {} ms with status {}", requestId, durationMs, response.statusCode());
      return result;

    } catch (TimeoutException e) {
      inFlight.cancel(true);
      var durationMs = elapsedMillis(startTime);
      return buildFailedRecord(
          descriptor,
          requestId,
          TransportFailure.TIMEOUT,
          "TIMEOUT: request did not complete within " + deadline.toMillis() + " ms",
          durationMs);
    } catch (InterruptedException e) {
      if (inFlight != null) {
        inFlight.cancel(true);
      }
      Thread.currentThread().interrupt();
      return buildFailedRecord(descriptor, requestId, e, elapsedMillis(startTime));
    } catch (ExecutionException e) {
      return buildFailedRecord(descriptor, requestId, e.getCause(), elapsedMillis(startTime));
    } catch (Exception e) {
      return buildFailedRecord(descriptor, requestId, e, elapsedMillis(startTime));
    }
  }

  private HttpRequest buildHttpRequest(RequestDescriptor descriptor) {
    var url = appendQuery(descriptor.getUrl(), descriptor.getParams());

    var requestBuilder = HttpRequest.newBuilder().uri(URI.create(url));
    if (descriptor.getTimeout() != null) {
      requestBuilder.timeout(descriptor.getTimeout());
    }

    descriptor.getHeaders().forEach(requestBuilder::setHeader);
    requestBuilder.method(descriptor.getMethod().name(), HttpRequest.BodyPublishers.noBody());

    return requestBuilder.build();
  }

  private ResultRecord buildCompletedRecord(
      RequestDescriptor descriptor, long requestId, HttpResponse<byte[]> response, double durationMs) {
    byte[] body = response.body() != null ? response.body() : new byte[0];
    Map<String, String> responseHeaders =
        response.headers().map().entrySet().stream()
            .collect(
                Collectors.toMap(
                    e -> e.getKey().toLowerCase(Locale.ROOT),
                    e -> String.join(",", e.getValue()),
                    (a, b) -> a + "," + b,
                    TreeMap::new));
    Optional<String> contentType = response.headers().firstValue("content-type");

    return ResultRecord.completed(
        requestId,
        Instant.now(),
        descriptor.getUrl(),
        descriptor.getMethod().name(),
        descriptor.getHeaders(),
        descriptor.getParams(),
        response.statusCode(),
        durationMs,
        responseHeaders,
        body.length,
        parseJsonBody(requestId, contentType.orElse(null), body));
  }

  private ResultRecord buildFailedRecord(
      RequestDescriptor descriptor, long requestId, Throwable failure, double durationMs) {
    TransportFailure category = TransportFailure.classify(failure);
    return buildFailedRecord(descriptor, requestId, category, category.describe(failure), durationMs);
  }

  private ResultRecord buildFailedRecord(
      RequestDescriptor descriptor,
      long requestId,
      TransportFailure category,
      String error,
      double durationMs) {
    log.debug("Request {} failed ({}) after {} ms: {}", requestId, category, durationMs, error);
    return ResultRecord.failed(
        requestId,
        Instant.now(),
        descriptor.getUrl(),
        descriptor.getMethod().name(),
        descriptor.getHeaders(),
        descriptor.getParams(),
        durationMs,
        error);
  }

  /**
   * Parses the body only for JSON content types. A body that fails to parse is dropped rather than
   * failing the record.
   */
  static JsonNode parseJsonBody(long requestId, String contentType, byte[] body) {
    if (body == null || body.length == 0 || !isJsonContentType(contentType)) {
      return null;
    }
    var text = new String(body, charsetOf(contentType));
    if (text.isBlank()) {
      return null;
    }
    try {
      return JsonUtil.readTree(text);
    } catch (JsonProcessingException e) {
      log.debug("Request {} declared JSON but body could not be parsed: {}", requestId, e.getOriginalMessage());
      return null;
    }
  }

  static boolean isJsonContentType(String contentType) {
    if (contentType == null) {
      return false;
    }
    var mediaType = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
    return mediaType.equals("application/json") || mediaType.endsWith("+json");
  }

  private static Charset charsetOf(String contentType) {
    for (String part : contentType.split(";")) {
      var trimmed = part.trim();
      if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
        var name = trimmed.substring("charset=".length()).replace("\"", "").trim();
        try {
          return Charset.forName(name);
        } catch (IllegalArgumentException e) {
          log.debug("Unknown response charset {}, falling back to UTF-8", name);
        }
      }
    }
    return StandardCharsets.UTF_8;
  }

  static String appendQuery(String url, Map<String, String> params) {
    if (params == null || params.isEmpty()) {
      return url;
    }
    var queryStr =
        params.entrySet().stream()
            .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
            .collect(Collectors.joining("&"));
    var fragmentIndex = url.indexOf('#');
    var base = fragmentIndex >= 0 ? url.substring(0, fragmentIndex) : url;
    var fragment = fragmentIndex >= 0 ? url.substring(fragmentIndex) : "";
    var separator = base.contains("?") ? (base.endsWith("?") || base.endsWith("&") ? "" : "&") : "?";
    return base + separator + queryStr + fragment;
  }

  private static String encode(String value) {
    return value != null ? URLEncoder.encode(value, StandardCharsets.UTF_8) : "";
  }

  private static double elapsedMillis(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000.0;
  }
}

package com.example.apistress.dto;

import com.example.apistress.sink.LogWriteMode;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.Map;

/** Run submission. Only {@code url} is required; absent fields fall back to the {@code stress.*} defaults. */
public class RunSubmissionRequest {

    @NotBlank
    @JsonProperty("url")
    private String url;

    @Min(1)
    @JsonProperty("totalRequests")
    private Integer totalRequests;

    @Min(1)
    @JsonProperty("concurrentRequests")
    private Integer concurrentRequests;

    @JsonProperty("headers")
    private Map<String, String> headers;

    @JsonProperty("params")
    private Map<String, String> params;

    @JsonProperty("method")
    private String method;

    @JsonProperty("logFile")
    private String logFile;

    @Positive
    @JsonProperty("timeoutSeconds")
    private Double timeoutSeconds;

    @JsonProperty("writeMode")
    private LogWriteMode writeMode;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public Integer getTotalRequests() {
        return totalRequests;
    }

    public void setTotalRequests(Integer totalRequests) {
        this.totalRequests = totalRequests;
    }

    public Integer getConcurrentRequests() {
        return concurrentRequests;
    }

    public void setConcurrentRequests(Integer concurrentRequests) {
        this.concurrentRequests = concurrentRequests;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public void setHeaders(Map<String, String> headers) {
        this.headers = headers;
    }

    public Map<String, String> getParams() {
        return params;
    }

    public void setParams(Map<String, String> params) {
        this.params = params;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public String getLogFile() {
        return logFile;
    }

    public void setLogFile(String logFile) {
        this.logFile = logFile;
    }

    public Double getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(Double timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public LogWriteMode getWriteMode() {
        return writeMode;
    }

    public void setWriteMode(LogWriteMode writeMode) {
        this.writeMode = writeMode;
    }
}

package com.example.apistress.config;

import com.example.apistress.clients.HttpMethod;
import com.example.apistress.sink.LogWriteMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "stress")
public class StressTestProperties {

    /** Target for the startup run. Submitted runs carry their own url. */
    private String url;

    private boolean runOnStartup = false;

    @Min(1)
    private int totalRequests = StressTestConfig.DEFAULT_TOTAL_REQUESTS;

    @Min(1)
    private int concurrentRequests = StressTestConfig.DEFAULT_CONCURRENT_REQUESTS;

    @NotNull
    private HttpMethod method = HttpMethod.GET;

    private Map<String, String> headers = new LinkedHashMap<>();

    private Map<String, String> params = new LinkedHashMap<>();

    @NotBlank
    private String logFile = StressTestConfig.DEFAULT_LOG_FILE;

    @NotNull
    private Duration timeout = StressTestConfig.DEFAULT_TIMEOUT;

    @NotNull
    private LogWriteMode writeMode = LogWriteMode.TRUNCATE;

    @Min(1)
    @Max(16)
    private int maxParallelRuns = 1;

    @Positive
    private int historySize = 50;

    /** Builder pre-filled with these defaults; callers override per run. */
    public StressTestConfig.StressTestConfigBuilder toConfigBuilder() {
        return StressTestConfig.builder()
                .url(url)
                .totalRequests(totalRequests)
                .concurrentRequests(concurrentRequests)
                .method(method)
                .headers(headers != null ? Map.copyOf(headers) : Map.of())
                .params(params != null ? Map.copyOf(params) : Map.of())
                .logFile(logFile)
                .timeout(timeout)
                .writeMode(writeMode);
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }

    public int getTotalRequests() {
        return totalRequests;
    }

    public void setTotalRequests(int totalRequests) {
        this.totalRequests = totalRequests;
    }

    public int getConcurrentRequests() {
        return concurrentRequests;
    }

    public void setConcurrentRequests(int concurrentRequests) {
        this.concurrentRequests = concurrentRequests;
    }

    public HttpMethod getMethod() {
        return method;
    }

    public void setMethod(HttpMethod method) {
        this.method = method;
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

    public String getLogFile() {
        return logFile;
    }

    public void setLogFile(String logFile) {
        this.logFile = logFile;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public LogWriteMode getWriteMode() {
        return writeMode;
    }

    public void setWriteMode(LogWriteMode writeMode) {
        this.writeMode = writeMode;
    }

    public int getMaxParallelRuns() {
        return maxParallelRuns;
    }

    public void setMaxParallelRuns(int maxParallelRuns) {
        this.maxParallelRuns = maxParallelRuns;
    }

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }
}

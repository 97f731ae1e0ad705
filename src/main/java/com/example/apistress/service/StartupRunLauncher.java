package com.example.apistress.service;

import com.example.apistress.config.StressTestProperties;
import com.example.apistress.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Runs one stress test against {@code stress.url} with the configured defaults when the application starts. */
@Component
@ConditionalOnProperty(prefix = "stress", name = "run-on-startup", havingValue = "true")
public class StartupRunLauncher implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupRunLauncher.class);

    private final StressTestProperties properties;
    private final StressTestRunner runner;

    public StartupRunLauncher(StressTestProperties properties, StressTestRunner runner) {
        this.properties = properties;
        this.runner = runner;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        log.info("Startup run enabled, targeting {}", properties.getUrl());
        RunSummary summary = runner.runStressTest(properties.toConfigBuilder().build());
        log.info("Startup run finished: {}/{} succeeded, log at {}",
                summary.successCount(), summary.totalRequests(), summary.logFile());
    }
}

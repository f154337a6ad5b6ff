package com.polyfetch.orchestrator;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one fetch round at startup and prints the combined outcome line. Backend failures do not fail startup.
 */
@Component
@ConditionalOnProperty(prefix = "polyfetch.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class StartupFetchRunner implements ApplicationRunner {

    private final FetchOrchestrator orchestrator;

    @Override
    public void run(ApplicationArguments args) {
        CombinedReport report = orchestrator.fetchAll();
        System.out.println(report.toLine());
    }
}

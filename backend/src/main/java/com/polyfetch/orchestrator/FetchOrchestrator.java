package com.polyfetch.orchestrator;

import com.polyfetch.aggregation.summary.Summary;
import com.polyfetch.backend.BackendClient;
import com.polyfetch.backend.relational.Employee;
import com.polyfetch.backend.rpc.AccountBalance;
import com.polyfetch.common.BackendException;
import com.polyfetch.common.ErrorKind;
import com.polyfetch.common.FetchError;
import com.polyfetch.common.FetchResult;
import com.polyfetch.config.AsyncConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Starts all three backend fetches together and waits for every one of them. A failure, timeout or unexpected
 * exception in one backend only turns that backend's result into a failure; nothing is cancelled elsewhere.
 */
@Service
@Slf4j
public class FetchOrchestrator {

    private final BackendClient<AccountBalance> accountClient;
    private final BackendClient<List<Employee>> employeeClient;
    private final BackendClient<List<Summary>> summaryClient;
    private final Executor fetchExecutor;
    private final ScheduledExecutorService timeoutScheduler;
    private final FetchProperties properties;
    private final TimeLimiter timeLimiter;
    private final AtomicReference<OrchestrationState> state = new AtomicReference<>(OrchestrationState.NOT_STARTED);

    public FetchOrchestrator(BackendClient<AccountBalance> accountClient,
                             BackendClient<List<Employee>> employeeClient,
                             BackendClient<List<Summary>> summaryClient,
                             @Qualifier(AsyncConfig.FETCH_EXECUTOR) Executor fetchExecutor,
                             @Qualifier(AsyncConfig.FETCH_TIMEOUT_SCHEDULER) ThreadPoolTaskScheduler timeoutScheduler,
                             FetchProperties properties) {
        this.accountClient = accountClient;
        this.employeeClient = employeeClient;
        this.summaryClient = summaryClient;
        this.fetchExecutor = fetchExecutor;
        this.timeoutScheduler = timeoutScheduler.getScheduledExecutor();
        this.properties = properties;
        this.timeLimiter = TimeLimiter.of("backend-fetch", TimeLimiterConfig.custom()
                .timeoutDuration(properties.timeout())
                .cancelRunningFuture(true)
                .build());
    }

    public OrchestrationState getState() {
        return state.get();
    }

    /**
     * Run one fetch round. Runs are not meant to overlap; {@link #getState()} reflects the latest one.
     */
    public CombinedReport fetchAll() {
        state.set(OrchestrationState.NOT_STARTED);
        CompletableFuture<FetchResult<AccountBalance>> account = dispatch(accountClient);
        CompletableFuture<FetchResult<List<Employee>>> employees = dispatch(employeeClient);
        CompletableFuture<FetchResult<List<Summary>>> summaries = dispatch(summaryClient);
        state.set(OrchestrationState.ALL_DISPATCHED);
        log.debug("Dispatched {}, {}, {}", accountClient.name(), employeeClient.name(), summaryClient.name());

        CompletableFuture.allOf(account, employees, summaries).join();
        state.set(OrchestrationState.ALL_COMPLETED);

        CombinedReport report = new CombinedReport(account.join(), employees.join(), summaries.join());
        log.info("Fetch round completed: {} of 3 backends failed", report.failureCount());
        return report;
    }

    private <T> CompletableFuture<FetchResult<T>> dispatch(BackendClient<T> client) {
        return timeLimiter.executeCompletionStage(timeoutScheduler,
                        () -> CompletableFuture.supplyAsync(client::fetch, fetchExecutor))
                .toCompletableFuture()
                .exceptionally(e -> failure(client.name(), e));
    }

    private <T> FetchResult<T> failure(String backend, Throwable thrown) {
        Throwable cause = unwrap(thrown);
        if (cause instanceof BackendException be) {
            return FetchResult.failure(backend, be);
        }
        if (cause instanceof TimeoutException) {
            log.warn("{} fetch timed out after {}", backend, properties.timeout());
            return FetchResult.failure(FetchError.of(ErrorKind.TIMEOUT, backend,
                    "No result within " + properties.timeout()));
        }
        log.error("{} fetch failed unexpectedly", backend, cause);
        return FetchResult.failure(FetchError.of(ErrorKind.UNEXPECTED, backend, String.valueOf(cause)));
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

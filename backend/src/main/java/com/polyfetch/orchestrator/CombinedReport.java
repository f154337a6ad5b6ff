package com.polyfetch.orchestrator;

import com.polyfetch.aggregation.summary.Summary;
import com.polyfetch.backend.relational.Employee;
import com.polyfetch.backend.rpc.AccountBalance;
import com.polyfetch.common.FetchResult;

import java.util.List;

/**
 * The three independent outcomes of one orchestration run.
 */
public record CombinedReport(
        FetchResult<AccountBalance> account,
        FetchResult<List<Employee>> employees,
        FetchResult<List<Summary>> summaries
) {

    public boolean allSucceeded() {
        return account.isSuccess() && employees.isSuccess() && summaries.isSuccess();
    }

    public long failureCount() {
        return List.of(account, employees, summaries).stream().filter(r -> !r.isSuccess()).count();
    }

    /**
     * Single line with all three outcomes, in backend declaration order.
     */
    public String toLine() {
        return account + ", " + employees + ", " + summaries;
    }
}

package com.fastalert.model;

import com.fastalert.model.enums.JobOutcome;
import com.fastalert.model.enums.OverallStatus;

import java.util.List;

/**
 * 批量派发报告
 */
public class BatchReport {

    private final List<JobResult> results;

    private final int sent;

    private final int failed;

    private final int skipped;

    public BatchReport(List<JobResult> results) {
        this.results = List.copyOf(results);
        int s = 0, f = 0, k = 0;
        for (JobResult r : this.results) {
            if (r.getOutcome() == JobOutcome.SENT) {
                s++;
            } else if (r.getOutcome() == JobOutcome.SKIPPED) {
                k++;
            } else {
                f++;
            }
        }
        this.sent = s;
        this.failed = f;
        this.skipped = k;
    }

    public static BatchReport empty() {
        return new BatchReport(List.of());
    }

    public List<JobResult> getResults() { return results; }
    public int getSent() { return sent; }
    public int getFailed() { return failed; }
    public int getSkipped() { return skipped; }
    public int getTotal() { return results.size(); }

    public long count(JobOutcome outcome) {
        return results.stream().filter(r -> r.getOutcome() == outcome).count();
    }

    public OverallStatus overallStatus() {
        if (sent == 0) {
            return OverallStatus.FAILED;
        }
        return sent == results.size() ? OverallStatus.DELIVERED : OverallStatus.PARTIAL;
    }
}

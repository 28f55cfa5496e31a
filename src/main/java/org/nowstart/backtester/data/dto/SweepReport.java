package org.nowstart.backtester.data.dto;

import java.util.List;

/**
 * Outcome of a parameter sweep: counters for every combination plus the best-ranked runs.
 */
public record SweepReport(
        String strategy,
        long combinations,
        int evaluated,
        int skipped,
        int failed,
        int timedOut,
        List<SweepResult> top
) {

    public SweepReport {
        top = top == null ? List.of() : List.copyOf(top);
    }
}

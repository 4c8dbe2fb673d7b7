package com.eainde.kyc.batch;

import java.util.List;

/**
 * Per-row outcomes of a batch, in input order, with counts.
 */
public record BatchSummary(int total, int successful, int failed, List<BatchRowOutcome> results) {

    public static BatchSummary of(List<BatchRowOutcome> outcomes) {
        int successful = (int) outcomes.stream().filter(BatchRowOutcome::isSuccess).count();
        return new BatchSummary(outcomes.size(), successful, outcomes.size() - successful, List.copyOf(outcomes));
    }
}

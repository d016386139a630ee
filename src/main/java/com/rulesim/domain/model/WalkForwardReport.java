package com.rulesim.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a walk-forward run for one asset: every generated period, the results of the
 * periods that completed, and the periods that were skipped.
 *
 * <p>{@code summary} is null when no period completed.
 */
@Value
@Builder
public class WalkForwardReport {

    String asset;
    List<Period> periods;
    List<PeriodResult> results;
    List<SkippedUnit> skipped;
    WalkForwardSummary summary;

    public boolean hasResults() {
        return !results.isEmpty();
    }
}

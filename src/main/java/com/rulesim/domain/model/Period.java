package com.rulesim.domain.model;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** One walk-forward step: a training window followed by the out-of-sample test window. */
@Value
@Builder
public class Period {

    /** 1-based ordinal. */
    int index;

    LocalDate trainStart;
    LocalDate trainEnd;
    LocalDate testStart;
    LocalDate testEnd;
    int testYear;

    public String label() {
        return "period-" + index + " (" + testStart + " to " + testEnd + ")";
    }
}

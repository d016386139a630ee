package com.rulesim.domain.model;

import com.rulesim.domain.enums.SkipReason;
import lombok.Value;

/** A batch unit (asset or period) excluded from aggregation, with the reason it was excluded. */
@Value
public class SkippedUnit {

    String unitId;
    SkipReason reason;
    String detail;
}

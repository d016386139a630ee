package com.rulesim.domain.model;

import java.time.LocalDateTime;
import lombok.Value;

/** Equity value at one timestamp, with 1.0 meaning initial capital. */
@Value
public class EquityPoint {

    LocalDateTime timestamp;
    double equity;
}

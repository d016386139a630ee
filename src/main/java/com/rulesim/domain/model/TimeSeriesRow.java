package com.rulesim.domain.model;

import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * One period of an asset's feature data.
 *
 * <p>{@code x} is the realized percentage change of this row. A signal generated at
 * index {@code t} is settled against {@code x} of row {@code t + 1}.
 */
@Value
@Builder
public class TimeSeriesRow {

    LocalDateTime timestamp;

    /** Binary attribute values keyed by column name, each 0 or 1. */
    Map<String, Integer> attributes;

    double x;

    public boolean isActive(String attribute) {
        Integer value = attributes.get(attribute);
        return value != null && value == 1;
    }
}

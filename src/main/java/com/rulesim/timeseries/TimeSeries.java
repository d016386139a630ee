package com.rulesim.timeseries;

import com.rulesim.domain.model.TimeSeriesRow;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Chronologically ordered feature rows of one asset with index-based lookback access.
 *
 * <p>Indices are 0-based positions within this series. Slicing with {@link #between} or
 * {@link #from} produces a new series whose indices restart at 0, so lookback never reaches
 * rows outside the slice.
 *
 * <p>Instances are immutable and safe to share across periods and threads.
 */
public final class TimeSeries {

    private final String asset;
    private final List<TimeSeriesRow> rows;
    private final Set<String> attributeNames;

    public TimeSeries(String asset, List<TimeSeriesRow> rows, Set<String> attributeNames) {
        this.asset = asset;
        this.rows = List.copyOf(rows);
        this.attributeNames = Set.copyOf(attributeNames);
    }

    public String getAsset() {
        return asset;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public TimeSeriesRow get(int index) {
        return rows.get(index);
    }

    public List<TimeSeriesRow> getRows() {
        return rows;
    }

    public Set<String> getAttributeNames() {
        return attributeNames;
    }

    public boolean hasAttribute(String attribute) {
        return attributeNames.contains(attribute);
    }

    /** Realized outcome X of the row at {@code index}. */
    public double x(int index) {
        return rows.get(index).getX();
    }

    public LocalDateTime timestamp(int index) {
        return rows.get(index).getTimestamp();
    }

    /**
     * True when {@code index} is in range and the attribute is 1 there. Unknown attributes
     * and negative indices are never active.
     */
    public boolean isActive(String attribute, int index) {
        if (index < 0 || index >= rows.size()) {
            return false;
        }
        return rows.get(index).isActive(attribute);
    }

    /** Rows whose date lies in {@code [from, to]} (both inclusive), re-indexed from 0. */
    public TimeSeries between(LocalDate from, LocalDate to) {
        LocalDateTime lower = from.atStartOfDay();
        LocalDateTime upper = to.plusDays(1).atStartOfDay();
        List<TimeSeriesRow> slice = new ArrayList<>();
        for (TimeSeriesRow row : rows) {
            LocalDateTime ts = row.getTimestamp();
            if (!ts.isBefore(lower) && ts.isBefore(upper)) {
                slice.add(row);
            }
        }
        return new TimeSeries(asset, slice, attributeNames);
    }

    /** Rows dated on or after {@code from}, re-indexed from 0. */
    public TimeSeries from(LocalDate from) {
        LocalDateTime lower = from.atStartOfDay();
        List<TimeSeriesRow> slice = rows.stream()
                .filter(row -> !row.getTimestamp().isBefore(lower))
                .toList();
        return new TimeSeries(asset, slice, attributeNames);
    }

    @Override
    public String toString() {
        if (rows.isEmpty()) {
            return "TimeSeries[" + asset + ": empty]";
        }
        return "TimeSeries[" + asset + ": " + rows.size() + " rows, " + timestamp(0) + " to "
                + timestamp(rows.size() - 1) + "]";
    }
}

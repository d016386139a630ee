package com.rulesim.domain.vo;

import lombok.Value;

/** Half-open index range {@code [start, end)} of a time series to scan for signals. */
@Value
public class ScanWindow {

    int start;
    int end;

    public ScanWindow(int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid scan window [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    public static ScanWindow of(int start, int end) {
        return new ScanWindow(start, end);
    }

    /** The whole series, however long. */
    public static ScanWindow all() {
        return new ScanWindow(0, Integer.MAX_VALUE);
    }
}

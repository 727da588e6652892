package com.vigil.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inclusive millisecond range that delays and intervals are sampled from.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RangeMs {

    private long min;
    private long max;

    public static RangeMs of(long min, long max) {
        return new RangeMs(min, max);
    }

    public boolean isValid() {
        return min >= 0 && max >= min;
    }
}

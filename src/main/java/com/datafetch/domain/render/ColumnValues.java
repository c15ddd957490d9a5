package com.datafetch.domain.render;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Conversion of raw columns into their wire form.
 */
final class ColumnValues {

    private ColumnValues() {
    }

    /**
     * NaN becomes null; every other value is kept as is.
     */
    static List<Object> nullable(double[] values) {
        List<Object> out = new ArrayList<>(values.length);
        for (double value : values) {
            out.add(Double.isNaN(value) ? null : value);
        }
        return out;
    }

    /**
     * Epoch milliseconds to ISO-8601 strings; NaN becomes null.
     */
    static List<Object> times(double[] epochMillis) {
        List<Object> out = new ArrayList<>(epochMillis.length);
        for (double millis : epochMillis) {
            out.add(Double.isNaN(millis) ? null : Instant.ofEpochMilli(Math.round(millis)).toString());
        }
        return out;
    }
}

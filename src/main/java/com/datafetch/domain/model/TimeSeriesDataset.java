package com.datafetch.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Time-indexed, column-oriented dataset.
 *
 * Timestamps are epoch milliseconds in non-decreasing order; every variable holds exactly one
 * value per timestamp, with {@link Double#NaN} marking a missing value. The primary dimension is
 * {@code time} unless the dataset was swapped onto one of its variables for plotting.
 *
 * Arrays handed to or returned from this class are shared, not copied, and must not be mutated.
 */
@Getter
public final class TimeSeriesDataset {

    public static final String TIME = "time";

    private final String name;
    private final long[] timestamps;
    private final Map<String, double[]> variables;
    private final Map<String, String> attributes;
    private final String primaryDimension;
    private final int chunkSize;

    @Builder(toBuilder = true)
    private TimeSeriesDataset(String name,
                              long[] timestamps,
                              @Singular Map<String, double[]> variables,
                              @Singular Map<String, String> attributes,
                              String primaryDimension,
                              int chunkSize) {
        this.name = name == null ? "" : name;
        this.timestamps = timestamps == null ? new long[0] : timestamps;
        for (int i = 1; i < this.timestamps.length; i++) {
            if (this.timestamps[i] < this.timestamps[i - 1]) {
                throw new IllegalArgumentException("Timestamps of dataset '" + this.name
                        + "' are not ordered at index " + i);
            }
        }

        Map<String, double[]> copy = new LinkedHashMap<>();
        variables.forEach((variable, values) -> {
            if (TIME.equals(variable)) {
                throw new IllegalArgumentException("'" + TIME + "' is reserved for the time index");
            }
            if (values.length != this.timestamps.length) {
                throw new IllegalArgumentException("Variable '" + variable + "' of dataset '" + this.name
                        + "' has " + values.length + " values for " + this.timestamps.length + " timestamps");
            }
            copy.put(variable, values);
        });
        this.variables = Collections.unmodifiableMap(copy);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));

        this.primaryDimension = primaryDimension == null ? TIME : primaryDimension;
        if (!hasVariable(this.primaryDimension)) {
            throw new IllegalArgumentException("Unknown primary dimension '" + this.primaryDimension + "'");
        }
        this.chunkSize = chunkSize > 0 ? chunkSize : Math.max(1, this.timestamps.length);
    }

    public int size() {
        return timestamps.length;
    }

    public boolean isEmpty() {
        return timestamps.length == 0;
    }

    public boolean hasVariable(String variable) {
        return TIME.equals(variable) || variables.containsKey(variable);
    }

    /**
     * Values of a variable as doubles; for {@code time} these are epoch milliseconds.
     */
    public double[] values(String variable) {
        if (TIME.equals(variable)) {
            double[] times = new double[timestamps.length];
            for (int i = 0; i < timestamps.length; i++) {
                times[i] = timestamps[i];
            }
            return times;
        }
        double[] values = variables.get(variable);
        if (values == null) {
            throw new IllegalArgumentException("Variable '" + variable + "' not found in dataset '" + name + "'");
        }
        return values;
    }

    /**
     * Samples whose timestamp falls within {@code [start, end]}, both ends inclusive.
     */
    public TimeSeriesDataset slice(Instant start, Instant end) {
        int from = lowerBound(start.toEpochMilli());
        int to = upperBound(end.toEpochMilli());
        if (from == 0 && to == timestamps.length) {
            return this;
        }
        to = Math.max(from, to);

        TimeSeriesDatasetBuilder builder = toBuilder()
                .timestamps(Arrays.copyOfRange(timestamps, from, to))
                .clearVariables()
                .chunkSize(0);
        final int sliceFrom = from;
        final int sliceTo = to;
        variables.forEach((variable, values) ->
                builder.variable(variable, Arrays.copyOfRange(values, sliceFrom, sliceTo)));
        return builder.build();
    }

    /**
     * Keeps only the listed variables. {@code time} is always kept and may be listed.
     */
    public TimeSeriesDataset project(List<String> keep) {
        TimeSeriesDatasetBuilder builder = toBuilder().clearVariables().primaryDimension(TIME);
        for (String variable : keep) {
            if (TIME.equals(variable)) {
                continue;
            }
            double[] values = variables.get(variable);
            if (values == null) {
                throw new IllegalArgumentException("Variable '" + variable + "' not found in dataset '" + name + "'");
            }
            builder.variable(variable, values);
        }
        return builder.build();
    }

    /**
     * Makes {@code variable} the primary dimension; time stays available as a column.
     */
    public TimeSeriesDataset swapDimension(String variable) {
        if (!hasVariable(variable)) {
            throw new IllegalArgumentException("Cannot swap onto unknown variable '" + variable + "'");
        }
        return toBuilder().primaryDimension(variable).build();
    }

    /**
     * Re-partitions the dataset into {@code chunks} equally sized blocks (the last may be shorter).
     */
    public TimeSeriesDataset withUniformChunks(int chunks) {
        int count = Math.max(1, Math.min(chunks, Math.max(1, size())));
        int size = Math.max(1, (int) Math.ceil(size() / (double) count));
        return toBuilder().chunkSize(size).build();
    }

    public int chunkCount() {
        return isEmpty() ? 0 : (size() + chunkSize - 1) / chunkSize;
    }

    public int chunkStart(int chunk) {
        return chunk * chunkSize;
    }

    public int chunkEnd(int chunk) {
        return Math.min(size(), (chunk + 1) * chunkSize);
    }

    /**
     * In-memory footprint of the time index and all variables as 8-byte values.
     */
    public long estimatedBytes() {
        return (long) (variables.size() + 1) * size() * Long.BYTES;
    }

    private int lowerBound(long millis) {
        int low = 0;
        int high = timestamps.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (timestamps[mid] < millis) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private int upperBound(long millis) {
        int low = 0;
        int high = timestamps.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (timestamps[mid] <= millis) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    @Override
    public String toString() {
        return "TimeSeriesDataset(" + name + ", samples=" + size() + ", variables=" + variables.keySet() + ")";
    }
}

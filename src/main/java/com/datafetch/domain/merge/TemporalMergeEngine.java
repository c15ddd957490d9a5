package com.datafetch.domain.merge;

import com.datafetch.domain.model.ComputeContext;
import com.datafetch.domain.model.TimeSeriesDataset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Aligns heterogeneous time series onto one common time grid and merges them.
 *
 * Steps:
 * 1. Build a one-second grid covering [start, end], both ends included
 * 2. Resample every dataset onto the grid by nearest neighbour, then fill remaining gaps
 *    (including the span outside the dataset's own time bounds) from the nearest grid value
 * 3. Merge all variables; dataset attributes are kept only where no two sources disagree
 * 4. Re-chunk the result uniformly for the downstream aggregation
 *
 * A single dataset is passed through untouched. This favours gap-free, uniform output over
 * fidelity at dataset edges, which suits plotting but not scientific export.
 */
@Slf4j
@Component
public class TemporalMergeEngine {

    static final long GRID_STEP_MILLIS = 1000L;

    public TimeSeriesDataset merge(Map<String, TimeSeriesDataset> datasets,
                                   Instant start,
                                   Instant end,
                                   ComputeContext context) {
        if (datasets.isEmpty()) {
            throw new IllegalArgumentException("Nothing to merge");
        }
        if (datasets.size() == 1) {
            return datasets.values().iterator().next();
        }

        long[] grid = commonGrid(start, end);
        log.debug("Merging {} datasets onto a grid of {} samples", datasets.size(), grid.length);

        List<CompletableFuture<TimeSeriesDataset>> resampling = new ArrayList<>();
        for (TimeSeriesDataset dataset : datasets.values()) {
            resampling.add(CompletableFuture.supplyAsync(() -> resample(dataset, grid), context.getExecutor()));
        }

        List<TimeSeriesDataset> aligned = new ArrayList<>();
        for (CompletableFuture<TimeSeriesDataset> future : resampling) {
            try {
                aligned.add(future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException) {
                    throw (RuntimeException) e.getCause();
                }
                throw e;
            }
        }

        return combine(String.join(",", datasets.keySet()), grid, aligned)
                .withUniformChunks(context.getParallelism());
    }

    /**
     * Epoch-millisecond timestamps at the whole seconds inside {@code [start, end]}.
     */
    static long[] commonGrid(Instant start, Instant end) {
        long first = start.getNano() == 0 ? start.getEpochSecond() : start.getEpochSecond() + 1;
        long last = end.getEpochSecond();
        if (last < first) {
            throw new IllegalArgumentException("Empty time range " + start + " - " + end);
        }
        long count = last - first + 1;
        if (count > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Time range " + start + " - " + end + " is too long to align");
        }
        long[] grid = new long[(int) count];
        for (int i = 0; i < grid.length; i++) {
            grid[i] = (first + i) * GRID_STEP_MILLIS;
        }
        return grid;
    }

    static TimeSeriesDataset resample(TimeSeriesDataset dataset, long[] grid) {
        TimeSeriesDataset.TimeSeriesDatasetBuilder builder = dataset.toBuilder()
                .timestamps(grid)
                .clearVariables()
                .primaryDimension(TimeSeriesDataset.TIME)
                .chunkSize(0);

        int[] nearest = nearestIndices(dataset.getTimestamps(), grid);
        dataset.getVariables().forEach((variable, values) -> {
            double[] resampled = new double[grid.length];
            for (int i = 0; i < grid.length; i++) {
                resampled[i] = nearest[i] < 0 ? Double.NaN : values[nearest[i]];
            }
            fillGaps(resampled);
            builder.variable(variable, resampled);
        });
        return builder.build();
    }

    /**
     * For each grid point, the index of the closest native sample, or -1 when the grid point lies
     * outside the native time bounds. Ties go to the earlier sample.
     */
    static int[] nearestIndices(long[] samples, long[] grid) {
        int[] nearest = new int[grid.length];
        if (samples.length == 0) {
            Arrays.fill(nearest, -1);
            return nearest;
        }
        long first = samples[0];
        long last = samples[samples.length - 1];
        int j = 0;
        for (int i = 0; i < grid.length; i++) {
            long t = grid[i];
            if (t < first || t > last) {
                nearest[i] = -1;
                continue;
            }
            while (j + 1 < samples.length && samples[j + 1] <= t) {
                j++;
            }
            if (j + 1 < samples.length && samples[j + 1] - t < t - samples[j]) {
                nearest[i] = j + 1;
            } else {
                nearest[i] = j;
            }
        }
        return nearest;
    }

    /**
     * Replaces every NaN with the closest non-NaN value by position, extending past both ends.
     * Ties go to the earlier value. An all-NaN array is left as is.
     */
    static void fillGaps(double[] values) {
        int n = values.length;
        int[] previous = new int[n];
        int last = -1;
        for (int i = 0; i < n; i++) {
            if (!Double.isNaN(values[i])) {
                last = i;
            }
            previous[i] = last;
        }
        int next = -1;
        for (int i = n - 1; i >= 0; i--) {
            if (!Double.isNaN(values[i])) {
                next = i;
                continue;
            }
            int before = previous[i];
            if (before < 0 && next < 0) {
                continue;
            }
            if (next < 0 || (before >= 0 && i - before <= next - i)) {
                values[i] = values[before];
            } else {
                values[i] = values[next];
            }
        }
    }

    static TimeSeriesDataset combine(String name, long[] grid, List<TimeSeriesDataset> aligned) {
        Map<String, double[]> variables = new LinkedHashMap<>();
        Map<String, String> attributes = new LinkedHashMap<>();
        Set<String> conflicting = new HashSet<>();

        for (TimeSeriesDataset dataset : aligned) {
            dataset.getVariables().forEach((variable, values) -> {
                double[] existing = variables.get(variable);
                if (existing == null) {
                    variables.put(variable, values);
                    return;
                }
                // same variable in several sources: first one wins, later ones fill its gaps
                double[] combined = existing.clone();
                for (int i = 0; i < combined.length; i++) {
                    if (Double.isNaN(combined[i])) {
                        combined[i] = values[i];
                    }
                }
                variables.put(variable, combined);
            });

            dataset.getAttributes().forEach((key, value) -> {
                if (conflicting.contains(key)) {
                    return;
                }
                String existing = attributes.putIfAbsent(key, value);
                if (existing != null && !existing.equals(value)) {
                    attributes.remove(key);
                    conflicting.add(key);
                    log.debug("Dropping conflicting attribute '{}' while merging", key);
                }
            });
        }

        return TimeSeriesDataset.builder()
                .name(name)
                .timestamps(grid)
                .variables(variables)
                .attributes(attributes)
                .build();
    }
}

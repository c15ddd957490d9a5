package com.datafetch.domain.render;

import com.datafetch.domain.model.ComputeContext;
import com.datafetch.domain.model.TimeSeriesDataset;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Mean-of-y aggregation over a width x height raster spanning the data's (x, y) extent.
 *
 * Every chunk of the dataset is binned independently on the compute executor and the partial
 * sums are combined afterwards. Bins receiving no sample have a NaN mean.
 */
class BinnedAggregator {

    private final int width;
    private final int height;

    BinnedAggregator(int width, int height) {
        this.width = width;
        this.height = height;
    }

    Raster aggregate(TimeSeriesDataset dataset, String xVariable, String yVariable, ComputeContext context) {
        double[] xs = dataset.values(xVariable);
        double[] ys = dataset.values(yVariable);

        Extent xExtent = new Extent();
        Extent yExtent = new Extent();
        for (int i = 0; i < xs.length; i++) {
            if (Double.isFinite(xs[i]) && Double.isFinite(ys[i])) {
                xExtent.include(xs[i]);
                yExtent.include(ys[i]);
            }
        }
        xExtent.widenIfFlat();
        yExtent.widenIfFlat();

        List<CompletableFuture<Partial>> partials = new ArrayList<>();
        for (int chunk = 0; chunk < dataset.chunkCount(); chunk++) {
            int from = dataset.chunkStart(chunk);
            int to = dataset.chunkEnd(chunk);
            partials.add(CompletableFuture.supplyAsync(
                    () -> bin(xs, ys, from, to, xExtent, yExtent), context.getExecutor()));
        }

        Partial total = new Partial(width * height);
        for (CompletableFuture<Partial> partial : partials) {
            total.add(partial.join());
        }
        return toRaster(total, xExtent, yExtent);
    }

    private Partial bin(double[] xs, double[] ys, int from, int to, Extent xExtent, Extent yExtent) {
        Partial partial = new Partial(width * height);
        if (xExtent.isEmpty()) {
            return partial;
        }
        for (int i = from; i < to; i++) {
            double x = xs[i];
            double y = ys[i];
            if (!Double.isFinite(x) || !Double.isFinite(y)) {
                continue;
            }
            int column = xExtent.bin(x, width);
            int row = yExtent.bin(y, height);
            int cell = row * width + column;
            partial.sums[cell] += y;
            partial.counts[cell]++;
        }
        return partial;
    }

    private Raster toRaster(Partial total, Extent xExtent, Extent yExtent) {
        int cells = width * height;
        double[] xCenters = new double[cells];
        double[] yCenters = new double[cells];
        double[] means = new double[cells];

        for (int row = 0; row < height; row++) {
            for (int column = 0; column < width; column++) {
                int cell = row * width + column;
                xCenters[cell] = xExtent.center(column, width);
                yCenters[cell] = yExtent.center(row, height);
                means[cell] = total.counts[cell] == 0 ? Double.NaN : total.sums[cell] / total.counts[cell];
            }
        }
        return new Raster(xCenters, yCenters, means);
    }

    static class Raster {

        final double[] xCenters;
        final double[] yCenters;
        final double[] means;

        Raster(double[] xCenters, double[] yCenters, double[] means) {
            this.xCenters = xCenters;
            this.yCenters = yCenters;
            this.means = means;
        }
    }

    private static class Partial {

        final double[] sums;
        final long[] counts;

        Partial(int cells) {
            sums = new double[cells];
            counts = new long[cells];
        }

        void add(Partial other) {
            for (int i = 0; i < sums.length; i++) {
                sums[i] += other.sums[i];
                counts[i] += other.counts[i];
            }
        }
    }

    private static class Extent {

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;

        void include(double value) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }

        boolean isEmpty() {
            return !(min <= max);
        }

        void widenIfFlat() {
            if (isEmpty()) {
                min = Double.NaN;
                max = Double.NaN;
                return;
            }
            if (min == max) {
                min -= 0.5;
                max += 0.5;
            }
        }

        int bin(double value, int bins) {
            int bin = (int) ((value - min) / (max - min) * bins);
            return Math.min(bins - 1, Math.max(0, bin));
        }

        double center(int bin, int bins) {
            return min + (bin + 0.5) * (max - min) / bins;
        }
    }
}

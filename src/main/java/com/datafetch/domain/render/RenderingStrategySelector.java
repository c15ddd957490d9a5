package com.datafetch.domain.render;

import com.datafetch.domain.model.AxisMapping;
import com.datafetch.domain.model.ComputeContext;
import com.datafetch.domain.model.TimeSeriesDataset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a merged dataset into plot columns.
 *
 * Decision:
 * - color mapped: point-wise scatter over (x, y, color)
 * - more samples than the shade threshold: mean of y binned over an (x, y) raster, with the
 *   aggregate in a synthetic column named "{x}_{y} {y}"
 * - otherwise: point-wise scatter over (x, y)
 *
 * When x is not time the dataset is swapped onto the x variable first. A mapped z is carried
 * along by the point-wise strategies; shading has no per-point z, so none is emitted.
 */
@Slf4j
@Component
public class RenderingStrategySelector {

    public static RenderStrategy select(AxisMapping axis, long sampleCount, int shadeThreshold) {
        if (axis.hasColor()) {
            return RenderStrategy.COLORED_SCATTER;
        }
        if (sampleCount > shadeThreshold) {
            return RenderStrategy.SHADED;
        }
        return RenderStrategy.SCATTER;
    }

    static String shadedColumnName(AxisMapping axis) {
        return axis.getX() + "_" + axis.getY() + " " + axis.getY();
    }

    public RenderResult render(TimeSeriesDataset merged,
                               AxisMapping axis,
                               RenderOptions options,
                               ComputeContext context) {
        TimeSeriesDataset frame = axis.isTimeOnX() ? merged : merged.swapDimension(axis.getX());
        RenderStrategy strategy = select(axis, frame.size(), options.getShadeThreshold());
        log.debug("Rendering {} samples of {} as {}", frame.size(), frame.getName(), strategy);

        return switch (strategy) {
            case COLORED_SCATTER -> RenderResult.builder()
                    .strategy(strategy)
                    .columns(pointColumns(frame, axis.getX(), axis.getY(), axis.getColor(), axis.getZ()))
                    .shaded(false)
                    .colorColumn(axis.getColor())
                    .build();
            case SHADED -> shade(frame, axis, options, context);
            case SCATTER -> RenderResult.builder()
                    .strategy(strategy)
                    .columns(pointColumns(frame, axis.getX(), axis.getY(), axis.getZ()))
                    .shaded(false)
                    .build();
        };
    }

    private RenderResult shade(TimeSeriesDataset frame,
                               AxisMapping axis,
                               RenderOptions options,
                               ComputeContext context) {
        BinnedAggregator aggregator = new BinnedAggregator(options.getWidth(), options.getHeight());
        BinnedAggregator.Raster raster = aggregator.aggregate(frame, axis.getX(), axis.getY(), context);

        String aggregateColumn = shadedColumnName(axis);
        Map<String, List<Object>> columns = new LinkedHashMap<>();
        columns.put(axis.getX(), column(axis.getX(), raster.xCenters));
        columns.put(axis.getY(), column(axis.getY(), raster.yCenters));
        columns.put(aggregateColumn, ColumnValues.nullable(raster.means));

        return RenderResult.builder()
                .strategy(RenderStrategy.SHADED)
                .columns(columns)
                .shaded(true)
                .colorColumn(aggregateColumn)
                .build();
    }

    private static Map<String, List<Object>> pointColumns(TimeSeriesDataset frame, String... names) {
        Set<String> wanted = new LinkedHashSet<>();
        for (String name : names) {
            if (name != null && !name.isBlank()) {
                wanted.add(name);
            }
        }
        Map<String, List<Object>> columns = new LinkedHashMap<>();
        for (String name : wanted) {
            columns.put(name, column(name, frame.values(name)));
        }
        return columns;
    }

    private static List<Object> column(String name, double[] values) {
        return TimeSeriesDataset.TIME.equals(name) ? ColumnValues.times(values) : ColumnValues.nullable(values);
    }
}

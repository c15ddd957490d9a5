package com.datafetch.domain.render;

/**
 * How a merged dataset is turned into plot columns.
 */
public enum RenderStrategy {

    /**
     * Point-wise (x, y, color), no aggregation.
     */
    COLORED_SCATTER,

    /**
     * Mean of y binned over an (x, y) raster, surfaced as a synthetic third column.
     */
    SHADED,

    /**
     * Point-wise (x, y).
     */
    SCATTER
}

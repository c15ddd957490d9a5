package com.datafetch.domain.render;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Plot columns keyed by name, restricted to the mapped axes plus the synthetic aggregate column
 * when shading was used. Numeric gaps are nulls; time values are ISO-8601 strings.
 */
@Value
@Builder
public class RenderResult {

    RenderStrategy strategy;
    Map<String, List<Object>> columns;
    boolean shaded;

    /**
     * Column carrying the color dimension: the mapped color variable, the synthetic aggregate
     * column when shaded, otherwise null.
     */
    String colorColumn;
}

package com.datafetch.domain.render;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RenderOptions {

    /**
     * Sample count above which uncolored plots are shaded.
     */
    int shadeThreshold;

    int width;
    int height;
}

package com.datafetch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Plot-ready result of a succeeded job. Numeric gaps are carried as nulls.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FetchResult {

    private List<Object> x;
    private List<Object> y;
    private List<Object> z;

    /**
     * Number of time samples in the merged dataset.
     */
    private long count;

    private boolean shaded;
}

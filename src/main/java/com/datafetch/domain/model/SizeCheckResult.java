package com.datafetch.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Per-dataset and total byte-size estimate over the requested variable projection.
 */
@Value
@Builder
public class SizeCheckResult {

    Map<String, Long> dataSizes;
    long totalSize;
}

package com.datafetch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SizeCheckResponse {

    private String status;

    /**
     * Estimated bytes per requested dataset.
     */
    private Map<String, Long> dataSizes;

    private long totalSize;
    private String msg;
}

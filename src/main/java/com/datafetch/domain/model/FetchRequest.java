package com.datafetch.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Request for a merged, plot-ready view of one or more datasets over a time window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FetchRequest {

    @NotEmpty
    private List<@NotBlank String> refs;

    @NotNull
    @Valid
    private AxisMapping axis;

    @NotNull
    private Instant startDt;

    @NotNull
    private Instant endDt;

    /**
     * Requested dataset ids in arrival order with duplicates removed.
     */
    public List<String> datasetIds() {
        return refs == null ? List.of() : new ArrayList<>(new LinkedHashSet<>(refs));
    }

    @JsonIgnore
    @AssertTrue(message = "startDt must be before endDt")
    public boolean isTimeRangeValid() {
        return startDt == null || endDt == null || startDt.isBefore(endDt);
    }
}

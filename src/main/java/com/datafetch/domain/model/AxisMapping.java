package com.datafetch.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Plot-axis mapping of a request. Each axis names a dataset variable; z and color are optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AxisMapping {

    @NotBlank
    private String x;

    @NotBlank
    private String y;

    private String z;

    private String color;

    /**
     * Variables that must be read from every dataset: the non-empty axes plus time,
     * which is always needed as the alignment key.
     */
    public List<String> variableProjection() {
        Set<String> variables = new LinkedHashSet<>();
        for (String axis : new String[] {x, y, z, color}) {
            if (StringUtils.isNotBlank(axis)) {
                variables.add(axis);
            }
        }
        variables.add(TimeSeriesDataset.TIME);
        return new ArrayList<>(variables);
    }

    public boolean hasZ() {
        return StringUtils.isNotBlank(z);
    }

    public boolean hasColor() {
        return StringUtils.isNotBlank(color);
    }

    @JsonIgnore
    public boolean isTimeOnX() {
        return TimeSeriesDataset.TIME.equals(x);
    }
}

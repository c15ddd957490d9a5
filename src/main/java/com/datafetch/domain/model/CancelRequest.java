package com.datafetch.domain.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CancelRequest {

    /**
     * One of {@link CancelSignal}; anything else is rejected.
     */
    @NotBlank
    private String signal;
}

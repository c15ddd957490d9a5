package com.datafetch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CancelResponse {

    private String status;
    private CancelSignal signal;
    private String msg;
}

package com.datafetch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private String status;
    private String msg;

    public static ErrorResponse failed(String msg) {
        return new ErrorResponse("failed", msg);
    }
}

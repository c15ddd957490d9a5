package com.datafetch.infrastructure.dataset;

public class DatasetResolutionException extends RuntimeException {

    public DatasetResolutionException(String message) {
        super(message);
    }

    public DatasetResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}

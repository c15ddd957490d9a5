package com.datafetch.domain.model;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Termination signals accepted by the cancellation endpoint.
 */
public enum CancelSignal {
    SIGTERM,
    SIGKILL,
    SIGUSR1;

    public static CancelSignal parse(String value) {
        for (CancelSignal signal : values()) {
            if (signal.name().equals(value)) {
                return signal;
            }
        }
        throw new IllegalArgumentException(value + " is not a valid value. Expected one of: "
                + Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", ")));
    }
}

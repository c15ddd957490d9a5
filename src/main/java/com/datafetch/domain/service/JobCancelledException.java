package com.datafetch.domain.service;

import com.datafetch.domain.model.CancelSignal;

/**
 * Raised at a checkpoint once a cancellation signal for the running job has been observed.
 */
public class JobCancelledException extends RuntimeException {

    private final CancelSignal signal;

    public JobCancelledException(CancelSignal signal) {
        super("Job cancelled by " + signal);
        this.signal = signal;
    }

    public CancelSignal getSignal() {
        return signal;
    }
}

package com.datafetch.domain.pool;

import lombok.Value;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Container image coordinates of a provisioned worker.
 */
@Value
public class WorkerImage {

    static final WorkerImage DEFAULT = new WorkerImage("datafetch", "fetch-worker", "1.0.0");

    private static final Pattern REFERENCE = Pattern.compile("(.+)/(.+):(.+)");

    String repository;
    String name;
    String tag;

    /**
     * Parses {@code repository/name:tag}; anything else yields the default image.
     */
    public static WorkerImage parse(String reference) {
        if (reference == null) {
            return DEFAULT;
        }
        Matcher matcher = REFERENCE.matcher(reference.trim());
        if (!matcher.matches()) {
            return DEFAULT;
        }
        return new WorkerImage(matcher.group(1), matcher.group(2), matcher.group(3));
    }

    public String toReference() {
        return repository + "/" + name + ":" + tag;
    }
}

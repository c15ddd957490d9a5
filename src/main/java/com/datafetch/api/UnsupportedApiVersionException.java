package com.datafetch.api;

public class UnsupportedApiVersionException extends RuntimeException {

    public UnsupportedApiVersionException(String version, String current, String packed) {
        super("API version " + version + " is not supported. Use " + current + " or " + packed + ".");
    }
}

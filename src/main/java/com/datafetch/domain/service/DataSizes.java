package com.datafetch.domain.service;

import java.util.Locale;

/**
 * Human-readable byte sizes with binary units.
 */
public final class DataSizes {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private DataSizes() {
    }

    public static String format(long bytes) {
        double value = Math.max(0, bytes);
        int unit = 0;
        while (value >= 1024 && unit < UNITS.length - 1) {
            value /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", value, UNITS[unit]);
    }
}

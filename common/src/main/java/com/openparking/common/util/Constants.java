package com.openparking.common.util;

/**
 * Common constants used across modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String API_PREFIX = "/api/v1";
    public static final String BEARER_PREFIX = "Bearer ";

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PAGE_SIZE = 10;
    public static final int MAX_PAGE_SIZE = 100;
}

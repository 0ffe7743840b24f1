package com.openguide.common.util;

/**
 * Constants shared by the trip platform services.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String GUIDE_ID_HEADER = "X-Guide-Id";

    public static final String TOPIC_TRIP_NOTIFICATIONS = "trip-notifications";

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;
}

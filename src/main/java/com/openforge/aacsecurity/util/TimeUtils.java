package com.openforge.aacsecurity.util;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Date;

/**
 * The one place where timestamps are normalised and compared.
 *
 * <p>Lockout and token code only ever compares UTC {@link Instant}s. Values coming
 * from libraries in other shapes ({@link Date} from jjwt, epoch seconds from a raw
 * payload) go through here first.
 */
public final class TimeUtils {

    private static final DateTimeFormatter UTC_DISPLAY =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private TimeUtils() {}

    public static Instant toUtc(Date date) {
        return date == null ? null : date.toInstant();
    }

    public static Instant fromEpochSeconds(Number seconds) {
        return seconds == null ? null : Instant.ofEpochSecond(seconds.longValue());
    }

    /**
     * {@code true} if {@code moment} is set and strictly after {@code now}.
     * A lock that ends exactly now is already over.
     */
    public static boolean isInFuture(Instant moment, Instant now) {
        return moment != null && moment.isAfter(now);
    }

    /** Human-readable UTC timestamp for messages, e.g. {@code 2025-11-30 14:05:00 UTC}. */
    public static String formatUtc(Instant moment) {
        return moment == null ? "N/A" : UTC_DISPLAY.format(moment);
    }
}

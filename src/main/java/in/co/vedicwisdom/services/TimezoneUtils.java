package in.co.vedicwisdom.services;

import net.iakovlev.timeshape.TimeZoneEngine;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * UTC offset lookup for coordinates whose offset is not configured. Uses Timeshape zone boundaries and
 * evaluates the zone rules on the requested date, so daylight saving time is honoured.
 */
public class TimezoneUtils {

    // Building the engine loads all zone polygons; do it once
    private static volatile TimeZoneEngine timeZoneEngine;
    private static final Object lock = new Object();

    private TimezoneUtils() {
    }

    private static TimeZoneEngine getTimeZoneEngine() {
        if (timeZoneEngine == null) {
            synchronized (lock) {
                if (timeZoneEngine == null) {
                    long start = LoggingService.logOperationStart("timezone_engine_init", LoggingService.data());
                    try {
                        timeZoneEngine = TimeZoneEngine.initialize(true);
                    } catch (RuntimeException e) {
                        LoggingService.warn("timezone_engine_accelerated_init_failed",
                                LoggingService.data("error", String.valueOf(e.getMessage())));
                        timeZoneEngine = TimeZoneEngine.initialize(false);
                    }
                    LoggingService.logOperationEnd("timezone_engine_init", start, LoggingService.data());
                }
            }
        }
        return timeZoneEngine;
    }

    /**
     * Offset in hours at local noon of {@code date}. Falls back to longitude / 15 rounded to the half hour
     * when no zone covers the point (open ocean) or the lookup fails.
     */
    public static double getTimezoneOffset(double latitude, double longitude, LocalDate date) {
        return getZoneOffset(latitude, longitude, date).getTotalSeconds() / 3600.0;
    }

    public static ZoneOffset getZoneOffset(double latitude, double longitude, LocalDate date) {
        Optional<ZoneId> zoneId = getZoneId(latitude, longitude);
        if (zoneId.isPresent()) {
            return zoneId.get().getRules().getOffset(date.atTime(LocalTime.NOON));
        }
        LoggingService.debug("timezone_not_found", LoggingService.data("latitude", latitude, "longitude", longitude));
        return getFallbackZoneOffset(longitude);
    }

    public static Optional<ZoneId> getZoneId(double latitude, double longitude) {
        try {
            return getTimeZoneEngine().query(latitude, longitude);
        } catch (RuntimeException e) {
            LoggingService.error("timezone_get_zoneid_error", e);
            return Optional.empty();
        }
    }

    static double getFallbackTimezoneOffset(double longitude) {
        return Math.round(longitude / 15.0 * 2.0) / 2.0;
    }

    private static ZoneOffset getFallbackZoneOffset(double longitude) {
        return ZoneOffset.ofTotalSeconds((int) Math.round(getFallbackTimezoneOffset(longitude) * 3600.0));
    }
}

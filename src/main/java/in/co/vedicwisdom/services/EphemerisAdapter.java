package in.co.vedicwisdom.services;

import in.co.vedicwisdom.pojos.CelestialPosition;
import in.co.vedicwisdom.pojos.GeoLocation;
import in.co.vedicwisdom.pojos.SunriseSunset;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Objects;

/**
 * Guards the ephemeris provider: longitudes leave here normalized to [0, 360), and anything the provider
 * cannot deliver becomes a {@link ComputationException}. A wrong position would silently produce a wrong
 * calendar, so there is never a default value.
 */
public class EphemerisAdapter {

    // Provider values beyond two turns are treated as garbage rather than normalized
    private static final double MAX_ABS_LONGITUDE = 720.0;

    private final EphemerisProvider provider;

    public EphemerisAdapter(EphemerisProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    public CelestialPosition positions(ZonedDateTime moment, GeoLocation location) throws ComputationException {
        Objects.requireNonNull(moment, "moment");
        Objects.requireNonNull(location, "location");

        CelestialPosition reading;
        try {
            reading = provider.reading(moment.toInstant(), location.getLatitude(), location.getLongitude());
        } catch (ComputationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComputationException(ErrorCode.EPHEMERIS_UNAVAILABLE,
                    "Ephemeris call interrupted at " + moment, e);
        } catch (Exception e) {
            throw new ComputationException(ErrorCode.EPHEMERIS_UNAVAILABLE,
                    "Ephemeris provider failed at " + moment + ": " + e.getMessage(), e);
        }
        if (reading == null) {
            throw new ComputationException(ErrorCode.EPHEMERIS_UNAVAILABLE, "Ephemeris provider returned no position at " + moment);
        }

        double sun = checkedLongitude("sun", reading.getSunLongitude(), moment);
        double moon = checkedLongitude("moon", reading.getMoonLongitude(), moment);
        LoggingService.debug("ephemeris_positions", Map.of(
                "moment", moment.toString(), "sunLongitude", sun, "moonLongitude", moon));
        return new CelestialPosition(moment.toInstant(), sun, moon, reading.getObliquity());
    }

    public SunriseSunset sunriseSunset(LocalDate date, GeoLocation location) throws ComputationException {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(location, "location");

        SunriseSunset result;
        try {
            result = provider.sunriseSunset(date, location.getLatitude(), location.getLongitude(), location.getZoneOffset());
        } catch (ComputationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComputationException(ErrorCode.EPHEMERIS_UNAVAILABLE, "Sunrise lookup interrupted for " + date, e);
        } catch (Exception e) {
            throw new ComputationException(ErrorCode.EPHEMERIS_UNAVAILABLE,
                    "Sunrise lookup failed for " + date + ": " + e.getMessage(), e);
        }
        if (result == null || result.getSunrise() == null || result.getSunset() == null) {
            throw new ComputationException(ErrorCode.EPHEMERIS_UNAVAILABLE, "Ephemeris provider returned no sunrise for " + date);
        }
        if (!result.getSunrise().isBefore(result.getSunset())) {
            throw new ComputationException(ErrorCode.EPHEMERIS_UNAVAILABLE,
                    "Sunrise " + result.getSunrise() + " is not before sunset " + result.getSunset());
        }
        LocalDate sunriseDate = result.getSunrise().withZoneSameInstant(location.getZoneOffset()).toLocalDate();
        if (Math.abs(ChronoUnit.DAYS.between(date, sunriseDate)) > 1) {
            throw new ComputationException(ErrorCode.EPHEMERIS_UNAVAILABLE,
                    "Sunrise " + result.getSunrise() + " does not belong to " + date);
        }
        return new SunriseSunset(
                result.getSunrise().withZoneSameInstant(location.getZoneOffset()),
                result.getSunset().withZoneSameInstant(location.getZoneOffset()));
    }

    private static double checkedLongitude(String body, double value, ZonedDateTime moment) throws ComputationException {
        if (!Double.isFinite(value) || Math.abs(value) > MAX_ABS_LONGITUDE) {
            throw new ComputationException(ErrorCode.EPHEMERIS_UNAVAILABLE,
                    "Ephemeris returned invalid " + body + " longitude " + value + " at " + moment);
        }
        return CalendarMath.normalize(value);
    }
}

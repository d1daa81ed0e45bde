package in.co.vedicwisdom.services;

import in.co.vedicwisdom.pojos.CelestialPosition;
import in.co.vedicwisdom.pojos.SunriseSunset;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Source of Sun/Moon positions and sunrise/sunset times. Implementations may return longitudes outside
 * [0, 360); {@link EphemerisAdapter} normalizes and validates them.
 */
public interface EphemerisProvider {

    CelestialPosition reading(Instant instant, double latitude, double longitude) throws Exception;

    /**
     * Sunrise and sunset of the local calendar date {@code date} at the given offset. Throws
     * {@link ComputationException} with {@link ErrorCode#INVALID_DATE} when the sun does not rise or set.
     */
    SunriseSunset sunriseSunset(LocalDate date, double latitude, double longitude, ZoneOffset offset) throws Exception;
}

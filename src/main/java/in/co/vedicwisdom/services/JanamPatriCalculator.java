package in.co.vedicwisdom.services;

import in.co.vedicwisdom.pojos.CalendarIndices;
import in.co.vedicwisdom.pojos.CelestialPosition;
import in.co.vedicwisdom.pojos.GeoLocation;
import in.co.vedicwisdom.pojos.JanamPatri;
import in.co.vedicwisdom.pojos.JanamPatriOverride;

import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Objects;

/**
 * Janma nakshatra and rashi at the exact birth moment (not the sunrise of the birth date).
 */
public class JanamPatriCalculator {

    private final EphemerisAdapter ephemeris;

    public JanamPatriCalculator(EphemerisAdapter ephemeris) {
        this.ephemeris = Objects.requireNonNull(ephemeris, "ephemeris");
    }

    public JanamPatri compute(ZonedDateTime birthMoment, GeoLocation birthLocation) throws ComputationException {
        return compute(birthMoment, birthLocation, null);
    }

    /**
     * A non-null {@code override} is returned as-is and the ephemeris is not consulted.
     */
    public JanamPatri compute(ZonedDateTime birthMoment, GeoLocation birthLocation, JanamPatriOverride override)
            throws ComputationException {
        Objects.requireNonNull(birthMoment, "birthMoment");
        Objects.requireNonNull(birthLocation, "birthLocation");

        if (override != null) {
            LoggingService.info("janam_patri_override_used", Map.of(
                    "nakshatra", CalendarNames.nakshatraName(override.getNakshatra()),
                    "rashi", CalendarNames.rashiName(override.getRashi())));
            return new JanamPatri(birthMoment, birthLocation, override.getNakshatra(), override.getRashi(), true);
        }

        CelestialPosition position = ephemeris.positions(birthMoment, birthLocation);
        CalendarIndices indices = CalendarMath.toCalendarIndices(position.getSunLongitude(), position.getMoonLongitude());
        return new JanamPatri(birthMoment, birthLocation, indices.getNakshatra(), indices.getRashi(), false);
    }
}

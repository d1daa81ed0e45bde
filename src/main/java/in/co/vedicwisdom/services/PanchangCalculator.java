package in.co.vedicwisdom.services;

import in.co.vedicwisdom.pojos.CalendarIndices;
import in.co.vedicwisdom.pojos.CelestialPosition;
import in.co.vedicwisdom.pojos.GeoLocation;
import in.co.vedicwisdom.pojos.PanchangDay;
import in.co.vedicwisdom.pojos.SunriseSunset;

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Computes the panchang of a local date. The Hindu day starts at sunrise, so every limb is read at the
 * sunrise moment: a tithi that is current at sunrise owns the whole day.
 */
public class PanchangCalculator {

    private final EphemerisAdapter ephemeris;

    public PanchangCalculator(EphemerisAdapter ephemeris) {
        this.ephemeris = Objects.requireNonNull(ephemeris, "ephemeris");
    }

    public PanchangDay compute(LocalDate date, GeoLocation location) throws ComputationException {
        SunriseSunset sun = ephemeris.sunriseSunset(date, location);
        CelestialPosition position = ephemeris.positions(sun.getSunrise(), location);
        CalendarIndices indices = CalendarMath.toCalendarIndices(position.getSunLongitude(), position.getMoonLongitude());

        PanchangDay day = new PanchangDay(date, location, sun.getSunrise(), sun.getSunset(), indices);
        LoggingService.debug("panchang_computed", Map.of(
                "date", date.toString(),
                "tithi", CalendarNames.tithiName(indices.getTithi()),
                "paksha", indices.getPaksha().getDisplayName(),
                "nakshatra", CalendarNames.nakshatraName(indices.getNakshatra())));
        return day;
    }

    /**
     * The tithi that begins after {@code day}'s sunrise and ends before {@code next}'s sunrise, i.e. a tithi
     * no sunrise belongs to. Empty when the sunrise tithi advanced by one (normal) or zero (repeated tithi).
     */
    public static OptionalInt skippedTithi(PanchangDay day, PanchangDay next) {
        int advance = Math.floorMod(next.getTithi() - day.getTithi(), 30);
        if (advance == 2) {
            return OptionalInt.of(day.getTithi() % 30 + 1);
        }
        return OptionalInt.empty();
    }
}

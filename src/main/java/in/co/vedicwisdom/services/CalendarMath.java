package in.co.vedicwisdom.services;

import in.co.vedicwisdom.pojos.CalendarIndices;

/**
 * Pure arithmetic from Sun/Moon longitudes to the calendar indices. Shared by the panchang and
 * janam patri calculators so both derive tithi, nakshatra and rashi the same way.
 */
public final class CalendarMath {

    public static final double TITHI_SPAN = 12.0;
    public static final double KARANA_SPAN = 6.0;
    public static final double NAKSHATRA_SPAN = 360.0 / 27.0;
    public static final double RASHI_SPAN = 30.0;

    private CalendarMath() {}

    public static CalendarIndices toCalendarIndices(double sunLongitude, double moonLongitude) {
        double sun = normalize(sunLongitude);
        double moon = normalize(moonLongitude);
        double elongation = normalize(moon - sun);
        return new CalendarIndices(
                tithi(elongation),
                nakshatra(moon),
                yoga(sun, moon),
                karana(elongation),
                rashi(moon));
    }

    public static double normalize(double degrees) {
        double value = degrees % 360.0;
        if (value < 0) {
            value += 360.0;
        }
        // -1e-15 % 360 + 360 rounds to 360.0
        return value >= 360.0 ? 0.0 : value;
    }

    static int tithi(double elongation) {
        return bucket(elongation, TITHI_SPAN, 30);
    }

    static int nakshatra(double moon) {
        return bucket(moon, NAKSHATRA_SPAN, 27);
    }

    static int yoga(double sun, double moon) {
        return bucket(normalize(sun + moon), NAKSHATRA_SPAN, 27);
    }

    static int rashi(double moon) {
        return bucket(moon, RASHI_SPAN, 12);
    }

    /**
     * Karana index 1-11. The sixty half-tithis of a lunar month map onto the seven movable karanas
     * (Bava..Vishti) except the first half-tithi (Kimstughna) and the last three (Shakuni, Chatushpada, Nagava).
     */
    static int karana(double elongation) {
        int halfTithi = bucket(elongation, KARANA_SPAN, 60) - 1;
        switch (halfTithi) {
            case 0: return 11;
            case 57: return 8;
            case 58: return 9;
            case 59: return 10;
            default: return ((halfTithi - 1) % 7) + 1;
        }
    }

    private static int bucket(double value, double span, int count) {
        int index = (int) Math.floor(value / span) + 1;
        return Math.min(Math.max(index, 1), count);
    }
}

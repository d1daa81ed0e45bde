package in.co.vedicwisdom.services;

import in.co.vedicwisdom.pojos.CelestialPosition;
import in.co.vedicwisdom.pojos.SunriseSunset;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Low-precision analytic ephemeris: Meeus' solar theory (ch. 25), the main periodic terms of the lunar
 * theory (ch. 47) and an hour-angle iteration for sunrise/sunset. Good to a few arc-minutes for the Moon,
 * which is enough to place tithi and nakshatra boundaries to within minutes.
 */
public class AnalyticEphemerisProvider implements EphemerisProvider {

    public enum Ayanamsha {
        LAHIRI, TROPICAL;

        public static Ayanamsha fromString(String value) {
            if (value == null || value.isBlank()) {
                return LAHIRI;
            }
            return Ayanamsha.valueOf(value.trim().toUpperCase());
        }
    }

    private static final double J2000 = 2451545.0;
    private static final double UNIX_EPOCH_JD = 2440587.5;
    private static final double SUN_ALTITUDE_AT_EVENT = -0.833; // refraction + solar semi-diameter
    private static final int EVENT_ITERATIONS = 5;

    // Lahiri (Chitrapaksha) ayanamsha at J2000 and its precession per Julian century
    private static final double LAHIRI_J2000 = 23.85306;
    private static final double LAHIRI_RATE = 1.39663;

    // Moon longitude terms: multiples of D, M, M', F and the sine coefficient in 1e-6 degrees
    private static final int[][] MOON_LONGITUDE_TERMS = {
            {0, 0, 1, 0, 6288774}, {2, 0, -1, 0, 1274027}, {2, 0, 0, 0, 658314},
            {0, 0, 2, 0, 213618}, {0, 1, 0, 0, -185116}, {0, 0, 0, 2, -114332},
            {2, 0, -2, 0, 58793}, {2, -1, -1, 0, 57066}, {2, 0, 1, 0, 53322},
            {2, -1, 0, 0, 45758}, {0, 1, -1, 0, -40923}, {1, 0, 0, 0, -34720},
            {0, 1, 1, 0, -30383}, {2, 0, 0, -2, 15327}, {0, 0, 1, 2, -12528},
            {0, 0, 1, -2, 10980}, {4, 0, -1, 0, 10675}, {0, 0, 3, 0, 10034},
            {4, 0, -2, 0, 8548}, {2, 1, -1, 0, -7888}, {2, 1, 0, 0, -6766},
            {1, 0, -1, 0, -5163}, {1, 1, 0, 0, 4987}, {2, -1, 1, 0, 4036},
            {2, 0, 2, 0, 3994}, {4, 0, 0, 0, 3861}, {2, 0, -3, 0, 3665},
            {0, 1, -2, 0, -2689}, {2, 0, -1, 2, -2602}, {2, -1, -2, 0, 2390},
            {1, 0, 1, 0, -2348}, {2, -2, 0, 0, 2236}, {0, 1, 2, 0, -2120},
            {0, 2, 0, 0, -2069}
    };

    private final Ayanamsha ayanamsha;

    public AnalyticEphemerisProvider() {
        this(Ayanamsha.LAHIRI);
    }

    public AnalyticEphemerisProvider(Ayanamsha ayanamsha) {
        this.ayanamsha = ayanamsha;
    }

    public Ayanamsha getAyanamsha() {
        return ayanamsha;
    }

    @Override
    public CelestialPosition reading(Instant instant, double latitude, double longitude) {
        double t = julianCenturies(julianDay(instant));
        double offset = ayanamsha == Ayanamsha.LAHIRI ? lahiriAyanamsha(t) : 0.0;
        return new CelestialPosition(
                instant,
                CalendarMath.normalize(apparentSunLongitude(t) - offset),
                CalendarMath.normalize(apparentMoonLongitude(t) - offset),
                meanObliquity(t));
    }

    @Override
    public SunriseSunset sunriseSunset(LocalDate date, double latitude, double longitude, ZoneOffset offset)
            throws ComputationException {
        double localNoon = julianDay(date.atTime(12, 0).toInstant(offset));
        double transit = solarTransit(localNoon, longitude);
        double sunrise = solarEvent(transit, latitude, longitude, true, date);
        double sunset = solarEvent(transit, latitude, longitude, false, date);
        return new SunriseSunset(toZoned(sunrise, offset), toZoned(sunset, offset));
    }

    // ===== Time =====

    public static double julianDay(Instant instant) {
        return UNIX_EPOCH_JD + (instant.getEpochSecond() + instant.getNano() / 1e9) / 86400.0;
    }

    static double julianCenturies(double jd) {
        return (jd - J2000) / 36525.0;
    }

    static ZonedDateTime toZoned(double jd, ZoneOffset offset) {
        long millis = Math.round((jd - UNIX_EPOCH_JD) * 86400000.0);
        return Instant.ofEpochMilli(millis).truncatedTo(ChronoUnit.SECONDS).atZone(offset);
    }

    static double greenwichMeanSiderealTime(double jd) {
        double t = julianCenturies(jd);
        return CalendarMath.normalize(280.46061837 + 360.98564736629 * (jd - J2000)
                + 0.000387933 * t * t - t * t * t / 38710000.0);
    }

    // ===== Sun =====

    static double apparentSunLongitude(double t) {
        double l0 = 280.46646 + 36000.76983 * t + 0.0003032 * t * t;
        double m = Math.toRadians(357.52911 + 35999.05029 * t - 0.0001537 * t * t);
        double center = (1.914602 - 0.004817 * t - 0.000014 * t * t) * Math.sin(m)
                + (0.019993 - 0.000101 * t) * Math.sin(2 * m)
                + 0.000289 * Math.sin(3 * m);
        return CalendarMath.normalize(l0 + center - 0.00569 + nutationInLongitude(t));
    }

    public static double meanObliquity(double t) {
        return 23.439291 - 0.0130042 * t - 1.64e-7 * t * t + 5.04e-7 * t * t * t;
    }

    static double nutationInLongitude(double t) {
        return -0.00478 * Math.sin(Math.toRadians(omega(t)));
    }

    private static double omega(double t) {
        return 125.04 - 1934.136 * t;
    }

    // ===== Moon =====

    static double apparentMoonLongitude(double t) {
        double lp = 218.3164477 + 481267.88123421 * t - 0.0015786 * t * t;
        double d = 297.8501921 + 445267.1114034 * t - 0.0018819 * t * t;
        double m = 357.5291092 + 35999.0502909 * t - 0.0001536 * t * t;
        double mp = 134.9633964 + 477198.8675055 * t + 0.0087414 * t * t;
        double f = 93.2720950 + 483202.0175233 * t - 0.0036539 * t * t;
        double e = 1.0 - 0.002516 * t - 0.0000074 * t * t;

        double sum = 0.0;
        for (int[] term : MOON_LONGITUDE_TERMS) {
            double argument = term[0] * d + term[1] * m + term[2] * mp + term[3] * f;
            double coefficient = term[4];
            if (Math.abs(term[1]) == 1) {
                coefficient *= e;
            } else if (Math.abs(term[1]) == 2) {
                coefficient *= e * e;
            }
            sum += coefficient * Math.sin(Math.toRadians(argument));
        }
        double a1 = 119.75 + 131.849 * t;
        double a2 = 53.09 + 479264.290 * t;
        sum += 3958 * Math.sin(Math.toRadians(a1))
                + 1962 * Math.sin(Math.toRadians(lp - f))
                + 318 * Math.sin(Math.toRadians(a2));
        return CalendarMath.normalize(lp + sum / 1_000_000.0 + nutationInLongitude(t));
    }

    static double lahiriAyanamsha(double t) {
        return LAHIRI_J2000 + LAHIRI_RATE * t;
    }

    // ===== Sunrise / sunset =====

    private static double[] solarEquatorial(double jd) {
        double t = julianCenturies(jd);
        double lambda = Math.toRadians(apparentSunLongitude(t));
        double epsilon = Math.toRadians(meanObliquity(t) + 0.00256 * Math.cos(Math.toRadians(omega(t))));
        double rightAscension = CalendarMath.normalize(Math.toDegrees(
                Math.atan2(Math.cos(epsilon) * Math.sin(lambda), Math.cos(lambda))));
        double declination = Math.toDegrees(Math.asin(Math.sin(epsilon) * Math.sin(lambda)));
        return new double[]{rightAscension, declination};
    }

    private static double localHourAngle(double jd, double longitude, double rightAscension) {
        return signed(greenwichMeanSiderealTime(jd) + longitude - rightAscension);
    }

    private static double solarTransit(double jdGuess, double longitude) {
        double jd = jdGuess;
        for (int i = 0; i < 3; i++) {
            double[] equatorial = solarEquatorial(jd);
            jd -= localHourAngle(jd, longitude, equatorial[0]) / 360.0;
        }
        return jd;
    }

    private static double solarEvent(double transit, double latitude, double longitude, boolean rising,
                                     LocalDate date) throws ComputationException {
        double phi = Math.toRadians(latitude);
        double jd = transit;
        for (int i = 0; i < EVENT_ITERATIONS; i++) {
            double[] equatorial = solarEquatorial(jd);
            double delta = Math.toRadians(equatorial[1]);
            double cosH0 = (Math.sin(Math.toRadians(SUN_ALTITUDE_AT_EVENT)) - Math.sin(phi) * Math.sin(delta))
                    / (Math.cos(phi) * Math.cos(delta));
            if (cosH0 < -1.0 || cosH0 > 1.0) {
                throw new ComputationException(ErrorCode.INVALID_DATE,
                        "Sun does not " + (rising ? "rise" : "set") + " on " + date + " at latitude " + latitude);
            }
            double h0 = Math.toDegrees(Math.acos(cosH0));
            double target = rising ? -h0 : h0;
            jd += signed(target - localHourAngle(jd, longitude, equatorial[0])) / 360.0;
        }
        return jd;
    }

    private static double signed(double degrees) {
        return CalendarMath.normalize(degrees + 180.0) - 180.0;
    }

    /**
     * Provider settings for log lines.
     */
    public Map<String, Object> describe() {
        return Map.of("provider", "BUILT_IN", "ayanamsha", ayanamsha.name());
    }
}

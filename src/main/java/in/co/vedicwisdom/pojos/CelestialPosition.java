package in.co.vedicwisdom.pojos;

import java.time.Instant;

/**
 * Sun and Moon ecliptic longitudes at one instant, both normalized to [0, 360).
 */
public final class CelestialPosition {
    private final Instant instant;
    private final double sunLongitude;
    private final double moonLongitude;
    private final double obliquity;

    public CelestialPosition(Instant instant, double sunLongitude, double moonLongitude, double obliquity) {
        this.instant = instant;
        this.sunLongitude = sunLongitude;
        this.moonLongitude = moonLongitude;
        this.obliquity = obliquity;
    }

    public Instant getInstant() {
        return instant;
    }

    public double getSunLongitude() {
        return sunLongitude;
    }

    public double getMoonLongitude() {
        return moonLongitude;
    }

    public double getObliquity() {
        return obliquity;
    }

    @Override
    public String toString() {
        return "CelestialPosition{instant=" + instant + ", sun=" + sunLongitude + ", moon=" + moonLongitude + "}";
    }
}

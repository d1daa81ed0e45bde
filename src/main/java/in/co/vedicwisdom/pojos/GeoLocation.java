package in.co.vedicwisdom.pojos;

import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Observer location: decimal degrees (east and north positive) plus the UTC offset
 * used to interpret local calendar dates.
 */
public final class GeoLocation {
    private final String name;
    private final double latitude;
    private final double longitude;
    private final double utcOffsetHours;

    public GeoLocation(double latitude, double longitude, double utcOffsetHours) {
        this(null, latitude, longitude, utcOffsetHours);
    }

    public GeoLocation(String name, double latitude, double longitude, double utcOffsetHours) {
        if (!Double.isFinite(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("Latitude out of range: " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("Longitude out of range: " + longitude);
        }
        if (!Double.isFinite(utcOffsetHours) || utcOffsetHours < -14.0 || utcOffsetHours > 14.0) {
            throw new IllegalArgumentException("UTC offset out of range: " + utcOffsetHours);
        }
        this.name = name;
        this.latitude = latitude;
        this.longitude = longitude;
        this.utcOffsetHours = utcOffsetHours;
    }

    public String getName() {
        return name;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public double getUtcOffsetHours() {
        return utcOffsetHours;
    }

    public ZoneOffset getZoneOffset() {
        return ZoneOffset.ofTotalSeconds((int) Math.round(utcOffsetHours * 3600));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GeoLocation)) return false;
        GeoLocation that = (GeoLocation) o;
        return Double.compare(latitude, that.latitude) == 0
                && Double.compare(longitude, that.longitude) == 0
                && Double.compare(utcOffsetHours, that.utcOffsetHours) == 0
                && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, latitude, longitude, utcOffsetHours);
    }

    @Override
    public String toString() {
        return (name != null ? name + " " : "") + "(" + latitude + ", " + longitude + ", UTC" + getZoneOffset().getId() + ")";
    }
}

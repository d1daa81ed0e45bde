package in.co.vedicwisdom.pojos;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZonedDateTime;

/**
 * Panchang for one local calendar date, fixed at the moment of sunrise.
 */
public final class PanchangDay {
    private final LocalDate date;
    private final GeoLocation location;
    private final ZonedDateTime sunrise;
    private final ZonedDateTime sunset;
    private final CalendarIndices indices;

    public PanchangDay(LocalDate date, GeoLocation location, ZonedDateTime sunrise, ZonedDateTime sunset,
                       CalendarIndices indices) {
        this.date = date;
        this.location = location;
        this.sunrise = sunrise;
        this.sunset = sunset;
        this.indices = indices;
    }

    public LocalDate getDate() {
        return date;
    }

    public DayOfWeek getWeekday() {
        return date.getDayOfWeek();
    }

    public GeoLocation getLocation() {
        return location;
    }

    public ZonedDateTime getSunrise() {
        return sunrise;
    }

    public ZonedDateTime getSunset() {
        return sunset;
    }

    public CalendarIndices getIndices() {
        return indices;
    }

    public int getTithi() {
        return indices.getTithi();
    }

    public Paksha getPaksha() {
        return indices.getPaksha();
    }

    public int getNakshatra() {
        return indices.getNakshatra();
    }

    public int getYoga() {
        return indices.getYoga();
    }

    public int getKarana() {
        return indices.getKarana();
    }

    @Override
    public String toString() {
        return "PanchangDay{" + date + ", " + indices + "}";
    }
}

package in.co.vedicwisdom.pojos;

import java.util.Map;

/**
 * Request payload of the Free Astrology API planets endpoint.
 */
public class ThirdPartyAstrologyRequest {
    private int year;
    private int month;
    private int date;
    private int hours;
    private int minutes;
    private int seconds;
    private double latitude;
    private double longitude;
    private double timezone;
    private Map<String, String> settings;

    public ThirdPartyAstrologyRequest() {
    }

    public ThirdPartyAstrologyRequest(int year, int month, int date, int hours, int minutes, int seconds,
                                      double latitude, double longitude, double timezone,
                                      Map<String, String> settings) {
        this.year = year;
        this.month = month;
        this.date = date;
        this.hours = hours;
        this.minutes = minutes;
        this.seconds = seconds;
        this.latitude = latitude;
        this.longitude = longitude;
        this.timezone = timezone;
        this.settings = settings;
    }

    public int getYear() {
        return year;
    }

    public int getMonth() {
        return month;
    }

    public int getDate() {
        return date;
    }

    public int getHours() {
        return hours;
    }

    public int getMinutes() {
        return minutes;
    }

    public int getSeconds() {
        return seconds;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public double getTimezone() {
        return timezone;
    }

    public Map<String, String> getSettings() {
        return settings;
    }
}

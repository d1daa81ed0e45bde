package in.co.vedicwisdom.pojos;

import java.time.ZonedDateTime;

public final class SunriseSunset {
    private final ZonedDateTime sunrise;
    private final ZonedDateTime sunset;

    public SunriseSunset(ZonedDateTime sunrise, ZonedDateTime sunset) {
        this.sunrise = sunrise;
        this.sunset = sunset;
    }

    public ZonedDateTime getSunrise() {
        return sunrise;
    }

    public ZonedDateTime getSunset() {
        return sunset;
    }
}

package in.co.vedicwisdom.pojos;

import java.time.ZonedDateTime;

/**
 * Birth chart: janma nakshatra and rashi for one birth moment.
 */
public final class JanamPatri {
    private final ZonedDateTime birthMoment;
    private final GeoLocation birthLocation;
    private final int nakshatra;
    private final int rashi;
    private final boolean fromOverride;

    public JanamPatri(ZonedDateTime birthMoment, GeoLocation birthLocation, int nakshatra, int rashi,
                      boolean fromOverride) {
        this.birthMoment = birthMoment;
        this.birthLocation = birthLocation;
        this.nakshatra = nakshatra;
        this.rashi = rashi;
        this.fromOverride = fromOverride;
    }

    public ZonedDateTime getBirthMoment() {
        return birthMoment;
    }

    public GeoLocation getBirthLocation() {
        return birthLocation;
    }

    public int getNakshatra() {
        return nakshatra;
    }

    public int getRashi() {
        return rashi;
    }

    public boolean isFromOverride() {
        return fromOverride;
    }

    @Override
    public String toString() {
        return "JanamPatri{" + birthMoment + ", nakshatra=" + nakshatra + ", rashi=" + rashi
                + (fromOverride ? ", override" : "") + "}";
    }
}

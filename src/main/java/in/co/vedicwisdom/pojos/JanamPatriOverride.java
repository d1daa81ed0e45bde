package in.co.vedicwisdom.pojos;

/**
 * A traditionally assigned nakshatra/rashi pair, e.g. from family records.
 */
public final class JanamPatriOverride {
    private final int nakshatra;
    private final int rashi;

    public JanamPatriOverride(int nakshatra, int rashi) {
        if (nakshatra < 1 || nakshatra > 27) {
            throw new IllegalArgumentException("Nakshatra must be 1-27: " + nakshatra);
        }
        if (rashi < 1 || rashi > 12) {
            throw new IllegalArgumentException("Rashi must be 1-12: " + rashi);
        }
        this.nakshatra = nakshatra;
        this.rashi = rashi;
    }

    public int getNakshatra() {
        return nakshatra;
    }

    public int getRashi() {
        return rashi;
    }
}

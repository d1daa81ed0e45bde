package in.co.vedicwisdom.pojos;

/**
 * The five-limb indices (plus rashi) derived from one pair of Sun/Moon longitudes.
 * All indices are 1-based.
 */
public final class CalendarIndices {
    private final int tithi;
    private final Paksha paksha;
    private final int nakshatra;
    private final int yoga;
    private final int karana;
    private final int rashi;

    public CalendarIndices(int tithi, int nakshatra, int yoga, int karana, int rashi) {
        this.tithi = tithi;
        this.paksha = Paksha.forTithi(tithi);
        this.nakshatra = nakshatra;
        this.yoga = yoga;
        this.karana = karana;
        this.rashi = rashi;
    }

    public int getTithi() {
        return tithi;
    }

    public Paksha getPaksha() {
        return paksha;
    }

    public int getNakshatra() {
        return nakshatra;
    }

    public int getYoga() {
        return yoga;
    }

    public int getKarana() {
        return karana;
    }

    public int getRashi() {
        return rashi;
    }

    @Override
    public String toString() {
        return "CalendarIndices{tithi=" + tithi + ", paksha=" + paksha + ", nakshatra=" + nakshatra
                + ", yoga=" + yoga + ", karana=" + karana + ", rashi=" + rashi + "}";
    }
}

package in.co.vedicwisdom.pojos;

/**
 * Lunar fortnight. Tithis 1-15 are Shukla (waxing), 16-30 Krishna (waning).
 */
public enum Paksha {
    SHUKLA("Shukla"),
    KRISHNA("Krishna");

    private final String displayName;

    Paksha(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Paksha forTithi(int tithi) {
        return tithi <= 15 ? SHUKLA : KRISHNA;
    }
}

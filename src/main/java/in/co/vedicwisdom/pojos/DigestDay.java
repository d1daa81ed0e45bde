package in.co.vedicwisdom.pojos;

import java.time.LocalDate;

/**
 * One row of the weekly digest.
 */
public final class DigestDay {
    private final PanchangDay panchang;
    private final ObservanceSet observances;
    private final RecommendationResult recommendation;
    private final Integer skippedTithi;

    public DigestDay(PanchangDay panchang, ObservanceSet observances, RecommendationResult recommendation,
                     Integer skippedTithi) {
        this.panchang = panchang;
        this.observances = observances;
        this.recommendation = recommendation;
        this.skippedTithi = skippedTithi;
    }

    public LocalDate getDate() {
        return panchang.getDate();
    }

    public PanchangDay getPanchang() {
        return panchang;
    }

    public ObservanceSet getObservances() {
        return observances;
    }

    public RecommendationResult getRecommendation() {
        return recommendation;
    }

    /**
     * Tithi that starts and ends between this sunrise and the next one (kshaya), or null.
     */
    public Integer getSkippedTithi() {
        return skippedTithi;
    }
}

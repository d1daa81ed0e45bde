package in.co.vedicwisdom.pojos;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public final class RecommendationResult {
    private final VerseRecord verse;
    private final double score;
    private final Set<String> queryTags;
    private final boolean fallback;

    public RecommendationResult(VerseRecord verse, double score, Set<String> queryTags, boolean fallback) {
        this.verse = verse;
        this.score = score;
        this.queryTags = Collections.unmodifiableSet(new LinkedHashSet<>(queryTags));
        this.fallback = fallback;
    }

    public VerseRecord getVerse() {
        return verse;
    }

    public double getScore() {
        return score;
    }

    public Set<String> getQueryTags() {
        return queryTags;
    }

    /**
     * True when nothing matched and the configured default verse was returned.
     */
    public boolean isFallback() {
        return fallback;
    }

    @Override
    public String toString() {
        return "RecommendationResult{" + verse.getId() + ", score=" + score + (fallback ? ", fallback" : "") + "}";
    }
}

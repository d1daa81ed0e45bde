package in.co.vedicwisdom.services;

import in.co.vedicwisdom.pojos.RecommendationResult;
import in.co.vedicwisdom.pojos.VerseRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ranks corpus verses for a set of query tags. Equal scores keep corpus order, so the same corpus and
 * tags always give the same answer. When nothing matches the default verse is returned as a fallback.
 */
public class VerseRecommender {

    private final VerseScorer scorer;
    private final VerseRecord defaultVerse;

    public VerseRecommender(VerseScorer scorer, VerseRecord defaultVerse) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.defaultVerse = Objects.requireNonNull(defaultVerse, "defaultVerse");
    }

    public VerseScorer getScorer() {
        return scorer;
    }

    public VerseRecord getDefaultVerse() {
        return defaultVerse;
    }

    public List<RecommendationResult> recommend(List<VerseRecord> corpus, Set<String> queryTags, int topK)
            throws ComputationException {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1: " + topK);
        }
        Objects.requireNonNull(queryTags, "queryTags");
        if (corpus == null || corpus.isEmpty()) {
            throw new ComputationException(ErrorCode.CORPUS_EMPTY, "Verse corpus is empty");
        }

        Set<String> tags = Collections.unmodifiableSet(new LinkedHashSet<>(queryTags));
        Set<String> queryTokens = TextNormalizer.tokens(tags);

        List<RecommendationResult> scored = new ArrayList<>();
        for (VerseRecord verse : corpus) {
            double score = queryTokens.isEmpty() ? 0.0 : scorer.score(queryTokens, verse);
            if (score > 0.0) {
                scored.add(new RecommendationResult(verse, score, tags, false));
            }
        }
        // List.sort is stable: ties stay in corpus order
        scored.sort(Comparator.comparingDouble(RecommendationResult::getScore).reversed());

        if (scored.isEmpty()) {
            LoggingService.debug("verse_fallback_used", LoggingService.data(
                    "queryTags", String.join(",", tags),
                    "defaultVerseId", defaultVerse.getId()));
            return List.of(new RecommendationResult(defaultVerse, 0.0, tags, true));
        }
        return List.copyOf(scored.subList(0, Math.min(topK, scored.size())));
    }

    public RecommendationResult recommendOne(List<VerseRecord> corpus, Set<String> queryTags)
            throws ComputationException {
        return recommend(corpus, queryTags, 1).get(0);
    }
}

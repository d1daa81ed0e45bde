package in.co.vedicwisdom.services;

import in.co.vedicwisdom.pojos.VerseRecord;

import java.util.Locale;
import java.util.Set;

/**
 * Scores one verse against normalized query tokens. Higher is better; zero or less means no match.
 */
public interface VerseScorer {

    String TOKEN_OVERLAP = "TOKEN_OVERLAP";
    String VECTOR_SIMILARITY = "VECTOR_SIMILARITY";

    double score(Set<String> queryTokens, VerseRecord verse);

    String name();

    static VerseScorer forBackend(String backend) {
        String normalized = backend == null ? TOKEN_OVERLAP : backend.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case TOKEN_OVERLAP:
                return new TokenOverlapScorer();
            case VECTOR_SIMILARITY:
                return new VectorSimilarityScorer();
            default:
                throw new IllegalArgumentException("Unknown matching backend: " + backend);
        }
    }
}

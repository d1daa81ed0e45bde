package in.co.vedicwisdom.services;

import in.co.vedicwisdom.pojos.VerseRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Cosine similarity between hashed term-frequency vectors of the query and of the verse's tags,
 * deity and meaning. Deterministic and dependency-free; no model is loaded.
 */
public class VectorSimilarityScorer implements VerseScorer {

    static final int DIMENSIONS = 256;

    @Override
    public double score(Set<String> queryTokens, VerseRecord verse) {
        List<String> verseText = new ArrayList<>(verse.getTags());
        verseText.add(verse.getDeity());
        verseText.add(verse.getMeaning());
        return cosineSimilarity(embed(queryTokens), embed(TextNormalizer.tokens(verseText)));
    }

    @Override
    public String name() {
        return VECTOR_SIMILARITY;
    }

    static double[] embed(Collection<String> tokens) {
        double[] vector = new double[DIMENSIONS];
        for (String token : tokens) {
            vector[Math.floorMod(token.hashCode(), DIMENSIONS)] += 1.0;
        }
        return vector;
    }

    static double cosineSimilarity(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors must have same dimension");
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}

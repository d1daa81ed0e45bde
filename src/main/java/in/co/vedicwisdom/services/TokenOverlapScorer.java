package in.co.vedicwisdom.services;

import in.co.vedicwisdom.pojos.VerseRecord;

import java.util.Set;

/**
 * Counts distinct query tokens found among the verse's tag tokens. Only when there is no tag overlap,
 * falls back to substring hits in the meaning and deity text at {@value #SUBSTRING_WEIGHT} each, capped
 * below one full tag hit.
 */
public class TokenOverlapScorer implements VerseScorer {

    static final double SUBSTRING_WEIGHT = 0.1;
    static final double SUBSTRING_CAP = 0.9;
    static final int MIN_SUBSTRING_TOKEN_LENGTH = 3;

    @Override
    public double score(Set<String> queryTokens, VerseRecord verse) {
        Set<String> tagTokens = TextNormalizer.tokens(verse.getTags());
        int overlap = 0;
        for (String token : queryTokens) {
            if (tagTokens.contains(token)) {
                overlap++;
            }
        }
        if (overlap > 0) {
            return overlap;
        }

        String text = TextNormalizer.normalize(verse.getMeaning() + " " + verse.getDeity());
        double partial = 0.0;
        for (String token : queryTokens) {
            if (token.length() >= MIN_SUBSTRING_TOKEN_LENGTH && text.contains(token)) {
                partial += SUBSTRING_WEIGHT;
            }
        }
        return Math.min(partial, SUBSTRING_CAP);
    }

    @Override
    public String name() {
        return TOKEN_OVERLAP;
    }
}

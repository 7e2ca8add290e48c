package com.business.deduplication.similarity;

import com.business.deduplication.rules.NormalizedRecord;
import com.business.deduplication.rules.PhoneticEncoder;

import java.util.ArrayList;
import java.util.List;

/**
 * Sounds-alike similarity over name tokens.
 *
 * <p>Equal Double Metaphone code sequences score 1.0. Otherwise the score is the share
 * of tokens whose code also appears on the other side, with a floor of 0.5 when the
 * first tokens have the same Soundex code.</p>
 */
public class PhoneticSimilarity implements SimilarityAlgorithm {

    static final double SOUNDEX_FLOOR = 0.5;

    private final PhoneticEncoder encoder;

    public PhoneticSimilarity() {
        this(new PhoneticEncoder());
    }

    public PhoneticSimilarity(PhoneticEncoder encoder) {
        this.encoder = encoder;
    }

    @Override
    public double compute(String s1, String s2) {
        if (SimilarityAlgorithm.isBlank(s1) || SimilarityAlgorithm.isBlank(s2)) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        return compareCodes(encoder.encodeTokens(s1), encoder.soundex(firstToken(s1)),
                encoder.encodeTokens(s2), encoder.soundex(firstToken(s2)));
    }

    /**
     * Compares the precomputed name codes of two snapshots.
     */
    public double compute(NormalizedRecord a, NormalizedRecord b) {
        if (a.name().isEmpty() || b.name().isEmpty()) {
            return 0.0;
        }
        if (a.name().equals(b.name())) {
            return 1.0;
        }
        return compareCodes(a.nameCodes(), a.nameSoundex(), b.nameCodes(), b.nameSoundex());
    }

    @Override
    public String getName() {
        return "phonetic";
    }

    double compareCodes(List<String> codes1, String soundex1, List<String> codes2, String soundex2) {
        if (codes1.isEmpty() || codes2.isEmpty()) {
            return 0.0;
        }
        if (codes1.equals(codes2)) {
            return 1.0;
        }

        List<String> remaining = new ArrayList<>(codes2);
        int matched = 0;
        for (String code : codes1) {
            if (remaining.remove(code)) {
                matched++;
            }
        }
        double score = (double) matched / Math.max(codes1.size(), codes2.size());

        if (!soundex1.isEmpty() && soundex1.equals(soundex2)) {
            score = Math.max(score, SOUNDEX_FLOOR);
        }
        return score;
    }

    private static String firstToken(String s) {
        String trimmed = s.trim();
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }
}

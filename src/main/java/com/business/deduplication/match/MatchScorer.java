package com.business.deduplication.match;

import com.business.deduplication.api.DeduplicationOptions;
import com.business.deduplication.core.model.MatchAlgorithm;
import com.business.deduplication.core.model.MatchConfidence;
import com.business.deduplication.core.model.MatchResult;
import com.business.deduplication.core.model.MergeAction;
import com.business.deduplication.core.model.RecordField;
import com.business.deduplication.rules.NormalizedRecord;
import com.business.deduplication.scorer.ScorerOutcome;
import com.business.deduplication.scorer.TimeBoundedScorer;
import com.business.deduplication.similarity.AbbreviationMatcher;
import com.business.deduplication.similarity.AddressSimilarity;
import com.business.deduplication.similarity.ContactSimilarity;
import com.business.deduplication.similarity.ExactFieldSimilarity;
import com.business.deduplication.similarity.FieldWeights;
import com.business.deduplication.similarity.LevenshteinSimilarity;
import com.business.deduplication.similarity.PhoneticSimilarity;
import com.business.deduplication.similarity.TokenSetSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Scores a pair of normalized records.
 *
 * <p>Each checked field populated on both sides gets the maximum score of the enabled
 * algorithms that apply to it. The pair score is the weighted mean of those field scores
 * ({@link FieldWeights}), where a field below its {@code fieldThresholds} minimum counts
 * as 0.0. Exact equality of a strong identifier (business number, phone, email, website
 * host) under {@code field-exact} is decisive and yields 1.0.</p>
 *
 * <p>Stateless apart from its collaborators; safe for concurrent use.</p>
 */
public class MatchScorer {
    private static final Logger log = LoggerFactory.getLogger(MatchScorer.class);

    static final double HIGH_CONFIDENCE = 0.9;
    static final double MEDIUM_CONFIDENCE = 0.7;
    static final double NUMERIC_MISMATCH_CAP = 0.5;

    /**
     * Order in which fields appear in match details.
     */
    static final List<RecordField> FIELD_ORDER = List.of(
            RecordField.NAME, RecordField.BUSINESS_NUMBER, RecordField.PHONE, RecordField.EMAIL,
            RecordField.WEBSITE, RecordField.ADDRESS, RecordField.INDUSTRY);

    /**
     * Tie-break order between algorithms with the same score.
     */
    static final List<MatchAlgorithm> ALGORITHM_ORDER = List.of(
            MatchAlgorithm.STRING, MatchAlgorithm.TOKEN, MatchAlgorithm.PHONETIC,
            MatchAlgorithm.ADDRESS, MatchAlgorithm.FIELD_EXACT, MatchAlgorithm.CUSTOM, MatchAlgorithm.ML);

    private static final Set<RecordField> STRONG_IDENTIFIERS = EnumSet.of(
            RecordField.BUSINESS_NUMBER, RecordField.PHONE, RecordField.EMAIL, RecordField.WEBSITE);

    private static final Set<RecordField> CONFLICT_FIELDS = EnumSet.of(
            RecordField.BUSINESS_NUMBER, RecordField.PHONE, RecordField.EMAIL);

    private final FieldWeights weights;
    private final TimeBoundedScorer externalScorer;
    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();
    private final TokenSetSimilarity tokenSet = new TokenSetSimilarity();
    private final PhoneticSimilarity phonetic = new PhoneticSimilarity();
    private final ExactFieldSimilarity exact = new ExactFieldSimilarity();
    private final ContactSimilarity contact = new ContactSimilarity(levenshtein);
    private final AddressSimilarity address = new AddressSimilarity(levenshtein, tokenSet);
    private final AbbreviationMatcher abbreviation = new AbbreviationMatcher();

    public MatchScorer() {
        this(FieldWeights.defaultWeights(), null);
    }

    /**
     * @param weights        field weights
     * @param externalScorer bounded external scorer, or {@code null} if none is configured
     */
    public MatchScorer(FieldWeights weights, TimeBoundedScorer externalScorer) {
        this.weights = Objects.requireNonNull(weights, "weights is required");
        this.externalScorer = externalScorer;
    }

    public FieldWeights getWeights() {
        return weights;
    }

    /**
     * Compares {@code query} against {@code candidate}; the result is attributed to the candidate.
     */
    public MatchResult compare(NormalizedRecord query, NormalizedRecord candidate, DeduplicationOptions options) {
        Map<String, Double> details = new LinkedHashMap<>();
        double weightedSum = 0.0;
        double weightTotal = 0.0;
        boolean decisive = false;
        boolean conflict = false;
        FieldScore best = null;

        for (RecordField field : FIELD_ORDER) {
            if (!options.isChecked(field) || !comparable(field, query, candidate)) {
                continue;
            }
            FieldScore fieldScore = scoreField(field, query, candidate, options);
            if (fieldScore == null) {
                continue;
            }

            details.put(field.detailKey(), fieldScore.score());
            double contribution = fieldScore.score() >= options.fieldThreshold(field) ? fieldScore.score() : 0.0;
            double weight = weights.weightOf(field);
            weightedSum += weight * contribution;
            weightTotal += weight;

            if (STRONG_IDENTIFIERS.contains(field)
                    && options.isEnabled(MatchAlgorithm.FIELD_EXACT)
                    && query.value(field).equals(candidate.value(field))) {
                decisive = true;
            }
            if (CONFLICT_FIELDS.contains(field) && fieldScore.score() < 1.0) {
                conflict = true;
            }
            if (best == null || fieldScore.beats(best)) {
                best = fieldScore;
            }
        }

        double score;
        MatchAlgorithm algorithm;
        String scorerNote = null;

        if (decisive) {
            score = 1.0;
            algorithm = MatchAlgorithm.FIELD_EXACT;
        } else {
            boolean hasAlgorithmic = weightTotal > 0.0;
            double algorithmic = hasAlgorithmic ? Math.min(1.0, weightedSum / weightTotal) : 0.0;
            score = algorithmic;
            algorithm = best != null ? best.algorithm() : MatchAlgorithm.STRING;

            if (options.wantsExternalScore() && externalScorer != null && externalScorer.isAvailable()) {
                ScorerOutcome outcome = externalScorer.score(query.source(), candidate.source());
                if (outcome.isSuccess()) {
                    double ml = outcome.score();
                    if (hasAlgorithmic) {
                        double w = options.getMlWeight();
                        score = Math.min(1.0, (1.0 - w) * algorithmic + w * ml);
                    } else {
                        score = ml;
                        algorithm = MatchAlgorithm.ML;
                    }
                } else {
                    scorerNote = outcome.note();
                }
            }
        }

        MatchConfidence confidence = confidence(score, decisive);
        MergeAction action = suggestAction(score, conflict && !decisive, options);

        if (log.isTraceEnabled()) {
            log.trace("match.scored queryId={} candidateId={} score={} algorithm={} details={}",
                    query.id(), candidate.id(), score, algorithm, details);
        }
        return new MatchResult(candidate.id(), score, confidence, algorithm, details, action, scorerNote);
    }

    static MatchConfidence confidence(double score, boolean decisive) {
        if (decisive || score >= HIGH_CONFIDENCE) {
            return MatchConfidence.HIGH;
        }
        if (score >= MEDIUM_CONFIDENCE) {
            return MatchConfidence.MEDIUM;
        }
        return MatchConfidence.LOW;
    }

    static MergeAction suggestAction(double score, boolean conflict, DeduplicationOptions options) {
        if (score >= options.getAutoMergeThreshold()) {
            return MergeAction.MERGE;
        }
        if (conflict) {
            return MergeAction.MANUAL_REVIEW;
        }
        if (score >= options.getThreshold()) {
            return MergeAction.MARK_DUPLICATE;
        }
        return MergeAction.KEEP_BOTH;
    }

    private boolean comparable(RecordField field, NormalizedRecord a, NormalizedRecord b) {
        if (field == RecordField.ADDRESS) {
            return address.comparable(a, b);
        }
        return a.has(field) && b.has(field);
    }

    private FieldScore scoreField(RecordField field, NormalizedRecord a, NormalizedRecord b,
                                  DeduplicationOptions options) {
        FieldComparator custom = options.getCustomComparators().get(field);
        if (custom != null) {
            FieldScore customScore = runCustom(field, custom, a, b);
            if (customScore != null) {
                return customScore;
            }
        }

        FieldScore result = null;
        switch (field) {
            case NAME -> {
                if (options.isEnabled(MatchAlgorithm.STRING)) {
                    result = FieldScore.max(result, MatchAlgorithm.STRING, Math.max(
                            levenshtein.compute(a.name(), b.name()),
                            abbreviation.compute(a.name(), b.name())));
                }
                if (options.isEnabled(MatchAlgorithm.TOKEN)) {
                    result = FieldScore.max(result, MatchAlgorithm.TOKEN,
                            TokenSetSimilarity.jaccard(a.nameTokens(), b.nameTokens()));
                }
                if (options.isEnabled(MatchAlgorithm.PHONETIC)) {
                    result = FieldScore.max(result, MatchAlgorithm.PHONETIC, phonetic.compute(a, b));
                }
                if (result != null && numericTokensDiffer(a.nameTokens(), b.nameTokens())) {
                    result = new FieldScore(Math.min(result.score(), NUMERIC_MISMATCH_CAP), result.algorithm());
                }
            }
            case BUSINESS_NUMBER -> {
                if (options.isEnabled(MatchAlgorithm.STRING)) {
                    result = FieldScore.max(result, MatchAlgorithm.STRING,
                            levenshtein.compute(a.businessNumber(), b.businessNumber()));
                }
                if (options.isEnabled(MatchAlgorithm.FIELD_EXACT)) {
                    result = FieldScore.max(result, MatchAlgorithm.FIELD_EXACT,
                            exact.compute(a.businessNumber(), b.businessNumber()));
                }
            }
            case PHONE -> {
                if (options.isEnabled(MatchAlgorithm.STRING)) {
                    result = FieldScore.max(result, MatchAlgorithm.STRING, contact.phone(a.phone(), b.phone()));
                }
                if (options.isEnabled(MatchAlgorithm.FIELD_EXACT)) {
                    result = FieldScore.max(result, MatchAlgorithm.FIELD_EXACT, exact.compute(a.phone(), b.phone()));
                }
            }
            case EMAIL -> {
                if (options.isEnabled(MatchAlgorithm.STRING)) {
                    result = FieldScore.max(result, MatchAlgorithm.STRING, contact.email(a.email(), b.email()));
                }
                if (options.isEnabled(MatchAlgorithm.FIELD_EXACT)) {
                    result = FieldScore.max(result, MatchAlgorithm.FIELD_EXACT, exact.compute(a.email(), b.email()));
                }
            }
            case WEBSITE -> {
                if (options.isEnabled(MatchAlgorithm.STRING)) {
                    result = FieldScore.max(result, MatchAlgorithm.STRING, contact.website(a.website(), b.website()));
                }
                if (options.isEnabled(MatchAlgorithm.FIELD_EXACT)) {
                    result = FieldScore.max(result, MatchAlgorithm.FIELD_EXACT,
                            exact.compute(a.website(), b.website()));
                }
            }
            case ADDRESS -> {
                if (options.isEnabled(MatchAlgorithm.ADDRESS)) {
                    result = FieldScore.max(result, MatchAlgorithm.ADDRESS, address.compute(a, b));
                }
            }
            case INDUSTRY -> {
                if (options.isEnabled(MatchAlgorithm.TOKEN)) {
                    result = FieldScore.max(result, MatchAlgorithm.TOKEN,
                            TokenSetSimilarity.jaccard(a.industry(), b.industry()));
                }
            }
            default -> throw new IllegalArgumentException("Field " + field.key() + " is not comparable");
        }
        return result;
    }

    private FieldScore runCustom(RecordField field, FieldComparator comparator,
                                 NormalizedRecord a, NormalizedRecord b) {
        NormalizedRecord first = compareIds(a, b) <= 0 ? a : b;
        NormalizedRecord second = first == a ? b : a;
        try {
            double value = comparator.compare(first.source(), second.source());
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                log.warn("match.customComparator.invalid field={} value={} firstId={} secondId={}",
                        field.key(), value, first.id(), second.id());
                return null;
            }
            return new FieldScore(value, MatchAlgorithm.CUSTOM);
        } catch (RuntimeException e) {
            log.warn("match.customComparator.failed field={} firstId={} secondId={}",
                    field.key(), first.id(), second.id(), e);
            return null;
        }
    }

    /**
     * True when one side has numeric tokens and the two numeric token sets differ,
     * e.g. {@code business 1} and {@code business 2}.
     */
    static boolean numericTokensDiffer(List<String> tokens1, List<String> tokens2) {
        Set<String> numbers1 = numericTokens(tokens1);
        Set<String> numbers2 = numericTokens(tokens2);
        if (numbers1.isEmpty() && numbers2.isEmpty()) {
            return false;
        }
        return !numbers1.equals(numbers2);
    }

    private static Set<String> numericTokens(List<String> tokens) {
        Set<String> numbers = new HashSet<>();
        for (String token : tokens) {
            if (token.chars().anyMatch(Character::isDigit)) {
                numbers.add(token);
            }
        }
        return numbers;
    }

    private static int compareIds(NormalizedRecord a, NormalizedRecord b) {
        String left = a.id() == null ? "" : a.id();
        String right = b.id() == null ? "" : b.id();
        return left.compareTo(right);
    }

    /**
     * A field score and the algorithm that produced it.
     */
    record FieldScore(double score, MatchAlgorithm algorithm) {

        static FieldScore max(FieldScore current, MatchAlgorithm algorithm, double score) {
            FieldScore candidate = new FieldScore(score, algorithm);
            return current == null || candidate.beats(current) ? candidate : current;
        }

        boolean beats(FieldScore other) {
            if (score != other.score) {
                return score > other.score;
            }
            return ALGORITHM_ORDER.indexOf(algorithm) < ALGORITHM_ORDER.indexOf(other.algorithm);
        }
    }
}

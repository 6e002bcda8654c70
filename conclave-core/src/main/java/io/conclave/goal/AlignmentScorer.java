package io.conclave.goal;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword-overlap heuristic deciding whether a request serves a {@link RepositoryGoal}.
 *
 * <p>The goal keyword set {@code F} is drawn from {@code primary} and every constraint value;
 * the request keyword set is {@code R}. If the request shares a keyword with the excluded
 * scope, the result is not aligned with the excluded-scope confidence, whatever the overlap.
 * Otherwise confidence is {@code |F ∩ R| / |F|}, or the neutral confidence when {@code F} is
 * empty, and the request is aligned when confidence exceeds the threshold.
 *
 * <p>The result is advice for a human, who may override it.
 */
public final class AlignmentScorer {
    /** Confidence used when the goal yields no keywords. */
    public static final double DEFAULT_NEUTRAL_CONFIDENCE = 0.5;
    /** Confidence a request must exceed to count as aligned. */
    public static final double DEFAULT_ALIGNMENT_THRESHOLD = 0.3;
    /** Confidence reported for a request touching the excluded scope. */
    public static final double DEFAULT_EXCLUDED_SCOPE_CONFIDENCE = 0.9;

    private static final Pattern WORD = Pattern.compile("[a-zA-Z]+");
    private static final int MIN_KEYWORD_LENGTH = 4;
    private static final Set<String> DEFAULT_STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by");

    private final double neutralConfidence;
    private final double alignmentThreshold;
    private final double excludedScopeConfidence;
    private final Set<String> stopWords;

    private AlignmentScorer(Builder builder) {
        checkUnit("neutralConfidence", builder.neutralConfidence);
        checkUnit("alignmentThreshold", builder.alignmentThreshold);
        checkUnit("excludedScopeConfidence", builder.excludedScopeConfidence);
        this.neutralConfidence = builder.neutralConfidence;
        this.alignmentThreshold = builder.alignmentThreshold;
        this.excludedScopeConfidence = builder.excludedScopeConfidence;
        this.stopWords = Set.copyOf(builder.stopWords);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Scorer with the default constants. */
    public static AlignmentScorer defaults() {
        return builder().build();
    }

    /**
     * Lower-cased alphabetic tokens longer than three characters, minus stop words, in order of
     * first appearance.
     *
     * @param text any text, may be {@code null}
     * @return the keywords
     */
    public Set<String> extractKeywords(String text) {
        Set<String> keywords = new LinkedHashSet<>();
        if (text == null) {
            return keywords;
        }
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            String word = matcher.group().toLowerCase(Locale.ROOT);
            if (word.length() >= MIN_KEYWORD_LENGTH && !stopWords.contains(word)) {
                keywords.add(word);
            }
        }
        return keywords;
    }

    /**
     * Keywords of the goal's primary objective and constraint values.
     *
     * @param goal the goal
     * @return the focus keywords
     */
    public Set<String> focusKeywords(RepositoryGoal goal) {
        Set<String> focus = extractKeywords(goal.primary());
        for (String constraint : goal.constraints().values()) {
            focus.addAll(extractKeywords(constraint));
        }
        return focus;
    }

    /**
     * Scores a request against a goal.
     *
     * @param goal        the goal, or {@code null} when none is defined
     * @param requestText the request
     * @return the alignment result
     */
    public AlignmentResult computeAlignment(RepositoryGoal goal, String requestText) {
        if (goal == null) {
            return new AlignmentResult(true, 0.0, Set.of(), "No goal defined");
        }
        Set<String> request = extractKeywords(requestText);

        if (goal.scope().hasExclusions()) {
            Set<String> excludedHits = extractKeywords(goal.scope().excluded());
            excludedHits.retainAll(request);
            if (!excludedHits.isEmpty()) {
                return new AlignmentResult(false, excludedScopeConfidence, excludedHits,
                        "Request may fall under excluded scope: " + goal.scope().excluded());
            }
        }

        Set<String> focus = focusKeywords(goal);
        Set<String> matching = new LinkedHashSet<>(focus);
        matching.retainAll(request);
        double confidence = focus.isEmpty() ? neutralConfidence : (double) matching.size() / focus.size();
        String reason = String.format(Locale.ROOT, "Keyword match: %d/%d (%.1f%%)",
                matching.size(), focus.size(), confidence * 100);
        return new AlignmentResult(confidence > alignmentThreshold, confidence, matching, reason);
    }

    private static void checkUnit(String name, double value) {
        if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
            throw new IllegalArgumentException(name + " must be in [0, 1]");
        }
    }

    /** Builder for {@link AlignmentScorer}. */
    public static final class Builder {
        private double neutralConfidence = DEFAULT_NEUTRAL_CONFIDENCE;
        private double alignmentThreshold = DEFAULT_ALIGNMENT_THRESHOLD;
        private double excludedScopeConfidence = DEFAULT_EXCLUDED_SCOPE_CONFIDENCE;
        private Set<String> stopWords = DEFAULT_STOP_WORDS;

        private Builder() {
        }

        /**
         * Optional. Defaults to {@value AlignmentScorer#DEFAULT_NEUTRAL_CONFIDENCE}.
         *
         * @param neutralConfidence confidence when the goal has no keywords
         * @return this builder
         */
        public Builder neutralConfidence(double neutralConfidence) {
            this.neutralConfidence = neutralConfidence;
            return this;
        }

        /**
         * Optional. Defaults to {@value AlignmentScorer#DEFAULT_ALIGNMENT_THRESHOLD}.
         *
         * @param alignmentThreshold confidence a request must exceed to be aligned
         * @return this builder
         */
        public Builder alignmentThreshold(double alignmentThreshold) {
            this.alignmentThreshold = alignmentThreshold;
            return this;
        }

        /**
         * Optional. Defaults to {@value AlignmentScorer#DEFAULT_EXCLUDED_SCOPE_CONFIDENCE}.
         *
         * @param excludedScopeConfidence confidence reported for an excluded-scope hit
         * @return this builder
         */
        public Builder excludedScopeConfidence(double excludedScopeConfidence) {
            this.excludedScopeConfidence = excludedScopeConfidence;
            return this;
        }

        public Builder stopWords(Set<String> stopWords) {
            this.stopWords = stopWords;
            return this;
        }

        public AlignmentScorer build() {
            return new AlignmentScorer(this);
        }
    }
}

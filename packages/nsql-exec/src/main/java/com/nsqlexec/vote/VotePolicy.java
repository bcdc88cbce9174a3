package com.nsqlexec.vote;

import java.util.Locale;
import java.util.Objects;

/**
 * Configuration of a majority vote. Immutable; the {@code with...} methods return copies.
 */
public class VotePolicy {

    public static final String DEFAULT_PLACEHOLDER = "<error|empty>";

    private final VoteMethod method;
    private final boolean allowNoneAndEmptyAnswer;
    private final String answerPlaceholder;
    private final String biasedAnswer;
    private final double biasedWeight;
    private final boolean biasedOverProbability;

    private VotePolicy(VoteMethod method, boolean allowNoneAndEmptyAnswer, String answerPlaceholder,
                       String biasedAnswer, double biasedWeight, boolean biasedOverProbability) {
        this.method = Objects.requireNonNull(method, "method");
        this.allowNoneAndEmptyAnswer = allowNoneAndEmptyAnswer;
        this.answerPlaceholder = answerPlaceholder;
        this.biasedAnswer = biasedAnswer;
        this.biasedWeight = biasedWeight;
        this.biasedOverProbability = biasedOverProbability;
    }

    public static VotePolicy of(VoteMethod method) {
        return new VotePolicy(method, false, DEFAULT_PLACEHOLDER, null, 1.0, false);
    }

    public static VotePolicy simple() {
        return of(VoteMethod.SIMPLE);
    }

    public static VotePolicy prob() {
        return of(VoteMethod.PROB);
    }

    /**
     * Simple vote in which the total weight of {@code answer} is multiplied by {@code weight}.
     */
    public static VotePolicy answerBiased(String answer, double weight) {
        return of(VoteMethod.ANSWER_BIASED).withBiasedAnswer(answer, weight, false);
    }

    public VotePolicy withAllowNoneAndEmptyAnswer(boolean allow) {
        return new VotePolicy(method, allow, answerPlaceholder, biasedAnswer, biasedWeight, biasedOverProbability);
    }

    public VotePolicy withAnswerPlaceholder(String placeholder) {
        return new VotePolicy(method, allowNoneAndEmptyAnswer, placeholder, biasedAnswer, biasedWeight,
                biasedOverProbability);
    }

    /**
     * @param overProbability weigh candidates by probability (as {@link VoteMethod#PROB}) before
     *                        applying the bias, instead of counting them once
     */
    public VotePolicy withBiasedAnswer(String answer, double weight, boolean overProbability) {
        return new VotePolicy(method, allowNoneAndEmptyAnswer, answerPlaceholder, answer, weight, overProbability);
    }

    public VoteMethod getMethod() { return method; }
    public boolean isAllowNoneAndEmptyAnswer() { return allowNoneAndEmptyAnswer; }
    public String getAnswerPlaceholder() { return answerPlaceholder; }
    public String getBiasedAnswer() { return biasedAnswer; }
    public double getBiasedWeight() { return biasedWeight; }
    public boolean isBiasedOverProbability() { return biasedOverProbability; }

    boolean weighsByProbability() {
        return method == VoteMethod.PROB || (method == VoteMethod.ANSWER_BIASED && biasedOverProbability);
    }

    boolean isBiased() {
        return method == VoteMethod.ANSWER_BIASED && biasedAnswer != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(method.name().toLowerCase(Locale.ROOT));
        if (isBiased()) {
            sb.append("(").append(biasedAnswer).append(" x").append(biasedWeight)
                    .append(biasedOverProbability ? ", prob" : "").append(")");
        }
        if (allowNoneAndEmptyAnswer) {
            sb.append(", allow empty");
        }
        return sb.toString();
    }
}

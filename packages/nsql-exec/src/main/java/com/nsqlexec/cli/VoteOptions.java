package com.nsqlexec.cli;

import com.nsqlexec.config.AppConfig;
import com.nsqlexec.vote.VoteMethod;
import picocli.CommandLine.Option;

/**
 * Vote policy options shared by the commands that aggregate answers.
 */
public class VoteOptions {

    @Option(names = {"--vote-method"}, description = "Vote method: ${COMPLETION-CANDIDATES}")
    VoteMethod voteMethod;

    @Option(names = {"--allow-none-and-empty-answer"}, description = "Let empty answers vote as the placeholder")
    Boolean allowNoneAndEmptyAnswer;

    @Option(names = {"--answer-placeholder"}, description = "Answer used when no candidate can win")
    String answerPlaceholder;

    @Option(names = {"--answer-biased"}, description = "Answer whose vote weight is multiplied (with --vote-method answer_biased)")
    String answerBiased;

    @Option(names = {"--answer-biased-weight"}, description = "Multiplier for the biased answer")
    Double answerBiasedWeight;

    void applyTo(AppConfig config) {
        if (voteMethod != null) {
            config.setVoteMethod(voteMethod);
        }
        if (allowNoneAndEmptyAnswer != null) {
            config.setAllowNoneAndEmptyAnswer(allowNoneAndEmptyAnswer);
        }
        if (answerPlaceholder != null) {
            config.setAnswerPlaceholder(answerPlaceholder);
        }
        if (answerBiased != null) {
            config.setAnswerBiased(answerBiased);
        }
        if (answerBiasedWeight != null) {
            config.setAnswerBiasedWeight(answerBiasedWeight);
        }
    }
}

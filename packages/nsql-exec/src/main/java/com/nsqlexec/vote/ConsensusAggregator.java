package com.nsqlexec.vote;

import com.nsqlexec.program.CandidateProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Majority vote over executed candidate programs.
 *
 * <p>Candidates are grouped by {@link VotingKey}. Failed candidates never vote; empty answers
 * vote only when the policy allows them. The key with the largest total weight wins; ties go to
 * the key with the highest-scoring single candidate, then to the one with the earliest-ranked
 * candidate. The result is a pure function of its input, independent of input order.
 */
public class ConsensusAggregator {

    private static final Logger logger = LoggerFactory.getLogger(ConsensusAggregator.class);

    public ConsensusResult aggregate(List<CandidateOutcome> candidates, VotePolicy policy) {
        List<CandidateOutcome> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingInt((CandidateOutcome c) -> c.getProgram().getRank())
                .thenComparing(c -> c.getProgram().getText()));

        double shift = scoreShift(ordered);
        List<CandidateOutcome> failed = new ArrayList<>();
        Map<VotingKey, Ballot> ballots = new LinkedHashMap<>();
        for (CandidateOutcome candidate : ordered) {
            VotingKey key = VotingKey.of(candidate.getOutcome());
            if (key.isError()) {
                failed.add(candidate);
                continue;
            }
            if (key.isEmpty() && !policy.isAllowNoneAndEmptyAnswer()) {
                continue;
            }
            ballots.computeIfAbsent(key, k -> new Ballot()).add(candidate, weight(candidate.getProgram(), policy, shift));
        }

        if (policy.isBiased()) {
            VotingKey biased = VotingKey.ofValues(Collections.singletonList(policy.getBiasedAnswer()));
            Ballot ballot = ballots.get(biased);
            if (ballot != null) {
                ballot.total *= policy.getBiasedWeight();
            }
        }

        Map<VotingKey, Double> tally = new LinkedHashMap<>();
        for (Map.Entry<VotingKey, Ballot> entry : ballots.entrySet()) {
            tally.put(entry.getKey(), entry.getValue().total);
        }

        if (ballots.isEmpty()) {
            logger.debug("No candidate left to vote ({} failed)", failed.size());
            return new ConsensusResult(Collections.singletonList(policy.getAnswerPlaceholder()), true,
                    Collections.emptyList(), null, tally, failed);
        }

        VotingKey winner = null;
        for (VotingKey key : ballots.keySet()) {
            if (winner == null || beats(key, ballots.get(key), winner, ballots.get(winner))) {
                winner = key;
            }
        }

        Ballot winning = ballots.get(winner);
        List<CandidateProgram> supporting = new ArrayList<>();
        for (CandidateOutcome candidate : winning.members) {
            supporting.add(candidate.getProgram());
        }

        if (winner.isEmpty()) {
            return new ConsensusResult(Collections.singletonList(policy.getAnswerPlaceholder()), true,
                    supporting, winner, tally, failed);
        }
        List<Object> answer = winning.members.get(0).getOutcome().getValues();
        return new ConsensusResult(answer, false, supporting, winner, tally, failed);
    }

    /**
     * Probability weight {@code exp(score - shift)}. All weights of one vote share the shift, so
     * they keep their ratios while very negative log-probabilities do not underflow to 0.
     */
    static double weight(CandidateProgram program, VotePolicy policy, double shift) {
        if (!policy.weighsByProbability()) {
            return 1.0;
        }
        double weight = Math.exp(program.getScore() - shift);
        return Double.isNaN(weight) ? 0.0 : weight;
    }

    /** Highest finite score of the candidates that can vote, or 0 if there is none. */
    static double scoreShift(List<CandidateOutcome> candidates) {
        double max = Double.NEGATIVE_INFINITY;
        for (CandidateOutcome candidate : candidates) {
            double score = candidate.getProgram().getScore();
            if (candidate.getOutcome() != null && candidate.getOutcome().isAnswer() && Double.isFinite(score)) {
                max = Math.max(max, score);
            }
        }
        return max == Double.NEGATIVE_INFINITY ? 0.0 : max;
    }

    private static boolean beats(VotingKey key, Ballot ballot, VotingKey best, Ballot bestBallot) {
        int cmp = Double.compare(ballot.total, bestBallot.total);
        if (cmp != 0) {
            return cmp > 0;
        }
        cmp = Double.compare(ballot.maxScore, bestBallot.maxScore);
        if (cmp != 0) {
            return cmp > 0;
        }
        if (ballot.minRank != bestBallot.minRank) {
            return ballot.minRank < bestBallot.minRank;
        }
        return key.compareTo(best) < 0;
    }

    private static class Ballot {
        final List<CandidateOutcome> members = new ArrayList<>();
        double total;
        double maxScore = Double.NEGATIVE_INFINITY;
        int minRank = Integer.MAX_VALUE;

        void add(CandidateOutcome candidate, double weight) {
            members.add(candidate);
            total += weight;
            // NaN scores never win a tie
            double score = candidate.getProgram().getScore();
            if (!Double.isNaN(score)) {
                maxScore = Math.max(maxScore, score);
            }
            minRank = Math.min(minRank, candidate.getProgram().getRank());
        }
    }
}

package com.nsqlexec.vote;

import com.nsqlexec.program.CandidateProgram;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a majority vote over the candidates of one example.
 */
public class ConsensusResult {

    private final List<Object> answer;
    private final boolean placeholder;
    private final List<CandidateProgram> supportingPrograms;
    private final VotingKey winningKey;
    private final Map<VotingKey, Double> tally;
    private final List<CandidateOutcome> failedPrograms;

    public ConsensusResult(List<Object> answer, boolean placeholder, List<CandidateProgram> supportingPrograms,
                           VotingKey winningKey, Map<VotingKey, Double> tally, List<CandidateOutcome> failedPrograms) {
        this.answer = Collections.unmodifiableList(new ArrayList<>(answer));
        this.placeholder = placeholder;
        this.supportingPrograms = Collections.unmodifiableList(new ArrayList<>(supportingPrograms));
        this.winningKey = winningKey;
        this.tally = Collections.unmodifiableMap(new LinkedHashMap<>(tally));
        this.failedPrograms = Collections.unmodifiableList(new ArrayList<>(failedPrograms));
    }

    /**
     * Result holding only the placeholder answer, for examples that could not be processed.
     */
    public static ConsensusResult placeholder(String placeholder) {
        return new ConsensusResult(Collections.singletonList(placeholder), true, Collections.emptyList(), null,
                Collections.emptyMap(), Collections.emptyList());
    }

    /** The consensus answer, or a single-element list holding the placeholder. */
    public List<Object> getAnswer() { return answer; }

    /** Whether the answer is the configured placeholder. */
    public boolean isPlaceholder() { return placeholder; }

    /** Programs whose answer matched the winner, in rank order. */
    public List<CandidateProgram> getSupportingPrograms() { return supportingPrograms; }

    /** Winning voting key, or null when no candidate took part in the vote. */
    public VotingKey getWinningKey() { return winningKey; }

    /** Total weight per voting key, after any answer bias. */
    public Map<VotingKey, Double> getTally() { return tally; }

    /** Candidates whose execution failed; kept for reporting, never voted. */
    public List<CandidateOutcome> getFailedPrograms() { return failedPrograms; }

    @Override
    public String toString() {
        return "ConsensusResult{answer=" + answer + ", support=" + supportingPrograms.size()
                + ", failed=" + failedPrograms.size() + "}";
    }
}

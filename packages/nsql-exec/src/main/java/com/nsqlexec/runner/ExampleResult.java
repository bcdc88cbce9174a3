package com.nsqlexec.runner;

import com.nsqlexec.vote.CandidateOutcome;
import com.nsqlexec.vote.ConsensusResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything recorded for one processed example. A failed result is the sentinel for an example
 * whose processing threw; its consensus is the placeholder answer.
 */
public class ExampleResult {

    private final String eid;
    private final String question;
    private final List<Object> goldAnswer;
    private final List<ProgramExecution> executions;
    private final ConsensusResult consensus;
    private final boolean failed;
    private final String error;

    private ExampleResult(String eid, String question, List<Object> goldAnswer, List<ProgramExecution> executions,
                          ConsensusResult consensus, boolean failed, String error) {
        this.eid = eid;
        this.question = question;
        this.goldAnswer = goldAnswer == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(goldAnswer));
        this.executions = Collections.unmodifiableList(new ArrayList<>(executions));
        this.consensus = consensus;
        this.failed = failed;
        this.error = error;
    }

    public static ExampleResult completed(String eid, String question, List<Object> goldAnswer,
                                          List<ProgramExecution> executions, ConsensusResult consensus) {
        return new ExampleResult(eid, question, goldAnswer, executions, consensus, false, null);
    }

    public static ExampleResult failed(String eid, String question, List<Object> goldAnswer, String error,
                                       String placeholder) {
        return new ExampleResult(eid, question, goldAnswer, Collections.emptyList(),
                ConsensusResult.placeholder(placeholder), true, error);
    }

    /** Copy with a different consensus, used when re-voting stored executions. */
    public ExampleResult withConsensus(ConsensusResult newConsensus) {
        return new ExampleResult(eid, question, goldAnswer, executions, newConsensus, failed, error);
    }

    public List<CandidateOutcome> candidateOutcomes() {
        List<CandidateOutcome> outcomes = new ArrayList<>(executions.size());
        for (ProgramExecution execution : executions) {
            outcomes.add(execution.toCandidateOutcome());
        }
        return outcomes;
    }

    public String getEid() { return eid; }
    public String getQuestion() { return question; }
    public List<Object> getGoldAnswer() { return goldAnswer; }
    public List<ProgramExecution> getExecutions() { return executions; }
    public ConsensusResult getConsensus() { return consensus; }
    public boolean isFailed() { return failed; }
    public String getError() { return error; }

    @Override
    public String toString() {
        return "ExampleResult{eid=" + eid + (failed ? ", failed: " + error : ", answer=" + consensus.getAnswer()) + "}";
    }
}

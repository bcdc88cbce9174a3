package com.nsqlexec.vote;

import com.nsqlexec.exec.ExecutionOutcome;
import com.nsqlexec.program.CandidateProgram;

/**
 * A candidate program together with the outcome of executing it.
 */
public class CandidateOutcome {

    private final CandidateProgram program;
    private final ExecutionOutcome outcome;

    public CandidateOutcome(CandidateProgram program, ExecutionOutcome outcome) {
        this.program = program;
        this.outcome = outcome;
    }

    public CandidateProgram getProgram() { return program; }
    public ExecutionOutcome getOutcome() { return outcome; }

    @Override
    public String toString() {
        return program + " -> " + outcome;
    }
}

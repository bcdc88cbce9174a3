package com.nsqlexec.runner;

import com.nsqlexec.exec.ExecutionOutcome;
import com.nsqlexec.program.CandidateProgram;
import com.nsqlexec.vote.CandidateOutcome;

/**
 * One candidate program as executed for an example: raw and normalized text plus outcome.
 */
public class ProgramExecution {

    private final CandidateProgram program;
    private final String normalizedText;
    private final ExecutionOutcome outcome;

    public ProgramExecution(CandidateProgram program, String normalizedText, ExecutionOutcome outcome) {
        this.program = program;
        this.normalizedText = normalizedText;
        this.outcome = outcome;
    }

    public CandidateProgram getProgram() { return program; }
    public String getNormalizedText() { return normalizedText; }
    public ExecutionOutcome getOutcome() { return outcome; }

    public CandidateOutcome toCandidateOutcome() {
        return new CandidateOutcome(program, outcome);
    }
}

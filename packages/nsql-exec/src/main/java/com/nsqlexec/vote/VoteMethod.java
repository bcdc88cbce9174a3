package com.nsqlexec.vote;

public enum VoteMethod {
    /** Every candidate counts once. */
    SIMPLE,
    /** Candidates count with the exponentiated score (log-probability) of their program. */
    PROB,
    /** Like SIMPLE or PROB, with the total of one designated answer multiplied by a boost factor. */
    ANSWER_BIASED
}

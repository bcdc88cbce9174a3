package com.nsqlexec.program;

import java.util.Objects;

/**
 * One generated hybrid program with its generation score (e.g. a log-probability; higher is
 * more confident) and its rank, the position in the generation list.
 */
public class CandidateProgram {

    private final String text;
    private final double score;
    private final int rank;

    public CandidateProgram(String text, double score, int rank) {
        this.text = text == null ? "" : text;
        this.score = score;
        this.rank = rank;
    }

    public String getText() { return text; }
    public double getScore() { return score; }
    public int getRank() { return rank; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CandidateProgram)) return false;
        CandidateProgram that = (CandidateProgram) o;
        return rank == that.rank
                && Double.compare(score, that.score) == 0
                && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, score, rank);
    }

    @Override
    public String toString() {
        return "#" + rank + " (" + score + ") " + text;
    }
}

package com.nsqlexec.runner;

import com.nsqlexec.eval.AnswerEvaluator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merged results of a run with their correctness scores.
 */
public class RunSummary {

    private final List<ExampleResult> results;
    private final Map<String, Integer> scores;
    private final int correct;

    private RunSummary(List<ExampleResult> results, Map<String, Integer> scores) {
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
        this.scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        int sum = 0;
        for (int score : scores.values()) {
            sum += score;
        }
        this.correct = sum;
    }

    /**
     * Score every result's consensus answer against its gold answer.
     */
    public static RunSummary score(List<ExampleResult> results, AnswerEvaluator evaluator) {
        Map<String, Integer> scores = new LinkedHashMap<>();
        for (ExampleResult result : results) {
            scores.put(result.getEid(), evaluator.score(result.getConsensus().getAnswer(), result.getGoldAnswer(),
                    result.getQuestion()));
        }
        return new RunSummary(results, scores);
    }

    public List<ExampleResult> getResults() { return results; }
    public Map<String, Integer> getScores() { return scores; }
    public int getCorrect() { return correct; }
    public int getTotal() { return results.size(); }

    public int getScore(String eid) {
        Integer score = scores.get(eid);
        return score == null ? 0 : score;
    }

    public double getAccuracy() {
        return results.isEmpty() ? 0.0 : (double) correct / results.size();
    }

    public int getFailedExamples() {
        int failed = 0;
        for (ExampleResult result : results) {
            if (result.isFailed()) {
                failed++;
            }
        }
        return failed;
    }

    public String format() {
        return String.format("Overall Accuracy: %d/%d (%.2f%%)", correct, getTotal(), getAccuracy() * 100);
    }
}

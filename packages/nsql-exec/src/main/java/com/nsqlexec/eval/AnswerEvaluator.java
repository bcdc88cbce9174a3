package com.nsqlexec.eval;

import java.util.List;

/**
 * Scores a predicted answer against the gold answer of an example.
 */
public interface AnswerEvaluator {

    /**
     * @return 1 if the prediction is correct, 0 otherwise
     */
    int score(List<Object> predicted, List<Object> gold, String question);
}

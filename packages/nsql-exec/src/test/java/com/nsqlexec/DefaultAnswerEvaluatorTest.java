package com.nsqlexec;

import com.nsqlexec.eval.DefaultAnswerEvaluator;
import com.nsqlexec.vote.VotePolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultAnswerEvaluatorTest {

    private DefaultAnswerEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new DefaultAnswerEvaluator();
    }

    @Test
    void testCaseAndEdgePunctuationAreIgnored() {
        assertEquals(1, evaluator.score(List.of("Spain."), List.of("spain"), "q"));
        assertEquals(1, evaluator.score(List.of("  New   York "), List.of("new york"), "q"));
    }

    @Test
    void testOrderInsensitive() {
        assertEquals(1, evaluator.score(List.of("Italy", "Spain"), List.of("spain", "italy"), "q"));
    }

    @Test
    void testNumbersMatchWithinTolerance() {
        assertEquals(1, evaluator.score(List.of("1,000"), List.of("1000.00001"), "q"));
        assertEquals(1, evaluator.score(List.of(13), List.of("13.0"), "q"));
        assertEquals(1, evaluator.score(List.of("-5"), List.of("-5.0"), "q"));
        assertEquals(0, evaluator.score(List.of("13"), List.of("13.5"), "q"));
    }

    @Test
    void testDifferentSizesDoNotMatch() {
        assertEquals(0, evaluator.score(List.of("Spain"), List.of("Spain", "Italy"), "q"));
    }

    @Test
    void testFactVerificationWords() {
        assertEquals(1, evaluator.score(List.of("yes"), List.of("1"), "is it true?"));
        assertEquals(1, evaluator.score(List.of("False"), List.of("0"), "is it true?"));
        assertEquals(0, evaluator.score(List.of("no"), List.of("1"), "is it true?"));
    }

    @Test
    void testNullsAndPlaceholderAreWrong() {
        assertEquals(0, evaluator.score(null, List.of("Spain"), "q"));
        assertEquals(0, evaluator.score(List.of("Spain"), null, "q"));
        assertEquals(0, evaluator.score(List.of(VotePolicy.DEFAULT_PLACEHOLDER), List.of("Spain"), "q"));
    }

    @Test
    void testNullValuesAreSkipped() {
        assertEquals(1, evaluator.score(Arrays.asList("Spain", null), List.of("Spain"), "q"));
    }
}

package com.nsqlexec;

import com.nsqlexec.exec.ExecutionOutcome;
import com.nsqlexec.exec.FailureKind;
import com.nsqlexec.exec.HybridExecutor;
import com.nsqlexec.llm.AnswerOracle;
import com.nsqlexec.llm.OracleException;
import com.nsqlexec.program.ast.NeuralLeaf;
import com.nsqlexec.table.TableStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HybridExecutorTest {

    private TableStore table;
    private FakeOracle oracle;
    private HybridExecutor executor;

    @BeforeEach
    void setUp() {
        table = TableStore.of("Medal Table", List.of("Nation", "Gold", "Silver"), List.of(
                Arrays.asList("Spain", "13", "7"),
                Arrays.asList("France", "8", "5"),
                Arrays.asList("Italy", "6", "5"),
                Arrays.asList("Kenya", "2", null)));
        oracle = new FakeOracle();
        executor = new HybridExecutor(oracle);
    }

    @Test
    void testFilterAndSort() {
        ExecutionOutcome outcome = executor.execute(
                "SELECT `Nation` FROM `Medal Table` WHERE `Gold` > 5 ORDER BY `Gold` ASC", table);
        assertTrue(outcome.isAnswer(), outcome.toString());
        assertEquals(List.of("Italy", "France", "Spain"), outcome.getValues());
    }

    @Test
    void testOrderByDescendingWithLimit() {
        ExecutionOutcome outcome = executor.execute("SELECT `Nation` FROM w ORDER BY `Gold` DESC LIMIT 1", table);
        assertEquals(List.of("Spain"), outcome.getValues());
    }

    @Test
    void testAggregates() {
        assertEquals(List.of(BigDecimal.valueOf(2)),
                executor.execute("SELECT COUNT(*) FROM w WHERE `Silver` = 5", table).getValues());
        assertEquals(List.of(new BigDecimal("29")),
                executor.execute("SELECT SUM(`Gold`) FROM w", table).getValues());
        assertEquals(List.of(BigDecimal.valueOf(3)),
                executor.execute("SELECT COUNT(`Silver`) FROM w", table).getValues());
    }

    @Test
    void testGroupByWithHaving() {
        ExecutionOutcome outcome = executor.execute(
                "SELECT `Silver` FROM w GROUP BY `Silver` HAVING COUNT(*) > 1", table);
        assertEquals(List.of("5"), outcome.getValues());
    }

    @Test
    void testNullComparisonsAreFilteredOut() {
        ExecutionOutcome outcome = executor.execute("SELECT `Nation` FROM w WHERE `Silver` < 6", table);
        assertEquals(List.of("France", "Italy"), outcome.getValues());
    }

    @Test
    void testDivisionByZeroIsNull() {
        ExecutionOutcome outcome = executor.execute("SELECT `Gold` / 0 FROM w WHERE `Nation` = 'Spain'", table);
        assertTrue(outcome.isAnswer());
        assertEquals(Arrays.asList((Object) null), outcome.getValues());
    }

    @Test
    void testIntegerDivisionTruncates() {
        assertEquals(List.of(BigDecimal.valueOf(6)),
                executor.execute("SELECT `Gold` / 2 FROM w WHERE `Nation` = 'Spain'", table).getValues());
        assertEquals(List.of(BigDecimal.valueOf(-3)),
                executor.execute("SELECT -7 / 2 FROM w WHERE `Nation` = 'Spain'", table).getValues());
        BigDecimal exact = (BigDecimal) executor.execute("SELECT `Gold` / 2.0 FROM w WHERE `Nation` = 'Spain'",
                table).getValues().get(0);
        assertEquals(0, new BigDecimal("6.5").compareTo(exact));
    }

    @Test
    void testBetweenLikeAndCase() {
        assertEquals(List.of("France", "Italy"),
                executor.execute("SELECT `Nation` FROM w WHERE `Gold` BETWEEN 6 AND 8", table).getValues());
        assertEquals(List.of("France"),
                executor.execute("SELECT `Nation` FROM w WHERE `Nation` LIKE 'f%'", table).getValues());
        assertEquals(List.of("many", "few", "few", "few"),
                executor.execute("SELECT CASE WHEN `Gold` > 10 THEN 'many' ELSE 'few' END FROM w", table)
                        .getValues());
    }

    @Test
    void testLimitBeyondIntRangeKeepsAllRows() {
        ExecutionOutcome withOffset = executor.execute("SELECT `Nation` FROM w LIMIT 2147483647 OFFSET 1", table);
        assertTrue(withOffset.isAnswer(), withOffset.toString());
        assertEquals(List.of("France", "Italy", "Kenya"), withOffset.getValues());

        ExecutionOutcome huge = executor.execute("SELECT `Nation` FROM w LIMIT 4294967295", table);
        assertTrue(huge.isAnswer(), huge.toString());
        assertEquals(List.of("Spain", "France", "Italy", "Kenya"), huge.getValues());
    }

    @Test
    void testDeeplyNestedProgramFails() {
        int depth = 100_000;
        StringBuilder program = new StringBuilder("SELECT `Nation` FROM w WHERE ");
        for (int i = 0; i < depth; i++) {
            program.append('(');
        }
        program.append("`Gold` > 5");
        for (int i = 0; i < depth; i++) {
            program.append(')');
        }
        ExecutionOutcome outcome = executor.execute(program.toString(), table);
        assertTrue(outcome.isFailure());
    }

    @Test
    void testTypeMismatchIsExecutionError() {
        ExecutionOutcome outcome = executor.execute("SELECT SUM(`Nation`) FROM w", table);
        assertEquals(FailureKind.EXECUTION_ERROR, outcome.getFailureKind());
    }

    @Test
    void testUnknownColumnOrTableIsExecutionError() {
        assertEquals(FailureKind.EXECUTION_ERROR,
                executor.execute("SELECT `Population` FROM w", table).getFailureKind());
        assertEquals(FailureKind.EXECUTION_ERROR,
                executor.execute("SELECT `Nation` FROM `Other Table`", table).getFailureKind());
    }

    @Test
    void testMalformedProgramIsParseError() {
        ExecutionOutcome outcome = executor.execute("SELEC `Nation` FROM w", table);
        assertTrue(outcome.isFailure());
        assertEquals(FailureKind.PARSE_ERROR, outcome.getFailureKind());
        assertTrue(outcome.getValues().isEmpty());
    }

    @Test
    void testMapLeafBecomesColumn() {
        oracle.answers.put("is it in europe?", Arrays.asList("yes", "yes", "yes", "no"));
        ExecutionOutcome outcome = executor.execute(
                "SELECT `Nation` FROM w WHERE QA(\"map@is it in europe?\"; `Nation`) = 'yes'", table);
        assertEquals(List.of("Spain", "France", "Italy"), outcome.getValues());
        assertEquals(1, oracle.questions.size());
    }

    @Test
    void testAnswerLeafBindsScalar() {
        oracle.answers.put("which nation hosted?", List.of("Spain"));
        ExecutionOutcome outcome = executor.execute(
                "SELECT `Gold` FROM w WHERE `Nation` = QA(\"ans@which nation hosted?\"; `Nation`)", table);
        assertEquals(List.of("13"), outcome.getValues());
    }

    @Test
    void testAnswerLeafWithSeveralValuesWorksWithIn() {
        oracle.answers.put("which nations are in europe?", List.of("Spain", "France"));
        ExecutionOutcome outcome = executor.execute(
                "SELECT `Gold` FROM w WHERE `Nation` IN (QA(\"ans@which nations are in europe?\"))", table);
        assertEquals(List.of("13", "8"), outcome.getValues());
    }

    @Test
    void testRowIndependentProjectionYieldsOneRow() {
        oracle.answers.put("how many nations?", List.of("4"));
        ExecutionOutcome outcome = executor.execute("SELECT QA(\"ans@how many nations?\") FROM w", table);
        assertEquals(List.of("4"), outcome.getValues());
    }

    @Test
    void testWholeQueryFallbackAsksExampleQuestion() {
        oracle.answers.put("how many gold medals did spain win?", List.of("13"));
        ExecutionOutcome outcome = executor.execute("QA(\"ans@gold of spain?\"; `Gold`)", table,
                "How many gold medals did Spain win?");
        assertEquals(List.of("13"), outcome.getValues());
        assertEquals(List.of("How many gold medals did Spain win?"), oracle.questions);
    }

    @Test
    void testWrongNumberOfMapAnswersIsOracleError() {
        oracle.answers.put("is it in europe?", List.of("yes", "no"));
        ExecutionOutcome outcome = executor.execute(
                "SELECT `Nation` FROM w WHERE QA(\"map@is it in europe?\"; `Nation`) = 'yes'", table);
        assertEquals(FailureKind.ORACLE_ERROR, outcome.getFailureKind());
    }

    @Test
    void testOracleFailureIsOracleError() {
        ExecutionOutcome outcome = executor.execute(
                "SELECT `Nation` FROM w WHERE `Nation` = QA(\"ans@unanswerable?\")", table);
        assertEquals(FailureKind.ORACLE_ERROR, outcome.getFailureKind());
    }

    @Test
    void testExecutionIsDeterministic() {
        String program = "SELECT `Nation`, `Gold` FROM w WHERE `Silver` = 5 ORDER BY `Nation`";
        assertEquals(executor.execute(program, table), executor.execute(program, table));
        assertEquals(List.of("France", "8", "Italy", "6"), executor.execute(program, table).getValues());
    }

    /** Answers from a fixed map keyed by the lower-cased question without its marker. */
    private static class FakeOracle implements AnswerOracle {
        final Map<String, List<Object>> answers = new HashMap<>();
        final List<String> questions = new ArrayList<>();

        @Override
        public List<Object> answer(String question, TableStore table, List<String> hintColumns)
                throws OracleException {
            questions.add(question);
            List<Object> answer = answers.get(NeuralLeaf.stripMarker(question).toLowerCase());
            if (answer == null) {
                throw new OracleException("no answer for " + question);
            }
            return answer;
        }
    }
}

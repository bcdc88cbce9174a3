package com.nsqlexec;

import com.nsqlexec.exec.FailureKind;
import com.nsqlexec.exec.QueryExecutionException;
import com.nsqlexec.program.ProgramParser;
import com.nsqlexec.program.ast.HybridQuery;
import com.nsqlexec.program.ast.NeuralLeaf;
import com.nsqlexec.program.ast.ProgramNode;
import com.nsqlexec.program.ast.WholeQueryFallback;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProgramParserTest {

    private ProgramParser parser;

    @BeforeEach
    void setUp() {
        parser = new ProgramParser();
    }

    @Test
    void testParsePlainQuery() throws Exception {
        ProgramNode node = parser.parse("SELECT `Nation` FROM w WHERE `Gold` > 5 ORDER BY `Gold` DESC LIMIT 1;");
        assertTrue(node instanceof HybridQuery);
        assertTrue(((HybridQuery) node).getLeaves().isEmpty());
    }

    @Test
    void testIdenticalQaCallsShareOneLeaf() throws Exception {
        ProgramNode node = parser.parse("SELECT `Nation` FROM w WHERE QA(\"map@in europe?\"; `Nation`) = 'yes' "
                + "AND QA(\"map@in europe?\"; `Nation`) IS NOT NULL");
        List<NeuralLeaf> leaves = ((HybridQuery) node).getLeaves();
        assertEquals(1, leaves.size());
        NeuralLeaf leaf = leaves.get(0);
        assertEquals(ProgramParser.PLACEHOLDER_PREFIX + "0", leaf.getPlaceholder());
        assertEquals(NeuralLeaf.Kind.MAP, leaf.getKind());
        assertEquals("in europe?", leaf.getQuestionText());
        assertEquals(List.of("Nation"), leaf.getHintColumns());
    }

    @Test
    void testDistinctQaCallsGetTheirOwnLeaves() throws Exception {
        ProgramNode node = parser.parse("SELECT `Nation` FROM w WHERE QA('map@in europe?', `Nation`) = 'yes' "
                + "AND `Gold` > QA('ans@gold medals of italy?'; `Nation`; `Gold`)");
        List<NeuralLeaf> leaves = ((HybridQuery) node).getLeaves();
        assertEquals(2, leaves.size());
        assertEquals(NeuralLeaf.Kind.MAP, leaves.get(0).getKind());
        assertEquals(NeuralLeaf.Kind.ANSWER, leaves.get(1).getKind());
        assertEquals(List.of("Nation", "Gold"), leaves.get(1).getHintColumns());
    }

    @Test
    void testQaWithoutMarkerIsAnAnswerLeaf() {
        assertEquals(NeuralLeaf.Kind.ANSWER, NeuralLeaf.kindOf("who won?"));
        assertEquals(NeuralLeaf.Kind.MAP, NeuralLeaf.kindOf(" MAP@country?"));
        assertEquals("country?", NeuralLeaf.stripMarker("map@ country?"));
    }

    @Test
    void testLoneAnswerQaIsWholeQueryFallback() throws Exception {
        ProgramNode node = parser.parse("QA(\"ans@how many nations won gold?\"; `Nation`; `Gold`)");
        assertTrue(node instanceof WholeQueryFallback);
        WholeQueryFallback fallback = (WholeQueryFallback) node;
        assertEquals("how many nations won gold?", fallback.getQuestion());
        assertEquals(List.of("Nation", "Gold"), fallback.getHintColumns());
    }

    @Test
    void testLoneMapQaIsNotAQuery() {
        QueryExecutionException e = assertThrows(QueryExecutionException.class,
                () -> parser.parse("QA(\"map@in europe?\"; `Nation`)"));
        assertEquals(FailureKind.PARSE_ERROR, e.getKind());
    }

    @Test
    void testParseErrors() {
        assertParseError("");
        assertParseError("   ;");
        assertParseError("SELEC `Nation` FROM w");
        assertParseError("SELECT `Nation` FROM w WHERE QA(\"ans@unterminated\"; `Nation`");
        assertParseError("SELECT `Nation` FROM w WHERE QA(`Nation`) = 'x'");
        assertParseError("SELECT a.x FROM a JOIN b ON a.x = b.x");
        assertParseError("SELECT `Nation` FROM w WHERE COUNT(*) > 1");
        assertParseError("SELECT `Nation` FROM w UNION SELECT `Nation` FROM w");
    }

    private void assertParseError(String program) {
        QueryExecutionException e = assertThrows(QueryExecutionException.class, () -> parser.parse(program));
        assertEquals(FailureKind.PARSE_ERROR, e.getKind(), program);
    }
}

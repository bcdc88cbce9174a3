package com.nsqlexec;

import com.nsqlexec.program.QueryNormalizer;
import com.nsqlexec.table.TableStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryNormalizerTest {

    private QueryNormalizer normalizer;
    private TableStore medals;
    private TableStore matches;

    @BeforeEach
    void setUp() {
        normalizer = new QueryNormalizer();
        medals = TableStore.of("Medal Table", List.of("Nation", "Gold"), List.of(
                List.of("Spain", "13"),
                List.of("France", "8")));
        matches = TableStore.of("Season 2004", List.of("Home Team", "Score"), List.of(
                List.of("Lions", "2-1"),
                List.of("Tigers", "0-0")));
    }

    @Test
    void testBareColumnsAndTableAliasAreQuoted() {
        assertEquals("SELECT `Nation` FROM `Medal Table` WHERE `Gold` > 5",
                normalizer.normalize("SELECT nation FROM w WHERE gold > 5", medals));
    }

    @Test
    void testQuotedColumnIsRewrittenToClosestColumn() {
        assertEquals("SELECT `Nation` FROM `Medal Table`",
                normalizer.normalize("SELECT `nations` FROM w", medals));
    }

    @Test
    void testAliasesAreLeftAlone() {
        assertEquals("SELECT `Gold` AS medals FROM `Medal Table` ORDER BY medals DESC",
                normalizer.normalize("SELECT gold AS medals FROM w ORDER BY medals DESC", medals));
    }

    @Test
    void testMultiWordColumnIsQuoted() {
        assertEquals("SELECT `Score` FROM `Season 2004` WHERE `Home Team` = 'Lions'",
                normalizer.normalize("SELECT score FROM w WHERE home team = 'Lions'", matches));
    }

    @Test
    void testComparedLiteralIsRepairedToCellValue() {
        assertEquals("SELECT `Score` FROM `Season 2004` WHERE `Home Team` = 'Lions'",
                normalizer.normalize("SELECT `Score` FROM w WHERE `Home Team` = 'lions'", matches));
        assertEquals("SELECT `Score` FROM `Season 2004` WHERE `Home Team` != 'Tigers'",
                normalizer.normalize("SELECT `Score` FROM w WHERE `Home Team` != 'Tiger'", matches));
    }

    @Test
    void testDoubleQuotedTokensBecomeIdentifiersOrStrings() {
        assertEquals("SELECT `Score` FROM `Season 2004` WHERE `Home Team` = 'Lions'",
                normalizer.normalize("SELECT \"Score\" FROM w WHERE \"Home Team\" = \"Lions\"", matches));
    }

    @Test
    void testQaQuestionIsNotRewritten() {
        assertEquals("SELECT QA(\"map@is nation in europe?\"; `Nation`) FROM `Medal Table`",
                normalizer.normalize("SELECT QA(\"map@is nation in europe?\"; nation) FROM w", medals));
    }

    @Test
    void testUnknownNamesAreKept() {
        assertEquals("SELECT `population` FROM `Medal Table`",
                normalizer.normalize("SELECT `population` FROM w", medals));
    }

    @Test
    void testNormalizationNeverFails() {
        assertEquals("", normalizer.normalize(null, medals));
        assertNotNull(normalizer.normalize("SELECT FROM WHERE (( 'unterminated", medals));
        assertNotNull(normalizer.normalize("QA(", medals));
    }

    @Test
    void testNormalizationIsIdempotent() {
        String once = normalizer.normalize("SELECT nation FROM w WHERE gold > 5", medals);
        assertEquals(once, normalizer.normalize(once, medals));
    }
}

package com.nsqlexec;

import com.nsqlexec.data.ProgramFileLoader;
import com.nsqlexec.program.CandidateProgram;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProgramFileLoaderTest {

    @TempDir
    Path tempDir;

    private ProgramFileLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ProgramFileLoader();
    }

    private Path write(String json) throws IOException {
        Path file = tempDir.resolve("programs.json");
        Files.writeString(file, json);
        return file;
    }

    @Test
    void testGenerationsAreRankedInFileOrder() throws IOException {
        Map<String, List<CandidateProgram>> programs = loader.load(write("""
                {
                  "0": {"generations": [["SELECT a FROM w", -0.5], ["SELECT b FROM w", -1.25]]},
                  "1": {"generations": [["SELECT c FROM w", "what is c?", -0.75]]}
                }
                """));

        assertEquals(List.of("0", "1"), List.copyOf(programs.keySet()));
        List<CandidateProgram> first = programs.get("0");
        assertEquals(2, first.size());
        assertEquals("SELECT a FROM w", first.get(0).getText());
        assertEquals(0, first.get(0).getRank());
        assertEquals(-0.5, first.get(0).getScore(), 1e-9);
        assertEquals(1, first.get(1).getRank());
        assertEquals(-1.25, first.get(1).getScore(), 1e-9);

        CandidateProgram triple = programs.get("1").get(0);
        assertEquals("SELECT c FROM w", triple.getText());
        assertEquals(-0.75, triple.getScore(), 1e-9);
    }

    @Test
    void testMissingGenerationsYieldDummyProgram() throws IOException {
        Map<String, List<CandidateProgram>> programs = loader.load(write("""
                {"0": {"generations": []}, "1": {}}
                """));

        for (String eid : List.of("0", "1")) {
            List<CandidateProgram> candidates = programs.get(eid);
            assertEquals(1, candidates.size());
            assertEquals(ProgramFileLoader.DUMMY_PROGRAM, candidates.get(0).getText());
            assertEquals(0, candidates.get(0).getRank());
        }
    }

    @Test
    void testUnreadableScoreIsNaN() throws IOException {
        Map<String, List<CandidateProgram>> programs = loader.load(write("""
                {"0": {"generations": [["SELECT a FROM w", null], ["SELECT b FROM w", "high"]]}}
                """));
        assertTrue(Double.isNaN(programs.get("0").get(0).getScore()));
        assertTrue(Double.isNaN(programs.get("0").get(1).getScore()));
    }

    @Test
    void testMalformedFileIsRejected() throws IOException {
        assertThrows(IOException.class, () -> loader.load(write("[1, 2, 3]")));
        assertThrows(IOException.class, () -> loader.load(write("{\"0\": ")));
    }
}

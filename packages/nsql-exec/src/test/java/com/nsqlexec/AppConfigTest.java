package com.nsqlexec;

import com.nsqlexec.config.ApiKeyPool;
import com.nsqlexec.config.AppConfig;
import com.nsqlexec.vote.VoteMethod;
import com.nsqlexec.vote.VotePolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testLoadOverridesDefaults() throws IOException {
        Path file = tempDir.resolve("application.yaml");
        Files.writeString(file, """
                llm:
                  model: local-model
                  api_key: secret
                  temperature: 0.4
                  max_tokens: 64
                execution:
                  workers: 8
                  save_dir: out
                vote:
                  method: answer_biased
                  allow_none_and_empty_answer: true
                  answer_placeholder: "N/A"
                  answer_biased: "yes"
                  answer_biased_weight: 2.5
                """);

        AppConfig config = AppConfig.load(file.toString());
        assertEquals("local-model", config.getLlmModel());
        assertEquals("secret", config.getLlmApiKey());
        assertEquals(0.4, config.getLlmTemperature(), 1e-9);
        assertEquals(64, config.getLlmMaxTokens());
        assertEquals(8, config.getWorkers());
        assertEquals("out", config.getSaveDir());
        assertEquals("nsql_execution", config.getCheckpointPrefix());

        VotePolicy policy = config.toVotePolicy();
        assertEquals(VoteMethod.ANSWER_BIASED, policy.getMethod());
        assertTrue(policy.isAllowNoneAndEmptyAnswer());
        assertEquals("N/A", policy.getAnswerPlaceholder());
        assertEquals("yes", policy.getBiasedAnswer());
        assertEquals(2.5, policy.getBiasedWeight(), 1e-9);
        assertFalse(policy.isBiasedOverProbability());
    }

    @Test
    void testMissingFileKeepsDefaults() {
        AppConfig config = AppConfig.load(tempDir.resolve("absent.yaml").toString());
        assertEquals(4, config.getWorkers());
        assertEquals(VoteMethod.SIMPLE, config.getVoteMethod());
        assertEquals(VotePolicy.DEFAULT_PLACEHOLDER, config.getAnswerPlaceholder());
        assertNull(config.getAnswerBiased());

        VotePolicy policy = config.toVotePolicy();
        assertEquals(VoteMethod.SIMPLE, policy.getMethod());
        assertFalse(policy.isAllowNoneAndEmptyAnswer());
    }

    @Test
    void testUnsetEnvironmentVariableResolvesToNull() throws IOException {
        Path file = tempDir.resolve("application.yaml");
        Files.writeString(file, """
                llm:
                  api_key: ${NSQL_EXEC_TEST_UNSET_VARIABLE}
                """);
        assertNull(AppConfig.load(file.toString()).getLlmApiKey());
    }

    @Test
    void testApiKeyPoolFromListAndFile() throws IOException {
        Path keys = tempDir.resolve("keys.txt");
        Files.writeString(keys, "# rate-limited keys\nkey-c\n\n key-a \n");
        Path file = tempDir.resolve("application.yaml");
        Files.writeString(file, "llm:\n"
                + "  api_key: single\n"
                + "  api_keys: [key-a, key-b]\n"
                + "  api_keys_file: " + keys + "\n");

        AppConfig config = AppConfig.load(file.toString());
        ApiKeyPool pool = config.loadApiKeyPool();
        assertEquals(3, pool.size());
        assertEquals("key-a", pool.keyFor(0));
        assertEquals("key-b", pool.keyFor(1));
        assertEquals("key-c", pool.keyFor(2));
        assertEquals("key-a", pool.keyFor(3));
        assertFalse(pool.toString().contains("key-a"));
    }

    @Test
    void testSingleApiKeyIsPoolFallback() throws IOException {
        Path file = tempDir.resolve("application.yaml");
        Files.writeString(file, """
                llm:
                  api_key: single
                """);
        ApiKeyPool pool = AppConfig.load(file.toString()).loadApiKeyPool();
        assertEquals(1, pool.size());
        assertEquals("single", pool.keyFor(5));
    }

    @Test
    void testMissingKeyFileFailsPoolLoading() throws IOException {
        Path file = tempDir.resolve("application.yaml");
        Files.writeString(file, "llm:\n  api_keys_file: " + tempDir.resolve("absent.txt") + "\n");
        AppConfig config = AppConfig.load(file.toString());
        assertThrows(IOException.class, config::loadApiKeyPool);
    }

    @Test
    void testCommandLineOverrides() {
        AppConfig config = new AppConfig();
        config.setWorkers(2);
        config.setVoteMethod(VoteMethod.PROB);
        config.setAnswerPlaceholder("-");
        assertEquals(2, config.getWorkers());
        assertEquals(VoteMethod.PROB, config.toVotePolicy().getMethod());
        assertEquals("-", config.toVotePolicy().getAnswerPlaceholder());
    }
}

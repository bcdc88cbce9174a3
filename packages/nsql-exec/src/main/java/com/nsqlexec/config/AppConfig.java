package com.nsqlexec.config;

import com.nsqlexec.vote.VoteMethod;
import com.nsqlexec.vote.VotePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    private String llmEndpoint;
    private String llmModel;
    private String llmApiKey;
    private List<String> llmApiKeys;
    private String llmApiKeysFile;
    private double llmTemperature;
    private int llmMaxTokens;
    private int llmTimeoutSeconds;
    private int workers;
    private String saveDir;
    private String checkpointPrefix;
    private String outputFile;
    private VoteMethod voteMethod;
    private boolean allowNoneAndEmptyAnswer;
    private String answerPlaceholder;
    private String answerBiased;
    private double answerBiasedWeight;
    private boolean biasedOverProbability;
    private boolean verbose;

    private static final String DEFAULT_CONFIG_PATH = "config/application.yaml";

    public AppConfig() {
        // Set defaults
        this.llmEndpoint = "https://api.openai.com/v1/chat/completions";
        this.llmModel = "gpt-4o-mini";
        this.llmApiKey = System.getenv("OPENAI_API_KEY");
        this.llmApiKeys = new ArrayList<>();
        this.llmApiKeysFile = null;
        this.llmTemperature = 0.0;
        this.llmMaxTokens = 512;
        this.llmTimeoutSeconds = 120;
        this.workers = 4;
        this.saveDir = "results";
        this.checkpointPrefix = "nsql_execution";
        this.outputFile = "nsql_execution.json";
        this.voteMethod = VoteMethod.SIMPLE;
        this.allowNoneAndEmptyAnswer = false;
        this.answerPlaceholder = VotePolicy.DEFAULT_PLACEHOLDER;
        this.answerBiased = null;
        this.answerBiasedWeight = 1.0;
        this.biasedOverProbability = false;
        this.verbose = false;
    }

    public static AppConfig load(String configPath) {
        AppConfig config = new AppConfig();

        Path path = configPath != null ? Path.of(configPath) : Path.of(DEFAULT_CONFIG_PATH);

        if (!Files.exists(path) && configPath == null) {
            // Try to find config relative to jar location
            String jarDir = AppConfig.class.getProtectionDomain().getCodeSource().getLocation().getPath();
            Path parent = Path.of(jarDir).getParent();
            if (parent != null) {
                path = parent.resolve(DEFAULT_CONFIG_PATH);
            }
        }

        if (Files.exists(path)) {
            try (InputStream is = new FileInputStream(path.toFile())) {
                Yaml yaml = new Yaml();
                Map<String, Object> data = yaml.load(is);
                config.parseConfig(data);
            } catch (IOException e) {
                logger.warn("Could not load config file {}: {}", path, e.getMessage());
            }
        } else if (configPath != null) {
            logger.warn("Config file {} not found, using defaults", configPath);
        }

        return config;
    }

    @SuppressWarnings("unchecked")
    void parseConfig(Map<String, Object> data) {
        if (data == null) return;

        // LLM config
        Map<String, Object> llm = (Map<String, Object>) data.get("llm");
        if (llm != null) {
            if (llm.get("endpoint") != null) {
                this.llmEndpoint = (String) llm.get("endpoint");
            }
            if (llm.get("model") != null) {
                this.llmModel = (String) llm.get("model");
            }
            if (llm.get("api_key") != null) {
                this.llmApiKey = resolveEnv((String) llm.get("api_key"));
            }
            if (llm.get("api_keys") instanceof List) {
                this.llmApiKeys = new ArrayList<>();
                for (Object key : (List<Object>) llm.get("api_keys")) {
                    if (key != null) {
                        this.llmApiKeys.add(resolveEnv(key.toString()));
                    }
                }
            }
            if (llm.get("api_keys_file") != null) {
                this.llmApiKeysFile = resolveEnv(llm.get("api_keys_file").toString());
            }
            if (llm.get("temperature") != null) {
                this.llmTemperature = ((Number) llm.get("temperature")).doubleValue();
            }
            if (llm.get("max_tokens") != null) {
                this.llmMaxTokens = ((Number) llm.get("max_tokens")).intValue();
            }
            if (llm.get("timeout_seconds") != null) {
                this.llmTimeoutSeconds = ((Number) llm.get("timeout_seconds")).intValue();
            }
        }

        // Execution config
        Map<String, Object> execution = (Map<String, Object>) data.get("execution");
        if (execution != null) {
            if (execution.get("workers") != null) {
                this.workers = ((Number) execution.get("workers")).intValue();
            }
            if (execution.get("save_dir") != null) {
                this.saveDir = (String) execution.get("save_dir");
            }
            if (execution.get("checkpoint_prefix") != null) {
                this.checkpointPrefix = (String) execution.get("checkpoint_prefix");
            }
            if (execution.get("output_file") != null) {
                this.outputFile = (String) execution.get("output_file");
            }
        }

        // Vote config
        Map<String, Object> vote = (Map<String, Object>) data.get("vote");
        if (vote != null) {
            if (vote.get("method") != null) {
                this.voteMethod = VoteMethod.valueOf(vote.get("method").toString().toUpperCase(Locale.ROOT));
            }
            if (vote.get("allow_none_and_empty_answer") != null) {
                this.allowNoneAndEmptyAnswer = (Boolean) vote.get("allow_none_and_empty_answer");
            }
            if (vote.get("answer_placeholder") != null) {
                this.answerPlaceholder = vote.get("answer_placeholder").toString();
            }
            if (vote.get("answer_biased") != null) {
                this.answerBiased = vote.get("answer_biased").toString();
            }
            if (vote.get("answer_biased_weight") != null) {
                this.answerBiasedWeight = ((Number) vote.get("answer_biased_weight")).doubleValue();
            }
            if (vote.get("biased_over_probability") != null) {
                this.biasedOverProbability = (Boolean) vote.get("biased_over_probability");
            }
        }

        // Output config
        Map<String, Object> output = (Map<String, Object>) data.get("output");
        if (output != null) {
            if (output.get("verbose") != null) {
                this.verbose = (Boolean) output.get("verbose");
            }
        }
    }

    // Support environment variable substitution
    private static String resolveEnv(String value) {
        if (value.startsWith("${") && value.endsWith("}")) {
            String envVar = value.substring(2, value.length() - 1);
            return System.getenv(envVar);
        }
        return value;
    }

    /**
     * The keys listed under {@code llm.api_keys} and in {@code llm.api_keys_file}. When neither
     * names a key, the pool holds the single {@code llm.api_key}, if any.
     *
     * @throws IOException if the key file cannot be read
     */
    public ApiKeyPool loadApiKeyPool() throws IOException {
        ApiKeyPool pool = ApiKeyPool.of(llmApiKeys);
        if (llmApiKeysFile != null) {
            pool = pool.plus(ApiKeyPool.load(Path.of(llmApiKeysFile)));
        }
        if (pool.isEmpty() && llmApiKey != null) {
            pool = ApiKeyPool.of(List.of(llmApiKey));
        }
        return pool;
    }

    public VotePolicy toVotePolicy() {
        VotePolicy policy = VotePolicy.of(voteMethod)
                .withAllowNoneAndEmptyAnswer(allowNoneAndEmptyAnswer)
                .withAnswerPlaceholder(answerPlaceholder);
        if (answerBiased != null) {
            policy = policy.withBiasedAnswer(answerBiased, answerBiasedWeight, biasedOverProbability);
        }
        return policy;
    }

    // Getters
    public String getLlmEndpoint() { return llmEndpoint; }
    public String getLlmModel() { return llmModel; }
    public String getLlmApiKey() { return llmApiKey; }
    public List<String> getLlmApiKeys() { return Collections.unmodifiableList(llmApiKeys); }
    public String getLlmApiKeysFile() { return llmApiKeysFile; }
    public double getLlmTemperature() { return llmTemperature; }
    public int getLlmMaxTokens() { return llmMaxTokens; }
    public int getLlmTimeoutSeconds() { return llmTimeoutSeconds; }
    public int getWorkers() { return workers; }
    public String getSaveDir() { return saveDir; }
    public String getCheckpointPrefix() { return checkpointPrefix; }
    public String getOutputFile() { return outputFile; }
    public VoteMethod getVoteMethod() { return voteMethod; }
    public boolean isAllowNoneAndEmptyAnswer() { return allowNoneAndEmptyAnswer; }
    public String getAnswerPlaceholder() { return answerPlaceholder; }
    public String getAnswerBiased() { return answerBiased; }
    public double getAnswerBiasedWeight() { return answerBiasedWeight; }
    public boolean isBiasedOverProbability() { return biasedOverProbability; }
    public boolean isVerbose() { return verbose; }

    // Setters for CLI overrides
    public void setWorkers(int workers) { this.workers = workers; }
    public void setSaveDir(String saveDir) { this.saveDir = saveDir; }
    public void setVoteMethod(VoteMethod voteMethod) { this.voteMethod = voteMethod; }
    public void setAllowNoneAndEmptyAnswer(boolean allow) { this.allowNoneAndEmptyAnswer = allow; }
    public void setAnswerPlaceholder(String placeholder) { this.answerPlaceholder = placeholder; }
    public void setAnswerBiased(String answer) { this.answerBiased = answer; }
    public void setAnswerBiasedWeight(double weight) { this.answerBiasedWeight = weight; }
    public void setVerbose(boolean verbose) { this.verbose = verbose; }
}

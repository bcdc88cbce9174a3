package com.nsqlexec.cli;

import com.nsqlexec.config.ApiKeyPool;
import com.nsqlexec.config.AppConfig;
import com.nsqlexec.data.CheckpointWriter;
import com.nsqlexec.data.DatasetLoader;
import com.nsqlexec.data.Example;
import com.nsqlexec.data.ProgramFileLoader;
import com.nsqlexec.data.ResultWriter;
import com.nsqlexec.eval.DefaultAnswerEvaluator;
import com.nsqlexec.exec.HybridExecutor;
import com.nsqlexec.llm.ChatClient;
import com.nsqlexec.llm.LlmAnswerOracle;
import com.nsqlexec.program.CandidateProgram;
import com.nsqlexec.program.QueryNormalizer;
import com.nsqlexec.runner.ExampleProcessor;
import com.nsqlexec.runner.PartitionedRunner;
import com.nsqlexec.runner.RunSummary;
import com.nsqlexec.runner.WorkerContext;
import com.nsqlexec.runner.WorkerContextFactory;
import com.nsqlexec.vote.ConsensusAggregator;
import com.nsqlexec.vote.VotePolicy;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "execute",
        description = "Execute the generated programs of a dataset and vote on their answers"
)
public class ExecuteCommand implements Callable<Integer> {

    @ParentCommand
    private MainCommand parent;

    @Parameters(index = "0", description = "Dataset file (JSON array of examples)")
    private Path datasetFile;

    @Parameters(index = "1", description = "Generated program file (JSON keyed by eid)")
    private Path programFile;

    @Option(names = {"-w", "--workers"}, description = "Number of workers")
    private Integer workers;

    @Option(names = {"--save-dir"}, description = "Directory for checkpoints and the output file")
    private String saveDir;

    @Option(names = {"--limit"}, description = "Only process the first N examples")
    private Integer limit;

    @Mixin
    private VoteOptions voteOptions;

    @Override
    public Integer call() {
        try {
            // Load configuration
            AppConfig config = AppConfig.load(parent.getConfigPath());
            if (workers != null) {
                config.setWorkers(workers);
            }
            if (saveDir != null) {
                config.setSaveDir(saveDir);
            }
            voteOptions.applyTo(config);
            if (parent.isVerbose()) {
                config.setVerbose(true);
            }

            // Check API keys
            ApiKeyPool apiKeys = config.loadApiKeyPool();
            if (apiKeys.isEmpty()) {
                System.err.println("Error: LLM API key not configured.");
                System.err.println("Set the OPENAI_API_KEY environment variable or configure llm.api_key, "
                        + "llm.api_keys or llm.api_keys_file in application.yaml");
                return 1;
            }

            Map<String, List<CandidateProgram>> programs = new ProgramFileLoader().load(programFile);
            List<Example> examples = new DatasetLoader().load(datasetFile, programs);
            if (limit != null && limit < examples.size()) {
                examples = examples.subList(0, limit);
            }
            if (examples.isEmpty()) {
                System.err.println("Error: No example of " + datasetFile + " has programs in " + programFile);
                return 1;
            }

            VotePolicy policy = config.toVotePolicy();
            WorkerContextFactory contexts = workerId -> new WorkerContext(workerId,
                    new QueryNormalizer(),
                    new HybridExecutor(new LlmAnswerOracle(ChatClient.forWorker(config, apiKeys, workerId))),
                    new ConsensusAggregator(),
                    policy);

            Path saveDirPath = Path.of(config.getSaveDir());
            PartitionedRunner runner = new PartitionedRunner(config.getWorkers(), contexts, new ExampleProcessor(),
                    new DefaultAnswerEvaluator(), new CheckpointWriter(saveDirPath, config.getCheckpointPrefix()));

            long start = System.currentTimeMillis();
            RunSummary summary = runner.run(examples);
            long elapsed = System.currentTimeMillis() - start;

            Path output = saveDirPath.resolve(config.getOutputFile());
            new ResultWriter().write(output, summary);

            System.out.println("=".repeat(60));
            System.out.println("EXECUTION RESULT");
            System.out.println("=".repeat(60));
            System.out.println("Vote policy:       " + policy);
            System.out.println("Examples:          " + summary.getTotal());
            System.out.println("Failed examples:   " + summary.getFailedExamples());
            System.out.println(summary.format());
            System.out.println("Output:            " + output);
            System.out.printf("Done. Elapsed time: %.1f s%n", elapsed / 1000.0);
            return 0;

        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            if (parent.isVerbose()) {
                e.printStackTrace();
            }
            return 1;
        }
    }
}

package com.nsqlexec.cli;

import com.nsqlexec.config.AppConfig;
import com.nsqlexec.data.CheckpointReader;
import com.nsqlexec.data.ResultWriter;
import com.nsqlexec.eval.DefaultAnswerEvaluator;
import com.nsqlexec.runner.ExampleResult;
import com.nsqlexec.runner.RunSummary;
import com.nsqlexec.vote.ConsensusAggregator;
import com.nsqlexec.vote.VotePolicy;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "vote",
        description = "Vote again on the outcomes stored in worker checkpoints, without executing programs"
)
public class VoteCommand implements Callable<Integer> {

    @ParentCommand
    private MainCommand parent;

    @Parameters(index = "0", description = "Directory holding the <prefix>_tmp_<worker>.json checkpoints")
    private Path checkpointDir;

    @Option(names = {"--prefix"}, description = "Checkpoint file prefix (default: from configuration)")
    private String prefix;

    @Option(names = {"-o", "--output"}, description = "Write the re-voted results to this file")
    private Path output;

    @Mixin
    private VoteOptions voteOptions;

    @Override
    public Integer call() {
        try {
            AppConfig config = AppConfig.load(parent.getConfigPath());
            voteOptions.applyTo(config);

            if (!Files.isDirectory(checkpointDir)) {
                System.err.println("Error: Checkpoint directory not found: " + checkpointDir);
                return 1;
            }

            VotePolicy policy = config.toVotePolicy();
            CheckpointReader reader = new CheckpointReader(new ConsensusAggregator(), policy);
            List<ExampleResult> results = reader.readAll(checkpointDir,
                    prefix != null ? prefix : config.getCheckpointPrefix());
            if (results.isEmpty()) {
                System.err.println("Error: No checkpoints found in " + checkpointDir);
                return 1;
            }

            RunSummary summary = RunSummary.score(results, new DefaultAnswerEvaluator());
            if (parent.isVerbose()) {
                for (ExampleResult result : summary.getResults()) {
                    System.out.printf("eid %s: %s (gold %s) %s%n", result.getEid(),
                            result.getConsensus().getAnswer(), result.getGoldAnswer(),
                            summary.getScore(result.getEid()) == 1 ? "correct" : "wrong");
                }
            }
            System.out.println("Vote policy: " + policy);
            System.out.println(summary.format());

            if (output != null) {
                new ResultWriter().write(output, summary);
                System.out.println("Output: " + output);
            }
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

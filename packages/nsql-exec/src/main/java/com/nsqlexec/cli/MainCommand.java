package com.nsqlexec.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "nsql-exec",
        description = "Execute hybrid NSQL programs and vote on their answers",
        mixinStandardHelpOptions = true,
        version = "NsqlExec 1.0.0",
        subcommands = {
                ExecuteCommand.class,
                VoteCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class MainCommand implements Runnable {

    @Option(names = {"-c", "--config"}, description = "Configuration file path")
    String configPath;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    boolean verbose;

    @Override
    public void run() {
        // If no subcommand specified, show help
        CommandLine.usage(this, System.out);
    }

    public String getConfigPath() { return configPath; }
    public boolean isVerbose() { return verbose; }
}

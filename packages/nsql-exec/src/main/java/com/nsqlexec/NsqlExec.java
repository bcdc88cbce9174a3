package com.nsqlexec;

import com.nsqlexec.cli.MainCommand;
import picocli.CommandLine;

/**
 * NsqlExec - executes generated hybrid NSQL programs over single tables and reconciles their
 * answers by majority vote.
 *
 * Relational parts are parsed with Apache Calcite and evaluated in memory; neural sub-queries
 * are answered by an OpenAI-compatible chat model.
 */
public class NsqlExec {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}

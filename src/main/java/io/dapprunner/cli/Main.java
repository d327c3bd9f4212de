package io.dapprunner.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new DappRunnerCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}

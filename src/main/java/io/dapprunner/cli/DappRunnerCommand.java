package io.dapprunner.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "dapp-runner",
    description = "Run multi-node applications described in YAML on a compute marketplace.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = { StartCommand.class, VerifyCommand.class }
)
final class DappRunnerCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}

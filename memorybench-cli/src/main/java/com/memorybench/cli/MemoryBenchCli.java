package com.memorybench.cli;

import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(name = "memorybench",
        mixinStandardHelpOptions = true,
        version = "memorybench 1.0.0",
        description = "Memory provider benchmark harness",
        subcommands = {CommandLine.HelpCommand.class, ListCommand.class})
public class MemoryBenchCli implements Callable<Integer> {

    /** Exit code for a missing providers directory and for usage errors. */
    static final int EXIT_USAGE = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return EXIT_USAGE;
    }

    static CommandLine commandLine() {
        return new CommandLine(new MemoryBenchCli())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}

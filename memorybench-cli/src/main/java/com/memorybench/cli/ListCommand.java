package com.memorybench.cli;

import picocli.CommandLine;

import java.util.concurrent.Callable;

@CommandLine.Command(name = "list",
        mixinStandardHelpOptions = true,
        description = "List registered resources",
        subcommands = {ListProvidersCommand.class})
class ListCommand implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return MemoryBenchCli.EXIT_USAGE;
    }
}

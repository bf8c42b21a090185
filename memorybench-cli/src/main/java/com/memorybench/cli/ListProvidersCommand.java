package com.memorybench.cli;

import com.memorybench.config.MemoryBenchConfig;
import com.memorybench.registry.ProviderLoadError;
import com.memorybench.registry.ProviderLoadWarning;
import com.memorybench.registry.ProviderRegistry;
import com.memorybench.registry.ProviderRegistryResult;
import com.memorybench.registry.ProvidersDirectoryNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Loads every provider under {@code <base-dir>/providers} and prints the registered ones.
 * Load warnings and errors go to stderr and never change the exit code.
 */
@CommandLine.Command(name = "providers",
        mixinStandardHelpOptions = true,
        description = "List the memory providers found under <base-dir>/providers")
class ListProvidersCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListProvidersCommand.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"--json"}, description = "Print providers as JSON")
    private boolean json;

    @CommandLine.Option(names = {"--base-dir"}, paramLabel = "DIR",
            description = "Directory containing providers/ (default: $MEMORYBENCH_BASE_DIR or the working directory)")
    private Path baseDir;

    private final MemoryBenchConfig config;

    ListProvidersCommand() {
        this(MemoryBenchConfig.fromEnvironment());
    }

    ListProvidersCommand(MemoryBenchConfig config) {
        this.config = config;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        MemoryBenchConfig effective = baseDir != null ? config.withBaseDir(baseDir) : config;
        log.debug("Listing providers from {}", effective.getBaseDir());

        ProviderRegistryResult result;
        try {
            result = new ProviderRegistry(effective).initialize();
        } catch (ProvidersDirectoryNotFoundException e) {
            err.println(e.getMessage());
            err.flush();
            return MemoryBenchCli.EXIT_USAGE;
        }

        for (ProviderLoadWarning warning : result.getWarnings()) {
            err.println(warning.format());
        }
        for (ProviderLoadError error : result.getErrors()) {
            err.println(error.format());
        }
        err.flush();

        out.println(json
                ? ProviderListFormatter.formatJson(result.getProviders())
                : ProviderListFormatter.formatTable(result.getProviders()));
        out.flush();
        return 0;
    }
}

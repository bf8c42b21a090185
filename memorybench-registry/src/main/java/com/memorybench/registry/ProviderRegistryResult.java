package com.memorybench.registry;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of one registry initialization: what loaded, plus every warning and error, in the order
 * the candidates were processed.
 */
public final class ProviderRegistryResult {

    private final List<LoadedProviderEntry> providers;
    private final List<ProviderLoadWarning> warnings;
    private final List<ProviderLoadError> errors;

    public ProviderRegistryResult(List<LoadedProviderEntry> providers, List<ProviderLoadWarning> warnings,
                                  List<ProviderLoadError> errors) {
        this.providers = List.copyOf(providers);
        this.warnings = List.copyOf(warnings);
        this.errors = List.copyOf(errors);
    }

    public List<LoadedProviderEntry> getProviders() {
        return providers;
    }

    public List<ProviderLoadWarning> getWarnings() {
        return warnings;
    }

    public List<ProviderLoadError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<ProviderLoadWarning> warningsWithCode(ProviderLoadWarning.Code code) {
        return warnings.stream().filter(w -> w.code() == code).collect(Collectors.toList());
    }

    public List<ProviderLoadError> errorsWithCode(ProviderLoadError.Code code) {
        return errors.stream().filter(e -> e.code() == code).collect(Collectors.toList());
    }

    /** "N loaded, W warnings, E errors". */
    public String summary() {
        return providers.size() + " loaded, " + warnings.size() + " warnings, " + errors.size() + " errors";
    }

    @Override
    public String toString() {
        return "ProviderRegistryResult{" + summary() + "}";
    }
}

package com.memorybench.registry;

import com.memorybench.capability.OptionalOperation;
import com.memorybench.capability.OptionalOperations;
import com.memorybench.provider.ProviderAdapter;
import com.memorybench.provider.ProviderOperations;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Compares the optional operations a manifest declares with the ones the adapter implements.
 * Declared but missing is fatal for the provider; implemented but undeclared is only reported.
 */
public final class CapabilityConformanceChecker {

    private CapabilityConformanceChecker() {
    }

    /**
     * Outcome of one comparison, both lists in {@link OptionalOperation} declaration order.
     *
     * @param missingDeclared   declared {@code true} in the manifest, not implemented
     * @param undeclaredPresent implemented, not declared {@code true}
     */
    public record Report(List<OptionalOperation> missingDeclared, List<OptionalOperation> undeclaredPresent) {

        public Report {
            missingDeclared = List.copyOf(missingDeclared);
            undeclaredPresent = List.copyOf(undeclaredPresent);
        }

        public boolean conforms() {
            return missingDeclared.isEmpty();
        }
    }

    public static Report check(ProviderAdapter adapter, OptionalOperations declared) {
        Set<OptionalOperation> implemented = ProviderOperations.implementedOptionalOperations(adapter);
        List<OptionalOperation> missing = new ArrayList<>();
        List<OptionalOperation> undeclared = new ArrayList<>();
        for (OptionalOperation op : OptionalOperation.values()) {
            boolean isDeclared = op.isDeclaredBy(declared);
            boolean isImplemented = implemented.contains(op);
            if (isDeclared && !isImplemented) {
                missing.add(op);
            } else if (!isDeclared && isImplemented) {
                undeclared.add(op);
            }
        }
        return new Report(missing, undeclared);
    }
}

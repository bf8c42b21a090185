package com.memorybench.registry;

import com.memorybench.capability.OptionalOperation;
import com.memorybench.capability.OptionalOperations;
import com.memorybench.registry.fixtures.UndeclaredOperationsAdapter;
import com.memorybench.registry.fixtures.ValidFullAdapter;
import com.memorybench.registry.fixtures.ValidMinimalAdapter;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CapabilityConformanceCheckerTest {

    @Test
    void check_fullAdapterMatchesFullDeclaration() {
        CapabilityConformanceChecker.Report report = CapabilityConformanceChecker.check(new ValidFullAdapter(),
                OptionalOperations.of(EnumSet.allOf(OptionalOperation.class)));

        assertTrue(report.conforms());
        assertTrue(report.undeclaredPresent().isEmpty());
    }

    @Test
    void check_declaredButMissingIsReported() {
        CapabilityConformanceChecker.Report report = CapabilityConformanceChecker.check(new ValidMinimalAdapter(),
                OptionalOperations.of(EnumSet.of(OptionalOperation.UPDATE_MEMORY, OptionalOperation.LIST_MEMORIES)));

        assertFalse(report.conforms());
        assertEquals(List.of(OptionalOperation.UPDATE_MEMORY, OptionalOperation.LIST_MEMORIES), report.missingDeclared());
    }

    @Test
    void check_presentButUndeclaredIsOnlyNoted() {
        CapabilityConformanceChecker.Report report = CapabilityConformanceChecker.check(new UndeclaredOperationsAdapter(),
                OptionalOperations.none());

        assertTrue(report.conforms());
        assertEquals(List.of(OptionalOperation.RESET_SCOPE), report.undeclaredPresent());
    }

    @Test
    void check_explicitFalseCountsAsUndeclared() {
        OptionalOperations declared = new OptionalOperations(null, null, false, null);

        CapabilityConformanceChecker.Report report = CapabilityConformanceChecker.check(new UndeclaredOperationsAdapter(), declared);

        assertEquals(List.of(OptionalOperation.RESET_SCOPE), report.undeclaredPresent());
    }
}

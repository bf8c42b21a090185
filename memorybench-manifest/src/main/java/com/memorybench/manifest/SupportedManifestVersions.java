package com.memorybench.manifest;

import java.util.List;

/** Manifest schema versions this build understands. */
public final class SupportedManifestVersions {

    /** Supported {@code manifest_version} values, oldest first. */
    public static final List<String> VERSIONS = List.of("1");

    private SupportedManifestVersions() {
    }

    public static boolean isSupported(String version) {
        return version != null && VERSIONS.contains(version);
    }

    /** "Supported versions: 1" – used as the expected value of an unsupported-version error. */
    public static String describe() {
        return "Supported versions: " + String.join(", ", VERSIONS);
    }
}

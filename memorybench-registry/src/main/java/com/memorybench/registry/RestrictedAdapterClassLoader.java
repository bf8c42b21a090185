package com.memorybench.registry;

import com.memorybench.provider.ProviderAdapter;

/**
 * Parent classloader for adapters loaded from provider-local jars. Only the contract packages are
 * visible; any other class request fails with {@link ClassNotFoundException}, including requests made
 * through reflection.
 * <p>
 * <b>Allowed:</b> {@code java.*}, {@code javax.*}, {@code com.memorybench.provider.*},
 * {@code com.memorybench.capability.*}, {@code org.slf4j.*}
 */
public final class RestrictedAdapterClassLoader extends ClassLoader {

    private static final String[] ALLOWED_PREFIXES = {
            "java.",
            "javax.",
            "com.memorybench.provider.",
            "com.memorybench.capability.",
            "org.slf4j."
    };

    private final ClassLoader contractLoader;

    public RestrictedAdapterClassLoader() {
        super(null);
        this.contractLoader = ProviderAdapter.class.getClassLoader();
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c == null) {
                if (!isAllowed(name)) {
                    throw new ClassNotFoundException("Access denied: " + name + " (provider adapters may only use "
                            + String.join("*, ", ALLOWED_PREFIXES) + "*)");
                }
                c = contractLoader.loadClass(name);
            }
            if (resolve) resolveClass(c);
            return c;
        }
    }

    static boolean isAllowed(String name) {
        for (String prefix : ALLOWED_PREFIXES) {
            if (name.startsWith(prefix)) return true;
        }
        return false;
    }
}

package com.memorybench.registry;

import com.memorybench.provider.AdapterContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.jar.Attributes;
import java.util.jar.JarFile;
import java.util.jar.Manifest;

/**
 * Loads the adapter object of one provider directory.
 * <p>
 * Supported module files, in order of preference:
 * <ul>
 *   <li>{@code index.properties}: {@code adapter.class} names the class; optional
 *       {@code adapter.classpath} lists jars relative to the provider directory. Without a classpath
 *       the class comes from the application classpath.</li>
 *   <li>{@code index.jar}: the jar manifest's {@code Adapter-Class} attribute names the class.</li>
 * </ul>
 * Jar-based adapters get a {@link URLClassLoader} whose parent is a
 * {@link RestrictedAdapterClassLoader}. The adapter object is the class's {@code public static INSTANCE}
 * field if it has one, otherwise a new instance from the public no-arg constructor.
 * <p>
 * Failures are thrown as {@link AdapterLoadException} carrying the code the registry records.
 */
public final class AdapterLoader {

    private static final Logger log = LoggerFactory.getLogger(AdapterLoader.class);

    public static final String PROPERTIES_MODULE = "index.properties";
    public static final String JAR_MODULE = "index.jar";
    public static final String PROPERTY_CLASS = "adapter.class";
    public static final String PROPERTY_CLASSPATH = "adapter.classpath";
    public static final String JAR_ATTRIBUTE = "Adapter-Class";
    public static final String INSTANCE_FIELD = "INSTANCE";

    /** Adapter object plus the contract it satisfies. */
    public record LoadedAdapter(Object instance, AdapterContract contract, Path module) {
    }

    private final int timeoutSeconds;
    private final ClassLoader applicationLoader;
    // keep references so community classloaders stay open while their adapters are registered
    private final List<URLClassLoader> communityLoaders = new ArrayList<>();

    /**
     * @param timeoutSeconds deadline for creating one adapter object; 0 for none
     */
    public AdapterLoader(int timeoutSeconds) {
        this(timeoutSeconds, AdapterLoader.class.getClassLoader());
    }

    AdapterLoader(int timeoutSeconds, ClassLoader applicationLoader) {
        this.timeoutSeconds = Math.max(0, timeoutSeconds);
        this.applicationLoader = applicationLoader;
    }

    /**
     * Picks the module to load from a candidate's {@code index.*} files.
     *
     * @throws AdapterLoadException {@code IMPORT_FAILED} if none is a supported format
     */
    public static Path selectModule(List<Path> modules) throws AdapterLoadException {
        for (String preferred : List.of(PROPERTIES_MODULE, JAR_MODULE)) {
            for (Path module : modules) {
                if (preferred.equals(String.valueOf(module.getFileName()))) return module;
            }
        }
        throw new AdapterLoadException(ProviderLoadError.Code.IMPORT_FAILED,
                "Unsupported adapter module " + (modules.isEmpty() ? "(none)" : modules.get(0))
                        + ": expected " + PROPERTIES_MODULE + " or " + JAR_MODULE);
    }

    /**
     * Loads, instantiates and classifies the adapter described by {@code module}.
     *
     * @throws AdapterLoadException on any failure; see {@link ProviderLoadError.Code}
     */
    public LoadedAdapter load(Path module) throws AdapterLoadException {
        String className;
        ClassLoader loader;
        String fileName = String.valueOf(module.getFileName());
        if (PROPERTIES_MODULE.equals(fileName)) {
            Properties props = readProperties(module);
            className = props.getProperty(PROPERTY_CLASS, "").trim();
            if (className.isEmpty()) {
                throw new AdapterLoadException(ProviderLoadError.Code.IMPORT_FAILED,
                        "Missing " + PROPERTY_CLASS + " in " + module);
            }
            String classpath = props.getProperty(PROPERTY_CLASSPATH, "").trim();
            loader = classpath.isEmpty() ? applicationLoader : communityLoader(module, classpath);
        } else if (JAR_MODULE.equals(fileName)) {
            className = readAdapterClassAttribute(module);
            loader = communityLoader(module, List.of(module));
        } else {
            throw new AdapterLoadException(ProviderLoadError.Code.IMPORT_FAILED,
                    "Unsupported adapter module " + module + ": expected " + PROPERTIES_MODULE + " or " + JAR_MODULE);
        }

        try {
            return classify(instantiateWithDeadline(className, loader, module), className, module);
        } catch (AdapterLoadException e) {
            closeIfCommunity(loader);
            throw e;
        }
    }

    private static LoadedAdapter classify(Object instance, String className, Path module) throws AdapterLoadException {
        AdapterContract contract;
        try {
            contract = AdapterContract.detect(instance).orElse(null);
        } catch (RuntimeException e) {
            throw new AdapterLoadException(ProviderLoadError.Code.INVALID_INTERFACE,
                    "Adapter " + className + " from " + module + " failed while reporting its name: " + e.getMessage(), e);
        }
        if (contract == null) {
            throw new AdapterLoadException(ProviderLoadError.Code.INVALID_INTERFACE,
                    "Adapter " + className + " from " + module
                            + " implements neither ProviderAdapter nor LegacyProvider with a non-null name");
        }
        log.debug("Loaded adapter {} ({}) from {}", className, contract, module);
        return new LoadedAdapter(instance, contract, module);
    }

    /**
     * Closes the classloader opened for {@code adapter} when it came from a jar. Call for adapters that
     * were loaded but not registered.
     */
    public void release(LoadedAdapter adapter) {
        closeIfCommunity(adapter.instance().getClass().getClassLoader());
    }

    synchronized int openCommunityLoaders() {
        return communityLoaders.size();
    }

    private synchronized void closeIfCommunity(ClassLoader loader) {
        if (!(loader instanceof URLClassLoader) || !communityLoaders.remove(loader)) return;
        try {
            ((URLClassLoader) loader).close();
        } catch (IOException e) {
            log.warn("Failed to close adapter classloader: {}", e.getMessage());
        }
    }

    /** Closes classloaders opened for jar-based adapters. Adapters loaded from them become unusable. */
    public synchronized void closeCommunityLoaders() {
        for (URLClassLoader loader : communityLoaders) {
            try {
                loader.close();
            } catch (IOException e) {
                log.warn("Failed to close adapter classloader: {}", e.getMessage());
            }
        }
        communityLoaders.clear();
    }

    private static Properties readProperties(Path module) throws AdapterLoadException {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(module)) {
            props.load(in);
        } catch (IOException | IllegalArgumentException e) {
            throw new AdapterLoadException(ProviderLoadError.Code.IMPORT_FAILED,
                    "Cannot read adapter module " + module + ": " + e.getMessage(), e);
        }
        return props;
    }

    private static String readAdapterClassAttribute(Path jar) throws AdapterLoadException {
        try (JarFile jarFile = new JarFile(jar.toFile())) {
            Manifest manifest = jarFile.getManifest();
            String className = manifest == null ? null : manifest.getMainAttributes().getValue(new Attributes.Name(JAR_ATTRIBUTE));
            if (className == null || className.isBlank()) {
                throw new AdapterLoadException(ProviderLoadError.Code.IMPORT_FAILED,
                        "Missing " + JAR_ATTRIBUTE + " attribute in META-INF/MANIFEST.MF of " + jar);
            }
            return className.trim();
        } catch (IOException e) {
            throw new AdapterLoadException(ProviderLoadError.Code.IMPORT_FAILED,
                    "Cannot open adapter jar " + jar + ": " + e.getMessage(), e);
        }
    }

    private ClassLoader communityLoader(Path module, String classpath) throws AdapterLoadException {
        Path providerDir = module.toAbsolutePath().getParent();
        List<Path> jars = new ArrayList<>();
        for (String entry : classpath.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) continue;
            Path jar = providerDir.resolve(trimmed).normalize();
            if (!jar.startsWith(providerDir)) {
                throw new AdapterLoadException(ProviderLoadError.Code.IMPORT_FAILED,
                        "Classpath entry " + trimmed + " in " + module + " points outside the provider directory");
            }
            if (!Files.isRegularFile(jar)) {
                throw new AdapterLoadException(ProviderLoadError.Code.IMPORT_FAILED,
                        "Classpath entry " + trimmed + " in " + module + " does not exist");
            }
            jars.add(jar);
        }
        return communityLoader(module, jars);
    }

    private synchronized ClassLoader communityLoader(Path module, List<Path> jars) throws AdapterLoadException {
        URL[] urls = new URL[jars.size()];
        try {
            for (int i = 0; i < jars.size(); i++) {
                urls[i] = jars.get(i).toUri().toURL();
            }
        } catch (MalformedURLException e) {
            throw new AdapterLoadException(ProviderLoadError.Code.IMPORT_FAILED,
                    "Invalid classpath for " + module + ": " + e.getMessage(), e);
        }
        URLClassLoader loader = new URLClassLoader(urls, new RestrictedAdapterClassLoader());
        communityLoaders.add(loader);
        return loader;
    }

    private Object instantiateWithDeadline(String className, ClassLoader loader, Path module) throws AdapterLoadException {
        if (timeoutSeconds == 0) {
            return instantiate(className, loader, module);
        }
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "adapter-loader");
            t.setDaemon(true);
            return t;
        });
        try {
            Future<Object> future = executor.submit(() -> instantiate(className, loader, module));
            try {
                return future.get(timeoutSeconds, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                throw new AdapterLoadException(ProviderLoadError.Code.IMPORT_FAILED,
                        "Loading adapter " + className + " from " + module + " timed out after " + timeoutSeconds + "s", e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof AdapterLoadException) {
                    throw (AdapterLoadException) e.getCause();
                }
                throw new AdapterLoadException(ProviderLoadError.Code.INITIALIZATION_FAILED,
                        "Loading adapter " + className + " from " + module + " failed: " + e.getCause(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AdapterLoadException(ProviderLoadError.Code.IMPORT_FAILED,
                        "Interrupted while loading adapter " + className + " from " + module, e);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static Object instantiate(String className, ClassLoader loader, Path module) throws AdapterLoadException {
        Class<?> type;
        try {
            type = Class.forName(className, true, loader);
        } catch (ExceptionInInitializerError e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new AdapterLoadException(ProviderLoadError.Code.INITIALIZATION_FAILED,
                    "Static initialization of " + className + " from " + module + " failed: " + cause, cause);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new AdapterLoadException(ProviderLoadError.Code.IMPORT_FAILED,
                    "Cannot load adapter class " + className + " from " + module + ": " + e.getMessage(), e);
        }

        Field instanceField = findInstanceField(type);
        try {
            if (instanceField != null) {
                Object instance = instanceField.get(null);
                if (instance == null) {
                    throw new AdapterLoadException(ProviderLoadError.Code.INVALID_INTERFACE,
                            "Adapter " + className + " from " + module + " has a null " + INSTANCE_FIELD + " field");
                }
                return instance;
            }
            Constructor<?> ctor = type.getConstructor();
            return ctor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new AdapterLoadException(ProviderLoadError.Code.INVALID_INTERFACE,
                    "Adapter " + className + " from " + module + " has neither a public static " + INSTANCE_FIELD
                            + " field nor a public no-arg constructor", e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new AdapterLoadException(ProviderLoadError.Code.INITIALIZATION_FAILED,
                    "Constructor of " + className + " from " + module + " threw: " + cause, cause);
        } catch (InstantiationException | IllegalAccessException e) {
            throw new AdapterLoadException(ProviderLoadError.Code.INVALID_INTERFACE,
                    "Cannot instantiate adapter " + className + " from " + module + ": " + e.getMessage(), e);
        }
    }

    private static Field findInstanceField(Class<?> type) {
        try {
            Field field = type.getField(INSTANCE_FIELD);
            return Modifier.isStatic(field.getModifiers()) ? field : null;
        } catch (NoSuchFieldException e) {
            return null;
        }
    }
}

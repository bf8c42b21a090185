package com.memorybench.registry;

import com.memorybench.provider.AdapterContract;
import com.memorybench.provider.ProviderAdapter;
import com.memorybench.registry.fixtures.FailingConstructorAdapter;
import com.memorybench.registry.fixtures.LegacyTemplateProvider;
import com.memorybench.registry.fixtures.NotAnAdapter;
import com.memorybench.registry.fixtures.SingletonAdapter;
import com.memorybench.registry.fixtures.SlowConstructorAdapter;
import com.memorybench.registry.fixtures.ValidMinimalAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdapterLoaderTest {

    @TempDir
    Path tempDir;

    private final AdapterLoader loader = new AdapterLoader(0);

    @AfterEach
    void closeLoaders() {
        loader.closeCommunityLoaders();
    }

    @Test
    void load_instantiatesClassFromApplicationClasspath() throws Exception {
        ProviderTree tree = new ProviderTree(tempDir).adapter("p", ValidMinimalAdapter.class);

        AdapterLoader.LoadedAdapter loaded = loader.load(tree.dir("p").resolve("index.properties"));

        assertInstanceOf(ValidMinimalAdapter.class, loaded.instance());
        assertEquals(AdapterContract.CURRENT, loaded.contract());
    }

    @Test
    void load_prefersStaticInstanceField() throws Exception {
        ProviderTree tree = new ProviderTree(tempDir).adapter("p", SingletonAdapter.class);

        AdapterLoader.LoadedAdapter loaded = loader.load(tree.dir("p").resolve("index.properties"));

        assertSame(SingletonAdapter.INSTANCE, loaded.instance());
    }

    @Test
    void load_detectsLegacyContract() throws Exception {
        ProviderTree tree = new ProviderTree(tempDir).adapter("p", LegacyTemplateProvider.class);

        assertEquals(AdapterContract.LEGACY, loader.load(tree.dir("p").resolve("index.properties")).contract());
    }

    @Test
    void load_reportsConstructorFailureAsInitializationFailed() throws Exception {
        ProviderTree tree = new ProviderTree(tempDir).adapter("p", FailingConstructorAdapter.class);

        AdapterLoadException e = assertThrows(AdapterLoadException.class,
                () -> loader.load(tree.dir("p").resolve("index.properties")));

        assertEquals(ProviderLoadError.Code.INITIALIZATION_FAILED, e.getCode());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertTrue(e.getMessage().contains("API key not configured"));
    }

    @Test
    void load_reportsUnknownClassAsImportFailed() throws Exception {
        ProviderTree tree = new ProviderTree(tempDir).rawFile("p", "index.properties", "adapter.class=com.example.Missing\n");

        AdapterLoadException e = assertThrows(AdapterLoadException.class,
                () -> loader.load(tree.dir("p").resolve("index.properties")));

        assertEquals(ProviderLoadError.Code.IMPORT_FAILED, e.getCode());
        assertTrue(e.getMessage().contains("com.example.Missing"));
    }

    @Test
    void load_reportsMissingClassPropertyAsImportFailed() throws Exception {
        ProviderTree tree = new ProviderTree(tempDir).rawFile("p", "index.properties", "# nothing here\n");

        AdapterLoadException e = assertThrows(AdapterLoadException.class,
                () -> loader.load(tree.dir("p").resolve("index.properties")));

        assertEquals(ProviderLoadError.Code.IMPORT_FAILED, e.getCode());
    }

    @Test
    void load_reportsNonConformingObjectAsInvalidInterface() throws Exception {
        ProviderTree tree = new ProviderTree(tempDir).adapter("p", NotAnAdapter.class);

        AdapterLoadException e = assertThrows(AdapterLoadException.class,
                () -> loader.load(tree.dir("p").resolve("index.properties")));

        assertEquals(ProviderLoadError.Code.INVALID_INTERFACE, e.getCode());
    }

    @Test
    void selectModule_prefersPropertiesThenJar() throws Exception {
        Path dir = tempDir.resolve("p");
        Path ts = dir.resolve("index.ts");
        Path jar = dir.resolve("index.jar");
        Path props = dir.resolve("index.properties");

        assertEquals(props, AdapterLoader.selectModule(List.of(jar, props, ts)));
        assertEquals(jar, AdapterLoader.selectModule(List.of(jar, ts)));
    }

    @Test
    void selectModule_rejectsUnsupportedFormats() {
        Path ts = tempDir.resolve("p").resolve("index.ts");

        AdapterLoadException e = assertThrows(AdapterLoadException.class, () -> AdapterLoader.selectModule(List.of(ts)));

        assertEquals(ProviderLoadError.Code.IMPORT_FAILED, e.getCode());
        assertTrue(e.getMessage().contains(ts.toString()));
    }

    @Test
    void load_readsAdapterFromJarThroughRestrictedLoader() throws Exception {
        ProviderTree tree = new ProviderTree(tempDir);
        Path jar = tree.jar("p", "index.jar", ValidMinimalAdapter.class.getName(), ValidMinimalAdapter.class);

        AdapterLoader.LoadedAdapter loaded = loader.load(jar);

        Object instance = loaded.instance();
        assertEquals(AdapterContract.CURRENT, loaded.contract());
        assertNotSame(ValidMinimalAdapter.class, instance.getClass());
        assertEquals(ValidMinimalAdapter.class.getName(), instance.getClass().getName());
        assertEquals("valid-minimal", ((ProviderAdapter) instance).getName());
    }

    @Test
    void release_closesJarClassLoader() throws Exception {
        Path jar = new ProviderTree(tempDir).jar("p", "index.jar", ValidMinimalAdapter.class.getName(), ValidMinimalAdapter.class);

        AdapterLoader.LoadedAdapter loaded = loader.load(jar);
        assertEquals(1, loader.openCommunityLoaders());

        loader.release(loaded);
        assertEquals(0, loader.openCommunityLoaders());
    }

    @Test
    void load_closesJarClassLoaderWhenLoadingFails() throws Exception {
        Path jar = new ProviderTree(tempDir).jar("p", "index.jar", NotAnAdapter.class.getName(), NotAnAdapter.class);

        assertThrows(AdapterLoadException.class, () -> loader.load(jar));
        assertEquals(0, loader.openCommunityLoaders());
    }

    @Test
    void release_ignoresApplicationClasspathAdapters() throws Exception {
        ProviderTree tree = new ProviderTree(tempDir).adapter("p", ValidMinimalAdapter.class);

        loader.release(loader.load(tree.dir("p").resolve("index.properties")));

        assertEquals(0, loader.openCommunityLoaders());
    }

    @Test
    void load_readsJarsListedInAdapterClasspath() throws Exception {
        ProviderTree tree = new ProviderTree(tempDir);
        tree.jar("p", "adapter.jar", ValidMinimalAdapter.class.getName(), ValidMinimalAdapter.class);
        tree.rawFile("p", "index.properties",
                "adapter.class=" + ValidMinimalAdapter.class.getName() + "\nadapter.classpath=adapter.jar\n");

        Object instance = loader.load(tree.dir("p").resolve("index.properties")).instance();

        assertNotSame(ValidMinimalAdapter.class, instance.getClass());
    }

    @Test
    void load_deniesInternalPackagesToJarAdapters() throws Exception {
        ProviderTree tree = new ProviderTree(tempDir);
        Path jar = tree.jar("p", "index.jar", ProviderRegistry.class.getName(), ValidMinimalAdapter.class);

        AdapterLoadException e = assertThrows(AdapterLoadException.class, () -> loader.load(jar));

        assertEquals(ProviderLoadError.Code.IMPORT_FAILED, e.getCode());
    }

    @Test
    void load_rejectsClasspathOutsideProviderDirectory() throws Exception {
        ProviderTree tree = new ProviderTree(tempDir);
        tree.rawFile("p", "index.properties", "adapter.class=x.Y\nadapter.classpath=../other/evil.jar\n");

        AdapterLoadException e = assertThrows(AdapterLoadException.class,
                () -> loader.load(tree.dir("p").resolve("index.properties")));

        assertEquals(ProviderLoadError.Code.IMPORT_FAILED, e.getCode());
        assertTrue(e.getMessage().contains("outside"));
    }

    @Test
    void load_appliesDeadline() throws Exception {
        ProviderTree tree = new ProviderTree(tempDir).adapter("p", SlowConstructorAdapter.class);
        AdapterLoader withDeadline = new AdapterLoader(1);

        AdapterLoadException e = assertThrows(AdapterLoadException.class,
                () -> withDeadline.load(tree.dir("p").resolve("index.properties")));

        assertEquals(ProviderLoadError.Code.IMPORT_FAILED, e.getCode());
        assertTrue(e.getMessage().contains("timed out"));
    }

    @Test
    void restrictedLoader_allowsContractPackagesOnly() {
        assertTrue(RestrictedAdapterClassLoader.isAllowed("com.memorybench.provider.ProviderAdapter"));
        assertTrue(RestrictedAdapterClassLoader.isAllowed("java.util.List"));
        assertTrue(!RestrictedAdapterClassLoader.isAllowed("com.memorybench.registry.ProviderRegistry"));
        assertTrue(!RestrictedAdapterClassLoader.isAllowed("com.fasterxml.jackson.databind.ObjectMapper"));
    }
}

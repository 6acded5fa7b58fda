package com.csd.formulary.service;

import com.csd.formulary.bundling.PackageArchiver;
import com.csd.formulary.exception.LocalPackageMissingException;
import com.csd.formulary.exception.VersionNotFoundException;
import com.csd.formulary.model.Dependency;
import com.csd.formulary.model.MaterializedPackage;
import com.csd.formulary.model.Package;
import com.csd.formulary.registry.ArtifactCache;
import com.csd.formulary.support.Archives;
import com.csd.formulary.support.StubRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

public class PackageMaterializerTest {

    @TempDir
    Path tmp;

    private StubRegistry registry;
    private ArtifactCache cache;
    private ExecutorService executor;
    private PackageMaterializer materializer;

    @BeforeEach
    void setUp() {
        registry = new StubRegistry();
        cache = new ArtifactCache(tmp.resolve("cache"));
        executor = Executors.newFixedThreadPool(3);
        materializer = new PackageMaterializer(registry, cache, new PackageArchiver(new ObjectMapper()), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Package pkg(String name, String version) {
        return Package.builder().name(name).version(version).build();
    }

    private void publish(String name, String version, String... functions) {
        registry.add(name, version);
        registry.archive(name, version, Archives.write(tmp, name, version, List.of(), functions));
    }

    @Test
    void fetchesAllPackagesInOrder() {
        publish("a", "1.0.0", "A", "=1");
        publish("b", "2.0.0", "B", "=2");
        publish("c", "0.1.0", "C", "=3");

        List<MaterializedPackage> result = materializer.materialize(List.of(pkg("a", "1.0.0"), pkg("b", "2.0.0"), pkg("c", "0.1.0")));

        assertEquals(List.of("a", "b", "c"), result.stream().map(MaterializedPackage::getName).toList());
        assertEquals("registry:b/2.0.0", result.get(1).getResolved());
        assertTrue(result.get(2).getContents().getFunctions().containsKey("C"));
        assertTrue(cache.has("a", "1.0.0"));
    }

    @Test
    void cachedPackagesAreNotDownloadedAgain() {
        publish("a", "1.0.0", "A", "=1");
        materializer.materialize(List.of(pkg("a", "1.0.0")));
        materializer.materialize(List.of(pkg("a", "1.0.0")));
        assertEquals(List.of("a@1.0.0"), registry.getDownloads());
    }

    @Test
    void failureIsRethrownUnwrapped() {
        publish("a", "1.0.0", "A", "=1");
        registry.add("broken", "1.0.0");
        assertThrows(VersionNotFoundException.class,
                () -> materializer.materialize(List.of(pkg("a", "1.0.0"), pkg("broken", "1.0.0"))));
        assertFalse(cache.has("broken", "1.0.0"));
    }

    @Test
    void localArchives() {
        Path archive = Archives.write(tmp.resolve("dist"), "mine", "0.3.0", List.of("a"), "MINE", "=1");
        MaterializedPackage local = materializer.materializeLocal(List.of(Dependency.local("mine", archive.toString()))).get(0);
        assertTrue(local.isLocal());
        assertEquals("0.3.0", local.getVersion());
        assertEquals("file:" + archive, local.getResolved());
        assertEquals(List.of("a"), local.getContents().getDependencies());
    }

    @Test
    void missingLocalArchive() {
        Dependency dep = Dependency.local("mine", tmp.resolve("gone.gspkg").toString());
        LocalPackageMissingException ex = assertThrows(LocalPackageMissingException.class,
                () -> materializer.materializeLocal(List.of(dep)));
        assertEquals(dep.getLocalPath(), ex.getPath());
    }
}

package com.csd.formulary.controller;

import com.csd.formulary.bundling.PackageArchiver;
import com.csd.formulary.model.PackageInfo;
import com.csd.formulary.registry.ArtifactCache;
import com.csd.formulary.registry.GitHubRegistryClient;
import com.csd.formulary.registry.RegistryIndexCache;
import com.csd.formulary.resolution.VersionResolver;
import com.csd.formulary.service.InstallationReconciler;
import com.csd.formulary.service.PackageInfoService;
import com.csd.formulary.service.PackageManagerService;
import com.csd.formulary.service.PackageMaterializer;
import com.csd.formulary.service.PublishService;
import com.csd.formulary.store.ProjectMetadataCodec;
import com.csd.formulary.support.Archives;
import com.csd.formulary.support.InMemoryFunctionStore;
import com.csd.formulary.support.StubRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.ResponseEntity;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PackageControllerTest {

    @TempDir
    Path tmp;

    private StubRegistry registry;
    private InMemoryFunctionStore store;
    private PackageController controller;

    @BeforeEach
    void setUp() {
        registry = new StubRegistry();
        store = new InMemoryFunctionStore();
        ObjectMapper mapper = new ObjectMapper();
        PackageArchiver archiver = new PackageArchiver(mapper);
        PackageMaterializer materializer = new PackageMaterializer(
                registry, new ArtifactCache(tmp.resolve("cache")), archiver, Runnable::run);
        PackageManagerService manager = new PackageManagerService(store,
                new InstallationReconciler(new VersionResolver(registry), materializer, archiver),
                new ProjectMetadataCodec(mapper));
        GitHubRegistryClient unused = new GitHubRegistryClient("http://localhost:1", new OkHttpClient(), mapper, new RegistryIndexCache());
        controller = new PackageController(manager, new PackageInfoService(registry), new PublishService(manager, archiver), unused);
    }

    @Test
    @SuppressWarnings("unchecked")
    void installThenRemove() {
        registry.add("pkg-a", "1.0.0");
        registry.archive("pkg-a", "1.0.0", Archives.write(tmp, "pkg-a", "1.0.0", List.of(), "A_ONE", "=1"));

        PackageController.InstallRequest install = new PackageController.InstallRequest();
        install.setPackages(List.of("pkg-a"));
        ResponseEntity<?> installed = controller.install(install);
        Map<String, Object> body = (Map<String, Object>) installed.getBody();
        assertEquals(List.of("A_ONE"), body.get("functions"));
        assertEquals(List.of("pkg-a"), body.get("dependencies"));

        PackageController.RemoveRequest remove = new PackageController.RemoveRequest();
        remove.setPackages(List.of("pkg-a"));
        Map<String, Object> removed = (Map<String, Object>) controller.remove(remove).getBody();
        assertEquals(List.of("A_ONE"), removed.get("deleted"));
        assertNull(store.get("A_ONE"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void upgradeReportsUpToDate() {
        registry.add("pkg-a", "1.0.0");
        registry.archive("pkg-a", "1.0.0", Archives.write(tmp, "pkg-a", "1.0.0", List.of(), "A_ONE", "=1"));
        PackageController.InstallRequest install = new PackageController.InstallRequest();
        install.setPackages(List.of("pkg-a"));
        controller.install(install);

        Map<String, Object> body = (Map<String, Object>) controller.upgrade(new PackageController.UpgradeRequest()).getBody();
        assertEquals(true, body.get("upToDate"));
    }

    @Test
    void initAndState() {
        PackageController.InitRequest init = new PackageController.InitRequest();
        init.setName("demo");
        init.setVersion("0.2.0");
        assertEquals(Map.of("created", true), controller.init(init));
        assertEquals(0, controller.state().get("functionCount"));
    }

    @Test
    void info() {
        registry.add("pkg-a", "1.0.0");
        PackageInfo info = controller.info("pkg-a", null);
        assertEquals("1.0.0", info.getLatest());
    }
}

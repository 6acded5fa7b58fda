package com.csd.formulary.service;

import com.csd.formulary.bundling.PackageArchiver;
import com.csd.formulary.exception.LocalPackageMissingException;
import com.csd.formulary.model.Dependency;
import com.csd.formulary.model.ExtractedPackage;
import com.csd.formulary.model.MaterializedPackage;
import com.csd.formulary.model.Package;
import com.csd.formulary.registry.ArtifactCache;
import com.csd.formulary.registry.RegistryClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Fetches and extracts package archives. Independent packages are processed in parallel, and every call
 * returns only once all of them have finished; the first failure is rethrown as-is.
 */
@Slf4j
@Service
public class PackageMaterializer {

    public static final String LOCAL_VERSION = "local";

    private final RegistryClient registry;
    private final ArtifactCache cache;
    private final PackageArchiver archiver;
    private final Executor executor;

    public PackageMaterializer(RegistryClient registry, ArtifactCache cache, PackageArchiver archiver,
                               @Qualifier("materializeExecutor") Executor executor) {
        this.registry = registry;
        this.cache = cache;
        this.archiver = archiver;
        this.executor = executor;
    }

    public List<MaterializedPackage> materialize(List<Package> packages) {
        log.info("Materializing {} registry packages", packages.size());
        return joinAll(packages.stream()
                .map(pkg -> (Supplier<MaterializedPackage>) () -> fromRegistry(pkg))
                .collect(Collectors.toList()));
    }

    /**
     * @throws LocalPackageMissingException if a declared archive path does not exist
     */
    public List<MaterializedPackage> materializeLocal(List<Dependency> localDependencies) {
        return joinAll(localDependencies.stream()
                .map(dep -> (Supplier<MaterializedPackage>) () -> fromFile(dep))
                .collect(Collectors.toList()));
    }

    private MaterializedPackage fromRegistry(Package pkg) {
        Path archive = cache.fill(pkg.getName(), pkg.getVersion(),
                target -> registry.downloadPackage(pkg.getName(), pkg.getVersion(), target));
        ExtractedPackage contents = archiver.extract(archive);
        log.debug("Materialized {} ({} functions)", pkg, contents.getFunctions().size());
        return MaterializedPackage.builder()
                .name(pkg.getName())
                .version(pkg.getVersion())
                .resolved("registry:" + pkg.getName() + "/" + pkg.getVersion())
                .path(archive)
                .local(false)
                .contents(contents)
                .build();
    }

    private MaterializedPackage fromFile(Dependency dep) {
        Path path = Path.of(dep.getLocalPath());
        if (!Files.isRegularFile(path)) {
            throw new LocalPackageMissingException(dep.getLocalPath());
        }
        ExtractedPackage contents = archiver.extract(path);
        String version = contents.getVersion() == null ? LOCAL_VERSION : contents.getVersion();
        return MaterializedPackage.builder()
                .name(dep.getName())
                .version(version)
                .resolved("file:" + dep.getLocalPath())
                .path(path)
                .local(true)
                .contents(contents)
                .build();
    }

    private List<MaterializedPackage> joinAll(List<Supplier<MaterializedPackage>> tasks) {
        List<CompletableFuture<MaterializedPackage>> futures = tasks.stream()
                .map(task -> CompletableFuture.supplyAsync(task, executor))
                .collect(Collectors.toList());
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }
}

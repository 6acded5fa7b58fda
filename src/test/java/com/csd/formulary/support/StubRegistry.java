package com.csd.formulary.support;

import com.csd.formulary.exception.PackageNotFoundException;
import com.csd.formulary.exception.VersionNotFoundException;
import com.csd.formulary.model.PackageMetadata;
import com.csd.formulary.registry.RegistryClient;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** In-memory registry; archives are served by copying files registered with {@link #archive}. */
public class StubRegistry implements RegistryClient {

    private final Map<String, Map<String, PackageMetadata>> packages = new LinkedHashMap<>();
    private final Map<String, Path> archives = new HashMap<>();
    private final Map<String, Map<String, String>> attributes = new HashMap<>();
    private final List<String> metadataCalls = new ArrayList<>();
    private final List<String> downloads = new ArrayList<>();

    public StubRegistry add(String name, String version, String... dependencies) {
        packages.computeIfAbsent(name, k -> new LinkedHashMap<>())
                .put(version, PackageMetadata.builder()
                        .dependencies(new ArrayList<>(Arrays.asList(dependencies)))
                        .path("packages/" + name + "/" + version + ".gspkg")
                        .build());
        return this;
    }

    public StubRegistry archive(String name, String version, Path archive) {
        archives.put(name + "@" + version, archive);
        return this;
    }

    public StubRegistry attributes(String name, Map<String, String> values) {
        attributes.put(name, values);
        return this;
    }

    public List<String> getMetadataCalls() {
        return metadataCalls;
    }

    public synchronized List<String> getDownloads() {
        return downloads;
    }

    @Override
    public Set<String> getVersions(String packageName) {
        return new LinkedHashSet<>(packages.getOrDefault(packageName, Map.of()).keySet());
    }

    @Override
    public PackageMetadata getPackageMetadata(String packageName, String version) {
        metadataCalls.add(packageName + "@" + version);
        Map<String, PackageMetadata> versions = packages.get(packageName);
        if (versions == null) throw new PackageNotFoundException(packageName);
        PackageMetadata metadata = versions.get(version);
        if (metadata == null) throw new VersionNotFoundException(packageName, version);
        return metadata;
    }

    @Override
    public Path downloadPackage(String packageName, String version, Path targetPath) {
        Path source = archives.get(packageName + "@" + version);
        if (source == null) throw new VersionNotFoundException(packageName, version);
        synchronized (this) {
            downloads.add(packageName + "@" + version);
        }
        try {
            Files.copy(source, targetPath, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return targetPath;
    }

    @Override
    public Map<String, String> getPackageAttributes(String packageName) {
        return attributes.getOrDefault(packageName, Map.of());
    }
}

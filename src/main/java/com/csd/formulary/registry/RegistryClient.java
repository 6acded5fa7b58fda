package com.csd.formulary.registry;

import com.csd.formulary.model.PackageMetadata;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Read access to a package registry.
 */
public interface RegistryClient {

    /** Published versions of a package; empty when the registry does not know the name. */
    Set<String> getVersions(String packageName);

    /**
     * @throws com.csd.formulary.exception.PackageNotFoundException if the package is unknown
     * @throws com.csd.formulary.exception.VersionNotFoundException if the version is not published
     */
    PackageMetadata getPackageMetadata(String packageName, String version);

    /** Downloads the archive for {@code packageName@version} to {@code targetPath}. */
    Path downloadPackage(String packageName, String version, Path targetPath);

    /** Package-level descriptive fields such as author or license. */
    default Map<String, String> getPackageAttributes(String packageName) {
        return Map.of();
    }
}

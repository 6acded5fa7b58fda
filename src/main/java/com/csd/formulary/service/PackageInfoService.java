package com.csd.formulary.service;

import com.csd.formulary.exception.PackageNotFoundException;
import com.csd.formulary.model.PackageInfo;
import com.csd.formulary.model.PackageMetadata;
import com.csd.formulary.registry.RegistryClient;
import com.csd.formulary.resolution.VersionUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
public class PackageInfoService {

    private static final int OTHER_VERSIONS_SHOWN = 5;

    private final RegistryClient registry;

    public PackageInfoService(RegistryClient registry) {
        this.registry = registry;
    }

    /**
     * Describes a registry package. Without a version the newest published one is shown, together with
     * up to five other versions, newest first.
     */
    public PackageInfo info(String name, String version) {
        Set<String> versions = registry.getVersions(name);
        if (versions.isEmpty()) {
            throw new PackageNotFoundException(name);
        }
        List<String> ordered = versions.stream().sorted(VersionUtil.newestFirst()).collect(Collectors.toList());
        boolean latestRequested = version == null || version.isBlank();
        String target = latestRequested ? ordered.get(0) : version;

        PackageMetadata metadata = registry.getPackageMetadata(name, target);
        Map<String, String> attributes = registry.getPackageAttributes(name);
        log.debug("Info for {}@{}: {}", name, target, attributes);

        PackageInfo.PackageInfoBuilder info = PackageInfo.builder()
                .name(name)
                .version(target)
                .description(attributes.getOrDefault("description", "No description provided."))
                .author(attributes.get("author"))
                .license(attributes.get("license"))
                .homepage(attributes.get("homepage"))
                .dependencies(new ArrayList<>(metadata.getDependencies()));
        if (latestRequested) {
            info.latest(target).otherVersions(ordered.stream()
                    .filter(v -> !v.equals(target))
                    .limit(OTHER_VERSIONS_SHOWN)
                    .collect(Collectors.toList()));
        }
        return info.build();
    }
}

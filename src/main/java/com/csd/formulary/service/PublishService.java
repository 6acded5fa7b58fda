package com.csd.formulary.service;

import com.csd.formulary.bundling.PackageArchiver;
import com.csd.formulary.exception.FormularyException;
import com.csd.formulary.model.FunctionDefinition;
import com.csd.formulary.model.ProjectMetadata;
import com.csd.formulary.model.ProjectState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Bundles the project's own functions into a package archive.
 */
@Slf4j
@Service
public class PublishService {

    private final PackageManagerService manager;
    private final PackageArchiver archiver;

    public PublishService(PackageManagerService manager, PackageArchiver archiver) {
        this.manager = manager;
        this.archiver = archiver;
    }

    /**
     * Writes the archive to {@code output} and returns its integrity string. Functions owned by installed
     * packages are left out.
     */
    public String pack(Path output) {
        ProjectState state = manager.loadState(true);
        ProjectMetadata project = state.getMetadata();
        if (project.getName() == null || project.getName().isBlank()
                || project.getVersion() == null || project.getVersion().isBlank()) {
            throw new IllegalStateException("Project metadata needs a name and a version");
        }

        Set<String> owned = state.getLockfile().ownership().keySet();
        Map<String, FunctionDefinition> functions = new LinkedHashMap<>();
        state.getFunctions().forEach((name, def) -> {
            if (!owned.contains(name)) functions.put(name, def);
        });
        if (functions.isEmpty()) {
            log.warn("Project {} has no functions of its own to pack", project.getName());
        }

        Map<String, Object> metadata = new LinkedHashMap<>(project.getExtra());
        metadata.put("name", project.getName());
        metadata.put("version", project.getVersion());
        metadata.put("description", project.getDescription());
        metadata.put("dependencies", project.getDependencies());

        try {
            archiver.create(output, metadata, functions, state.getLockfile());
            String integrity = PackageArchiver.integrity(Files.readAllBytes(output));
            log.info("Packed {}@{} into {} ({})", project.getName(), project.getVersion(), output, integrity);
            return integrity;
        } catch (IOException e) {
            throw new FormularyException("Failed to write package " + output, e);
        }
    }
}

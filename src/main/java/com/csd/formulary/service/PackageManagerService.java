package com.csd.formulary.service;

import com.csd.formulary.model.FunctionDefinition;
import com.csd.formulary.model.Lockfile;
import com.csd.formulary.model.ProjectMetadata;
import com.csd.formulary.model.ProjectState;
import com.csd.formulary.model.ReconcileResult;
import com.csd.formulary.store.FunctionHasher;
import com.csd.formulary.store.FunctionStore;
import com.csd.formulary.store.ProjectMetadataCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for package operations on one spreadsheet. Each operation plans the full target state first,
 * then writes it to the store one function at a time, the lockfile last.
 */
@Slf4j
@Service
public class PackageManagerService {

    private final FunctionStore store;
    private final InstallationReconciler reconciler;
    private final ProjectMetadataCodec codec;

    public PackageManagerService(FunctionStore store, InstallationReconciler reconciler, ProjectMetadataCodec codec) {
        this.store = store;
        this.reconciler = reconciler;
        this.codec = codec;
    }

    public ReconcileResult install(List<String> packages, boolean local, Map<String, Map<String, String>> renames) {
        log.info("=== Installing {} ===", packages);
        ProjectState state = loadState(false);
        ReconcileResult result = reconciler.planInstall(state, packages, local, renames);
        apply(state, result);
        log.info("=== Install complete: {} packages locked ===", result.getLockfile().getPackages().size());
        return result;
    }

    public ReconcileResult upgrade(List<String> packages, Map<String, Map<String, String>> renames) {
        log.info("=== Upgrading {} ===", packages == null || packages.isEmpty() ? "all packages" : packages);
        ProjectState state = loadState(true);
        ReconcileResult result = reconciler.planUpgrade(state, packages, renames);
        if (result.isNoop()) {
            return result;
        }
        apply(state, result);
        log.info("=== Upgrade complete: {} packages changed ===", result.getUpgrades().size());
        return result;
    }

    public ReconcileResult remove(List<String> packages) {
        log.info("=== Removing {} ===", packages);
        ProjectState state = loadState(true);
        ReconcileResult result = reconciler.planRemove(state, packages);
        apply(state, result);
        log.info("=== Remove complete: {} functions deleted ===", result.getFunctionsToDelete().size());
        return result;
    }

    /**
     * Writes fresh project metadata and an empty lockfile. Does nothing when a project already exists.
     *
     * @return whether a project was created
     */
    public boolean init(String name, String version, String description) {
        if (currentMetadata(store.getNamedFunctions()) != null) {
            log.warn("Project already initialized, leaving it unchanged");
            return false;
        }
        ProjectMetadata defaults = ProjectMetadata.defaults();
        ProjectMetadata metadata = ProjectMetadata.builder()
                .name(name == null || name.isBlank() ? defaults.getName() : name)
                .version(version == null || version.isBlank() ? defaults.getVersion() : version)
                .description(description == null ? "" : description)
                .build();
        store.updateFunction(codec.projectFunction(metadata));
        store.updateFunction(codec.lockFunction(Lockfile.empty()));
        log.info("Initialized project {}@{}", metadata.getName(), metadata.getVersion());
        return true;
    }

    public ProjectState loadState(boolean requireProject) {
        Map<String, FunctionDefinition> all = store.getNamedFunctions();
        ProjectMetadata metadata = currentMetadata(all);
        if (metadata == null) {
            if (requireProject) throw new IllegalStateException("No project initialized");
            metadata = ProjectMetadata.defaults();
        }
        FunctionDefinition lock = all.get(FunctionStore.LOCK_FUNCTION);
        Lockfile lockfile = lock == null ? Lockfile.empty() : codec.decodeLockfile(lock.getDefinition());

        Map<String, FunctionDefinition> functions = new LinkedHashMap<>(all);
        FunctionStore.RESERVED_NAMES.forEach(functions::remove);
        return ProjectState.builder()
                .metadata(metadata)
                .lockfile(lockfile)
                .functions(functions)
                .build();
    }

    private ProjectMetadata currentMetadata(Map<String, FunctionDefinition> all) {
        FunctionDefinition project = all.get(FunctionStore.PROJECT_FUNCTION);
        return project == null ? null : codec.decodeProject(project.getDefinition());
    }

    private void apply(ProjectState state, ReconcileResult result) {
        String step = "delete";
        try {
            for (String name : result.getFunctionsToDelete()) {
                if (state.getFunctions().containsKey(name)) {
                    store.deleteFunction(name);
                }
            }
            step = "write functions";
            int written = 0;
            for (FunctionDefinition function : result.getFunctions().values()) {
                FunctionDefinition current = state.getFunctions().get(function.getName());
                if (current == null) {
                    store.createFunction(function);
                    written++;
                } else if (!FunctionHasher.sameContent(current, function)) {
                    store.updateFunction(function);
                    written++;
                }
            }
            log.debug("Wrote {} of {} functions", written, result.getFunctions().size());
            step = "write project metadata";
            store.updateFunction(codec.projectFunction(result.getMetadata()));
            step = "write lockfile";
            store.updateFunction(codec.lockFunction(result.getLockfile()));
        } catch (RuntimeException e) {
            log.error("Failed to {}: {}", step, e.getMessage(), e);
            throw e;
        }
    }
}

package com.csd.formulary.service;

import com.csd.formulary.bundling.PackageArchiver;
import com.csd.formulary.exception.FunctionCollisionException;
import com.csd.formulary.exception.LocalPackageMissingException;
import com.csd.formulary.exception.NotInstalledException;
import com.csd.formulary.exception.UnsatisfiableRequirementsException;
import com.csd.formulary.formula.FormulaRefactorer;
import com.csd.formulary.model.CollisionReport;
import com.csd.formulary.model.Dependency;
import com.csd.formulary.model.ExtractedPackage;
import com.csd.formulary.model.FunctionDefinition;
import com.csd.formulary.model.Lockfile;
import com.csd.formulary.model.MaterializedPackage;
import com.csd.formulary.model.Package;
import com.csd.formulary.model.PackageLock;
import com.csd.formulary.model.ProjectMetadata;
import com.csd.formulary.model.ProjectState;
import com.csd.formulary.model.ReconcileResult;
import com.csd.formulary.model.VersionChange;
import com.csd.formulary.resolution.VersionResolver;
import com.csd.formulary.store.FunctionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes the target state of an install, upgrade or remove without touching the function store.
 * Any exception thrown here leaves the spreadsheet exactly as it was.
 */
@Slf4j
@Service
public class InstallationReconciler {

    private final VersionResolver resolver;
    private final PackageMaterializer materializer;
    private final PackageArchiver archiver;

    public InstallationReconciler(VersionResolver resolver, PackageMaterializer materializer, PackageArchiver archiver) {
        this.resolver = resolver;
        this.materializer = materializer;
        this.archiver = archiver;
    }

    /**
     * Adds {@code packages} to the project's dependencies and reconciles the whole dependency set.
     *
     * @param packages requirement strings, or archive paths when {@code local} is set
     * @param renames  {@code package -> (function -> alias)}
     */
    public ReconcileResult planInstall(ProjectState state, List<String> packages, boolean local,
                                       Map<String, Map<String, String>> renames) {
        ProjectMetadata metadata = state.getMetadata() == null ? ProjectMetadata.defaults() : state.getMetadata().copy();
        List<String> dependencies = new ArrayList<>(metadata.getDependencies());

        for (String pkg : packages) {
            String entry = local ? localEntry(pkg) : pkg.trim();
            if (dependencies.contains(entry)) continue;
            String name = Dependency.parse(entry).getName();
            dependencies.removeIf(d -> Dependency.parse(d).getName().equals(name));
            dependencies.add(entry);
        }
        metadata.setDependencies(dependencies);

        Resolution resolution = resolve(metadata, Map.of());
        return assemble(state, metadata, resolution, renames);
    }

    /**
     * Moves installed packages to the newest versions the project's requirements allow. Packages outside
     * {@code packages} stay at their locked versions when possible. An empty list targets every package.
     */
    public ReconcileResult planUpgrade(ProjectState state, List<String> packages, Map<String, Map<String, String>> renames) {
        Lockfile previous = state.getLockfile();
        Set<String> targets = packages == null || packages.isEmpty()
                ? new LinkedHashSet<>(previous.getPackages().keySet())
                : new LinkedHashSet<>(packages);
        for (String target : targets) {
            if (!previous.contains(target)) throw new NotInstalledException(target);
        }

        Map<String, String> pins = new LinkedHashMap<>();
        previous.getPackages().forEach((name, lock) -> {
            if (!targets.contains(name) && lock.getResolved() != null && lock.getResolved().startsWith("registry:")) {
                pins.put(name, lock.getVersion());
            }
        });

        ProjectMetadata metadata = state.getMetadata().copy();
        Resolution resolution;
        try {
            resolution = resolve(metadata, pins);
        } catch (UnsatisfiableRequirementsException e) {
            if (pins.isEmpty()) throw e;
            log.warn("Locked versions of {} block the upgrade, retrying without them", pins.keySet());
            resolution = resolve(metadata, Map.of());
        }

        Map<String, VersionChange> upgrades = new LinkedHashMap<>();
        for (Package pkg : resolution.registryPackages) {
            PackageLock old = previous.getPackages().get(pkg.getName());
            if (old != null && !old.getVersion().equals(pkg.getVersion())) {
                upgrades.put(pkg.getName(), new VersionChange(old.getVersion(), pkg.getVersion()));
            }
        }
        if (upgrades.isEmpty()) {
            log.info("All packages are up to date");
            return ReconcileResult.builder()
                    .metadata(metadata)
                    .lockfile(previous.copy())
                    .noop(true)
                    .build();
        }

        ReconcileResult result = assemble(state, metadata, resolution, renames);
        result.setUpgrades(upgrades);
        upgrades.forEach((name, change) -> log.info("Upgrading {} {} -> {}", name, change.getFrom(), change.getTo()));
        return result;
    }

    /**
     * Drops direct dependencies, given by name or by local archive path, and prunes every locked package
     * no longer reachable from the remaining ones.
     */
    public ReconcileResult planRemove(ProjectState state, List<String> packages) {
        ProjectMetadata metadata = state.getMetadata().copy();
        List<Dependency> direct = metadata.getDependencies().stream().map(Dependency::parse).collect(Collectors.toList());

        Set<String> removed = new LinkedHashSet<>();
        for (String input : packages) {
            removed.add(matchDirect(direct, input));
        }

        List<String> remaining = new ArrayList<>();
        Set<String> keep = new LinkedHashSet<>();
        for (Dependency dep : direct) {
            if (removed.contains(dep.getName())) continue;
            remaining.add(dep.toRequirement());
            keep.add(dep.getName());
        }
        metadata.setDependencies(remaining);

        Lockfile lockfile = state.getLockfile().copy();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Map.Entry<String, PackageLock> entry : lockfile.getPackages().entrySet()) {
                if (!keep.contains(entry.getKey())) continue;
                for (String requirement : entry.getValue().getDependencies()) {
                    changed |= keep.add(Dependency.parse(requirement).getName());
                }
            }
        }

        List<String> functionsToDelete = new ArrayList<>();
        List<String> pruned = new ArrayList<>();
        lockfile.getPackages().entrySet().removeIf(entry -> {
            if (keep.contains(entry.getKey())) return false;
            pruned.add(entry.getKey());
            functionsToDelete.addAll(entry.getValue().getFunctions());
            return true;
        });
        List<String> orphans = pruned.stream().filter(p -> !removed.contains(p)).collect(Collectors.toList());
        if (!orphans.isEmpty()) {
            log.info("Also removing orphaned dependencies: {}", String.join(", ", orphans));
        }

        Map<String, FunctionDefinition> kept = new LinkedHashMap<>();
        lockfile.ownership().keySet().forEach(fn -> {
            FunctionDefinition current = state.getFunctions().get(fn);
            if (current != null) kept.put(fn, current);
        });

        return ReconcileResult.builder()
                .metadata(metadata)
                .lockfile(lockfile)
                .functions(kept)
                .functionsToDelete(functionsToDelete)
                .build();
    }

    private String localEntry(String pathText) {
        Path path = Path.of(pathText).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new LocalPackageMissingException(path.toString());
        }
        ExtractedPackage extracted = archiver.extract(path);
        String name = extracted.getName();
        if (name == null || name.isBlank()) {
            name = path.getFileName().toString().replaceFirst("\\.gspkg$", "");
            log.warn("Archive {} declares no name, using {}", path, name);
        }
        return Dependency.local(name, path.toString()).toRequirement();
    }

    private String matchDirect(List<Dependency> direct, String input) {
        for (Dependency dep : direct) {
            if (dep.getName().equals(input)) return dep.getName();
        }
        Path inputPath = Path.of(input).toAbsolutePath().normalize();
        for (Dependency dep : direct) {
            if (!dep.isLocal()) continue;
            Path depPath = Path.of(dep.getLocalPath()).toAbsolutePath().normalize();
            if (depPath.equals(inputPath) || depPath.endsWith(Path.of(input).normalize())) return dep.getName();
        }
        throw new NotInstalledException(input);
    }

    private Resolution resolve(ProjectMetadata metadata, Map<String, String> pins) {
        List<Dependency> direct = metadata.getDependencies().stream().map(Dependency::parse).collect(Collectors.toList());
        List<Dependency> localDeps = direct.stream().filter(Dependency::isLocal).collect(Collectors.toList());
        List<MaterializedPackage> locals = materializer.materializeLocal(localDeps);
        Set<String> localNames = locals.stream().map(MaterializedPackage::getName).collect(Collectors.toSet());

        List<Dependency> requirements = new ArrayList<>();
        direct.stream().filter(d -> !d.isLocal()).forEach(requirements::add);
        for (MaterializedPackage local : locals) {
            local.getContents().getDependencies().forEach(r -> requirements.add(Dependency.parse(r)));
        }
        pins.forEach((name, version) -> requirements.add(Dependency.builder().name(name).specifier("==" + version).build()));
        requirements.removeIf(r -> localNames.contains(r.getName()));

        List<Package> registryPackages = requirements.isEmpty() ? List.of() : resolver.resolveOrThrow(requirements);
        return new Resolution(locals, registryPackages);
    }

    private ReconcileResult assemble(ProjectState state, ProjectMetadata metadata, Resolution resolution,
                                     Map<String, Map<String, String>> renames) {
        List<MaterializedPackage> installs = new ArrayList<>(resolution.locals);
        installs.addAll(materializer.materialize(resolution.registryPackages));

        Map<String, String> owners = state.getLockfile().ownership();
        Map<String, String> introducedBy = new LinkedHashMap<>();
        Map<String, Map<String, FunctionDefinition>> renamed = new LinkedHashMap<>();
        Map<String, Map<String, String>> aliasesByPackage = new LinkedHashMap<>();
        CollisionReport collisions = new CollisionReport();

        for (MaterializedPackage pkg : installs) {
            Map<String, String> aliases = aliasesFor(pkg, renames);
            aliasesByPackage.put(pkg.getName(), aliases);
            Map<String, FunctionDefinition> functions = new LinkedHashMap<>();
            pkg.getContents().getFunctions().forEach((name, def) -> {
                String finalName = aliases.getOrDefault(name, name);
                if (FunctionStore.isReserved(finalName)) {
                    log.warn("Package {} ships reserved function {}, skipping it", pkg.getName(), finalName);
                    return;
                }
                functions.put(finalName, def);
            });

            for (String fn : functions.keySet()) {
                if (state.getFunctions().containsKey(fn) && !pkg.getName().equals(owners.get(fn))) {
                    collisions.add(pkg.getName(), fn);
                }
                String other = introducedBy.putIfAbsent(fn, pkg.getName());
                if (other != null && !other.equals(pkg.getName())) {
                    collisions.add(pkg.getName(), fn);
                }
            }
            renamed.put(pkg.getName(), functions);
        }
        if (!collisions.isEmpty()) {
            log.info("Function collisions: {}", collisions.getConflicts());
            throw new FunctionCollisionException(collisions);
        }

        Lockfile lockfile = Lockfile.empty();
        Map<String, FunctionDefinition> allFunctions = new LinkedHashMap<>();
        for (MaterializedPackage pkg : installs) {
            Map<String, String> aliases = aliasesByPackage.get(pkg.getName());
            FormulaRefactorer refactorer = aliases.isEmpty() ? null : new FormulaRefactorer(aliases);
            Map<String, FunctionDefinition> functions = renamed.get(pkg.getName());
            functions.replaceAll((name, def) -> def.toBuilder()
                    .name(name)
                    .definition(refactorer == null ? def.getDefinition() : refactorer.refactor(def.getDefinition()))
                    .build());
            allFunctions.putAll(functions);

            lockfile.getPackages().put(pkg.getName(), PackageLock.builder()
                    .version(pkg.getVersion())
                    .resolved(pkg.getResolved())
                    .integrity(pkg.getContents().getIntegrity())
                    .dependencies(new ArrayList<>(pkg.getContents().getDependencies()))
                    .functions(new ArrayList<>(functions.keySet()))
                    .build());
        }

        List<String> functionsToDelete = new ArrayList<>();
        for (String fn : owners.keySet()) {
            if (!allFunctions.containsKey(fn)) functionsToDelete.add(fn);
        }

        log.info("Planned {} packages, {} functions, {} deletions",
                lockfile.getPackages().size(), allFunctions.size(), functionsToDelete.size());
        return ReconcileResult.builder()
                .metadata(metadata)
                .lockfile(lockfile)
                .functions(allFunctions)
                .functionsToDelete(functionsToDelete)
                .build();
    }

    private Map<String, String> aliasesFor(MaterializedPackage pkg, Map<String, Map<String, String>> renames) {
        Map<String, String> requested = renames == null ? Map.of() : renames.getOrDefault(pkg.getName(), Map.of());
        Map<String, String> aliases = new LinkedHashMap<>();
        requested.forEach((from, to) -> {
            if (FunctionStore.isReserved(to)) {
                throw new IllegalArgumentException("Cannot rename " + from + " to reserved name " + to);
            }
            if (!pkg.getContents().getFunctions().containsKey(from)) {
                log.warn("Package {} has no function {}, ignoring rename", pkg.getName(), from);
                return;
            }
            aliases.put(from, to);
        });
        return aliases;
    }

    private static final class Resolution {
        final List<MaterializedPackage> locals;
        final List<Package> registryPackages;

        Resolution(List<MaterializedPackage> locals, List<Package> registryPackages) {
            this.locals = locals;
            this.registryPackages = registryPackages;
        }
    }
}

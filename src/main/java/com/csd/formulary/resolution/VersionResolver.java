package com.csd.formulary.resolution;

import com.csd.formulary.exception.UnsatisfiableRequirementsException;
import com.csd.formulary.model.Dependency;
import com.csd.formulary.model.Package;
import com.csd.formulary.model.PackageMetadata;
import com.csd.formulary.model.ResolutionResult;
import com.csd.formulary.registry.RegistryClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Backtracking solver picking one version per package name.
 *
 * <p>At every step the unpinned name with the fewest viable versions is pinned next (ties go to the
 * name discovered first), trying its versions newest first. A candidate's own dependencies are fetched
 * only when it is pinned, and a pin is abandoned as soon as some name is left without a viable version.
 * Given the same registry answers the result is always the same.
 */
@Slf4j
@Service
public class VersionResolver {

    private final RegistryClient registry;

    public VersionResolver(RegistryClient registry) {
        this.registry = registry;
    }

    public ResolutionResult resolve(List<Dependency> requirements) {
        Search search = new Search();
        State initial = State.EMPTY.require(requirements);
        State solved = search.solve(initial);
        if (solved == null) {
            log.info("Resolution failed, unsatisfiable: {}", search.conflict);
            return ResolutionResult.failure(search.conflict);
        }
        List<Package> packages = new ArrayList<>(solved.pins.values());
        log.info("Resolved {} packages: {}", packages.size(), packages);
        return ResolutionResult.success(packages);
    }

    public List<Package> resolveOrThrow(List<Dependency> requirements) {
        ResolutionResult result = resolve(requirements);
        if (!result.isResolved()) {
            throw new UnsatisfiableRequirementsException(result.getUnsatisfied());
        }
        return result.getPackages();
    }

    /**
     * Partial assignment. Never mutated once built; each pin produces a fresh copy.
     */
    private static final class State {
        static final State EMPTY = new State(new LinkedHashMap<>(), new LinkedHashMap<>());

        final LinkedHashMap<String, List<Dependency>> requirements;
        final LinkedHashMap<String, Package> pins;

        State(LinkedHashMap<String, List<Dependency>> requirements, LinkedHashMap<String, Package> pins) {
            this.requirements = requirements;
            this.pins = pins;
        }

        State require(List<Dependency> deps) {
            LinkedHashMap<String, List<Dependency>> reqs = copyRequirements();
            for (Dependency dep : deps) {
                if (dep.isLocal()) continue;
                reqs.computeIfAbsent(dep.getName(), k -> new ArrayList<>()).add(dep);
            }
            return new State(reqs, new LinkedHashMap<>(pins));
        }

        State pin(Package candidate, List<Dependency> deps) {
            State next = require(deps);
            next.pins.put(candidate.getName(), candidate);
            return next;
        }

        private LinkedHashMap<String, List<Dependency>> copyRequirements() {
            LinkedHashMap<String, List<Dependency>> copy = new LinkedHashMap<>();
            requirements.forEach((name, list) -> copy.put(name, new ArrayList<>(list)));
            return copy;
        }
    }

    /** Per-call search with its registry answers memoised. */
    private final class Search {
        private final Map<String, List<String>> versions = new HashMap<>();
        private final Map<String, PackageMetadata> metadata = new HashMap<>();
        private List<Dependency> conflict = List.of();

        State solve(State state) {
            String next = null;
            List<String> nextCandidates = null;
            for (Map.Entry<String, List<Dependency>> entry : state.requirements.entrySet()) {
                String name = entry.getKey();
                Package pinned = state.pins.get(name);
                if (pinned != null) {
                    if (!satisfiesAll(entry.getValue(), pinned.getVersion())) {
                        conflict = List.copyOf(entry.getValue());
                        return null;
                    }
                    continue;
                }
                List<String> candidates = candidates(name, entry.getValue());
                if (candidates.isEmpty()) {
                    conflict = List.copyOf(entry.getValue());
                    return null;
                }
                if (next == null || candidates.size() < nextCandidates.size()) {
                    next = name;
                    nextCandidates = candidates;
                }
            }
            if (next == null) {
                return state;
            }

            for (String version : nextCandidates) {
                Package candidate = candidate(next, version);
                log.debug("Pinning {}", candidate);
                State solved = solve(state.pin(candidate, candidate.getParsedDependencies()));
                if (solved != null) {
                    return solved;
                }
                log.debug("Backtracking from {}", candidate);
            }
            return null;
        }

        private List<String> candidates(String name, List<Dependency> requirements) {
            List<String> all = versions.computeIfAbsent(name, n -> registry.getVersions(n).stream()
                    .sorted(VersionUtil.newestFirst())
                    .collect(Collectors.toList()));
            return all.stream()
                    .filter(v -> satisfiesAll(requirements, v))
                    .collect(Collectors.toList());
        }

        private Package candidate(String name, String version) {
            PackageMetadata meta = metadata.computeIfAbsent(name + "@" + version,
                    k -> registry.getPackageMetadata(name, version));
            return Package.builder()
                    .name(name)
                    .version(version)
                    .dependencies(new ArrayList<>(meta.getDependencies()))
                    .description(meta.getDescription())
                    .build();
        }

        private boolean satisfiesAll(List<Dependency> requirements, String version) {
            for (Dependency req : requirements) {
                if (!VersionSpecifier.parse(req.getSpecifier()).contains(version)) return false;
            }
            return true;
        }
    }
}

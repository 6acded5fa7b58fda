package com.csd.formulary.resolution;

import com.csd.formulary.exception.UnsatisfiableRequirementsException;
import com.csd.formulary.model.Dependency;
import com.csd.formulary.model.Package;
import com.csd.formulary.model.ResolutionResult;
import com.csd.formulary.support.StubRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class VersionResolverTest {

    private static Map<String, String> versions(List<Package> packages) {
        return packages.stream().collect(Collectors.toMap(Package::getName, Package::getVersion));
    }

    @Test
    void prefersNewestCompatible() {
        StubRegistry registry = new StubRegistry()
                .add("pkg-a", "1.0.0")
                .add("pkg-a", "2.0.0")
                .add("pkg-b", "1.0.0", "pkg-a>=1.0.0");
        List<Package> resolved = new VersionResolver(registry).resolveOrThrow(List.of(Dependency.parse("pkg-b")));
        assertEquals(Map.of("pkg-a", "2.0.0", "pkg-b", "1.0.0"), versions(resolved));
    }

    @Test
    void releaseWinsOverItsPrerelease() {
        StubRegistry registry = new StubRegistry()
                .add("pkg-a", "2.0.0-dev")
                .add("pkg-a", "2.0.0")
                .add("pkg-a", "1.0.0");
        List<Package> resolved = new VersionResolver(registry).resolveOrThrow(List.of(Dependency.parse("pkg-a>=2.0.0-dev")));
        assertEquals(Map.of("pkg-a", "2.0.0"), versions(resolved));
    }

    @Test
    void missingPackageIsUnsatisfiable() {
        VersionResolver resolver = new VersionResolver(new StubRegistry());
        ResolutionResult result = resolver.resolve(List.of(Dependency.parse("nonexistent-pkg")));
        assertFalse(result.isResolved());
        assertEquals("nonexistent-pkg", result.getUnsatisfied().get(0).getName());

        UnsatisfiableRequirementsException ex = assertThrows(UnsatisfiableRequirementsException.class,
                () -> resolver.resolveOrThrow(List.of(Dependency.parse("nonexistent-pkg"))));
        assertTrue(ex.getMessage().contains("nonexistent-pkg"));
        assertEquals("nonexistent-pkg", ex.getRequirements().get(0).getName());
    }

    @Test
    void backtracksWhenNewestCandidateConflicts() {
        // app 2.0 needs lib>=2 which needs core<1; app also pins core>=1 directly
        StubRegistry registry = new StubRegistry()
                .add("app", "1.0.0", "lib>=1.0,<2.0")
                .add("app", "2.0.0", "lib>=2.0")
                .add("lib", "1.0.0", "core>=1.0")
                .add("lib", "2.0.0", "core<1.0")
                .add("core", "0.5.0")
                .add("core", "1.2.0");
        List<Package> resolved = new VersionResolver(registry)
                .resolveOrThrow(List.of(Dependency.parse("app"), Dependency.parse("core>=1.0")));
        assertEquals(Map.of("app", "1.0.0", "lib", "1.0.0", "core", "1.2.0"), versions(resolved));
    }

    @Test
    void conflictingRootsReportRequirements() {
        StubRegistry registry = new StubRegistry()
                .add("pkg-a", "1.0.0")
                .add("pkg-a", "2.0.0");
        ResolutionResult result = new VersionResolver(registry)
                .resolve(List.of(Dependency.parse("pkg-a>=2.0"), Dependency.parse("pkg-a<2.0")));
        assertFalse(result.isResolved());
        List<String> specs = result.getUnsatisfied().stream().map(Dependency::getSpecifier).collect(Collectors.toList());
        assertEquals(List.of(">=2.0", "<2.0"), specs);
    }

    @Test
    void fetchesDependenciesOncePerCandidate() {
        StubRegistry registry = new StubRegistry()
                .add("pkg-a", "1.0.0")
                .add("pkg-b", "1.0.0", "pkg-a")
                .add("pkg-c", "1.0.0", "pkg-a");
        new VersionResolver(registry).resolveOrThrow(List.of(Dependency.parse("pkg-b"), Dependency.parse("pkg-c")));
        assertEquals(1, registry.getMetadataCalls().stream().filter("pkg-a@1.0.0"::equals).count());
        assertEquals(3, registry.getMetadataCalls().size());
    }

    @Test
    void skipsLocalRequirements() {
        StubRegistry registry = new StubRegistry().add("pkg-a", "1.0.0");
        List<Package> resolved = new VersionResolver(registry).resolveOrThrow(List.of(
                Dependency.parse("pkg-a"),
                Dependency.parse("mine@file:/tmp/mine.gspkg")));
        assertEquals(List.of("pkg-a"), resolved.stream().map(Package::getName).collect(Collectors.toList()));
    }

    @Test
    void deterministic() {
        StubRegistry registry = new StubRegistry()
                .add("x", "1.0")
                .add("x", "1.1")
                .add("y", "1.0", "x<1.1")
                .add("y", "2.0", "x");
        VersionResolver resolver = new VersionResolver(registry);
        List<Package> first = resolver.resolveOrThrow(List.of(Dependency.parse("y"), Dependency.parse("x")));
        List<Package> second = resolver.resolveOrThrow(List.of(Dependency.parse("y"), Dependency.parse("x")));
        assertEquals(first, second);
        assertEquals(Map.of("x", "1.1", "y", "2.0"), versions(first));
    }
}

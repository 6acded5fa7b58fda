package com.csd.formulary.resolution;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class VersionSpecifierTest {

    @Test
    void emptyMatchesAnyRelease() {
        VersionSpecifier any = VersionSpecifier.parse("");
        assertTrue(any.contains("0.0.1"));
        assertTrue(any.contains("99.0"));
        assertFalse(any.contains("2.0.0-beta"));
    }

    @Test
    void rangeClausesCombine() {
        VersionSpecifier range = VersionSpecifier.parse(">=1.0.0, <2.0.0");
        assertTrue(range.contains("1.0.0"));
        assertTrue(range.contains("1.9.9"));
        assertFalse(range.contains("2.0.0"));
        assertFalse(range.contains("0.9"));
    }

    @Test
    void exactAndExclusion() {
        assertTrue(VersionSpecifier.parse("==1.0").contains("1.0.0"));
        assertFalse(VersionSpecifier.parse("==1.0").contains("1.0.1"));
        assertFalse(VersionSpecifier.parse("!=1.0.1").contains("1.0.1"));
        assertTrue(VersionSpecifier.parse(">1.0,<=1.5").contains("1.5"));
        assertTrue(VersionSpecifier.parse("===1.0").contains("1.0"));
        assertFalse(VersionSpecifier.parse("===1.0").contains("1.0.0"));
    }

    @Test
    void wildcards() {
        VersionSpecifier eq = VersionSpecifier.parse("==1.4.*");
        assertTrue(eq.contains("1.4.0"));
        assertTrue(eq.contains("1.4.12"));
        assertFalse(eq.contains("1.5.0"));
        assertFalse(VersionSpecifier.parse("!=1.4.*").contains("1.4.3"));
    }

    @Test
    void compatibleRelease() {
        VersionSpecifier compatible = VersionSpecifier.parse("~=1.4.2");
        assertTrue(compatible.contains("1.4.2"));
        assertTrue(compatible.contains("1.4.9"));
        assertFalse(compatible.contains("1.5.0"));
        assertFalse(compatible.contains("1.4.1"));
        assertTrue(VersionSpecifier.parse("~=2.2").contains("2.9"));
        assertFalse(VersionSpecifier.parse("~=2.2").contains("3.0"));
    }

    @Test
    void prereleasesOnlyWhenNamed() {
        assertFalse(VersionSpecifier.parse(">=1.0").contains("2.0.0-beta"));
        assertTrue(VersionSpecifier.parse(">=2.0.0-alpha").contains("2.0.0-beta"));
    }

    @Test
    void prereleaseFallsBelowItsRelease() {
        VersionSpecifier beforeRelease = VersionSpecifier.parse(">=2.0.0-dev,<2.0.0");
        assertTrue(beforeRelease.contains("2.0.0-dev"));
        assertTrue(beforeRelease.contains("2.0.0-x.7"));
        assertFalse(beforeRelease.contains("2.0.0"));
    }

    @Test
    void malformedSpecifiersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> VersionSpecifier.parse("about 1.0"));
        assertThrows(IllegalArgumentException.class, () -> VersionSpecifier.parse(">=1.*"));
        assertThrows(IllegalArgumentException.class, () -> VersionSpecifier.parse("~=1"));
    }

    @Test
    void keepsOriginalText() {
        assertEquals(">=1.0,<2", VersionSpecifier.parse(" >=1.0,<2 ").toString());
    }
}

package com.csd.formulary.resolution;

import org.apache.maven.artifact.versioning.ArtifactVersion;
import org.apache.maven.artifact.versioning.DefaultArtifactVersion;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class VersionUtil {
    private static final Pattern RELEASE = Pattern.compile("^v?\\d+(\\.\\d+)*$");
    private static final Pattern RELEASE_AND_QUALIFIER = Pattern.compile("^(\\d+(?:\\.\\d+)*)[-.+]?(.*)$");

    private VersionUtil() {}

    /**
     * Numeric segments are compared first; a version with a qualifier sorts below the same
     * release without one, so {@code 1.0.0-dev < 1.0.0}. Two qualifiers on the same release
     * are ordered by Maven's qualifier rules.
     */
    public static int compare(String a, String b) {
        if (a == null && b == null) return 0;
        if (a == null) return -1;
        if (b == null) return 1;
        String sa = strip(a);
        String sb = strip(b);
        Matcher ma = RELEASE_AND_QUALIFIER.matcher(sa);
        Matcher mb = RELEASE_AND_QUALIFIER.matcher(sb);
        if (!ma.matches() || !mb.matches()) {
            return artifactVersion(sa).compareTo(artifactVersion(sb));
        }
        int release = artifactVersion(ma.group(1)).compareTo(artifactVersion(mb.group(1)));
        if (release != 0) return release;

        boolean qualifiedA = !ma.group(2).isEmpty();
        boolean qualifiedB = !mb.group(2).isEmpty();
        if (qualifiedA != qualifiedB) return qualifiedA ? -1 : 1;
        if (!qualifiedA) return 0;
        return artifactVersion(sa).compareTo(artifactVersion(sb));
    }

    /** Anything that is not a plain dotted number, e.g. {@code 2.0.0-beta.1} or {@code 1.0rc1}. */
    public static boolean isPrerelease(String version) {
        return version != null && !RELEASE.matcher(version.trim()).matches();
    }

    /** Newest first; versions of equal precedence keep a stable order by their text. */
    public static Comparator<String> newestFirst() {
        return (a, b) -> {
            int c = compare(b, a);
            return c != 0 ? c : a.compareTo(b);
        };
    }

    private static ArtifactVersion artifactVersion(String version) {
        return new DefaultArtifactVersion(version);
    }

    private static String strip(String version) {
        String v = version.trim();
        return v.startsWith("v") ? v.substring(1) : v;
    }
}

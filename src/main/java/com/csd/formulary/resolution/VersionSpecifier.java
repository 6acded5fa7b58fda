package com.csd.formulary.resolution;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Comma-separated version constraints such as {@code >=1.0.0,<2.0.0}, {@code ==1.4.*} or {@code ~=2.2}.
 * An empty specifier accepts every release. Pre-releases are accepted only when a clause names one.
 */
public final class VersionSpecifier {

    private static final Pattern CLAUSE = Pattern.compile("^(===|==|!=|~=|>=|<=|>|<)\\s*(\\S+)$");

    private enum Op { ARBITRARY, EQ, NE, COMPATIBLE, GE, LE, GT, LT }

    private record Clause(Op op, String version, boolean wildcard) {}

    private final String text;
    private final List<Clause> clauses;
    private final boolean allowsPrereleases;

    private VersionSpecifier(String text, List<Clause> clauses) {
        this.text = text;
        this.clauses = clauses;
        this.allowsPrereleases = clauses.stream().anyMatch(c -> VersionUtil.isPrerelease(c.version()));
    }

    public static VersionSpecifier parse(String specifier) {
        String text = specifier == null ? "" : specifier.trim();
        if (text.isEmpty()) return new VersionSpecifier("", Collections.emptyList());

        List<Clause> clauses = new ArrayList<>();
        for (String raw : text.split(",")) {
            String part = raw.trim();
            if (part.isEmpty()) continue;
            Matcher m = CLAUSE.matcher(part);
            if (!m.matches()) {
                throw new IllegalArgumentException("Invalid version specifier: '" + specifier + "'");
            }
            String version = m.group(2);
            boolean wildcard = version.endsWith(".*");
            Op op = switch (m.group(1)) {
                case "===" -> Op.ARBITRARY;
                case "==" -> Op.EQ;
                case "!=" -> Op.NE;
                case "~=" -> Op.COMPATIBLE;
                case ">=" -> Op.GE;
                case "<=" -> Op.LE;
                case ">" -> Op.GT;
                default -> Op.LT;
            };
            if (wildcard && op != Op.EQ && op != Op.NE) {
                throw new IllegalArgumentException("Wildcard only allowed with == or != in '" + specifier + "'");
            }
            if (op == Op.COMPATIBLE && version.split("\\.").length < 2) {
                throw new IllegalArgumentException("~= needs at least two release segments in '" + specifier + "'");
            }
            clauses.add(new Clause(op, wildcard ? version.substring(0, version.length() - 2) : version, wildcard));
        }
        return new VersionSpecifier(text, List.copyOf(clauses));
    }

    public boolean contains(String version) {
        if (version == null) return false;
        if (VersionUtil.isPrerelease(version) && !allowsPrereleases) return false;
        for (Clause clause : clauses) {
            if (!matches(clause, version)) return false;
        }
        return true;
    }

    private static boolean matches(Clause clause, String version) {
        int cmp = VersionUtil.compare(version, clause.version());
        return switch (clause.op()) {
            case ARBITRARY -> version.equals(clause.version());
            case EQ -> clause.wildcard() ? hasPrefix(version, clause.version()) : cmp == 0;
            case NE -> clause.wildcard() ? !hasPrefix(version, clause.version()) : cmp != 0;
            case GE -> cmp >= 0;
            case LE -> cmp <= 0;
            case GT -> cmp > 0;
            case LT -> cmp < 0;
            case COMPATIBLE -> cmp >= 0 && hasPrefix(version, compatiblePrefix(clause.version()));
        };
    }

    // ~=1.4.2 -> 1.4
    private static String compatiblePrefix(String version) {
        String[] parts = version.split("\\.");
        return String.join(".", Arrays.copyOf(parts, parts.length - 1));
    }

    private static boolean hasPrefix(String version, String prefix) {
        String[] v = version.split("[.\\-+]");
        String[] p = prefix.split("\\.");
        for (int i = 0; i < p.length; i++) {
            String segment = i < v.length ? v[i] : "0";
            if (VersionUtil.compare(segment, p[i]) != 0) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return text;
    }
}

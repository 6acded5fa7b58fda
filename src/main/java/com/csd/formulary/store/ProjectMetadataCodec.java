package com.csd.formulary.store;

import com.csd.formulary.model.FunctionDefinition;
import com.csd.formulary.model.Lockfile;
import com.csd.formulary.model.PackageLock;
import com.csd.formulary.model.ProjectMetadata;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Encodes the project manifest and lockfile as spreadsheet array literals, e.g.
 * {@code ={"Key","Value";"name","demo"}}. Quotes inside values are doubled.
 */
@Slf4j
@Component
public class ProjectMetadataCodec {

    private static final List<String> LOCK_HEADER =
            List.of("Package", "Version", "Resolved", "Integrity", "Dependencies", "Functions");
    private static final Set<String> STANDARD_KEYS = Set.of("name", "version", "description", "dependencies");
    /** Specifier clauses start with an operator, so only a comma followed by a name opens a new requirement. */
    private static final Pattern REQUIREMENT_SEPARATOR = Pattern.compile(",(?=\\s*[A-Za-z0-9_-])");
    private static final Pattern COMMA = Pattern.compile(",");

    private final ObjectMapper mapper;

    public ProjectMetadataCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public FunctionDefinition projectFunction(ProjectMetadata metadata) {
        return FunctionDefinition.builder()
                .name(FunctionStore.PROJECT_FUNCTION)
                .definition(encodeProject(metadata))
                .description("Project Metadata")
                .build();
    }

    public FunctionDefinition lockFunction(Lockfile lockfile) {
        return FunctionDefinition.builder()
                .name(FunctionStore.LOCK_FUNCTION)
                .definition(encodeLockfile(lockfile))
                .description("Project Lockfile")
                .build();
    }

    public String encodeProject(ProjectMetadata metadata) {
        List<List<String>> rows = new ArrayList<>();
        rows.add(List.of("Key", "Value"));
        rows.add(List.of("name", nullToEmpty(metadata.getName())));
        rows.add(List.of("version", nullToEmpty(metadata.getVersion())));
        rows.add(List.of("description", nullToEmpty(metadata.getDescription())));
        rows.add(List.of("dependencies", String.join(",", metadata.getDependencies())));
        metadata.getExtra().forEach((k, v) -> {
            if (!STANDARD_KEYS.contains(k)) rows.add(List.of(k, nullToEmpty(v)));
        });
        return formatArrayLiteral(rows);
    }

    /**
     * @return the decoded manifest, or {@code null} when the definition holds nothing usable
     */
    public ProjectMetadata decodeProject(String definition) {
        if (definition == null) return null;
        String text = definition.strip();
        Map<String, String> values = new LinkedHashMap<>();
        List<String> dependencies = new ArrayList<>();

        if (text.startsWith("=\"") || text.startsWith("{")) {
            Map<String, Object> legacy = readLegacyJson(text);
            if (legacy == null) return null;
            legacy.forEach((k, v) -> {
                if ("dependencies".equals(k) && v instanceof List<?> list) {
                    list.forEach(d -> dependencies.add(String.valueOf(d).trim()));
                } else if (v != null) {
                    values.put(k, String.valueOf(v));
                }
            });
        } else {
            List<List<String>> rows = parseArrayLiteral(text);
            if (rows.size() < 2) return null;
            for (List<String> row : rows.subList(1, rows.size())) {
                if (row.size() < 2) continue;
                if ("dependencies".equals(row.get(0))) {
                    dependencies.addAll(splitRequirements(row.get(1)));
                } else {
                    values.put(row.get(0), row.get(1));
                }
            }
        }

        Map<String, String> extra = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (!STANDARD_KEYS.contains(k)) extra.put(k, v);
        });
        return ProjectMetadata.builder()
                .name(values.get("name"))
                .version(values.get("version"))
                .description(values.getOrDefault("description", ""))
                .dependencies(dependencies)
                .extra(extra)
                .build();
    }

    public String encodeLockfile(Lockfile lockfile) {
        List<List<String>> rows = new ArrayList<>();
        rows.add(LOCK_HEADER);
        lockfile.getPackages().forEach((name, lock) -> rows.add(List.of(
                name,
                nullToEmpty(lock.getVersion()),
                nullToEmpty(lock.getResolved()),
                nullToEmpty(lock.getIntegrity()),
                String.join(",", lock.getDependencies()),
                String.join(",", lock.getFunctions()))));
        return formatArrayLiteral(rows);
    }

    public Lockfile decodeLockfile(String definition) {
        Lockfile lockfile = Lockfile.empty();
        if (definition == null) return lockfile;
        List<List<String>> rows = parseArrayLiteral(definition.strip());
        for (int i = 1; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            if (row.size() < 2) continue;
            lockfile.getPackages().put(row.get(0), PackageLock.builder()
                    .version(row.get(1))
                    .resolved(emptyToNull(column(row, 2)))
                    .integrity(emptyToNull(column(row, 3)))
                    .dependencies(splitRequirements(column(row, 4)))
                    .functions(splitList(column(row, 5)))
                    .build());
        }
        return lockfile;
    }

    static String formatArrayLiteral(List<List<String>> rows) {
        return rows.stream()
                .map(row -> row.stream()
                        .map(col -> "\"" + col.replace("\"", "\"\"") + "\"")
                        .collect(Collectors.joining(",")))
                .collect(Collectors.joining(";", "={", "}"));
    }

    /** Characters outside quotes other than separators are ignored. */
    static List<List<String>> parseArrayLiteral(String text) {
        List<List<String>> rows = new ArrayList<>();
        if (!text.startsWith("={") || !text.endsWith("}")) return rows;
        String content = text.substring(2, text.length() - 1);

        List<String> row = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean inQuote = false;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '"') {
                if (inQuote && i + 1 < content.length() && content.charAt(i + 1) == '"') {
                    cell.append('"');
                    i++;
                } else {
                    inQuote = !inQuote;
                }
            } else if (inQuote) {
                cell.append(c);
            } else if (c == ',') {
                row.add(cell.toString());
                cell.setLength(0);
            } else if (c == ';') {
                row.add(cell.toString());
                rows.add(row);
                row = new ArrayList<>();
                cell.setLength(0);
            }
        }
        if (cell.length() > 0 || !row.isEmpty()) {
            row.add(cell.toString());
            rows.add(row);
        }
        return rows;
    }

    private Map<String, Object> readLegacyJson(String text) {
        String json = text;
        if (text.startsWith("=\"")) {
            json = text.substring(2, text.endsWith("\"") ? text.length() - 1 : text.length()).replace("\"\"", "\"");
        }
        try {
            return mapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (IOException e) {
            log.warn("Ignoring unreadable legacy project metadata: {}", e.getMessage());
            return null;
        }
    }

    static List<String> splitRequirements(String value) {
        return split(value, REQUIREMENT_SEPARATOR);
    }

    private static List<String> splitList(String value) {
        return split(value, COMMA);
    }

    private static List<String> split(String value, Pattern separator) {
        if (value == null || value.isBlank()) return new ArrayList<>();
        return Arrays.stream(separator.split(value))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static String column(List<String> row, int index) {
        return index < row.size() ? row.get(index) : "";
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}

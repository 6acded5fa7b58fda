package com.csd.formulary.bundling;

import com.csd.formulary.exception.ArchiveCorruptException;
import com.csd.formulary.model.ArgumentMetadata;
import com.csd.formulary.model.ExtractedPackage;
import com.csd.formulary.model.FunctionDefinition;
import com.csd.formulary.model.Lockfile;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.HexFormat;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Reads and writes package archives: a zip holding {@code __GSPROJECT__.json} (project metadata),
 * an optional {@code __LOCK__.json} and {@code functions.json}.
 */
@Slf4j
@Component
public class PackageArchiver {

    public static final String PROJECT_ENTRY = "__GSPROJECT__.json";
    public static final String LOCK_ENTRY = "__LOCK__.json";
    public static final String FUNCTIONS_ENTRY = "functions.json";

    private final ObjectMapper mapper;

    public PackageArchiver(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ExtractedPackage extract(Path archive) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(archive);
        } catch (IOException e) {
            throw new ArchiveCorruptException("Cannot read package archive " + archive, e);
        }
        String integrity = integrity(bytes);

        Map<String, byte[]> entries = readEntries(archive, bytes);
        byte[] project = entries.get(PROJECT_ENTRY);
        byte[] functionsJson = entries.get(FUNCTIONS_ENTRY);
        if (project == null || functionsJson == null) {
            throw new ArchiveCorruptException("Package archive " + archive + " is missing "
                    + (project == null ? PROJECT_ENTRY : FUNCTIONS_ENTRY));
        }

        try {
            Map<String, Object> metadata = mapper.readValue(project, new TypeReference<LinkedHashMap<String, Object>>() {});
            Lockfile lockfile = entries.containsKey(LOCK_ENTRY)
                    ? mapper.readValue(entries.get(LOCK_ENTRY), Lockfile.class)
                    : Lockfile.empty();
            Map<String, FunctionDefinition> functions = readFunctions(mapper.readTree(functionsJson));
            log.debug("Extracted {} functions from {}", functions.size(), archive);
            return ExtractedPackage.builder()
                    .metadata(metadata)
                    .lockfile(lockfile)
                    .functions(functions)
                    .integrity(integrity)
                    .build();
        } catch (IOException e) {
            throw new ArchiveCorruptException("Malformed JSON in package archive " + archive, e);
        }
    }

    /**
     * Writes an archive and returns the number of bytes written. Arguments are always written in
     * the map form, with default metadata for arguments that have none.
     */
    public long create(Path output, Map<String, Object> metadata, Map<String, FunctionDefinition> functions, Lockfile lockfile) throws IOException {
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bos)) {
            writeEntry(zip, PROJECT_ENTRY, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(metadata));
            if (lockfile != null) {
                writeEntry(zip, LOCK_ENTRY, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(lockfile));
            }
            writeEntry(zip, FUNCTIONS_ENTRY, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(functionsNode(functions)));
        }
        byte[] bytes = bos.toByteArray();
        Files.write(output, bytes);
        log.info("Wrote package archive {} ({} bytes, {} functions)", output, bytes.length, functions.size());
        return bytes.length;
    }

    public static String integrity(byte[] archiveBytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return "sha256:" + HexFormat.of().formatHex(digest.digest(archiveBytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private Map<String, byte[]> readEntries(Path archive, byte[] bytes) {
        Map<String, byte[]> entries = new HashMap<>();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(bytes))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (!entry.isDirectory()) {
                    entries.put(entry.getName(), zip.readAllBytes());
                }
            }
        } catch (ZipException e) {
            throw new ArchiveCorruptException("Package archive " + archive + " is not a valid zip file", e);
        } catch (IOException e) {
            throw new ArchiveCorruptException("Cannot read package archive " + archive, e);
        }
        if (entries.isEmpty()) {
            throw new ArchiveCorruptException("Package archive " + archive + " is empty or not a zip file");
        }
        return entries;
    }

    private Map<String, FunctionDefinition> readFunctions(JsonNode root) {
        if (!root.isObject()) {
            throw new ArchiveCorruptException(FUNCTIONS_ENTRY + " must be an object");
        }
        Map<String, FunctionDefinition> functions = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode data = field.getValue();
            if (!data.hasNonNull("definition")) {
                throw new ArchiveCorruptException("Function '" + name + "' has no definition");
            }

            List<String> argNames = new ArrayList<>();
            Map<String, ArgumentMetadata> argMeta = new LinkedHashMap<>();
            JsonNode args = data.path("arguments");
            if (args.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> argFields = args.fields();
                while (argFields.hasNext()) {
                    Map.Entry<String, JsonNode> arg = argFields.next();
                    argNames.add(arg.getKey());
                    argMeta.put(arg.getKey(), ArgumentMetadata.builder()
                            .description(textOr(arg.getValue(), "description", ArgumentMetadata.NO_DESCRIPTION))
                            .example(textOr(arg.getValue(), "example", ArgumentMetadata.NO_EXAMPLE))
                            .build());
                }
            } else if (args.isArray()) {
                // legacy form: names only
                args.forEach(a -> argNames.add(a.asText()));
            }

            functions.put(name, FunctionDefinition.builder()
                    .name(name)
                    .definition(data.get("definition").asText())
                    .description(data.hasNonNull("description") ? data.get("description").asText() : null)
                    .arguments(argNames)
                    .argumentMetadata(argMeta)
                    .build());
        }
        return functions;
    }

    private ObjectNode functionsNode(Map<String, FunctionDefinition> functions) {
        ObjectNode root = mapper.createObjectNode();
        functions.forEach((name, f) -> {
            ObjectNode fn = root.putObject(name);
            fn.put("definition", f.getDefinition());
            fn.put("description", f.getDescription());
            ObjectNode args = fn.putObject("arguments");
            for (String arg : f.getArguments()) {
                ArgumentMetadata meta = f.getArgumentMetadata().getOrDefault(arg, new ArgumentMetadata());
                ObjectNode argNode = args.putObject(arg);
                argNode.put("description", meta.getDescription());
                argNode.put("example", meta.getExample());
            }
        });
        return root;
    }

    private static String textOr(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? fallback : value.asText();
    }

    private static void writeEntry(ZipOutputStream zip, String name, byte[] content) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        zip.write(content);
        zip.closeEntry();
    }
}

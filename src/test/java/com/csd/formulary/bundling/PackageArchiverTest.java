package com.csd.formulary.bundling;

import com.csd.formulary.exception.ArchiveCorruptException;
import com.csd.formulary.model.ArgumentMetadata;
import com.csd.formulary.model.ExtractedPackage;
import com.csd.formulary.model.FunctionDefinition;
import com.csd.formulary.model.Lockfile;
import com.csd.formulary.model.PackageLock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.*;

public class PackageArchiverTest {

    private final PackageArchiver archiver = new PackageArchiver(new ObjectMapper());

    @TempDir
    Path tmp;

    @Test
    void createThenExtract() throws Exception {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("name", "pkg-a");
        metadata.put("version", "1.2.0");
        metadata.put("dependencies", List.of("pkg-b>=1.0"));

        Map<String, FunctionDefinition> functions = new LinkedHashMap<>();
        functions.put("DOUBLE", FunctionDefinition.builder()
                .name("DOUBLE")
                .definition("=LAMBDA(x, x*2)")
                .description("Doubles a value")
                .arguments(List.of("x"))
                .argumentMetadata(new LinkedHashMap<>(Map.of("x", new ArgumentMetadata("a number", "3"))))
                .build());

        Lockfile lockfile = Lockfile.empty();
        lockfile.getPackages().put("pkg-b", PackageLock.builder().version("1.0.0").functions(List.of("B")).build());

        Path output = tmp.resolve("out/pkg-a.gspkg");
        long written = archiver.create(output, metadata, functions, lockfile);
        assertEquals(Files.size(output), written);

        ExtractedPackage extracted = archiver.extract(output);
        assertEquals("pkg-a", extracted.getName());
        assertEquals("1.2.0", extracted.getVersion());
        assertEquals(List.of("pkg-b>=1.0"), extracted.getDependencies());
        assertEquals("1.0.0", extracted.getLockfile().getPackages().get("pkg-b").getVersion());

        FunctionDefinition fn = extracted.getFunctions().get("DOUBLE");
        assertEquals("=LAMBDA(x, x*2)", fn.getDefinition());
        assertEquals(List.of("x"), fn.getArguments());
        assertEquals("a number", fn.getArgumentMetadata().get("x").getDescription());

        String expected = "sha256:" + HexFormat.of().formatHex(
                MessageDigest.getInstance("SHA-256").digest(Files.readAllBytes(output)));
        assertEquals(expected, extracted.getIntegrity());
    }

    @Test
    void argumentsWithoutMetadataGetDefaults() throws IOException {
        Map<String, FunctionDefinition> functions = Map.of("F", FunctionDefinition.builder()
                .name("F").definition("=1").arguments(List.of("a")).build());
        Path output = tmp.resolve("f.gspkg");
        archiver.create(output, Map.of("name", "f", "version", "1.0"), functions, null);

        ExtractedPackage extracted = archiver.extract(output);
        ArgumentMetadata meta = extracted.getFunctions().get("F").getArgumentMetadata().get("a");
        assertEquals(ArgumentMetadata.NO_DESCRIPTION, meta.getDescription());
        assertEquals(ArgumentMetadata.NO_EXAMPLE, meta.getExample());
        assertTrue(extracted.getLockfile().getPackages().isEmpty());
    }

    @Test
    void readsLegacyArgumentList() throws IOException {
        Path archive = zip(tmp.resolve("legacy.gspkg"), Map.of(
                PackageArchiver.PROJECT_ENTRY, "{\"name\":\"old\",\"version\":\"0.1\"}",
                PackageArchiver.FUNCTIONS_ENTRY, "{\"ADD\":{\"definition\":\"=LAMBDA(a,b,a+b)\",\"arguments\":[\"a\",\"b\"]}}"));
        FunctionDefinition fn = archiver.extract(archive).getFunctions().get("ADD");
        assertEquals(List.of("a", "b"), fn.getArguments());
        assertNull(fn.getDescription());
    }

    @Test
    void missingEntriesAreCorrupt() throws IOException {
        Path noFunctions = zip(tmp.resolve("nf.gspkg"), Map.of(PackageArchiver.PROJECT_ENTRY, "{}"));
        assertThrows(ArchiveCorruptException.class, () -> archiver.extract(noFunctions));

        Path notZip = tmp.resolve("plain.gspkg");
        Files.writeString(notZip, "definitely not a zip");
        assertThrows(ArchiveCorruptException.class, () -> archiver.extract(notZip));

        assertThrows(ArchiveCorruptException.class, () -> archiver.extract(tmp.resolve("absent.gspkg")));
    }

    @Test
    void malformedJsonIsCorrupt() throws IOException {
        Path archive = zip(tmp.resolve("bad.gspkg"), Map.of(
                PackageArchiver.PROJECT_ENTRY, "{\"name\":",
                PackageArchiver.FUNCTIONS_ENTRY, "{}"));
        assertThrows(ArchiveCorruptException.class, () -> archiver.extract(archive));
    }

    private static Path zip(Path path, Map<String, String> entries) throws IOException {
        try (OutputStream out = Files.newOutputStream(path); ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
        return path;
    }
}

package com.csd.formulary.registry;

import com.csd.formulary.exception.FormularyException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Local store of downloaded archives at {@code <root>/<name>/<version>.gspkg}. Entries are only ever
 * added; a fill writes to a temporary file and moves it into place, so readers never see partial data.
 */
@Slf4j
public class ArtifactCache {

    private final Path root;

    public ArtifactCache(Path root) {
        this.root = root;
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            log.error("Failed to create cache dir {}", root, e);
        }
    }

    public Path getRoot() {
        return root;
    }

    public Path pathFor(String packageName, String version) {
        return root.resolve(packageName).resolve(version + ".gspkg");
    }

    public boolean has(String packageName, String version) {
        return Files.isRegularFile(pathFor(packageName, version));
    }

    /**
     * Returns the cached archive, downloading it through {@code downloader} first on a miss.
     */
    public Path fill(String packageName, String version, Consumer<Path> downloader) {
        Path target = pathFor(packageName, version);
        if (Files.isRegularFile(target)) {
            log.debug("Cache hit for {}@{}", packageName, version);
            return target;
        }
        Path partial = null;
        try {
            Files.createDirectories(target.getParent());
            partial = Files.createTempFile(target.getParent(), version + "-", ".part");
            downloader.accept(partial);
            try {
                Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Cached {}@{} at {}", packageName, version, target);
            return target;
        } catch (IOException e) {
            throw new FormularyException("Failed to cache " + packageName + "@" + version, e);
        } finally {
            if (partial != null) {
                try {
                    Files.deleteIfExists(partial);
                } catch (IOException e) {
                    log.warn("Could not remove partial download {}: {}", partial, e.getMessage());
                }
            }
        }
    }

    public void clear() {
        if (!Files.exists(root)) return;
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder())
                    .filter(p -> !p.equals(root))
                    .forEach(p -> {
                        try {
                            Files.delete(p);
                        } catch (IOException e) {
                            throw new FormularyException("Failed to clear cache entry " + p, e);
                        }
                    });
        } catch (IOException e) {
            throw new FormularyException("Failed to clear cache " + root, e);
        }
    }
}

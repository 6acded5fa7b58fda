package com.csd.formulary.registry;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.function.Supplier;

/**
 * Holds the registry index once fetched. Owned by whoever builds the registry client;
 * {@link #invalidate()} forces the next lookup to go back to the network.
 */
@Slf4j
public class RegistryIndexCache {

    private JsonNode index;
    private Instant loadedAt;

    public synchronized JsonNode get(Supplier<JsonNode> loader) {
        if (index == null) {
            index = loader.get();
            loadedAt = Instant.now();
            log.debug("Registry index loaded with {} packages", index.size());
        } else {
            log.debug("Cache hit for registry index loaded at {}", loadedAt);
        }
        return index;
    }

    public synchronized void invalidate() {
        index = null;
        loadedAt = null;
    }
}

package com.csd.formulary.store;

import com.csd.formulary.exception.FunctionStoreException;
import com.csd.formulary.model.FunctionDefinition;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Function store backed by a single JSON document of {@code name -> definition}. Every write rewrites the file.
 */
@Slf4j
public class JsonFileFunctionStore implements FunctionStore {

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileFunctionStore(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public synchronized Map<String, FunctionDefinition> getNamedFunctions() {
        return read();
    }

    @Override
    public synchronized void createFunction(FunctionDefinition function) {
        Map<String, FunctionDefinition> functions = read();
        if (functions.containsKey(function.getName())) {
            throw new FunctionStoreException("Function '" + function.getName() + "' already exists");
        }
        functions.put(function.getName(), function);
        write(functions);
        log.debug("Created function {}", function.getName());
    }

    @Override
    public synchronized void updateFunction(FunctionDefinition function) {
        Map<String, FunctionDefinition> functions = read();
        functions.put(function.getName(), function);
        write(functions);
        log.debug("Updated function {}", function.getName());
    }

    @Override
    public synchronized void deleteFunction(String name) {
        Map<String, FunctionDefinition> functions = read();
        if (functions.remove(name) == null) {
            log.warn("Function {} not present, nothing to delete", name);
            return;
        }
        write(functions);
        log.debug("Deleted function {}", name);
    }

    private Map<String, FunctionDefinition> read() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, FunctionDefinition> functions = mapper.readValue(file.toFile(),
                    new TypeReference<LinkedHashMap<String, FunctionDefinition>>() {});
            // the map key is authoritative for the name
            functions.forEach((name, def) -> def.setName(name));
            return functions;
        } catch (IOException e) {
            throw new FunctionStoreException("Failed to read function store " + file, e);
        }
    }

    private void write(Map<String, FunctionDefinition> functions) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), functions);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new FunctionStoreException("Failed to write function store " + file, e);
        }
    }
}

package com.csd.formulary.store;

import com.csd.formulary.model.FunctionDefinition;

import java.util.Map;
import java.util.Set;

/**
 * The spreadsheet's named functions. Writes are applied one at a time; callers must not write concurrently.
 */
public interface FunctionStore {

    String PROJECT_FUNCTION = "__GSPROJECT__";
    String LOCK_FUNCTION = "__LOCK__";
    Set<String> RESERVED_NAMES = Set.of(PROJECT_FUNCTION, LOCK_FUNCTION);

    Map<String, FunctionDefinition> getNamedFunctions();

    /** @throws com.csd.formulary.exception.FunctionStoreException if the name is taken */
    void createFunction(FunctionDefinition function);

    /** Replaces the named function, creating it when absent. */
    void updateFunction(FunctionDefinition function);

    void deleteFunction(String name);

    static boolean isReserved(String name) {
        return name != null && RESERVED_NAMES.contains(name);
    }
}

package com.csd.formulary.store;

import com.csd.formulary.model.FunctionDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.TreeMap;

/**
 * Short content hash of a function: first 12 hex chars of SHA-256 over
 * {@code {"arguments":[...],"definition":"...","description":"..."}} with sorted keys.
 */
public final class FunctionHasher {

    private static final ObjectMapper CANONICAL = new ObjectMapper();

    private FunctionHasher() {
    }

    public static String hash(FunctionDefinition function) {
        TreeMap<String, Object> data = new TreeMap<>();
        data.put("arguments", function.getArguments() == null ? List.of() : function.getArguments());
        data.put("definition", function.getDefinition() == null ? "" : function.getDefinition());
        data.put("description", function.getDescription() == null ? "" : function.getDescription());
        try {
            byte[] json = CANONICAL.writeValueAsBytes(data);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
            return HexFormat.of().formatHex(digest).substring(0, 12);
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Cannot hash function " + function.getName(), e);
        }
    }

    public static boolean sameContent(FunctionDefinition a, FunctionDefinition b) {
        if (a == null || b == null) return a == b;
        return hash(a).equals(hash(b));
    }
}

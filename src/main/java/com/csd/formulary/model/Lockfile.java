package com.csd.formulary.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Record of installed package versions and the functions each one owns.
 * A function name is owned by at most one package.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Lockfile {
    @Builder.Default
    private Map<String, PackageLock> packages = new LinkedHashMap<>();

    public static Lockfile empty() {
        return new Lockfile();
    }

    /** function name -> owning package */
    public Map<String, String> ownership() {
        Map<String, String> owners = new LinkedHashMap<>();
        packages.forEach((pkg, lock) -> lock.getFunctions().forEach(f -> owners.put(f, pkg)));
        return owners;
    }

    public boolean contains(String packageName) {
        return packages.containsKey(packageName);
    }

    public Lockfile copy() {
        Map<String, PackageLock> copied = new LinkedHashMap<>();
        packages.forEach((name, lock) -> copied.put(name, lock.toBuilder()
                .dependencies(new ArrayList<>(lock.getDependencies()))
                .functions(new ArrayList<>(lock.getFunctions()))
                .build()));
        return new Lockfile(copied);
    }
}

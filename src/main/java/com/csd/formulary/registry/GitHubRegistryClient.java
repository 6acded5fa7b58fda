package com.csd.formulary.registry;

import com.csd.formulary.exception.PackageNotFoundException;
import com.csd.formulary.exception.RegistryException;
import com.csd.formulary.exception.VersionNotFoundException;
import com.csd.formulary.model.PackageMetadata;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry served as static files: {@code index.json} at the root plus one archive per version.
 *
 * <pre>
 * { "pkg": { "description": ..., "author": ..., "license": ..., "homepage": ...,
 *            "versions": { "1.0.0": { "dependencies": [...], "description": ..., "path": ... } } } }
 * </pre>
 */
@Slf4j
public class GitHubRegistryClient implements RegistryClient {

    private final String baseUrl;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final RegistryIndexCache indexCache;

    public GitHubRegistryClient(String baseUrl, OkHttpClient client, ObjectMapper mapper, RegistryIndexCache indexCache) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.client = client;
        this.mapper = mapper;
        this.indexCache = indexCache;
    }

    @Override
    public Set<String> getVersions(String packageName) {
        JsonNode versions = index().path(packageName).path("versions");
        Set<String> result = new LinkedHashSet<>();
        if (versions.isObject()) {
            versions.fieldNames().forEachRemaining(result::add);
        }
        return result;
    }

    @Override
    public PackageMetadata getPackageMetadata(String packageName, String version) {
        JsonNode pkg = index().get(packageName);
        if (pkg == null) {
            throw new PackageNotFoundException(packageName);
        }
        JsonNode entry = pkg.path("versions").get(version);
        if (entry == null) {
            throw new VersionNotFoundException(packageName, version);
        }
        List<String> deps = new ArrayList<>();
        entry.path("dependencies").forEach(d -> deps.add(d.asText()));
        return PackageMetadata.builder()
                .dependencies(deps)
                .description(entry.hasNonNull("description") ? entry.get("description").asText() : null)
                .path(entry.hasNonNull("path") ? entry.get("path").asText() : null)
                .build();
    }

    @Override
    public Map<String, String> getPackageAttributes(String packageName) {
        JsonNode pkg = index().get(packageName);
        if (pkg == null) {
            throw new PackageNotFoundException(packageName);
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = pkg.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isValueNode() && !field.getValue().isNull()) {
                attributes.put(field.getKey(), field.getValue().asText());
            }
        }
        return attributes;
    }

    @Override
    public Path downloadPackage(String packageName, String version, Path targetPath) {
        PackageMetadata metadata = getPackageMetadata(packageName, version);
        if (metadata.getPath() != null && !metadata.getPath().isBlank()) {
            if (fetch(baseUrl + "/" + metadata.getPath(), targetPath)) {
                return targetPath;
            }
            log.warn("Archive for {}@{} missing at {}, trying legacy location", packageName, version, metadata.getPath());
        }
        String legacy = String.format("%s/packages/%s/%s/%s@%s.gspkg", baseUrl, packageName, version, packageName, version);
        if (!fetch(legacy, targetPath)) {
            throw new VersionNotFoundException(packageName, version);
        }
        return targetPath;
    }

    /** Drops the cached index and fetches it again. */
    public void refreshIndex() {
        indexCache.invalidate();
        index();
    }

    private JsonNode index() {
        return indexCache.get(this::fetchIndex);
    }

    private JsonNode fetchIndex() {
        String url = baseUrl + "/index.json";
        log.info("Fetching registry index from {}", url);
        Request request = new Request.Builder().url(url).build();
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) throw new RegistryException("Failed to fetch registry index: " + response);
            ResponseBody body = response.body();
            if (body == null) throw new RegistryException("Empty registry index response from " + url);
            JsonNode root = mapper.readTree(body.string());
            if (!root.isObject()) throw new RegistryException("Invalid registry index at " + url);
            return root;
        } catch (IOException e) {
            throw new RegistryException("Failed to fetch registry index from " + url, e);
        }
    }

    // false on 404, throws on any other failure
    private boolean fetch(String url, Path targetPath) {
        log.debug("Downloading {}", url);
        Request request = new Request.Builder().url(url).build();
        try (Response response = client.newCall(request).execute()) {
            if (response.code() == 404) return false;
            if (!response.isSuccessful()) throw new RegistryException("Failed to download " + url + ": " + response);
            ResponseBody body = response.body();
            if (body == null) throw new RegistryException("Empty response body for " + url);
            try (InputStream in = body.byteStream()) {
                Files.copy(in, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
            return true;
        } catch (IOException e) {
            throw new RegistryException("Failed to download " + url, e);
        }
    }
}

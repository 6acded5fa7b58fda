package com.csd.formulary.controller;

import com.csd.formulary.model.PackageInfo;
import com.csd.formulary.model.ProjectState;
import com.csd.formulary.model.ReconcileResult;
import com.csd.formulary.registry.GitHubRegistryClient;
import com.csd.formulary.service.PackageInfoService;
import com.csd.formulary.service.PackageManagerService;
import com.csd.formulary.service.PublishService;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Slf4j
public class PackageController {

    private final PackageManagerService packageManager;
    private final PackageInfoService infoService;
    private final PublishService publishService;
    private final GitHubRegistryClient registryClient;

    public PackageController(PackageManagerService packageManager, PackageInfoService infoService,
                             PublishService publishService, GitHubRegistryClient registryClient) {
        this.packageManager = packageManager;
        this.infoService = infoService;
        this.publishService = publishService;
        this.registryClient = registryClient;
    }

    @PostMapping("/init")
    public Map<String, Object> init(@RequestBody InitRequest request) {
        boolean created = packageManager.init(request.getName(), request.getVersion(), request.getDescription());
        return Map.of("created", created);
    }

    @PostMapping("/install")
    public ResponseEntity<?> install(@RequestBody InstallRequest request) {
        ReconcileResult result = packageManager.install(request.getPackages(), request.isLocal(), request.getResolutions());
        return ResponseEntity.ok(summary(result));
    }

    @PostMapping("/upgrade")
    public ResponseEntity<?> upgrade(@RequestBody UpgradeRequest request) {
        ReconcileResult result = packageManager.upgrade(request.getPackages(), request.getResolutions());
        Map<String, Object> body = summary(result);
        body.put("upgrades", result.getUpgrades());
        body.put("upToDate", result.isNoop());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/remove")
    public ResponseEntity<?> remove(@RequestBody RemoveRequest request) {
        return ResponseEntity.ok(summary(packageManager.remove(request.getPackages())));
    }

    @GetMapping("/packages/{name}")
    public PackageInfo info(@PathVariable String name, @RequestParam(required = false) String version) {
        return infoService.info(name, version);
    }

    @PostMapping("/pack")
    public Map<String, String> pack(@RequestBody PackRequest request) {
        String integrity = publishService.pack(Path.of(request.getOutput()));
        return Map.of("output", request.getOutput(), "integrity", integrity);
    }

    @GetMapping("/state")
    public Map<String, Object> state() {
        ProjectState state = packageManager.loadState(false);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("project", state.getMetadata());
        body.put("lockfile", state.getLockfile());
        body.put("functionCount", state.getFunctions().size());
        return body;
    }

    @PostMapping("/registry/refresh")
    public Map<String, Object> refreshRegistry() {
        registryClient.refreshIndex();
        return Map.of("refreshed", true);
    }

    private static Map<String, Object> summary(ReconcileResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("dependencies", result.getMetadata().getDependencies());
        body.put("lockfile", result.getLockfile());
        body.put("functions", new ArrayList<>(result.getFunctions().keySet()));
        body.put("deleted", result.getFunctionsToDelete());
        return body;
    }

    @Data
    public static class InitRequest {
        private String name;
        private String version;
        private String description;
    }

    @Data
    public static class InstallRequest {
        private List<String> packages = new ArrayList<>();
        private boolean local;
        private Map<String, Map<String, String>> resolutions = new LinkedHashMap<>();
    }

    @Data
    public static class UpgradeRequest {
        private List<String> packages = new ArrayList<>();
        private Map<String, Map<String, String>> resolutions = new LinkedHashMap<>();
    }

    @Data
    public static class RemoveRequest {
        private List<String> packages = new ArrayList<>();
    }

    @Data
    public static class PackRequest {
        private String output;
    }
}

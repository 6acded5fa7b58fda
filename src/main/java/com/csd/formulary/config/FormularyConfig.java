package com.csd.formulary.config;

import com.csd.formulary.registry.ArtifactCache;
import com.csd.formulary.registry.GitHubRegistryClient;
import com.csd.formulary.registry.RegistryIndexCache;
import com.csd.formulary.store.FunctionStore;
import com.csd.formulary.store.JsonFileFunctionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Configuration
public class FormularyConfig {

    @Value("${formulary.registry.url}")
    private String registryUrl;

    @Value("${formulary.cache.dir}")
    private String cacheDir;

    @Value("${formulary.store.path}")
    private String storePath;

    @Value("${formulary.materialize.threads:4}")
    private int materializeThreads;

    @Value("${formulary.http.timeout-seconds:30}")
    private long httpTimeoutSeconds;

    @Bean
    public OkHttpClient registryHttpClient() {
        Duration timeout = Duration.ofSeconds(httpTimeoutSeconds);
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .build();
    }

    @Bean
    public RegistryIndexCache registryIndexCache() {
        return new RegistryIndexCache();
    }

    @Bean
    public GitHubRegistryClient registryClient(OkHttpClient registryHttpClient, ObjectMapper objectMapper, RegistryIndexCache registryIndexCache) {
        log.info("Using package registry at {}", registryUrl);
        return new GitHubRegistryClient(registryUrl, registryHttpClient, objectMapper, registryIndexCache);
    }

    @Bean
    public ArtifactCache artifactCache() {
        return new ArtifactCache(Path.of(cacheDir));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService materializeExecutor() {
        return Executors.newFixedThreadPool(Math.max(1, materializeThreads));
    }

    @Bean
    public FunctionStore functionStore(ObjectMapper objectMapper) {
        log.info("Function store at {}", storePath);
        return new JsonFileFunctionStore(Path.of(storePath), objectMapper);
    }
}

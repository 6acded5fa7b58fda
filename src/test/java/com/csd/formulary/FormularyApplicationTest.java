package com.csd.formulary;

import com.csd.formulary.controller.PackageController;
import com.csd.formulary.service.PackageManagerService;
import com.csd.formulary.service.PackageMaterializer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "formulary.registry.url=http://localhost:1/registry",
        "formulary.cache.dir=target/test-cache",
        "formulary.store.path=target/test-store/functions.json"
})
public class FormularyApplicationTest {

    @Autowired
    private PackageController controller;

    @Autowired
    private PackageManagerService packageManager;

    @Autowired
    private PackageMaterializer materializer;

    @Test
    void contextLoads() {
        assertNotNull(controller);
        assertNotNull(packageManager);
        assertNotNull(materializer);
    }
}

package com.e2eq.hierarchy.runtime;

import com.e2eq.hierarchy.core.HierarchyConfig;
import com.e2eq.hierarchy.core.HierarchyConfigLoader;
import com.e2eq.hierarchy.core.HierarchyMaterializer;
import io.quarkus.logging.Log;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the hierarchy build configuration from the classpath and exposes both the
 * {@link HierarchyConfig} and a {@link HierarchyMaterializer} bound to it for injection.
 */
@ApplicationScoped
public class HierarchyConfigProducer {

    private final String configLocation;

    private HierarchyConfig config;
    private HierarchyMaterializer materializer;

    @Inject
    public HierarchyConfigProducer(@ConfigProperty(name = "quantum.hierarchy.config", defaultValue = "hierarchy/hierarchy-config.yaml")
                                   String configLocation) {
        this.configLocation = configLocation;
    }

    @PostConstruct
    void init() {
        this.config = loadConfig();
        this.materializer = new HierarchyMaterializer(config);
        Log.infof("Loaded hierarchy config from %s: %d seeds, %d structural exclusions, %d output exclusions",
                configLocation, config.seeds().size(), config.structuralExclusions().size(), config.outputExclusions().size());
    }

    @Produces
    public HierarchyConfig config() {
        return config;
    }

    @Produces
    public HierarchyMaterializer materializer() {
        return materializer;
    }

    private HierarchyConfig loadConfig() {
        try (InputStream stream = Thread.currentThread().getContextClassLoader().getResourceAsStream(configLocation)) {
            if (stream == null) {
                throw new IllegalStateException("Unable to locate hierarchy config resource at " + configLocation);
            }
            return new HierarchyConfigLoader().load(stream);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load hierarchy config from " + configLocation, e);
        }
    }
}

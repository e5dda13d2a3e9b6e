package com.e2eq.hierarchy.core;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads a {@link HierarchyConfig} from a YAML file or classpath resource.
 * <pre>
 * source: https://query.example.org/sparql
 * shareSubtrees: false
 * seeds: [Q29605, Q29600]
 * structuralExclusions: [Q19054]
 * outputExclusions: [Q19053]
 * propertiesUsed: {P1: instance of}
 * </pre>
 */
public final class HierarchyConfigLoader {

    // DTO mirroring YAML
    public record YHierarchyConfig(
            String source,
            Boolean shareSubtrees,
            List<String> seeds,
            List<String> structuralExclusions,
            List<String> outputExclusions,
            Map<String, String> propertiesUsed
    ) {}

    private final ObjectMapper mapper = new ObjectMapper(HierarchyJson.yamlFactory());

    public HierarchyConfig loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return load(in);
        }
    }

    public HierarchyConfig loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public HierarchyConfig load(InputStream in) throws IOException {
        return toConfig(mapper.readValue(in, YHierarchyConfig.class));
    }

    static HierarchyConfig toConfig(YHierarchyConfig y) {
        List<String> seeds = ids("seeds", y.seeds());
        List<String> structural = ids("structuralExclusions", y.structuralExclusions());
        List<String> output = ids("outputExclusions", y.outputExclusions());
        return new HierarchyConfig(
                seeds,
                new LinkedHashSet<>(structural),
                output,
                Boolean.TRUE.equals(y.shareSubtrees()),
                y.source(),
                Optional.ofNullable(y.propertiesUsed()).orElse(Map.of())
        );
    }

    private static List<String> ids(String field, List<String> values) {
        List<String> result = new ArrayList<>();
        for (String v : Optional.ofNullable(values).orElse(List.of())) {
            require(RelationStore.isWellFormed(v), "Malformed identifier '" + v + "' in " + field);
            result.add(v);
        }
        return result;
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}

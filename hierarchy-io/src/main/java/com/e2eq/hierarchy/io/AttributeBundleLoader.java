package com.e2eq.hierarchy.io;

import com.e2eq.hierarchy.model.AttributeBundle;
import com.e2eq.hierarchy.core.HierarchyJson;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads an identifier to {@link AttributeBundle} map from JSON.
 */
public final class AttributeBundleLoader {

    private static final TypeReference<LinkedHashMap<String, AttributeBundle>> BUNDLES = new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper(HierarchyJson.jsonFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public Map<String, AttributeBundle> load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new HierarchyIoException("Failed to read attribute bundles", path, e);
        }
    }

    public Map<String, AttributeBundle> load(InputStream in) throws IOException {
        Map<String, AttributeBundle> bundles = mapper.readValue(in, BUNDLES);
        return bundles == null ? Map.of() : bundles;
    }
}

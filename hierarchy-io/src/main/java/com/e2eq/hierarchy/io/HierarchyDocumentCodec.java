package com.e2eq.hierarchy.io;

import com.e2eq.hierarchy.model.HierarchyDocument;
import com.e2eq.hierarchy.core.HierarchyJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON form of a {@link HierarchyDocument}: pretty printed UTF-8 with non-ASCII labels kept as is.
 * Attributes this version does not know about are ignored on read.
 */
public final class HierarchyDocumentCodec {

    private final ObjectMapper mapper = new ObjectMapper(HierarchyJson.jsonFactory())
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public void write(HierarchyDocument document, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (OutputStream out = Files.newOutputStream(path)) {
                mapper.writeValue(out, document);
            }
        } catch (IOException e) {
            throw new HierarchyIoException("Failed to write hierarchy document", path, e);
        }
    }

    public HierarchyDocument read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return mapper.readValue(in, HierarchyDocument.class);
        } catch (IOException e) {
            throw new HierarchyIoException("Failed to read hierarchy document", path, e);
        }
    }

    public String toJson(HierarchyDocument document) throws JsonProcessingException {
        return mapper.writeValueAsString(document);
    }

    public HierarchyDocument fromJson(String json) throws JsonProcessingException {
        return mapper.readValue(json, HierarchyDocument.class);
    }
}

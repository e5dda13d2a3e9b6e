package com.e2eq.hierarchy.io;

import com.e2eq.hierarchy.core.HierarchyJson;
import com.e2eq.hierarchy.core.RelationStore;
import com.e2eq.hierarchy.exceptions.MalformedEdgeException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.logging.Log;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a {@link RelationSnapshot} from JSON or YAML (chosen by file extension) and populates a
 * {@link RelationStore} from it.
 */
public final class RelationSnapshotLoader {

    private final ObjectMapper json = new ObjectMapper(HierarchyJson.jsonFactory());
    private final ObjectMapper yaml = new ObjectMapper(HierarchyJson.yamlFactory());

    public RelationStore load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            RelationSnapshot snapshot = mapperFor(path).readValue(in, RelationSnapshot.class);
            RelationStore store = toStore(snapshot);
            Log.infof("Loaded %s: %d items, %d subclass relationships, %d instance relationships",
                    path.getFileName(), store.entityCount(), store.subclassEdgeCount(), store.instanceEdgeCount());
            return store;
        } catch (IOException e) {
            throw new HierarchyIoException("Failed to read relation snapshot", path, e);
        }
    }

    public static RelationStore toStore(RelationSnapshot snapshot) {
        RelationStore store = new RelationStore();
        for (Map.Entry<String, String> label : snapshot.labels().entrySet()) {
            store.putLabel(label.getKey(), label.getValue());
        }
        for (List<String> pair : snapshot.subclassOf()) {
            requirePair(RelationStore.SUBCLASS_OF, pair);
            store.addSubclass(pair.get(0), pair.get(1));
        }
        for (List<String> pair : snapshot.superclassOf()) {
            requirePair(RelationStore.SUPERCLASS_OF, pair);
            store.addSuperclass(pair.get(0), pair.get(1));
        }
        for (List<String> pair : snapshot.instanceOf()) {
            requirePair(RelationStore.INSTANCE_OF, pair);
            store.addInstance(pair.get(0), pair.get(1));
        }
        return store;
    }

    private static void requirePair(String relation, List<String> pair) {
        if (pair == null || pair.size() != 2) {
            throw new MalformedEdgeException("Malformed " + relation + " entry " + pair + ": expected exactly two identifiers");
        }
    }

    private ObjectMapper mapperFor(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") ? yaml : json;
    }
}

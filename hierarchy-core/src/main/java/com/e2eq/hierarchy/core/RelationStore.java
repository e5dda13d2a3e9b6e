package com.e2eq.hierarchy.core;

import com.e2eq.hierarchy.exceptions.MalformedEdgeException;

import java.util.*;

/**
 * Holds the deduplicated subclassOf and instanceOf edge sets of one build together with the
 * identifier to label lookup.
 * <p>
 * The store is populated by the acquisition side before the core runs and is treated as
 * frozen afterwards. Root inference edits a {@link #copy()}, never the caller's instance.
 * All lookups answer empty results for unknown identifiers.
 * </p>
 */
public final class RelationStore {

    public static final String SUBCLASS_OF = "subclassOf";
    public static final String SUPERCLASS_OF = "superclassOf";
    public static final String INSTANCE_OF = "instanceOf";

    /** Directed edge; {@code from} is the child or instance side. */
    public record Edge(String from, String to) {}

    private final Set<Edge> subclassEdges = new LinkedHashSet<>();
    private final Set<Edge> instanceEdges = new LinkedHashSet<>();
    private final Map<String, Set<String>> childrenByParent = new HashMap<>();
    private final Map<String, Set<String>> parentsByChild = new HashMap<>();
    private final Map<String, Set<String>> instancesByClass = new HashMap<>();
    private final Map<String, Set<String>> classesByInstance = new HashMap<>();
    private final Map<String, String> labels = new HashMap<>();

    public RelationStore addSubclass(String child, String parent) {
        requireWellFormed(SUBCLASS_OF, child, parent);
        if (subclassEdges.add(new Edge(child, parent))) {
            index(childrenByParent, parent, child);
            index(parentsByChild, child, parent);
        }
        return this;
    }

    /**
     * Records a superclassOf statement {@code (parent, child)} as the equivalent subclassOf edge.
     */
    public RelationStore addSuperclass(String parent, String child) {
        requireWellFormed(SUPERCLASS_OF, parent, child);
        return addSubclass(child, parent);
    }

    public RelationStore addInstance(String instance, String cls) {
        requireWellFormed(INSTANCE_OF, instance, cls);
        if (instanceEdges.add(new Edge(instance, cls))) {
            index(instancesByClass, cls, instance);
            index(classesByInstance, instance, cls);
        }
        return this;
    }

    /**
     * Stores a display label. Blank labels are ignored so the identifier keeps serving as its own label.
     */
    public RelationStore putLabel(String id, String label) {
        if (id == null || label == null || label.isBlank()) return this;
        labels.put(id, label);
        return this;
    }

    public String labelOf(String id) {
        return labels.getOrDefault(id, id);
    }

    public Set<String> childrenOf(String parent) {
        return view(childrenByParent, parent);
    }

    public Set<String> parentsOf(String child) {
        return view(parentsByChild, child);
    }

    public Set<String> instancesOf(String cls) {
        return view(instancesByClass, cls);
    }

    public Set<String> classesOf(String instance) {
        return view(classesByInstance, instance);
    }

    public boolean hasParent(String id) {
        return parentsByChild.containsKey(id);
    }

    public boolean hasChildren(String id) {
        return childrenByParent.containsKey(id);
    }

    public boolean hasInstances(String id) {
        return instancesByClass.containsKey(id);
    }

    public boolean isInstance(String id) {
        return classesByInstance.containsKey(id);
    }

    public Set<Edge> subclassEdges() {
        return Collections.unmodifiableSet(subclassEdges);
    }

    public Set<Edge> instanceEdges() {
        return Collections.unmodifiableSet(instanceEdges);
    }

    /**
     * Every identifier known to the store, whether through an edge endpoint or a label.
     */
    public Set<String> entityIds() {
        Set<String> ids = new HashSet<>(labels.keySet());
        for (Edge e : subclassEdges) {
            ids.add(e.from());
            ids.add(e.to());
        }
        for (Edge e : instanceEdges) {
            ids.add(e.from());
            ids.add(e.to());
        }
        return ids;
    }

    public int subclassEdgeCount() { return subclassEdges.size(); }
    public int instanceEdgeCount() { return instanceEdges.size(); }
    public int entityCount() { return entityIds().size(); }

    /**
     * Removes every subclassOf edge pointing at {@code parent}.
     *
     * @return the children that were detached, in no particular order
     */
    public Set<String> detachChildren(String parent) {
        Set<String> children = childrenByParent.remove(parent);
        if (children == null) return Set.of();
        for (String child : children) {
            subclassEdges.remove(new Edge(child, parent));
            Set<String> parents = parentsByChild.get(child);
            if (parents != null) {
                parents.remove(parent);
                if (parents.isEmpty()) parentsByChild.remove(child);
            }
        }
        return children;
    }

    /**
     * Unions the edges and labels of {@code other} into this store. Labels from {@code other} win.
     */
    public RelationStore mergeFrom(RelationStore other) {
        if (other == null) return this;
        for (Edge e : other.subclassEdges) addSubclass(e.from(), e.to());
        for (Edge e : other.instanceEdges) addInstance(e.from(), e.to());
        labels.putAll(other.labels);
        return this;
    }

    public RelationStore copy() {
        return new RelationStore().mergeFrom(this);
    }

    /**
     * Well-formed identifiers are non-blank and contain no whitespace.
     */
    public static boolean isWellFormed(String id) {
        if (id == null || id.isEmpty()) return false;
        for (int i = 0; i < id.length(); i++) {
            if (Character.isWhitespace(id.charAt(i))) return false;
        }
        return true;
    }

    private static void requireWellFormed(String relation, String from, String to) {
        if (!isWellFormed(from) || !isWellFormed(to)) {
            throw new MalformedEdgeException(relation, from, to);
        }
    }

    private static void index(Map<String, Set<String>> map, String key, String value) {
        map.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(value);
    }

    private static Set<String> view(Map<String, Set<String>> map, String key) {
        Set<String> values = map.get(key);
        return values == null ? Set.of() : Collections.unmodifiableSet(values);
    }
}

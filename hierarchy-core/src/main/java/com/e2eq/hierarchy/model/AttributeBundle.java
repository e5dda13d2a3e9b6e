package com.e2eq.hierarchy.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

/**
 * Descriptive attributes of one entity, supplied independently of the relation data and merged
 * onto an already built forest.
 * <p>
 * List attributes are deduplicated here, keeping first-seen order, so attaching the same
 * bundle twice can never produce repeated entries.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record AttributeBundle(
        String description,
        @JsonProperty("used_in") List<EntityRef> usedIn,
        @JsonProperty("ieee_term") List<String> ieeeTerm,
        @JsonProperty("exact_match") List<String> exactMatch,
        List<String> thumbnail
) {

    public AttributeBundle {
        usedIn = distinct(usedIn);
        ieeeTerm = distinct(ieeeTerm);
        exactMatch = distinct(exactMatch);
        thumbnail = distinct(thumbnail);
    }

    /**
     * True when at least one attribute would be attached to a node.
     */
    public boolean hasData() {
        return (description != null && !description.isEmpty())
                || !usedIn.isEmpty() || !ieeeTerm.isEmpty() || !exactMatch.isEmpty() || !thumbnail.isEmpty();
    }

    private static <T> List<T> distinct(List<T> values) {
        if (values == null || values.isEmpty()) return List.of();
        Set<T> seen = new LinkedHashSet<>();
        for (T v : values) {
            if (v != null) seen.add(v);
        }
        return List.copyOf(seen);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Folds row-shaped acquisition results into a bundle: the first description wins and
     * list values are kept once each.
     */
    public static final class Builder {
        private String description;
        private final Set<EntityRef> usedIn = new LinkedHashSet<>();
        private final Set<String> ieeeTerm = new LinkedHashSet<>();
        private final Set<String> exactMatch = new LinkedHashSet<>();
        private final Set<String> thumbnail = new LinkedHashSet<>();

        private Builder() {}

        public Builder description(String value) {
            if (description == null && value != null) description = value;
            return this;
        }

        public Builder usedIn(String id, String label) {
            if (id != null) usedIn.add(new EntityRef(id, label));
            return this;
        }

        public Builder ieeeTerm(String value) {
            if (value != null) ieeeTerm.add(value);
            return this;
        }

        public Builder exactMatch(String value) {
            if (value != null) exactMatch.add(value);
            return this;
        }

        public Builder thumbnail(String value) {
            if (value != null) thumbnail.add(value);
            return this;
        }

        public AttributeBundle build() {
            return new AttributeBundle(description, new ArrayList<>(usedIn), new ArrayList<>(ieeeTerm),
                    new ArrayList<>(exactMatch), new ArrayList<>(thumbnail));
        }
    }
}

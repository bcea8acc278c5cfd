package com.libragraph.forge.core.system;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, insertion-ordered mapping from component name to {@link Component}.
 * <p>
 * Insertion order is the start order; stop order is its reverse. The order is
 * chosen by whoever builds the map. Every "modifying" method returns a copy.
 */
public final class SystemMap {

    private static final SystemMap EMPTY = new SystemMap(new LinkedHashMap<>());

    private final Map<String, Component> components;

    private SystemMap(LinkedHashMap<String, Component> components) {
        this.components = Collections.unmodifiableMap(components);
    }

    public static SystemMap empty() {
        return EMPTY;
    }

    public static SystemMap of(String name, Component component) {
        return builder().add(name, component).build();
    }

    public static SystemMap of(String name1, Component component1,
                               String name2, Component component2) {
        return builder().add(name1, component1).add(name2, component2).build();
    }

    public static SystemMap of(String name1, Component component1,
                               String name2, Component component2,
                               String name3, Component component3) {
        return builder()
                .add(name1, component1)
                .add(name2, component2)
                .add(name3, component3)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy with {@code name} bound to {@code component}. An existing
     * name keeps its position; a new name is appended.
     */
    public SystemMap with(String name, Component component) {
        LinkedHashMap<String, Component> copy = new LinkedHashMap<>(components);
        copy.put(validName(name), Objects.requireNonNull(component, "component cannot be null"));
        return new SystemMap(copy);
    }

    /** Returns a copy without {@code name}; {@code this} when the name is absent. */
    public SystemMap without(String name) {
        if (!components.containsKey(name)) {
            return this;
        }
        LinkedHashMap<String, Component> copy = new LinkedHashMap<>(components);
        copy.remove(name);
        return new SystemMap(copy);
    }

    public Optional<Component> get(String name) {
        return Optional.ofNullable(components.get(name));
    }

    public boolean contains(String name) {
        return components.containsKey(name);
    }

    /** Component names in start order. */
    public List<String> names() {
        return List.copyOf(components.keySet());
    }

    public List<String> startOrder() {
        return names();
    }

    public List<String> stopOrder() {
        List<String> reversed = new ArrayList<>(components.keySet());
        Collections.reverse(reversed);
        return reversed;
    }

    public int size() {
        return components.size();
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }

    /** Unmodifiable view, iterating in start order. */
    public Map<String, Component> asMap() {
        return components;
    }

    /** Equal when both hold the same components under the same names in the same order. */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SystemMap other)) return false;
        return components.equals(other.components)
                && names().equals(other.names());
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }

    @Override
    public String toString() {
        return "SystemMap" + components;
    }

    private static String validName(String name) {
        Objects.requireNonNull(name, "component name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("component name cannot be blank");
        }
        return name;
    }

    public static final class Builder {

        private final LinkedHashMap<String, Component> components = new LinkedHashMap<>();

        private Builder() {
        }

        /** Appends a component. Names must be unique within one system. */
        public Builder add(String name, Component component) {
            validName(name);
            Objects.requireNonNull(component, "component cannot be null");
            if (components.putIfAbsent(name, component) != null) {
                throw new IllegalArgumentException("duplicate component name: " + name);
            }
            return this;
        }

        public SystemMap build() {
            if (components.isEmpty()) {
                return EMPTY;
            }
            return new SystemMap(new LinkedHashMap<>(components));
        }
    }
}

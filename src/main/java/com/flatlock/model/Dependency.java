package com.flatlock.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A single external package pinned by a lockfile.
 *
 * Identity inside a {@code DependencySet} is {@link #key()}: two records with the same
 * name and version are the same dependency regardless of integrity or resolved URL.
 */
@Value
@Builder
public class Dependency {
    @NonNull
    String name;
    @NonNull
    String version;
    String integrity;
    String resolved;
    boolean link;

    public String key() {
        return keyOf(name, version);
    }

    public static String keyOf(String name, String version) {
        return name + "@" + version;
    }

    public static Dependency of(String name, String version) {
        return Dependency.builder().name(name).version(version).build();
    }

    @Override
    public String toString() {
        return key();
    }
}

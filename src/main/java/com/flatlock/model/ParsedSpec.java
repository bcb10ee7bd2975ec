package com.flatlock.model;

import lombok.Value;

/**
 * Name and version decoded from a lockfile key. Either part is null when the key
 * does not describe a registry package (link:, file:, malformed keys).
 */
@Value(staticConstructor = "of")
public class ParsedSpec {
    public static final ParsedSpec EMPTY = of(null, null);

    String name;
    String version;

    public boolean isPresent() {
        return name != null && !name.isEmpty() && version != null && !version.isEmpty();
    }

    public boolean isEmpty() {
        return !isPresent();
    }
}

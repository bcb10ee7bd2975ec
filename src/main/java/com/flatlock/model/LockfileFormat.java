package com.flatlock.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lockfile formats understood by the parser.
 */
public enum LockfileFormat {
    /**
     * package-lock.json / npm-shrinkwrap.json (JSON).
     */
    NPM("npm"),

    /**
     * pnpm-lock.yaml and the older shrinkwrap.yaml (YAML).
     */
    PNPM("pnpm"),

    /**
     * yarn.lock v1 (yarn's own indentation syntax).
     */
    YARN_CLASSIC("yarn-classic"),

    /**
     * yarn.lock v2+ (YAML with a __metadata header).
     */
    YARN_BERRY("yarn-berry");

    private final String id;

    LockfileFormat(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static Optional<LockfileFormat> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim();
        return Arrays.stream(values())
                .filter(f -> f.id.equalsIgnoreCase(normalized) || f.name().equalsIgnoreCase(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return id;
    }
}

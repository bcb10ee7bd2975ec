package com.flatlock.extract;

import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.flatlock.model.Dependency;
import com.flatlock.model.LockfileFormat;
import com.flatlock.parser.JsonNodes;
import com.flatlock.parser.YarnClassicKeyParser;

/**
 * Extracts packages from a yarn v1 lockfile. Entries resolved to {@code file:} or
 * {@code link:} locations are dropped.
 */
public class YarnClassicExtractor implements DependencyExtractor {
    private static final Logger log = LoggerFactory.getLogger(YarnClassicExtractor.class);

    @Override
    public LockfileFormat format() {
        return LockfileFormat.YARN_CLASSIC;
    }

    @Override
    public Stream<Dependency> extract(JsonNode lockfile) {
        return JsonNodes.fields(lockfile)
                .map(this::toDependency)
                .filter(Objects::nonNull);
    }

    private Dependency toDependency(Map.Entry<String, JsonNode> entry) {
        JsonNode pkg = entry.getValue();
        if (!pkg.isObject()) {
            return null;
        }
        String resolved = JsonNodes.text(pkg, "resolved");
        if (isLocal(resolved)) {
            log.debug("Skipping local package {}", entry.getKey());
            return null;
        }

        String name = YarnClassicKeyParser.parseKey(entry.getKey());
        String version = JsonNodes.text(pkg, "version");
        if (NpmExtractor.isBlank(name) || NpmExtractor.isBlank(version)) {
            return null;
        }
        return Dependency.builder()
                .name(name)
                .version(version)
                .integrity(JsonNodes.text(pkg, "integrity"))
                .resolved(resolved)
                .build();
    }

    static boolean isLocal(String resolved) {
        return resolved != null && (resolved.startsWith("file:") || resolved.startsWith("link:"));
    }
}

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
import com.flatlock.parser.NpmKeyParser;

/**
 * Extracts installed packages from the {@code packages} table of package-lock.json v2/v3.
 *
 * The root entry ({@code ""}) and workspace definitions ({@code packages/foo}) are skipped;
 * only {@code node_modules/} paths are installed packages. Workspace symlinks
 * ({@code link: true}) are dropped.
 */
public class NpmExtractor implements DependencyExtractor {
    private static final Logger log = LoggerFactory.getLogger(NpmExtractor.class);

    @Override
    public LockfileFormat format() {
        return LockfileFormat.NPM;
    }

    @Override
    public Stream<Dependency> extract(JsonNode lockfile) {
        JsonNode packages = JsonNodes.object(lockfile, "packages");
        if (packages == null) {
            log.debug("npm lockfile has no packages table");
        }
        return JsonNodes.fields(packages)
                .map(this::toDependency)
                .filter(Objects::nonNull);
    }

    private Dependency toDependency(Map.Entry<String, JsonNode> entry) {
        String path = entry.getKey();
        JsonNode pkg = entry.getValue();
        if (!NpmKeyParser.isInstalledPath(path)) {
            return null;
        }
        if (pkg.path("link").asBoolean(false)) {
            log.debug("Skipping linked package {}", path);
            return null;
        }

        String name = NpmKeyParser.parseKey(path);
        String version = JsonNodes.text(pkg, "version");
        if (isBlank(name) || isBlank(version)) {
            return null;
        }
        return Dependency.builder()
                .name(name)
                .version(version)
                .integrity(JsonNodes.text(pkg, "integrity"))
                .resolved(JsonNodes.text(pkg, "resolved"))
                .build();
    }

    static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }
}

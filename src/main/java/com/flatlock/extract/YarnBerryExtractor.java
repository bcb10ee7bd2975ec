package com.flatlock.extract;

import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.flatlock.detect.LockfileDetector;
import com.flatlock.model.Dependency;
import com.flatlock.model.LockfileFormat;
import com.flatlock.parser.JsonNodes;
import com.flatlock.parser.YarnBerryKeyParser;

/**
 * Extracts packages from a yarn v2+ lockfile.
 *
 * The package name comes from the {@code resolution} field, which names the real
 * package even when the key is an alias. Workspace, portal, link and file resolutions
 * are dropped.
 */
public class YarnBerryExtractor implements DependencyExtractor {
    private static final Logger log = LoggerFactory.getLogger(YarnBerryExtractor.class);

    @Override
    public LockfileFormat format() {
        return LockfileFormat.YARN_BERRY;
    }

    @Override
    public Stream<Dependency> extract(JsonNode lockfile) {
        return JsonNodes.fields(lockfile)
                .filter(entry -> !LockfileDetector.METADATA.equals(entry.getKey()))
                .map(this::toDependency)
                .filter(Objects::nonNull);
    }

    private Dependency toDependency(Map.Entry<String, JsonNode> entry) {
        JsonNode pkg = entry.getValue();
        if (!pkg.isObject()) {
            return null;
        }
        String resolution = JsonNodes.text(pkg, "resolution");
        if (YarnBerryKeyParser.isLocalResolution(resolution)) {
            log.debug("Skipping local package {}", entry.getKey());
            return null;
        }

        String name = nameOf(entry.getKey(), resolution);
        String version = JsonNodes.text(pkg, "version");
        if (NpmExtractor.isBlank(name) || NpmExtractor.isBlank(version)) {
            return null;
        }
        return Dependency.builder()
                .name(name)
                .version(version)
                .integrity(JsonNodes.text(pkg, "checksum"))
                .resolved(resolution)
                .build();
    }

    static String nameOf(String key, String resolution) {
        return resolution != null ? YarnBerryKeyParser.parseResolution(resolution) : YarnBerryKeyParser.parseKey(key);
    }
}

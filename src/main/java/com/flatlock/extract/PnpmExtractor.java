package com.flatlock.extract;

import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.flatlock.detect.PnpmEraDetector;
import com.flatlock.model.DetectedPnpmVersion;
import com.flatlock.model.Dependency;
import com.flatlock.model.LockfileFormat;
import com.flatlock.model.ParsedSpec;
import com.flatlock.model.PnpmEra;
import com.flatlock.parser.JsonNodes;
import com.flatlock.parser.PnpmSpecParser;

/**
 * Extracts packages from pnpm-lock.yaml (every era) and shrinkwrap.yaml.
 *
 * Keys are decoded with the grammar of the detected era. Peer variants of one package
 * collapse to a single {@code name@version}. Directory resolutions and {@code link:} keys
 * are dropped. For v9 the {@code snapshots} table is walked as well, keeping only
 * entries backed by a {@code packages} record.
 */
public class PnpmExtractor implements DependencyExtractor {
    private static final Logger log = LoggerFactory.getLogger(PnpmExtractor.class);

    @Override
    public LockfileFormat format() {
        return LockfileFormat.PNPM;
    }

    @Override
    public Stream<Dependency> extract(JsonNode lockfile) {
        DetectedPnpmVersion detected = PnpmEraDetector.detect(lockfile);
        log.debug("pnpm lockfile era {} (version '{}')", detected.getEra(), detected.getVersion());

        Function<String, ParsedSpec> parseSpec = PnpmSpecParser.forEra(detected.getEra());
        JsonNode packages = JsonNodes.object(lockfile, "packages");
        Set<String> seen = new HashSet<>();

        Stream<Dependency> fromPackages = JsonNodes.fields(packages)
                .map(entry -> fromPackage(entry, parseSpec, seen))
                .filter(Objects::nonNull);

        if (detected.getEra() != PnpmEra.V9) {
            return fromPackages;
        }

        // Stream.concat is lazy: the snapshot pass sees everything the package pass marked
        Stream<Dependency> fromSnapshots = JsonNodes.fields(JsonNodes.object(lockfile, "snapshots"))
                .map(entry -> fromSnapshot(entry.getKey(), packages, parseSpec, seen))
                .filter(Objects::nonNull);
        return Stream.concat(fromPackages, fromSnapshots);
    }

    private Dependency fromPackage(Map.Entry<String, JsonNode> entry, Function<String, ParsedSpec> parseSpec,
            Set<String> seen) {
        String spec = entry.getKey();
        ParsedSpec parsed = parseSpec.apply(spec);
        if (parsed.isEmpty()) {
            return null;
        }
        if (!seen.add(Dependency.keyOf(parsed.getName(), parsed.getVersion()))) {
            return null;
        }

        JsonNode resolution = JsonNodes.object(entry.getValue(), "resolution");
        if (spec.startsWith("link:") || "directory".equals(JsonNodes.text(resolution, "type"))) {
            log.debug("Skipping local package {}", spec);
            return null;
        }
        return toDependency(parsed, resolution);
    }

    private Dependency fromSnapshot(String spec, JsonNode packages, Function<String, ParsedSpec> parseSpec,
            Set<String> seen) {
        ParsedSpec parsed = parseSpec.apply(spec);
        if (parsed.isEmpty()) {
            return null;
        }
        String key = Dependency.keyOf(parsed.getName(), parsed.getVersion());
        if (!seen.add(key)) {
            return null;
        }
        JsonNode basePackage = packages == null ? null : packages.get(key);
        if (basePackage == null) {
            return null;
        }
        return toDependency(parsed, JsonNodes.object(basePackage, "resolution"));
    }

    private Dependency toDependency(ParsedSpec parsed, JsonNode resolution) {
        return Dependency.builder()
                .name(parsed.getName())
                .version(parsed.getVersion())
                .integrity(JsonNodes.text(resolution, "integrity"))
                .resolved(JsonNodes.text(resolution, "tarball"))
                .build();
    }
}

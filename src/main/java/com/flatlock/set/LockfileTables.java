package com.flatlock.set;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.fasterxml.jackson.databind.JsonNode;
import com.flatlock.detect.LockfileDetector;
import com.flatlock.detect.PnpmEraDetector;
import com.flatlock.model.Dependency;
import com.flatlock.model.LockfileFormat;
import com.flatlock.model.ParsedSpec;
import com.flatlock.model.PnpmEra;
import com.flatlock.parser.JsonNodes;
import com.flatlock.parser.NpmKeyParser;
import com.flatlock.parser.PnpmSpecParser;
import com.flatlock.parser.YarnBerryKeyParser;
import com.flatlock.parser.YarnClassicKeyParser;

import lombok.Getter;

/**
 * Raw lockfile tables kept by a traversable {@link DependencySet}, plus the lookup indexes
 * built from them once at load time.
 */
@Getter
final class LockfileTables {
    private static final String[] IMPORTER_SECTIONS =
            { "dependencies", "devDependencies", "optionalDependencies", "peerDependencies" };

    private final LockfileFormat format;
    private final JsonNode root;
    /** npm and pnpm {@code packages}; the whole document for the yarn formats. */
    private final JsonNode packages;
    private final JsonNode importers;
    private final JsonNode snapshots;
    private final PnpmEra era;
    private final Map<String, Dependency> firstByName;
    /** name@version to every raw entry describing that package (peer variants, aliases, nested copies). */
    private final Map<String, List<JsonNode>> entriesByKey;
    /** yarn berry only: every descriptor of a merged key ({@code ms@npm:^2.1.0}) to its entry. */
    private final Map<String, JsonNode> entriesByDescriptor;
    /** yarn berry only: workspace package name to its {@code name@workspace:path} entry. */
    private final Map<String, JsonNode> workspacesByName;

    private LockfileTables(LockfileFormat format, JsonNode root, JsonNode packages, JsonNode importers,
            JsonNode snapshots, PnpmEra era, Map<String, Dependency> firstByName,
            Map<String, List<JsonNode>> entriesByKey) {
        this(format, root, packages, importers, snapshots, era, firstByName, entriesByKey, Map.of(), Map.of());
    }

    private LockfileTables(LockfileFormat format, JsonNode root, JsonNode packages, JsonNode importers,
            JsonNode snapshots, PnpmEra era, Map<String, Dependency> firstByName,
            Map<String, List<JsonNode>> entriesByKey, Map<String, JsonNode> entriesByDescriptor,
            Map<String, JsonNode> workspacesByName) {
        this.format = format;
        this.root = root;
        this.packages = packages;
        this.importers = importers;
        this.snapshots = snapshots;
        this.era = era;
        this.firstByName = firstByName;
        this.entriesByKey = entriesByKey;
        this.entriesByDescriptor = entriesByDescriptor;
        this.workspacesByName = workspacesByName;
    }

    static LockfileTables of(LockfileFormat format, JsonNode root, Map<String, Dependency> dependencies) {
        Map<String, Dependency> firstByName = new HashMap<>();
        for (Dependency dependency : dependencies.values()) {
            firstByName.putIfAbsent(dependency.getName(), dependency);
        }

        return switch (format) {
            case NPM -> {
                JsonNode packages = JsonNodes.object(root, "packages");
                yield new LockfileTables(format, root, packages, null, null, null, firstByName, indexNpm(packages));
            }
            case PNPM -> {
                PnpmEra era = PnpmEraDetector.detect(root).getEra();
                JsonNode packages = JsonNodes.object(root, "packages");
                JsonNode snapshots = JsonNodes.object(root, "snapshots");
                JsonNode source = era == PnpmEra.V9 && snapshots != null ? snapshots : packages;
                yield new LockfileTables(format, root, packages, JsonNodes.object(root, "importers"), snapshots,
                        era, firstByName, indexPnpm(source, PnpmSpecParser.forEra(era)));
            }
            case YARN_CLASSIC ->
                new LockfileTables(format, root, root, null, null, null, firstByName, indexYarn(root, format));
            case YARN_BERRY -> {
                Map<String, JsonNode> byDescriptor = new HashMap<>();
                Map<String, JsonNode> workspaces = new LinkedHashMap<>();
                indexBerryDescriptors(root, byDescriptor, workspaces);
                yield new LockfileTables(format, root, root, null, null, null, firstByName, indexYarn(root, format),
                        Collections.unmodifiableMap(byDescriptor), Collections.unmodifiableMap(workspaces));
            }
        };
    }

    Dependency firstByName(String name) {
        return firstByName.get(name);
    }

    List<JsonNode> entries(String name, String version) {
        return entriesByKey.getOrDefault(Dependency.keyOf(name, version), List.of());
    }

    /**
     * The yarn berry entry yarn resolved {@code descriptor} to, or null.
     */
    JsonNode entryByDescriptor(String descriptor) {
        return descriptor == null ? null : entriesByDescriptor.get(descriptor);
    }

    JsonNode workspace(String name) {
        return name == null ? null : workspacesByName.get(name);
    }

    JsonNode packageAt(String path) {
        return packages == null ? null : packages.get(path);
    }

    /**
     * The pnpm importer for a workspace. A single-project lockfile without an
     * {@code importers} table uses its root document as the {@code .} importer.
     */
    JsonNode importer(String workspacePath) {
        String path = workspacePath == null || workspacePath.isEmpty() ? "." : workspacePath;
        if (importers != null) {
            JsonNode importer = importers.get(path);
            return importer != null && importer.isObject() ? importer : null;
        }
        if (!".".equals(path)) {
            return null;
        }
        for (String section : IMPORTER_SECTIONS) {
            if (JsonNodes.object(root, section) != null) {
                return root;
            }
        }
        return null;
    }

    private static Map<String, List<JsonNode>> indexNpm(JsonNode packages) {
        Map<String, List<JsonNode>> index = new LinkedHashMap<>();
        JsonNodes.fields(packages)
                .filter(entry -> NpmKeyParser.isInstalledPath(entry.getKey()))
                .forEach(entry -> {
                    String version = JsonNodes.text(entry.getValue(), "version");
                    if (version != null) {
                        add(index, Dependency.keyOf(NpmKeyParser.parseKey(entry.getKey()), version), entry.getValue());
                    }
                });
        return freeze(index);
    }

    private static Map<String, List<JsonNode>> indexPnpm(JsonNode source, Function<String, ParsedSpec> parseSpec) {
        Map<String, List<JsonNode>> index = new LinkedHashMap<>();
        JsonNodes.fields(source).forEach(entry -> {
            ParsedSpec parsed = parseSpec.apply(entry.getKey());
            if (parsed.isPresent()) {
                add(index, Dependency.keyOf(parsed.getName(), parsed.getVersion()), entry.getValue());
            }
        });
        return freeze(index);
    }

    private static Map<String, List<JsonNode>> indexYarn(JsonNode root, LockfileFormat format) {
        Map<String, List<JsonNode>> index = new LinkedHashMap<>();
        JsonNodes.fields(root)
                .filter(entry -> !LockfileDetector.METADATA.equals(entry.getKey()))
                .forEach(entry -> {
                    JsonNode pkg = entry.getValue();
                    String version = JsonNodes.text(pkg, "version");
                    if (version == null) {
                        return;
                    }
                    if (format == LockfileFormat.YARN_BERRY) {
                        String keyName = YarnBerryKeyParser.parseKey(entry.getKey());
                        add(index, Dependency.keyOf(keyName, version), pkg);
                        String resolution = JsonNodes.text(pkg, "resolution");
                        if (resolution != null) {
                            String resolvedName = YarnBerryKeyParser.parseResolution(resolution);
                            if (!resolvedName.equals(keyName)) {
                                add(index, Dependency.keyOf(resolvedName, version), pkg);
                            }
                        }
                    } else {
                        add(index, Dependency.keyOf(YarnClassicKeyParser.parseKey(entry.getKey()), version), pkg);
                    }
                });
        return freeze(index);
    }

    private static void indexBerryDescriptors(JsonNode root, Map<String, JsonNode> byDescriptor,
            Map<String, JsonNode> workspaces) {
        JsonNodes.fields(root)
                .filter(entry -> !LockfileDetector.METADATA.equals(entry.getKey()))
                .forEach(entry -> {
                    for (String descriptor : YarnBerryKeyParser.descriptors(entry.getKey())) {
                        byDescriptor.putIfAbsent(descriptor, entry.getValue());
                        if (YarnBerryKeyParser.isWorkspaceDescriptor(descriptor)) {
                            workspaces.putIfAbsent(YarnBerryKeyParser.parseKey(descriptor), entry.getValue());
                        }
                    }
                });
    }

    private static void add(Map<String, List<JsonNode>> index, String key, JsonNode entry) {
        index.computeIfAbsent(key, k -> new ArrayList<>(1)).add(entry);
    }

    private static Map<String, List<JsonNode>> freeze(Map<String, List<JsonNode>> index) {
        index.replaceAll((key, entries) -> List.copyOf(entries));
        return Collections.unmodifiableMap(index);
    }
}

package com.flatlock.set;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.flatlock.model.Dependency;
import com.flatlock.model.ParsedSpec;
import com.flatlock.parser.JsonNodes;
import com.flatlock.parser.PnpmSpecParser;

import lombok.Value;

/**
 * Breadth-first closure over a pnpm importer, whose dependency maps pin the exact
 * version each name resolved to for that workspace.
 *
 * <pre>
 * importers:
 *   packages/bar:
 *     dependencies:
 *       leftpad: 1.0.0                    # v5
 *       react: {specifier: ^18, version: 18.2.0(react-dom@18.2.0)}   # v6, v9
 *       shared: link:../shared
 * </pre>
 *
 * A {@code link:} version points at a sibling importer; its runtime dependencies join the
 * walk but the sibling itself is not a record. Names that resolve to nothing are dropped.
 */
class ImporterResolution implements ResolutionStrategy {
    private static final Logger log = LoggerFactory.getLogger(ImporterResolution.class);

    private static final String LINK = "link:";

    private final LockfileTables tables;
    private final Map<String, Dependency> dependencies;
    private final ResolveOptions options;
    private final String workspacePath;

    ImporterResolution(LockfileTables tables, Map<String, Dependency> dependencies, ResolveOptions options,
            String workspacePath) {
        this.tables = tables;
        this.dependencies = dependencies;
        this.options = options;
        this.workspacePath = workspacePath;
    }

    @Value
    private static class Pending {
        String name;
        /** Version pinned by whoever introduced the name, may be null. */
        String version;
        /** Importer the name was declared in, for resolving relative links. */
        String workspace;
    }

    @Override
    public Map<String, Dependency> resolve(Map<String, String> seeds) {
        JsonNode importer = tables.importer(workspacePath);
        Map<String, String> pins = importerVersions(importer, allSections());

        Map<String, Dependency> result = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>();
        Set<String> visitedWorkspaces = new HashSet<>();
        visitedWorkspaces.add(workspacePath);
        Deque<Pending> queue = new ArrayDeque<>();
        seeds.keySet().forEach(name -> queue.add(new Pending(name, pins.get(name), workspacePath)));
        int unresolved = 0;

        while (!queue.isEmpty()) {
            Pending pending = queue.poll();
            if (!visited.add(pending.getName())) {
                continue;
            }

            String version = pins.getOrDefault(pending.getName(), pending.getVersion());
            if (version != null && version.startsWith(LINK)) {
                followLink(pending.getWorkspace(), version.substring(LINK.length()), visitedWorkspaces, visited, queue);
                continue;
            }
            if (version != null && version.startsWith("file:")) {
                continue;
            }

            Dependency match = find(pending.getName(), version);
            if (match == null) {
                unresolved++;
                continue;
            }
            result.put(match.key(), match);

            for (JsonNode entry : tables.entries(match.getName(), match.getVersion())) {
                for (Map.Entry<String, String> child : importerVersions(entry, runtimeSections()).entrySet()) {
                    if (!visited.contains(child.getKey())) {
                        queue.add(new Pending(child.getKey(), child.getValue(), pending.getWorkspace()));
                    }
                }
            }
        }

        if (unresolved > 0) {
            log.debug("{} package name(s) of importer '{}' could not be resolved", unresolved, workspacePath);
        }
        return result;
    }

    private void followLink(String fromWorkspace, String target, Set<String> visitedWorkspaces, Set<String> visited,
            Deque<Pending> queue) {
        String linked = resolveRelative(fromWorkspace, target);
        if (!visitedWorkspaces.add(linked)) {
            return;
        }
        JsonNode sibling = tables.importer(linked);
        if (sibling == null) {
            log.debug("Linked workspace '{}' has no importer", linked);
            return;
        }
        for (Map.Entry<String, String> child : importerVersions(sibling, runtimeSections()).entrySet()) {
            if (!visited.contains(child.getKey())) {
                queue.add(new Pending(child.getKey(), child.getValue(), linked));
            }
        }
    }

    /**
     * Looks up name@version, decoding aliased versions such as {@code /string-width@4.2.3}.
     * Falls back to any record with the name.
     */
    private Dependency find(String name, String version) {
        if (version != null) {
            String bare = PnpmSpecParser.stripPeerSuffix(version);
            Dependency exact = dependencies.get(Dependency.keyOf(name, bare));
            if (exact != null) {
                return exact;
            }
            if (bare.startsWith("/") || bare.lastIndexOf('@') > 0) {
                ParsedSpec alias = PnpmSpecParser.parseSpec(version);
                if (alias.isPresent()) {
                    Dependency aliased = dependencies.get(Dependency.keyOf(alias.getName(), alias.getVersion()));
                    if (aliased != null) {
                        return aliased;
                    }
                }
            }
        }
        return tables.firstByName(name);
    }

    private List<String> allSections() {
        List<String> sections = new ArrayList<>(runtimeSections());
        if (options.isDev()) {
            sections.add("devDependencies");
        }
        if (options.isPeer()) {
            sections.add("peerDependencies");
        }
        return sections;
    }

    private List<String> runtimeSections() {
        return options.isOptional()
                ? List.of("dependencies", "optionalDependencies")
                : List.of("dependencies");
    }

    /**
     * Name to version for the given sections of an importer or package entry. Values are
     * either a version string or a {@code {specifier, version}} mapping.
     */
    static Map<String, String> importerVersions(JsonNode node, List<String> sections) {
        Map<String, String> versions = new LinkedHashMap<>();
        if (node == null) {
            return versions;
        }
        for (String section : sections) {
            JsonNodes.fields(JsonNodes.object(node, section)).forEach(entry -> {
                JsonNode value = entry.getValue();
                String version = value.isObject() ? JsonNodes.text(value, "version")
                        : value.isValueNode() && !value.isNull() ? value.asText() : null;
                if (version != null) {
                    versions.putIfAbsent(entry.getKey(), version);
                }
            });
        }
        return versions;
    }

    static String resolveRelative(String from, String relative) {
        Deque<String> parts = new ArrayDeque<>();
        if (from != null && !from.isEmpty() && !".".equals(from)) {
            for (String part : from.split("/")) {
                parts.addLast(part);
            }
        }
        for (String part : relative.split("/")) {
            if ("..".equals(part)) {
                parts.pollLast();
            } else if (!part.isEmpty() && !".".equals(part)) {
                parts.addLast(part);
            }
        }
        return parts.isEmpty() ? "." : String.join("/", parts);
    }
}

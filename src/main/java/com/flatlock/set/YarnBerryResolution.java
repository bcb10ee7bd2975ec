package com.flatlock.set;

import java.util.ArrayDeque;
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
import com.flatlock.parser.JsonNodes;
import com.flatlock.parser.YarnBerryKeyParser;

import lombok.Value;

/**
 * Breadth-first closure over a yarn v2+ lockfile.
 *
 * Every dependency map in the lockfile records the range it asked for, and yarn keys each
 * entry by the descriptors that resolved to it, so a name plus its range finds the exact
 * entry:
 *
 * <pre>
 * "lib@workspace:packages/lib":
 *   dependencies:
 *     ms: "npm:^2.1.0"                 # looked up as ms@npm:^2.1.0
 *     sw: "npm:string-width@^4.2.0"    # alias, looked up as sw@npm:string-width@^4.2.0
 *
 * "ms@npm:^2.1.0, ms@npm:^2.1.1":
 *   version: 2.1.3
 * </pre>
 *
 * {@code workspace:} dependencies, and any other entry resolved inside the project, continue
 * into that entry's own dependencies without becoming a record. A name without a matching descriptor falls back to the first
 * record with that name.
 */
class YarnBerryResolution implements ResolutionStrategy {
    private static final Logger log = LoggerFactory.getLogger(YarnBerryResolution.class);

    private final LockfileTables tables;
    private final Map<String, Dependency> dependencies;
    private final ResolveOptions options;

    YarnBerryResolution(LockfileTables tables, Map<String, Dependency> dependencies, ResolveOptions options) {
        this.tables = tables;
        this.dependencies = dependencies;
        this.options = options;
    }

    @Value
    private static class Pending {
        String name;
        /** Range as declared, e.g. {@code npm:^2.1.0} or {@code workspace:^}; may be null. */
        String range;
    }

    @Override
    public Map<String, Dependency> resolve(Map<String, String> seeds) {
        Map<String, Dependency> result = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>();
        Set<String> visitedWorkspaces = new HashSet<>();
        Deque<Pending> queue = new ArrayDeque<>();
        seeds.forEach((name, range) -> queue.add(new Pending(name, range)));
        int unresolved = 0;

        while (!queue.isEmpty()) {
            Pending pending = queue.poll();
            String name = pending.getName();

            JsonNode entry = tables.entryByDescriptor(YarnBerryKeyParser.descriptorOf(name, pending.getRange()));
            if (entry == null) {
                // workspace:^ and workspace:* never appear as keys, the workspace path does
                entry = tables.workspace(name);
            }
            if (entry != null && YarnBerryKeyParser.isLocalResolution(JsonNodes.text(entry, "resolution"))) {
                if (visitedWorkspaces.add(name)) {
                    expand(entry, visited, queue);
                }
                continue;
            }

            if (!visited.add(name)) {
                continue;
            }
            Dependency match = entry != null ? recordOf(entry) : tables.firstByName(name);
            if (match == null) {
                unresolved++;
                continue;
            }
            result.put(match.key(), match);
            if (entry != null) {
                expand(entry, visited, queue);
            } else {
                for (JsonNode raw : tables.entries(match.getName(), match.getVersion())) {
                    expand(raw, visited, queue);
                }
            }
        }

        if (unresolved > 0) {
            log.debug("{} package name(s) could not be resolved in the yarn berry lockfile", unresolved);
        }
        return result;
    }

    /**
     * The record for a lockfile entry, named by its resolution so aliases map to the real package.
     */
    private Dependency recordOf(JsonNode entry) {
        String version = JsonNodes.text(entry, "version");
        String resolution = JsonNodes.text(entry, "resolution");
        if (version == null || resolution == null) {
            return null;
        }
        return dependencies.get(Dependency.keyOf(YarnBerryKeyParser.parseResolution(resolution), version));
    }

    private void expand(JsonNode entry, Set<String> visited, Deque<Pending> queue) {
        List<String> sections = options.isOptional()
                ? List.of("dependencies", "optionalDependencies")
                : List.of("dependencies");
        for (String section : sections) {
            JsonNodes.fields(JsonNodes.object(entry, section))
                    .filter(child -> !visited.contains(child.getKey()))
                    .forEach(child -> queue.add(new Pending(child.getKey(), child.getValue().asText(null))));
        }
    }
}

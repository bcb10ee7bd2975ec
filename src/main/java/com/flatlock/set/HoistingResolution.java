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
import com.flatlock.model.LockfileFormat;
import com.flatlock.parser.JsonNodes;
import com.flatlock.parser.NpmKeyParser;

import lombok.Value;

/**
 * Breadth-first closure for lockfiles whose packages are hoisted to one version per name:
 * npm, yarn classic, and pnpm workspaces without an importer.
 *
 * npm resolves a name the way Node does, from the requesting package's own
 * {@code node_modules} up to the root; the workspace directory is the starting point
 * for seeds. The other formats have no paths and fall back to the first record with
 * that name. Each name is expanded once.
 */
class HoistingResolution implements ResolutionStrategy {
    private static final Logger log = LoggerFactory.getLogger(HoistingResolution.class);

    private final LockfileTables tables;
    private final Map<String, Dependency> dependencies;
    private final ResolveOptions options;

    HoistingResolution(LockfileTables tables, Map<String, Dependency> dependencies, ResolveOptions options) {
        this.tables = tables;
        this.dependencies = dependencies;
        this.options = options;
    }

    @Value
    private static class Pending {
        String name;
        String context;
    }

    @Override
    public Map<String, Dependency> resolve(Map<String, String> seeds) {
        Map<String, Dependency> result = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>();
        Deque<Pending> queue = new ArrayDeque<>();
        String rootContext = normalize(options.getWorkspacePath());
        seeds.keySet().forEach(name -> queue.add(new Pending(name, rootContext)));
        int unresolved = 0;

        while (!queue.isEmpty()) {
            Pending pending = queue.poll();
            if (!visited.add(pending.getName())) {
                continue;
            }

            if (tables.getFormat() == LockfileFormat.NPM) {
                String path = locateNpm(pending.getName(), pending.getContext());
                JsonNode entry = path == null ? null : tables.packageAt(path);
                if (entry != null && entry.path("link").asBoolean(false)) {
                    // workspace symlink: its dependencies count, the workspace itself is not a record
                    String target = JsonNodes.text(entry, "resolved");
                    expand(tables.packageAt(target), target, visited, queue);
                    continue;
                }
                String version = JsonNodes.text(entry, "version");
                Dependency match = version == null ? null
                        : dependencies.get(Dependency.keyOf(pending.getName(), version));
                if (match != null) {
                    result.put(match.key(), match);
                    expand(entry, path, visited, queue);
                    continue;
                }
            }

            Dependency match = tables.firstByName(pending.getName());
            if (match == null) {
                unresolved++;
                continue;
            }
            result.put(match.key(), match);
            for (JsonNode entry : tables.entries(match.getName(), match.getVersion())) {
                expand(entry, pending.getContext(), visited, queue);
            }
        }

        if (unresolved > 0) {
            log.debug("{} package name(s) could not be resolved in the {} lockfile", unresolved, tables.getFormat());
        }
        return result;
    }

    private void expand(JsonNode entry, String context, Set<String> visited, Deque<Pending> queue) {
        if (entry == null) {
            return;
        }
        List<String> sections = options.isOptional()
                ? List.of("dependencies", "optionalDependencies")
                : List.of("dependencies");
        for (String section : sections) {
            JsonNodes.fields(JsonNodes.object(entry, section))
                    .map(Map.Entry::getKey)
                    .filter(name -> !visited.contains(name))
                    .forEach(name -> queue.add(new Pending(name, context == null ? "" : context)));
        }
    }

    /**
     * Finds the package path Node would load {@code name} from when required inside
     * {@code context}: {@code context/node_modules/name}, then each enclosing
     * {@code node_modules}, then the root.
     */
    private String locateNpm(String name, String context) {
        String current = context;
        while (true) {
            String candidate = current.isEmpty()
                    ? NpmKeyParser.hoistedPath(name)
                    : NpmKeyParser.workspacePath(current, name);
            if (tables.packageAt(candidate) != null) {
                return candidate;
            }
            if (current.isEmpty()) {
                return null;
            }
            current = parentContext(current);
        }
    }

    static String parentContext(String context) {
        int nested = context.lastIndexOf("/" + NpmKeyParser.NODE_MODULES);
        if (nested >= 0) {
            return context.substring(0, nested);
        }
        return "";
    }

    static String normalize(String workspacePath) {
        if (workspacePath == null) {
            return "";
        }
        String path = workspacePath.trim();
        while (path.startsWith("./")) {
            path = path.substring(2);
        }
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return ".".equals(path) ? "" : path;
    }
}

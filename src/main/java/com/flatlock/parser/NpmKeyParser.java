package com.flatlock.parser;

import lombok.experimental.UtilityClass;

/**
 * Decodes package names from package-lock.json path keys.
 *
 * Keys are filesystem paths, not package specs:
 * <pre>
 *   path := (node_modules/&lt;pkg&gt;)+
 *         | &lt;workspace&gt;/&lt;path&gt;
 *         | &lt;workspace&gt;/&lt;path&gt;/(node_modules/&lt;pkg&gt;)+
 *   pkg  := name | @scope/name
 * </pre>
 */
@UtilityClass
public class NpmKeyParser {

    public static final String NODE_MODULES = "node_modules/";

    /**
     * {@code node_modules/foo/node_modules/@scope/bar} yields {@code @scope/bar}.
     */
    public static String parseKey(String path) {
        if (path == null || path.isEmpty()) {
            return path;
        }
        String[] parts = path.split("/");
        String name = parts[parts.length - 1];
        if (parts.length > 1) {
            String maybeScope = parts[parts.length - 2];
            if (maybeScope.startsWith("@")) {
                return maybeScope + "/" + name;
            }
        }
        return name;
    }

    /**
     * True for installed package paths; false for the root entry and bare workspace definitions.
     */
    public static boolean isInstalledPath(String path) {
        return path != null && path.contains(NODE_MODULES);
    }

    public static String hoistedPath(String name) {
        return NODE_MODULES + name;
    }

    public static String workspacePath(String workspacePath, String name) {
        String base = workspacePath.endsWith("/") ? workspacePath : workspacePath + "/";
        return base + NODE_MODULES + name;
    }
}

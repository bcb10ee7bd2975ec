package com.flatlock.parser;

import lombok.experimental.UtilityClass;

/**
 * Package names from yarn v1 lockfile keys.
 *
 * <pre>
 *   lodash@^4.17.21                                  lodash
 *   @babel/core@^7.0.0                               @babel/core
 *   lodash@^4.17.21, lodash@^4.0.0                   lodash
 *   string-width-cjs@npm:string-width@^4.2.0         string-width-cjs
 * </pre>
 *
 * For {@code npm:} aliases the alias is returned, not the real package name.
 */
@UtilityClass
public class YarnClassicKeyParser {

    private static final String NPM_PROTOCOL = "@npm:";

    public static String parseKey(String key) {
        if (key == null) {
            return null;
        }
        String firstKey = firstEntry(key);

        int npmProtocol = firstKey.indexOf(NPM_PROTOCOL);
        if (npmProtocol >= 0) {
            return firstKey.substring(0, npmProtocol);
        }
        return nameBeforeVersion(firstKey);
    }

    static String firstEntry(String key) {
        int comma = key.indexOf(',');
        return (comma >= 0 ? key.substring(0, comma) : key).trim();
    }

    /**
     * Everything before the '@' that starts the version range. Scoped names skip
     * their leading '@'.
     */
    static String nameBeforeVersion(String entry) {
        if (entry.startsWith("@")) {
            int slash = entry.indexOf('/');
            if (slash >= 0) {
                int at = entry.indexOf('@', slash);
                if (at >= 0) {
                    return entry.substring(0, at);
                }
            }
            int lastAt = entry.lastIndexOf('@');
            return lastAt > 0 ? entry.substring(0, lastAt) : entry;
        }
        int at = entry.indexOf('@');
        return at >= 0 ? entry.substring(0, at) : entry;
    }
}

package com.flatlock.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import lombok.experimental.UtilityClass;

/**
 * Package names from yarn v2+ lockfile keys and resolution fields.
 *
 * Keys carry a protocol after the name ({@code @npm:}, {@code @workspace:},
 * {@code @patch:} ...). A patch descriptor embeds a second descriptor
 * ({@code pkg@patch:pkg@npm:1.0.0#...}), so the earliest protocol marker wins.
 */
@UtilityClass
public class YarnBerryKeyParser {

    private static final List<String> PROTOCOLS =
            List.of("@npm:", "@workspace:", "@portal:", "@link:", "@patch:", "@file:");

    /**
     * Protocols of entries that live inside the project rather than in a registry.
     */
    private static final List<String> LOCAL_PROTOCOLS = List.of("workspace:", "portal:", "link:", "file:");

    private static final String WORKSPACE_PROTOCOL = "workspace:";

    /** A range that already names its protocol, e.g. {@code npm:^1.0.0} or {@code workspace:^}. */
    private static final Pattern PROTOCOL_RANGE = Pattern.compile("^[a-z][a-z0-9+.-]*:.*");

    public static String parseKey(String key) {
        if (key == null) {
            return null;
        }
        String firstKey = YarnClassicKeyParser.firstEntry(key);

        int protocol = earliestProtocol(firstKey);
        if (protocol >= 0) {
            return firstKey.substring(0, protocol);
        }
        return YarnClassicKeyParser.nameBeforeVersion(firstKey);
    }

    /**
     * The resolution field ({@code string-width@npm:4.2.3}) always names the real
     * package, also for aliased keys.
     */
    public static String parseResolution(String resolution) {
        return parseKey(resolution);
    }

    /**
     * True when a resolution points at a workspace, portal, link or file location,
     * either bare ({@code workspace:.}) or after a package name
     * ({@code my-app@workspace:packages/app}).
     */
    public static boolean isLocalResolution(String resolution) {
        if (resolution == null) {
            return false;
        }
        for (String local : LOCAL_PROTOCOLS) {
            if (resolution.startsWith(local)) {
                return true;
            }
        }
        String name = parseResolution(resolution);
        if (name == null || name.isEmpty() || name.length() >= resolution.length()) {
            return false;
        }
        String rest = resolution.substring(name.length() + 1);
        for (String local : LOCAL_PROTOCOLS) {
            if (rest.startsWith(local)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Splits a possibly merged key ({@code ms@npm:^2.1.0, ms@npm:^2.1.1}) into its descriptors.
     */
    public static List<String> descriptors(String key) {
        List<String> descriptors = new ArrayList<>();
        if (key == null) {
            return descriptors;
        }
        for (String part : key.split(",")) {
            String descriptor = part.trim();
            if (descriptor.length() > 1 && descriptor.startsWith("\"") && descriptor.endsWith("\"")) {
                descriptor = descriptor.substring(1, descriptor.length() - 1);
            }
            if (!descriptor.isEmpty()) {
                descriptors.add(descriptor);
            }
        }
        return descriptors;
    }

    /**
     * The lockfile descriptor yarn writes for a declared dependency. Bare ranges get the
     * implicit {@code npm:} protocol, so {@code ms: ^2.1.0} becomes {@code ms@npm:^2.1.0}
     * and the alias {@code sw: npm:string-width@^4} stays {@code sw@npm:string-width@^4}.
     */
    public static String descriptorOf(String name, String range) {
        if (name == null || range == null || range.isEmpty()) {
            return null;
        }
        return PROTOCOL_RANGE.matcher(range).matches() ? name + "@" + range : name + "@npm:" + range;
    }

    /**
     * True for a {@code name@workspace:path} descriptor.
     */
    public static boolean isWorkspaceDescriptor(String descriptor) {
        String name = parseKey(descriptor);
        return name != null && descriptor.length() > name.length()
                && descriptor.startsWith(WORKSPACE_PROTOCOL, name.length() + 1);
    }

    private static int earliestProtocol(String entry) {
        int earliest = -1;
        for (String protocol : PROTOCOLS) {
            int idx = entry.indexOf(protocol);
            if (idx >= 0 && (earliest < 0 || idx < earliest)) {
                earliest = idx;
            }
        }
        return earliest;
    }
}

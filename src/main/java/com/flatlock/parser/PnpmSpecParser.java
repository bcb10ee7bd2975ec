package com.flatlock.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.flatlock.model.ParsedSpec;
import com.flatlock.model.PnpmEra;

import lombok.experimental.UtilityClass;

/**
 * Decodes pnpm package keys ("specs") into name and version.
 *
 * <pre>
 *   shrinkwrap (v3/v4): /name/version[/peer@ver+@scope!peer@ver]
 *   v5.x:               /name/version[_peer@ver+@scope+peer@ver]
 *   v6:                 /name@version[(peer@ver)...]
 *   v9:                  name@version[(peer@ver)...]
 * </pre>
 *
 * Scoped names contain no version-terminating '@', so in the v6+ grammar the last '@'
 * always separates name from version. link: and file: specs are local and yield
 * {@link ParsedSpec#EMPTY}.
 */
@UtilityClass
public class PnpmSpecParser {

    private static final Pattern PEER_GROUP = Pattern.compile("\\(([^)]+)\\)");

    /**
     * Era-agnostic parse: picks the v6+ or v5 grammar from the shape of the spec.
     */
    public static ParsedSpec parseSpec(String spec) {
        if (spec == null || isLocal(spec)) {
            return ParsedSpec.EMPTY;
        }
        if (spec.indexOf('(') >= 0) {
            return parseSpecV6Plus(spec);
        }

        String cleaned = stripLeadingSlash(spec);
        int underscore = cleaned.indexOf('_');
        String withoutV5Peer = underscore >= 0 ? cleaned.substring(0, underscore) : cleaned;

        int lastAt = withoutV5Peer.lastIndexOf('@');
        if (lastAt > 0 && withoutV5Peer.indexOf('/', lastAt + 1) < 0) {
            return parseSpecV6Plus(spec);
        }
        return parseSpecV5(spec);
    }

    public static String parseKey(String key) {
        return parseSpec(key).getName();
    }

    /**
     * Returns the grammar a lockfile of the given era uses for its package keys.
     */
    public static Function<String, ParsedSpec> forEra(PnpmEra era) {
        if (era == PnpmEra.SHRINKWRAP) {
            return PnpmSpecParser::parseSpecShrinkwrap;
        }
        if (era == PnpmEra.UNKNOWN) {
            return PnpmSpecParser::parseSpec;
        }
        // 5.4-inlineSpecifiers moved the specifiers into the importers but kept slash keys
        return era.usesAtSeparator() ? PnpmSpecParser::parseSpecV6Plus : PnpmSpecParser::parseSpecV5;
    }

    // ---- v6 / v9 ----

    public static ParsedSpec parseSpecV6Plus(String spec) {
        if (spec == null || isLocal(spec)) {
            return ParsedSpec.EMPTY;
        }
        String cleaned = stripLeadingSlash(spec);
        int paren = cleaned.indexOf('(');
        if (paren >= 0) {
            cleaned = cleaned.substring(0, paren);
        }
        if (cleaned.isEmpty()) {
            return ParsedSpec.EMPTY;
        }

        int lastAt = cleaned.lastIndexOf('@');
        if (lastAt <= 0) {
            return ParsedSpec.EMPTY;
        }
        String name = cleaned.substring(0, lastAt);
        String version = cleaned.substring(lastAt + 1);
        if (name.isEmpty() || version.isEmpty()) {
            return ParsedSpec.EMPTY;
        }
        return ParsedSpec.of(name, version);
    }

    public static boolean hasPeerSuffixV6Plus(String spec) {
        return spec != null && spec.indexOf('(') >= 0 && spec.indexOf(')') >= 0;
    }

    /**
     * {@code /@babel/core@7.23.0(@types/node@20.0.0)} yields {@code (@types/node@20.0.0)}.
     */
    public static String extractPeerSuffixV6Plus(String spec) {
        if (spec == null) {
            return null;
        }
        int paren = spec.indexOf('(');
        return paren >= 0 ? spec.substring(paren) : null;
    }

    /**
     * Parses every {@code (name@version)} group of a v6+ peer suffix.
     */
    public static List<ParsedSpec> parsePeerDependencies(String peerSuffix) {
        List<ParsedSpec> peers = new ArrayList<>();
        if (peerSuffix == null) {
            return peers;
        }
        Matcher matcher = PEER_GROUP.matcher(peerSuffix);
        while (matcher.find()) {
            String peer = matcher.group(1);
            int lastAt = peer.lastIndexOf('@');
            if (lastAt > 0 && lastAt < peer.length() - 1) {
                peers.add(ParsedSpec.of(peer.substring(0, lastAt), peer.substring(lastAt + 1)));
            }
        }
        return peers;
    }

    // ---- v5 ----

    public static ParsedSpec parseSpecV5(String spec) {
        if (spec == null || isLocal(spec)) {
            return ParsedSpec.EMPTY;
        }
        String cleaned = stripLeadingSlash(spec);
        int underscore = cleaned.indexOf('_');
        if (underscore >= 0) {
            cleaned = cleaned.substring(0, underscore);
        }
        return splitSlashSeparated(cleaned);
    }

    public static boolean hasPeerSuffixV5(String spec) {
        return spec != null && spec.indexOf('_') >= 0;
    }

    /**
     * {@code /foo/1.0.0_bar@2.0.0+@scope+qar@3.0.0} yields {@code bar@2.0.0+@scope+qar@3.0.0}.
     */
    public static String extractPeerSuffixV5(String spec) {
        if (spec == null) {
            return null;
        }
        int underscore = spec.indexOf('_');
        return underscore >= 0 ? spec.substring(underscore + 1) : null;
    }

    // ---- shrinkwrap v3/v4 ----

    public static ParsedSpec parseSpecShrinkwrap(String spec) {
        if (spec == null || isLocal(spec)) {
            return ParsedSpec.EMPTY;
        }
        // peer segments follow the version after another slash and are ignored by the split
        return splitSlashSeparated(stripLeadingSlash(spec));
    }

    public static boolean hasPeerSuffixShrinkwrap(String spec) {
        if (spec == null) {
            return false;
        }
        String cleaned = stripLeadingSlash(spec);
        long slashes = cleaned.chars().filter(c -> c == '/').count();
        return cleaned.startsWith("@") ? slashes > 2 : slashes > 1;
    }

    /**
     * {@code /foo/1.0.0/bar@2.0.0} yields {@code bar@2.0.0}.
     */
    public static String extractPeerSuffixShrinkwrap(String spec) {
        if (spec == null) {
            return null;
        }
        String cleaned = stripLeadingSlash(spec);
        String[] parts = cleaned.split("/", -1);
        int versionIndex = cleaned.startsWith("@") ? 2 : 1;
        if (parts.length <= versionIndex + 1) {
            return null;
        }
        return String.join("/", List.of(parts).subList(versionIndex + 1, parts.length));
    }

    // ---- shared ----

    /**
     * Strips a v5 "_peer" or v6+ "(peer)" suffix from a resolved version string,
     * as found in importer and dependency maps.
     */
    public static String stripPeerSuffix(String version) {
        if (version == null) {
            return null;
        }
        int cut = version.length();
        int paren = version.indexOf('(');
        if (paren >= 0) {
            cut = paren;
        }
        int underscore = version.indexOf('_');
        if (underscore >= 0 && underscore < cut) {
            cut = underscore;
        }
        return version.substring(0, cut);
    }

    static boolean isLocal(String spec) {
        return spec.startsWith("link:") || spec.startsWith("file:");
    }

    private static ParsedSpec splitSlashSeparated(String cleaned) {
        if (cleaned.isEmpty()) {
            return ParsedSpec.EMPTY;
        }
        String[] parts = cleaned.split("/", -1);
        if (cleaned.startsWith("@")) {
            if (parts.length < 3) {
                return ParsedSpec.EMPTY;
            }
            String scope = parts[0];
            String pkgName = parts[1];
            String version = parts[2];
            if (scope.length() < 2 || pkgName.isEmpty() || version.isEmpty()) {
                return ParsedSpec.EMPTY;
            }
            return ParsedSpec.of(scope + "/" + pkgName, version);
        }

        if (parts.length < 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            return ParsedSpec.EMPTY;
        }
        return ParsedSpec.of(parts[0], parts[1]);
    }

    private static String stripLeadingSlash(String spec) {
        return spec.startsWith("/") ? spec.substring(1) : spec;
    }
}

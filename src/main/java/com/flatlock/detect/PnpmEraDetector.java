package com.flatlock.detect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.flatlock.model.DetectedPnpmVersion;
import com.flatlock.model.PnpmEra;

import lombok.experimental.UtilityClass;

/**
 * Classifies a parsed pnpm lockfile into its {@link PnpmEra}.
 *
 * <pre>
 *   shrinkwrapVersion: 3             SHRINKWRAP
 *   lockfileVersion: 5.4             V5 (numeric)
 *   lockfileVersion: 5.4-inlineSpecifiers   V5_INLINE
 *   lockfileVersion: '6.0'           V6
 *   lockfileVersion: '9.0'           V9
 * </pre>
 */
@UtilityClass
public class PnpmEraDetector {
    private static final Logger log = LoggerFactory.getLogger(PnpmEraDetector.class);

    public static DetectedPnpmVersion detect(JsonNode lockfile) {
        if (lockfile == null || !lockfile.isObject()) {
            return DetectedPnpmVersion.unknown("");
        }

        JsonNode shrinkwrapVersion = lockfile.get(LockfileDetector.SHRINKWRAP_VERSION);
        if (shrinkwrapVersion != null && !shrinkwrapVersion.isNull()) {
            return new DetectedPnpmVersion(PnpmEra.SHRINKWRAP, shrinkwrapVersion.asText(), true);
        }

        JsonNode lockfileVersion = lockfile.get(LockfileDetector.LOCKFILE_VERSION);
        if (lockfileVersion == null || lockfileVersion.isNull()) {
            return DetectedPnpmVersion.unknown("");
        }

        String raw = lockfileVersion.asText();
        if (lockfileVersion.isNumber()) {
            return new DetectedPnpmVersion(PnpmEra.V5, raw, false);
        }
        if (raw.contains("inlineSpecifiers")) {
            return new DetectedPnpmVersion(PnpmEra.V5_INLINE, raw, false);
        }
        if (raw.startsWith("9")) {
            return new DetectedPnpmVersion(PnpmEra.V9, raw, false);
        }
        if (raw.startsWith("6")) {
            return new DetectedPnpmVersion(PnpmEra.V6, raw, false);
        }

        log.warn("Unrecognized pnpm lockfileVersion '{}'", raw);
        return DetectedPnpmVersion.unknown(raw);
    }
}

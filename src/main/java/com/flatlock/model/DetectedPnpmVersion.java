package com.flatlock.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Era of a pnpm lockfile together with the raw version value it was derived from.
 */
@Value
public class DetectedPnpmVersion {
    @NonNull
    PnpmEra era;
    /** Raw lockfileVersion / shrinkwrapVersion as text, empty when absent. */
    @NonNull
    String version;
    boolean shrinkwrap;

    public static DetectedPnpmVersion unknown(String version) {
        return new DetectedPnpmVersion(PnpmEra.UNKNOWN, version == null ? "" : version, false);
    }
}

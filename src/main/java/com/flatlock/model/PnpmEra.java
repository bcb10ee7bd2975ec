package com.flatlock.model;

/**
 * Historical layouts of the pnpm lockfile.
 */
public enum PnpmEra {
    /**
     * shrinkwrap.yaml v3/v4 (2016-2019), keys like /name/version/peer@ver.
     */
    SHRINKWRAP,

    /**
     * pnpm-lock.yaml 5.x with a numeric lockfileVersion, keys like /name/version_peer@ver.
     */
    V5,

    /**
     * The experimental 5.4-inlineSpecifiers layout.
     */
    V5_INLINE,

    /**
     * pnpm-lock.yaml 6.x, keys like /name@version(peer@ver).
     */
    V6,

    /**
     * pnpm-lock.yaml 9.x, keys like name@version with a separate snapshots table.
     */
    V9,

    UNKNOWN;

    public boolean usesAtSeparator() {
        return this == V6 || this == V9;
    }

    public boolean usesSnapshotsSplit() {
        return this == V9;
    }

    public boolean usesInlineSpecifiers() {
        return this == V5_INLINE || this == V6 || this == V9;
    }

    public boolean hasLeadingSlash() {
        return this != V9;
    }
}

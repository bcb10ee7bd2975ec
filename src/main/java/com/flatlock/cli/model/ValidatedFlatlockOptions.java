package com.flatlock.cli.model;

import java.nio.file.Path;

import com.flatlock.model.LockfileFormat;
import com.flatlock.set.ResolveOptions;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps FlatlockCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedFlatlockOptions {
    Path lockfile;
    /** Null when the format is to be detected. */
    LockfileFormat format;
    /** package.json of the requested workspace, null when listing the whole lockfile. */
    Path manifest;
    ResolveOptions resolveOptions;
}

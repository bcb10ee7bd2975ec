package com.flatlock.set;

import com.flatlock.model.LockfileFormat;

import lombok.Builder;
import lombok.Value;

/**
 * How to load a lockfile into a {@link DependencySet}.
 */
@Value
@Builder
public class LoadOptions {
    /** Parse as this format instead of detecting it. */
    LockfileFormat format;
    /** File name consulted for detection when the content is blank. */
    String pathHint;

    public static LoadOptions defaults() {
        return LoadOptions.builder().build();
    }
}

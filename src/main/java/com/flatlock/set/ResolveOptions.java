package com.flatlock.set;

import lombok.Builder;
import lombok.Value;

/**
 * Controls {@link DependencySet#dependenciesOf}.
 */
@Value
@Builder
public class ResolveOptions {
    /** Workspace directory relative to the lockfile, e.g. {@code packages/foo}. Null for the root project. */
    String workspacePath;
    @Builder.Default
    boolean dev = false;
    @Builder.Default
    boolean optional = true;
    @Builder.Default
    boolean peer = false;

    public static ResolveOptions defaults() {
        return ResolveOptions.builder().build();
    }
}

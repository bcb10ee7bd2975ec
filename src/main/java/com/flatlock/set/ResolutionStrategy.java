package com.flatlock.set;

import java.util.Map;

import com.flatlock.model.Dependency;

/**
 * One way of walking a lockfile graph from the dependencies a manifest declares.
 */
interface ResolutionStrategy {

    /**
     * @param seeds package name to the range the manifest declares for it
     * @return every reachable package, keyed by name@version in discovery order
     */
    Map<String, Dependency> resolve(Map<String, String> seeds);
}

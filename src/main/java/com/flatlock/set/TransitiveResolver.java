package com.flatlock.set;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.flatlock.model.Dependency;
import com.flatlock.model.LockfileFormat;
import com.flatlock.model.PackageManifest;

/**
 * Computes the packages a manifest transitively depends on within one lockfile.
 *
 * pnpm lockfiles with an importer for the workspace use {@link ImporterResolution}, yarn berry
 * uses {@link YarnBerryResolution}, everything else uses {@link HoistingResolution}. All of them
 * collapse a name to one version.
 */
class TransitiveResolver {
    private static final Logger log = LoggerFactory.getLogger(TransitiveResolver.class);

    private final LockfileTables tables;
    private final Map<String, Dependency> dependencies;

    TransitiveResolver(LockfileTables tables, Map<String, Dependency> dependencies) {
        this.tables = tables;
        this.dependencies = dependencies;
    }

    Map<String, Dependency> resolve(PackageManifest manifest, ResolveOptions options) {
        Map<String, String> seeds = collectSeeds(manifest, options);
        ResolutionStrategy strategy = strategyFor(options);
        Map<String, Dependency> result = strategy.resolve(seeds);
        log.debug("Resolved {} package(s) from {} seed(s) with {}", result.size(), seeds.size(),
                strategy.getClass().getSimpleName());
        return result;
    }

    private ResolutionStrategy strategyFor(ResolveOptions options) {
        String workspace = HoistingResolution.normalize(options.getWorkspacePath());
        if (tables.getFormat() == LockfileFormat.PNPM) {
            String importerPath = workspace.isEmpty() ? "." : workspace;
            if (tables.importer(importerPath) != null) {
                return new ImporterResolution(tables, dependencies, options, importerPath);
            }
            log.debug("No pnpm importer for '{}', falling back to hoisted resolution", importerPath);
        }
        if (tables.getFormat() == LockfileFormat.YARN_BERRY) {
            return new YarnBerryResolution(tables, dependencies, options);
        }
        return new HoistingResolution(tables, dependencies, options);
    }

    /**
     * Name to declared range for every section the options select. A name declared in more
     * than one section keeps its first range.
     */
    static Map<String, String> collectSeeds(PackageManifest manifest, ResolveOptions options) {
        Map<String, String> seeds = new LinkedHashMap<>(manifest.getDependencies());
        if (options.isDev()) {
            manifest.getDevDependencies().forEach(seeds::putIfAbsent);
        }
        if (options.isOptional()) {
            manifest.getOptionalDependencies().forEach(seeds::putIfAbsent);
        }
        if (options.isPeer()) {
            manifest.getPeerDependencies().forEach(seeds::putIfAbsent);
        }
        return seeds;
    }
}

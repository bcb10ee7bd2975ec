package com.flatlock.set;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.flatlock.detect.LockfileDetector;
import com.flatlock.exception.TraversalException;
import com.flatlock.extract.Extractors;
import com.flatlock.model.Dependency;
import com.flatlock.model.LockfileFormat;
import com.flatlock.model.PackageManifest;
import com.flatlock.parser.LockfileReader;

/**
 * Immutable set of the external packages pinned by a lockfile, keyed by {@code name@version}.
 *
 * Sets loaded from a lockfile keep its raw tables and can answer
 * {@link #dependenciesOf}. Sets derived by set algebra or resolution no longer describe
 * one lockfile graph, so they drop the tables and cannot traverse.
 *
 * <pre>
 * DependencySet lockfile = DependencySet.fromPath(Path.of("pnpm-lock.yaml"));
 * DependencySet web = lockfile.dependenciesOf(webManifest,
 *         ResolveOptions.builder().workspacePath("apps/web").build());
 * </pre>
 */
public final class DependencySet implements Iterable<Dependency> {
    private static final Logger log = LoggerFactory.getLogger(DependencySet.class);

    private final Map<String, Dependency> dependencies;
    private final LockfileFormat format;
    private final LockfileTables tables;

    private DependencySet(Map<String, Dependency> dependencies, LockfileFormat format, LockfileTables tables) {
        this.dependencies = Collections.unmodifiableMap(dependencies);
        this.format = format;
        this.tables = tables;
    }

    // ---- construction ----

    public static DependencySet fromContent(String content) {
        return fromContent(content, LoadOptions.defaults());
    }

    /**
     * Detects the format unless given, then parses once into both the record map and the
     * raw tables used for traversal.
     *
     * @throws com.flatlock.exception.LockfileDetectionException if no format is given and none matches
     * @throws com.flatlock.exception.LockfileParseException if the content is invalid for the format
     */
    public static DependencySet fromContent(String content, LoadOptions options) {
        LoadOptions effective = options != null ? options : LoadOptions.defaults();
        LockfileFormat format = effective.getFormat() != null
                ? effective.getFormat()
                : LockfileDetector.detect(content, effective.getPathHint());

        JsonNode root = LockfileReader.read(content, format);
        Map<String, Dependency> dependencies = new LinkedHashMap<>();
        Extractors.forFormat(format).extract(root)
                .forEach(dependency -> dependencies.putIfAbsent(dependency.key(), dependency));

        log.debug("Loaded {} dependencies from {} lockfile", dependencies.size(), format);
        return new DependencySet(dependencies, format, LockfileTables.of(format, root, dependencies));
    }

    /**
     * Reads the file as UTF-8; its name is the detection hint.
     */
    public static DependencySet fromPath(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        Path fileName = path.getFileName();
        return fromContent(content, LoadOptions.builder()
                .pathHint(fileName != null ? fileName.toString() : null)
                .build());
    }

    private static DependencySet derived(Map<String, Dependency> dependencies, LockfileFormat format) {
        return new DependencySet(dependencies, format, null);
    }

    // ---- queries ----

    public int size() {
        return dependencies.size();
    }

    public boolean isEmpty() {
        return dependencies.isEmpty();
    }

    /**
     * @return the source format, or null for the result of set algebra
     */
    public LockfileFormat format() {
        return format;
    }

    public boolean canTraverse() {
        return tables != null;
    }

    public boolean has(String key) {
        return dependencies.containsKey(key);
    }

    public Optional<Dependency> get(String key) {
        return Optional.ofNullable(dependencies.get(key));
    }

    public Collection<Dependency> values() {
        return dependencies.values();
    }

    public Set<String> keys() {
        return dependencies.keySet();
    }

    public Set<Map.Entry<String, Dependency>> entries() {
        return dependencies.entrySet();
    }

    @Override
    public Iterator<Dependency> iterator() {
        return dependencies.values().iterator();
    }

    public Stream<Dependency> stream() {
        return dependencies.values().stream();
    }

    public List<Dependency> toList() {
        return List.copyOf(dependencies.values());
    }

    // ---- set algebra ----

    /**
     * Every record of this set, then the records of {@code other} whose key is new.
     */
    public DependencySet union(DependencySet other) {
        Map<String, Dependency> result = new LinkedHashMap<>(dependencies);
        other.dependencies.forEach(result::putIfAbsent);
        return derived(result, null);
    }

    public DependencySet intersection(DependencySet other) {
        Map<String, Dependency> result = new LinkedHashMap<>();
        dependencies.forEach((key, dependency) -> {
            if (other.has(key)) {
                result.put(key, dependency);
            }
        });
        return derived(result, null);
    }

    public DependencySet difference(DependencySet other) {
        Map<String, Dependency> result = new LinkedHashMap<>();
        dependencies.forEach((key, dependency) -> {
            if (!other.has(key)) {
                result.put(key, dependency);
            }
        });
        return derived(result, null);
    }

    public boolean isSubsetOf(DependencySet other) {
        return other.dependencies.keySet().containsAll(dependencies.keySet());
    }

    public boolean isSupersetOf(DependencySet other) {
        return other.isSubsetOf(this);
    }

    public boolean isDisjointFrom(DependencySet other) {
        return dependencies.keySet().stream().noneMatch(other::has);
    }

    // ---- traversal ----

    public DependencySet dependenciesOf(PackageManifest manifest) {
        return dependenciesOf(manifest, ResolveOptions.defaults());
    }

    /**
     * The transitive closure of the manifest's declared dependencies, resolved against
     * this lockfile. Names the lockfile cannot resolve are left out.
     *
     * @throws TraversalException if this set was not loaded from a lockfile, or the
     *                            manifest or options are null
     */
    public DependencySet dependenciesOf(PackageManifest manifest, ResolveOptions options) {
        if (!canTraverse()) {
            throw new TraversalException("dependenciesOf() requires lockfile data; this set was derived by "
                    + "set operations or resolution. Call it on the set loaded from the lockfile.");
        }
        if (manifest == null) {
            throw new TraversalException("Package manifest must not be null");
        }
        if (options == null) {
            throw new TraversalException("Resolve options must not be null");
        }

        Map<String, Dependency> resolved = new TransitiveResolver(tables, dependencies).resolve(manifest, options);
        return derived(resolved, format);
    }

    @Override
    public String toString() {
        return "DependencySet[format=" + format + ", size=" + dependencies.size()
                + ", canTraverse=" + canTraverse() + "]";
    }
}

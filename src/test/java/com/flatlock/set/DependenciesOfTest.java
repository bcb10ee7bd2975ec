package com.flatlock.set;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.flatlock.Fixtures;
import com.flatlock.exception.TraversalException;
import com.flatlock.model.LockfileFormat;
import com.flatlock.model.PackageManifest;

/**
 * Unit tests for DependencySet.dependenciesOf across lockfile formats.
 */
class DependenciesOfTest {

    private static ResolveOptions workspace(String path) {
        return ResolveOptions.builder().workspacePath(path).build();
    }

    @Test
    void testNpmWorkspaceResolvesHoistedPackage() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.NPM_WORKSPACE);
        PackageManifest foo = PackageManifest.builder().name("foo").dependency("lodash", "^4.17.21").build();

        DependencySet result = lockfile.dependenciesOf(foo, workspace("packages/foo"));

        assertThat(result.keys()).containsExactly("lodash@4.17.21");
        assertThat(result.format()).isEqualTo(LockfileFormat.NPM);
        assertThat(result.canTraverse()).isFalse();
    }

    @Test
    void testNpmWorkspacePrefersNestedCopy() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.NPM_WORKSPACE);
        PackageManifest bar = PackageManifest.builder().name("bar").dependency("lodash", "^3.10.0").build();

        DependencySet result = lockfile.dependenciesOf(bar, workspace("./packages/bar/"));

        assertThat(result.keys()).containsExactly("lodash@3.10.1");
    }

    @Test
    void testNpmFollowsWorkspaceLinks() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.NPM_WORKSPACE);
        PackageManifest root = PackageManifest.builder().name("monorepo").dependency("foo", "*").build();

        DependencySet result = lockfile.dependenciesOf(root);

        assertThat(result.keys()).containsExactly("lodash@4.17.21");
    }

    @Test
    void testNpmNestedResolutionWalksUp() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.NPM_NESTED);
        PackageManifest app = PackageManifest.builder().dependency("express", "^4.18.2").build();

        DependencySet result = lockfile.dependenciesOf(app);

        assertThat(result.keys()).containsExactlyInAnyOrder("express@4.18.2", "debug@2.6.9", "fsevents@2.3.3",
                "ms@2.0.0");
        assertThat(result.has("debug@4.3.4")).isFalse();
    }

    @Test
    void testOptionalDependenciesCanBeExcluded() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.NPM_NESTED);
        PackageManifest app = PackageManifest.builder().dependency("express", "^4.18.2").build();

        DependencySet result = lockfile.dependenciesOf(app, ResolveOptions.builder().optional(false).build());

        assertThat(result.keys()).containsExactlyInAnyOrder("express@4.18.2", "debug@2.6.9", "ms@2.0.0");
    }

    @Test
    void testDevDependenciesOnlyWhenRequested() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.NPM_NESTED);
        PackageManifest app = PackageManifest.builder().devDependency("typescript", "^5.0.0").build();

        assertThat(lockfile.dependenciesOf(app).isEmpty()).isTrue();
        assertThat(lockfile.dependenciesOf(app, ResolveOptions.builder().dev(true).build()).keys())
                .containsExactly("typescript@5.3.3");
    }

    @Test
    void testPeerDependenciesOnlyWhenRequested() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.NPM_NESTED);
        PackageManifest plugin = PackageManifest.builder().peerDependency("ms", "^2.0.0").build();

        assertThat(lockfile.dependenciesOf(plugin).isEmpty()).isTrue();
        assertThat(lockfile.dependenciesOf(plugin, ResolveOptions.builder().peer(true).build()).keys())
                .containsExactly("ms@2.0.0");
    }

    @Test
    void testUnresolvableNamesAreOmitted() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.NPM_WORKSPACE);
        PackageManifest manifest = PackageManifest.builder()
                .dependency("does-not-exist", "^1.0.0")
                .dependency("lodash", "^4.17.21")
                .build();

        assertThat(lockfile.dependenciesOf(manifest).keys()).containsExactly("lodash@4.17.21");
    }

    @Test
    void testPnpmImporterPinsExactVersions() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.PNPM_V6);
        PackageManifest bar = PackageManifest.builder().name("bar").dependency("leftpad", "1.0.0").build();

        DependencySet result = lockfile.dependenciesOf(bar, workspace("packages/bar"));

        assertThat(result.keys()).containsExactly("leftpad@1.0.0");
    }

    @Test
    void testPnpmWithoutImporterFallsBackToHoisting() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.PNPM_V6);
        PackageManifest manifest = PackageManifest.builder().dependency("leftpad", "1.0.0").build();

        DependencySet result = lockfile.dependenciesOf(manifest, workspace("packages/missing"));

        assertThat(result.keys()).containsExactly("leftpad@1.0.0");
    }

    @Test
    void testPnpmV9FollowsPeerVariantsAndWorkspaceLinks() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.PNPM_V9);
        PackageManifest web = PackageManifest.builder()
                .name("web")
                .dependency("react-dom", "^18.2.0")
                .dependency("ui", "workspace:*")
                .build();

        DependencySet result = lockfile.dependenciesOf(web, workspace("apps/web"));

        assertThat(result.keys()).containsExactlyInAnyOrder("react-dom@18.2.0", "loose-envify@1.4.0",
                "react@18.2.0", "clsx@2.1.0");
        assertThat(result.has("vitest@1.2.0")).isFalse();
    }

    @Test
    void testPnpmV5SingleProjectUsesRootImporter() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.PNPM_V5);
        PackageManifest manifest = PackageManifest.builder().dependency("styled-jsx", "3.0.9").build();

        DependencySet result = lockfile.dependenciesOf(manifest);

        assertThat(result.keys()).containsExactly("styled-jsx@3.0.9", "loose-envify@1.4.0");
    }

    @Test
    void testPnpmV5InlineSpecifiersUsesImporterPins() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.PNPM_V5_INLINE);
        PackageManifest manifest = PackageManifest.builder()
                .dependency("lodash", "^4.17.21")
                .dependency("styled-jsx", "3.0.9")
                .build();

        DependencySet result = lockfile.dependenciesOf(manifest);

        assertThat(result.keys()).containsExactly("lodash@4.17.21", "styled-jsx@3.0.9", "loose-envify@1.4.0");
        assertThat(result.get("lodash@4.17.21").map(match -> match.getIntegrity())).contains("sha512-inline-lodash");
    }

    @Test
    void testPnpmUnknownEraStillResolves() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.PNPM_UNKNOWN_ERA);
        PackageManifest manifest = PackageManifest.builder().dependency("debug", "^4.3.4").build();

        DependencySet result = lockfile.dependenciesOf(manifest);

        assertThat(result.keys()).containsExactly("debug@4.3.4", "ms@2.1.2");
    }

    @Test
    void testPnpmAliasedImporterVersion() {
        String content = """
                lockfileVersion: '6.0'

                importers:

                  .:
                    dependencies:
                      string-width-cjs:
                        specifier: npm:string-width@^4.2.0
                        version: /string-width@4.2.3

                packages:

                  /string-width@4.2.3:
                    resolution: {integrity: sha512-sw}
                    dependencies:
                      strip-ansi: 6.0.1
                    dev: false

                  /strip-ansi@6.0.1:
                    resolution: {integrity: sha512-sa}
                    dev: false
                """;
        DependencySet lockfile = DependencySet.fromContent(content);
        PackageManifest manifest = PackageManifest.builder()
                .dependency("string-width-cjs", "npm:string-width@^4.2.0")
                .build();

        DependencySet result = lockfile.dependenciesOf(manifest);

        assertThat(result.keys()).containsExactly("string-width@4.2.3", "strip-ansi@6.0.1");
    }

    @Test
    void testYarnClassicTransitive() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.YARN_CLASSIC);
        PackageManifest manifest = PackageManifest.builder().dependency("express", "^4.18.2").build();

        DependencySet result = lockfile.dependenciesOf(manifest);

        assertThat(result.keys()).containsExactly("express@4.18.2", "debug@2.6.9", "ms@2.0.0");
        assertThat(result.format()).isEqualTo(LockfileFormat.YARN_CLASSIC);
    }

    @Test
    void testYarnBerryTransitive() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.YARN_BERRY);
        PackageManifest manifest = PackageManifest.builder().dependency("chalk", "^4.1.0").build();

        DependencySet result = lockfile.dependenciesOf(manifest);

        assertThat(result.keys()).containsExactly("chalk@4.1.2", "supports-color@7.2.0");
    }

    @Test
    void testYarnBerryFollowsWorkspaceDependencies() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.YARN_BERRY_WORKSPACES);
        PackageManifest app = PackageManifest.builder().name("app").dependency("lib", "workspace:^").build();

        DependencySet result = lockfile.dependenciesOf(app, workspace("packages/app"));

        assertThat(result.keys()).containsExactly("ms@2.1.3");
    }

    @Test
    void testYarnBerryPicksVersionByDeclaredRange() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.YARN_BERRY_WORKSPACES);
        PackageManifest manifest = PackageManifest.builder().dependency("ms", "^2.1.0").build();

        DependencySet result = lockfile.dependenciesOf(manifest);

        assertThat(lockfile.keys()).contains("ms@2.0.0", "ms@2.1.3");
        assertThat(result.keys()).containsExactly("ms@2.1.3");
    }

    @Test
    void testYarnBerryUnknownRangeFallsBackToName() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.YARN_BERRY_WORKSPACES);
        PackageManifest manifest = PackageManifest.builder().dependency("debug", "^2.0.0").build();

        DependencySet result = lockfile.dependenciesOf(manifest);

        assertThat(result.keys()).containsExactly("debug@2.6.9", "ms@2.0.0");
    }

    @Test
    void testYarnBerryResolvesAliasToRealPackage() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.YARN_BERRY);
        PackageManifest manifest = PackageManifest.builder()
                .dependency("string-width-cjs", "npm:string-width@^4.2.0")
                .build();

        DependencySet result = lockfile.dependenciesOf(manifest);

        assertThat(result.keys()).containsExactly("string-width@4.2.3");
    }

    @Test
    void testYarnBerryRootWorkspaceClosure() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.YARN_BERRY_WORKSPACES);
        PackageManifest app = PackageManifest.builder()
                .name("app")
                .dependency("debug", "npm:2.6.9")
                .dependency("lib", "workspace:^")
                .build();

        DependencySet result = lockfile.dependenciesOf(app);

        // ms reached through debug first, one version per name
        assertThat(result.keys()).containsExactly("debug@2.6.9", "ms@2.0.0");
        assertThat(result.keys()).noneMatch(key -> key.startsWith("lib@") || key.startsWith("app@"));
    }

    @Test
    void testNullArgumentsFail() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.YARN_CLASSIC);
        PackageManifest manifest = PackageManifest.builder().build();

        assertThatThrownBy(() -> lockfile.dependenciesOf(null))
                .isInstanceOf(TraversalException.class);
        assertThatThrownBy(() -> lockfile.dependenciesOf(manifest, null))
                .isInstanceOf(TraversalException.class);
    }

    @Test
    void testResolvedSetCannotTraverseAgain() {
        DependencySet lockfile = DependencySet.fromContent(Fixtures.YARN_CLASSIC);
        PackageManifest manifest = PackageManifest.builder().dependency("express", "^4.18.2").build();
        DependencySet result = lockfile.dependenciesOf(manifest);

        assertThatThrownBy(() -> result.dependenciesOf(manifest)).isInstanceOf(TraversalException.class);
    }
}

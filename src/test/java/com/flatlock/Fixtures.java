package com.flatlock;

/**
 * Small lockfiles shared by the tests, one per format and era.
 */
public final class Fixtures {

    private Fixtures() {
    }

    /** npm v3 workspace: foo is a workspace linked into node_modules, with its own lodash copy. */
    public static final String NPM_WORKSPACE = """
            {
              "name": "monorepo",
              "version": "1.0.0",
              "lockfileVersion": 3,
              "requires": true,
              "packages": {
                "": {
                  "name": "monorepo",
                  "version": "1.0.0",
                  "workspaces": ["packages/*"]
                },
                "node_modules/foo": {
                  "resolved": "packages/foo",
                  "link": true
                },
                "node_modules/lodash": {
                  "version": "4.17.21",
                  "resolved": "https://registry.npmjs.org/lodash/-/lodash-4.17.21.tgz",
                  "integrity": "sha512-npm-lodash"
                },
                "node_modules/@babel/core": {
                  "version": "7.23.0",
                  "integrity": "sha512-babel"
                },
                "packages/foo": {
                  "name": "foo",
                  "version": "1.0.0",
                  "dependencies": {
                    "lodash": "^4.17.21"
                  }
                },
                "packages/bar": {
                  "name": "bar",
                  "version": "1.0.0",
                  "dependencies": {
                    "lodash": "^3.10.0"
                  }
                },
                "packages/bar/node_modules/lodash": {
                  "version": "3.10.1",
                  "integrity": "sha512-old-lodash"
                }
              }
            }
            """;

    /** npm lockfile with a nested copy of debug under express. */
    public static final String NPM_NESTED = """
            {
              "name": "app",
              "lockfileVersion": 3,
              "packages": {
                "": {
                  "name": "app",
                  "dependencies": {
                    "express": "^4.18.2"
                  },
                  "devDependencies": {
                    "typescript": "^5.0.0"
                  }
                },
                "node_modules/express": {
                  "version": "4.18.2",
                  "dependencies": {
                    "debug": "2.6.9"
                  },
                  "optionalDependencies": {
                    "fsevents": "^2.3.0"
                  }
                },
                "node_modules/express/node_modules/debug": {
                  "version": "2.6.9",
                  "dependencies": {
                    "ms": "2.0.0"
                  }
                },
                "node_modules/debug": {
                  "version": "4.3.4"
                },
                "node_modules/ms": {
                  "version": "2.0.0"
                },
                "node_modules/fsevents": {
                  "version": "2.3.3",
                  "optional": true
                },
                "node_modules/typescript": {
                  "version": "5.3.3",
                  "dev": true
                }
              }
            }
            """;

    public static final String PNPM_V5 = """
            lockfileVersion: 5.4

            specifiers:
              styled-jsx: 3.0.9

            dependencies:
              styled-jsx: 3.0.9_react@17.0.2

            packages:

              /styled-jsx/3.0.9_react@17.0.2:
                resolution: {integrity: sha512-styled}
                dependencies:
                  loose-envify: 1.4.0
                peerDependencies:
                  react: '>= 16.8.0'
                dev: false

              /styled-jsx/3.0.9_react@18.2.0:
                resolution: {integrity: sha512-styled}
                dev: false

              /loose-envify/1.4.0:
                resolution: {integrity: sha512-loose}
                dev: false
            """;

    /** The experimental 5.4-inlineSpecifiers layout: v6-style importers over v5 slash keys. */
    public static final String PNPM_V5_INLINE = """
            lockfileVersion: 5.4-inlineSpecifiers

            importers:

              .:
                dependencies:
                  lodash:
                    specifier: ^4.17.21
                    version: 4.17.21
                  styled-jsx:
                    specifier: 3.0.9
                    version: 3.0.9_react@17.0.2

            packages:

              /lodash/4.17.21:
                resolution: {integrity: sha512-inline-lodash}
                dev: false

              /styled-jsx/3.0.9_react@17.0.2:
                resolution: {integrity: sha512-styled}
                dependencies:
                  loose-envify: 1.4.0
                dev: false

              /loose-envify/1.4.0:
                resolution: {integrity: sha512-loose}
                dev: false
            """;

    public static final String PNPM_V6 = """
            lockfileVersion: '6.0'

            importers:

              packages/bar:
                dependencies:
                  leftpad:
                    specifier: 1.0.0
                    version: 1.0.0

            packages:

              /leftpad@1.0.0:
                resolution:
                  integrity: sha512-leftpad
                  tarball: https://registry.example.com/leftpad-1.0.0.tgz
                dev: false

              /@scope/other@2.0.0(leftpad@1.0.0):
                resolution: {integrity: sha512-other}
                dev: false
            """;

    public static final String PNPM_V9 = """
            lockfileVersion: '9.0'

            importers:

              .:
                dependencies: {}

              apps/web:
                dependencies:
                  react-dom:
                    specifier: ^18.2.0
                    version: 18.2.0(react@18.2.0)
                  ui:
                    specifier: workspace:*
                    version: link:../../packages/ui

              packages/ui:
                dependencies:
                  clsx:
                    specifier: ^2.0.0
                    version: 2.1.0
                devDependencies:
                  vitest:
                    specifier: ^1.0.0
                    version: 1.2.0

            packages:

              react-dom@18.2.0:
                resolution: {integrity: sha512-react-dom}
                peerDependencies:
                  react: ^18.2.0

              react@18.2.0:
                resolution: {integrity: sha512-react}

              loose-envify@1.4.0:
                resolution: {integrity: sha512-loose}

              clsx@2.1.0:
                resolution: {integrity: sha512-clsx}

              vitest@1.2.0:
                resolution: {integrity: sha512-vitest}

              local-tool@file:tools/local:
                resolution: {directory: tools/local, type: directory}

            snapshots:

              react-dom@18.2.0(react@18.2.0):
                dependencies:
                  loose-envify: 1.4.0
                  react: 18.2.0

              react@18.2.0:
                dependencies:
                  loose-envify: 1.4.0

              loose-envify@1.4.0: {}

              clsx@2.1.0: {}

              vitest@1.2.0: {}
            """;

    /** A lockfileVersion this library does not know, with v6-shaped keys. */
    public static final String PNPM_UNKNOWN_ERA = """
            lockfileVersion: '7.0'

            importers:

              .:
                dependencies:
                  debug:
                    specifier: ^4.3.4
                    version: 4.3.4

            packages:

              /debug@4.3.4:
                resolution: {integrity: sha512-debug}
                dependencies:
                  ms: 2.1.2

              /ms@2.1.2:
                resolution: {integrity: sha512-ms}
            """;

    public static final String PNPM_SHRINKWRAP = """
            shrinkwrapVersion: 3
            packages:
              /foo/1.0.0/bar@2.0.0:
                resolution:
                  integrity: sha512-foo
              /bar/2.0.0:
                resolution:
                  integrity: sha512-bar
            """;

    public static final String YARN_CLASSIC = """
            # THIS IS AN AUTOGENERATED FILE. DO NOT EDIT THIS FILE DIRECTLY.
            # yarn lockfile v1


            debug@2.6.9:
              version "2.6.9"
              resolved "https://registry.yarnpkg.com/debug/-/debug-2.6.9.tgz#5d128515df134ff327e90a4c93f4e077a536341f"
              integrity sha512-debug
              dependencies:
                ms "2.0.0"

            express@^4.18.2:
              version "4.18.2"
              resolved "https://registry.yarnpkg.com/express/-/express-4.18.2.tgz"
              integrity sha512-express
              dependencies:
                debug "2.6.9"

            "left-pad@^1.3.0", left-pad@~1.3.0:
              version "1.3.0"
              integrity sha512-left-pad

            lodash@^4.17.21:
              version "4.17.21"
              integrity sha512-yarn-lodash

            ms@2.0.0:
              version "2.0.0"
              integrity sha512-ms

            "local-pkg@file:./local":
              version "1.0.0"
              resolved "file:./local"
            """;

    public static final String YARN_BERRY = """
            # This file is generated by running "yarn install" inside your project.
            # Manual changes might be lost - proceed with caution!

            __metadata:
              version: 6
              cacheKey: 8

            "app@workspace:.":
              version: 0.0.0-use.local
              resolution: "app@workspace:."
              dependencies:
                chalk: "npm:^4.1.0"
                string-width-cjs: "npm:string-width@^4.2.0"
              languageName: unknown
              linkType: soft

            "chalk@npm:^4.1.0":
              version: 4.1.2
              resolution: "chalk@npm:4.1.2"
              dependencies:
                supports-color: "npm:^7.1.0"
              checksum: 10c0/chalk
              languageName: node
              linkType: hard

            "string-width-cjs@npm:string-width@^4.2.0":
              version: 4.2.3
              resolution: "string-width@npm:4.2.3"
              checksum: 10c0/string-width
              languageName: node
              linkType: hard

            "supports-color@npm:^7.1.0":
              version: 7.2.0
              resolution: "supports-color@npm:7.2.0"
              checksum: 10c0/supports-color
              languageName: node
              linkType: hard
            """;

    /** yarn berry monorepo: app depends on the lib workspace, two ms versions are installed. */
    public static final String YARN_BERRY_WORKSPACES = """
            __metadata:
              version: 8
              cacheKey: 10c0

            "app@workspace:packages/app":
              version: 0.0.0-use.local
              resolution: "app@workspace:packages/app"
              dependencies:
                debug: "npm:2.6.9"
                lib: "workspace:^"
              languageName: unknown
              linkType: soft

            "debug@npm:2.6.9":
              version: 2.6.9
              resolution: "debug@npm:2.6.9"
              dependencies:
                ms: "npm:2.0.0"
              checksum: 10c0/debug
              languageName: node
              linkType: hard

            "lib@workspace:packages/lib":
              version: 1.0.0
              resolution: "lib@workspace:packages/lib"
              dependencies:
                ms: "npm:^2.1.0"
              languageName: unknown
              linkType: soft

            "ms@npm:2.0.0":
              version: 2.0.0
              resolution: "ms@npm:2.0.0"
              checksum: 10c0/ms-old
              languageName: node
              linkType: hard

            "ms@npm:^2.1.0, ms@npm:^2.1.1":
              version: 2.1.3
              resolution: "ms@npm:2.1.3"
              checksum: 10c0/ms
              languageName: node
              linkType: hard
            """;
}

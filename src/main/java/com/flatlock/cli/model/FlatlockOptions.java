package com.flatlock.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the flatlock command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class FlatlockOptions {

	@Parameters(index = "0", paramLabel = "<lockfile>", description = "package-lock.json, npm-shrinkwrap.json, pnpm-lock.yaml, shrinkwrap.yaml or yarn.lock")
	private Path lockfile;

	@Option(names = { "--workspace",
			"-w" }, description = "Workspace directory relative to the lockfile; prints that workspace's transitive dependencies")
	private String workspace;

	@Option(names = { "--dev" }, description = "Include devDependencies of the workspace")
	private boolean dev;

	@Option(names = { "--peer" }, description = "Include peerDependencies of the workspace")
	private boolean peer;

	@Option(names = { "--no-optional" }, description = "Exclude optionalDependencies")
	private boolean noOptional;

	@Option(names = { "--type", "-t" }, description = "Lockfile type, skips detection: npm, pnpm, yarn-classic, yarn-berry")
	private String type;

	@Option(names = { "--names" }, description = "Print package names only, without versions")
	private boolean namesOnly;
}

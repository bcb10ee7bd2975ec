package com.flatlock.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.flatlock.cli.exception.OptionsValidationException;
import com.flatlock.cli.model.FlatlockOptions;
import com.flatlock.cli.model.ValidatedFlatlockOptions;
import com.flatlock.model.LockfileFormat;
import com.flatlock.set.ResolveOptions;

public class FlatlockOptionsValidator {

	static final String LOCKFILE = "<lockfile>";
	static final String TYPE = "--type";
	static final String WORKSPACE = "--workspace";

	public ValidatedFlatlockOptions validate(FlatlockOptions o) {
		Map<String, String> errors = new LinkedHashMap<>();

		Path lockfile = null;
		if (o.getLockfile() == null) {
			errors.put(LOCKFILE, "Lockfile path is required.");
		} else {
			lockfile = o.getLockfile().toAbsolutePath().normalize();
			if (!Files.isRegularFile(lockfile)) {
				errors.put(LOCKFILE, "Lockfile does not exist or is not a file: " + o.getLockfile());
			}
		}

		LockfileFormat format = null;
		if (!isBlank(o.getType())) {
			Optional<LockfileFormat> parsed = LockfileFormat.fromId(o.getType());
			if (parsed.isPresent()) {
				format = parsed.get();
			} else {
				errors.put(TYPE, "Unknown lockfile type '" + o.getType() + "'. Expected one of: " + formatIds() + ".");
			}
		}

		Path manifest = null;
		boolean hasWorkspace = !isBlank(o.getWorkspace());
		if (hasWorkspace && lockfile != null) {
			Path lockfileDir = lockfile.getParent() == null ? Path.of(".") : lockfile.getParent();
			manifest = lockfileDir.resolve(o.getWorkspace().trim()).resolve("package.json").normalize();
			if (!Files.isRegularFile(manifest)) {
				errors.put(WORKSPACE, "Workspace package.json does not exist: " + manifest);
			}
		}

		List<String> workspaceFlags = workspaceOnlyFlags(o);
		if (!hasWorkspace && !workspaceFlags.isEmpty()) {
			errors.put(String.join(", ", workspaceFlags),
					"--dev, --peer and --no-optional only apply together with --workspace / -w.");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		ResolveOptions resolveOptions = ResolveOptions.builder()
				.workspacePath(hasWorkspace ? o.getWorkspace().trim() : null)
				.dev(o.isDev())
				.peer(o.isPeer())
				.optional(!o.isNoOptional())
				.build();

		return new ValidatedFlatlockOptions(lockfile, format, manifest, resolveOptions);
	}

	private static List<String> workspaceOnlyFlags(FlatlockOptions o) {
		List<String> flags = new ArrayList<>();
		if (o.isDev()) {
			flags.add("--dev");
		}
		if (o.isPeer()) {
			flags.add("--peer");
		}
		if (o.isNoOptional()) {
			flags.add("--no-optional");
		}
		return flags;
	}

	private static String formatIds() {
		return Arrays.stream(LockfileFormat.values()).map(LockfileFormat::getId).collect(Collectors.joining(", "));
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}

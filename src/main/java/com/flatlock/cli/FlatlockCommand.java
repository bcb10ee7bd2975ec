package com.flatlock.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.flatlock.cli.exception.OptionsValidationException;
import com.flatlock.cli.model.FlatlockOptions;
import com.flatlock.cli.model.ValidatedFlatlockOptions;
import com.flatlock.cli.output.DependencyListPrinter;
import com.flatlock.cli.validation.FlatlockOptionsValidator;
import com.flatlock.exception.FlatlockException;
import com.flatlock.model.PackageManifest;
import com.flatlock.set.DependencySet;
import com.flatlock.set.LoadOptions;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Lists the external packages of a lockfile, or the transitive dependencies of one
 * workspace in it.
 */
@Command(
        name = "flatlock",
        mixinStandardHelpOptions = true,
        version = "flatlock 1.0.0",
        description = "Prints the flat dependency list of an npm, pnpm or yarn lockfile."
)
public class FlatlockCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FlatlockCommand.class);

    @Mixin
    private FlatlockOptions options;

    @Spec
    private CommandSpec spec;

    private final FlatlockOptionsValidator validator = new FlatlockOptionsValidator();
    private final DependencyListPrinter printer = new DependencyListPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedFlatlockOptions validated = validator.validate(options);
            printer.printBanner(options, validated);

            DependencySet lockfile = DependencySet.fromContent(
                    Files.readString(validated.getLockfile(), StandardCharsets.UTF_8),
                    LoadOptions.builder()
                            .format(validated.getFormat())
                            .pathHint(validated.getLockfile().getFileName().toString())
                            .build());

            DependencySet result = lockfile;
            if (validated.getManifest() != null) {
                PackageManifest manifest = PackageManifest.fromPath(validated.getManifest());
                result = lockfile.dependenciesOf(manifest, validated.getResolveOptions());
            }

            printer.printDependencies(spec.commandLine().getOut(), result, options.isNamesOnly());
            printer.printSummary(result);
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrorsByOption().forEach((option, error) -> log.error("{}: {}", option, error));
            return 1;
        } catch (FlatlockException e) {
            log.error(e.getMessage());
            log.debug("Failure detail", e);
            return 1;
        } catch (IOException e) {
            log.error("Failed to read input: {}", e.getMessage());
            return 1;
        }
    }
}

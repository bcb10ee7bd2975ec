package com.flatlock.cli.output;

import java.io.PrintWriter;
import java.util.List;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.flatlock.cli.model.FlatlockOptions;
import com.flatlock.cli.model.ValidatedFlatlockOptions;
import com.flatlock.model.Dependency;
import com.flatlock.set.DependencySet;

/**
 * Responsible only for printing CLI output for the flatlock command.
 * The dependency list goes to the command's output stream; banners and
 * summaries go through the logger.
 */
public class DependencyListPrinter {

    private static final Logger log = LoggerFactory.getLogger(DependencyListPrinter.class);

    public void printBanner(FlatlockOptions o, ValidatedFlatlockOptions v) {
        log.info("Lockfile: {}", v.getLockfile());
        log.info("Type: {}", v.getFormat() != null ? v.getFormat() : "auto-detect");
        if (v.getManifest() != null) {
            log.info("Workspace: {} (dev={}, optional={}, peer={})", o.getWorkspace(),
                    v.getResolveOptions().isDev(), v.getResolveOptions().isOptional(), v.getResolveOptions().isPeer());
        }
    }

    /**
     * Prints one sorted line per dependency: {@code name@version}, or just the
     * de-duplicated names.
     */
    public void printDependencies(PrintWriter out, DependencySet dependencies, boolean namesOnly) {
        for (String line : lines(dependencies, namesOnly)) {
            out.println(line);
        }
        out.flush();
    }

    public void printSummary(DependencySet dependencies) {
        log.info("{} {} dependencies", dependencies.size(), dependencies.format());
    }

    static List<String> lines(DependencySet dependencies, boolean namesOnly) {
        TreeSet<String> lines = new TreeSet<>();
        for (Dependency dependency : dependencies) {
            lines.add(namesOnly ? dependency.getName() : dependency.key());
        }
        return List.copyOf(lines);
    }
}

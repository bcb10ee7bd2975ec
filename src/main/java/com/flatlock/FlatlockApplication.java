package com.flatlock;

import com.flatlock.cli.FlatlockCommand;

import picocli.CommandLine;

/**
 * Main entry point for the flatlock command line tool.
 */
public class FlatlockApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new FlatlockCommand()).execute(args);
        System.exit(exitCode);
    }
}

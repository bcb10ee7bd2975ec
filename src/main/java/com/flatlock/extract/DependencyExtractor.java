package com.flatlock.extract;

import java.util.stream.Stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.flatlock.model.Dependency;
import com.flatlock.model.LockfileFormat;

/**
 * Turns a parsed lockfile into the flat sequence of external packages it pins.
 *
 * Streams are lazy and can be consumed once; call {@link #extract} again to re-read.
 * Local, link and workspace entries never appear in the stream.
 */
public interface DependencyExtractor {

    LockfileFormat format();

    Stream<Dependency> extract(JsonNode lockfile);
}

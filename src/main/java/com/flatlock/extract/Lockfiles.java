package com.flatlock.extract;

import java.util.stream.Stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.flatlock.detect.LockfileDetector;
import com.flatlock.model.Dependency;
import com.flatlock.model.LockfileFormat;
import com.flatlock.parser.LockfileReader;

import lombok.experimental.UtilityClass;

/**
 * Streaming entry point: detect, read and extract in one call, without building a set.
 */
@UtilityClass
public class Lockfiles {

    public static Stream<Dependency> stream(String content) {
        return stream(content, null, null);
    }

    /**
     * @param format   format to parse as, or null to detect it
     * @param pathHint file name used for detection when content is blank, may be null
     */
    public static Stream<Dependency> stream(String content, LockfileFormat format, String pathHint) {
        LockfileFormat resolved = format != null ? format : LockfileDetector.detect(content, pathHint);
        JsonNode root = LockfileReader.read(content, resolved);
        return Extractors.forFormat(resolved).extract(root);
    }
}

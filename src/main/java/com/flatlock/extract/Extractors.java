package com.flatlock.extract;

import java.util.EnumMap;
import java.util.Map;

import com.flatlock.model.LockfileFormat;

import lombok.experimental.UtilityClass;

/**
 * Registry of the extractor for each lockfile format.
 */
@UtilityClass
public class Extractors {

    private static final Map<LockfileFormat, DependencyExtractor> EXTRACTORS = new EnumMap<>(LockfileFormat.class);

    static {
        register(new NpmExtractor());
        register(new PnpmExtractor());
        register(new YarnClassicExtractor());
        register(new YarnBerryExtractor());
    }

    private static void register(DependencyExtractor extractor) {
        EXTRACTORS.put(extractor.format(), extractor);
    }

    public static DependencyExtractor forFormat(LockfileFormat format) {
        DependencyExtractor extractor = EXTRACTORS.get(format);
        if (extractor == null) {
            throw new IllegalArgumentException("No extractor for format " + format);
        }
        return extractor;
    }
}

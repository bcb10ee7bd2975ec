package com.flatlock.parser;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.error.YAMLException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.flatlock.exception.LockfileParseException;
import com.flatlock.model.LockfileFormat;

import lombok.experimental.UtilityClass;

/**
 * Reads lockfile text into a Jackson tree: JSON for npm, YAML for pnpm and yarn berry,
 * and {@link YarnLockParser} for yarn v1.
 */
@UtilityClass
public class LockfileReader {
    private static final Logger log = LoggerFactory.getLogger(LockfileReader.class);

    /** Monorepo lockfiles routinely exceed SnakeYAML's 3 MB default. */
    private static final int YAML_CODE_POINT_LIMIT = 256 * 1024 * 1024;

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(yamlFactory());

    /**
     * Blank content reads as an empty document of any format.
     *
     * @return the document root, always an object node
     * @throws LockfileParseException when the content is not valid for {@code format}
     */
    public static JsonNode read(String content, LockfileFormat format) {
        if (content == null || content.isBlank()) {
            return JSON.createObjectNode();
        }
        JsonNode root = switch (format) {
            case NPM -> readTree(JSON, content, format);
            case PNPM, YARN_BERRY -> readTree(YAML, content, format);
            case YARN_CLASSIC -> YarnLockParser.parse(content);
        };
        if (root == null || !root.isObject()) {
            throw new LockfileParseException(format, "Document root is not a mapping");
        }
        log.debug("Read {} lockfile with {} top-level fields", format, root.size());
        return root;
    }

    private static JsonNode readTree(ObjectMapper mapper, String content, LockfileFormat format) {
        try {
            return mapper.readTree(content);
        } catch (IOException | YAMLException e) {
            throw new LockfileParseException(format, e.getMessage(), e);
        }
    }

    private static YAMLFactory yamlFactory() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setCodePointLimit(YAML_CODE_POINT_LIMIT);
        return YAMLFactory.builder().loaderOptions(loaderOptions).build();
    }
}

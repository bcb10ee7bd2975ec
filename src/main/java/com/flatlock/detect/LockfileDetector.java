package com.flatlock.detect;

import java.nio.file.Path;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.flatlock.exception.LockfileDetectionException;
import com.flatlock.exception.LockfileParseException;
import com.flatlock.model.LockfileFormat;
import com.flatlock.parser.LockfileReader;

import lombok.experimental.UtilityClass;

/**
 * Decides which lockfile format a piece of content is.
 *
 * Content is parsed and its structure inspected; a package name that merely contains
 * {@code __metadata} or {@code lockfileVersion} cannot change the outcome. First match wins:
 * <ol>
 *   <li>NPM: JSON object with a numeric root {@code lockfileVersion}</li>
 *   <li>YARN_BERRY: YAML mapping whose root {@code __metadata} mapping has a {@code version}</li>
 *   <li>PNPM: YAML mapping with a root {@code lockfileVersion} or {@code shrinkwrapVersion}
 *       and no {@code __metadata}</li>
 *   <li>YARN_CLASSIC: parses as yarn v1 with at least one entry and no {@code __metadata}</li>
 * </ol>
 * The path hint is consulted only when there is no content.
 */
@UtilityClass
public class LockfileDetector {
    private static final Logger log = LoggerFactory.getLogger(LockfileDetector.class);

    public static final String METADATA = "__metadata";
    public static final String LOCKFILE_VERSION = "lockfileVersion";
    public static final String SHRINKWRAP_VERSION = "shrinkwrapVersion";

    public static LockfileFormat detect(String content) {
        return detect(content, null);
    }

    /**
     * @param content  lockfile text, authoritative when non-blank
     * @param pathHint file name or path, used only when {@code content} is blank
     * @throws LockfileDetectionException when no format matches
     */
    public static LockfileFormat detect(String content, String pathHint) {
        if (content != null && !content.isBlank()) {
            LockfileFormat format = detectFromContent(content);
            log.debug("Detected {} lockfile from content", format);
            return format;
        }

        if (pathHint != null) {
            Optional<LockfileFormat> fromPath = detectFromPath(pathHint);
            if (fromPath.isPresent()) {
                log.debug("Detected {} lockfile from path hint {}", fromPath.get(), pathHint);
                return fromPath.get();
            }
        }

        throw new LockfileDetectionException("Unable to detect lockfile type"
                + (pathHint != null ? ": no content and unrecognized file name '" + pathHint + "'" : ": no content"));
    }

    private static LockfileFormat detectFromContent(String content) {
        Optional<JsonNode> json = tryRead(content, LockfileFormat.NPM);
        if (json.isPresent() && json.get().path(LOCKFILE_VERSION).isNumber()) {
            return LockfileFormat.NPM;
        }

        Optional<JsonNode> yaml = tryRead(content, LockfileFormat.YARN_BERRY);
        if (yaml.isPresent()) {
            JsonNode root = yaml.get();
            JsonNode metadata = root.get(METADATA);
            if (metadata != null && metadata.isObject() && metadata.has("version")) {
                return LockfileFormat.YARN_BERRY;
            }
            if (metadata == null && (root.has(LOCKFILE_VERSION) || root.has(SHRINKWRAP_VERSION))) {
                return LockfileFormat.PNPM;
            }
        }

        Optional<JsonNode> yarnClassic = tryRead(content, LockfileFormat.YARN_CLASSIC);
        if (yarnClassic.isPresent() && yarnClassic.get().size() > 0 && !yarnClassic.get().has(METADATA)) {
            return LockfileFormat.YARN_CLASSIC;
        }

        throw new LockfileDetectionException(
                "Unable to detect lockfile type: content does not match any known format");
    }

    static Optional<LockfileFormat> detectFromPath(String pathHint) {
        Path fileName = Path.of(pathHint).getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        return switch (fileName.toString()) {
            case "package-lock.json", "npm-shrinkwrap.json" -> Optional.of(LockfileFormat.NPM);
            case "pnpm-lock.yaml", "shrinkwrap.yaml" -> Optional.of(LockfileFormat.PNPM);
            case "yarn.lock" -> Optional.of(LockfileFormat.YARN_CLASSIC);
            default -> Optional.empty();
        };
    }

    private static Optional<JsonNode> tryRead(String content, LockfileFormat format) {
        try {
            return Optional.of(LockfileReader.read(content, format));
        } catch (LockfileParseException e) {
            log.trace("Content is not a {} document: {}", format, e.getMessage());
            return Optional.empty();
        }
    }
}

package com.flatlock.model;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flatlock.exception.ManifestException;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * The parts of a package.json that drive transitive resolution.
 *
 * Ranges are never evaluated. yarn berry resolution matches them verbatim against
 * lockfile descriptors; every other format only looks at the names.
 */
@Value
@Builder
public class PackageManifest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    String name;
    String version;
    @Singular("dependency")
    Map<String, String> dependencies;
    @Singular("devDependency")
    Map<String, String> devDependencies;
    @Singular("optionalDependency")
    Map<String, String> optionalDependencies;
    @Singular("peerDependency")
    Map<String, String> peerDependencies;

    public static PackageManifest fromPath(Path path) throws IOException {
        return fromJson(Files.readString(path, StandardCharsets.UTF_8));
    }

    public static PackageManifest fromJson(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ManifestException("Package manifest is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ManifestException("Package manifest must be a JSON object");
        }

        return PackageManifest.builder()
                .name(textOrNull(root.get("name")))
                .version(textOrNull(root.get("version")))
                .dependencies(readSection(root, "dependencies"))
                .devDependencies(readSection(root, "devDependencies"))
                .optionalDependencies(readSection(root, "optionalDependencies"))
                .peerDependencies(readSection(root, "peerDependencies"))
                .build();
    }

    private static Map<String, String> readSection(JsonNode root, String field) {
        JsonNode section = root.get(field);
        Map<String, String> result = new LinkedHashMap<>();
        if (section == null || section.isNull()) {
            return result;
        }
        if (!section.isObject()) {
            throw new ManifestException("Package manifest field '" + field + "' must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = section.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            result.put(entry.getKey(), entry.getValue().isValueNode() ? entry.getValue().asText() : "");
        }
        return result;
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isValueNode() ? node.asText() : null;
    }
}

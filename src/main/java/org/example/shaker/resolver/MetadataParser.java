package org.example.shaker.resolver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.example.shaker.exception.ConfigException;
import org.example.shaker.exception.ConstraintFormatException;
import org.example.shaker.model.DependencyRecord;
import org.example.shaker.model.FormulaMetadata;
import org.example.shaker.model.PackageKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code metadata.yml} manifests:
 *
 * <pre>
 * formula: org/name
 * dependencies:
 *   - git@github.com:org/other-formula.git==v1.0.1
 * exports:
 *   - other
 * </pre>
 */
public class MetadataParser {

    private final YAMLMapper mapper = new YAMLMapper();
    private final RequirementParser requirementParser;
    private final Logger log;

    public MetadataParser(RequirementParser requirementParser) {
        this(requirementParser, LoggerFactory.getLogger(MetadataParser.class));
    }

    public MetadataParser(RequirementParser requirementParser, Logger log) {
        this.requirementParser = requirementParser;
        this.log = log;
    }

    /**
     * Loads a manifest from disk.
     *
     * @throws ConfigException if the file is missing, unreadable or malformed
     */
    public FormulaMetadata parseFile(Path path) throws ConfigException, ConstraintFormatException {
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Metadata file not found: " + path);
        }
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8), path.toString());
        } catch (IOException e) {
            throw new ConfigException("Failed to read metadata file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses manifest text.
     *
     * @param content the YAML document
     * @param origin  where the document came from, for messages
     * @throws ConfigException           if the document is not a mapping or has malformed fields
     * @throws ConstraintFormatException if a dependency carries a malformed constraint
     */
    public FormulaMetadata parse(String content, String origin) throws ConfigException, ConstraintFormatException {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid YAML in " + origin + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigException("Metadata in " + origin + " is not a mapping");
        }

        PackageKey rootKey = null;
        JsonNode formula = root.get("formula");
        if (formula != null && !formula.isNull()) {
            if (!formula.isTextual()) {
                throw new ConfigException("'formula' in " + origin + " must be a string");
            }
            rootKey = PackageKey.parse(formula.asText());
        }

        Map<PackageKey, DependencyRecord> dependencies =
                requirementParser.parseAll(readStringList(root, "dependencies", origin));
        if (!root.has("dependencies")) {
            log.debug("No dependencies declared in {}", origin);
        }

        List<String> exports = readStringList(root, "exports", origin);

        return new FormulaMetadata(rootKey, dependencies, exports);
    }

    private List<String> readStringList(JsonNode root, String field, String origin) throws ConfigException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return Collections.emptyList();
        }
        if (!node.isArray()) {
            throw new ConfigException("'" + field + "' in " + origin + " must be a list");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode entry : node) {
            if (!entry.isTextual()) {
                throw new ConfigException("'" + field + "' in " + origin + " must only contain strings, found: " + entry);
            }
            values.add(entry.asText());
        }
        return values;
    }
}

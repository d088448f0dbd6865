/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;

import io.syncwarden.kubernetes.reconciler.declared.Documents;
import io.syncwarden.kubernetes.reconciler.errors.ErrorKind;
import io.syncwarden.kubernetes.reconciler.errors.ReconcilerError;

/**
 * Decodes YAML and JSON manifest files, which may hold several documents each. A document of kind {@code List} is
 * expanded into its items. A file that cannot be decoded is reported and skipped; the other files are still decoded.
 */
public class YamlManifestParser implements ManifestParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(YamlManifestParser.class);

    static final String LIST_KIND = "List";

    private static final ObjectReader READER = new ObjectMapper(new YAMLFactory()).readerFor(Map.class);

    @Override
    public ParseResult parse(SourceState source) {
        var manifests = new ArrayList<ParsedManifest>();
        var errors = new ArrayList<ReconcilerError>();
        for (Path file : source.files()) {
            Path relative = source.syncDir().relativize(file);
            try {
                manifests.addAll(parseFile(file, relative));
            }
            catch (IOException | RuntimeJsonMappingException | IllegalArgumentException e) {
                errors.add(ReconcilerError.of(ErrorKind.PARSE, "failed to parse " + relative + ": " + e.getMessage(), e));
            }
        }
        LOGGER.debug("Decoded {} objects from {} files with {} errors", manifests.size(), source.files().size(), errors.size());
        return new ParseResult(manifests, errors);
    }

    private static List<ParsedManifest> parseFile(Path file, Path relative) throws IOException {
        var manifests = new ArrayList<ParsedManifest>();
        try (MappingIterator<Map<String, Object>> documents = READER.readValues(file.toFile())) {
            while (documents.hasNext()) {
                Map<String, Object> document = documents.next();
                if (document == null || document.isEmpty()) {
                    continue;
                }
                for (Map<String, Object> item : expand(document)) {
                    GenericKubernetesResource object = Documents.serialization().convertValue(item, GenericKubernetesResource.class);
                    manifests.add(new ParsedManifest(relative, object));
                }
            }
        }
        return manifests;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> expand(Map<String, Object> document) {
        if (!LIST_KIND.equals(document.get("kind")) || !(document.get("items") instanceof List<?> items)) {
            return List.of(document);
        }
        var expanded = new ArrayList<Map<String, Object>>();
        for (Object item : items) {
            if (!(item instanceof Map<?, ?>)) {
                throw new IllegalArgumentException("the items of a List must be objects");
            }
            expanded.add((Map<String, Object>) item);
        }
        return expanded;
    }
}

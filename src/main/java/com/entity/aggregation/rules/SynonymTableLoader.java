package com.entity.aggregation.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads synonym tables from JSON.
 *
 * <pre>
 * {
 *   "version": "v1",
 *   "aliases": { "ig": "instagram", "nyc": "new york city" }
 * }
 * </pre>
 *
 * Both sides of every alias are run through the given {@link NormalizationEngine} so that
 * table authors can write natural casing and punctuation.
 */
public class SynonymTableLoader {
    private static final Logger log = LoggerFactory.getLogger(SynonymTableLoader.class);

    public static final String DEFAULT_RESOURCE = "synonyms/default-v1.json";

    private final ObjectMapper objectMapper;
    private final NormalizationEngine engine;

    public SynonymTableLoader(NormalizationEngine engine) {
        this(new ObjectMapper(), engine);
    }

    public SynonymTableLoader(ObjectMapper objectMapper, NormalizationEngine engine) {
        this.objectMapper = objectMapper;
        this.engine = engine;
    }

    /**
     * Loads the table bundled with the library.
     */
    public SynonymTable loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public SynonymTable loadResource(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = SynonymTableLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new SynonymTableException("Synonym table resource not found: " + resource);
            }
            return load(in);
        } catch (IOException e) {
            throw new SynonymTableException("Failed to read synonym table " + resource, e);
        }
    }

    public SynonymTable load(InputStream in) {
        TableDocument document;
        try {
            document = objectMapper.readValue(in, TableDocument.class);
        } catch (IOException e) {
            throw new SynonymTableException("Malformed synonym table: " + e.getMessage(), e);
        }
        if (document.version == null || document.version.isBlank()) {
            throw new SynonymTableException("Synonym table is missing a version");
        }

        Map<String, String> aliases = new LinkedHashMap<>();
        if (document.aliases != null) {
            document.aliases.forEach((alias, canonical) -> {
                String from = engine.normalize(alias, null);
                String to = engine.normalize(canonical, null);
                if (from.isEmpty() || to.isEmpty()) {
                    throw new SynonymTableException("Empty alias entry '" + alias + "' -> '" + canonical + "'");
                }
                if (!from.equals(to)) {
                    aliases.put(from, to);
                }
            });
        }

        SynonymTable table = new SynonymTable(document.version, aliases);
        log.info("Loaded synonym table version={} aliases={}", table.getVersion(), table.size());
        return table;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TableDocument {
        @JsonProperty("version")
        String version;

        @JsonProperty("aliases")
        Map<String, String> aliases;
    }
}

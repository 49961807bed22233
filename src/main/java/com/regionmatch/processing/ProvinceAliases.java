package com.regionmatch.processing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Colloquial province short names (广东, 内蒙古, 北京, ...) mapped to canonical province names.
 * Loaded from a JSON object resource, e.g. {@code {"广东": "广东省"}}.
 */
public class ProvinceAliases {

    private static final Logger logger = LoggerFactory.getLogger(ProvinceAliases.class);

    public static final String DEFAULT_RESOURCE = "/province-aliases.json";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Loads the bundled alias table.
     */
    public static Map<String, String> load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Loads an alias table from the given classpath resource.
     *
     * @return unmodifiable short name to canonical name map, in file order
     * @throws RegionDataException if the resource is missing, unreadable or not a JSON object
     */
    public static Map<String, String> load(String resourcePath) {
        try (InputStream is = ProvinceAliases.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new RegionDataException("Province alias resource not found: " + resourcePath);
            }

            JsonNode rootNode = objectMapper.readTree(is);
            if (rootNode == null || !rootNode.isObject()) {
                throw new RegionDataException("Province alias resource must be a JSON object: " + resourcePath);
            }

            Map<String, String> aliases = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = rootNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String shortName = field.getKey().trim();
                String canonicalName = field.getValue().asText().trim();
                if (shortName.isEmpty() || canonicalName.isEmpty()) {
                    logger.warn("Ignoring empty province alias in {}: {}", resourcePath, field);
                    continue;
                }
                aliases.put(shortName, canonicalName);
            }

            logger.info("Loaded {} province aliases from {}", aliases.size(), resourcePath);
            return Collections.unmodifiableMap(aliases);

        } catch (IOException e) {
            throw new RegionDataException("Failed to load province aliases from " + resourcePath, e);
        }
    }
}

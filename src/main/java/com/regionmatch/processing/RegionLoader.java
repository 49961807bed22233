package com.regionmatch.processing;

import com.regionmatch.matching.Region;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the gazetteer from a classpath CSV resource.
 * Expected format: {@code id,province,city,district} with an optional empty district column.
 */
public class RegionLoader {

    private static final Logger logger = LoggerFactory.getLogger(RegionLoader.class);

    public static final String DEFAULT_RESOURCE = "/regions.csv";

    private static final String HEADER_PREFIX = "id,";

    /**
     * Loads the bundled gazetteer.
     */
    public static List<Region> load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Loads a gazetteer from the given classpath resource.
     *
     * @param resourcePath absolute classpath location, e.g. {@code /regions.csv}
     * @return de-duplicated rows in file order, never empty
     * @throws RegionDataException if the resource is missing, unreadable or holds no valid row
     */
    public static List<Region> load(String resourcePath) {
        try (InputStream is = RegionLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new RegionDataException("Gazetteer resource not found: " + resourcePath);
            }

            BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
            List<Region> regions = read(reader, resourcePath);
            if (regions.isEmpty()) {
                throw new RegionDataException("Gazetteer resource contains no valid rows: " + resourcePath);
            }
            return regions;

        } catch (IOException e) {
            throw new RegionDataException("Failed to load gazetteer from " + resourcePath, e);
        }
    }

    static List<Region> read(BufferedReader reader, String source) throws IOException {
        Set<Region> regions = new LinkedHashSet<>();

        String line;
        int lineCount = 0;
        int skipped = 0;

        while ((line = reader.readLine()) != null) {
            lineCount++;
            if (lineCount == 1 && !line.isEmpty() && line.charAt(0) == '\uFEFF') {
                line = line.substring(1);
            }
            line = line.trim();

            // Skip empty lines, comments and header
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(HEADER_PREFIX)) {
                continue;
            }

            Region region = parseLine(line, lineCount, source);
            if (region == null) {
                skipped++;
            } else {
                regions.add(region);
            }
        }

        logger.info("Loaded {} regions from {} ({} lines processed, {} skipped)",
                regions.size(), source, lineCount, skipped);
        return new ArrayList<>(regions);
    }

    /**
     * Parses a single gazetteer line.
     *
     * @return the region, or null if the line is malformed
     */
    private static Region parseLine(String line, int lineNumber, String source) {
        String[] parts = line.split(",", -1);
        if (parts.length < 3) {
            logger.warn("Invalid line format in {} at line {}: {}", source, lineNumber, line);
            return null;
        }

        String province = parts[1].trim();
        String city = parts[2].trim();
        String district = parts.length > 3 ? parts[3].trim() : "";

        if (province.isEmpty() || city.isEmpty()) {
            logger.warn("Empty province or city in {} at line {}: {}", source, lineNumber, line);
            return null;
        }

        return new Region(province, city, district.isEmpty() ? null : district);
    }
}

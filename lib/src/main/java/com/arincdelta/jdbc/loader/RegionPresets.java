package com.arincdelta.jdbc.loader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Expands region tokens into area codes. Aliases come from {@code region-presets.properties}; an
 * ARINC-424 area code stands for itself.
 */
public final class RegionPresets {

    static final String RESOURCE = "region-presets.properties";

    /** ARINC-424 5.3 area codes. */
    public static final Set<String> AREA_CODES =
            Set.of("USA", "CAN", "PAC", "LAM", "SAM", "SPA", "EUR", "EEU", "MES", "AFR");

    private static final RegionPresets DEFAULT = loadDefault();

    private final Map<String, Set<String>> aliases;

    public RegionPresets(Map<String, Set<String>> aliases) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : aliases.entrySet()) {
            copy.put(entry.getKey().toUpperCase(Locale.ROOT), Set.copyOf(entry.getValue()));
        }
        this.aliases = Collections.unmodifiableMap(copy);
    }

    public static RegionPresets defaults() {
        return DEFAULT;
    }

    public Map<String, Set<String>> getAliases() {
        return aliases;
    }

    public Set<String> expand(Set<String> tokens) throws DeltaRequestException {
        Set<String> areas = new LinkedHashSet<>();
        for (String token : tokens) {
            Set<String> mapped = aliases.get(token);
            if (mapped != null) {
                areas.addAll(mapped);
            } else if (AREA_CODES.contains(token)) {
                areas.add(token);
            } else {
                throw new DeltaRequestException(
                        "Unknown region '" + token + "'. Allowed aliases: " + aliases.keySet()
                                + ", area codes: " + AREA_CODES);
            }
        }
        return areas;
    }

    private static RegionPresets loadDefault() {
        Properties properties = new Properties();
        try (InputStream in = RegionPresets.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource: " + RESOURCE);
            }
            properties.load(in);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read " + RESOURCE, ex);
        }
        Map<String, Set<String>> aliases = new LinkedHashMap<>();
        for (String alias : properties.stringPropertyNames()) {
            Set<String> areas = FilterLists.parse(properties.getProperty(alias));
            aliases.put(alias, areas == null ? Set.of() : areas);
        }
        return new RegionPresets(aliases);
    }
}

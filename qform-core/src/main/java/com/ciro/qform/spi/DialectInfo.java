package com.ciro.qform.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadatos de un dialecto para introspección y tooling.
 * Los ejemplos van en orden de declaración: título -> fuente.
 */
public record DialectInfo(String title,
                          String description,
                          String rootName,
                          String version,
                          Map<String, String> examples) {

    public DialectInfo {
        examples = examples == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(examples));
    }
}

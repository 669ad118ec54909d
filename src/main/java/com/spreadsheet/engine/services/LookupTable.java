package com.spreadsheet.engine.services;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Externally supplied data behind the domain lookup functions
 * (analyst notes, signals, quotes, portfolio and bot metrics).
 * Entries are keyed by function, key and optional field, case-insensitively.
 */
@Service
public class LookupTable {

    private static final Logger log = LoggerFactory.getLogger(LookupTable.class);

    private final Map<String, String> entries = new ConcurrentHashMap<>();

    public void put(String function, String key, String value) {
        entries.put(entryKey(function, key), value);
        log.debug("Lookup {}({}) = {}", function, key, value);
    }

    public void put(String function, String key, String field, String value) {
        entries.put(entryKey(function, key, field), value);
        log.debug("Lookup {}({}, {}) = {}", function, key, field, value);
    }

    public Optional<String> find(String function, String key) {
        return Optional.ofNullable(entries.get(entryKey(function, key)));
    }

    public Optional<String> find(String function, String key, String field) {
        return Optional.ofNullable(entries.get(entryKey(function, key, field)));
    }

    /**
     * All entries, sorted, as "FUNCTION/KEY[/FIELD]" -> value.
     */
    public Map<String, String> snapshot() {
        return new TreeMap<>(entries);
    }

    private static String entryKey(String... parts) {
        return String.join("/", parts).toUpperCase(Locale.ROOT);
    }
}

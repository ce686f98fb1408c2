package com.oloc.config;

import java.util.List;
import java.util.Optional;

/**
 * Ordered alias table: each entry maps a list of aliases to one canonical form.
 * Entries are tried top to bottom and aliases left to right.
 *
 * @param entries Table entries in lookup order
 */
public record MappingTable(List<Entry> entries) {

    public MappingTable {
        entries = List.copyOf(entries);
    }

    /**
     * @param canonical Canonical form written in place of any alias (may be empty)
     * @param aliases   Aliases in lookup order
     */
    public record Entry(String canonical, List<String> aliases) {
        public Entry {
            aliases = List.copyOf(aliases);
        }
    }

    public static MappingTable empty() {
        return new MappingTable(List.of());
    }

    /**
     * Canonical form of an exact alias, if any entry lists it.
     */
    public Optional<String> canonicalOf(String alias) {
        for (Entry entry : entries) {
            if (entry.aliases().contains(alias)) {
                return Optional.of(entry.canonical());
            }
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int aliasCount() {
        return entries.stream().mapToInt(entry -> entry.aliases().size()).sum();
    }
}

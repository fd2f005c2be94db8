package com.williamcallahan.notewiki.service.tex;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup from command and environment names to their entries.
 */
public final class DispatchTable {

    private final Map<DispatchKind, Map<String, DispatchEntry>> entries;

    private DispatchTable(Map<DispatchKind, Map<String, DispatchEntry>> entries) {
        this.entries = entries;
    }

    /**
     * Looks up an entry by kind and exact name.
     */
    public Optional<DispatchEntry> lookup(DispatchKind kind, String name) {
        return Optional.ofNullable(entries.get(kind).get(name));
    }

    /**
     * Returns the names registered for {@code kind}.
     */
    public Set<String> names(DispatchKind kind) {
        return entries.get(kind).keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects entries; a later entry with the same kind and name replaces the earlier one.
     */
    public static final class Builder {
        private final Map<DispatchKind, Map<String, DispatchEntry>> entries = new EnumMap<>(DispatchKind.class);

        private Builder() {
            for (DispatchKind kind : DispatchKind.values()) {
                entries.put(kind, new HashMap<>());
            }
        }

        public Builder add(DispatchEntry entry) {
            entries.get(entry.kind()).put(entry.name(), entry);
            return this;
        }

        public Builder addAll(Iterable<DispatchEntry> more) {
            more.forEach(this::add);
            return this;
        }

        public DispatchTable build() {
            Map<DispatchKind, Map<String, DispatchEntry>> frozen = new EnumMap<>(DispatchKind.class);
            entries.forEach((kind, byName) -> frozen.put(kind, Map.copyOf(byName)));
            return new DispatchTable(frozen);
        }
    }
}

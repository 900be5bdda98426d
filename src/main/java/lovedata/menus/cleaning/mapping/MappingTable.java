package lovedata.menus.cleaning.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only lookup of raw value to standard value.
 *
 * Raw values are unique and matched exactly. A raw value may map to
 * {@code null} on purpose (the venue table sends "NULL" to null), so use
 * {@link #contains(String)} to tell "mapped to null" from "not in the table".
 */
public final class MappingTable {

    private final String name;
    private final Map<String, String> entries;

    private MappingTable(String name, Map<String, String> entries) {
        this.name = name;
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public boolean contains(String rawValue) {
        return rawValue != null && entries.containsKey(rawValue);
    }

    /**
     * @return the standard value, or null when the raw value is unknown or explicitly mapped to null
     */
    public String get(String rawValue) {
        return rawValue == null ? null : entries.get(rawValue);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Entries in the order they were added.
     */
    public Map<String, String> entries() {
        return entries;
    }

    @Override
    public String toString() {
        return "MappingTable{" + name + ", " + entries.size() + " entries}";
    }

    public static final class Builder {

        private final String name;
        private final Map<String, String> entries = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        /**
         * @throws IllegalArgumentException on a blank or repeated raw value
         */
        public Builder put(String rawValue, String standardValue) {
            if (rawValue == null || rawValue.isEmpty()) {
                throw new IllegalArgumentException("Mapping table " + name + ": raw value must not be empty");
            }
            if (entries.containsKey(rawValue)) {
                throw new IllegalArgumentException("Mapping table " + name + ": duplicate raw value '" + rawValue + "'");
            }
            entries.put(rawValue, standardValue == null || standardValue.isEmpty() ? null : standardValue);
            return this;
        }

        public MappingTable build() {
            return new MappingTable(name, new LinkedHashMap<>(entries));
        }
    }
}

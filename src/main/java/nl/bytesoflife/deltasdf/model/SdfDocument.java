package nl.bytesoflife.deltasdf.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Root of a parsed SDF file: the header plus all timing entries, grouped by cell type
 * and then by instance. Map iteration order carries no meaning; the writer sorts.
 */
public final class SdfDocument {

    private final SdfHeader header;
    private final Map<String, Map<String, Map<EntryKey, Entry>>> cells;

    public SdfDocument(SdfHeader header, Map<String, ? extends Map<String, ? extends Map<EntryKey, Entry>>> cells) {
        this.header = Objects.requireNonNull(header, "header");
        Map<String, Map<String, Map<EntryKey, Entry>>> copy = new LinkedHashMap<>();
        cells.forEach((cellType, instances) -> {
            Map<String, Map<EntryKey, Entry>> instanceCopy = new LinkedHashMap<>();
            instances.forEach((instance, entries) ->
                instanceCopy.put(instance, Collections.unmodifiableMap(new LinkedHashMap<>(entries))));
            copy.put(cellType, Collections.unmodifiableMap(instanceCopy));
        });
        this.cells = Collections.unmodifiableMap(copy);
    }

    public SdfHeader getHeader() {
        return header;
    }

    public Map<String, Map<String, Map<EntryKey, Entry>>> getCells() {
        return cells;
    }

    public Map<String, Map<EntryKey, Entry>> getInstances(String cellType) {
        return cells.getOrDefault(cellType, Map.of());
    }

    public Map<EntryKey, Entry> getEntries(String cellType, String instance) {
        return getInstances(cellType).getOrDefault(instance, Map.of());
    }

    /**
     * Looks up an entry by the string form of its key, for example {@code iopath_a_y#1}.
     */
    public Entry getEntry(String cellType, String instance, String key) {
        return getEntries(cellType, instance).get(EntryKey.parse(key));
    }

    public int getEntryCount() {
        int count = 0;
        for (Map<String, Map<EntryKey, Entry>> instances : cells.values()) {
            for (Map<EntryKey, Entry> entries : instances.values()) {
                count += entries.size();
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SdfDocument other)) return false;
        return header.equals(other.header) && cells.equals(other.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(header, cells);
    }

    @Override
    public String toString() {
        return "SdfDocument{cellTypes=" + cells.size() + ", entries=" + getEntryCount() + "}";
    }
}

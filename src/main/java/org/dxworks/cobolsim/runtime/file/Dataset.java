package org.dxworks.cobolsim.runtime.file;

import org.dxworks.cobolsim.model.FileOrganization;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory dataset: an ordered list of records, or records sorted by key for indexed
 * (VSAM-like) files. Sequential access to a keyed dataset walks it in key order.
 */
public final class Dataset {
    public final String name;
    public final FileOrganization organization;

    private final List<String> records = new ArrayList<>();
    private final TreeMap<String, String> keyed = new TreeMap<>();

    Dataset(String name, FileOrganization organization) {
        this.name = name;
        this.organization = organization;
    }

    public boolean isKeyed() {
        return organization == FileOrganization.INDEXED;
    }

    public List<String> getRecords() {
        return isKeyed() ? List.copyOf(keyed.values()) : Collections.unmodifiableList(records);
    }

    public Map<String, String> getKeyedRecords() {
        return Collections.unmodifiableMap(keyed);
    }

    public int size() {
        return isKeyed() ? keyed.size() : records.size();
    }

    public String recordAt(int index) {
        if (!isKeyed()) {
            return records.get(index);
        }
        int i = 0;
        for (String record : keyed.values()) {
            if (i++ == index) {
                return record;
            }
        }
        throw new IndexOutOfBoundsException("Record " + index + " of " + name);
    }

    public void append(String record) {
        if (isKeyed()) {
            throw new IllegalStateException("Dataset " + name + " is keyed");
        }
        records.add(record);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(keyed.get(key));
    }

    public boolean containsKey(String key) {
        return keyed.containsKey(key);
    }

    public void put(String key, String record) {
        if (!isKeyed()) {
            throw new IllegalStateException("Dataset " + name + " is not keyed");
        }
        keyed.put(key, record);
    }

    public boolean remove(String key) {
        return keyed.remove(key) != null;
    }

    void clear() {
        records.clear();
        keyed.clear();
    }
}

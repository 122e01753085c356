package org.dxworks.cobolsim.runtime.file;

import org.dxworks.cobolsim.model.FileOrganization;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Named datasets of one runtime, looked up case-insensitively. Contents outlive individual
 * runs, so one program can read what an earlier run wrote.
 */
public final class DatasetCatalog {
    private final Map<String, Dataset> datasets = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public Dataset defineSequential(String name, List<String> records) {
        Dataset dataset = create(name, FileOrganization.SEQUENTIAL);
        records.forEach(dataset::append);
        return dataset;
    }

    public Dataset defineKeyed(String name, Map<String, String> records) {
        Dataset dataset = create(name, FileOrganization.INDEXED);
        records.forEach(dataset::put);
        return dataset;
    }

    /**
     * Replaces any dataset of that name with an empty one.
     */
    public Dataset create(String name, FileOrganization organization) {
        Dataset dataset = new Dataset(name, organization);
        datasets.put(name, dataset);
        return dataset;
    }

    public Optional<Dataset> find(String name) {
        return Optional.ofNullable(datasets.get(name));
    }

    public boolean exists(String name) {
        return datasets.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(datasets.keySet());
    }

    public void remove(String name) {
        datasets.remove(name);
    }
}

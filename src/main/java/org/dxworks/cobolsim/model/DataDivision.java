package org.dxworks.cobolsim.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class DataDivision {
    public final List<FileDescription> fileSection;
    public final List<VariableDeclaration> workingStorage;
    public final List<VariableDeclaration> linkageSection;
    public final List<MapDefinition> mapSection;
    public final List<ConditionName> conditionNames;

    public DataDivision(List<FileDescription> fileSection,
                        List<VariableDeclaration> workingStorage,
                        List<VariableDeclaration> linkageSection,
                        List<MapDefinition> mapSection,
                        List<ConditionName> conditionNames) {
        this.fileSection = List.copyOf(fileSection);
        this.workingStorage = List.copyOf(workingStorage);
        this.linkageSection = List.copyOf(linkageSection);
        this.mapSection = List.copyOf(mapSection);
        this.conditionNames = List.copyOf(conditionNames);
    }

    /**
     * File Section records followed by Working-Storage items; the program-owned storage.
     */
    public List<VariableDeclaration> ownedStorage() {
        List<VariableDeclaration> all = new ArrayList<>();
        for (FileDescription fd : fileSection) {
            all.addAll(fd.records);
        }
        all.addAll(workingStorage);
        return all;
    }

    public Optional<FileDescription> findFileByRecord(String recordName) {
        return fileSection.stream().filter(fd -> fd.declaresRecord(recordName)).findFirst();
    }

    public Optional<MapDefinition> findMap(String map, String mapset) {
        return mapSection.stream().filter(m -> m.matches(map, mapset)).findFirst();
    }
}

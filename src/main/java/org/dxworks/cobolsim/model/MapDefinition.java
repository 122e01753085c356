package org.dxworks.cobolsim.model;

import java.util.List;

/**
 * A BMS screen map: named fields placed on the 24x80 screen.
 */
public final class MapDefinition {
    public static final int SCREEN_ROWS = 24;
    public static final int SCREEN_COLUMNS = 80;

    public final String mapName;
    public final String mapsetName;
    public final List<MapField> fields;
    public final int line;

    public MapDefinition(String mapName, String mapsetName, List<MapField> fields, int line) {
        this.mapName = mapName;
        this.mapsetName = mapsetName;
        this.fields = List.copyOf(fields);
        this.line = line;
    }

    public boolean matches(String map, String mapset) {
        return mapName.equalsIgnoreCase(map) && (mapset == null || mapsetName.equalsIgnoreCase(mapset));
    }
}

package org.dxworks.cobolsim.model;

public final class MapField {
    public final String name;
    public final int row;
    public final int column;
    public final int length;
    public final String initial;
    public final SourceSpan span;

    public MapField(String name, int row, int column, int length, String initial, SourceSpan span) {
        this.name = name;
        this.row = row;
        this.column = column;
        this.length = length;
        this.initial = initial;
        this.span = span;
    }

    /**
     * True when the field starts inside the screen. A field may still run past the last column.
     */
    public boolean startsOnScreen() {
        return row >= 1 && row <= MapDefinition.SCREEN_ROWS && column >= 1 && column <= MapDefinition.SCREEN_COLUMNS;
    }
}

package org.dxworks.cobolsim.runtime.cics;

import org.dxworks.cobolsim.model.MapDefinition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 3270-style 24x80 terminal buffer. Rows and columns are 1-based. Text that starts on the screen
 * wraps onto the next row and is cut off at the last screen position. A start position off the
 * screen is rejected with {@link IllegalArgumentException}; callers check {@link #contains} first.
 */
public final class ScreenBuffer {
    public static final int ROWS = MapDefinition.SCREEN_ROWS;
    public static final int COLUMNS = MapDefinition.SCREEN_COLUMNS;

    private final ScreenChar[] cells = new ScreenChar[ROWS * COLUMNS];

    public ScreenBuffer() {
        clear();
    }

    public void clear() {
        Arrays.fill(cells, ScreenChar.BLANK);
    }

    public void write(int row, int column, String text) {
        write(row, column, text, ScreenChar.NORMAL);
    }

    public void write(int row, int column, String text, int attr) {
        int start = index(row, column);
        for (int i = 0; i < text.length() && start + i < cells.length; i++) {
            cells[start + i] = new ScreenChar(text.charAt(i), attr);
        }
    }

    public String read(int row, int column, int length) {
        int start = index(row, column);
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length && start + i < cells.length; i++) {
            sb.append(cells[start + i].ch);
        }
        return sb.toString();
    }

    public String rowText(int row) {
        return read(row, 1, COLUMNS);
    }

    public List<String> lines() {
        List<String> lines = new ArrayList<>(ROWS);
        for (int row = 1; row <= ROWS; row++) {
            lines.add(rowText(row));
        }
        return lines;
    }

    public List<ScreenChar> snapshot() {
        return List.of(cells);
    }

    public static boolean contains(int row, int column) {
        return row >= 1 && row <= ROWS && column >= 1 && column <= COLUMNS;
    }

    private static int index(int row, int column) {
        if (!contains(row, column)) {
            throw new IllegalArgumentException("Screen position out of range: " + row + "," + column);
        }
        return (row - 1) * COLUMNS + (column - 1);
    }
}

package org.dxworks.cobolsim.runtime.cics;

/**
 * One screen position: the character shown and its attribute byte.
 */
public final class ScreenChar {
    public static final int NORMAL = 0;

    public static final ScreenChar BLANK = new ScreenChar(' ', NORMAL);

    public final char ch;
    public final int attr;

    public ScreenChar(char ch, int attr) {
        this.ch = ch;
        this.attr = attr;
    }

    @Override
    public String toString() {
        return String.valueOf(ch);
    }
}

package org.dxworks.cobolsim.runtime;

import org.dxworks.cobolsim.runtime.cics.ScreenChar;

import java.util.List;

@FunctionalInterface
public interface ScreenUpdateHandler {

    ScreenUpdateHandler IGNORE = buffer -> {
    };

    /**
     * Called after SEND MAP with a copy of the 24x80 buffer, row by row.
     */
    void onScreenUpdate(List<ScreenChar> buffer);
}

package org.dxworks.cobolsim.runtime;

/**
 * Asked by RECEIVE MAP whether operator data is on the screen. Answering false suspends the
 * run until the host fills the buffer and resumes it.
 */
@FunctionalInterface
public interface ScreenInputHandler {

    ScreenInputHandler SUSPENDING = () -> false;

    boolean awaitInput();
}

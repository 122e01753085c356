package org.dxworks.cobolsim.runtime;

import org.dxworks.cobolsim.model.PicType;

import java.util.Optional;

/**
 * Supplies values for ACCEPT. An empty result suspends the run; the value is then passed to
 * {@link CobolRuntime#resume}.
 */
@FunctionalInterface
public interface InputHandler {

    InputHandler SUSPENDING = (name, type, length) -> Optional.empty();

    Optional<String> requestInput(String variableName, PicType type, int length);
}

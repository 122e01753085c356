package org.dxworks.cobolsim.runtime;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Identifies one suspension of one run. A token is accepted by {@link CobolRuntime#resume} exactly once.
 */
public final class ResumeToken {
    private final String id;

    ResumeToken(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResumeToken)) {
            return false;
        }
        return id.equals(((ResumeToken) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return id;
    }
}

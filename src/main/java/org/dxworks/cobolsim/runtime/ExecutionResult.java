package org.dxworks.cobolsim.runtime;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Snapshot of a run when it completes or suspends. Output and errors are cumulative for the
 * whole run, across suspensions.
 */
public final class ExecutionResult {
    public final ExecutionStatus status;
    public final List<String> output;
    public final List<String> errors;
    public final boolean abended;
    public final NextTransaction nextTransaction;
    public final Suspension suspension;

    ExecutionResult(ExecutionStatus status, List<String> output, List<String> errors, boolean abended,
                    NextTransaction nextTransaction, Suspension suspension) {
        this.status = status;
        this.output = List.copyOf(output);
        this.errors = List.copyOf(errors);
        this.abended = abended;
        this.nextTransaction = nextTransaction;
        this.suspension = suspension;
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == ExecutionStatus.COMPLETED;
    }

    @JsonIgnore
    public boolean isSuspended() {
        return status == ExecutionStatus.SUSPENDED;
    }
}

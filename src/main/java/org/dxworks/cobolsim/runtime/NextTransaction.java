package org.dxworks.cobolsim.runtime;

/**
 * Transaction requested by {@code EXEC CICS RETURN TRANSID(...)}, with the commarea to hand over.
 */
public final class NextTransaction {
    public final String transId;
    public final String commarea;

    public NextTransaction(String transId, String commarea) {
        this.transId = transId;
        this.commarea = commarea;
    }
}

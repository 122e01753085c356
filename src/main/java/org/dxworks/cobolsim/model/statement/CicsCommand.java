package org.dxworks.cobolsim.model.statement;

public enum CicsCommand {
    SEND_MAP,
    RECEIVE_MAP,
    READ,
    WRITE,
    REWRITE,
    DELETE,
    RETURN,
    LINK,
    HANDLE_CONDITION
}

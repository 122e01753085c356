package org.dxworks.cobolsim.model.statement;

public enum StatementKind {
    MOVE,
    ADD,
    SUBTRACT,
    MULTIPLY,
    DIVIDE,
    COMPUTE,
    IF,
    PERFORM,
    DISPLAY,
    ACCEPT,
    CALL,
    EXIT_PROGRAM,
    GOBACK,
    STOP_RUN,
    OPEN,
    CLOSE,
    READ,
    WRITE,
    EXEC_CICS
}

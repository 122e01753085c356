package org.dxworks.cobolsim.model.statement;

public enum OpenMode {
    INPUT,
    OUTPUT,
    I_O,
    EXTEND
}

package org.dxworks.cobolsim.validator;

public enum Severity {
    ERROR,
    WARNING,
    INFO
}

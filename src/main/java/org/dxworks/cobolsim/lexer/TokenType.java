package org.dxworks.cobolsim.lexer;

public enum TokenType {
    // Divisions, sections, paragraphs
    IDENTIFICATION, DIVISION, PROGRAM_ID,
    ENVIRONMENT, CONFIGURATION, INPUT_OUTPUT, FILE_CONTROL,
    DATA, FILE, FD, WORKING_STORAGE, LINKAGE, SECTION,
    PROCEDURE, USING,

    // Dedicated kind: Map Section header, map definition or CICS MAP(...) parameter
    MAP,

    // File control clauses
    SELECT, ASSIGN, ORGANIZATION, ACCESS, MODE, RECORD, KEY, IS,
    SEQUENTIAL, INDEXED, RANDOM, DYNAMIC,

    // Data clauses
    PIC, VALUE,

    // Verbs and phrases
    MOVE, ADD, SUBTRACT, MULTIPLY, DIVIDE, COMPUTE,
    TO, FROM, BY, INTO, GIVING,
    IF, THEN, ELSE, END_IF, NOT,
    PERFORM, UNTIL, TIMES, END_PERFORM,
    ACCEPT, DISPLAY, STOP, RUN,
    CALL, EXIT, PROGRAM, GOBACK,
    OPEN, CLOSE, READ, WRITE, END_READ, AT, END,
    INPUT, OUTPUT, I_O, EXTEND,
    EXEC, CICS, END_EXEC,

    // Figurative constants
    ZERO, SPACE,

    IDENTIFIER, LITERAL_STRING, LITERAL_NUMBER,

    // Punctuation and operators
    DOT, COLON, LPAREN, RPAREN,
    EQUALS, GREATER, LESS,
    PLUS, MINUS, ASTERISK, SLASH, POWER,

    EOF;

    /**
     * Tokens that close an open IF, PERFORM or READ scope.
     */
    public boolean isScopeTerminator() {
        return this == ELSE || this == END_IF || this == END_PERFORM || this == END_READ;
    }

    /**
     * Tokens that begin a procedure statement.
     */
    public boolean isVerb() {
        switch (this) {
            case MOVE: case ADD: case SUBTRACT: case MULTIPLY: case DIVIDE: case COMPUTE:
            case IF: case PERFORM: case ACCEPT: case DISPLAY: case STOP:
            case CALL: case EXIT: case GOBACK:
            case OPEN: case CLOSE: case READ: case WRITE: case EXEC:
                return true;
            default:
                return false;
        }
    }
}

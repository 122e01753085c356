package org.dxworks.cobolsim.lexer;

import org.dxworks.cobolsim.CompilationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Fixed-format tokenizer.
 *
 * Columns 1-6 are the sequence area and are ignored, column 7 is the indicator area
 * ('*' and '/' mark comment lines), columns 8-72 hold the program text and
 * columns 73+ are ignored. Tokens never span lines.
 */
public class Lexer {

    private static final Logger log = LoggerFactory.getLogger(Lexer.class);

    public static final String ILLEGAL_CHARACTER = "IGYPS2002-S";

    private static final int INDICATOR_INDEX = 6;
    private static final int CONTENT_START = 7;
    private static final int CONTENT_END = 72;

    private static final Pattern NUMBER = Pattern.compile("^[+-]?[0-9]+(\\.[0-9]+)?$");

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        KEYWORDS.put("IDENTIFICATION", TokenType.IDENTIFICATION);
        KEYWORDS.put("DIVISION", TokenType.DIVISION);
        KEYWORDS.put("PROGRAM-ID", TokenType.PROGRAM_ID);
        KEYWORDS.put("ENVIRONMENT", TokenType.ENVIRONMENT);
        KEYWORDS.put("CONFIGURATION", TokenType.CONFIGURATION);
        KEYWORDS.put("INPUT-OUTPUT", TokenType.INPUT_OUTPUT);
        KEYWORDS.put("FILE-CONTROL", TokenType.FILE_CONTROL);
        KEYWORDS.put("DATA", TokenType.DATA);
        KEYWORDS.put("FILE", TokenType.FILE);
        KEYWORDS.put("FD", TokenType.FD);
        KEYWORDS.put("WORKING-STORAGE", TokenType.WORKING_STORAGE);
        KEYWORDS.put("LINKAGE", TokenType.LINKAGE);
        KEYWORDS.put("SECTION", TokenType.SECTION);
        KEYWORDS.put("PROCEDURE", TokenType.PROCEDURE);
        KEYWORDS.put("USING", TokenType.USING);
        KEYWORDS.put("MAP", TokenType.MAP);

        KEYWORDS.put("SELECT", TokenType.SELECT);
        KEYWORDS.put("ASSIGN", TokenType.ASSIGN);
        KEYWORDS.put("ORGANIZATION", TokenType.ORGANIZATION);
        KEYWORDS.put("ACCESS", TokenType.ACCESS);
        KEYWORDS.put("MODE", TokenType.MODE);
        KEYWORDS.put("RECORD", TokenType.RECORD);
        KEYWORDS.put("KEY", TokenType.KEY);
        KEYWORDS.put("IS", TokenType.IS);
        KEYWORDS.put("SEQUENTIAL", TokenType.SEQUENTIAL);
        KEYWORDS.put("INDEXED", TokenType.INDEXED);
        KEYWORDS.put("RANDOM", TokenType.RANDOM);
        KEYWORDS.put("DYNAMIC", TokenType.DYNAMIC);

        KEYWORDS.put("PIC", TokenType.PIC);
        KEYWORDS.put("PICTURE", TokenType.PIC);
        KEYWORDS.put("VALUE", TokenType.VALUE);

        KEYWORDS.put("MOVE", TokenType.MOVE);
        KEYWORDS.put("ADD", TokenType.ADD);
        KEYWORDS.put("SUBTRACT", TokenType.SUBTRACT);
        KEYWORDS.put("MULTIPLY", TokenType.MULTIPLY);
        KEYWORDS.put("DIVIDE", TokenType.DIVIDE);
        KEYWORDS.put("COMPUTE", TokenType.COMPUTE);
        KEYWORDS.put("TO", TokenType.TO);
        KEYWORDS.put("FROM", TokenType.FROM);
        KEYWORDS.put("BY", TokenType.BY);
        KEYWORDS.put("INTO", TokenType.INTO);
        KEYWORDS.put("GIVING", TokenType.GIVING);
        KEYWORDS.put("IF", TokenType.IF);
        KEYWORDS.put("THEN", TokenType.THEN);
        KEYWORDS.put("ELSE", TokenType.ELSE);
        KEYWORDS.put("END-IF", TokenType.END_IF);
        KEYWORDS.put("NOT", TokenType.NOT);
        KEYWORDS.put("PERFORM", TokenType.PERFORM);
        KEYWORDS.put("UNTIL", TokenType.UNTIL);
        KEYWORDS.put("TIMES", TokenType.TIMES);
        KEYWORDS.put("END-PERFORM", TokenType.END_PERFORM);
        KEYWORDS.put("ACCEPT", TokenType.ACCEPT);
        KEYWORDS.put("DISPLAY", TokenType.DISPLAY);
        KEYWORDS.put("STOP", TokenType.STOP);
        KEYWORDS.put("RUN", TokenType.RUN);
        KEYWORDS.put("CALL", TokenType.CALL);
        KEYWORDS.put("EXIT", TokenType.EXIT);
        KEYWORDS.put("PROGRAM", TokenType.PROGRAM);
        KEYWORDS.put("GOBACK", TokenType.GOBACK);
        KEYWORDS.put("OPEN", TokenType.OPEN);
        KEYWORDS.put("CLOSE", TokenType.CLOSE);
        KEYWORDS.put("READ", TokenType.READ);
        KEYWORDS.put("WRITE", TokenType.WRITE);
        KEYWORDS.put("END-READ", TokenType.END_READ);
        KEYWORDS.put("AT", TokenType.AT);
        KEYWORDS.put("END", TokenType.END);
        KEYWORDS.put("INPUT", TokenType.INPUT);
        KEYWORDS.put("OUTPUT", TokenType.OUTPUT);
        KEYWORDS.put("I-O", TokenType.I_O);
        KEYWORDS.put("EXTEND", TokenType.EXTEND);
        KEYWORDS.put("EXEC", TokenType.EXEC);
        KEYWORDS.put("CICS", TokenType.CICS);
        KEYWORDS.put("END-EXEC", TokenType.END_EXEC);

        KEYWORDS.put("ZERO", TokenType.ZERO);
        KEYWORDS.put("ZEROS", TokenType.ZERO);
        KEYWORDS.put("ZEROES", TokenType.ZERO);
        KEYWORDS.put("SPACE", TokenType.SPACE);
        KEYWORDS.put("SPACES", TokenType.SPACE);
    }

    private final String source;

    public Lexer(String source) {
        this.source = source == null ? "" : source;
    }

    public static boolean isKeyword(String word) {
        return KEYWORDS.containsKey(word.toUpperCase(Locale.ROOT));
    }

    public List<Token> tokenize() throws CompilationException {
        List<Token> tokens = new ArrayList<>();
        String[] lines = source.split("\n", -1);

        for (int i = 0; i < lines.length; i++) {
            String rawLine = stripCarriageReturn(lines[i]);
            int lineNumber = i + 1;

            if (rawLine.length() <= CONTENT_START) {
                continue;
            }
            char indicator = rawLine.charAt(INDICATOR_INDEX);
            if (indicator == '*' || indicator == '/') {
                continue;
            }

            String content = rawLine.substring(CONTENT_START, Math.min(rawLine.length(), CONTENT_END));
            tokenizeLine(content, lineNumber, tokens);
        }

        tokens.add(new Token(TokenType.EOF, "EOF", lines.length + 1, 0));
        log.debug("Tokenized {} lines into {} tokens", lines.length, tokens.size());
        return tokens;
    }

    private void tokenizeLine(String content, int lineNumber, List<Token> tokens) throws CompilationException {
        int pos = 0;
        while (pos < content.length()) {
            char c = content.charAt(pos);
            // pos 0 of the content area is column 8
            int column = pos + CONTENT_START + 1;

            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }

            if ((c == '+' || c == '-') && startsSignedNumber(content, pos, tokens, lineNumber)) {
                pos = readWord(content, pos, lineNumber, column, tokens);
                continue;
            }

            switch (c) {
                case '.':
                    tokens.add(new Token(TokenType.DOT, ".", lineNumber, column));
                    pos++;
                    continue;
                case ':':
                    tokens.add(new Token(TokenType.COLON, ":", lineNumber, column));
                    pos++;
                    continue;
                case '(':
                    tokens.add(new Token(TokenType.LPAREN, "(", lineNumber, column));
                    pos++;
                    continue;
                case ')':
                    tokens.add(new Token(TokenType.RPAREN, ")", lineNumber, column));
                    pos++;
                    continue;
                case '=':
                    tokens.add(new Token(TokenType.EQUALS, "=", lineNumber, column));
                    pos++;
                    continue;
                case '>':
                    tokens.add(new Token(TokenType.GREATER, ">", lineNumber, column));
                    pos++;
                    continue;
                case '<':
                    tokens.add(new Token(TokenType.LESS, "<", lineNumber, column));
                    pos++;
                    continue;
                case '+':
                    tokens.add(new Token(TokenType.PLUS, "+", lineNumber, column));
                    pos++;
                    continue;
                case '-':
                    tokens.add(new Token(TokenType.MINUS, "-", lineNumber, column));
                    pos++;
                    continue;
                case '/':
                    tokens.add(new Token(TokenType.SLASH, "/", lineNumber, column));
                    pos++;
                    continue;
                case '*':
                    if (pos + 1 < content.length() && content.charAt(pos + 1) == '*') {
                        tokens.add(new Token(TokenType.POWER, "**", lineNumber, column));
                        pos += 2;
                    } else {
                        tokens.add(new Token(TokenType.ASTERISK, "*", lineNumber, column));
                        pos++;
                    }
                    continue;
                case '"':
                case '\'':
                    pos = readString(content, pos, lineNumber, column, tokens);
                    continue;
                default:
                    break;
            }

            if (isWordChar(c)) {
                pos = readWord(content, pos, lineNumber, column, tokens);
                continue;
            }

            throw new CompilationException(ILLEGAL_CHARACTER, lineNumber, column,
                    "Illegal character '" + c + "' at Line " + lineNumber + ", Column " + column);
        }
    }

    private int readString(String content, int start, int lineNumber, int column, List<Token> tokens)
            throws CompilationException {
        char quote = content.charAt(start);
        int end = content.indexOf(quote, start + 1);
        if (end < 0) {
            throw new CompilationException(ILLEGAL_CHARACTER, lineNumber, column,
                    "String literal not closed at Line " + lineNumber + ", Column " + column);
        }
        tokens.add(new Token(TokenType.LITERAL_STRING, content.substring(start + 1, end), lineNumber, column));
        return end + 1;
    }

    private int readWord(String content, int start, int lineNumber, int column, List<Token> tokens) {
        StringBuilder word = new StringBuilder();
        word.append(content.charAt(start));
        int pos = start + 1;

        while (pos < content.length()) {
            char c = content.charAt(pos);
            boolean decimalPoint = c == '.' && pos + 1 < content.length() && isDigit(content.charAt(pos + 1));
            if (isWordChar(c) || decimalPoint) {
                word.append(c);
                pos++;
            } else {
                break;
            }
        }

        String upper = word.toString().toUpperCase(Locale.ROOT);
        TokenType type;
        if (NUMBER.matcher(upper).matches()) {
            type = TokenType.LITERAL_NUMBER;
        } else {
            type = KEYWORDS.getOrDefault(upper, TokenType.IDENTIFIER);
        }
        tokens.add(new Token(type, upper, lineNumber, column));
        return pos;
    }

    // A sign belongs to a numeric literal only when it cannot be a binary operator.
    private static boolean startsSignedNumber(String content, int pos, List<Token> tokens, int lineNumber) {
        if (pos + 1 >= content.length() || !isDigit(content.charAt(pos + 1))) {
            return false;
        }
        if (pos > 0 && !Character.isWhitespace(content.charAt(pos - 1)) && content.charAt(pos - 1) != '(') {
            return false;
        }
        if (tokens.isEmpty()) {
            return true;
        }
        Token previous = tokens.get(tokens.size() - 1);
        if (previous.line != lineNumber) {
            return true;
        }
        switch (previous.type) {
            case IDENTIFIER:
            case LITERAL_NUMBER:
            case LITERAL_STRING:
            case RPAREN:
                return false;
            default:
                return true;
        }
    }

    private static boolean isWordChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || isDigit(c) || c == '-';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}

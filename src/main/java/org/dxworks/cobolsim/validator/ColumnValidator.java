package org.dxworks.cobolsim.validator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Fixed-format layout checks on raw source lines.
 *
 * <pre>
 *  cols 1-6   sequence area
 *  col  7     indicator: space, '*', '/', '-', 'D'
 *  cols 8-11  Area A: division/section headers, FD, level 01 and 77
 *  cols 12-72 Area B: statements, level 66 and 88
 *  cols 73+   ignored
 * </pre>
 */
public final class ColumnValidator {

    public static final String TEXT_BEYOND_COLUMN_72 = "IGYDS1085-I";
    public static final String INVALID_INDICATOR = "IGYDS1086-S";
    public static final String SUBORDINATE_LEVEL_IN_AREA_A = "IGYDS1087-S";
    public static final String STATEMENT_IN_AREA_A = "IGYDS1088-S";
    public static final String HEADER_NOT_IN_AREA_A = "IGYDS1089-S";

    private static final int INDICATOR_INDEX = 6;
    private static final int CONTENT_START = 7;
    private static final int AREA_B_START = 11;
    private static final int CONTENT_END = 72;

    private static final Set<String> AREA_B_VERBS = Set.of(
            "ACCEPT", "ADD", "CALL", "CLOSE", "COMPUTE", "CONTINUE", "DELETE",
            "DISPLAY", "DIVIDE", "EVALUATE", "EXEC", "EXIT", "GO", "GOBACK", "IF", "INITIALIZE",
            "INSPECT", "MERGE", "MOVE", "MULTIPLY", "OPEN", "PERFORM", "READ",
            "RELEASE", "RETURN", "REWRITE", "SEARCH", "SET", "SORT", "START",
            "STOP", "STRING", "SUBTRACT", "UNSTRING", "WRITE", "ELSE", "END-IF",
            "END-PERFORM", "END-READ", "END-EXEC", "THEN");

    private static final Set<String> AREA_A_LEVELS = Set.of("1", "01", "77");
    private static final Set<String> AREA_B_LEVELS = Set.of("66", "88");

    private ColumnValidator() {
    }

    public static List<Diagnostic> validate(String source) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        String[] lines = (source == null ? "" : source).split("\n", -1);

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].endsWith("\r") ? lines[i].substring(0, lines[i].length() - 1) : lines[i];
            int lineNumber = i + 1;
            if (line.isBlank() || line.length() <= INDICATOR_INDEX) {
                continue;
            }

            char indicator = line.charAt(INDICATOR_INDEX);
            if (indicator == '*' || indicator == '/') {
                continue;
            }
            if (indicator != ' ' && indicator != '-' && indicator != 'D' && indicator != 'd') {
                diagnostics.add(Diagnostic.error(lineNumber, INDICATOR_INDEX + 1, INVALID_INDICATOR,
                        "INVALID INDICATOR '" + indicator + "' IN COLUMN 7."));
                continue;
            }

            if (line.length() > CONTENT_END && !line.substring(CONTENT_END).isBlank()) {
                diagnostics.add(Diagnostic.info(lineNumber, CONTENT_END + 1, TEXT_BEYOND_COLUMN_72,
                        "TEXT IN COLUMNS 73 AND BEYOND IS IGNORED."));
            }

            // a continuation line carries the rest of a literal, so its placement is free
            if (indicator != '-') {
                checkAreas(line, lineNumber, diagnostics);
            }
        }
        return diagnostics;
    }

    private static void checkAreas(String line, int lineNumber, List<Diagnostic> diagnostics) {
        String content = line.substring(Math.min(CONTENT_START, line.length()), Math.min(line.length(), CONTENT_END));
        int offset = firstNonBlank(content);
        if (offset < 0) {
            return;
        }
        int index = CONTENT_START + offset;
        int column = index + 1;
        String[] words = content.substring(offset).trim().toUpperCase(Locale.ROOT).split("\\s+");
        String first = stripPeriod(words[0]);
        String second = words.length > 1 ? stripPeriod(words[1]) : "";

        boolean inAreaA = index < AREA_B_START;
        if (inAreaA) {
            if (AREA_B_VERBS.contains(first)) {
                diagnostics.add(Diagnostic.error(lineNumber, column, STATEMENT_IN_AREA_A,
                        "STATEMENT NOT ALLOWED IN AREA A. FOUND '" + first + "'."));
            } else if (AREA_B_LEVELS.contains(first)) {
                diagnostics.add(Diagnostic.error(lineNumber, column, SUBORDINATE_LEVEL_IN_AREA_A,
                        "LEVEL " + first + " ENTRY MUST BEGIN IN AREA B."));
            }
            return;
        }

        if (second.equals("DIVISION") || second.equals("SECTION")) {
            diagnostics.add(Diagnostic.error(lineNumber, column, HEADER_NOT_IN_AREA_A,
                    "'" + first + " " + second + "' HEADER MUST BEGIN IN AREA A."));
        } else if (first.equals("FD")) {
            diagnostics.add(Diagnostic.error(lineNumber, column, HEADER_NOT_IN_AREA_A,
                    "FD ENTRY MUST BEGIN IN AREA A."));
        } else if (AREA_A_LEVELS.contains(first)) {
            diagnostics.add(Diagnostic.error(lineNumber, column, HEADER_NOT_IN_AREA_A,
                    "LEVEL " + first + " ENTRY MUST BEGIN IN AREA A."));
        }
    }

    private static int firstNonBlank(String content) {
        for (int i = 0; i < content.length(); i++) {
            if (!Character.isWhitespace(content.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static String stripPeriod(String word) {
        return word.endsWith(".") ? word.substring(0, word.length() - 1) : word;
    }
}

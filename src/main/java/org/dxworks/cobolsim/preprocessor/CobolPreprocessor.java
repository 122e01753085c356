package org.dxworks.cobolsim.preprocessor;

import org.dxworks.cobolsim.CompilationError;
import org.dxworks.cobolsim.CompilationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands COPY statements against a {@link CopybookLibrary}.
 *
 * Each pass inlines every COPY it finds; the buffer is then re-scanned from the top because
 * inlined text may contain further COPY statements. Expansion stops with an error once the
 * pass limit is exceeded. A copybook missing from the library stops expansion immediately so
 * the caller can supply it and call {@link #process} again; nothing is cached between calls.
 */
public class CobolPreprocessor {

    private static final Logger log = LoggerFactory.getLogger(CobolPreprocessor.class);

    public static final int DEFAULT_MAX_PASSES = 100;

    public static final String NESTED_COPY_DEPTH = "IGYDS1090-S";
    public static final String DIVISION_IN_COPYBOOK = "IGYDS1091-S";
    public static final String CODE_BEYOND_COLUMN_72 = "IGYDS1092-S";

    public static final String BEGIN_MARKER = "      *++ BEGIN COPY ";
    public static final String END_MARKER = "      *++ END COPY ";

    private static final int INDICATOR_INDEX = 6;
    private static final int CONTENT_START = 7;
    private static final int CONTENT_END = 72;

    private static final Pattern COPY_KEYWORD = Pattern.compile("(?<![A-Z0-9-])COPY(?=\\s)");
    private static final Pattern COPY_STATEMENT = Pattern.compile(
            "^COPY\\s+(\"[^\"]+\"|'[^']+'|[A-Z0-9-]+)(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern REPLACING_PAIR = Pattern.compile(
            "(==|'|\")(.+?)\\1\\s+BY\\s+(==|'|\")(.*?)\\3", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIVISION_HEADER = Pattern.compile(
            "\\b(IDENTIFICATION|ID|ENVIRONMENT|DATA|PROCEDURE)\\s+DIVISION\\b");

    private final int maxPasses;

    public CobolPreprocessor() {
        this(DEFAULT_MAX_PASSES);
    }

    public CobolPreprocessor(int maxPasses) {
        this.maxPasses = maxPasses > 0 ? maxPasses : DEFAULT_MAX_PASSES;
    }

    public PreprocessorResult process(String source, CopybookLibrary library) {
        List<String> lines = splitLines(source == null ? "" : source);

        for (int pass = 1; ; pass++) {
            if (pass > maxPasses) {
                log.debug("Copy expansion exceeded {} passes", maxPasses);
                return PreprocessorResult.failed(String.join("\n", lines),
                        new CompilationError(NESTED_COPY_DEPTH, 0, 0, "COMPILER LIMIT EXCEEDED: NESTED COPY DEPTH."));
            }

            List<String> expanded = new ArrayList<>();
            boolean changed = false;

            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                int copyIndex = findCopyKeyword(line);
                if (copyIndex < 0) {
                    expanded.add(line);
                    continue;
                }

                Matcher statement = COPY_STATEMENT.matcher(line.substring(copyIndex, contentEnd(line)));
                if (!statement.matches()) {
                    expanded.add(line);
                    continue;
                }

                String bookName = CopybookLibrary.normalizeName(statement.group(1));
                int lineNumber = i + 1;
                int column = copyIndex + 1;

                if (!library.contains(bookName)) {
                    log.debug("Copybook {} missing at {}:{}", bookName, lineNumber, column);
                    return PreprocessorResult.missing(String.join("\n", lines),
                            new MissingCopy(bookName, lineNumber, column));
                }

                List<String> bookLines;
                try {
                    bookLines = prepareCopybook(bookName, library.lookup(bookName).orElse(""),
                            statement.group(2), lineNumber, column);
                } catch (CompilationException e) {
                    return PreprocessorResult.failed(String.join("\n", lines), e.error);
                }

                String prefix = line.substring(0, copyIndex);
                if (prefix.length() > CONTENT_START && !prefix.substring(CONTENT_START).isBlank()) {
                    expanded.add(prefix);
                }
                expanded.add(BEGIN_MARKER + bookName);
                expanded.addAll(bookLines);
                expanded.add(END_MARKER + bookName);
                changed = true;
            }

            lines = expanded;
            if (!changed) {
                log.debug("Copy expansion finished after {} pass(es)", pass);
                return PreprocessorResult.expanded(String.join("\n", lines));
            }
        }
    }

    // Index of the COPY keyword within the line, or -1 when the line holds no COPY statement.
    private static int findCopyKeyword(String line) {
        if (line.length() <= CONTENT_START) {
            return -1;
        }
        char indicator = line.charAt(INDICATOR_INDEX);
        if (indicator == '*' || indicator == '/') {
            return -1;
        }

        String upper = line.substring(0, contentEnd(line)).toUpperCase(Locale.ROOT);
        Matcher m = COPY_KEYWORD.matcher(upper);
        while (m.find()) {
            if (m.start() < CONTENT_START) {
                continue;
            }
            if (countQuotes(upper, CONTENT_START, m.start()) % 2 == 0) {
                return m.start();
            }
        }
        return -1;
    }

    private static int countQuotes(String text, int from, int to) {
        int count = 0;
        for (int i = from; i < to; i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                count++;
            }
        }
        return count;
    }

    private static List<String> prepareCopybook(String bookName, String content, String remainder,
                                                int copyLine, int copyColumn) throws CompilationException {
        List<String> bookLines = splitLines(content);
        validateCopybook(bookName, bookLines, copyLine, copyColumn);

        List<String[]> replacements = new ArrayList<>();
        if (remainder != null && remainder.toUpperCase(Locale.ROOT).contains("REPLACING")) {
            Matcher m = REPLACING_PAIR.matcher(remainder);
            while (m.find()) {
                replacements.add(new String[]{m.group(2), m.group(4)});
            }
        }

        List<String> processed = new ArrayList<>(bookLines.size());
        for (String bookLine : bookLines) {
            String replaced = bookLine;
            for (String[] pair : replacements) {
                replaced = Pattern.compile(Pattern.quote(pair[0]), Pattern.CASE_INSENSITIVE)
                        .matcher(replaced)
                        .replaceAll(Matcher.quoteReplacement(pair[1]));
            }
            processed.add(replaced);
        }
        return processed;
    }

    private static void validateCopybook(String bookName, List<String> bookLines, int copyLine, int copyColumn)
            throws CompilationException {
        for (int i = 0; i < bookLines.size(); i++) {
            String bookLine = bookLines.get(i);
            if (bookLine.length() > INDICATOR_INDEX) {
                char indicator = bookLine.charAt(INDICATOR_INDEX);
                if (indicator == '*' || indicator == '/') {
                    continue;
                }
            }
            if (bookLine.length() > CONTENT_START) {
                String content = bookLine.substring(CONTENT_START, contentEnd(bookLine)).toUpperCase(Locale.ROOT);
                if (DIVISION_HEADER.matcher(content).find()) {
                    throw new CompilationException(DIVISION_IN_COPYBOOK, copyLine, copyColumn,
                            "COPYBOOK '" + bookName + "' LINE " + (i + 1) + " CONTAINS A DIVISION HEADER.");
                }
            }
            if (bookLine.length() > CONTENT_END && !bookLine.substring(CONTENT_END).isBlank()) {
                throw new CompilationException(CODE_BEYOND_COLUMN_72, copyLine, copyColumn,
                        "COPYBOOK '" + bookName + "' LINE " + (i + 1) + " CONTAINS CODE BEYOND COLUMN 72.");
            }
        }
    }

    private static int contentEnd(String line) {
        return Math.min(line.length(), CONTENT_END);
    }

    private static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        return lines;
    }
}

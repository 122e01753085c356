package org.dxworks.cobolsim.parser;

import org.dxworks.cobolsim.CompilationException;
import org.dxworks.cobolsim.lexer.Lexer;
import org.dxworks.cobolsim.lexer.Token;
import org.dxworks.cobolsim.lexer.TokenType;
import org.dxworks.cobolsim.model.*;
import org.dxworks.cobolsim.model.expression.*;
import org.dxworks.cobolsim.model.statement.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Recursive-descent parser with one token of lookahead.
 *
 * <p>Statement bodies of IF, PERFORM and READ ... AT END end at the first scope terminator or
 * at a period. A period closes every scope that is open at that point; once it has been seen,
 * no enclosing construct goes on parsing an ELSE branch or expects its own terminator.
 *
 * <p>Any syntax error stops parsing; there is no recovery.
 */
public class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    public static final String SYNTAX_ERROR = "IGYPS2120-S";
    public static final String ELSE_WITHOUT_IF = "IGYPS2078-S";
    public static final String END_IF_WITHOUT_IF = "IGYPS2079-S";
    public static final String END_PERFORM_WITHOUT_PERFORM = "IGYPS2081-S";
    public static final String END_READ_WITHOUT_READ = "IGYPS2082-S";

    private final List<Token> tokens;
    private int current;

    private final Map<String, ConditionName> conditionNames = new LinkedHashMap<>();

    private int ifDepth;
    private int performDepth;
    private int readDepth;
    private boolean sentenceClosed;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Lexes and parses {@code source}, converting the first fatal failure into an error value.
     */
    public static CompileResult parse(String source) {
        try {
            List<Token> tokens = new Lexer(source).tokenize();
            return CompileResult.ofProgram(new Parser(tokens).parseProgram());
        } catch (CompilationException e) {
            log.debug("Compilation stopped: {}", e.error.format());
            return CompileResult.ofError(e.error);
        }
    }

    public Program parseProgram() throws CompilationException {
        Token start = expect(TokenType.IDENTIFICATION, "Division Header");
        expect(TokenType.DIVISION, "Division Header");
        expect(TokenType.DOT, "End of statement");
        expect(TokenType.PROGRAM_ID, "Program-ID Paragraph");
        expect(TokenType.DOT, "End of statement");
        String programId = parseProgramName();
        match(TokenType.DOT);

        // AUTHOR., DATE-WRITTEN. and the like carry no semantics
        while (!check(TokenType.ENVIRONMENT) && !check(TokenType.DATA) && !check(TokenType.PROCEDURE) && !isAtEnd()) {
            advance();
        }

        List<FileControlEntry> fileControl = new ArrayList<>();
        if (match(TokenType.ENVIRONMENT)) {
            expect(TokenType.DIVISION, "Division Header");
            expect(TokenType.DOT, "End of statement");
            parseEnvironmentDivision(fileControl);
        }

        DataDivision dataDivision = check(TokenType.DATA)
                ? parseDataDivision()
                : new DataDivision(List.of(), List.of(), List.of(), List.of(), List.of());

        ProcedureDivision procedureDivision = parseProcedureDivision();

        log.debug("Parsed program {} with {} top-level statements", programId, procedureDivision.statements.size());
        return new Program(programId, fileControl, dataDivision, procedureDivision,
                new SourceSpan(start.line, start.column, previous().line));
    }

    private String parseProgramName() throws CompilationException {
        if (check(TokenType.IDENTIFIER) || check(TokenType.LITERAL_STRING)) {
            return advance().value;
        }
        throw error(peek(), "Expected Program Name");
    }

    // --- Environment Division ---

    private void parseEnvironmentDivision(List<FileControlEntry> fileControl) throws CompilationException {
        while (!check(TokenType.DATA) && !check(TokenType.PROCEDURE) && !isAtEnd()) {
            if (match(TokenType.INPUT_OUTPUT)) {
                expect(TokenType.SECTION, "Section Header");
                expect(TokenType.DOT, "End of statement");
            } else if (match(TokenType.FILE_CONTROL)) {
                expect(TokenType.DOT, "End of statement");
                while (check(TokenType.SELECT)) {
                    fileControl.add(parseSelect());
                }
            } else {
                // CONFIGURATION SECTION paragraphs are not interpreted
                advance();
            }
        }
    }

    private FileControlEntry parseSelect() throws CompilationException {
        Token select = expect(TokenType.SELECT, "SELECT clause");
        String fileName = expect(TokenType.IDENTIFIER, "File Name").value;
        expect(TokenType.ASSIGN, "ASSIGN clause");
        match(TokenType.TO);
        String external;
        if (check(TokenType.IDENTIFIER) || check(TokenType.LITERAL_STRING)) {
            external = advance().value;
        } else {
            throw error(peek(), "Expected dataset name after ASSIGN");
        }

        FileOrganization organization = FileOrganization.SEQUENTIAL;
        AccessMode accessMode = AccessMode.SEQUENTIAL;
        String recordKey = null;

        while (!check(TokenType.DOT) && !isAtEnd()) {
            if (match(TokenType.ORGANIZATION)) {
                match(TokenType.IS);
                if (match(TokenType.INDEXED)) {
                    organization = FileOrganization.INDEXED;
                } else {
                    expect(TokenType.SEQUENTIAL, "File Organization");
                    organization = FileOrganization.SEQUENTIAL;
                }
            } else if (match(TokenType.ACCESS)) {
                match(TokenType.MODE);
                match(TokenType.IS);
                if (match(TokenType.RANDOM)) {
                    accessMode = AccessMode.RANDOM;
                } else if (match(TokenType.DYNAMIC)) {
                    accessMode = AccessMode.DYNAMIC;
                } else {
                    expect(TokenType.SEQUENTIAL, "Access Mode");
                    accessMode = AccessMode.SEQUENTIAL;
                }
            } else if (match(TokenType.RECORD)) {
                match(TokenType.KEY);
                match(TokenType.IS);
                recordKey = expect(TokenType.IDENTIFIER, "Record Key").value;
            } else {
                throw error(peek(), "Unexpected clause in SELECT");
            }
        }
        expect(TokenType.DOT, "End of SELECT clause");
        return new FileControlEntry(fileName, external, organization, accessMode, recordKey, select.line);
    }

    // --- Data Division ---

    private DataDivision parseDataDivision() throws CompilationException {
        expect(TokenType.DATA, "Division Header");
        expect(TokenType.DIVISION, "Division Header");
        expect(TokenType.DOT, "End of statement");

        List<FileDescription> fileSection = new ArrayList<>();
        List<VariableDeclaration> workingStorage = new ArrayList<>();
        List<VariableDeclaration> linkage = new ArrayList<>();
        List<MapDefinition> maps = new ArrayList<>();

        while (true) {
            if (match(TokenType.FILE)) {
                sectionHeader();
                while (check(TokenType.FD)) {
                    fileSection.add(parseFileDescription());
                }
            } else if (match(TokenType.WORKING_STORAGE)) {
                sectionHeader();
                parseDeclarations(DataSection.WORKING_STORAGE, workingStorage);
            } else if (match(TokenType.LINKAGE)) {
                sectionHeader();
                parseDeclarations(DataSection.LINKAGE, linkage);
            } else if (check(TokenType.MAP) && peekAhead(1).is(TokenType.SECTION)) {
                advance();
                sectionHeader();
                while (check(TokenType.MAP)) {
                    maps.add(parseMapDefinition());
                }
            } else {
                break;
            }
        }

        if (!check(TokenType.PROCEDURE)) {
            throw error(peek(), "Expected Section Header or PROCEDURE DIVISION");
        }
        return new DataDivision(fileSection, workingStorage, linkage, maps, new ArrayList<>(conditionNames.values()));
    }

    private void sectionHeader() throws CompilationException {
        expect(TokenType.SECTION, "Section Header");
        expect(TokenType.DOT, "End of statement");
    }

    private FileDescription parseFileDescription() throws CompilationException {
        Token fd = expect(TokenType.FD, "FD entry");
        String fileName = expect(TokenType.IDENTIFIER, "File Name").value;
        // LABEL RECORDS, BLOCK CONTAINS and similar clauses are accepted and ignored
        while (!check(TokenType.DOT) && !isAtEnd()) {
            advance();
        }
        expect(TokenType.DOT, "End of FD entry");
        List<VariableDeclaration> records = new ArrayList<>();
        parseDeclarations(DataSection.FILE, records);
        return new FileDescription(fileName, records, fd.line);
    }

    private void parseDeclarations(DataSection section, List<VariableDeclaration> into) throws CompilationException {
        while (check(TokenType.LITERAL_NUMBER)) {
            Token levelToken = advance();
            int level = parseLevel(levelToken);
            Token nameToken = expect(TokenType.IDENTIFIER, "Variable Name");

            if (level == 88) {
                parseConditionName(nameToken, into);
                continue;
            }

            expect(TokenType.PIC, "PIC Clause");
            StringBuilder picture = new StringBuilder();
            while (!check(TokenType.VALUE) && !check(TokenType.DOT) && !isAtEnd()) {
                picture.append(advance().value);
            }
            PictureInfo pic = PictureInfo.parse(picture.toString());
            if (pic == null) {
                throw error(nameToken, "Invalid PICTURE string '" + picture + "'");
            }

            Operand initialValue = null;
            if (match(TokenType.VALUE)) {
                match(TokenType.IS);
                initialValue = parseValueLiteral();
            }
            expect(TokenType.DOT, "End of variable declaration");

            into.add(new VariableDeclaration(level, nameToken.value, pic.type, pic.length, picture.toString(),
                    initialValue, section, levelToken.line, levelToken.column));
        }
    }

    private void parseConditionName(Token nameToken, List<VariableDeclaration> declared) throws CompilationException {
        if (declared.isEmpty()) {
            throw error(nameToken, "Level 88 entry '" + nameToken.value + "' has no preceding data item");
        }
        expect(TokenType.VALUE, "VALUE clause of condition name");
        match(TokenType.IS);
        Operand value = parseValueLiteral();
        expect(TokenType.DOT, "End of condition name");
        String parent = declared.get(declared.size() - 1).name;
        conditionNames.put(nameToken.value,
                new ConditionName(nameToken.value, parent, value, nameToken.line, nameToken.column));
    }

    private int parseLevel(Token levelToken) throws CompilationException {
        if (levelToken.value.matches("[0-9]{1,2}")) {
            int level = Integer.parseInt(levelToken.value);
            if (level >= 1 && level <= 88) {
                return level;
            }
        }
        throw error(levelToken, "Invalid level number");
    }

    private Operand parseValueLiteral() throws CompilationException {
        if (check(TokenType.LITERAL_STRING)) {
            return new StringLiteral(advance().value);
        }
        if (check(TokenType.LITERAL_NUMBER)) {
            return NumericLiteral.parse(advance().value);
        }
        if (match(TokenType.ZERO)) {
            return new Figurative(FigurativeConstant.ZERO);
        }
        if (match(TokenType.SPACE)) {
            return new Figurative(FigurativeConstant.SPACE);
        }
        throw error(peek(), "Expected Literal, ZERO, or SPACE after VALUE");
    }

    private MapDefinition parseMapDefinition() throws CompilationException {
        Token map = expect(TokenType.MAP, "Map Definition");
        String mapName = expectWord("Map Name");
        expectContextual("MAPSET");
        String mapset = expectWord("Mapset Name");
        expect(TokenType.DOT, "End of map header");

        List<MapField> fields = new ArrayList<>();
        while (checkContextual("FIELD")) {
            Token field = advance();
            String name = expect(TokenType.IDENTIFIER, "Field Name").value;
            expectContextual("LINE");
            int row = expectInteger("Field Line");
            expectContextual("COLUMN");
            int column = expectInteger("Field Column");
            expectContextual("LENGTH");
            int length = expectInteger("Field Length");
            String initial = null;
            if (checkContextual("INITIAL")) {
                advance();
                initial = expect(TokenType.LITERAL_STRING, "Initial Text").value;
            }
            expect(TokenType.DOT, "End of field definition");
            fields.add(new MapField(name, row, column, length, initial, SourceSpan.at(field.line, field.column)));
        }
        return new MapDefinition(mapName, mapset, fields, map.line);
    }

    // --- Procedure Division ---

    private ProcedureDivision parseProcedureDivision() throws CompilationException {
        Token start = expect(TokenType.PROCEDURE, "Division Header");
        expect(TokenType.DIVISION, "Division Header");
        List<String> using = new ArrayList<>();
        if (match(TokenType.USING)) {
            do {
                using.add(expect(TokenType.IDENTIFIER, "USING parameter").value);
            } while (check(TokenType.IDENTIFIER));
        }
        expect(TokenType.DOT, "End of statement");

        List<Statement> statements = new ArrayList<>();
        while (!isAtEnd()) {
            sentenceClosed = false;
            if (match(TokenType.DOT)) {
                continue;
            }
            if (isParagraphHeader()) {
                skipParagraphHeader();
                continue;
            }
            if (peek().type.isScopeTerminator()) {
                throw strayTerminator(peek());
            }
            statements.add(parseStatement());
        }
        return new ProcedureDivision(using, statements, new SourceSpan(start.line, start.column, previous().line));
    }

    // Paragraph and section names act as fall-through labels.
    private boolean isParagraphHeader() {
        if (!check(TokenType.IDENTIFIER)) {
            return false;
        }
        TokenType next = peekAhead(1).type;
        return next == TokenType.DOT || (next == TokenType.SECTION && peekAhead(2).is(TokenType.DOT));
    }

    private void skipParagraphHeader() {
        advance();
        match(TokenType.SECTION);
        advance();
    }

    /**
     * Statements up to a scope terminator, the end of input, or a period. A period is consumed
     * and marks the sentence as closed for every enclosing scope.
     */
    private List<Statement> parseBody() throws CompilationException {
        List<Statement> body = new ArrayList<>();
        while (!sentenceClosed && !isAtEnd()) {
            if (match(TokenType.DOT)) {
                sentenceClosed = true;
                break;
            }
            Token next = peek();
            if (next.type.isScopeTerminator()) {
                if (!hasOwner(next.type)) {
                    throw strayTerminator(next);
                }
                break;
            }
            body.add(parseStatement());
        }
        return body;
    }

    private boolean hasOwner(TokenType terminator) {
        switch (terminator) {
            case ELSE:
            case END_IF:
                return ifDepth > 0;
            case END_PERFORM:
                return performDepth > 0;
            case END_READ:
                return readDepth > 0;
            default:
                return false;
        }
    }

    private CompilationException strayTerminator(Token token) {
        switch (token.type) {
            case ELSE:
                return positioned(ELSE_WITHOUT_IF, token, "ELSE without matching IF");
            case END_IF:
                return positioned(END_IF_WITHOUT_IF, token, "END-IF without matching IF");
            case END_PERFORM:
                return positioned(END_PERFORM_WITHOUT_PERFORM, token, "END-PERFORM without matching PERFORM");
            case END_READ:
                return positioned(END_READ_WITHOUT_READ, token, "END-READ without matching READ");
            default:
                return error(token, "Unexpected scope terminator");
        }
    }

    private Statement parseStatement() throws CompilationException {
        Token start = peek();
        switch (start.type) {
            case MOVE:
                advance();
                return parseMove(start);
            case ADD:
                advance();
                return parseArithmetic(start, ArithmeticVerb.ADD, TokenType.TO);
            case SUBTRACT:
                advance();
                return parseArithmetic(start, ArithmeticVerb.SUBTRACT, TokenType.FROM);
            case MULTIPLY:
                advance();
                return parseArithmetic(start, ArithmeticVerb.MULTIPLY, TokenType.BY);
            case DIVIDE:
                advance();
                return parseDivide(start);
            case COMPUTE:
                advance();
                return parseCompute(start);
            case IF:
                advance();
                return parseIf(start);
            case PERFORM:
                advance();
                return parsePerform(start);
            case DISPLAY:
                advance();
                return parseDisplay(start);
            case ACCEPT:
                advance();
                return new AcceptStatement(parseVariableRef("Target Identifier"), span(start));
            case CALL:
                advance();
                return parseCall(start);
            case EXIT:
                advance();
                expect(TokenType.PROGRAM, "PROGRAM after EXIT");
                return new ExitProgramStatement(span(start));
            case GOBACK:
                advance();
                return new GobackStatement(span(start));
            case STOP:
                advance();
                expect(TokenType.RUN, "RUN after STOP");
                return new StopRunStatement(span(start));
            case OPEN:
                advance();
                return parseOpen(start);
            case CLOSE:
                advance();
                return parseClose(start);
            case READ:
                advance();
                return parseRead(start);
            case WRITE:
                advance();
                return parseWrite(start);
            case EXEC:
                advance();
                return parseExecCics(start);
            default:
                throw error(start, "Unexpected token or unknown statement");
        }
    }

    private Statement parseMove(Token start) throws CompilationException {
        Operand source = parseOperand();
        expect(TokenType.TO, "Keyword TO");
        VariableRef target = parseVariableRef("Target Identifier");
        return new MoveStatement(source, target, span(start));
    }

    private Statement parseArithmetic(Token start, ArithmeticVerb verb, TokenType preposition) throws CompilationException {
        Operand value = parseOperand();
        expect(preposition, "Keyword " + preposition.name());
        Operand target = parseOperand();
        VariableRef giving = parseGiving();
        if (giving == null && !(target instanceof VariableRef)) {
            throw error(previous(), "Expected Target Identifier");
        }
        return new ArithmeticStatement(verb, value, target, giving, span(start));
    }

    private Statement parseDivide(Token start) throws CompilationException {
        Operand value = parseOperand();
        if (match(TokenType.INTO)) {
            Operand target = parseOperand();
            VariableRef giving = parseGiving();
            if (giving == null && !(target instanceof VariableRef)) {
                throw error(previous(), "Expected Target Identifier");
            }
            return new ArithmeticStatement(ArithmeticVerb.DIVIDE_INTO, value, target, giving, span(start));
        }
        expect(TokenType.BY, "Keyword INTO or BY");
        Operand divisor = parseOperand();
        VariableRef giving = parseGiving();
        if (giving == null) {
            throw error(peek(), "Expected Keyword GIVING (DIVIDE BY requires GIVING)");
        }
        return new ArithmeticStatement(ArithmeticVerb.DIVIDE_BY, value, divisor, giving, span(start));
    }

    private VariableRef parseGiving() throws CompilationException {
        if (match(TokenType.GIVING)) {
            return parseVariableRef("GIVING Identifier");
        }
        return null;
    }

    private Statement parseCompute(Token start) throws CompilationException {
        VariableRef target = parseVariableRef("Target Identifier");
        expect(TokenType.EQUALS, "=");
        Expression expression = parseExpression();
        return new ComputeStatement(target, expression, span(start));
    }

    private Expression parseExpression() throws CompilationException {
        Expression left = parseTerm();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            ArithmeticOperator operator = advance().is(TokenType.PLUS) ? ArithmeticOperator.ADD : ArithmeticOperator.SUBTRACT;
            left = new Expression.Binary(operator, left, parseTerm());
        }
        return left;
    }

    private Expression parseTerm() throws CompilationException {
        Expression left = parseFactor();
        while (check(TokenType.ASTERISK) || check(TokenType.SLASH)) {
            ArithmeticOperator operator = advance().is(TokenType.ASTERISK) ? ArithmeticOperator.MULTIPLY : ArithmeticOperator.DIVIDE;
            left = new Expression.Binary(operator, left, parseFactor());
        }
        return left;
    }

    private Expression parseFactor() throws CompilationException {
        Expression left = parseUnary();
        while (match(TokenType.POWER)) {
            left = new Expression.Binary(ArithmeticOperator.POWER, left, parseUnary());
        }
        return left;
    }

    private Expression parseUnary() throws CompilationException {
        if (match(TokenType.MINUS)) {
            return new Expression.Unary(parseUnary());
        }
        if (match(TokenType.PLUS)) {
            return parseUnary();
        }
        return parsePrimary();
    }

    private Expression parsePrimary() throws CompilationException {
        if (check(TokenType.LITERAL_NUMBER)) {
            return new Expression.Literal(NumericLiteral.parse(advance().value));
        }
        if (check(TokenType.IDENTIFIER)) {
            return new Expression.Variable(parseVariableRef("Identifier"));
        }
        if (match(TokenType.LPAREN)) {
            Expression inner = parseExpression();
            expect(TokenType.RPAREN, ")");
            return inner;
        }
        throw error(peek(), "Expected Expression (Number, Identifier, or '(')");
    }

    private Statement parseIf(Token start) throws CompilationException {
        Condition condition = parseCondition();
        match(TokenType.THEN);

        ifDepth++;
        List<Statement> thenBody = parseBody();
        List<Statement> elseBody = List.of();
        if (!sentenceClosed && match(TokenType.ELSE)) {
            elseBody = parseBody();
        }
        if (!sentenceClosed) {
            // Without END-IF the IF is closed by the terminator of an enclosing scope.
            match(TokenType.END_IF);
        }
        ifDepth--;
        return new IfStatement(condition, thenBody, elseBody, span(start));
    }

    private Statement parsePerform(Token start) throws CompilationException {
        Condition until = null;
        Operand times = null;
        if (match(TokenType.UNTIL)) {
            until = parseCondition();
        } else if ((check(TokenType.LITERAL_NUMBER) || check(TokenType.IDENTIFIER)) && peekAhead(1).is(TokenType.TIMES)) {
            times = parseOperand();
            advance();
        } else if (check(TokenType.IDENTIFIER)) {
            throw error(peek(), "Out-of-line PERFORM of a paragraph is not supported");
        }

        performDepth++;
        List<Statement> body = parseBody();
        if (!sentenceClosed) {
            expect(TokenType.END_PERFORM, "Keyword END-PERFORM");
        }
        performDepth--;
        return new PerformStatement(until, times, body, span(start));
    }

    private Condition parseCondition() throws CompilationException {
        boolean outerNot = match(TokenType.NOT);

        if (check(TokenType.IDENTIFIER) && conditionNames.containsKey(peek().value) && !startsRelation(peekAhead(1))) {
            Token nameToken = advance();
            ConditionName conditionName = conditionNames.get(nameToken.value);
            VariableRef parent = new VariableRef(conditionName.parent, nameToken.line, nameToken.column);
            return new Condition(parent, RelationalOperator.EQUAL, conditionName.value, outerNot);
        }

        Operand left = parseOperand();
        match(TokenType.IS);
        boolean negated = match(TokenType.NOT);

        RelationalOperator operator;
        if (match(TokenType.EQUALS)) {
            operator = RelationalOperator.EQUAL;
        } else if (match(TokenType.GREATER)) {
            operator = RelationalOperator.GREATER;
            if (match(TokenType.EQUALS)) {
                // a >= b is NOT a < b
                operator = RelationalOperator.LESS;
                negated = !negated;
            }
        } else if (match(TokenType.LESS)) {
            operator = RelationalOperator.LESS;
            if (match(TokenType.EQUALS)) {
                operator = RelationalOperator.GREATER;
                negated = !negated;
            }
        } else {
            throw error(peek(), "Expected Logical Operator (=, >, <)");
        }

        Operand right = parseOperand();
        return new Condition(left, operator, right, negated != outerNot);
    }

    private static boolean startsRelation(Token token) {
        switch (token.type) {
            case EQUALS:
            case GREATER:
            case LESS:
            case IS:
                return true;
            default:
                return false;
        }
    }

    private Statement parseDisplay(Token start) throws CompilationException {
        List<Operand> values = new ArrayList<>();
        while (startsOperand(peek())) {
            values.add(parseOperand());
        }
        return new DisplayStatement(values, span(start));
    }

    private Statement parseCall(Token start) throws CompilationException {
        Operand program;
        if (check(TokenType.LITERAL_STRING)) {
            program = new StringLiteral(advance().value);
        } else if (check(TokenType.IDENTIFIER)) {
            program = parseVariableRef("Program Name");
        } else {
            throw error(peek(), "Expected Program Name");
        }

        List<VariableRef> using = new ArrayList<>();
        if (match(TokenType.USING)) {
            if (match(TokenType.BY)) {
                expectContextual("REFERENCE");
            }
            do {
                using.add(parseVariableRef("USING argument"));
            } while (check(TokenType.IDENTIFIER));
        }
        return new CallStatement(program, using, span(start));
    }

    private Statement parseOpen(Token start) throws CompilationException {
        List<OpenStatement.Target> targets = new ArrayList<>();
        do {
            OpenMode mode = parseOpenMode();
            do {
                targets.add(new OpenStatement.Target(mode, expect(TokenType.IDENTIFIER, "File Name").value));
            } while (check(TokenType.IDENTIFIER));
        } while (check(TokenType.INPUT) || check(TokenType.OUTPUT) || check(TokenType.I_O) || check(TokenType.EXTEND));
        return new OpenStatement(targets, span(start));
    }

    private OpenMode parseOpenMode() throws CompilationException {
        if (match(TokenType.INPUT)) {
            return OpenMode.INPUT;
        }
        if (match(TokenType.OUTPUT)) {
            return OpenMode.OUTPUT;
        }
        if (match(TokenType.I_O)) {
            return OpenMode.I_O;
        }
        if (match(TokenType.EXTEND)) {
            return OpenMode.EXTEND;
        }
        throw error(peek(), "Expected open mode (INPUT, OUTPUT, I-O, EXTEND)");
    }

    private Statement parseClose(Token start) throws CompilationException {
        List<String> files = new ArrayList<>();
        do {
            files.add(expect(TokenType.IDENTIFIER, "File Name").value);
        } while (check(TokenType.IDENTIFIER));
        return new CloseStatement(files, span(start));
    }

    private Statement parseRead(Token start) throws CompilationException {
        String fileName = expect(TokenType.IDENTIFIER, "File Name").value;
        VariableRef into = null;
        if (match(TokenType.INTO)) {
            into = parseVariableRef("INTO Identifier");
        }

        readDepth++;
        boolean hasAtEnd = false;
        List<Statement> atEnd = List.of();
        if (check(TokenType.AT) || check(TokenType.END)) {
            match(TokenType.AT);
            expect(TokenType.END, "Keyword END");
            hasAtEnd = true;
            atEnd = parseBody();
        }
        if (!sentenceClosed) {
            match(TokenType.END_READ);
        }
        readDepth--;
        return new ReadStatement(fileName, into, hasAtEnd, atEnd, span(start));
    }

    private Statement parseWrite(Token start) throws CompilationException {
        String record = expect(TokenType.IDENTIFIER, "Record Name").value;
        Operand from = null;
        if (match(TokenType.FROM)) {
            from = parseOperand();
        }
        return new WriteStatement(record, from, span(start));
    }

    private Statement parseExecCics(Token start) throws CompilationException {
        expect(TokenType.CICS, "Keyword CICS");
        CicsCommand command = parseCicsCommand();

        Map<String, Operand> params = new LinkedHashMap<>();
        while (!check(TokenType.END_EXEC) && !isAtEnd()) {
            Token keyword = advance();
            if (!isWord(keyword)) {
                throw error(keyword, "Expected CICS option");
            }
            Operand value = null;
            if (match(TokenType.LPAREN)) {
                value = parseOperand();
                expect(TokenType.RPAREN, ")");
            }
            params.put(keyword.value, value);
        }
        expect(TokenType.END_EXEC, "Keyword END-EXEC");
        return new ExecCicsStatement(command, params, span(start));
    }

    private CicsCommand parseCicsCommand() throws CompilationException {
        Token verb = advance();
        switch (verb.value) {
            case "SEND":
            case "RECEIVE":
                // MAP stays in the stream as the first option
                if (!check(TokenType.MAP)) {
                    throw error(peek(), "Expected MAP after " + verb.value);
                }
                return verb.value.equals("SEND") ? CicsCommand.SEND_MAP : CicsCommand.RECEIVE_MAP;
            case "READ":
                return CicsCommand.READ;
            case "WRITE":
                return CicsCommand.WRITE;
            case "REWRITE":
                return CicsCommand.REWRITE;
            case "DELETE":
                return CicsCommand.DELETE;
            case "RETURN":
                return CicsCommand.RETURN;
            case "LINK":
                return CicsCommand.LINK;
            case "HANDLE":
                expectContextual("CONDITION");
                return CicsCommand.HANDLE_CONDITION;
            default:
                throw error(verb, "Unsupported CICS command");
        }
    }

    // --- Operands ---

    private static boolean startsOperand(Token token) {
        switch (token.type) {
            case LITERAL_NUMBER:
            case LITERAL_STRING:
            case IDENTIFIER:
            case ZERO:
            case SPACE:
                return true;
            default:
                return false;
        }
    }

    private Operand parseOperand() throws CompilationException {
        if (check(TokenType.LITERAL_NUMBER)) {
            return NumericLiteral.parse(advance().value);
        }
        if (check(TokenType.LITERAL_STRING)) {
            return new StringLiteral(advance().value);
        }
        if (match(TokenType.ZERO)) {
            return new Figurative(FigurativeConstant.ZERO);
        }
        if (match(TokenType.SPACE)) {
            return new Figurative(FigurativeConstant.SPACE);
        }
        if (check(TokenType.IDENTIFIER)) {
            return parseVariableRef("Identifier");
        }
        throw error(peek(), "Expected Value (Literal or Identifier)");
    }

    private VariableRef parseVariableRef(String what) throws CompilationException {
        Token name = expect(TokenType.IDENTIFIER, what);
        ReferenceModification refMod = null;
        if (check(TokenType.LPAREN) && peekAhead(1).is(TokenType.LITERAL_NUMBER) && peekAhead(2).is(TokenType.COLON)) {
            advance();
            int start = expectInteger("Reference modification start");
            expect(TokenType.COLON, ":");
            int length = expectInteger("Reference modification length");
            expect(TokenType.RPAREN, ")");
            if (start < 1 || length < 1) {
                throw error(name, "Reference modification must use positive start and length");
            }
            refMod = new ReferenceModification(start, length);
        }
        return new VariableRef(name.value, refMod, name.line, name.column);
    }

    // --- Token helpers ---

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAhead(int offset) {
        int index = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    private boolean isAtEnd() {
        return peek().is(TokenType.EOF);
    }

    private boolean check(TokenType type) {
        return peek().is(type);
    }

    private Token advance() {
        if (!isAtEnd()) {
            current++;
        }
        return previous();
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type, String what) throws CompilationException {
        if (check(type)) {
            return advance();
        }
        throw error(peek(), "Expected " + type.name().replace('_', '-') + " (" + what + ")");
    }

    private boolean checkContextual(String word) {
        return check(TokenType.IDENTIFIER) && peek().value.equals(word);
    }

    private void expectContextual(String word) throws CompilationException {
        if (!checkContextual(word)) {
            throw error(peek(), "Expected " + word);
        }
        advance();
    }

    private String expectWord(String what) throws CompilationException {
        if (check(TokenType.IDENTIFIER) || check(TokenType.LITERAL_STRING)) {
            return advance().value;
        }
        throw error(peek(), "Expected " + what);
    }

    private int expectInteger(String what) throws CompilationException {
        Token token = expect(TokenType.LITERAL_NUMBER, what);
        if (!token.value.matches("[0-9]{1,9}")) {
            throw error(token, "Expected an unsigned integer (" + what + ")");
        }
        return Integer.parseInt(token.value);
    }

    private static boolean isWord(Token token) {
        return !token.value.isEmpty() && Character.isLetter(token.value.charAt(0))
                && token.type != TokenType.LITERAL_STRING;
    }

    private SourceSpan span(Token start) {
        return new SourceSpan(start.line, start.column, previous().line);
    }

    private CompilationException error(Token token, String message) {
        String found = token.is(TokenType.EOF) ? "EOF" : "'" + token.value + "'";
        return new CompilationException(SYNTAX_ERROR, token.line, token.column,
                "Syntax Error: " + message + ". Found " + found + ".");
    }

    private static CompilationException positioned(String code, Token token, String message) {
        return new CompilationException(code, token.line, token.column, message.toUpperCase(Locale.ROOT) + ".");
    }

    /**
     * Storage type and length of a PICTURE string. {@code S} and {@code V} occupy no storage.
     */
    static final class PictureInfo {
        final PicType type;
        final int length;

        private PictureInfo(PicType type, int length) {
            this.type = type;
            this.length = length;
        }

        static PictureInfo parse(String picture) {
            String pic = picture.toUpperCase(Locale.ROOT);
            if (pic.isEmpty()) {
                return null;
            }
            int length = 0;
            boolean alphanumeric = false;
            boolean numeric = false;
            int i = 0;
            while (i < pic.length()) {
                char symbol = pic.charAt(i);
                if (symbol != 'X' && symbol != 'A' && symbol != '9' && symbol != 'S' && symbol != 'V') {
                    return null;
                }
                int count = 1;
                if (i + 1 < pic.length() && pic.charAt(i + 1) == '(') {
                    int close = pic.indexOf(')', i + 2);
                    if (close < 0) {
                        return null;
                    }
                    try {
                        count = Integer.parseInt(pic.substring(i + 2, close));
                    } catch (NumberFormatException e) {
                        return null;
                    }
                    i = close + 1;
                } else {
                    i++;
                }
                if (symbol == 'S' || symbol == 'V') {
                    continue;
                }
                if (symbol == '9') {
                    numeric = true;
                } else {
                    alphanumeric = true;
                }
                length += count;
            }
            if (length <= 0) {
                return null;
            }
            PicType type = alphanumeric || !numeric ? PicType.ALPHANUMERIC : PicType.NUMERIC;
            return new PictureInfo(type, length);
        }
    }
}

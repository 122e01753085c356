package org.dxworks.cobolsim.validator;

import org.dxworks.cobolsim.model.ConditionName;
import org.dxworks.cobolsim.model.MapDefinition;
import org.dxworks.cobolsim.model.MapField;
import org.dxworks.cobolsim.model.Program;
import org.dxworks.cobolsim.model.VariableDeclaration;
import org.dxworks.cobolsim.model.expression.*;
import org.dxworks.cobolsim.model.statement.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Two-pass static checks over a parsed program.
 *
 * <p>Pass 1 builds the symbol table from the File Section records, Working-Storage and Linkage
 * declarations. Pass 2 walks every statement, nested bodies included. Each call works on its
 * own state, so one validator can serve concurrent compilations; it never throws.
 */
public final class SemanticValidator {

    public static final String UNDEFINED = "IGYPS2001-E";
    public static final String INVALID_MOVE = "IGYPS2104-E";
    public static final String DUPLICATE_SYMBOL = "IGYPS2112-S";
    public static final String NUMERIC_REQUIRED = "IGYPS2113-E";
    public static final String INVALID_REFERENCE_MODIFICATION = "IGYPS2131-E";
    public static final String INVALID_TIMES = "IGYPS2135-E";
    public static final String DISPLAY_WITHOUT_OPERAND = "IGYPS2142-E";
    public static final String FIELD_OFF_SCREEN = "IGYPS2150-E";
    public static final String STATIC_UNTIL = "IGYPS4001-W";
    public static final String ALPHANUMERIC_TO_NUMERIC = "IGYPS4002-W";
    public static final String ACCEPT_INTO_NUMERIC = "IGYPS4005-W";

    /** CICS options naming data items; other options carry names or labels. */
    private static final Set<String> CICS_DATA_OPTIONS = Set.of("INTO", "FROM", "RIDFLD", "COMMAREA");

    private SemanticValidator() {
    }

    public static List<Diagnostic> validate(Program program) {
        return new Analysis(program).run();
    }

    private static final class Analysis implements StatementVisitor<Void> {
        private final Program program;
        private final Map<String, SymbolInfo> symbols = new HashMap<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private Statement current;

        Analysis(Program program) {
            this.program = program;
        }

        List<Diagnostic> run() {
            buildSymbolTable();
            for (String parameter : program.procedureDivision.usingParameters) {
                if (!symbols.containsKey(parameter)) {
                    diagnostics.add(Diagnostic.error(program.procedureDivision.span.startLine,
                            program.procedureDivision.span.startColumn, UNDEFINED,
                            "USING PARAMETER '" + parameter + "' WAS NOT DECLARED."));
                }
            }
            checkMapFields();
            visitAll(program.procedureDivision.statements);
            diagnostics.sort(Diagnostic.BY_POSITION);
            return diagnostics;
        }

        private void buildSymbolTable() {
            List<VariableDeclaration> declarations = new ArrayList<>(program.dataDivision.ownedStorage());
            declarations.addAll(program.dataDivision.linkageSection);
            for (VariableDeclaration declaration : declarations) {
                if (symbols.containsKey(declaration.name)) {
                    duplicate(declaration.name, declaration.line, declaration.column);
                    continue;
                }
                symbols.put(declaration.name, SymbolInfo.of(declaration));
            }
            for (ConditionName conditionName : program.dataDivision.conditionNames) {
                if (symbols.containsKey(conditionName.name)) {
                    duplicate(conditionName.name, conditionName.line, conditionName.column);
                }
            }
        }

        private void checkMapFields() {
            for (MapDefinition map : program.dataDivision.mapSection) {
                for (MapField field : map.fields) {
                    if (!field.startsOnScreen()) {
                        diagnostics.add(Diagnostic.error(field.span.startLine, field.span.startColumn, FIELD_OFF_SCREEN,
                                "FIELD '" + field.name + "' OF MAP '" + map.mapName + "' AT LINE " + field.row
                                        + ", COLUMN " + field.column + " IS OUTSIDE THE " + MapDefinition.SCREEN_ROWS
                                        + "X" + MapDefinition.SCREEN_COLUMNS + " SCREEN."));
                    }
                }
            }
        }

        private void duplicate(String name, int line, int column) {
            diagnostics.add(Diagnostic.error(line, column, DUPLICATE_SYMBOL,
                    "SYMBOL '" + name + "' WAS ALREADY DEFINED IN THIS PROGRAM."));
        }

        private void visitAll(List<Statement> statements) {
            for (Statement statement : statements) {
                Statement enclosing = current;
                current = statement;
                statement.accept(this);
                current = enclosing;
            }
        }

        @Override
        public Void visitMove(MoveStatement statement) {
            SymbolInfo target = resolve(statement.target);
            SymbolInfo source = statement.source instanceof VariableRef ref ? resolve(ref) : null;
            if (target == null) {
                return null;
            }
            String name = statement.target.name;
            if (statement.source instanceof NumericLiteral literal && !target.isNumeric()) {
                error(INVALID_MOVE, "INVALID MOVE: NUMERIC LITERAL " + literal.describe()
                        + " TO ALPHANUMERIC ITEM '" + name + "'.");
            } else if (statement.source instanceof StringLiteral literal && target.isNumeric() && !literal.isNumericLooking()) {
                error(INVALID_MOVE, "INVALID MOVE: ALPHANUMERIC LITERAL '" + literal.value
                        + "' TO NUMERIC ITEM '" + name + "'.");
            } else if (statement.source instanceof Figurative figurative
                    && figurative.constant == FigurativeConstant.SPACE && target.isNumeric()) {
                error(INVALID_MOVE, "INVALID MOVE: SPACE TO NUMERIC ITEM '" + name + "'.");
            } else if (source != null && !source.isNumeric() && target.isNumeric()) {
                warning(ALPHANUMERIC_TO_NUMERIC, "MOVE OF ALPHANUMERIC ITEM '" + source.name
                        + "' TO NUMERIC ITEM '" + name + "' MAY CAUSE A RUNTIME DATA EXCEPTION.");
            }
            return null;
        }

        @Override
        public Void visitArithmetic(ArithmeticStatement statement) {
            String verb = statement.verb.keyword();
            numericOperand(statement.value, verb);
            numericOperand(statement.target, verb);
            if (statement.giving != null) {
                numericOperand(statement.giving, verb);
            }
            return null;
        }

        @Override
        public Void visitCompute(ComputeStatement statement) {
            numericOperand(statement.target, "COMPUTE");
            statement.expression.accept(new Expression.Visitor<Void>() {
                @Override
                public Void visitLiteral(Expression.Literal literal) {
                    return null;
                }

                @Override
                public Void visitVariable(Expression.Variable variable) {
                    numericOperand(variable.ref, "COMPUTE");
                    return null;
                }

                @Override
                public Void visitUnary(Expression.Unary unary) {
                    return unary.operand.accept(this);
                }

                @Override
                public Void visitBinary(Expression.Binary binary) {
                    binary.left.accept(this);
                    return binary.right.accept(this);
                }
            });
            return null;
        }

        @Override
        public Void visitIf(IfStatement statement) {
            condition(statement.condition);
            visitAll(statement.thenBody);
            visitAll(statement.elseBody);
            return null;
        }

        @Override
        public Void visitPerform(PerformStatement statement) {
            if (statement.times != null) {
                times(statement.times);
            }
            if (statement.until != null) {
                condition(statement.until);
                if (statement.until.hasOnlyLiterals()) {
                    warning(STATIC_UNTIL, "PERFORM UNTIL CONDITION MAY RESULT IN INFINITE LOOP (STATIC OPERANDS).");
                }
            }
            visitAll(statement.body);
            return null;
        }

        private void times(Operand times) {
            if (times instanceof NumericLiteral literal) {
                if (!isPositiveInteger(literal.value)) {
                    error(INVALID_TIMES, "INVALID TIMES VALUE '" + literal.describe() + "'. MUST BE A POSITIVE INTEGER.");
                }
            } else if (times instanceof VariableRef ref) {
                SymbolInfo symbol = resolve(ref);
                if (symbol != null && !symbol.isNumeric()) {
                    error(NUMERIC_REQUIRED, "TIMES IDENTIFIER '" + ref.name + "' MUST BE NUMERIC.");
                }
            } else {
                error(INVALID_TIMES, "INVALID TIMES VALUE " + times.describe() + ". MUST BE A POSITIVE INTEGER.");
            }
        }

        @Override
        public Void visitDisplay(DisplayStatement statement) {
            if (statement.values.isEmpty()) {
                error(DISPLAY_WITHOUT_OPERAND, "DISPLAY STATEMENT REQUIRES AT LEAST ONE OPERAND.");
            }
            for (Operand value : statement.values) {
                if (value instanceof VariableRef ref) {
                    resolve(ref);
                }
            }
            return null;
        }

        @Override
        public Void visitAccept(AcceptStatement statement) {
            SymbolInfo target = resolve(statement.target);
            if (target != null && target.isNumeric()) {
                warning(ACCEPT_INTO_NUMERIC, "ACCEPT INTO NUMERIC FIELD '" + target.name
                        + "' MAY CAUSE RUNTIME CONVERSION ERROR.");
            }
            return null;
        }

        @Override
        public Void visitCall(CallStatement statement) {
            if (statement.program instanceof VariableRef ref) {
                resolve(ref);
            }
            for (VariableRef argument : statement.using) {
                resolve(argument);
            }
            return null;
        }

        @Override
        public Void visitExitProgram(ExitProgramStatement statement) {
            return null;
        }

        @Override
        public Void visitGoback(GobackStatement statement) {
            return null;
        }

        @Override
        public Void visitStopRun(StopRunStatement statement) {
            return null;
        }

        @Override
        public Void visitOpen(OpenStatement statement) {
            for (OpenStatement.Target target : statement.targets) {
                file(target.fileName);
            }
            return null;
        }

        @Override
        public Void visitClose(CloseStatement statement) {
            statement.fileNames.forEach(this::file);
            return null;
        }

        @Override
        public Void visitRead(ReadStatement statement) {
            file(statement.fileName);
            if (statement.into != null) {
                resolve(statement.into);
            }
            visitAll(statement.atEnd);
            return null;
        }

        @Override
        public Void visitWrite(WriteStatement statement) {
            if (program.dataDivision.findFileByRecord(statement.recordName).isEmpty()) {
                error(UNDEFINED, "RECORD '" + statement.recordName + "' IS NOT DEFINED IN THE FILE SECTION.");
            }
            if (statement.from instanceof VariableRef ref) {
                resolve(ref);
            }
            return null;
        }

        @Override
        public Void visitExecCics(ExecCicsStatement statement) {
            switch (statement.command) {
                case HANDLE_CONDITION:
                    // options are condition -> paragraph label pairs
                    return null;
                case SEND_MAP:
                case RECEIVE_MAP:
                    if (statement.param("MAP") instanceof StringLiteral map) {
                        String mapset = statement.param("MAPSET") instanceof StringLiteral set ? set.value : null;
                        if (program.dataDivision.findMap(map.value, mapset).isEmpty()) {
                            error(UNDEFINED, "MAP '" + map.value + "' IS NOT DEFINED IN THE MAP SECTION.");
                        }
                    }
                    break;
                default:
                    break;
            }
            for (Map.Entry<String, Operand> option : statement.params.entrySet()) {
                if (CICS_DATA_OPTIONS.contains(option.getKey()) && option.getValue() instanceof VariableRef ref) {
                    resolve(ref);
                }
            }
            return null;
        }

        // --- helpers ---

        private void condition(Condition condition) {
            if (condition.left instanceof VariableRef ref) {
                resolve(ref);
            }
            if (condition.right instanceof VariableRef ref) {
                resolve(ref);
            }
        }

        private void numericOperand(Operand operand, String verb) {
            if (operand instanceof VariableRef ref) {
                SymbolInfo symbol = resolve(ref);
                if (symbol != null && !symbol.isNumeric()) {
                    error(NUMERIC_REQUIRED, "DATA ITEM '" + ref.name + "' MUST BE NUMERIC FOR " + verb + ".");
                }
            } else if (operand instanceof StringLiteral literal) {
                error(NUMERIC_REQUIRED, "OPERAND '" + literal.value + "' MUST BE NUMERIC FOR " + verb + ".");
            } else if (operand instanceof Figurative figurative && figurative.constant == FigurativeConstant.SPACE) {
                error(NUMERIC_REQUIRED, "OPERAND SPACE MUST BE NUMERIC FOR " + verb + ".");
            }
        }

        private SymbolInfo resolve(VariableRef ref) {
            SymbolInfo symbol = symbols.get(ref.name);
            if (symbol == null) {
                diagnostics.add(Diagnostic.error(ref.line, ref.column, UNDEFINED,
                        "VARIABLE '" + ref.name + "' NOT DEFINED."));
                return null;
            }
            if (ref.hasRefMod()) {
                ReferenceModification refMod = ref.refMod;
                if (symbol.isNumeric()) {
                    diagnostics.add(Diagnostic.error(ref.line, ref.column, INVALID_REFERENCE_MODIFICATION,
                            "REFERENCE MODIFICATION IS NOT ALLOWED ON NUMERIC ITEM '" + ref.name + "'."));
                } else if (refMod.start + refMod.length - 1 > symbol.length) {
                    diagnostics.add(Diagnostic.error(ref.line, ref.column, INVALID_REFERENCE_MODIFICATION,
                            "REFERENCE MODIFICATION " + refMod + " EXCEEDS THE LENGTH OF '" + ref.name
                                    + "' (" + symbol.length + ")."));
                }
            }
            return symbol;
        }

        private void error(String code, String message) {
            diagnostics.add(Diagnostic.error(current.span.startLine, current.span.startColumn, code, message));
        }

        private void warning(String code, String message) {
            diagnostics.add(Diagnostic.warning(current.span.startLine, current.span.startColumn, code, message));
        }

        private void file(String fileName) {
            if (program.findFile(fileName).isEmpty()) {
                error(UNDEFINED, "FILE '" + fileName + "' IS NOT DEFINED IN FILE-CONTROL.");
            }
        }
    }

    private static boolean isPositiveInteger(BigDecimal value) {
        return value.signum() > 0 && value.stripTrailingZeros().scale() <= 0;
    }
}

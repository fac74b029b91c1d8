package com.github.musiKk.rockstar;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.DoubleBinaryOperator;
import java.util.function.LongBinaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.musiKk.rockstar.natives.Io;
import com.github.musiKk.rockstar.parser.ParseResult;
import com.github.musiKk.rockstar.parser.Program;
import com.github.musiKk.rockstar.parser.Program.Assignment;
import com.github.musiKk.rockstar.parser.Program.BooleanConstant;
import com.github.musiKk.rockstar.parser.Program.Call;
import com.github.musiKk.rockstar.parser.Program.Direction;
import com.github.musiKk.rockstar.parser.Program.Element;
import com.github.musiKk.rockstar.parser.Program.Expression;
import com.github.musiKk.rockstar.parser.Program.FloatConstant;
import com.github.musiKk.rockstar.parser.Program.FunctionDefinition;
import com.github.musiKk.rockstar.parser.Program.If;
import com.github.musiKk.rockstar.parser.Program.Input;
import com.github.musiKk.rockstar.parser.Program.IntegerConstant;
import com.github.musiKk.rockstar.parser.Program.Loop;
import com.github.musiKk.rockstar.parser.Program.Operator;
import com.github.musiKk.rockstar.parser.Program.Output;
import com.github.musiKk.rockstar.parser.Program.Return;
import com.github.musiKk.rockstar.parser.Program.Statement;
import com.github.musiKk.rockstar.parser.Program.StringConstant;
import com.github.musiKk.rockstar.parser.Program.Turn;
import com.github.musiKk.rockstar.parser.Program.Variable;
import com.github.musiKk.rockstar.parser.SourceParser;

import lombok.Setter;

/**
 * Walks the statement tree of a program. Function definitions become
 * callable only once execution has reached them.
 */
public class Runner implements ConfigReader.ConfigTarget {

    private static final Logger LOG = LoggerFactory.getLogger(Runner.class);

    private final Io io;

    private List<String> lookupPath = new ArrayList<>();
    @Setter
    private boolean keepStringQuotes;
    @Setter
    private boolean printState = true;

    public Runner() {
        this(Io.console());
    }

    public Runner(Io io) {
        this.io = io;
    }

    @Override
    public void setLookupPath(List<String> lookupPath) {
        this.lookupPath = lookupPath;
    }

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("usage: rockstar <source file>");
            System.exit(2);
        }
        var runner = new Runner();
        ConfigReader.readConfig().applyConfig(runner);
        try {
            if (!runner.runFile(args[0])) {
                System.exit(1);
            }
        } catch (RockstarRuntimeException e) {
            System.err.println("RuntimeError " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Parses and runs a file. Nothing is run if any line fails to parse.
     *
     * @return whether the file parsed
     */
    public boolean runFile(String file) {
        var path = resolvePath(file);
        String source;
        try {
            source = Files.readString(path);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }

        var result = parse(source, file);
        if (!result.isSuccess()) {
            result.diagnostics().forEach(diagnostic -> io.error(diagnostic.format()));
            io.error("Failed to parse input file");
            return false;
        }
        LOG.info("parsed {}", path);

        var state = run(result.program().get());
        LOG.info("finished running {}", path);
        if (printState) {
            io.print("state: " + Io.stringify(state.variables()));
        }
        return true;
    }

    private Path resolvePath(String file) {
        var path = Path.of(file);
        if (!path.isAbsolute()) {
            for (String lookupPathEntry : lookupPath) {
                var candidate = Path.of(lookupPathEntry, file);
                if (Files.isRegularFile(candidate)) {
                    return candidate;
                }
            }
        }
        return path;
    }

    public ParseResult parse(String source, String fileName) {
        var parser = new SourceParser();
        parser.setKeepStringQuotes(keepStringQuotes);
        return parser.parse(source, fileName);
    }

    /** @return the top level variables once the program has finished */
    public Scope run(Program program) {
        var frame = new StackFrame(new Scope(), new HashMap<>());
        execute(program.statements(), frame);
        return frame.scope();
    }

    /**
     * @return the value of the {@code Give back} that ended the block, empty if
     *         control ran off its end
     */
    Optional<Value> execute(List<Statement> statements, StackFrame frame) {
        for (var statement : statements) {
            if (statement instanceof FunctionDefinition function) {
                LOG.debug("registering function {}{}", function.name(), function.parameters());
                frame.functions().put(function.name(), function);
            } else if (statement instanceof Return returnStatement) {
                return Optional.of(evaluateExpression(returnStatement.value(), frame));
            } else {
                var returned = execute(statement, frame);
                if (returned.isPresent()) {
                    return returned;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Value> execute(Statement statement, StackFrame frame) {
        if (statement instanceof Assignment assignment) {
            frame.scope().putVariable(assignment.target().name(), evaluateExpression(assignment.value(), frame));
        } else if (statement instanceof Output output) {
            io.print(evaluateExpression(output.value(), frame));
        } else if (statement instanceof Input input) {
            var line = io.readLine().orElseGet(() -> {
                LOG.warn("input exhausted, {} is set to an empty string", input.target().name());
                return "";
            });
            frame.scope().putVariable(input.target().name(), new StringValue(line));
        } else if (statement instanceof If ifStatement) {
            if (isTruthy(evaluateExpression(ifStatement.condition(), frame))) {
                return execute(ifStatement.block(), frame);
            }
        } else if (statement instanceof Loop loop) {
            var expected = loop.isWhile() ? True : False;
            while (valuesEqual(evaluateExpression(loop.condition(), frame), expected)) {
                var returned = execute(loop.body(), frame);
                if (returned.isPresent()) {
                    return returned;
                }
            }
        } else if (statement instanceof Turn turn) {
            var name = turn.target().name();
            frame.scope().putVariable(name, turn(turn.direction(), frame.scope().getVariable(name)));
        } else {
            throw new RockstarRuntimeException("Invalid statement " + statement);
        }
        return Optional.empty();
    }

    /**
     * Moves half a step in the turn direction and rounds to the nearest
     * integer, ties going the same way. Whole numbers move by exactly one.
     */
    static Value turn(Direction direction, Value value) {
        if (!isNumeric(value)) {
            throw new RockstarRuntimeException("Cannot turn " + value);
        }
        long result = switch (direction) {
            case UP -> (long) Math.floor((asDouble(value) + 0.5) + 0.5);
            case DOWN -> (long) Math.ceil((asDouble(value) - 0.5) - 0.5);
        };
        return new IntegerValue(result);
    }

    Value evaluateExpression(Expression expression, StackFrame frame) {
        var elements = expression.elements();
        if (elements.isEmpty()) {
            throw new RockstarRuntimeException("Cannot evaluate an empty expression");
        }

        var left = evaluateElement(elements.get(0), frame);
        for (int i = 1; i < elements.size(); i += 2) {
            if (!(elements.get(i) instanceof Operator operator)) {
                throw new RockstarRuntimeException("Expected an operator but got " + elements.get(i));
            }
            if (i + 1 >= elements.size()) {
                throw new RockstarRuntimeException("Missing operand after " + operator);
            }
            var right = evaluateElement(elements.get(i + 1), frame);
            left = applyOperator(operator, left, right);
        }
        return left;
    }

    private Value evaluateElement(Element element, StackFrame frame) {
        if (element instanceof IntegerConstant c) {
            return new IntegerValue(c.value());
        } else if (element instanceof FloatConstant c) {
            return new FloatValue(c.value());
        } else if (element instanceof BooleanConstant c) {
            return c.value() ? True : False;
        } else if (element instanceof StringConstant c) {
            return new StringValue(c.value());
        } else if (element instanceof Variable v) {
            return frame.scope().getVariable(v.name());
        } else if (element instanceof Call call) {
            return evaluateFunction(call, frame);
        }
        throw new RockstarRuntimeException("Expected a value but got " + element);
    }

    private Value evaluateFunction(Call call, StackFrame frame) {
        var function = frame.functions().get(call.name());
        if (function == null) {
            throw new RockstarRuntimeException("Cannot find function of name " + call.name());
        }

        var callee = frame.pushFrame();
        var parameters = function.parameters();
        var arguments = call.arguments();
        for (int i = 0; i < Math.min(parameters.size(), arguments.size()); i++) {
            // arguments see the caller's variables only
            callee.scope().putVariable(parameters.get(i).name(), evaluateExpression(arguments.get(i), frame));
        }
        LOG.debug("calling {} with {}", call.name(), callee.scope().variables());

        return execute(function.body(), callee).orElse(Mysterious);
    }

    static Value applyOperator(Operator operator, Value left, Value right) {
        return switch (operator) {
            case ADD -> add(left, right);
            case SUB -> arithmetic(operator, left, right, Math::subtractExact, (a, b) -> a - b);
            case MUL -> multiply(left, right);
            case DIV -> divide(left, right);
            case EQ -> valuesEqual(left, right) ? True : False;
            case NEQ -> valuesEqual(left, right) ? False : True;
            case LT -> compare(operator, left, right) < 0 ? True : False;
            case LEQ -> compare(operator, left, right) <= 0 ? True : False;
            case GT -> compare(operator, left, right) > 0 ? True : False;
            case GEQ -> compare(operator, left, right) >= 0 ? True : False;
        };
    }

    private static Value add(Value left, Value right) {
        if (left instanceof StringValue || right instanceof StringValue) {
            return new StringValue(Io.stringify(left) + Io.stringify(right));
        }
        return arithmetic(Operator.ADD, left, right, Math::addExact, (a, b) -> a + b);
    }

    private static Value multiply(Value left, Value right) {
        if (left instanceof StringValue sv && right instanceof IntegerValue iv) {
            return new StringValue(sv.string().repeat(repeatCount(iv)));
        }
        if (left instanceof IntegerValue iv && right instanceof StringValue sv) {
            return new StringValue(sv.string().repeat(repeatCount(iv)));
        }
        return arithmetic(Operator.MUL, left, right, Math::multiplyExact, (a, b) -> a * b);
    }

    private static int repeatCount(IntegerValue count) {
        try {
            return Math.max(0, Math.toIntExact(count.number()));
        } catch (ArithmeticException e) {
            throw new RockstarRuntimeException("Cannot repeat a string " + count.number() + " times");
        }
    }

    private static Value divide(Value left, Value right) {
        if (!isNumeric(left) || !isNumeric(right)) {
            throw mismatch(Operator.DIV, left, right);
        }
        if (asDouble(right) == 0) {
            throw new RockstarRuntimeException("Division by zero");
        }
        return new FloatValue(asDouble(left) / asDouble(right));
    }

    private static Value arithmetic(Operator operator, Value left, Value right,
            LongBinaryOperator onIntegers, DoubleBinaryOperator onFloats) {
        if (!isNumeric(left) || !isNumeric(right)) {
            throw mismatch(operator, left, right);
        }
        if (left instanceof FloatValue || right instanceof FloatValue) {
            return new FloatValue(onFloats.applyAsDouble(asDouble(left), asDouble(right)));
        }
        try {
            return new IntegerValue(onIntegers.applyAsLong(asLong(left), asLong(right)));
        } catch (ArithmeticException e) {
            throw new RockstarRuntimeException("Integer overflow applying " + operator + " to " + left + " and " + right);
        }
    }

    /**
     * Integers, floats and booleans compare as numbers with each other,
     * strings only with strings. Any other pairing is unequal.
     */
    static boolean valuesEqual(Value left, Value right) {
        if (isNumeric(left) && isNumeric(right)) {
            if (left instanceof FloatValue || right instanceof FloatValue) {
                return asDouble(left) == asDouble(right);
            }
            return asLong(left) == asLong(right);
        }
        return left.equals(right);
    }

    private static int compare(Operator operator, Value left, Value right) {
        if (isNumeric(left) && isNumeric(right)) {
            if (left instanceof FloatValue || right instanceof FloatValue) {
                return Double.compare(asDouble(left), asDouble(right));
            }
            return Long.compare(asLong(left), asLong(right));
        }
        if (left instanceof StringValue l && right instanceof StringValue r) {
            return l.string().compareTo(r.string());
        }
        throw mismatch(operator, left, right);
    }

    static boolean isTruthy(Value value) {
        if (value instanceof BooleanValue bv) {
            return bv.value();
        } else if (value instanceof IntegerValue iv) {
            return iv.number() != 0;
        } else if (value instanceof FloatValue fv) {
            return fv.number() != 0;
        } else if (value instanceof StringValue sv) {
            return !sv.string().isEmpty();
        }
        return false;
    }

    private static boolean isNumeric(Value value) {
        return value instanceof IntegerValue || value instanceof FloatValue || value instanceof BooleanValue;
    }

    private static long asLong(Value value) {
        if (value instanceof BooleanValue bv) {
            return bv.value() ? 1 : 0;
        } else if (value instanceof IntegerValue iv) {
            return iv.number();
        }
        return (long) ((FloatValue) value).number();
    }

    private static double asDouble(Value value) {
        if (value instanceof FloatValue fv) {
            return fv.number();
        }
        return asLong(value);
    }

    private static RockstarRuntimeException mismatch(Operator operator, Value left, Value right) {
        return new RockstarRuntimeException("Cannot apply " + operator + " to " + left + " and " + right);
    }

    public static class Scope {
        private final Map<String, Value> variables = new HashMap<>();

        public Value getVariable(String name) {
            var value = variables.get(name);
            if (value == null) {
                throw new SymbolNotFoundException("Variable used before assignment " + name);
            }
            return value;
        }
        public void putVariable(String name, Value value) {
            variables.put(name, value);
        }
        public Map<String, Value> variables() {
            return Collections.unmodifiableMap(variables);
        }
        @Override
        public String toString() {
            return Io.stringify(variables);
        }
    }

    public static class StackFrame {
        private final Scope scope;
        private final Map<String, FunctionDefinition> functions;

        StackFrame(Scope scope, Map<String, FunctionDefinition> functions) {
            this.scope = scope;
            this.functions = functions;
        }

        Scope scope() {
            return scope;
        }

        Map<String, FunctionDefinition> functions() {
            return functions;
        }

        /**
         * Frame for a function call: fresh variables, same function table so
         * that functions can call themselves and each other.
         */
        StackFrame pushFrame() {
            return new StackFrame(new Scope(), functions);
        }
    }

    public sealed interface Value {}

    public record IntegerValue(long number) implements Value {}
    public record FloatValue(double number) implements Value {}
    public record BooleanValue(boolean value) implements Value {}
    public record StringValue(String string) implements Value {}
    /** What a function gives back when it never reaches {@code Give back}. */
    public record MysteriousValue() implements Value {}

    public static final Value True = new BooleanValue(true);
    public static final Value False = new BooleanValue(false);
    public static final Value Mysterious = new MysteriousValue();

    static class SymbolNotFoundException extends RockstarRuntimeException {
        public SymbolNotFoundException(String message) {
            super(message);
        }
    }
}

package com.github.musiKk.rockstar.parser;

import java.util.List;

/**
 * The statement tree of a whole source file. Block headers ({@link If},
 * {@link Loop}, {@link FunctionDefinition}) come out of line parsing with an
 * empty block and are rebuilt by the {@link Treeifier} once their block is
 * known.
 */
public record Program(List<Statement> statements) {

    public sealed interface Statement {}

    public record Assignment(Variable target, Expression value) implements Statement {}
    public record Output(Expression value) implements Statement {}
    public record Input(Variable target) implements Statement {}
    public record If(Expression condition, List<Statement> block) implements Statement {
        public If(Expression condition) {
            this(condition, List.of());
        }
        public If withBlock(List<Statement> block) {
            return new If(condition, List.copyOf(block));
        }
    }
    public record Loop(boolean isWhile, Expression condition, List<Statement> body) implements Statement {
        public Loop(boolean isWhile, Expression condition) {
            this(isWhile, condition, List.of());
        }
        public Loop withBody(List<Statement> body) {
            return new Loop(isWhile, condition, List.copyOf(body));
        }
    }
    public record Turn(Direction direction, Variable target) implements Statement {}
    public record FunctionDefinition(String name, List<Variable> parameters, List<Statement> body) implements Statement {
        public FunctionDefinition(String name, List<Variable> parameters) {
            this(name, parameters, List.of());
        }
        public FunctionDefinition withBody(List<Statement> body) {
            return new FunctionDefinition(name, parameters, List.copyOf(body));
        }
    }
    public record Return(Expression value) implements Statement {}
    /** A blank line. Closes the innermost open block and never survives treeifying. */
    public record End() implements Statement {}

    public enum Direction {
        UP, DOWN;

        static Direction of(String word) {
            return switch (word) {
                case "up" -> UP;
                case "down" -> DOWN;
                default -> null;
            };
        }
    }

    /**
     * Operands and operators in source order, to be folded strictly left to
     * right without precedence.
     */
    public record Expression(List<Element> elements) {
        public Expression {
            elements = List.copyOf(elements);
        }
        public static Expression of(Element... elements) {
            return new Expression(List.of(elements));
        }
        public boolean isEmpty() {
            return elements.isEmpty();
        }
    }

    public sealed interface Element {}

    /** Anything that yields a value on its own. */
    public sealed interface Evalable extends Element {}

    public record IntegerConstant(long value) implements Evalable {}
    public record FloatConstant(double value) implements Evalable {}
    public record BooleanConstant(boolean value) implements Evalable {}
    public record StringConstant(String value) implements Evalable {}
    public record Variable(String name) implements Evalable {}
    public record Call(String name, List<Expression> arguments) implements Evalable {
        public Call {
            arguments = List.copyOf(arguments);
        }
    }

    public enum Operator implements Element {
        ADD, SUB, MUL, DIV,
        EQ, NEQ, LT, LEQ, GT, GEQ
    }

}

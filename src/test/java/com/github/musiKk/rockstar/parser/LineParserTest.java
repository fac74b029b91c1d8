package com.github.musiKk.rockstar.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.musiKk.rockstar.parser.Program.Assignment;
import com.github.musiKk.rockstar.parser.Program.BooleanConstant;
import com.github.musiKk.rockstar.parser.Program.Call;
import com.github.musiKk.rockstar.parser.Program.Direction;
import com.github.musiKk.rockstar.parser.Program.End;
import com.github.musiKk.rockstar.parser.Program.Expression;
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

public class LineParserTest {

    private static final Variable TOMMY = new Variable("tommy");

    @ParameterizedTest
    @MethodSource("statements")
    public void testStatementParse(String line, Statement expected) {
        var parsed = new LineParser(new ParseContext()).parseLine(line);
        assertEquals(expected, parsed);
    }

    private static Object[][] statements() {
        return new Object[][] {
            {
                "",
                new End()
            }, {
                "(only a comment)",
                new End()
            }, {
                "Say \"Hello World\"",
                new Output(Expression.of(new StringConstant("Hello World")))
            }, {
                "Shout Tommy (the boy) plus 1",
                new Output(Expression.of(TOMMY, Operator.ADD, new IntegerConstant(1)))
            }, {
                "Listen to your heart",
                new Input(new Variable("your#heart"))
            }, {
                "Put 5 into the cat",
                new Assignment(new Variable("the#cat"), Expression.of(new IntegerConstant(5)))
            }, {
                "Put Midnight taking Tommy into the night",
                new Assignment(new Variable("the#night"),
                    Expression.of(new Call("Midnight", List.of(Expression.of(TOMMY)))))
            }, {
                "Let my heart be Tommy with 1",
                new Assignment(new Variable("my#heart"), Expression.of(TOMMY, Operator.ADD, new IntegerConstant(1)))
            }, {
                "If Tommy is nothing",
                new If(Expression.of(TOMMY, Operator.EQ, new IntegerConstant(0)))
            }, {
                "Until Tommy is 0",
                new Loop(false, Expression.of(TOMMY, Operator.EQ, new IntegerConstant(0)))
            }, {
                "While Tommy is not true",
                new Loop(true, Expression.of(TOMMY, Operator.NEQ, new BooleanConstant(true)))
            }, {
                "Turn up Tommy",
                new Turn(Direction.UP, TOMMY)
            }, {
                "Turn Tommy down",
                new Turn(Direction.DOWN, TOMMY)
            }, {
                "Midnight takes your heart and my soul",
                new FunctionDefinition("Midnight", List.of(new Variable("your#heart"), new Variable("my#soul")))
            }, {
                "Midnight takes Tommy, Gina, and Bob",
                new FunctionDefinition("Midnight", List.of(TOMMY, new Variable("gina"), new Variable("bob")))
            }, {
                "Give back Tommy",
                new Return(Expression.of(TOMMY))
            }, {
                "Tommy was a lovestruck ladykiller",
                new Assignment(TOMMY, Expression.of(new IntegerConstant(100)))
            }, {
                "Tommy's a lovestruck ladykiller",
                new Assignment(TOMMY, Expression.of(new IntegerConstant(100)))
            }, {
                "Tommy is 5",
                new Assignment(TOMMY, Expression.of(new IntegerConstant(0)))
            }, {
                "Tommy was nothing",
                new Assignment(TOMMY, Expression.of(new IntegerConstant(7)))
            }, {
                "Tommy was right",
                new Assignment(TOMMY, Expression.of(new IntegerConstant(5)))
            }, {
                "Tommy is \"rock\"",
                new Assignment(TOMMY, Expression.of(new IntegerConstant(4)))
            }, {
                "Gina says Hello, World!",
                new Assignment(new Variable("gina"), Expression.of(new StringConstant("Hello, World!")))
            }
        };
    }

    @ParameterizedTest
    @MethodSource("malformedLines")
    public void testMalformedLine(String line, String message) {
        var parser = new LineParser(new ParseContext());
        var e = assertThrows(RockstarSyntaxException.class, () -> parser.parseLine(line));
        assertEquals(message, e.getMessage());
    }

    private static Object[][] malformedLines() {
        return new Object[][] {
            { "put 5 into the cat", "Cannot start a statement with a lower case letter" },
            { "Say (unbalanced", "Invalid comment" },
            { "Say ) backwards (", "Invalid comment" },
            { "Put 5 in the cat", "Expected \"into\" in assignment" },
            { "Put 5 into Tommy now", "Unexpected tokens at end of line" },
            { "Put 5 into", "Expected variable in assignment" },
            { "Let Tommy 5", "Expected \"be\" after variable in assignment" },
            { "Turn Tommy sideways", "Expected \"up\" or \"down\" for turn statement" },
            { "Turn up Tommy now", "Unexpected tokens at end of line" },
            { "Midnight takes x y", "Invalid syntax for function Midnight" },
            { "Midnight takes 5", "Failed to read argument list" },
            { "Give Tommy", "Invalid \"Give back\" statement" },
            { "Hello", "Cannot parse line" },
            { "Listen to", "Cannot parse line" },
            { "Put 99999999999999999999 into X", "Number 99999999999999999999 is too large" },
            { "Tommy was" + " wonderful".repeat(20), "Poetic number literal is too large" }
        };
    }

    @Test
    public void testPronounAcrossLines() {
        var parser = new LineParser(new ParseContext());

        parser.parseLine("Put 5 into the cat");

        assertEquals(new Output(Expression.of(new Variable("the#cat"))), parser.parseLine("Say it"));
    }

    @Test
    public void testKeepStringQuotes() {
        var parser = new LineParser(new ParseContext(), true);

        assertEquals(new Output(Expression.of(new StringConstant("\"Hello\""))), parser.parseLine("Say \"Hello\""));
    }

}

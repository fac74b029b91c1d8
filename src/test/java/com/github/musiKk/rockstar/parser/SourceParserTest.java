package com.github.musiKk.rockstar.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.musiKk.rockstar.parser.Program.Call;
import com.github.musiKk.rockstar.parser.Program.Expression;
import com.github.musiKk.rockstar.parser.Program.FunctionDefinition;
import com.github.musiKk.rockstar.parser.Program.If;
import com.github.musiKk.rockstar.parser.Program.IntegerConstant;
import com.github.musiKk.rockstar.parser.Program.Operator;
import com.github.musiKk.rockstar.parser.Program.Output;
import com.github.musiKk.rockstar.parser.Program.Return;
import com.github.musiKk.rockstar.parser.Program.Variable;

public class SourceParserTest {

    @Test
    public void testParseProgram() {
        var source = String.join("\n",
            "Midnight takes your heart",
            "If your heart is nothing",
            "Say your heart",
            "",
            "Give back your heart",
            "",
            "Say Midnight taking 5");

        var result = new SourceParser().parse(source, "midnight.rock");

        assertTrue(result.isSuccess());
        var heart = new Variable("your#heart");
        assertEquals(new Program(List.of(
            new FunctionDefinition("Midnight", List.of(heart), List.of(
                new If(Expression.of(heart, Operator.EQ, new IntegerConstant(0)),
                    List.of(new Output(Expression.of(heart)))),
                new Return(Expression.of(heart)))),
            new Output(Expression.of(new Call("Midnight", List.of(Expression.of(new IntegerConstant(5)))))))),
            result.program().get());
    }

    @Test
    public void testCarriageReturnsAreIgnored() {
        var result = new SourceParser().parse("Put 1 into X\r\nSay X\r\n", "crlf.rock");

        assertTrue(result.isSuccess());
        assertEquals(2, result.program().get().statements().size());
    }

    @Test
    public void testAllBrokenLinesAreReported() {
        var source = String.join("\n",
            "Put 5 into X",
            "put 6 into Y",
            "Say X",
            "Let Y 5");

        var result = new SourceParser().parse(source, "broken.rock");

        assertFalse(result.isSuccess());
        assertEquals(List.of(
            new Diagnostic("broken.rock", 1, "put 6 into Y", "Cannot start a statement with a lower case letter"),
            new Diagnostic("broken.rock", 3, "Let Y 5", "Expected \"be\" after variable in assignment")),
            result.diagnostics());
    }

    @Test
    public void testDiagnosticFormat() {
        var diagnostic = new Diagnostic("broken.rock", 1, "put 6 into Y", "Cannot start a statement with a lower case letter");

        assertEquals(
            "put 6 into Y\n"
                + "^^^^^^^^^^^^\n"
                + "broken.rock(1): SyntaxError Cannot start a statement with a lower case letter",
            diagnostic.format());
    }

    @Test
    public void testReturnOutsideFunctionIsReported() {
        var result = new SourceParser().parse("Put 5 into X\nGive back X", "return.rock");

        assertFalse(result.isSuccess());
        assertEquals(List.of(new Diagnostic("return.rock", 1, "Give back X", "\"Give back\" statement has to be in function")),
            result.diagnostics());
    }

    @Test
    public void testReturnInsideIfIsReported() {
        var source = String.join("\n",
            "Midnight takes your heart",
            "If your heart is 1",
            "Give back 1",
            "",
            "Give back 2");

        var result = new SourceParser().parse(source, "nested.rock");

        assertFalse(result.isSuccess());
        assertEquals(List.of(new Diagnostic("nested.rock", 2, "Give back 1", "\"Give back\" statement has to be in function")),
            result.diagnostics());
    }

}

package com.github.musiKk.rockstar.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import com.github.musiKk.rockstar.Tokenizer;
import com.github.musiKk.rockstar.Tokenizer.Tokens;
import com.github.musiKk.rockstar.parser.Program.Assignment;
import com.github.musiKk.rockstar.parser.Program.Direction;
import com.github.musiKk.rockstar.parser.Program.End;
import com.github.musiKk.rockstar.parser.Program.Expression;
import com.github.musiKk.rockstar.parser.Program.FunctionDefinition;
import com.github.musiKk.rockstar.parser.Program.If;
import com.github.musiKk.rockstar.parser.Program.Input;
import com.github.musiKk.rockstar.parser.Program.Loop;
import com.github.musiKk.rockstar.parser.Program.Output;
import com.github.musiKk.rockstar.parser.Program.Return;
import com.github.musiKk.rockstar.parser.Program.Statement;
import com.github.musiKk.rockstar.parser.Program.StringConstant;
import com.github.musiKk.rockstar.parser.Program.Turn;
import com.github.musiKk.rockstar.parser.Program.Variable;

import lombok.RequiredArgsConstructor;

/**
 * Turns one source line into one flat statement. Block headers come back
 * without their blocks; see {@link Treeifier}.
 */
@RequiredArgsConstructor
public class LineParser {

    static final Set<String> OUTPUT_KEYWORDS = Set.of("say", "shout", "whisper", "scream");

    private final Tokenizer tokenizer;
    private final ExpressionParser expressionParser;

    public LineParser(ParseContext context, boolean keepStringQuotes) {
        this(new Tokenizer(), new ExpressionParser(context, keepStringQuotes));
    }

    public LineParser(ParseContext context) {
        this(context, false);
    }

    public Statement parseLine(String source) {
        if (!source.isEmpty() && Character.isLowerCase(source.charAt(0))) {
            throw new RockstarSyntaxException("Cannot start a statement with a lower case letter");
        }

        var line = stripComment(source)
            .replace("'s ", " is ")
            .replace("'", "");
        var tokens = tokenizer.tokenize(line);
        if (tokens.isEmpty()) {
            return new End();
        }

        var keyword = tokens.peek();
        if (OUTPUT_KEYWORDS.contains(keyword.toLowerCase(Locale.ROOT))) {
            return parseOutput(tokens);
        }
        if (keyword.equalsIgnoreCase("listen") && tokens.size() > 2 && tokens.matchesAt(1, "to")) {
            return parseInput(tokens);
        }
        switch (keyword) {
            case "Put":
                return parsePut(tokens);
            case "Let":
                return parseLet(tokens);
            case "If":
                tokens.next();
                return new If(expressionParser.parseExpression(tokens));
            case "Until":
                tokens.next();
                return new Loop(false, expressionParser.parseExpression(tokens));
            case "While":
                tokens.next();
                return new Loop(true, expressionParser.parseExpression(tokens));
            case "Turn":
                return parseTurn(tokens);
            default:
                break;
        }
        if (tokens.matchesAt(1, "takes")) {
            return parseFunctionDefinition(tokens);
        }
        if (keyword.equals("Give")) {
            return parseReturn(tokens);
        }
        return parsePoeticAssignment(source, tokens);
    }

    // at most one comment is cut out here, the tokenizer drops any further ones
    private static String stripComment(String line) {
        int open = line.indexOf('(');
        int close = line.indexOf(')');
        if (open < 0 && close < 0) {
            return line;
        }
        if (open < 0 || close < 0 || close < open) {
            throw new RockstarSyntaxException("Invalid comment");
        }
        return line.substring(0, open) + line.substring(close + 1);
    }

    // <> (say|shout|whisper|scream) expression
    private Output parseOutput(Tokens tokens) {
        tokens.next();
        var value = expressionParser.parseExpression(tokens);
        expectEnd(tokens);
        return new Output(value);
    }

    // <> listen to variable
    private Input parseInput(Tokens tokens) {
        tokens.skip(2);
        var target = expectVariable(tokens, "Expected variable after \"Listen to\"");
        expectEnd(tokens);
        return new Input(target);
    }

    // <> Put expression into variable
    private Assignment parsePut(Tokens tokens) {
        tokens.next();
        int into = tokens.indexOf("into");
        if (into < 0) {
            throw new RockstarSyntaxException("Expected \"into\" in assignment");
        }
        var value = expressionParser.parseExpression(tokens.take(into));
        tokens.next();
        var target = expectVariable(tokens, "Expected variable in assignment");
        expectEnd(tokens);
        return new Assignment(target, value);
    }

    // <> Let variable (be|is|are|was|were) expression
    private Assignment parseLet(Tokens tokens) {
        tokens.next();
        var target = expectVariable(tokens, "Expected variable in assignment");
        if (!tokens.matches("be", "is", "are", "was", "were")) {
            throw new RockstarSyntaxException("Expected \"be\" after variable in assignment");
        }
        tokens.next();
        var value = expressionParser.parseExpression(tokens);
        expectEnd(tokens);
        return new Assignment(target, value);
    }

    // <> Turn (up|down) variable | Turn variable (up|down)
    private Turn parseTurn(Tokens tokens) {
        tokens.next();
        Direction direction;
        Variable target;
        if (tokens.matches("up", "down")) {
            direction = Direction.of(tokens.next());
            target = expectVariable(tokens, "Expected variable in turn statement");
        } else {
            target = expectVariable(tokens, "Expected variable in turn statement");
            if (!tokens.matches("up", "down")) {
                throw new RockstarSyntaxException("Expected \"up\" or \"down\" for turn statement");
            }
            direction = Direction.of(tokens.next());
        }
        expectEnd(tokens);
        return new Turn(direction, target);
    }

    // <> name takes variable ((, | and | n) variable)*
    private FunctionDefinition parseFunctionDefinition(Tokens tokens) {
        var name = tokens.next();
        tokens.next();

        List<Variable> parameters = new ArrayList<>();
        while (!tokens.isEmpty()) {
            parameters.add(expectVariable(tokens, "Failed to read argument list"));
            if (tokens.matches(",", "and", "n")) {
                tokens.next();
                if (tokens.matches("and")) {
                    tokens.next();
                }
            } else if (!tokens.isEmpty()) {
                throw new RockstarSyntaxException("Invalid syntax for function " + name);
            }
        }
        return new FunctionDefinition(name, parameters);
    }

    // <> Give back expression
    private Return parseReturn(Tokens tokens) {
        if (!tokens.matchesAt(1, "back")) {
            throw new RockstarSyntaxException("Invalid \"Give back\" statement");
        }
        tokens.skip(2);
        return new Return(expressionParser.parseExpression(tokens));
    }

    // <> variable (be|is|...) poetic-number | variable (says|...) rest-of-line
    private Assignment parsePoeticAssignment(String source, Tokens tokens) {
        var target = expressionParser.tryParseVariableName(tokens);
        if (target.isPresent() && !tokens.isEmpty()) {
            if (tokens.matches("be", "is", "are", "was", "were")) {
                tokens.next();
                return new Assignment(target.get(), Expression.of(expressionParser.parsePoeticNumberLiteral(tokens)));
            }
            if (tokens.matches("says", "shouts", "screams", "whispers")) {
                var keyword = tokens.next();
                var literal = new StringConstant(restOfLine(source, keyword));
                return new Assignment(target.get(), Expression.of(literal));
            }
        }
        throw new RockstarSyntaxException("Cannot parse line");
    }

    private static String restOfLine(String source, String keyword) {
        var matcher = Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b").matcher(source);
        if (!matcher.find()) {
            return "";
        }
        var rest = source.substring(matcher.end());
        return rest.isEmpty() ? rest : rest.substring(1);
    }

    private Variable expectVariable(Tokens tokens, String message) {
        return expressionParser.tryParseVariableName(tokens)
            .orElseThrow(() -> new RockstarSyntaxException(message));
    }

    private static void expectEnd(Tokens tokens) {
        if (!tokens.isEmpty()) {
            throw new RockstarSyntaxException("Unexpected tokens at end of line");
        }
    }

}

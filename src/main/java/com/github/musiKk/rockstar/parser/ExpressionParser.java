package com.github.musiKk.rockstar.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import com.github.musiKk.rockstar.Tokenizer.Tokens;
import com.github.musiKk.rockstar.parser.Program.BooleanConstant;
import com.github.musiKk.rockstar.parser.Program.Call;
import com.github.musiKk.rockstar.parser.Program.Element;
import com.github.musiKk.rockstar.parser.Program.Evalable;
import com.github.musiKk.rockstar.parser.Program.Expression;
import com.github.musiKk.rockstar.parser.Program.FloatConstant;
import com.github.musiKk.rockstar.parser.Program.IntegerConstant;
import com.github.musiKk.rockstar.parser.Program.Operator;
import com.github.musiKk.rockstar.parser.Program.StringConstant;
import com.github.musiKk.rockstar.parser.Program.Variable;

import lombok.RequiredArgsConstructor;

/**
 * Lookahead parsers for the pieces of a line: variable names, constants,
 * operators, function calls and whole expressions.
 * <p>
 * Every {@code tryParse*} method either consumes the tokens it matched or
 * leaves the cursor exactly where it was.
 */
@RequiredArgsConstructor
public class ExpressionParser {

    static final Set<String> PRONOUNS = Set.of(
        "it", "he", "she", "him", "her", "they", "them",
        "ze", "hir", "zie", "zir", "xe", "xem", "ve", "ver");
    static final Set<String> DETERMINERS = Set.of("a", "an", "the", "my", "your");

    static final Set<String> NOTHING = Set.of("null", "nothing", "nowhere", "nobody", "empty", "gone");
    static final Set<String> TRUE = Set.of("true", "right", "yes", "ok", "truth");
    static final Set<String> FALSE = Set.of("false", "wrong", "no", "lies");

    static final Set<String> ARGUMENT_SEPARATORS = Set.of(",", "and", "n");

    private static final Pattern DECIMAL = Pattern.compile("[+-]?\\d+\\.\\d+");
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private final ParseContext context;
    private final boolean keepStringQuotes;

    public ExpressionParser(ParseContext context) {
        this(context, false);
    }

    // <> pronoun | determiner word | Proper Words* | word
    public Optional<Variable> tryParseVariableName(Tokens tokens) {
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        var first = tokens.peek();

        String name;
        if (PRONOUNS.contains(first.toLowerCase(Locale.ROOT))) {
            var last = context.lastParsedVariable();
            if (last.isEmpty()) {
                return Optional.empty();
            }
            tokens.skip(1);
            name = last.get();
        } else if (DETERMINERS.contains(first.toLowerCase(Locale.ROOT)) && isSimple(tokens.peek(1))) {
            name = first + "#" + tokens.peek(1);
            tokens.skip(2);
        } else if (DETERMINERS.contains(first)) {
            return Optional.empty();
        } else if (isProper(first)) {
            List<String> words = new ArrayList<>();
            while (!tokens.isEmpty() && isProper(tokens.peek())) {
                words.add(tokens.next());
            }
            name = String.join("_", words);
        } else if (isSimple(first)) {
            name = tokens.next();
        } else {
            return Optional.empty();
        }

        name = name.toLowerCase(Locale.ROOT);
        context.rememberVariable(name);
        return Optional.of(new Variable(name));
    }

    public Optional<StringConstant> tryParseStringLiteral(Tokens tokens) {
        var token = tokens.peek();
        if (token == null || token.length() < 2 || !token.startsWith("\"") || !token.endsWith("\"")) {
            return Optional.empty();
        }
        tokens.next();
        return Optional.of(new StringConstant(keepStringQuotes ? token : token.substring(1, token.length() - 1)));
    }

    public Optional<Evalable> tryParseNumericConstant(Tokens tokens) {
        var token = tokens.peek();
        if (token == null) {
            return Optional.empty();
        }
        Evalable constant;
        if (NOTHING.contains(token)) {
            constant = new IntegerConstant(0);
        } else if (TRUE.contains(token)) {
            constant = new BooleanConstant(true);
        } else if (FALSE.contains(token)) {
            constant = new BooleanConstant(false);
        } else if (DECIMAL.matcher(token).matches()) {
            constant = new FloatConstant(Double.parseDouble(token));
        } else if (INTEGER.matcher(token).matches()) {
            try {
                constant = new IntegerConstant(Long.parseLong(token));
            } catch (NumberFormatException e) {
                throw new RockstarSyntaxException("Number " + token + " is too large");
            }
        } else {
            return Optional.empty();
        }
        tokens.next();
        return Optional.of(constant);
    }

    public Optional<Operator> tryParseOperator(Tokens tokens) {
        var token = tokens.peek();
        if (token == null) {
            return Optional.empty();
        }
        var operator = switch (token) {
            case "plus", "with" -> consume(tokens, 1, Operator.ADD);
            case "minus", "without" -> consume(tokens, 1, Operator.SUB);
            case "times", "of" -> consume(tokens, 1, Operator.MUL);
            case "over" -> consume(tokens, 1, Operator.DIV);
            case "isnt", "aint" -> consume(tokens, 1, Operator.NEQ);
            case "is" -> parseComparison(tokens);
            default -> null;
        };
        return Optional.ofNullable(operator);
    }

    // <> is not | is (higher|lower...) than | is as (high|low...) as | is
    private Operator parseComparison(Tokens tokens) {
        if (tokens.size() > 2 && "not".equals(tokens.peek(1))) {
            return consume(tokens, 2, Operator.NEQ);
        }
        if (tokens.size() > 3 && (tokens.matchesAt(2, "then", "than"))) {
            if (tokens.matchesAt(1, "higher", "greater", "bigger", "stronger")) {
                return consume(tokens, 3, Operator.GT);
            }
            if (tokens.matchesAt(1, "lower", "less", "smaller", "weaker")) {
                return consume(tokens, 3, Operator.LT);
            }
        }
        if (tokens.size() > 4 && "as".equals(tokens.peek(1)) && "as".equals(tokens.peek(3))) {
            if (tokens.matchesAt(2, "high", "great", "big", "strong")) {
                return consume(tokens, 4, Operator.GEQ);
            }
            if (tokens.matchesAt(2, "low", "little", "small", "weak")) {
                return consume(tokens, 4, Operator.LEQ);
            }
        }
        return consume(tokens, 1, Operator.EQ);
    }

    private static Operator consume(Tokens tokens, int count, Operator operator) {
        tokens.skip(count);
        return operator;
    }

    /**
     * Consumes every remaining token. Tokens that fit none of the element
     * parsers are skipped.
     */
    public Expression parseExpression(Tokens tokens) {
        List<Element> elements = new ArrayList<>();
        while (!tokens.isEmpty()) {
            if ("taking".equals(tokens.peek(1))) {
                elements.add(parseCall(tokens));
                continue;
            }
            Optional<? extends Element> element = tryParseOperator(tokens);
            if (element.isEmpty()) {
                element = tryParseStringLiteral(tokens);
            }
            if (element.isEmpty()) {
                element = tryParseNumericConstant(tokens);
            }
            if (element.isEmpty()) {
                element = tryParseVariableName(tokens);
            }
            if (element.isPresent()) {
                elements.add(element.get());
            } else {
                tokens.skip(1);
            }
        }
        return new Expression(elements);
    }

    // <> name taking argument ((, | and | n) argument)*
    private Call parseCall(Tokens tokens) {
        var name = tokens.next();
        tokens.next();

        List<Expression> arguments = new ArrayList<>();
        while (!tokens.isEmpty()) {
            List<String> chunk = new ArrayList<>();
            while (!tokens.isEmpty()) {
                if (ARGUMENT_SEPARATORS.contains(tokens.peek())) {
                    tokens.next();
                    if (tokens.matches("and")) {
                        tokens.next();
                    }
                    break;
                }
                chunk.add(tokens.next());
            }
            var argument = parseExpression(new Tokens(chunk));
            if (!argument.isEmpty()) {
                arguments.add(argument);
            }
        }
        return new Call(name, arguments);
    }

    /**
     * Each word contributes the number of its letters modulo 10 as one digit.
     * The first word containing a period ends the integer part; every word
     * after it adds one decimal place. Either part must fit in a {@code long}.
     */
    public Evalable parsePoeticNumberLiteral(Tokens tokens) {
        long integer = 0;
        while (!tokens.isEmpty()) {
            var word = tokens.next();
            integer = appendDigit(integer, letterCount(word) % 10);
            if (word.contains(".")) {
                break;
            }
        }

        long decimal = 0;
        int places = 0;
        while (!tokens.isEmpty()) {
            decimal = appendDigit(decimal, letterCount(tokens.next()) % 10);
            places++;
        }

        if (places == 0) {
            return new IntegerConstant(integer);
        }
        return new FloatConstant(integer + decimal * Math.pow(10, -places));
    }

    private static long appendDigit(long number, int digit) {
        try {
            return Math.addExact(Math.multiplyExact(number, 10), digit);
        } catch (ArithmeticException e) {
            throw new RockstarSyntaxException("Poetic number literal is too large");
        }
    }

    private static int letterCount(String word) {
        int count = 0;
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (Character.isLetter(c) || c == '-') {
                count++;
            }
        }
        return count;
    }

    /** At least one cased character and no upper case ones. */
    static boolean isSimple(String token) {
        if (token == null) {
            return false;
        }
        boolean cased = false;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (Character.isUpperCase(c) || Character.isTitleCase(c)) {
                return false;
            }
            cased |= Character.isLowerCase(c);
        }
        return cased;
    }

    /**
     * Title case: upper case letters only start a word, lower case letters
     * only continue one, and there is at least one letter.
     */
    static boolean isProper(String token) {
        if (token == null) {
            return false;
        }
        boolean cased = false;
        boolean previousCased = false;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (Character.isUpperCase(c) || Character.isTitleCase(c)) {
                if (previousCased) {
                    return false;
                }
                previousCased = true;
                cased = true;
            } else if (Character.isLowerCase(c)) {
                if (!previousCased) {
                    return false;
                }
                previousCased = true;
                cased = true;
            } else {
                previousCased = false;
            }
        }
        return cased;
    }

}

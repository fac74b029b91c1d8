package com.github.musiKk.rockstar.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.musiKk.rockstar.parser.Program.End;
import com.github.musiKk.rockstar.parser.Program.FunctionDefinition;
import com.github.musiKk.rockstar.parser.Program.If;
import com.github.musiKk.rockstar.parser.Program.Loop;
import com.github.musiKk.rockstar.parser.Program.Return;
import com.github.musiKk.rockstar.parser.Program.Statement;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Nests the flat statements of a file under their block headers. A blank
 * line closes the innermost block. A {@code Give back} is only allowed
 * directly in a function body and closes that body.
 */
public class Treeifier {

    private static final Logger LOG = LoggerFactory.getLogger(Treeifier.class);

    public List<Statement> treeify(List<ParsedLine> lines) {
        var cursor = new Cursor(lines);
        List<Statement> statements = new ArrayList<>();
        // a blank line at top level only ends one pass
        while (cursor.hasNext()) {
            statements.addAll(treeifyBlock(cursor, false));
        }
        LOG.debug("treeified {} lines into {} top level statements", lines.size(), statements.size());
        return statements;
    }

    List<Statement> treeifyBlock(Cursor cursor, boolean inFunction) {
        List<Statement> block = new ArrayList<>();
        while (cursor.hasNext()) {
            var line = cursor.next();
            var statement = line.statement();
            if (statement instanceof End) {
                break;
            }
            if (statement instanceof Return) {
                if (!inFunction) {
                    throw new MisplacedStatementException("\"Give back\" statement has to be in function", line);
                }
                block.add(statement);
                break;
            }
            if (statement instanceof If ifStatement) {
                statement = ifStatement.withBlock(treeifyBlock(cursor, false));
            } else if (statement instanceof Loop loop) {
                statement = loop.withBody(treeifyBlock(cursor, false));
            } else if (statement instanceof FunctionDefinition function) {
                statement = function.withBody(treeifyBlock(cursor, true));
            }
            block.add(statement);
        }
        return block;
    }

    static class Cursor {
        final List<ParsedLine> lines;
        int index;

        Cursor(List<ParsedLine> lines) {
            this.lines = lines;
        }

        boolean hasNext() {
            return index < lines.size();
        }

        ParsedLine next() {
            return lines.get(index++);
        }
    }

    /** A statement that parsed fine on its own but is not allowed where it stands. */
    public static class MisplacedStatementException extends RockstarSyntaxException {
        @Accessors(fluent = true)
        @Getter
        private final ParsedLine line;

        public MisplacedStatementException(String message, ParsedLine line) {
            super(message);
            this.line = line;
        }
    }

}

package com.github.musiKk.rockstar.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.musiKk.rockstar.parser.Treeifier.MisplacedStatementException;

import lombok.Setter;

/**
 * Parses a whole source file line by line. A line that fails is reported and
 * skipped so that every broken line of a file shows up in one run; the file
 * is only treeified once all of its lines parsed.
 */
public class SourceParser {

    private static final Logger LOG = LoggerFactory.getLogger(SourceParser.class);

    @Setter
    private boolean keepStringQuotes;

    public ParseResult parse(String source, String fileName) {
        var lineParser = new LineParser(new ParseContext(), keepStringQuotes);

        List<ParsedLine> lines = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        var sourceLines = source.split("\n", -1);
        for (int lineNumber = 0; lineNumber < sourceLines.length; lineNumber++) {
            var line = stripCarriageReturn(sourceLines[lineNumber]);
            try {
                var statement = lineParser.parseLine(line);
                LOG.debug("{}({}): {}", fileName, lineNumber, statement);
                lines.add(new ParsedLine(lineNumber, line, statement));
            } catch (RockstarSyntaxException e) {
                diagnostics.add(new Diagnostic(fileName, lineNumber, line, e.getMessage()));
            }
        }

        if (!diagnostics.isEmpty()) {
            LOG.debug("{} lines of {} failed to parse", diagnostics.size(), fileName);
            return ParseResult.failure(diagnostics);
        }

        try {
            return ParseResult.success(new Program(new Treeifier().treeify(lines)));
        } catch (MisplacedStatementException e) {
            var line = e.line();
            return ParseResult.failure(List.of(new Diagnostic(fileName, line.lineNumber(), line.source(), e.getMessage())));
        }
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

}

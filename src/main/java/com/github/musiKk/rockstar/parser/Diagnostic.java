package com.github.musiKk.rockstar.parser;

/**
 * A syntax error located in a source file. Line numbers are 0-based.
 */
public record Diagnostic(String fileName, int lineNumber, String source, String message) {

    public String format() {
        return source + "\n"
            + "^".repeat(source.length()) + "\n"
            + fileName + "(" + lineNumber + "): SyntaxError " + message;
    }

}

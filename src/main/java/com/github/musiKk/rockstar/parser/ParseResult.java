package com.github.musiKk.rockstar.parser;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of parsing a whole file: a program when every line parsed, the
 * collected diagnostics otherwise.
 */
public record ParseResult(Optional<Program> program, List<Diagnostic> diagnostics) {

    public static ParseResult success(Program program) {
        return new ParseResult(Optional.of(program), List.of());
    }

    public static ParseResult failure(List<Diagnostic> diagnostics) {
        return new ParseResult(Optional.empty(), List.copyOf(diagnostics));
    }

    public boolean isSuccess() {
        return program.isPresent();
    }

}

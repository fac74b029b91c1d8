package com.github.musiKk.rockstar.parser;

import java.util.Optional;

import lombok.ToString;

/**
 * Parse-time state shared by every line of one source file. Pronouns resolve
 * to the variable name that was parsed last, wherever that happened.
 */
@ToString
public class ParseContext {

    private String lastParsedVariable;

    public Optional<String> lastParsedVariable() {
        return Optional.ofNullable(lastParsedVariable);
    }

    void rememberVariable(String name) {
        this.lastParsedVariable = name;
    }

}

package com.github.musiKk.rockstar.parser;

/**
 * A line that cannot be parsed, or a statement in a place where it is not
 * allowed.
 */
public class RockstarSyntaxException extends RuntimeException {

    public RockstarSyntaxException(String message) {
        super(message);
    }

}

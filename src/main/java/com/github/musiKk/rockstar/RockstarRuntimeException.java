package com.github.musiKk.rockstar;

/**
 * Fatal error while running a program. Nothing inside the interpreter
 * recovers from it.
 */
public class RockstarRuntimeException extends RuntimeException {

    public RockstarRuntimeException(String message) {
        super(message);
    }

}

package com.github.musiKk.rockstar.parser;

import com.github.musiKk.rockstar.parser.Program.Statement;

/** The flat statement of one source line together with where it came from. */
public record ParsedLine(int lineNumber, String source, Statement statement) {}

package com.github.musiKk.rockstar.natives;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

import com.github.musiKk.rockstar.Runner.BooleanValue;
import com.github.musiKk.rockstar.Runner.FloatValue;
import com.github.musiKk.rockstar.Runner.IntegerValue;
import com.github.musiKk.rockstar.Runner.MysteriousValue;
import com.github.musiKk.rockstar.Runner.StringValue;
import com.github.musiKk.rockstar.Runner.Value;

import lombok.RequiredArgsConstructor;

/**
 * The console a program talks to: {@code Listen to} reads from {@code in},
 * {@code Say} writes to {@code out}.
 */
@RequiredArgsConstructor
public class Io {

    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;

    public static Io console() {
        return new Io(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out, System.err);
    }

    public void print(Value value) {
        out.println(stringify(value));
    }

    public void print(String line) {
        out.println(line);
    }

    public void error(String line) {
        err.println(line);
    }

    /** @return the next input line, or empty once the input is exhausted */
    public Optional<String> readLine() {
        try {
            return Optional.ofNullable(in.readLine());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String stringify(Value value) {
        if (value instanceof IntegerValue iv) {
            return Long.toString(iv.number());
        } else if (value instanceof FloatValue fv) {
            return Double.toString(fv.number());
        } else if (value instanceof BooleanValue bv) {
            return String.valueOf(bv.value());
        } else if (value instanceof StringValue sv) {
            return sv.string();
        } else if (value instanceof MysteriousValue) {
            return "mysterious";
        }
        return String.valueOf(value);
    }

    /** Renders variables sorted by name, {@code {a=1, b=two}}. */
    public static String stringify(Map<String, Value> variables) {
        return new TreeMap<>(variables).entrySet().stream()
            .map(e -> e.getKey() + "=" + stringify(e.getValue()))
            .collect(Collectors.joining(", ", "{", "}"));
    }

}

package com.github.musiKk.rockstar;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a single source line into words, commas and quoted strings.
 * Parenthesized comments are dropped. An unterminated string or comment
 * at the end of the line is dropped as well.
 */
public class Tokenizer {

    private enum State {
        NORMAL,
        IN_STRING,
        IN_COMMENT
    }

    public Tokens tokenize(String line) {
        List<String> tokens = new ArrayList<>();

        State state = State.NORMAL;
        int tokenStart = 0;
        for (int index = 0; index < line.length(); index++) {
            char c = line.charAt(index);
            switch (state) {
                case NORMAL -> {
                    if (Character.isWhitespace(c)) {
                        flush(tokens, line.substring(tokenStart, index));
                        tokenStart = index + 1;
                    } else if (c == ',') {
                        flush(tokens, line.substring(tokenStart, index));
                        tokens.add(",");
                        tokenStart = index + 1;
                    } else if (c == '(') {
                        flush(tokens, line.substring(tokenStart, index));
                        state = State.IN_COMMENT;
                        tokenStart = index + 1;
                    } else if (c == '"') {
                        flush(tokens, line.substring(tokenStart, index));
                        state = State.IN_STRING;
                        // the opening quote stays part of the token
                        tokenStart = index;
                    }
                }
                case IN_STRING -> {
                    if (c == '"') {
                        tokens.add(line.substring(tokenStart, index + 1));
                        state = State.NORMAL;
                        tokenStart = index + 1;
                    }
                }
                case IN_COMMENT -> {
                    if (c == ')') {
                        state = State.NORMAL;
                        tokenStart = index + 1;
                    }
                }
            }
        }
        if (state == State.NORMAL) {
            flush(tokens, line.substring(tokenStart));
        }

        return new Tokens(tokens);
    }

    private static void flush(List<String> tokens, String pending) {
        var token = pending.strip();
        if (!token.isEmpty()) {
            tokens.add(token);
        }
    }

    /**
     * Cursor over the tokens of one line. Parsers look ahead with
     * {@link #peek(int)} and only move on once they matched.
     */
    public static class Tokens {
        final List<String> tokens;
        int index;

        public Tokens(List<String> tokens) {
            this.tokens = List.copyOf(tokens);
        }

        public static Tokens of(String... tokens) {
            return new Tokens(List.of(tokens));
        }

        public boolean isEmpty() {
            return index >= tokens.size();
        }

        public int size() {
            return tokens.size() - index;
        }

        /**
         * @return the token {@code offset} positions ahead, or {@code null}
         *         past the end of the line
         */
        public String peek(int offset) {
            int position = index + offset;
            return position < tokens.size() ? tokens.get(position) : null;
        }

        public String peek() {
            return peek(0);
        }

        public String next() {
            if (isEmpty()) {
                throw new IllegalStateException("no more tokens");
            }
            return tokens.get(index++);
        }

        public boolean matches(String... images) {
            return matchesAt(0, images);
        }

        public boolean matchesAt(int offset, String... images) {
            var token = peek(offset);
            if (token == null) {
                return false;
            }
            for (var image : images) {
                if (token.equals(image)) {
                    return true;
                }
            }
            return false;
        }

        public void skip(int count) {
            index = Math.min(tokens.size(), index + count);
        }

        /** Relative position of the next occurrence of {@code image}, or -1. */
        public int indexOf(String image) {
            for (int i = index; i < tokens.size(); i++) {
                if (tokens.get(i).equals(image)) {
                    return i - index;
                }
            }
            return -1;
        }

        /** Splits off the next {@code count} tokens into a cursor of their own. */
        public Tokens take(int count) {
            int end = Math.min(tokens.size(), index + count);
            var taken = new Tokens(tokens.subList(index, end));
            index = end;
            return taken;
        }

        public List<String> remaining() {
            return tokens.subList(index, tokens.size());
        }

        @Override
        public String toString() {
            return remaining().toString();
        }
    }

}

package com.robotlang.parser;

import java.util.Optional;
import java.util.Set;

public record Token(Type type, String text, Category category, int line, int column) {
    public enum Type {
        ASSIGN, CONST, NUMBER, IDENT,
        PIPE, LBRACKET, RBRACKET,
        COLON, DOT, COMMA
    }

    /** Vocabulary a {@code #constant} belongs to. */
    public enum Category {
        DIRECTION("north", "south", "east", "west"),
        TURN("left", "right", "around"),
        TYPE("chips", "balloons");

        private final Set<String> literals;

        Category(String... literals) {
            this.literals = Set.of(literals);
        }

        public Set<String> literals() {
            return literals;
        }

        public static Optional<Category> of(String literal) {
            for (Category c : values()) {
                if (c.literals.contains(literal)) return Optional.of(c);
            }
            return Optional.empty();
        }
    }

    public Token(Type type, String text, int line, int column) {
        this(type, text, null, line, column);
    }

    public boolean is(Type type, String text) {
        return this.type == type && this.text.equals(text);
    }

    @Override
    public String toString() {
        return type + " '" + text + "' at line " + line + ", column " + column;
    }
}

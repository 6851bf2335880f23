package com.robotlang.check;

import com.robotlang.parser.Token;

import java.util.Optional;

/** Built-in commands whose arguments must come from a constant vocabulary. */
public enum CommandRule {
    FACE("face", 0, Token.Category.DIRECTION),
    TURN("turn", 0, Token.Category.TURN),
    PUT("put", 1, Token.Category.TYPE),
    PICK("pick", 1, Token.Category.TYPE);

    private final String command;
    private final int argIndex;
    private final Token.Category category;

    CommandRule(String command, int argIndex, Token.Category category) {
        this.command = command;
        this.argIndex = argIndex;
        this.category = category;
    }

    public String command() {
        return command;
    }

    /** Zero-based position of the constrained argument. */
    public int argIndex() {
        return argIndex;
    }

    public Token.Category category() {
        return category;
    }

    public static Optional<CommandRule> forCommand(String name) {
        for (CommandRule r : values()) {
            if (r.command.equals(name)) return Optional.of(r);
        }
        return Optional.empty();
    }
}

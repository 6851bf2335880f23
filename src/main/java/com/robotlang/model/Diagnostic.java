package com.robotlang.model;

import com.robotlang.exception.RobotLangException;

public record Diagnostic(
        Stage stage,
        String message,
        Integer line,
        Integer column
) {

    public static Diagnostic from(RobotLangException e) {
        return new Diagnostic(
                e.stage(),
                e.getMessage(),
                e.line().isPresent() ? e.line().getAsInt() : null,
                e.column().isPresent() ? e.column().getAsInt() : null
        );
    }

    public boolean hasPosition() {
        return line != null;
    }

    @Override
    public String toString() {
        if (!hasPosition()) return stage + ": " + message;
        return stage + " (line " + line + ", column " + column + "): " + message;
    }
}

package com.robotlang.exception;

import com.robotlang.model.Stage;

import java.util.OptionalInt;

// line is 1-based, column 0-based
public abstract class RobotLangException extends RuntimeException {

    private final Stage stage;
    private final Integer line;
    private final Integer column;

    protected RobotLangException(Stage stage, String message, Integer line, Integer column) {
        super(message);
        this.stage = stage;
        this.line = line;
        this.column = column;
    }

    public Stage stage() {
        return stage;
    }

    public OptionalInt line() {
        return line == null ? OptionalInt.empty() : OptionalInt.of(line);
    }

    public OptionalInt column() {
        return column == null ? OptionalInt.empty() : OptionalInt.of(column);
    }
}

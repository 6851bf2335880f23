package com.robotlang.exception;

import com.robotlang.model.Stage;

public class SyntaxException extends RobotLangException {

    public SyntaxException(String message) {
        super(Stage.SYNTAX, message, null, null);
    }

    public SyntaxException(String message, int line, int column) {
        super(Stage.SYNTAX, message, line, column);
    }
}

package com.robotlang.exception;

import com.robotlang.model.Stage;

public class SemanticException extends RobotLangException {

    public SemanticException(String message) {
        super(Stage.SEMANTIC, message, null, null);
    }

    public SemanticException(String message, int line, int column) {
        super(Stage.SEMANTIC, message, line, column);
    }
}

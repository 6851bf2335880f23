package com.robotlang.exception;

import com.robotlang.model.Stage;

public class LexicalException extends RobotLangException {

    public LexicalException(String message) {
        super(Stage.LEXICAL, message, null, null);
    }

    public LexicalException(String message, int line, int column) {
        super(Stage.LEXICAL, message, line, column);
    }
}

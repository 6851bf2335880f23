package com.robotlang.exception;

import com.robotlang.model.Stage;

public class StructuralException extends RobotLangException {

    public StructuralException(String message) {
        super(Stage.STRUCTURAL, message, null, null);
    }

    public StructuralException(String message, int line, int column) {
        super(Stage.STRUCTURAL, message, line, column);
    }
}

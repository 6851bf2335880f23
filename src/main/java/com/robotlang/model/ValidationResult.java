package com.robotlang.model;

import com.robotlang.parser.RobotParser;

import java.util.Optional;

public record ValidationResult(
        boolean valid,
        Diagnostic diagnostic,
        RobotParser.Program program
) {

    public static ValidationResult accepted(RobotParser.Program program) {
        return new ValidationResult(true, null, program);
    }

    public static ValidationResult rejected(Diagnostic diagnostic) {
        return new ValidationResult(false, diagnostic, null);
    }

    public Optional<Diagnostic> failure() {
        return Optional.ofNullable(diagnostic);
    }
}

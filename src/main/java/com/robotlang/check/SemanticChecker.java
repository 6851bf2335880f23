package com.robotlang.check;

import com.robotlang.exception.SemanticException;
import com.robotlang.parser.Programs;
import com.robotlang.parser.RobotParser;

import java.util.Locale;

public final class SemanticChecker {

    private SemanticChecker() {}

    public static void check(RobotParser.Program program) {
        for (RobotParser.Call call : Programs.calls(program)) {
            CommandRule.forCommand(call.name()).ifPresent(rule -> checkCall(call, rule));
        }
    }

    private static void checkCall(RobotParser.Call call, CommandRule rule) {
        int position = rule.argIndex() + 1;
        String expected = rule.category().name().toLowerCase(Locale.ROOT)
                + " constant " + rule.category().literals().stream().sorted().map(l -> "#" + l).toList();

        RobotParser.Expr arg = Programs.arg(call, rule.argIndex()).orElseThrow(() -> new SemanticException(
                "'" + call.name() + "' needs " + position + " argument(s) but got " + call.args().size(),
                call.line(), call.column()));

        RobotParser.Const constant = Programs.constant(arg).orElseThrow(() -> new SemanticException(
                "Argument " + position + " of '" + call.name() + "' must be a " + expected
                        + " but got " + Programs.describe(arg),
                call.line(), call.column()));

        if (!rule.category().literals().contains(constant.literal())) {
            throw new SemanticException(
                    "Argument " + position + " of '" + call.name() + "' must be a " + expected
                            + " but got #" + constant.literal(),
                    call.line(), call.column());
        }
    }
}

package com.robotlang.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class Programs {

    private Programs() {}

    public static Optional<RobotParser.Expr> arg(RobotParser.Call call, int index) {
        if (call == null || index < 0 || index >= call.args().size()) return Optional.empty();
        return Optional.of(call.args().get(index));
    }

    public static Optional<RobotParser.Const> constant(RobotParser.Expr e) {
        return (e instanceof RobotParser.Const c) ? Optional.of(c) : Optional.empty();
    }

    // procedure bodies in definition order, then main; depth first
    public static List<RobotParser.Call> calls(RobotParser.Program program) {
        List<RobotParser.Call> out = new ArrayList<>();
        for (RobotParser.ProcedureDef def : program.procedures()) {
            collectCalls(def.body(), out);
        }
        collectCalls(program.main(), out);
        return out;
    }

    private static void collectCalls(RobotParser.Block block, List<RobotParser.Call> out) {
        for (RobotParser.Instruction ins : block.instructions()) {
            if (ins instanceof RobotParser.Call c) {
                out.add(c);
            } else if (ins instanceof RobotParser.While w) {
                collectCalls(w.body(), out);
            } else if (ins instanceof RobotParser.If i) {
                collectCalls(i.then(), out);
                i.otherwise().ifPresent(b -> collectCalls(b, out));
            }
        }
    }

    public static String describe(RobotParser.Expr e) {
        if (e instanceof RobotParser.Num n) return String.valueOf(n.value());
        if (e instanceof RobotParser.Var v) return v.name();
        if (e instanceof RobotParser.Const c) return "#" + c.literal();
        return String.valueOf(e);
    }
}

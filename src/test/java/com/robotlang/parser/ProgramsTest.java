package com.robotlang.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProgramsTest {

    private static RobotParser.Program parse(String source) {
        return new RobotParser(new Tokenizer(source).tokenize()).parseProgram();
    }

    @Test
    void callsAreListedProceduresFirstThenMainDepthFirst() {
        RobotParser.Program program = parse(
                "proc one [ a. while: x do: [ b. if: y then: [ c. ] else: [ d. ] ] e. ]\n"
                        + "proc two [ f. ]\n"
                        + "[ g. |v| v := 1. h ]\n");
        List<String> names = Programs.calls(program).stream().map(RobotParser.Call::name).toList();
        assertEquals(List.of("a", "b", "c", "d", "e", "f", "g", "h"), names);
    }

    @Test
    void argAndConstantAccessors() {
        RobotParser.Call call = (RobotParser.Call) parse("[ put: 2 andChips: #chips ]").main().instructions().get(0);
        assertTrue(Programs.arg(call, 0).flatMap(Programs::constant).isEmpty());
        assertEquals("chips", Programs.arg(call, 1).flatMap(Programs::constant).orElseThrow().literal());
        assertTrue(Programs.arg(call, 2).isEmpty());
        assertTrue(Programs.arg(call, -1).isEmpty());
    }

    @Test
    void describeUsesSourceSpelling() {
        assertEquals("#north", Programs.describe(new RobotParser.Const(Token.Category.DIRECTION, "north")));
        assertEquals("x", Programs.describe(new RobotParser.Var("x")));
    }
}

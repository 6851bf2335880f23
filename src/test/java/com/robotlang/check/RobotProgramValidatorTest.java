package com.robotlang.check;

import com.robotlang.config.RobotLangProperties;
import com.robotlang.model.Diagnostic;
import com.robotlang.model.Stage;
import com.robotlang.model.ValidationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class RobotProgramValidatorTest {

    private final RobotProgramValidator validator = new RobotProgramValidator();

    private Diagnostic rejection(String source) {
        ValidationResult result = validator.check(source);
        assertFalse(result.valid(), "expected rejection of: " + source);
        assertNull(result.program());
        return result.failure().orElseThrow();
    }

    @Test
    void procedureAndCall() {
        assertTrue(validator.validate("| a b c d | proc move [ forward. ] [ move. ]"));
    }

    @Test
    void threeGlobalsAreStructurallyWrong() {
        Diagnostic d = rejection("| a b c | [ ]");
        assertEquals(Stage.STRUCTURAL, d.stage());
        assertTrue(d.message().contains("exactly 4"));
    }

    @Test
    void faceNorth() {
        assertTrue(validator.validate("| a b c d | [ face: #north. ]"));
    }

    @Test
    void unknownConstantIsALexicalError() {
        Diagnostic d = rejection("| a b c d | [ face: #purple. ]");
        assertEquals(Stage.LEXICAL, d.stage());
        assertEquals(1, d.line());
        assertEquals(20, d.column());
    }

    @Test
    void labeledParameterCall() {
        assertTrue(validator.validate("| a b c d | [ put: 5 andBalloons: #chips. ]"));
    }

    @Test
    void emptyMainBlock() {
        ValidationResult result = validator.check("| a b c d | [ ]");
        assertTrue(result.valid());
        assertTrue(result.failure().isEmpty());
        assertTrue(result.program().main().instructions().isEmpty());
    }

    @Test
    void programWithoutMainBlock() {
        assertTrue(validator.validate("| a b c d | proc go [ forward ]"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"[ ]", "| | [ ]", "| a | [ ]", "| a b c | [ ]", "| a b c d e | [ ]", "| a b c d e | "})
    void globalCountOtherThanFour(String source) {
        assertEquals(Stage.STRUCTURAL, rejection(source).stage());
    }

    @Test
    void globalsAreCountedNotDeduplicated() {
        assertTrue(validator.validate("| a, a, a, a | [ ]"));
    }

    @Test
    void wrongVocabularyIsSemantic() {
        Diagnostic d = rejection("| a b c d | [ face: #left. ]");
        assertEquals(Stage.SEMANTIC, d.stage());
        assertEquals(1, d.line());
        assertEquals(14, d.column());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "| a b c d | [ turn: #east. ]",
            "| a b c d | [ put: 1. ]",
            "| a b c d | [ pick: 1 andBalloons: #around. ]",
            "| a b c d | proc p :x [ face: x. ] [ p: 1. ]"
    })
    void semanticRejections(String source) {
        assertEquals(Stage.SEMANTIC, rejection(source).stage());
    }

    @Test
    void unterminatedBlockCitesEndOfInput() {
        Diagnostic d = rejection("| a b c d | [ forward.");
        assertEquals(Stage.SYNTAX, d.stage());
        assertTrue(d.message().contains("end of input"));
        assertFalse(d.hasPosition());
    }

    @Test
    void trailingTokensAreRejected() {
        Diagnostic d = rejection("| a b c d | [ ] foo");
        assertEquals(Stage.STRUCTURAL, d.stage());
        assertTrue(d.message().contains("foo"));
        assertEquals(16, d.column());
    }

    @Test
    void globalCountIsCheckedBeforeTrailingTokens() {
        Diagnostic d = rejection("| a b c | [ ] ]");
        assertTrue(d.message().contains("global"));
    }

    @Test
    void syntaxErrorsCarryPosition() {
        Diagnostic d = rejection("| a b c d |\n[ x := 5 ]");
        assertEquals(Stage.SYNTAX, d.stage());
        assertEquals(2, d.line());
        assertEquals(9, d.column());
    }

    @Test
    void fullProgram() {
        String source = "| nom, x, y, one |\n"
                + "proc putCB :c andBalloons :b [\n"
                + "    put: c ofType: #chips.\n"
                + "    put: b ofType: #balloons\n"
                + "]\n"
                + "proc goNorth [\n"
                + "    while: canMove: 1 inDir: #north do: [ move: 1 inDir: #north. ]\n"
                + "]\n"
                + "[\n"
                + "    |local|\n"
                + "    local := 3.\n"
                + "    if: facing: #west then: [ turn: #right. ] else: [ face: #east. ]\n"
                + "    putCB: 1 andBalloons: local.\n"
                + "    goNorth\n"
                + "]\n";
        assertTrue(validator.validate(source));
    }

    @Test
    void sameSourceSameResult() {
        String bad = "| a b c d | [ turn: #north. ]";
        assertEquals(validator.check(bad), validator.check(bad));

        String good = "| a b c d | [ turn: #left. ]";
        assertEquals(validator.check(good), validator.check(good));
    }

    @Test
    void validatorCanBeSharedAcrossThreads() {
        List<String> sources = List.of(
                "| a b c d | [ face: #north. ]",
                "| a b c | [ ]",
                "| a b c d | [ face: #left. ]",
                "| a b c d | [ forward.");
        List<Boolean> expected = List.of(true, false, false, false);

        List<Boolean> actual = IntStream.range(0, 400).parallel()
                .mapToObj(i -> validator.validate(sources.get(i % 4)) == expected.get(i % 4))
                .toList();
        assertFalse(actual.contains(false));
    }

    @Test
    void duplicateProceduresAllowedByDefault() {
        assertTrue(validator.validate("| a b c d | proc go [ a. ] proc go [ b. ] [ go. ]"));
    }

    @Test
    void duplicateProceduresRejectedWhenConfigured() {
        var strict = new RobotProgramValidator(new RobotLangProperties(4, true, 0, 256));
        ValidationResult result = strict.check("| a b c d | proc go [ a. ]\nproc go [ b. ] [ go. ]");
        assertFalse(result.valid());
        assertEquals(Stage.STRUCTURAL, result.diagnostic().stage());
        assertEquals(2, result.diagnostic().line());
    }

    @Test
    void requiredGlobalCountIsConfigurable() {
        var two = new RobotProgramValidator(new RobotLangProperties(2, false, 0, 256));
        assertTrue(two.validate("| a b | [ ]"));
        assertFalse(two.validate("| a b c d | [ ]"));
    }

    @Test
    void longProgramsAreAcceptedByDefault() {
        String source = "| a b c d | [ " + "forward. ".repeat(20_000) + "]";
        assertTrue(source.length() > 100_000);
        assertTrue(validator.validate(source));
    }

    @Test
    void sourceLengthLimitIsOptIn() {
        var small = new RobotProgramValidator(new RobotLangProperties(4, false, 10, 256));
        Diagnostic d = small.check("| a b c d | [ $ ]").diagnostic();
        assertEquals(Stage.STRUCTURAL, d.stage());
    }

    @Test
    void deeplyNestedBlocksAreRejectedNotThrown() {
        String source = "| a b c d | [ " + "while:x do:[".repeat(3000) + "]".repeat(3000) + "]";
        ValidationResult result = assertDoesNotThrow(() -> validator.check(source));
        assertFalse(result.valid());
        assertEquals(Stage.STRUCTURAL, result.diagnostic().stage());
        assertEquals(1, result.diagnostic().line());
        assertFalse(validator.validate(source));
    }

    @Test
    void nestingUpToTheLimitIsAccepted() {
        // the main block is level 1
        String source = "| a b c d | [ " + "if: x then: [".repeat(255) + "face: #north" + "]".repeat(255) + "]";
        assertTrue(validator.validate(source));

        String deeper = "| a b c d | [ " + "if: x then: [".repeat(256) + "]".repeat(256) + "]";
        assertEquals(Stage.STRUCTURAL, validator.check(deeper).diagnostic().stage());
    }
}

package com.robotlang.check;

import com.robotlang.config.RobotLangProperties;
import com.robotlang.exception.RobotLangException;
import com.robotlang.exception.StructuralException;
import com.robotlang.model.Diagnostic;
import com.robotlang.model.ValidationResult;
import com.robotlang.parser.RobotParser;
import com.robotlang.parser.Token;
import com.robotlang.parser.Tokenizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class RobotProgramValidator {

    private static final Logger logger = LoggerFactory.getLogger(RobotProgramValidator.class);

    private final RobotLangProperties properties;

    public RobotProgramValidator() {
        this(new RobotLangProperties());
    }

    public RobotProgramValidator(RobotLangProperties properties) {
        this.properties = properties;
    }

    public boolean validate(String source) {
        return check(source).valid();
    }

    public ValidationResult check(String source) {
        try {
            return ValidationResult.accepted(run(source));
        } catch (RobotLangException e) {
            Diagnostic diagnostic = Diagnostic.from(e);
            logger.debug("Program rejected: {}", diagnostic);
            return ValidationResult.rejected(diagnostic);
        }
    }

    private RobotParser.Program run(String source) {
        if (properties.maxSourceLength() > 0 && source.length() > properties.maxSourceLength()) {
            throw new StructuralException("Source is " + source.length()
                    + " characters long, the limit is " + properties.maxSourceLength());
        }

        List<Token> tokens = new Tokenizer(source).tokenize();
        logger.trace("Tokenized {} tokens", tokens.size());

        RobotParser parser = new RobotParser(tokens, properties.maxNestingDepth());
        RobotParser.Program program = parser.parseProgram();

        if (program.variables().size() != properties.requiredGlobals()) {
            throw new StructuralException("The global variable declaration must have exactly "
                    + properties.requiredGlobals() + " identifiers but has " + program.variables().size());
        }

        if (!parser.isAtEnd()) {
            Token extra = parser.current().orElseThrow();
            throw new StructuralException("Extra tokens at the end of the input, starting with '"
                    + extra.text() + "'", extra.line(), extra.column());
        }

        if (properties.rejectDuplicateProcedures()) {
            checkUniqueProcedures(program);
        }

        SemanticChecker.check(program);
        return program;
    }

    private static void checkUniqueProcedures(RobotParser.Program program) {
        Set<String> seen = new HashSet<>();
        for (RobotParser.ProcedureDef def : program.procedures()) {
            if (!seen.add(def.name())) {
                throw new StructuralException("Procedure '" + def.name() + "' is defined more than once",
                        def.line(), def.column());
            }
        }
    }
}

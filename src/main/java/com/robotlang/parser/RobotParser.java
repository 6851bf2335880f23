package com.robotlang.parser;

import com.robotlang.exception.StructuralException;
import com.robotlang.exception.SyntaxException;

import java.math.BigInteger;
import java.util.*;

import static com.robotlang.parser.Token.Type.*;

public class RobotParser {

    public static final int DEFAULT_MAX_DEPTH = 256;

    public record Program(List<String> variables, List<ProcedureDef> procedures, Block main) {
        public Program {
            variables = List.copyOf(variables);
            procedures = List.copyOf(procedures);
        }

        /** Procedures by name; a later definition replaces an earlier one of the same name. */
        public Map<String, ProcedureDef> procedureTable() {
            Map<String, ProcedureDef> table = new LinkedHashMap<>();
            for (ProcedureDef def : procedures) table.put(def.name(), def);
            return table;
        }
    }

    public record ProcedureDef(String name, List<String> params, Block body, int line, int column) {
        public ProcedureDef {
            params = List.copyOf(params);
        }
    }

    public record Block(List<Instruction> instructions) {
        public Block {
            instructions = List.copyOf(instructions);
        }

        public static Block empty() {
            return new Block(List.of());
        }
    }

    public sealed interface Instruction permits VarDecl, Assign, Call, While, If {}

    public record VarDecl(List<String> names) implements Instruction {
        public VarDecl {
            names = List.copyOf(names);
        }
    }

    public record Assign(String target, Expr value) implements Instruction {}

    public record Call(String name, List<Expr> args, int line, int column) implements Instruction {
        public Call {
            args = List.copyOf(args);
        }
    }

    /** The condition is kept as the flat list of expressions between the keyword and "do". */
    public record While(List<Expr> condition, Block body) implements Instruction {
        public While {
            condition = List.copyOf(condition);
        }
    }

    public record If(List<Expr> condition, Block then, Optional<Block> otherwise) implements Instruction {
        public If {
            condition = List.copyOf(condition);
        }
    }

    public sealed interface Expr permits Num, Var, Const {}

    public record Num(BigInteger value) implements Expr {}
    public record Var(String name) implements Expr {}
    public record Const(Token.Category category, String literal) implements Expr {}

    private final List<Token> tokens;
    private final int maxDepth;
    private int p = 0;
    private int depth = 0;

    public RobotParser(List<Token> tokens) {
        this(tokens, DEFAULT_MAX_DEPTH);
    }

    public RobotParser(List<Token> tokens, int maxDepth) {
        this.tokens = List.copyOf(tokens);
        this.maxDepth = maxDepth;
    }

    // Stops quietly at a top-level token no production starts with; see isAtEnd().
    public Program parseProgram() {
        List<String> variables = peek(PIPE) ? parseVarDecl() : List.of();

        List<ProcedureDef> procedures = new ArrayList<>();
        while (peekKeyword("proc")) {
            procedures.add(parseProcedure());
        }

        Block main = peek(LBRACKET) ? parseBlock() : Block.empty();
        return new Program(variables, procedures, main);
    }

    public boolean isAtEnd() {
        return p >= tokens.size();
    }

    public int position() {
        return p;
    }

    public Optional<Token> current() {
        return isAtEnd() ? Optional.empty() : Optional.of(tokens.get(p));
    }

    private List<String> parseVarDecl() {
        expect(PIPE);
        List<String> names = new ArrayList<>();
        while (peek(IDENT)) {
            names.add(expect(IDENT).text());
            if (peek(COMMA)) p++;
        }
        expect(PIPE);
        return names;
    }

    private ProcedureDef parseProcedure() {
        Token proc = expectKeyword("proc");
        String name = expect(IDENT, "procedure name after 'proc'").text();

        List<String> params = new ArrayList<>();
        while (true) {
            if (peek(COLON)) {
                p++;
                params.add(expect(IDENT, "parameter name after ':'").text());
            } else if (peek(IDENT) && tokens.get(p).text().startsWith("and")) {
                p++;
                expect(COLON);
                params.add(expect(IDENT, "parameter name after label").text());
            } else {
                break;
            }
        }

        Block body = parseBlock();
        return new ProcedureDef(name, params, body, proc.line(), proc.column());
    }

    private Block parseBlock() {
        Token open = expect(LBRACKET);
        if (++depth > maxDepth) {
            throw new StructuralException("Blocks are nested more than " + maxDepth + " levels deep",
                    open.line(), open.column());
        }
        List<Instruction> instructions = new ArrayList<>();
        while (!isAtEnd() && !peek(RBRACKET)) {
            instructions.add(parseInstruction());
        }
        expect(RBRACKET);
        depth--;
        return new Block(instructions);
    }

    private Instruction parseInstruction() {
        if (peek(PIPE)) return new VarDecl(parseVarDecl());
        if (peekKeyword("while")) return parseWhile();
        if (peekKeyword("if")) return parseIf();
        if (peek(IDENT) && peekNext(ASSIGN)) return parseAssign();
        return parseCall();
    }

    private Assign parseAssign() {
        String target = expect(IDENT).text();
        expect(ASSIGN);
        Expr value = parseExpr();
        expect(DOT);
        return new Assign(target, value);
    }

    private Call parseCall() {
        Token name = expect(IDENT, "procedure name in procedure call");

        List<Expr> args = new ArrayList<>();
        while (!isAtEnd()) {
            if (peek(COLON)) {
                p++;
                args.add(parseExpr());
            } else if (peek(IDENT) && peekNext(COLON)) {
                p++; // label
                expect(COLON);
                args.add(parseExpr());
            } else {
                break;
            }
        }

        if (peek(DOT)) {
            p++;
        } else if (!isAtEnd() && !peek(RBRACKET)) {
            throw unexpected("'.' or ']' after call to '" + name.text() + "'");
        }
        return new Call(name.text(), args, name.line(), name.column());
    }

    private While parseWhile() {
        expectKeyword("while");
        expect(COLON);
        List<Expr> condition = parseCondition("do");
        expectKeyword("do");
        expect(COLON);
        return new While(condition, parseBlock());
    }

    private If parseIf() {
        expectKeyword("if");
        expect(COLON);
        List<Expr> condition = parseCondition("then");
        expectKeyword("then");
        expect(COLON);
        Block then = parseBlock();

        Optional<Block> otherwise = Optional.empty();
        if (peekKeyword("else")) {
            p++;
            expect(COLON);
            otherwise = Optional.of(parseBlock());
        }
        return new If(condition, then, otherwise);
    }

    // First expression is read unconditionally, the rest up to the closing keyword.
    private List<Expr> parseCondition(String keyword) {
        List<Expr> parts = new ArrayList<>();
        parts.add(parseExpr());
        while (!isAtEnd() && !peekKeyword(keyword)) {
            if (peek(COLON)) p++;
            parts.add(parseExpr());
        }
        return parts;
    }

    private Expr parseExpr() {
        if (peek(NUMBER)) return new Num(new BigInteger(expect(NUMBER).text()));
        if (peek(IDENT)) return new Var(expect(IDENT).text());
        if (peek(CONST)) {
            Token t = expect(CONST);
            return new Const(t.category(), t.text().substring(1));
        }
        throw unexpected("an expression (number, identifier or constant)");
    }

    private Token expect(Token.Type type) {
        return expect(type, null, describe(type));
    }

    private Token expect(Token.Type type, String what) {
        return expect(type, null, what);
    }

    private Token expectKeyword(String keyword) {
        return expect(IDENT, keyword, "'" + keyword + "'");
    }

    private Token expect(Token.Type type, String text, String what) {
        if (isAtEnd()) {
            throw new SyntaxException("Expected " + what + " but found end of input");
        }
        Token t = tokens.get(p);
        if (t.type() != type || (text != null && !t.text().equals(text))) {
            throw unexpected(what);
        }
        p++;
        return t;
    }

    private SyntaxException unexpected(String what) {
        if (isAtEnd()) {
            return new SyntaxException("Expected " + what + " but found end of input");
        }
        Token t = tokens.get(p);
        return new SyntaxException(
                "Expected " + what + " but got " + t.type() + " '" + t.text() + "'",
                t.line(), t.column());
    }

    private boolean peek(Token.Type type) {
        return !isAtEnd() && tokens.get(p).type() == type;
    }

    private boolean peekKeyword(String keyword) {
        return !isAtEnd() && tokens.get(p).is(IDENT, keyword);
    }

    private boolean peekNext(Token.Type type) {
        if (p + 1 >= tokens.size()) return false;
        return tokens.get(p + 1).type() == type;
    }

    private static String describe(Token.Type type) {
        return switch (type) {
            case ASSIGN -> "':='";
            case CONST -> "a constant";
            case NUMBER -> "a number";
            case IDENT -> "an identifier";
            case PIPE -> "'|'";
            case LBRACKET -> "'['";
            case RBRACKET -> "']'";
            case COLON -> "':'";
            case DOT -> "'.'";
            case COMMA -> "','";
        };
    }
}

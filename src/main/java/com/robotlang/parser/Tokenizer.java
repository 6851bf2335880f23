package com.robotlang.parser;

import com.robotlang.exception.LexicalException;

import java.util.ArrayList;
import java.util.List;

import static com.robotlang.parser.Token.Type.*;


public class Tokenizer {
    private final String s;
    private int i = 0;
    private int line = 1;
    private int lineStart = 0;

    public Tokenizer(String s) {
        this.s = s;
    }

    public List<Token> tokenize() {
        List<Token> out = new ArrayList<>();
        while (true) {
            skipWhiteSpace();
            if (i >= s.length()) {
                return out;
            }

            char c = s.charAt(i);

            // ":=" has to win over ":"
            if (c == ':' && i + 1 < s.length() && s.charAt(i + 1) == '=') {
                out.add(single(ASSIGN, 2));
                continue;
            }
            if (c == '#') {
                out.add(readConstant());
                continue;
            }
            if (isDigit(c)) {
                out.add(readNumber());
                continue;
            }
            if (isIdentStart(c)) {
                out.add(readIdent());
                continue;
            }

            switch (c) {
                case '|' -> out.add(single(PIPE, 1));
                case '[' -> out.add(single(LBRACKET, 1));
                case ']' -> out.add(single(RBRACKET, 1));
                case ':' -> out.add(single(COLON, 1));
                case '.' -> out.add(single(DOT, 1));
                case ',' -> out.add(single(COMMA, 1));
                default -> throw new LexicalException(
                        "Unexpected character '" + c + "' on line " + line, line, column());
            }
        }
    }

    private void skipWhiteSpace() {
        while (i < s.length()) {
            char c = s.charAt(i);

            if (c == '\n') {
                i++;
                line++;
                lineStart = i;
                continue;
            }

            if (c != ' ' && c != '\t') return;
            i++;
        }
    }

    private Token single(Token.Type type, int length) {
        Token t = new Token(type, s.substring(i, i + length), line, column());
        i += length;
        return t;
    }

    private Token readConstant() {
        int col = column();
        int j = i + 1;
        if (j < s.length() && isIdentStart(s.charAt(j))) {
            j++;
            while (j < s.length() && isIdentPart(s.charAt(j))) j++;
        }
        String text = s.substring(i, j);
        if (text.length() == 1) {
            throw new LexicalException("Expected a constant name after '#' on line " + line, line, col);
        }

        String literal = text.substring(1);
        Token.Category category = Token.Category.of(literal).orElseThrow(() ->
                new LexicalException("Unknown constant '" + text + "' on line " + line, line, col));
        i = j;
        return new Token(CONST, text, category, line, col);
    }

    private Token readNumber() {
        int col = column();
        int j = i;
        while (j < s.length() && isDigit(s.charAt(j))) j++;
        String num = s.substring(i, j);
        i = j;
        return new Token(NUMBER, num, line, col);
    }

    private Token readIdent() {
        int col = column();
        int j = i;
        while (j < s.length() && isIdentPart(s.charAt(j))) j++;
        String ident = s.substring(i, j);
        i = j;
        return new Token(IDENT, ident, line, col);
    }

    private int column() {
        return i - lineStart;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || isDigit(c);
    }
}

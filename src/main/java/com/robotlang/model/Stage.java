package com.robotlang.model;

/** Pipeline stage a program was rejected in. */
public enum Stage {
    LEXICAL,
    SYNTAX,
    STRUCTURAL,
    SEMANTIC
}

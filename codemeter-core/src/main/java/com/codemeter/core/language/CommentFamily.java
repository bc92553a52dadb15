package com.codemeter.core.language;

/**
 * Lexical comment profile shared by a group of languages.
 */
public enum CommentFamily {
    /** {@code //} line comments, {@code /* ... *}{@code /} block comments, quoted strings. */
    C_STYLE,
    /** {@code #} line comments. */
    HASH,
    /** {@code --} line comments. */
    DOUBLE_DASH,
    /** {@code ;} line comments. */
    SEMICOLON,
    /** {@code %} line comments. */
    PERCENT,
    /** {@code <!-- ... -->} block comments, no string literals. */
    XML,
    /** No comment syntax recognized; lines are blank or code. */
    NONE
}

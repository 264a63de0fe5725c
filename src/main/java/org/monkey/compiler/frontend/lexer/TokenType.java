package org.monkey.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Structural tokens.
    /** The '=' character. */
    ASSIGN,
    /** The ',' character, separating parameters and arguments. */
    COMMA,
    /** The ';' character, ending a statement. */
    SEMICOLON,
    /** The '(' character. */
    LPAREN,
    /** The ')' character. */
    RPAREN,
    /** The '{' character. */
    LBRACE,
    /** The '}' character. */
    RBRACE,

    // Arithmetic operators.
    /** The '+' character. */
    PLUS,
    /** The '-' character. Negative literals are scanned as MINUS followed by INT. */
    MINUS,
    /** The '*' character. */
    ASTERISK,
    /** The '/' character. */
    SLASH,

    // Single-character comparators.
    /** The '<' character. */
    LT,
    /** The '>' character. */
    GT,
    /** The '!' character. */
    BANG,

    // Two-character comparators.
    /** The "&lt;=" operator. */
    LTE,
    /** The "&gt;=" operator. */
    GTE,
    /** The "==" operator. */
    EQ,
    /** The "!=" operator. */
    NOT_EQ,

    // Literals.
    /** An identifier, such as a variable or function name. */
    IDENT,
    /** A non-negative decimal integer literal that fits into a {@code long}. */
    INT,

    // Keywords.
    /** The "fn" keyword. */
    FUNCTION,
    /** The "let" keyword. */
    LET,
    /** The "true" keyword. */
    TRUE,
    /** The "false" keyword. */
    FALSE,
    /** The "if" keyword. */
    IF,
    /** The "else" keyword. */
    ELSE,
    /** The "return" keyword. */
    RETURN,

    // Miscellaneous.
    /** An unrecognized character or an integer literal outside the {@code long} range. */
    ILLEGAL,
    /** Represents the end of the input. Returned again on every further call. */
    END_OF_FILE
}

package org.monkey.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., IDENT, INT, LET).
 * @param lexeme The exact characters of the source that make up the token. Empty for END_OF_FILE.
 * @param value The integer value of an INT token, {@code null} for every other type.
 * @param position The offset of the token's first character in the source.
 * @param line The line number where the token was found, starting at 1.
 * @param column The column number where the token begins, starting at 1.
 */
public record Token(
        TokenType type,
        SourceSpan lexeme,
        Long value,
        int position,
        int line,
        int column
) {

    /**
     * Returns the token's lexeme as a string. Allocates a new string on every call.
     * @return The source text of the token.
     */
    public String text() {
        return lexeme.toString();
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * Renders the token followed by its line and column, e.g. {@code IDENT("x") @ 1:5}.
     * @return The token with its position.
     */
    public String describe() {
        return this + " @ " + line + ":" + column;
    }

    /**
     * Renders the token the way the REPL prints it: the type name, followed by the
     * payload in parentheses for identifiers, integers and illegal input.
     */
    @Override
    public String toString() {
        return switch (type) {
            case IDENT, ILLEGAL -> type + "(\"" + lexeme + "\")";
            case INT -> type + "(" + value + ")";
            default -> type.name();
        };
    }
}

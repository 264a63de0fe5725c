package org.monkey.compiler.frontend.lexer;

import org.monkey.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Tokens are pulled one at a time with {@link #nextToken()}. Once the input is exhausted every
 * further call returns an {@link TokenType#END_OF_FILE} token. Unrecognized characters and
 * integer literals outside the {@code long} range become {@link TokenType#ILLEGAL} tokens and
 * are reported to the {@link DiagnosticsEngine}; no input makes the lexer throw.
 * <p>
 * A Lexer is not thread-safe.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "fn", TokenType.FUNCTION,
            "let", TokenType.LET,
            "true", TokenType.TRUE,
            "false", TokenType.FALSE,
            "if", TokenType.IF,
            "else", TokenType.ELSE,
            "return", TokenType.RETURN
    );
    private static final int LONGEST_KEYWORD = 6;

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;

    // Cursor: ch is the code point at position, readPosition is the offset right after it.
    private int position = 0;
    private int readPosition = 0;
    private int ch;
    private boolean atEnd = false;
    private int line = 1;
    private int column = 0;

    // Where the token being scanned begins.
    private int start;
    private int startLine;
    private int startColumn;

    /**
     * Creates a new Lexer that collects its diagnostics in a private engine.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this(source, new DiagnosticsEngine());
    }

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the source being scanned, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = Objects.requireNonNull(source, "source");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.logicalFileName = logicalFileName;
        readChar();
    }

    /**
     * Skips whitespace and scans exactly one token.
     * @return The next token, or END_OF_FILE once the input is exhausted.
     */
    public Token nextToken() {
        skipWhitespace();
        start = position;
        startLine = line;
        startColumn = column;

        if (atEnd) {
            return makeToken(TokenType.END_OF_FILE);
        }

        return switch (ch) {
            case ',' -> single(TokenType.COMMA);
            case ';' -> single(TokenType.SEMICOLON);
            case '(' -> single(TokenType.LPAREN);
            case ')' -> single(TokenType.RPAREN);
            case '{' -> single(TokenType.LBRACE);
            case '}' -> single(TokenType.RBRACE);
            case '+' -> single(TokenType.PLUS);
            case '-' -> single(TokenType.MINUS);
            case '*' -> single(TokenType.ASTERISK);
            case '/' -> single(TokenType.SLASH);
            case '<' -> withOptionalEquals(TokenType.LT, TokenType.LTE);
            case '>' -> withOptionalEquals(TokenType.GT, TokenType.GTE);
            case '!' -> withOptionalEquals(TokenType.BANG, TokenType.NOT_EQ);
            case '=' -> withOptionalEquals(TokenType.ASSIGN, TokenType.EQ);
            default -> {
                if (Character.isAlphabetic(ch)) {
                    yield word();
                } else if (isDigit(ch)) {
                    yield integer();
                }
                yield illegal();
            }
        };
    }

    /**
     * Scans the remaining input.
     * @return An unmodifiable list of the tokens, ending with END_OF_FILE.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (!token.is(TokenType.END_OF_FILE));
        return Collections.unmodifiableList(tokens);
    }

    /**
     * Returns a lazy stream over the remaining tokens. The stream ends with the first
     * END_OF_FILE token, which it includes.
     * @return A sequential stream of tokens.
     */
    public Stream<Token> tokens() {
        Spliterator<Token> spliterator = new Spliterators.AbstractSpliterator<>(
                Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL) {
            private boolean done = false;

            @Override
            public boolean tryAdvance(Consumer<? super Token> action) {
                if (done) {
                    return false;
                }
                Token token = nextToken();
                done = token.is(TokenType.END_OF_FILE);
                action.accept(token);
                return true;
            }
        };
        return StreamSupport.stream(spliterator, false);
    }

    private Token single(TokenType type) {
        readChar();
        return makeToken(type);
    }

    private Token withOptionalEquals(TokenType oneChar, TokenType twoChar) {
        if (peekIs('=')) {
            readChar();
            readChar();
            return makeToken(twoChar);
        }
        readChar();
        return makeToken(oneChar);
    }

    private Token word() {
        while (!atEnd && (Character.isAlphabetic(ch) || ch == '_')) {
            readChar();
        }
        TokenType type = TokenType.IDENT;
        if (position - start <= LONGEST_KEYWORD) {
            type = KEYWORDS.getOrDefault(source.substring(start, position), TokenType.IDENT);
        }
        return makeToken(type);
    }

    private Token integer() {
        while (!atEnd && isDigit(ch)) {
            readChar();
        }
        try {
            long value = Long.parseLong(source, start, position, 10);
            return makeToken(TokenType.INT, value);
        } catch (NumberFormatException e) {
            diagnostics.reportError("Integer literal out of range: " + source.substring(start, position),
                    logicalFileName, startLine, startColumn);
            return makeToken(TokenType.ILLEGAL);
        }
    }

    private Token illegal() {
        String offending = new String(Character.toChars(ch));
        readChar();
        diagnostics.reportError("Unexpected character: '" + offending + "'", logicalFileName, startLine, startColumn);
        return makeToken(TokenType.ILLEGAL);
    }

    private void skipWhitespace() {
        while (!atEnd && isWhitespace(ch)) {
            readChar();
        }
    }

    /**
     * Moves the cursor one code point forward. At the end of the input the cursor stays put,
     * so repeated calls are harmless.
     */
    private void readChar() {
        if (atEnd) {
            return;
        }
        if (ch == '\n') {
            line++;
            column = 0;
        }
        position = readPosition;
        column++;
        if (readPosition >= source.length()) {
            atEnd = true;
            ch = 0;
            return;
        }
        ch = source.codePointAt(readPosition);
        readPosition += Character.charCount(ch);
    }

    private boolean peekIs(char expected) {
        return readPosition < source.length() && source.charAt(readPosition) == expected;
    }

    private Token makeToken(TokenType type) {
        return makeToken(type, null);
    }

    private Token makeToken(TokenType type, Long value) {
        return new Token(type, SourceSpan.of(source, start, position), value, start, startLine, startColumn);
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWhitespace(int c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }
}

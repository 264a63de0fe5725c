package org.monkey.compiler.frontend;

import org.monkey.compiler.diagnostics.Diagnostic;
import org.monkey.compiler.diagnostics.DiagnosticsEngine;
import org.monkey.compiler.frontend.lexer.Lexer;
import org.monkey.compiler.frontend.lexer.Token;
import org.monkey.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that the lexer converts source strings into the expected token stream,
 * including operator disambiguation, keyword classification and the handling of bad input.
 */
@Tag("unit")
public class LexerTest {

    private static List<String> render(String source) {
        return new Lexer(source).scanTokens().stream()
                .map(Token::toString)
                .collect(Collectors.toList());
    }

    /**
     * Scans a small program covering keywords, operators, identifiers and integers.
     */
    @Test
    void testProgramTokenization() {
        // Arrange
        String source = String.join("\n",
                "let five = 5;",
                "let ten = 10;",
                "",
                "let add = fn(x, y) {",
                "    x + y;",
                "};",
                "",
                "let result = add(five, ten);",
                "!-/*5;",
                "5 < 10 > 5;",
                "",
                "if (5 < 10) {",
                "    return true;",
                "} else {",
                "    return false;",
                "}",
                "",
                "10 != 9;",
                "10 == 10;",
                "");
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer(source, diagnostics);

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::toString).containsExactly(
                "LET", "IDENT(\"five\")", "ASSIGN", "INT(5)", "SEMICOLON",
                "LET", "IDENT(\"ten\")", "ASSIGN", "INT(10)", "SEMICOLON",
                "LET", "IDENT(\"add\")", "ASSIGN", "FUNCTION", "LPAREN", "IDENT(\"x\")", "COMMA", "IDENT(\"y\")", "RPAREN", "LBRACE",
                "IDENT(\"x\")", "PLUS", "IDENT(\"y\")", "SEMICOLON",
                "RBRACE", "SEMICOLON",
                "LET", "IDENT(\"result\")", "ASSIGN", "IDENT(\"add\")", "LPAREN", "IDENT(\"five\")", "COMMA", "IDENT(\"ten\")", "RPAREN", "SEMICOLON",
                "BANG", "MINUS", "SLASH", "ASTERISK", "INT(5)", "SEMICOLON",
                "INT(5)", "LT", "INT(10)", "GT", "INT(5)", "SEMICOLON",
                "IF", "LPAREN", "INT(5)", "LT", "INT(10)", "RPAREN", "LBRACE",
                "RETURN", "TRUE", "SEMICOLON",
                "RBRACE", "ELSE", "LBRACE",
                "RETURN", "FALSE", "SEMICOLON",
                "RBRACE",
                "INT(10)", "NOT_EQ", "INT(9)", "SEMICOLON",
                "INT(10)", "EQ", "INT(10)", "SEMICOLON",
                "END_OF_FILE");
    }

    @Test
    void testLetStatement() {
        List<Token> tokens = new Lexer("let five = 5;").scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.LET, TokenType.IDENT, TokenType.ASSIGN, TokenType.INT, TokenType.SEMICOLON, TokenType.END_OF_FILE);
        assertThat(tokens.get(1).text()).isEqualTo("five");
        assertThat(tokens.get(3).value()).isEqualTo(5L);
    }

    @Test
    void testNotEqualComparison() {
        assertThat(render("10 != 9;")).containsExactly("INT(10)", "NOT_EQ", "INT(9)", "SEMICOLON", "END_OF_FILE");
    }

    @Test
    void testChainedComparison() {
        assertThat(render("5 < 10 > 5;"))
                .containsExactly("INT(5)", "LT", "INT(10)", "GT", "INT(5)", "SEMICOLON", "END_OF_FILE");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   \n\t ", "\r\n\r\n", "  "})
    void testEmptyOrWhitespaceOnlyInput(String source) {
        assertThat(render(source)).containsExactly("END_OF_FILE");
    }

    @Test
    void testIllegalCharacterIsReportedAndSkipped() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer("@", diagnostics, "input.mk");

        // Act
        Token illegal = lexer.nextToken();
        Token end = lexer.nextToken();

        // Assert
        assertThat(illegal.type()).isEqualTo(TokenType.ILLEGAL);
        assertThat(illegal.text()).isEqualTo("@");
        assertThat(end.type()).isEqualTo(TokenType.END_OF_FILE);
        assertThat(end.position()).isEqualTo(1);
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::type, Diagnostic::message, Diagnostic::fileName, Diagnostic::lineNumber, Diagnostic::column)
                .containsExactly(Diagnostic.Type.ERROR, "Unexpected character: '@'", "input.mk", 1, 1);
    }

    @Test
    void testScanningContinuesAfterIllegalCharacters() {
        assertThat(render("a $ b # 1"))
                .containsExactly("IDENT(\"a\")", "ILLEGAL(\"$\")", "IDENT(\"b\")", "ILLEGAL(\"#\")", "INT(1)", "END_OF_FILE");
    }

    @Test
    void testEndOfFileIsRepeated() {
        Lexer lexer = new Lexer("x");
        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.IDENT);
        for (int i = 0; i < 5; i++) {
            Token token = lexer.nextToken();
            assertThat(token.type()).isEqualTo(TokenType.END_OF_FILE);
            assertThat(token.position()).isEqualTo(1);
            assertThat(token.text()).isEmpty();
        }
    }

    @ParameterizedTest
    @CsvSource({
            "fn, FUNCTION",
            "let, LET",
            "true, TRUE",
            "false, FALSE",
            "if, IF",
            "else, ELSE",
            "return, RETURN"
    })
    void testKeywordsAreNeverIdentifiers(String spelling, TokenType expected) {
        List<Token> tokens = new Lexer(spelling).scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(expected, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).text()).isEqualTo(spelling);
    }

    @ParameterizedTest
    @ValueSource(strings = {"f", "fun", "lets", "True", "IF", "elsewhere", "returns", "foo_bar", "x__", "café"})
    void testOtherWordsAreIdentifiers(String word) {
        List<Token> tokens = new Lexer(word).scanTokens();

        assertThat(tokens).hasSize(2);
        assertThat(tokens.get(0).type()).isEqualTo(TokenType.IDENT);
        assertThat(tokens.get(0).text()).isEqualTo(word);
    }

    @Test
    void testIdentifierMustStartWithLetter() {
        assertThat(render("_x")).containsExactly("ILLEGAL(\"_\")", "IDENT(\"x\")", "END_OF_FILE");
    }

    @Test
    void testDigitsEndAnIdentifier() {
        assertThat(render("x1 2y")).containsExactly("IDENT(\"x\")", "INT(1)", "INT(2)", "IDENT(\"y\")", "END_OF_FILE");
    }

    @ParameterizedTest
    @CsvSource({
            "'<=', LTE",
            "'>=', GTE",
            "'==', EQ",
            "'!=', NOT_EQ",
            "'<', LT",
            "'>', GT",
            "'=', ASSIGN",
            "'!', BANG"
    })
    void testComparatorTieBreak(String source, TokenType expected) {
        Lexer lexer = new Lexer(source + "x");

        Token token = lexer.nextToken();
        Token next = lexer.nextToken();

        assertThat(token.type()).isEqualTo(expected);
        assertThat(token.text()).isEqualTo(source);
        assertThat(next.type()).isEqualTo(TokenType.IDENT);
        assertThat(next.position()).isEqualTo(source.length());
    }

    @Test
    void testEqualsSignIsConsumedOncePerOperator() {
        assertThat(render("===")).containsExactly("EQ", "ASSIGN", "END_OF_FILE");
        assertThat(render("<==")).containsExactly("LTE", "ASSIGN", "END_OF_FILE");
        assertThat(render("! =")).containsExactly("BANG", "ASSIGN", "END_OF_FILE");
    }

    @Test
    void testNegativeNumberIsTwoTokens() {
        assertThat(render("-5")).containsExactly("MINUS", "INT(5)", "END_OF_FILE");
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "7", "007", "1234567890", "9223372036854775807"})
    void testIntegerLiteral(String digits) {
        Lexer lexer = new Lexer(digits + ";");

        Token token = lexer.nextToken();

        assertThat(token.type()).isEqualTo(TokenType.INT);
        assertThat(token.value()).isEqualTo(Long.parseLong(digits));
        assertThat(token.text()).isEqualTo(digits);
        assertThat(lexer.nextToken().position()).isEqualTo(digits.length());
    }

    @Test
    void testIntegerOverflowBecomesIllegal() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer("9223372036854775808 + 1", diagnostics);

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type)
                .containsExactly(TokenType.ILLEGAL, TokenType.PLUS, TokenType.INT, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).text()).isEqualTo("9223372036854775808");
        assertThat(tokens.get(0).value()).isNull();
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.getDiagnostics().get(0).message())
                .isEqualTo("Integer literal out of range: 9223372036854775808");
    }

    @Test
    void testLineAndColumnTracking() {
        List<Token> tokens = new Lexer("let a = 1;\n  a != 2;\n").scanTokens();

        assertThat(tokens.get(0)).extracting(Token::line, Token::column).containsExactly(1, 1);
        assertThat(tokens.get(1)).extracting(Token::line, Token::column).containsExactly(1, 5);
        assertThat(tokens.get(5)).extracting(Token::type, Token::line, Token::column).containsExactly(TokenType.IDENT, 2, 3);
        assertThat(tokens.get(6)).extracting(Token::type, Token::line, Token::column).containsExactly(TokenType.NOT_EQ, 2, 5);
        assertThat(tokens.get(tokens.size() - 1)).extracting(Token::type, Token::line, Token::column)
                .containsExactly(TokenType.END_OF_FILE, 3, 1);
    }

    @Test
    void testSupplementaryCharacterIsOneIllegalToken() {
        String emoji = new String(Character.toChars(0x1F600));

        List<Token> tokens = new Lexer(emoji + "x").scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(TokenType.ILLEGAL, TokenType.IDENT, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).text()).isEqualTo(emoji);
        assertThat(tokens.get(1).column()).isEqualTo(2);
    }

    @Test
    void testIdentifierReferencesSourceWithoutCopying() {
        String source = "let answer = 42;";

        Token ident = new Lexer(source).scanTokens().get(1);

        assertThat(ident.lexeme().source()).isSameAs(source);
        assertThat(ident.lexeme().start()).isEqualTo(4);
        assertThat(ident.lexeme().end()).isEqualTo(10);
    }

    @Test
    void testTokensStreamEndsWithEndOfFile() {
        List<TokenType> types = new Lexer("a+b").tokens().map(Token::type).collect(Collectors.toList());

        assertThat(types).containsExactly(TokenType.IDENT, TokenType.PLUS, TokenType.IDENT, TokenType.END_OF_FILE);
    }

    @Test
    void testNullSourceIsRejected() {
        assertThatThrownBy(() -> new Lexer(null)).isInstanceOf(NullPointerException.class);
    }

    /**
     * Feeds random garbage to the lexer: it must reach END_OF_FILE within length + 1 calls,
     * never throw, and produce the same tokens on a second run.
     */
    @Test
    void testRandomInputTerminatesDeterministically() {
        Random random = new Random(20240117L);
        String alphabet = "abcxyz_019 \t\n=!<>+-*/,;(){}@#$%^&~\"'é ";
        for (int run = 0; run < 200; run++) {
            StringBuilder sb = new StringBuilder();
            int length = random.nextInt(60);
            for (int i = 0; i < length; i++) {
                sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
            }
            String source = sb.toString();

            List<Token> first = pullUntilEnd(source);
            List<Token> second = pullUntilEnd(source);

            assertThat(first.size()).isLessThanOrEqualTo(source.length() + 1);
            assertThat(first.get(first.size() - 1).type()).isEqualTo(TokenType.END_OF_FILE);
            assertThat(first).isEqualTo(second);
        }
    }

    private static List<Token> pullUntilEnd(String source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = new ArrayList<>();
        for (int calls = 0; calls <= source.length(); calls++) {
            Token token = lexer.nextToken();
            tokens.add(token);
            if (token.is(TokenType.END_OF_FILE)) {
                return tokens;
            }
        }
        throw new AssertionError("No END_OF_FILE after " + (source.length() + 1) + " calls for: " + source);
    }
}

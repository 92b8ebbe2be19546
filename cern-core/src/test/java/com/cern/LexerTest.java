package com.cern;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<TokenType> types(String source) {
        return Lexer.tokenize(source).stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    void testKeywordsAndIdentifiers() {
        List<Token> tokens = Lexer.tokenize("var return if elif else func int char count_2");
        assertEquals(List.of(
            TokenType.VAR, TokenType.RETURN, TokenType.IF, TokenType.ELIF, TokenType.ELSE,
            TokenType.FUNC, TokenType.TYPE_INT, TokenType.TYPE_CHAR, TokenType.IDENTIFIER),
            tokens.stream().map(Token::type).collect(Collectors.toList()));
        assertEquals("count_2", tokens.get(8).value());
        assertNull(tokens.get(0).value(), "Keywords carry no literal text");
    }

    @Test
    void testPunctuationAndOperators() {
        assertEquals(List.of(
            TokenType.EQUAL, TokenType.COLON, TokenType.COMMA,
            TokenType.LEFT_PARENTHESIS, TokenType.RIGHT_PARENTHESIS,
            TokenType.LEFT_CURLY_BRACKET, TokenType.RIGHT_CURLY_BRACKET,
            TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.SLASH),
            types("= : , ( ) { } + - * /"));
    }

    @Test
    void testLiterals() {
        List<Token> tokens = Lexer.tokenize("var x = 42 + 'z'");
        assertEquals(new Token(TokenType.INTEGER_LITERAL, "42", 1), tokens.get(3));
        assertEquals(new Token(TokenType.CHAR_LITERAL, "z", 1), tokens.get(5));
    }

    @Test
    void testNoWhitespaceNeeded() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.LEFT_PARENTHESIS,
            TokenType.INTEGER_LITERAL, TokenType.PLUS, TokenType.IDENTIFIER, TokenType.RIGHT_PARENTHESIS,
            TokenType.STAR, TokenType.INTEGER_LITERAL),
            types("x=(1+y)*2"));
    }

    @Test
    void testCommentsAreDropped() {
        String source = String.join("\n",
            "// leading comment",
            "var x = 1 // trailing",
            "/* block",
            "   spanning lines */ x = 2 / 1");
        List<Token> tokens = Lexer.tokenize(source);
        assertEquals(List.of(
            TokenType.VAR, TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.INTEGER_LITERAL,
            TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.INTEGER_LITERAL, TokenType.SLASH,
            TokenType.INTEGER_LITERAL),
            tokens.stream().map(Token::type).collect(Collectors.toList()));
        assertEquals(2, tokens.get(0).line());
        assertEquals(4, tokens.get(4).line(), "Newlines inside block comments still count");
    }

    @Test
    void testUnterminatedBlockCommentConsumesRest() {
        assertEquals(List.of(TokenType.RETURN, TokenType.INTEGER_LITERAL), types("return 1 /* never closed\nx = 2"));
    }

    @Test
    void testLineNumbers() {
        List<Token> tokens = Lexer.tokenize("var a = 1\n\n  a = 2\n");
        assertEquals(1, tokens.get(0).line());
        assertEquals(3, tokens.get(4).line());
        assertEquals(3, tokens.get(6).line());
    }

    @Test
    void testEmptySource() {
        assertTrue(Lexer.tokenize("").isEmpty());
        assertTrue(Lexer.tokenize("  \n\t// nothing\n").isEmpty());
    }

    @Test
    void testInvalidCharacter() {
        TokenizeException e = assertThrows(TokenizeException.class, () -> Lexer.tokenize("var x = 1\nx = $"));
        assertEquals(2, e.getLine());
        assertEquals("invalid token `$`", e.getReason());
        assertEquals("[Error] invalid token `$` on line 2", e.getMessage());
    }

    @Test
    @DisplayName("Letters, digits and spaces outside ASCII are invalid tokens")
    void testNonAsciiCharacters() {
        // Arabic-Indic digit three
        TokenizeException digit = assertThrows(TokenizeException.class, () -> Lexer.tokenize("return ٣"));
        assertEquals("invalid token `٣`", digit.getReason());
        assertEquals(1, digit.getLine());

        TokenizeException letter = assertThrows(TokenizeException.class, () -> Lexer.tokenize("var x = 1\nvar é = 1"));
        assertEquals("invalid token `é`", letter.getReason());
        assertEquals(2, letter.getLine());

        assertThrows(TokenizeException.class, () -> Lexer.tokenize("var xé = 1"));
        assertThrows(TokenizeException.class, () -> Lexer.tokenize("return\u20031"));
        assertThrows(TokenizeException.class, () -> Lexer.tokenize("var c = 'é'"));
    }

    @Test
    void testUnclosedCharLiteral() {
        TokenizeException e = assertThrows(TokenizeException.class, () -> Lexer.tokenize("var c = 'ab'"));
        assertEquals("expected `'`", e.getReason());
        assertEquals(1, e.getLine());
    }

    @Test
    void testInvalidCharLiteralPayload() {
        assertEquals("expected a valid char",
            assertThrows(TokenizeException.class, () -> Lexer.tokenize("var c = '+'")).getReason());
        assertEquals("expected a valid char",
            assertThrows(TokenizeException.class, () -> Lexer.tokenize("var c = '")).getReason());
    }
}

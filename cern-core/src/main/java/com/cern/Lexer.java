package com.cern;

import java.util.ArrayList;
import java.util.List;

/**
 * Character scanner turning source text into tokens. Comments and whitespace
 * are dropped here, so the parser never sees them.
 */
public class Lexer {
    private final String source;
    private int position = 0;
    private int line = 1;

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        StringBuilder buf = new StringBuilder();

        while (!isAtEnd()) {
            char c = peek();

            if (c == '/' && peekIs(1, '/')) {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else if (c == '/' && peekIs(1, '*')) {
                skipBlockComment();
            } else if (isLetter(c)) {
                buf.append(advance());
                while (!isAtEnd() && (isLetter(peek()) || isDigit(peek()) || peek() == '_')) {
                    buf.append(advance());
                }
                tokens.add(word(buf.toString()));
                buf.setLength(0);
            } else if (isDigit(c)) {
                buf.append(advance());
                while (!isAtEnd() && isDigit(peek())) {
                    buf.append(advance());
                }
                tokens.add(new Token(TokenType.INTEGER_LITERAL, buf.toString(), line));
                buf.setLength(0);
            } else if (c == '\'') {
                tokens.add(charLiteral());
            } else if (c == '\n') {
                line++;
                advance();
            } else if (isWhitespace(c)) {
                advance();
            } else {
                TokenType punctuation = punctuation(c);
                if (punctuation == null) {
                    throw new TokenizeException("invalid token `" + c + "`", line);
                }
                advance();
                tokens.add(new Token(punctuation, line));
            }
        }

        return tokens;
    }

    private Token word(String text) {
        TokenType type = switch (text) {
            case "int" -> TokenType.TYPE_INT;
            case "char" -> TokenType.TYPE_CHAR;
            case "var" -> TokenType.VAR;
            case "func" -> TokenType.FUNC;
            case "return" -> TokenType.RETURN;
            case "if" -> TokenType.IF;
            case "elif" -> TokenType.ELIF;
            case "else" -> TokenType.ELSE;
            default -> TokenType.IDENTIFIER;
        };
        return type == TokenType.IDENTIFIER ? new Token(type, text, line) : new Token(type, line);
    }

    private static TokenType punctuation(char c) {
        return switch (c) {
            case '=' -> TokenType.EQUAL;
            case ':' -> TokenType.COLON;
            case ',' -> TokenType.COMMA;
            case '(' -> TokenType.LEFT_PARENTHESIS;
            case ')' -> TokenType.RIGHT_PARENTHESIS;
            case '{' -> TokenType.LEFT_CURLY_BRACKET;
            case '}' -> TokenType.RIGHT_CURLY_BRACKET;
            case '+' -> TokenType.PLUS;
            case '-' -> TokenType.MINUS;
            case '*' -> TokenType.STAR;
            case '/' -> TokenType.SLASH;
            default -> null;
        };
    }

    private Token charLiteral() {
        advance(); // opening '
        if (isAtEnd() || !(isLetter(peek()) || isDigit(peek()))) {
            throw new TokenizeException("expected a valid char", line);
        }
        Token token = new Token(TokenType.CHAR_LITERAL, String.valueOf(advance()), line);
        if (isAtEnd() || peek() != '\'') {
            throw new TokenizeException("expected `'`", line);
        }
        advance(); // closing '
        return token;
    }

    // Unterminated block comments run to end of input
    private void skipBlockComment() {
        advance();
        advance();
        while (!isAtEnd()) {
            if (peek() == '*' && peekIs(1, '/')) {
                advance();
                advance();
                return;
            }
            if (peek() == '\n') {
                line++;
            }
            advance();
        }
    }

    // Character classes are ASCII only; anything else is an invalid token
    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == '\u000B';
    }

    private boolean isAtEnd() {
        return position >= source.length();
    }

    private char peek() {
        return source.charAt(position);
    }

    private boolean peekIs(int offset, char expected) {
        int pos = position + offset;
        return pos < source.length() && source.charAt(pos) == expected;
    }

    private char advance() {
        return source.charAt(position++);
    }

    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }
}

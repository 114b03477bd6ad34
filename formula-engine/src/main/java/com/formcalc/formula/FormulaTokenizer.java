package com.formcalc.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts formula text into a flat list of tokens, always terminated by an EOF token.
 */
public class FormulaTokenizer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "true", TokenType.TRUE,
            "false", TokenType.FALSE,
            "null", TokenType.NULL,
            "and", TokenType.AND,
            "or", TokenType.OR,
            "not", TokenType.NOT);

    private static final Map<String, TokenType> TWO_CHAR_OPERATORS = Map.of(
            "**", TokenType.POWER,
            "==", TokenType.EQUAL,
            "!=", TokenType.NOT_EQUAL,
            "<=", TokenType.LESS_EQUAL,
            ">=", TokenType.GREATER_EQUAL);

    private static final Map<Character, TokenType> SINGLE_CHAR_OPERATORS = Map.of(
            '+', TokenType.PLUS,
            '-', TokenType.MINUS,
            '*', TokenType.MULTIPLY,
            '/', TokenType.DIVIDE,
            '%', TokenType.MODULO,
            '<', TokenType.LESS_THAN,
            '>', TokenType.GREATER_THAN,
            '(', TokenType.LPAREN,
            ')', TokenType.RPAREN,
            ',', TokenType.COMMA);

    private final String expr;
    private int pos = 0;

    public FormulaTokenizer(String expr) {
        if (expr == null) {
            throw new IllegalArgumentException("Formula text must not be null");
        }
        this.expr = expr;
    }

    public static List<Token> tokenize(String expr) {
        return new FormulaTokenizer(expr).tokenize();
    }

    /**
     * @throws FormulaException with kind SYNTAX on an unexpected character or an unterminated string
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        pos = 0;

        while (pos < expr.length()) {
            char c = current();

            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }

            if (isDigit(c)) {
                tokens.add(readNumber());
                continue;
            }

            if (c == '"' || c == '\'') {
                tokens.add(readString(c));
                continue;
            }

            if (isIdentifierStart(c)) {
                tokens.add(readIdentifier());
                continue;
            }

            if (pos + 1 < expr.length()) {
                String twoChar = expr.substring(pos, pos + 2);
                TokenType type = TWO_CHAR_OPERATORS.get(twoChar);
                if (type != null) {
                    tokens.add(new Token(type, twoChar, pos));
                    pos += 2;
                    continue;
                }
            }

            TokenType type = SINGLE_CHAR_OPERATORS.get(c);
            if (type != null) {
                tokens.add(new Token(type, String.valueOf(c), pos));
                pos++;
                continue;
            }

            throw FormulaException.syntax("Unexpected character '" + c + "' at position " + pos, pos);
        }

        tokens.add(new Token(TokenType.EOF, null, pos));
        return tokens;
    }

    private Token readNumber() {
        int start = pos;
        while (pos < expr.length() && isDigit(current())) pos++;

        // a dot only belongs to the number when a digit follows it
        if (current() == '.' && pos + 1 < expr.length() && isDigit(expr.charAt(pos + 1))) {
            pos++;
            while (pos < expr.length() && isDigit(current())) pos++;
            String num = expr.substring(start, pos);
            return new Token(TokenType.NUMBER, FormulaValue.of(Double.parseDouble(num)), start);
        }

        String num = expr.substring(start, pos);
        try {
            return new Token(TokenType.NUMBER, FormulaValue.of(Long.parseLong(num)), start);
        } catch (NumberFormatException e) {
            // too large for a long, keep it as a decimal
            return new Token(TokenType.NUMBER, FormulaValue.of(Double.parseDouble(num)), start);
        }
    }

    private Token readString(char quote) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();

        while (pos < expr.length() && current() != quote) {
            char c = current();
            if (c == '\\') {
                pos++;
                if (pos >= expr.length()) {
                    break;
                }
                sb.append(unescape(current()));
            } else {
                sb.append(c);
            }
            pos++;
        }

        if (pos >= expr.length()) {
            throw FormulaException.syntax("Unterminated string at position " + start, start);
        }

        pos++;
        return new Token(TokenType.STRING, FormulaValue.of(sb.toString()), start);
    }

    private static char unescape(char c) {
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            default: return c;
        }
    }

    private Token readIdentifier() {
        int start = pos;
        while (pos < expr.length() && (Character.isLetterOrDigit(current()) || current() == '_')) {
            pos++;
        }
        String word = expr.substring(start, pos);

        String lower = word.toLowerCase();
        TokenType keyword = KEYWORDS.get(lower);
        if (keyword != null) {
            return new Token(keyword, lower, start);
        }
        return new Token(TokenType.IDENTIFIER, word, start);
    }

    private char current() {
        return pos < expr.length() ? expr.charAt(pos) : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }
}

package com.formcalc.formula;

import com.formcalc.formula.FormulaNode.BinaryOperator;
import com.formcalc.formula.FormulaNode.UnaryOperator;
import com.formcalc.util.LoggingUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser producing a {@link FormulaNode} tree.
 *
 * <p>Precedence, lowest to highest:
 * <ol>
 *   <li>{@code or}</li>
 *   <li>{@code and}</li>
 *   <li>{@code not} (prefix)</li>
 *   <li>{@code == != < <= > >=}</li>
 *   <li>{@code + -}</li>
 *   <li>{@code * / %}</li>
 *   <li>{@code **} (right-associative)</li>
 *   <li>unary {@code + -}</li>
 *   <li>literals, field references, function calls, parentheses</li>
 * </ol>
 *
 * <p>Nesting and tree depth are both limited to {@link #MAX_DEPTH}; deeper formulas
 * fail with a SYNTAX error instead of exhausting the stack.
 */
public class FormulaParser {

    private static final Map<TokenType, BinaryOperator> COMPARISON_OPERATORS = Map.of(
            TokenType.EQUAL, BinaryOperator.EQUAL,
            TokenType.NOT_EQUAL, BinaryOperator.NOT_EQUAL,
            TokenType.LESS_THAN, BinaryOperator.LESS_THAN,
            TokenType.LESS_EQUAL, BinaryOperator.LESS_EQUAL,
            TokenType.GREATER_THAN, BinaryOperator.GREATER_THAN,
            TokenType.GREATER_EQUAL, BinaryOperator.GREATER_EQUAL);

    public static final int MAX_DEPTH = 200;

    private final List<Token> tokens;
    private int pos = 0;
    private int nesting = 0;

    public FormulaParser(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
            throw new IllegalArgumentException("Token list must end with an EOF token");
        }
        this.tokens = List.copyOf(tokens);
    }

    /**
     * Tokenize and parse formula text.
     *
     * @throws FormulaException with kind SYNTAX
     */
    public static FormulaNode parse(String expr) {
        return new FormulaParser(FormulaTokenizer.tokenize(expr)).parse();
    }

    /**
     * @throws FormulaException with kind SYNTAX; no partial tree is ever returned
     */
    public FormulaNode parse() {
        pos = 0;
        nesting = 0;
        if (current().is(TokenType.EOF)) {
            throw FormulaException.syntax("Empty formula", current().getPosition());
        }

        FormulaNode root = parseOr();

        if (!current().is(TokenType.EOF)) {
            throw unexpected(current());
        }
        if (LoggingUtil.isDebugEnabled()) {
            LoggingUtil.debug("Parsed formula into " + root);
        }
        return root;
    }

    private FormulaNode parseOr() {
        enter(current());
        try {
            FormulaNode left = parseAnd();
            while (current().is(TokenType.OR)) {
                Token op = advance();
                FormulaNode right = parseAnd();
                left = limited(FormulaNode.binary(BinaryOperator.OR, left, right), op);
            }
            return left;
        } finally {
            leave();
        }
    }

    private FormulaNode parseAnd() {
        FormulaNode left = parseNot();
        while (current().is(TokenType.AND)) {
            Token op = advance();
            FormulaNode right = parseNot();
            left = limited(FormulaNode.binary(BinaryOperator.AND, left, right), op);
        }
        return left;
    }

    private FormulaNode parseNot() {
        if (current().is(TokenType.NOT)) {
            Token op = advance();
            enter(op);
            try {
                return limited(FormulaNode.unary(UnaryOperator.NOT, parseNot()), op);
            } finally {
                leave();
            }
        }
        return parseComparison();
    }

    private FormulaNode parseComparison() {
        FormulaNode left = parseAdditive();
        while (COMPARISON_OPERATORS.containsKey(current().getType())) {
            Token op = advance();
            FormulaNode right = parseAdditive();
            left = limited(FormulaNode.binary(COMPARISON_OPERATORS.get(op.getType()), left, right), op);
        }
        return left;
    }

    private FormulaNode parseAdditive() {
        FormulaNode left = parseMultiplicative();
        while (current().is(TokenType.PLUS) || current().is(TokenType.MINUS)) {
            Token op = advance();
            FormulaNode right = parseMultiplicative();
            BinaryOperator operator = op.is(TokenType.PLUS) ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
            left = limited(FormulaNode.binary(operator, left, right), op);
        }
        return left;
    }

    private FormulaNode parseMultiplicative() {
        FormulaNode left = parsePower();
        while (current().is(TokenType.MULTIPLY) || current().is(TokenType.DIVIDE) || current().is(TokenType.MODULO)) {
            Token op = advance();
            BinaryOperator operator = switch (op.getType()) {
                case MULTIPLY -> BinaryOperator.MULTIPLY;
                case DIVIDE -> BinaryOperator.DIVIDE;
                default -> BinaryOperator.MODULO;
            };
            FormulaNode right = parsePower();
            left = limited(FormulaNode.binary(operator, left, right), op);
        }
        return left;
    }

    private FormulaNode parsePower() {
        FormulaNode base = parseUnary();
        if (current().is(TokenType.POWER)) {
            Token op = advance();
            enter(op);
            try {
                // right-associative: 2 ** 3 ** 2 == 2 ** (3 ** 2)
                return limited(FormulaNode.binary(BinaryOperator.POWER, base, parsePower()), op);
            } finally {
                leave();
            }
        }
        return base;
    }

    private FormulaNode parseUnary() {
        if (current().is(TokenType.PLUS) || current().is(TokenType.MINUS)) {
            Token op = advance();
            UnaryOperator operator = op.is(TokenType.PLUS) ? UnaryOperator.PLUS : UnaryOperator.MINUS;
            enter(op);
            try {
                return limited(FormulaNode.unary(operator, parseUnary()), op);
            } finally {
                leave();
            }
        }
        return parsePrimary();
    }

    private FormulaNode parsePrimary() {
        Token token = current();
        switch (token.getType()) {
            case NUMBER:
            case STRING:
                advance();
                return FormulaNode.literal((FormulaValue) token.getValue());
            case TRUE:
                advance();
                return FormulaNode.literal(FormulaValue.TRUE);
            case FALSE:
                advance();
                return FormulaNode.literal(FormulaValue.FALSE);
            case NULL:
                advance();
                return FormulaNode.literal(FormulaValue.NULL);
            case IDENTIFIER:
                advance();
                String name = (String) token.getValue();
                if (current().is(TokenType.LPAREN)) {
                    return parseFunctionCall(name);
                }
                return FormulaNode.field(name);
            case LPAREN:
                advance();
                FormulaNode inner = parseOr();
                expect(TokenType.RPAREN);
                return inner;
            default:
                throw unexpected(token);
        }
    }

    private FormulaNode parseFunctionCall(String name) {
        Token open = expect(TokenType.LPAREN);
        List<FormulaNode> args = new ArrayList<>();

        if (match(TokenType.RPAREN)) {
            return FormulaNode.call(name, args);
        }

        while (true) {
            args.add(parseOr());
            if (match(TokenType.COMMA)) {
                continue;
            }
            if (match(TokenType.RPAREN)) {
                break;
            }
            Token token = current();
            throw FormulaException.syntax("Expected ',' or ')' in function call, got "
                    + token.getType() + " at position " + token.getPosition(), token.getPosition());
        }
        return limited(FormulaNode.call(name, args), open);
    }

    private void enter(Token at) {
        if (++nesting > MAX_DEPTH) {
            throw tooDeep(at);
        }
    }

    private void leave() {
        nesting--;
    }

    private static FormulaNode limited(FormulaNode node, Token at) {
        if (node.getDepth() > MAX_DEPTH) {
            throw tooDeep(at);
        }
        return node;
    }

    private static FormulaException tooDeep(Token at) {
        return FormulaException.syntax("Formula nested too deeply (limit " + MAX_DEPTH
                + ") at position " + at.getPosition(), at.getPosition());
    }

    private Token expect(TokenType type) {
        Token token = current();
        if (!token.is(type)) {
            throw FormulaException.syntax("Expected " + type + ", got " + token.getType()
                    + " at position " + token.getPosition(), token.getPosition());
        }
        return advance();
    }

    private boolean match(TokenType type) {
        if (current().is(type)) {
            pos++;
            return true;
        }
        return false;
    }

    private Token advance() {
        Token token = current();
        if (!token.is(TokenType.EOF)) {
            pos++;
        }
        return token;
    }

    private Token current() {
        return tokens.get(Math.min(pos, tokens.size() - 1));
    }

    private static FormulaException unexpected(Token token) {
        return FormulaException.syntax("Unexpected token " + token.getType()
                + " at position " + token.getPosition(), token.getPosition());
    }
}

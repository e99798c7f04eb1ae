package com.sketchmath.server.pipeline.symbolic;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the canonical math alphabet.
 *
 * <pre>
 * sum     := product (('+' | '-') product)*
 * product := unary (('*' | '/') unary | implicit power)*
 * unary   := ('-' | '+') unary | power
 * power   := primary ('^' unary)?
 * primary := NUMBER | CONSTANT | SYMBOL | FUNCTION '(' sum ')' | '(' sum ')'
 * </pre>
 *
 * Implicit multiplication applies when a number or a closing parenthesis is
 * directly followed, without whitespace, by an identifier or an opening
 * parenthesis ("2x", "3(4+5)", "(1+2)(3)").
 */
public final class ExpressionParser {

    private enum TokenType {
        NUMBER, IDENTIFIER, OPERATOR, LEFT_PAREN, RIGHT_PAREN, END
    }

    private static final class Token {
        final TokenType type;
        final String text;
        final int position;
        final boolean spaceBefore;

        Token(TokenType type, String text, int position, boolean spaceBefore) {
            this.type = type;
            this.text = text;
            this.position = position;
            this.spaceBefore = spaceBefore;
        }

        boolean isOperator(char op) {
            return type == TokenType.OPERATOR && text.charAt(0) == op;
        }
    }

    static final int MAX_NESTING = 200;

    private final String source;
    private final List<Token> tokens;
    private int index = 0;
    private int depth = 0;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = tokenize(source);
    }

    public static Expr parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new ExpressionParseException("empty expression", text == null ? "" : text, 0);
        }
        ExpressionParser parser = new ExpressionParser(text);
        Expr expr = parser.parseSum();
        Token trailing = parser.peek();
        if (trailing.type != TokenType.END) {
            throw parser.error("unexpected '" + trailing.text + "'", trailing);
        }
        return expr;
    }

    private List<Token> tokenize(String text) {
        List<Token> result = new ArrayList<>();
        int i = 0;
        boolean space = false;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                space = true;
                i++;
                continue;
            }
            int start = i;
            if (isDigit(c) || (c == '.' && i + 1 < text.length() && isDigit(text.charAt(i + 1)))) {
                while (i < text.length() && isDigit(text.charAt(i))) {
                    i++;
                }
                if (i < text.length() && text.charAt(i) == '.') {
                    i++;
                    while (i < text.length() && isDigit(text.charAt(i))) {
                        i++;
                    }
                }
                result.add(new Token(TokenType.NUMBER, text.substring(start, i), start, space));
            } else if (isIdentifierStart(c)) {
                while (i < text.length() && isIdentifierPart(text.charAt(i))) {
                    i++;
                }
                result.add(new Token(TokenType.IDENTIFIER, text.substring(start, i), start, space));
            } else if (c == '+' || c == '-' || c == '*' || c == '/' || c == '^') {
                i++;
                result.add(new Token(TokenType.OPERATOR, String.valueOf(c), start, space));
            } else if (c == '(') {
                i++;
                result.add(new Token(TokenType.LEFT_PAREN, "(", start, space));
            } else if (c == ')') {
                i++;
                result.add(new Token(TokenType.RIGHT_PAREN, ")", start, space));
            } else {
                throw new ExpressionParseException("unsupported character '" + c + "'", text, start);
            }
            space = false;
        }
        result.add(new Token(TokenType.END, "end of input", text.length(), space));
        return result;
    }

    private Expr parseSum() {
        Expr left = parseProduct();
        while (peek().isOperator('+') || peek().isOperator('-')) {
            Token op = next();
            Expr right = parseProduct();
            left = new BinaryOperation(BinaryOperation.Operator.of(op.text.charAt(0)), left, right);
        }
        return left;
    }

    private Expr parseProduct() {
        Expr left = parseUnary();
        while (true) {
            if (peek().isOperator('*') || peek().isOperator('/')) {
                Token op = next();
                Expr right = parseUnary();
                left = new BinaryOperation(BinaryOperation.Operator.of(op.text.charAt(0)), left, right);
            } else if (implicitMultiplicationFollows()) {
                Expr right = parsePower();
                left = new BinaryOperation(BinaryOperation.Operator.MULTIPLY, left, right);
            } else {
                return left;
            }
        }
    }

    private boolean implicitMultiplicationFollows() {
        Token current = peek();
        Token previous = tokens.get(index - 1);
        if (current.spaceBefore) {
            return false;
        }
        boolean previousCloses = previous.type == TokenType.NUMBER || previous.type == TokenType.RIGHT_PAREN;
        boolean currentOpens = current.type == TokenType.IDENTIFIER || current.type == TokenType.LEFT_PAREN;
        return previousCloses && currentOpens;
    }

    // Every nesting level (parentheses, call arguments, signs, exponents) passes through here.
    private Expr parseUnary() {
        if (++depth > MAX_NESTING) {
            throw error("expression nested more than " + MAX_NESTING + " levels deep", peek());
        }
        try {
            if (peek().isOperator('-')) {
                next();
                return new Negation(parseUnary());
            }
            if (peek().isOperator('+')) {
                next();
                return parseUnary();
            }
            return parsePower();
        } finally {
            depth--;
        }
    }

    private Expr parsePower() {
        Expr base = parsePrimary();
        if (peek().isOperator('^')) {
            next();
            Expr exponent = parseUnary();
            return new BinaryOperation(BinaryOperation.Operator.POWER, base, exponent);
        }
        return base;
    }

    private Expr parsePrimary() {
        Token token = next();
        switch (token.type) {
            case NUMBER:
                return new NumberLiteral(token.text);
            case IDENTIFIER:
                return parseIdentifier(token);
            case LEFT_PAREN: {
                Expr inner = parseSum();
                expect(TokenType.RIGHT_PAREN, "')'");
                return inner;
            }
            case END:
                throw error("unexpected end of input", token);
            default:
                throw error("unexpected '" + token.text + "'", token);
        }
    }

    private Expr parseIdentifier(Token token) {
        String name = token.text;
        if (MathVocabulary.FUNCTIONS.contains(name)) {
            if (peek().type != TokenType.LEFT_PAREN) {
                throw error("function '" + name + "' requires a parenthesized argument", token);
            }
            next();
            Expr argument = parseSum();
            expect(TokenType.RIGHT_PAREN, "')'");
            return new FunctionCall(name, argument);
        }
        if (peek().type == TokenType.LEFT_PAREN && !peek().spaceBefore) {
            throw error("unsupported function '" + name + "'", token);
        }
        if (MathVocabulary.CONSTANTS.contains(name)) {
            return new Constant(name);
        }
        return new Symbol(name);
    }

    private void expect(TokenType type, String description) {
        Token token = next();
        if (token.type != type) {
            throw error("expected " + description + " but found '" + token.text + "'", token);
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.type != TokenType.END) {
            index++;
        }
        return token;
    }

    private ExpressionParseException error(String detail, Token at) {
        return new ExpressionParseException(detail, source, at.position);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}

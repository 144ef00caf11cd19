package com.sheetcalc.app.formula;

import com.sheetcalc.app.exceptions.FormulaSyntaxException;
import com.sheetcalc.app.models.Address;
import com.sheetcalc.app.models.CrossPageReference;
import com.sheetcalc.app.models.LocalCellReference;
import com.sheetcalc.app.models.LocalRangeReference;
import com.sheetcalc.app.models.PageRef;
import com.sheetcalc.app.models.Range;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for formula bodies.
 * Precedence, loosest first:
 * 1) comparison  = <> < <= > >=
 * 2) concatenation  &
 * 3) additive  + -
 * 4) multiplicative  * /
 * 5) exponent  ^
 * 6) unary  + -
 * 7) primary: literals, references, function calls, parenthesized expressions
 * All binary levels are left-associative.
 */
public final class FormulaParser {

    private static final Set<String> COMPARISON = Set.of("=", "<>", "<", "<=", ">", ">=");
    private static final Set<String> CONCATENATION = Set.of("&");
    private static final Set<String> ADDITIVE = Set.of("+", "-");
    private static final Set<String> MULTIPLICATIVE = Set.of("*", "/");
    private static final Set<String> EXPONENT = Set.of("^");

    // Parentheses, function calls and unary signs each add one level
    static final int MAX_NESTING_DEPTH = 256;
    // Operators still open on the current path; each one makes the tree one level taller
    static final int MAX_OPEN_OPERATORS = 1024;

    private final List<Token> tokens;
    private int position;
    private int depth;
    private int openOperators;

    private FormulaParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a formula body (the text after '='). Throws FormulaSyntaxException if malformed.
     */
    public static Expression parse(String formula) {
        List<Token> tokens = Tokenizer.tokenize(formula);
        if (tokens.isEmpty()) {
            throw new FormulaSyntaxException("Empty formula");
        }
        FormulaParser parser = new FormulaParser(tokens);
        Expression expression = parser.parseComparison();
        if (!parser.isAtEnd()) {
            throw new FormulaSyntaxException("Unexpected tokens after end of formula");
        }
        return expression;
    }

    private Expression parseComparison() {
        int opened = openOperators;
        Expression node = parseConcatenation();
        try {
            while (matchOperator(COMPARISON)) {
                openOperator();
                BinaryOperator operator = BinaryOperator.fromSymbol(previous().getText());
                node = new BinaryExpression(operator, node, parseConcatenation());
            }
            return node;
        } finally {
            openOperators = opened;
        }
    }

    private Expression parseConcatenation() {
        int opened = openOperators;
        Expression node = parseAdditive();
        try {
            while (matchOperator(CONCATENATION)) {
                openOperator();
                node = new BinaryExpression(BinaryOperator.CONCAT, node, parseAdditive());
            }
            return node;
        } finally {
            openOperators = opened;
        }
    }

    private Expression parseAdditive() {
        int opened = openOperators;
        Expression node = parseMultiplicative();
        try {
            while (matchOperator(ADDITIVE)) {
                openOperator();
                BinaryOperator operator = BinaryOperator.fromSymbol(previous().getText());
                node = new BinaryExpression(operator, node, parseMultiplicative());
            }
            return node;
        } finally {
            openOperators = opened;
        }
    }

    private Expression parseMultiplicative() {
        int opened = openOperators;
        Expression node = parseExponent();
        try {
            while (matchOperator(MULTIPLICATIVE)) {
                openOperator();
                BinaryOperator operator = BinaryOperator.fromSymbol(previous().getText());
                node = new BinaryExpression(operator, node, parseExponent());
            }
            return node;
        } finally {
            openOperators = opened;
        }
    }

    private Expression parseExponent() {
        int opened = openOperators;
        Expression node = parseUnary();
        try {
            while (matchOperator(EXPONENT)) {
                openOperator();
                node = new BinaryExpression(BinaryOperator.POWER, node, parseUnary());
            }
            return node;
        } finally {
            openOperators = opened;
        }
    }

    private Expression parseUnary() {
        if (matchOperator(ADDITIVE)) {
            UnaryOperator operator = previous().getText().equals("-") ? UnaryOperator.NEGATE : UnaryOperator.PLUS;
            enter();
            try {
                return new UnaryExpression(operator, parseUnary());
            } finally {
                depth--;
            }
        }
        return parsePrimary();
    }

    private Expression parsePrimary() {
        if (match(TokenType.NUMBER)) {
            return new NumberLiteral(Double.parseDouble(previous().getText()));
        }
        if (match(TokenType.STRING)) {
            return new StringLiteral(previous().getText());
        }
        if (match(TokenType.BOOLEAN)) {
            return new BooleanLiteral(previous().getText().equals("TRUE"));
        }
        if (match(TokenType.PAGE)) {
            return parsePageReference(previous().getPage());
        }
        if (match(TokenType.CELL)) {
            Address start = toAddress(previous());
            if (match(TokenType.COLON)) {
                if (!match(TokenType.CELL)) {
                    throw new FormulaSyntaxException("Range references must use cell addresses");
                }
                return new ReferenceExpression(new LocalRangeReference(new Range(start, toAddress(previous()))));
            }
            return new ReferenceExpression(new LocalCellReference(start));
        }
        if (match(TokenType.IDENTIFIER)) {
            return parseFunctionCall(previous().getText());
        }
        if (match(TokenType.LEFT_PAREN)) {
            enter();
            try {
                Expression inner = parseComparison();
                consume(TokenType.RIGHT_PAREN, "Expected closing parenthesis");
                return inner;
            } finally {
                depth--;
            }
        }
        if (isAtEnd()) {
            throw new FormulaSyntaxException("Unexpected end of formula");
        }
        throw new FormulaSyntaxException("Unexpected token '" + peek().getText() + "'");
    }

    private Expression parsePageReference(PageRef page) {
        // No ':' suffix means the whole sheet of that page
        if (!match(TokenType.COLON)) {
            return new ReferenceExpression(CrossPageReference.toWholeSheet(page));
        }
        if (!match(TokenType.CELL)) {
            throw new FormulaSyntaxException("Expected cell reference after page reference");
        }
        Address start = toAddress(previous());
        if (match(TokenType.COLON)) {
            if (!match(TokenType.CELL)) {
                throw new FormulaSyntaxException("Range references must use cell addresses");
            }
            Range range = new Range(start, toAddress(previous()));
            return new ReferenceExpression(CrossPageReference.toRange(page, range));
        }
        return new ReferenceExpression(CrossPageReference.toCell(page, start));
    }

    private Expression parseFunctionCall(String name) {
        if (!match(TokenType.LEFT_PAREN)) {
            throw new FormulaSyntaxException("Unexpected identifier '" + name + "'");
        }
        enter();
        try {
            List<Expression> arguments = new ArrayList<>();
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    arguments.add(parseComparison());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_PAREN, "Expected closing parenthesis for " + name + "()");
            return new FunctionCall(name, arguments);
        } finally {
            depth--;
        }
    }

    private void openOperator() {
        if (++openOperators > MAX_OPEN_OPERATORS) {
            throw new FormulaSyntaxException("Formula is nested too deeply");
        }
    }

    private void enter() {
        if (++depth > MAX_NESTING_DEPTH) {
            throw new FormulaSyntaxException("Formula is nested too deeply");
        }
    }

    private static Address toAddress(Token token) {
        try {
            return Address.parse(token.getText());
        } catch (IllegalArgumentException e) {
            throw new FormulaSyntaxException("Invalid cell reference " + token.getText());
        }
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            position++;
            return true;
        }
        return false;
    }

    private boolean matchOperator(Set<String> operators) {
        if (check(TokenType.OPERATOR) && operators.contains(peek().getText())) {
            position++;
            return true;
        }
        return false;
    }

    private void consume(TokenType type, String message) {
        if (!match(type)) {
            throw new FormulaSyntaxException(message);
        }
    }

    private boolean check(TokenType type) {
        return !isAtEnd() && peek().getType() == type;
    }

    private boolean isAtEnd() {
        return position >= tokens.size();
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}

package com.sheetcalc.app.formula;

import com.sheetcalc.app.exceptions.FormulaSyntaxException;
import com.sheetcalc.app.models.PageRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits formula text (without the leading '=') into tokens.
 * A page mention such as "@[Q3 Sales, EU](sales-1)" is lexed as a single PAGE token,
 * because its label may contain spaces and punctuation other than ']'.
 */
public final class Tokenizer {

    private static final Pattern NUMBER_PATTERN = Pattern.compile("^(?:\\d+\\.?\\d*|\\.\\d+)$");
    private static final Pattern CELL_PATTERN = Pattern.compile("^[A-Z]+\\d+$");

    private final String formula;
    private int index;

    private Tokenizer(String formula) {
        this.formula = formula;
    }

    /**
     * Tokenizes the formula body. Throws FormulaSyntaxException on malformed input.
     */
    public static List<Token> tokenize(String formula) {
        return new Tokenizer(formula).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (index < formula.length()) {
            char c = formula.charAt(index);

            if (Character.isWhitespace(c)) {
                index++;
            } else if (c == '@' && peek(1) == '[') {
                tokens.add(readPage());
            } else if (c == '"') {
                tokens.add(readString());
            } else if (isDigit(c) || c == '.') {
                tokens.add(readNumber());
            } else if (isIdentifierStart(c)) {
                tokens.add(readWord());
            } else if (c == '(') {
                tokens.add(single(TokenType.LEFT_PAREN));
            } else if (c == ')') {
                tokens.add(single(TokenType.RIGHT_PAREN));
            } else if (c == ',') {
                tokens.add(single(TokenType.COMMA));
            } else if (c == ':') {
                tokens.add(single(TokenType.COLON));
            } else if (c == '<' || c == '>' || c == '=') {
                tokens.add(readComparison(c));
            } else if ("+-*/^&".indexOf(c) >= 0) {
                tokens.add(single(TokenType.OPERATOR));
            } else {
                throw new FormulaSyntaxException("Unexpected character '" + c + "' in formula");
            }
        }
        return tokens;
    }

    private char peek(int offset) {
        int at = index + offset;
        return at < formula.length() ? formula.charAt(at) : '\0';
    }

    private Token single(TokenType type) {
        Token token = new Token(type, String.valueOf(formula.charAt(index)));
        index++;
        return token;
    }

    private Token readPage() {
        int labelStart = index + 2;
        int labelEnd = formula.indexOf(']', labelStart);
        if (labelEnd < 0) {
            throw new FormulaSyntaxException("Unterminated page reference");
        }
        String label = formula.substring(labelStart, labelEnd).trim();
        if (label.isEmpty()) {
            throw new FormulaSyntaxException("Page reference label cannot be empty");
        }

        int cursor = labelEnd + 1;
        String identifier = null;
        String mentionType = null;
        if (cursor < formula.length() && formula.charAt(cursor) == '(') {
            int metaEnd = formula.indexOf(')', cursor + 1);
            if (metaEnd < 0) {
                throw new FormulaSyntaxException("Unterminated page reference identifier");
            }
            String meta = formula.substring(cursor + 1, metaEnd).trim();
            int colon = meta.indexOf(':');
            if (colon < 0) {
                identifier = meta;
            } else {
                identifier = meta.substring(0, colon);
                mentionType = meta.substring(colon + 1);
            }
            cursor = metaEnd + 1;
        }

        PageRef page = new PageRef(label, identifier, mentionType);
        index = cursor;
        return new Token(TokenType.PAGE, page.getRaw(), page);
    }

    private Token readString() {
        int end = formula.indexOf('"', index + 1);
        if (end < 0) {
            throw new FormulaSyntaxException("Unterminated string literal");
        }
        Token token = new Token(TokenType.STRING, formula.substring(index + 1, end));
        index = end + 1;
        return token;
    }

    private Token readNumber() {
        int end = index + 1;
        while (end < formula.length() && (isDigit(formula.charAt(end)) || formula.charAt(end) == '.')) {
            end++;
        }
        String text = formula.substring(index, end);
        if (!NUMBER_PATTERN.matcher(text).matches()) {
            throw new FormulaSyntaxException("Invalid number literal: " + text);
        }
        index = end;
        return new Token(TokenType.NUMBER, text);
    }

    private Token readWord() {
        int end = index + 1;
        while (end < formula.length() && isIdentifierPart(formula.charAt(end))) {
            end++;
        }
        String upper = formula.substring(index, end).toUpperCase(Locale.ROOT);
        index = end;
        if (CELL_PATTERN.matcher(upper).matches()) {
            return new Token(TokenType.CELL, upper);
        }
        if (upper.equals("TRUE") || upper.equals("FALSE")) {
            return new Token(TokenType.BOOLEAN, upper);
        }
        return new Token(TokenType.IDENTIFIER, upper);
    }

    private Token readComparison(char c) {
        char next = peek(1);
        if ((c == '<' && (next == '=' || next == '>')) || (c == '>' && next == '=')) {
            index += 2;
            return new Token(TokenType.OPERATOR, "" + c + next);
        }
        return single(TokenType.OPERATOR);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}

package com.scanprev.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns script text into tokens.
 *
 * Operators are matched longest first against {@link #OPERATORS}, so {@code **} always comes out as
 * a single {@link TokenType#DOUBLE_STAR}; whether it means power or spread is the parser's call.
 * Strings take either quote and the usual backslash escapes, numbers may carry a fraction and an
 * exponent. Comments are {@code //} to end of line, or C-style blocks.
 */
public class Lexer {
    private static final Map<String, TokenType> KEYWORDS;
    private static final Map<String, TokenType> OPERATORS;
    private static final int LONGEST_OPERATOR = 2;

    static {
        Map<String, TokenType> kw = new HashMap<>();
        for (TokenType t : new TokenType[] {
                TokenType.LET, TokenType.IF, TokenType.ELSE, TokenType.WHILE, TokenType.FOR,
                TokenType.IN, TokenType.TRUE, TokenType.FALSE, TokenType.NULL, TokenType.FUNCTION,
                TokenType.RETURN, TokenType.BREAK}) {
            kw.put(t.name().toLowerCase(Locale.ROOT), t);
        }
        KEYWORDS = Collections.unmodifiableMap(kw);

        Map<String, TokenType> ops = new HashMap<>();
        ops.put("(", TokenType.LEFT_PAREN);
        ops.put(")", TokenType.RIGHT_PAREN);
        ops.put("{", TokenType.LEFT_BRACE);
        ops.put("}", TokenType.RIGHT_BRACE);
        ops.put("[", TokenType.LEFT_BRACKET);
        ops.put("]", TokenType.RIGHT_BRACKET);
        ops.put(",", TokenType.COMMA);
        ops.put(";", TokenType.SEMICOLON);
        ops.put("@", TokenType.AT);
        ops.put("+", TokenType.PLUS);
        ops.put("-", TokenType.MINUS);
        ops.put("*", TokenType.STAR);
        ops.put("**", TokenType.DOUBLE_STAR);
        ops.put("/", TokenType.SLASH);
        ops.put("%", TokenType.PERCENT);
        ops.put("!", TokenType.BANG);
        ops.put("!=", TokenType.BANG_EQUAL);
        ops.put("=", TokenType.EQUAL);
        ops.put("==", TokenType.EQUAL_EQUAL);
        ops.put("<", TokenType.LESS);
        ops.put("<=", TokenType.LESS_EQUAL);
        ops.put(">", TokenType.GREATER);
        ops.put(">=", TokenType.GREATER_EQUAL);
        ops.put("&&", TokenType.AND_AND);
        ops.put("||", TokenType.OR_OR);
        OPERATORS = Collections.unmodifiableMap(ops);
    }

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int pos = 0;
    private int line = 1;

    public Lexer(String source) {
        this.source = source;
    }

    /** True if {@code name} would lex as a single identifier token (not a keyword). */
    public static boolean isIdentifier(String name) {
        if (name == null || name.isEmpty() || !identStart(name.charAt(0))) return false;
        for (int i = 1; i < name.length(); i++) {
            if (!identPart(name.charAt(i))) return false;
        }
        return !KEYWORDS.containsKey(name);
    }

    public List<Token> tokenize() {
        while (skipBlankAndComments()) {
            char c = source.charAt(pos);
            if (c == '"' || c == '\'') readString(c);
            else if (isDigit(c)) readNumber();
            else if (identStart(c)) readWord();
            else readOperator();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line));
        return tokens;
    }

    /** Skips whitespace and comments; false once the input is used up. */
    private boolean skipBlankAndComments() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') {
                line++;
                pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (source.startsWith("//", pos)) {
                int end = source.indexOf('\n', pos);
                pos = end < 0 ? source.length() : end;
            } else if (source.startsWith("/*", pos)) {
                int end = source.indexOf("*/", pos + 2);
                if (end < 0) throw error("Unterminated comment");
                countLines(pos, end);
                pos = end + 2;
            } else {
                return true;
            }
        }
        return false;
    }

    private void readOperator() {
        for (int len = Math.min(LONGEST_OPERATOR, source.length() - pos); len > 0; len--) {
            String text = source.substring(pos, pos + len);
            TokenType type = OPERATORS.get(text);
            if (type != null) {
                pos += len;
                tokens.add(new Token(type, text, null, line));
                return;
            }
        }
        throw error("Unexpected character: " + source.charAt(pos));
    }

    private void readWord() {
        int start = pos;
        while (pos < source.length() && identPart(source.charAt(pos))) pos++;
        String text = source.substring(start, pos);
        tokens.add(new Token(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER), text, null, line));
    }

    private void readNumber() {
        int start = pos;
        skipDigits();
        if (peekIs('.') && pos + 1 < source.length() && isDigit(source.charAt(pos + 1))) {
            pos++;
            skipDigits();
        }
        if (peekIs('e') || peekIs('E')) {
            int mark = pos++;
            if (peekIs('+') || peekIs('-')) pos++;
            if (pos < source.length() && isDigit(source.charAt(pos))) skipDigits();
            else pos = mark; // "2e" is the number 2 followed by the identifier e
        }
        String text = source.substring(start, pos);
        tokens.add(new Token(TokenType.NUMBER, text, Double.parseDouble(text), line));
    }

    private void readString(char quote) {
        int start = pos;
        int startLine = line;
        StringBuilder value = new StringBuilder();
        pos++;
        while (true) {
            if (pos >= source.length()) {
                throw new RuntimeException("[line " + startLine + "] Unterminated string");
            }
            char c = source.charAt(pos++);
            if (c == quote) break;
            if (c == '\n') line++;
            if (c != '\\') {
                value.append(c);
                continue;
            }
            if (pos >= source.length()) continue;
            char esc = source.charAt(pos++);
            switch (esc) {
                case 'n': value.append('\n'); break;
                case 't': value.append('\t'); break;
                case 'r': value.append('\r'); break;
                case '0': value.append('\0'); break;
                case '\\': case '"': case '\'': value.append(esc); break;
                default: throw error("Unknown escape: \\" + esc);
            }
        }
        tokens.add(new Token(TokenType.STRING, source.substring(start, pos), value.toString(), startLine));
    }

    private void skipDigits() {
        while (pos < source.length() && isDigit(source.charAt(pos))) pos++;
    }

    private void countLines(int from, int to) {
        for (int i = from; i < to; i++) {
            if (source.charAt(i) == '\n') line++;
        }
    }

    private boolean peekIs(char c) {
        return pos < source.length() && source.charAt(pos) == c;
    }

    private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }

    private static boolean identStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean identPart(char c) {
        return identStart(c) || isDigit(c);
    }

    private RuntimeException error(String msg) {
        return new RuntimeException("[line " + line + "] " + msg);
    }
}

package com.telemetra.service.core.query;

import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL-flavoured lexer, just precise enough to tell keywords apart from literals, quoted
 * identifiers and comments.
 *
 * Handles:
 *  - 'single quoted' strings with '' escapes, and E'...' / B'...' / X'...' / N'...' prefixes
 *  - "quoted identifiers" with "" escapes
 *  - $$dollar$$ and $tag$dollar$tag$ quoted bodies
 *  - -- line comments and nested block comments
 *  - ? and $n bind markers
 */
public final class SqlTokenizer {

    private final String sql;
    private int pos;

    private SqlTokenizer(String sql) {
        this.sql = sql;
    }

    public static List<SqlToken> tokenize(String sql) {
        return new SqlTokenizer(sql).run();
    }

    private List<SqlToken> run() {
        List<SqlToken> out = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= sql.length()) {
                return out;
            }
            int start = pos;
            char c = sql.charAt(pos);
            if (c == '\'') {
                out.add(new SqlToken(SqlToken.Type.STRING, readString(start, false), start));
            } else if (isStringPrefix(c) && peek(1) == '\'') {
                boolean escapes = c == 'e' || c == 'E';
                pos++;
                out.add(new SqlToken(SqlToken.Type.STRING, readString(start, escapes), start));
            } else if (c == '"') {
                out.add(new SqlToken(SqlToken.Type.QUOTED_IDENTIFIER, readQuotedIdentifier(), start));
            } else if (c == '$') {
                out.add(readDollar(start));
            } else if (c == '?') {
                pos++;
                out.add(new SqlToken(SqlToken.Type.PARAMETER, "?", start));
            } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
                out.add(new SqlToken(SqlToken.Type.NUMBER, readNumber(), start));
            } else if (isIdentifierStart(c)) {
                while (pos < sql.length() && isIdentifierPart(sql.charAt(pos))) pos++;
                out.add(new SqlToken(SqlToken.Type.WORD, sql.substring(start, pos), start));
            } else {
                pos++;
                out.add(new SqlToken(SqlToken.Type.SYMBOL, String.valueOf(c), start));
            }
        }
    }

    private void skipWhitespaceAndComments() {
        while (pos < sql.length()) {
            char c = sql.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '-' && peek(1) == '-') {
                while (pos < sql.length() && sql.charAt(pos) != '\n') pos++;
            } else if (c == '/' && peek(1) == '*') {
                skipBlockComment();
            } else {
                return;
            }
        }
    }

    private void skipBlockComment() {
        int start = pos;
        int depth = 0;
        while (pos < sql.length()) {
            if (sql.startsWith("/*", pos)) {
                depth++;
                pos += 2;
            } else if (sql.startsWith("*/", pos)) {
                depth--;
                pos += 2;
                if (depth == 0) return;
            } else {
                pos++;
            }
        }
        throw new QueryRejectedException("Unterminated comment starting at position " + (start + 1));
    }

    private String readString(int start, boolean backslashEscapes) {
        pos++; // opening quote
        while (pos < sql.length()) {
            char c = sql.charAt(pos);
            if (backslashEscapes && c == '\\') {
                pos += 2;
            } else if (c == '\'') {
                if (peek(1) == '\'') {
                    pos += 2;
                } else {
                    pos++;
                    return sql.substring(start, pos);
                }
            } else {
                pos++;
            }
        }
        throw new QueryRejectedException("Unterminated string literal starting at position " + (start + 1));
    }

    private String readQuotedIdentifier() {
        int start = pos;
        StringBuilder name = new StringBuilder();
        pos++;
        while (pos < sql.length()) {
            char c = sql.charAt(pos);
            if (c == '"') {
                if (peek(1) == '"') {
                    name.append('"');
                    pos += 2;
                } else {
                    pos++;
                    return name.toString();
                }
            } else {
                name.append(c);
                pos++;
            }
        }
        throw new QueryRejectedException("Unterminated quoted identifier starting at position " + (start + 1));
    }

    private SqlToken readDollar(int start) {
        if (Character.isDigit(peek(1))) {
            pos++;
            while (pos < sql.length() && Character.isDigit(sql.charAt(pos))) pos++;
            return new SqlToken(SqlToken.Type.PARAMETER, sql.substring(start, pos), start);
        }
        int tagEnd = pos + 1;
        while (tagEnd < sql.length() && isIdentifierPart(sql.charAt(tagEnd)) && sql.charAt(tagEnd) != '$') {
            tagEnd++;
        }
        if (tagEnd < sql.length() && sql.charAt(tagEnd) == '$') {
            String tag = sql.substring(start, tagEnd + 1);
            int close = sql.indexOf(tag, tagEnd + 1);
            if (close < 0) {
                throw new QueryRejectedException("Unterminated dollar-quoted string starting at position " + (start + 1));
            }
            pos = close + tag.length();
            return new SqlToken(SqlToken.Type.STRING, sql.substring(start, pos), start);
        }
        pos++;
        return new SqlToken(SqlToken.Type.SYMBOL, "$", start);
    }

    private String readNumber() {
        int start = pos;
        while (pos < sql.length()) {
            char c = sql.charAt(pos);
            if (Character.isDigit(c) || c == '.') {
                pos++;
            } else if ((c == 'e' || c == 'E')
                    && (Character.isDigit(peek(1)) || ((peek(1) == '+' || peek(1) == '-') && Character.isDigit(peek(2))))) {
                pos += 2;
            } else {
                break;
            }
        }
        return sql.substring(start, pos);
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < sql.length() ? sql.charAt(i) : '\0';
    }

    private static boolean isStringPrefix(char c) {
        return c == 'e' || c == 'E' || c == 'b' || c == 'B' || c == 'x' || c == 'X' || c == 'n' || c == 'N';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}

package com.cellsafety.analysis.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Splits cell source into tokens, emitting INDENT/DEDENT around indented blocks.
 * Newlines inside brackets and after a backslash continuation are not significant.
 */
final class Tokenizer {

    enum Kind { NAME, NUMBER, STRING, OP, NEWLINE, INDENT, DEDENT, EOF }

    record Token(Kind kind, String text, int line, Object value) {
        boolean is(Kind k, String t) { return kind == k && text.equals(t); }

        @Override
        public String toString() {
            return kind + (text.isEmpty() ? "" : " '" + text + "'") + " @" + line;
        }
    }

    private static final String[] OPERATORS = {
        "**=", "//=", ">>=", "<<=", "...",
        "->", "**", "//", "==", "!=", "<=", ">=", "<<", ">>",
        "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=", ":=",
        "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
        "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "=",
    };

    private final String src;
    private int pos = 0;
    private int line = 1;
    private int bracketDepth = 0;
    private boolean atLineStart = true;
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final List<Token> tokens = new ArrayList<>();

    Tokenizer(String src) {
        this.src = src.replace("\r\n", "\n").replace('\r', '\n');
        indents.push(0);
    }

    List<Token> tokenize() {
        while (pos < src.length()) {
            if (atLineStart && bracketDepth == 0) {
                if (handleIndentation()) continue;
            }
            char c = src.charAt(pos);
            if (c == '\n') {
                if (bracketDepth == 0 && !lastIs(Kind.NEWLINE)) {
                    emit(Kind.NEWLINE, "", null);
                }
                pos++;
                line++;
                atLineStart = bracketDepth == 0;
            } else if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\' && peek(1) == '\n') {
                pos += 2;
                line++;
            } else if (isStringStart()) {
                readString();
            } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
                readNumber();
            } else if (Character.isJavaIdentifierStart(c)) {
                readName();
            } else {
                readOperator();
            }
        }
        if (!tokens.isEmpty() && !lastIs(Kind.NEWLINE)) {
            emit(Kind.NEWLINE, "", null);
        }
        while (indents.peek() > 0) {
            indents.pop();
            emit(Kind.DEDENT, "", null);
        }
        emit(Kind.EOF, "", null);
        return tokens;
    }

    /** Measures leading whitespace; returns true if the line was blank or comment-only and consumed. */
    private boolean handleIndentation() {
        int width = 0;
        int p = pos;
        while (p < src.length() && (src.charAt(p) == ' ' || src.charAt(p) == '\t')) {
            width += src.charAt(p) == '\t' ? 8 - (width % 8) : 1;
            p++;
        }
        if (p >= src.length() || src.charAt(p) == '\n' || src.charAt(p) == '#') {
            pos = p;
            if (pos < src.length() && src.charAt(pos) == '#') skipComment();
            if (pos < src.length()) {
                pos++;
                line++;
            }
            return true;
        }
        pos = p;
        atLineStart = false;
        if (width > indents.peek()) {
            indents.push(width);
            emit(Kind.INDENT, "", null);
        } else {
            while (width < indents.peek()) {
                indents.pop();
                emit(Kind.DEDENT, "", null);
            }
            if (width != indents.peek()) {
                throw new CellParser.ParseException("inconsistent dedent", line);
            }
        }
        return false;
    }

    private void skipComment() {
        while (pos < src.length() && src.charAt(pos) != '\n') pos++;
    }

    private boolean isStringStart() {
        int p = pos;
        int prefix = 0;
        while (p < src.length() && prefix < 2 && "rRbBuUfF".indexOf(src.charAt(p)) >= 0) {
            p++;
            prefix++;
        }
        return p < src.length() && (src.charAt(p) == '\'' || src.charAt(p) == '"');
    }

    private void readString() {
        int startLine = line;
        boolean raw = false;
        while ("rRbBuUfF".indexOf(src.charAt(pos)) >= 0) {
            if (src.charAt(pos) == 'r' || src.charAt(pos) == 'R') raw = true;
            pos++;
        }
        char quote = src.charAt(pos);
        boolean triple = peek(1) == quote && peek(2) == quote;
        pos += triple ? 3 : 1;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= src.length()) {
                throw new CellParser.ParseException("unterminated string literal", startLine);
            }
            char c = src.charAt(pos);
            if (triple && c == quote && peek(1) == quote && peek(2) == quote) {
                pos += 3;
                break;
            }
            if (!triple && c == quote) {
                pos++;
                break;
            }
            if (!triple && c == '\n') {
                throw new CellParser.ParseException("unterminated string literal", startLine);
            }
            if (c == '\\' && pos + 1 < src.length()) {
                char next = src.charAt(pos + 1);
                if (raw) {
                    sb.append(c).append(next);
                } else {
                    switch (next) {
                        case 'n' -> sb.append('\n');
                        case 't' -> sb.append('\t');
                        case 'r' -> sb.append('\r');
                        case '0' -> sb.append('\0');
                        case '\n' -> line++;
                        default -> sb.append(next);
                    }
                }
                if (next == '\n' && raw) line++;
                pos += 2;
                continue;
            }
            if (c == '\n') line++;
            sb.append(c);
            pos++;
        }
        // adjacent literals concatenate
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).kind() == Kind.STRING) {
            Token prev = tokens.remove(tokens.size() - 1);
            String joined = prev.value() + sb.toString();
            tokens.add(new Token(Kind.STRING, joined, prev.line(), joined));
            return;
        }
        String value = sb.toString();
        tokens.add(new Token(Kind.STRING, value, startLine, value));
    }

    private void readNumber() {
        int start = pos;
        if (src.charAt(pos) == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
            pos += 2;
            while (pos < src.length() && (Character.digit(src.charAt(pos), 16) >= 0 || src.charAt(pos) == '_')) pos++;
            String text = src.substring(start, pos);
            emit(Kind.NUMBER, text, Long.parseLong(text.substring(2).replace("_", ""), 16));
            return;
        }
        boolean floating = false;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (Character.isDigit(c) || c == '_') {
                pos++;
            } else if (c == '.' && !floating) {
                floating = true;
                pos++;
            } else if ((c == 'e' || c == 'E')
                    && (Character.isDigit(peek(1)) || ((peek(1) == '+' || peek(1) == '-') && Character.isDigit(peek(2))))) {
                floating = true;
                pos += 2;
            } else {
                break;
            }
        }
        if (pos < src.length() && (src.charAt(pos) == 'j' || src.charAt(pos) == 'J')) {
            throw new CellParser.ParseException("complex literals are not supported", line);
        }
        String text = src.substring(start, pos);
        String digits = text.replace("_", "");
        try {
            emit(Kind.NUMBER, text, floating ? (Object) Double.parseDouble(digits) : (Object) Long.parseLong(digits));
        } catch (NumberFormatException e) {
            throw new CellParser.ParseException("malformed number literal: " + text, line);
        }
    }

    private void readName() {
        int start = pos;
        while (pos < src.length() && Character.isJavaIdentifierPart(src.charAt(pos))) pos++;
        emit(Kind.NAME, src.substring(start, pos), null);
    }

    private void readOperator() {
        for (String op : OPERATORS) {
            if (src.startsWith(op, pos)) {
                if ("([{".contains(op)) bracketDepth++;
                if (")]}".contains(op)) bracketDepth = Math.max(0, bracketDepth - 1);
                pos += op.length();
                emit(Kind.OP, op, null);
                return;
            }
        }
        throw new CellParser.ParseException("unexpected character '" + src.charAt(pos) + "'", line);
    }

    private char peek(int offset) {
        int p = pos + offset;
        return p < src.length() ? src.charAt(p) : '\0';
    }

    private boolean lastIs(Kind kind) {
        return tokens.isEmpty() ? kind == Kind.NEWLINE : tokens.get(tokens.size() - 1).kind() == kind;
    }

    private void emit(Kind kind, String text, Object value) {
        tokens.add(new Token(kind, text, line, value));
    }
}

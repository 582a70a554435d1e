/*
 * Anarres Verilog Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.vpp;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.anarres.vpp.TokenType.*;

/**
 * Lexes Verilog and SystemVerilog source text into {@link Token Tokens}.
 *
 * Every character of the input belongs to exactly one token, so
 * concatenating the text of all tokens reproduces the input.
 * Whitespace, newlines and comments are returned as non-significant
 * tokens. Malformed input produces {@link TokenType#INVALID} tokens;
 * the lexer never throws.
 *
 * The lexer understands the shape of a <code>`define</code> line:
 * the macro name and any parameter list are returned as ordinary
 * tokens, and everything up to the unescaped end of line is returned
 * as a single {@link TokenType#DEFINE_BODY} token.
 */
public class VerilogLexer {

    private static final Logger LOG = LoggerFactory.getLogger(VerilogLexer.class);

    /* Longest first. */
    private static final String[] OPERATORS = {
        "<<<=", ">>>=",
        "===", "!==", "==?", "!=?", "<<<", ">>>", "<<=", ">>=",
        "->>", "<->", "|->", "|=>", "#-#", "#=#",
        "**", "==", "!=", "<=", ">=", "&&", "||", "<<", ">>", "->",
        "+:", "-:", "::", "++", "--", "+=", "-=", "*=", "/=", "%=",
        "&=", "|=", "^=", "~&", "~|", "~^", "^~", "##", "@@",
        "`\"", "``"
    };

    private final String text;
    private final int base;
    private int pos;
    private int line;
    private int column;
    private final Deque<Token> pending = new ArrayDeque<Token>();

    public VerilogLexer(@Nonnull String text) {
        this(text, 1, 0, 0);
    }

    /**
     * Creates a lexer for a fragment of a larger source, such as the
     * body of a macro, so that token locations refer to the larger source.
     */
    public VerilogLexer(@Nonnull String text, @Nonnegative int line, @Nonnegative int column, @Nonnegative int offset) {
        this.text = text;
        this.pos = 0;
        this.line = line;
        this.column = column;
        this.base = offset;
    }

    /**
     * Lexes the whole input, returning every token including
     * whitespace and comments, but not the final EOF.
     */
    @Nonnull
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<Token>();
        for (;;) {
            Token tok = token();
            if (tok.getType() == EOF)
                break;
            tokens.add(tok);
        }
        return tokens;
    }

    /**
     * Lexes the whole input, returning only the significant tokens.
     */
    @Nonnull
    public List<Token> tokenizeSignificant() {
        return significant(tokenize());
    }

    /**
     * Returns the significant tokens of the given sequence, in order.
     */
    @Nonnull
    public static List<Token> significant(@Nonnull List<Token> tokens) {
        List<Token> out = new ArrayList<Token>(tokens.size());
        for (Token tok : tokens)
            if (tok.isSignificant())
                out.add(tok);
        return out;
    }

    /**
     * Returns the next token, or a token of type {@link TokenType#EOF}.
     */
    @Nonnull
    public Token token() {
        if (!pending.isEmpty())
            return pending.removeFirst();
        return lex();
    }

    @Nonnull
    private Token lex() {
        if (pos >= text.length())
            return new Token(EOF, "", line, column, base + pos);

        char c = text.charAt(pos);
        switch (c) {
            case '\n':
                return make(NEWLINE, pos + 1);
            case ' ':
            case '\t':
            case '\r':
            case '\f':
                return make(WHITESPACE, skipWhitespace(pos));
            case '/':
                if (peek(1) == '/')
                    return make(COMMENT, lineEnd(pos));
                if (peek(1) == '*')
                    return blockComment();
                return operator();
            case '"':
                return string();
            case '\\':
                if (isContinuation(pos))
                    return make(WHITESPACE, skipWhitespace(pos));
                return escapedIdentifier();
            case '`':
                return backtick();
            case '$':
                if (isIdentifierPart(peek(1)))
                    return make(SYSTEM_IDENTIFIER, identifierEnd(pos + 1));
                return operator();
            case '\'':
                int b = isBase(pos + 1);
                if (b != -1)
                    return make(NUMBER, basedValueEnd(b));
                if ("01xXzZ".indexOf(peek(1)) != -1 && !isIdentifierPart(peek(2)))
                    return make(NUMBER, pos + 2);
                return operator();
            case '(':
                return make(LPAREN, pos + 1);
            case ')':
                return make(RPAREN, pos + 1);
            case '[':
                return make(LBRACKET, pos + 1);
            case ']':
                return make(RBRACKET, pos + 1);
            case '{':
                return make(LBRACE, pos + 1);
            case '}':
                return make(RBRACE, pos + 1);
            case ',':
                return make(COMMA, pos + 1);
            case ';':
                return make(SEMICOLON, pos + 1);
            default:
                if (Character.isDigit(c))
                    return number();
                if (isIdentifierStart(c))
                    return make(IDENTIFIER, identifierEnd(pos));
                return operator();
        }
    }

    private char peek(int ahead) {
        int i = pos + ahead;
        return i < text.length() ? text.charAt(i) : '\0';
    }

    private char charAt(int i) {
        return i < text.length() ? text.charAt(i) : '\0';
    }

    /* Builds a token from pos to end and advances over it. */
    @Nonnull
    private Token make(@Nonnull TokenType type, int end) {
        Token tok = new Token(type, text.substring(pos, end), line, column, base + pos);
        for (int i = pos; i < end; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                column = 0;
            } else {
                column++;
            }
        }
        pos = end;
        return tok;
    }

    private boolean isContinuation(int i) {
        if (charAt(i) != '\\')
            return false;
        char n = charAt(i + 1);
        return n == '\n' || (n == '\r' && charAt(i + 2) == '\n');
    }

    /* Horizontal whitespace, including backslash-newline continuations. */
    private int skipWhitespace(int i) {
        for (;;) {
            char c = charAt(i);
            if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                i++;
            } else if (isContinuation(i)) {
                i += charAt(i + 1) == '\r' ? 3 : 2;
            } else {
                return i;
            }
        }
    }

    private int lineEnd(int i) {
        while (i < text.length() && text.charAt(i) != '\n')
            i++;
        return i;
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9') || c == '$';
    }

    private int identifierEnd(int i) {
        while (isIdentifierPart(charAt(i)))
            i++;
        return i;
    }

    @Nonnull
    private Token blockComment() {
        int end = text.indexOf("*/", pos + 2);
        if (end == -1) {
            LOG.debug("Unterminated comment at line {}", line);
            return make(INVALID, text.length());
        }
        return make(COMMENT, end + 2);
    }

    @Nonnull
    private Token string() {
        int i = pos + 1;
        for (;;) {
            char c = charAt(i);
            if (i >= text.length() || c == '\n')
                return make(INVALID, i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            i++;
            if (c == '"')
                return make(STRING, i);
        }
    }

    @Nonnull
    private Token escapedIdentifier() {
        int i = pos + 1;
        while (i < text.length() && !Character.isWhitespace(text.charAt(i)))
            i++;
        if (i == pos + 1)
            return make(INVALID, i);
        return make(ESCAPED_IDENTIFIER, i);
    }

    /* Returns the index after the base specifier starting at i, or -1. */
    private int isBase(int i) {
        if (charAt(i) == 's' || charAt(i) == 'S')
            i++;
        if ("bBoOdDhH".indexOf(charAt(i)) == -1)
            return -1;
        return i + 1;
    }

    private int basedValueEnd(int i) {
        while (charAt(i) == ' ' || charAt(i) == '\t')
            i++;
        for (;;) {
            char c = charAt(i);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '?')
                i++;
            else
                return i;
        }
    }

    @Nonnull
    private Token number() {
        int i = pos;
        while (Character.isDigit(charAt(i)) || charAt(i) == '_')
            i++;
        if (charAt(i) == '.' && Character.isDigit(charAt(i + 1))) {
            i++;
            while (Character.isDigit(charAt(i)) || charAt(i) == '_')
                i++;
        }
        if ((charAt(i) == 'e' || charAt(i) == 'E')
                && (Character.isDigit(charAt(i + 1))
                || ((charAt(i + 1) == '+' || charAt(i + 1) == '-') && Character.isDigit(charAt(i + 2))))) {
            i += 2;
            while (Character.isDigit(charAt(i)))
                i++;
        }
        if (charAt(i) == '\'') {
            int b = isBase(i + 1);
            if (b != -1)
                return make(NUMBER, basedValueEnd(b));
        }
        /* Time literals: 10ns, 1.5us */
        int unit = identifierEnd(i);
        String suffix = text.substring(i, unit);
        if (suffix.equals("s") || suffix.equals("ms") || suffix.equals("us")
                || suffix.equals("ns") || suffix.equals("ps") || suffix.equals("fs"))
            i = unit;
        return make(NUMBER, i);
    }

    @Nonnull
    private Token operator() {
        for (String op : OPERATORS)
            if (text.startsWith(op, pos))
                return make(OPERATOR, pos + op.length());
        return make(OPERATOR, pos + 1);
    }

    @Nonnull
    private Token backtick() {
        int end = identifierEnd(pos + 1);
        if (end == pos + 1) {
            if (peek(1) == '"' || peek(1) == '`')
                return make(OPERATOR, pos + 2);
            return make(INVALID, pos + 1);
        }
        TokenType type = TokenType.forDirective(text.substring(pos, end));
        Token tok = make(type, end);
        if (type == PP_DEFINE)
            define();
        return tok;
    }

    /*
     * Queues the remainder of a `define line: the name, an optional
     * parameter list which must follow the name immediately, and the body.
     */
    private void define() {
        if (pos < skipWhitespace(pos))
            pending.add(make(WHITESPACE, skipWhitespace(pos)));
        if (isIdentifierStart(charAt(pos))) {
            pending.add(make(IDENTIFIER, identifierEnd(pos)));
            if (charAt(pos) == '(')
                parameters();
            if (pos < skipWhitespace(pos))
                pending.add(make(WHITESPACE, skipWhitespace(pos)));
        }
        pending.add(make(DEFINE_BODY, bodyEnd(pos)));
    }

    /* Default values may contain parentheses of their own. */
    private void parameters() {
        int depth = 0;
        for (;;) {
            if (pos >= text.length() || charAt(pos) == '\n')
                return;
            Token tok = lex();
            pending.add(tok);
            if (tok.getType() == LPAREN)
                depth++;
            else if (tok.getType() == RPAREN && --depth == 0)
                return;
        }
    }

    /* Stops at an unescaped newline or a line comment outside a string. */
    private int bodyEnd(int i) {
        boolean quoted = false;
        for (;;) {
            char c = charAt(i);
            if (i >= text.length() || c == '\n')
                return i;
            if (isContinuation(i)) {
                i += charAt(i + 1) == '\r' ? 3 : 2;
                continue;
            }
            if (quoted) {
                if (c == '\\')
                    i++;
                else if (c == '"')
                    quoted = false;
            } else if (c == '"') {
                quoted = true;
            } else if (c == '/' && charAt(i + 1) == '/') {
                return i;
            } else if (c == '/' && charAt(i + 1) == '*') {
                int end = text.indexOf("*/", i + 2);
                if (end == -1)
                    return text.length();
                i = end + 1;
            }
            i++;
        }
    }
}

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

import java.util.HashMap;
import java.util.Map;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * The kinds of {@link Token} produced by the {@link VerilogLexer}.
 */
public enum TokenType {

    IDENTIFIER,
    /** A system task or function, e.g. <code>$display</code>. */
    SYSTEM_IDENTIFIER,
    /** <code>\name</code>, terminated by whitespace. */
    ESCAPED_IDENTIFIER,
    NUMBER,
    STRING,

    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    COMMA,
    SEMICOLON,
    OPERATOR,

    /** A <code>`name</code> which is not a handled directive. */
    MACRO_IDENTIFIER,
    PP_DEFINE("`define"),
    PP_UNDEF("`undef"),
    PP_UNDEFINEALL("`undefineall"),
    PP_IFDEF("`ifdef"),
    PP_IFNDEF("`ifndef"),
    PP_ELSIF("`elsif"),
    PP_ELSE("`else"),
    PP_ENDIF("`endif"),
    /** The raw text of a <code>`define</code> body, up to the unescaped end of line. */
    DEFINE_BODY,

    WHITESPACE,
    NEWLINE,
    COMMENT,
    INVALID,
    EOF;

    private static final Map<String, TokenType> DIRECTIVES = new HashMap<String, TokenType>();

    static {
        for (TokenType type : values())
            if (type.directive != null)
                DIRECTIVES.put(type.directive, type);
    }

    @CheckForNull
    private final String directive;

    TokenType() {
        this(null);
    }

    TokenType(@CheckForNull String directive) {
        this.directive = directive;
    }

    /**
     * Returns the directive type for the given backtick-prefixed text,
     * or {@link #MACRO_IDENTIFIER} if the text names no handled directive.
     */
    @Nonnull
    public static TokenType forDirective(@Nonnull String text) {
        TokenType type = DIRECTIVES.get(text);
        return type == null ? MACRO_IDENTIFIER : type;
    }

    /**
     * Returns true for tokens which carry no syntax: whitespace,
     * newlines and comments.
     */
    public boolean isWhite() {
        return this == WHITESPACE || this == NEWLINE || this == COMMENT;
    }

    /** Returns true for the directives which the preprocessor interprets. */
    public boolean isDirective() {
        return directive != null || this == DEFINE_BODY;
    }
}

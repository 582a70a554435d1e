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

import com.google.gson.JsonObject;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * A Verilog token.
 *
 * Tokens are produced once by the {@link VerilogLexer} and are never
 * modified afterwards. The text of a token is exactly the source text
 * it was lexed from.
 */
public final class Token {

    /** A token with no location, used to mark the end of a stream. */
    public static final Token EOF = new Token(TokenType.EOF, "", 0, 0, 0);

    private final TokenType type;
    private final String text;
    private final int line;
    private final int column;
    private final int offset;
    private final boolean significant;

    public Token(@Nonnull TokenType type, @Nonnull String text,
            @Nonnegative int line, @Nonnegative int column, @Nonnegative int offset) {
        this.type = type;
        this.text = text;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.significant = !type.isWhite();
    }

    /**
     * Returns the type of this token.
     */
    @Nonnull
    public TokenType getType() {
        return type;
    }

    /**
     * Returns the source text of this token.
     */
    @Nonnull
    public String getText() {
        return text;
    }

    /**
     * Returns the 1-based line at which this token starts,
     * or 0 for synthetic tokens.
     */
    public int getLine() {
        return line;
    }

    /**
     * Returns the 0-based column at which this token starts.
     */
    public int getColumn() {
        return column;
    }

    /**
     * Returns the character offset of this token in its source.
     */
    public int getOffset() {
        return offset;
    }

    /**
     * Returns false for whitespace, newline and comment tokens.
     */
    public boolean isSignificant() {
        return significant;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("type", type.name());
        result.addProperty("text", text);
        result.addProperty("line", line);
        result.addProperty("col", column);
        return result;
    }

    @Override
    public int hashCode() {
        return ((type.hashCode() * 31 + text.hashCode()) * 31 + offset) * 31 + line;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Token))
            return false;
        Token o = (Token) obj;
        return type == o.type
                && text.equals(o.text)
                && line == o.line
                && column == o.column
                && offset == o.offset;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append('[').append(type.name());
        if (line != 0)
            buf.append('@').append(line).append(',').append(column);
        buf.append("]:");
        buf.append('"').append(text).append('"');
        return buf.toString();
    }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import static org.anarres.vpp.TokenType.*;

/**
 * The extent of one macro invocation within a token list: the
 * <code>`name</code> token and, for function-like macros, the
 * parenthesized argument list.
 */
/* pp */ final class MacroCall {

    private final List<Token> tokens;
    private final int start;
    private final int end;
    @CheckForNull
    private final List<List<Token>> args;
    private final boolean terminated;

    private MacroCall(List<Token> tokens, int start, int end, @CheckForNull List<List<Token>> args, boolean terminated) {
        this.tokens = tokens;
        this.start = start;
        this.end = end;
        this.args = args;
        this.terminated = terminated;
    }

    /**
     * Reads the invocation starting at the macro name token at
     * <code>start</code>. An argument list is only read if
     * <code>wantArgs</code> is set and the next token is an open
     * parenthesis. Arguments are split on commas which are not nested
     * inside parentheses, brackets or braces.
     */
    @Nonnull
    public static MacroCall parse(@Nonnull List<Token> tokens, @Nonnegative int start, boolean wantArgs) {
        int i = start + 1;
        if (!wantArgs || i >= tokens.size() || tokens.get(i).getType() != LPAREN)
            return new MacroCall(tokens, start, i, null, true);

        List<List<Token>> args = new ArrayList<List<Token>>();
        List<Token> arg = new ArrayList<Token>();
        int depth = 0;
        ARGS:
        for (i++; i < tokens.size(); i++) {
            Token tok = tokens.get(i);
            if (tok.getType().isDirective())
                break;
            switch (tok.getType()) {
                case COMMA:
                    if (depth == 0) {
                        args.add(arg);
                        arg = new ArrayList<Token>();
                        continue ARGS;
                    }
                    break;
                case LPAREN:
                case LBRACKET:
                case LBRACE:
                    depth++;
                    break;
                case RPAREN:
                    if (depth == 0) {
                        args.add(arg);
                        return new MacroCall(tokens, start, i + 1, args, true);
                    }
                    depth--;
                    break;
                case RBRACKET:
                case RBRACE:
                    /* A stray closer is an ordinary argument token. */
                    if (depth > 0)
                        depth--;
                    break;
                default:
                    break;
            }
            arg.add(tok);
        }
        return new MacroCall(tokens, start, i, null, false);
    }

    /**
     * Returns the index after the last token of this invocation.
     */
    public int getEnd() {
        return end;
    }

    /**
     * Returns the actual arguments, or null if there was no argument list.
     *
     * <code>`M()</code> yields one empty argument.
     */
    @CheckForNull
    public List<List<Token>> getArgs() {
        return args;
    }

    /**
     * Returns false if the argument list ran into the end of the input
     * or into a directive.
     */
    public boolean isTerminated() {
        return terminated;
    }

    /**
     * Returns all the tokens of this invocation, unexpanded.
     */
    @Nonnull
    public List<Token> getTokens() {
        return Collections.unmodifiableList(tokens.subList(start, end));
    }
}

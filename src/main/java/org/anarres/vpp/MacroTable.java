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
import java.util.Map;
import java.util.TreeMap;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.anarres.vpp.TokenType.*;

/**
 * The macros defined during one preprocessing run.
 *
 * A MacroTable is owned by a single {@link Preprocessor} and is
 * discarded with it. Snapshots returned by {@link #getMacros()} are
 * persistent and are not affected by later definitions.
 */
public class MacroTable {

    private static final Logger LOG = LoggerFactory.getLogger(MacroTable.class);

    public static final int DEFAULT_MAX_RECURSION_DEPTH = 64;

    private static final String __LINE__ = "__LINE__";
    private static final String __FILE__ = "__FILE__";

    private PMap<String, MacroDefinition> macros = HashTreePMap.empty();
    private int maxRecursionDepth = DEFAULT_MAX_RECURSION_DEPTH;
    private String fileName = "<no file>";

    /**
     * Defines the given macro, replacing any previous definition.
     *
     * @return the previous definition, or null.
     */
    @CheckForNull
    public MacroDefinition define(@Nonnull MacroDefinition m) {
        MacroDefinition previous = macros.get(m.getName());
        macros = macros.plus(m.getName(), m);
        LOG.debug("Defined macro {}", m);
        return previous;
    }

    /**
     * Removes the named macro. Unknown names are ignored.
     *
     * @return true if the macro was defined.
     */
    public boolean undef(@Nonnull String name) {
        if (!macros.containsKey(name))
            return false;
        macros = macros.minus(name);
        return true;
    }

    /**
     * Removes every macro.
     */
    public void undefineAll() {
        macros = HashTreePMap.empty();
    }

    /**
     * Defines an object-like macro whose body is the lexed value,
     * as for <code>+define+name=value</code>.
     */
    public void setExternalDefine(@Nonnull String name, @Nonnull String value) {
        List<Token> body = new VerilogLexer(value).tokenizeSignificant();
        define(new MacroDefinition(name, body, null));
    }

    public boolean isDefined(@Nonnull String name) {
        return macros.containsKey(name);
    }

    /**
     * Returns the named macro, or null if it is not defined.
     */
    @CheckForNull
    public MacroDefinition lookup(@Nonnull String name) {
        return macros.get(name);
    }

    /**
     * Returns an immutable snapshot of the current definitions.
     */
    @Nonnull
    public Map<String, MacroDefinition> getMacros() {
        return macros;
    }

    /**
     * Sets the maximum nesting of macro expansions. An invocation
     * nested deeper than this is reported as recursive and left
     * unexpanded.
     */
    public void setMaxRecursionDepth(@Nonnegative int maxRecursionDepth) {
        this.maxRecursionDepth = maxRecursionDepth;
    }

    @Nonnegative
    public int getMaxRecursionDepth() {
        return maxRecursionDepth;
    }

    /**
     * Sets the name returned by <code>`__FILE__</code>.
     */
    public void setFileName(@Nonnull String fileName) {
        this.fileName = fileName;
    }

    /**
     * Expands the given tokens, which normally begin with a macro
     * invocation, re-scanning the result for nested invocations.
     *
     * Problems are reported to the listener; the offending invocation
     * is then returned unexpanded.
     */
    @Nonnull
    public List<Token> expand(@Nonnull List<Token> invocation, @Nonnull PreprocessorListener listener) {
        List<Token> out = new ArrayList<Token>();
        rescan(invocation, 0, new Expansion(listener), out);
        return out;
    }

    /* Tracks one top-level expansion, so that a runaway recursion is only reported once. */
    /* pp */ static class Expansion {

        private final PreprocessorListener listener;
        private boolean overflowed;

        Expansion(@Nonnull PreprocessorListener listener) {
            this.listener = listener;
        }
    }

    /*
     * The result of replacing one invocation. If expanded, the tokens
     * are the substituted body, still to be rescanned; otherwise they
     * stand for themselves.
     */
    /* pp */ static final class Replacement {

        private final int end;
        private final List<Token> tokens;
        private final boolean expanded;

        Replacement(int end, @Nonnull List<Token> tokens, boolean expanded) {
            this.end = end;
            this.tokens = tokens;
            this.expanded = expanded;
        }

        /* pp */ int getEnd() {
            return end;
        }

        @Nonnull
        /* pp */ List<Token> getTokens() {
            return tokens;
        }

        /* pp */ boolean isExpanded() {
            return expanded;
        }
    }

    private void rescan(@Nonnull List<Token> tokens, int depth, @Nonnull Expansion expansion, @Nonnull List<Token> out) {
        int i = 0;
        while (i < tokens.size()) {
            Token tok = tokens.get(i);
            if (tok.getType() == MACRO_IDENTIFIER) {
                Replacement r = replace(tokens, i, depth, expansion);
                if (r.isExpanded())
                    rescan(r.getTokens(), depth + 1, expansion, out);
                else
                    out.addAll(r.getTokens());
                i = r.getEnd();
            } else {
                out.add(tok);
                i++;
            }
        }
    }

    /**
     * Replaces the invocation at <code>start</code> by one level of
     * its macro body. <code>depth</code> is the number of expansions
     * enclosing the invocation.
     *
     * Problems are reported to the listener of the expansion, and the
     * invocation is then returned unexpanded.
     */
    @Nonnull
    /* pp */ Replacement replace(@Nonnull List<Token> tokens, @Nonnegative int start, @Nonnegative int depth,
            @Nonnull Expansion expansion) {
        Token tok = tokens.get(start);
        String name = tok.getText().substring(1);
        MacroDefinition m = macros.get(name);
        if (m == null || expansion.overflowed) {
            Token builtin = m == null ? builtin(name, tok) : null;
            return new Replacement(start + 1, Collections.singletonList(builtin != null ? builtin : tok), false);
        }

        MacroCall call = MacroCall.parse(tokens, start, m.isFunctionLike());
        if (!call.isTerminated()) {
            expansion.listener.handleError(new PreprocessError(ErrorKind.UNTERMINATED_MACRO_CALL, tok,
                    "Unterminated argument list for macro " + name));
            return new Replacement(start + 1, Collections.singletonList(tok), false);
        }

        List<List<Token>> args = call.getArgs();
        if (m.isFunctionLike()) {
            if (args == null) {
                expansion.listener.handleError(new PreprocessError(ErrorKind.MACRO_ARITY_MISMATCH, tok,
                        "macro " + name + " requires an argument list"));
                return new Replacement(call.getEnd(), Collections.singletonList(tok), false);
            }
            args = bind(m, args);
            if (args == null) {
                expansion.listener.handleError(new PreprocessError(ErrorKind.MACRO_ARITY_MISMATCH, tok,
                        "macro " + name + " has " + m.getArgs() + " parameters "
                        + "but given " + call.getArgs().size() + " args"));
                return new Replacement(call.getEnd(), call.getTokens(), false);
            }
        }

        if (depth >= maxRecursionDepth) {
            expansion.overflowed = true;
            expansion.listener.handleError(new PreprocessError(ErrorKind.RECURSIVE_MACRO_EXPANSION, tok,
                    "Expansion of macro " + name + " exceeds depth " + maxRecursionDepth));
            return new Replacement(call.getEnd(), call.getTokens(), false);
        }

        return new Replacement(call.getEnd(), substitute(m, args), true);
    }

    /*
     * Matches actual arguments to parameters. Omitted trailing arguments
     * and empty ones take the parameter's default value, if it has one.
     * Returns null on a count mismatch.
     */
    @CheckForNull
    private static List<List<Token>> bind(@Nonnull MacroDefinition m, @Nonnull List<List<Token>> args) {
        /* `M() for a macro with no parameters. */
        if (m.getArgs() == 0 && args.size() == 1 && args.get(0).isEmpty())
            return Collections.emptyList();
        if (args.size() > m.getArgs())
            return null;
        List<List<Token>> out = new ArrayList<List<Token>>(m.getArgs());
        for (int i = 0; i < m.getArgs(); i++) {
            List<Token> arg = i < args.size() ? args.get(i) : null;
            List<Token> value = m.getDefault(i);
            if (value != null && (arg == null || arg.isEmpty()))
                arg = value;
            if (arg == null)
                return null;
            out.add(arg);
        }
        return out;
    }

    /* Replaces parameters by arguments, then performs `` pastes. */
    @Nonnull
    private static List<Token> substitute(@Nonnull MacroDefinition m, @CheckForNull List<List<Token>> args) {
        List<Token> out = new ArrayList<Token>();
        boolean paste = false;
        for (Token tok : m.getBody()) {
            if (tok.getType() == OPERATOR && tok.getText().equals("``")) {
                paste = !out.isEmpty();
                continue;
            }
            List<Token> replacement;
            int idx = tok.getType() == IDENTIFIER ? m.getParameters().indexOf(tok.getText()) : -1;
            if (idx != -1 && args != null)
                replacement = args.get(idx);
            else
                replacement = Collections.singletonList(tok);
            if (paste && !replacement.isEmpty()) {
                Token left = out.remove(out.size() - 1);
                Token right = replacement.get(0);
                out.addAll(new VerilogLexer(left.getText() + right.getText(),
                        left.getLine(), left.getColumn(), left.getOffset()).tokenizeSignificant());
                replacement = replacement.subList(1, replacement.size());
            }
            paste = false;
            out.addAll(replacement);
        }
        return out;
    }

    @CheckForNull
    private Token builtin(@Nonnull String name, @Nonnull Token orig) {
        if (__LINE__.equals(name))
            return new Token(NUMBER, Integer.toString(orig.getLine()),
                    orig.getLine(), orig.getColumn(), orig.getOffset());
        if (__FILE__.equals(name)) {
            StringBuilder buf = new StringBuilder("\"");
            for (int i = 0; i < fileName.length(); i++) {
                char c = fileName.charAt(i);
                if (c == '\\' || c == '"')
                    buf.append('\\');
                buf.append(c);
            }
            buf.append('"');
            return new Token(STRING, buf.toString(),
                    orig.getLine(), orig.getColumn(), orig.getOffset());
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        for (MacroDefinition m : new TreeMap<String, MacroDefinition>(macros).values())
            buf.append("`define ").append(m).append("\n");
        return buf.toString();
    }
}

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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * A text macro, as defined by <code>`define</code> or on the
 * command line.
 *
 * A macro is function-like if its name was immediately followed by
 * a parameter list, even an empty one. The body holds only
 * significant tokens.
 */
public final class MacroDefinition {

    private final String name;
    private final List<String> parameters;
    private final List<List<Token>> defaults;
    private final boolean functionLike;
    private final List<Token> body;
    @CheckForNull
    private final Token source;

    /**
     * Constructs a function-like macro.
     *
     * @throws IllegalArgumentException if a parameter name is repeated.
     */
    public MacroDefinition(@Nonnull String name, @Nonnull List<String> parameters,
            @Nonnull List<Token> body, @CheckForNull Token source) {
        this(name, parameters, Collections.<List<Token>>nCopies(parameters.size(), null), true, body, source);
    }

    /**
     * Constructs a function-like macro whose parameters may have
     * default values, as in <code>`define M(a, b=1)</code>. A null
     * entry in <code>defaults</code> means the parameter has none.
     *
     * @throws IllegalArgumentException if a parameter name is repeated,
     * or if there is not one default entry per parameter.
     */
    public MacroDefinition(@Nonnull String name, @Nonnull List<String> parameters,
            @Nonnull List<List<Token>> defaults,
            @Nonnull List<Token> body, @CheckForNull Token source) {
        this(name, parameters, defaults, true, body, source);
    }

    /**
     * Constructs an object-like macro.
     */
    public MacroDefinition(@Nonnull String name, @Nonnull List<Token> body, @CheckForNull Token source) {
        this(name, Collections.<String>emptyList(), Collections.<List<Token>>emptyList(), false, body, source);
    }

    private MacroDefinition(@Nonnull String name, @Nonnull List<String> parameters,
            @Nonnull List<List<Token>> defaults, boolean functionLike,
            @Nonnull List<Token> body, @CheckForNull Token source) {
        Set<String> seen = new HashSet<String>();
        for (String parameter : parameters)
            if (!seen.add(parameter))
                throw new IllegalArgumentException("Duplicate parameter " + parameter + " in macro " + name);
        if (defaults.size() != parameters.size())
            throw new IllegalArgumentException("Macro " + name + " has " + parameters.size()
                    + " parameters but " + defaults.size() + " defaults");
        this.name = name;
        this.parameters = Collections.unmodifiableList(new ArrayList<String>(parameters));
        List<List<Token>> d = new ArrayList<List<Token>>(defaults.size());
        for (List<Token> value : defaults)
            d.add(value == null ? null : Collections.unmodifiableList(new ArrayList<Token>(value)));
        this.defaults = Collections.unmodifiableList(d);
        this.functionLike = functionLike;
        this.body = Collections.unmodifiableList(new ArrayList<Token>(body));
        this.source = source;
    }

    /**
     * Returns the name of this macro.
     */
    @Nonnull
    public String getName() {
        return name;
    }

    /**
     * Returns the formal parameter names, in order.
     */
    @Nonnull
    public List<String> getParameters() {
        return parameters;
    }

    /**
     * Returns the default value of the given parameter, or null
     * if it has none.
     */
    @CheckForNull
    public List<Token> getDefault(@Nonnegative int index) {
        return defaults.get(index);
    }

    /**
     * Returns the number of parameters to this macro.
     */
    @Nonnegative
    public int getArgs() {
        return parameters.size();
    }

    /**
     * Returns true if this is a function-like macro, which must be
     * invoked with an argument list.
     */
    public boolean isFunctionLike() {
        return functionLike;
    }

    /**
     * Returns the expansion tokens of this macro.
     */
    @Nonnull
    public List<Token> getBody() {
        return body;
    }

    /**
     * Returns the name token of the defining directive, or null
     * if this macro was defined externally.
     */
    @CheckForNull
    public Token getSource() {
        return source;
    }

    /**
     * Returns true if the given macro has the same parameters and
     * the same expansion text as this one.
     */
    public boolean isSameDefinition(@Nonnull MacroDefinition other) {
        if (functionLike != other.functionLike || !parameters.equals(other.parameters))
            return false;
        for (int i = 0; i < defaults.size(); i++) {
            List<Token> a = defaults.get(i);
            List<Token> b = other.defaults.get(i);
            if (a == null ? b != null : b == null || !sameText(a, b))
                return false;
        }
        return sameText(body, other.body);
    }

    private static boolean sameText(@Nonnull List<Token> a, @Nonnull List<Token> b) {
        if (a.size() != b.size())
            return false;
        for (int i = 0; i < a.size(); i++)
            if (!a.get(i).getText().equals(b.get(i).getText()))
                return false;
        return true;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder(name);
        if (functionLike) {
            buf.append('(');
            for (int i = 0; i < parameters.size(); i++) {
                if (i > 0)
                    buf.append(", ");
                buf.append(parameters.get(i));
                List<Token> value = defaults.get(i);
                if (value != null) {
                    buf.append('=');
                    for (int j = 0; j < value.size(); j++) {
                        if (j > 0)
                            buf.append(' ');
                        buf.append(value.get(j).getText());
                    }
                }
            }
            buf.append(')');
        }
        if (!body.isEmpty()) {
            buf.append(" => ");
            for (int i = 0; i < body.size(); i++) {
                if (i > 0)
                    buf.append(' ');
                buf.append(body.get(i).getText());
            }
        }
        return buf.toString();
    }
}

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

import java.util.Collections;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * One arm of a conditional group in a {@link FlowTree}.
 *
 * The conditions of an arm are those under which it is selected:
 * every earlier arm of the group must be rejected, and the arm's own
 * test must hold. An <code>`else</code> arm has no test of its own.
 */
public final class Alternative {

    public static enum Kind {

        IFDEF, IFNDEF, ELSIF, ELSE;

        /* The condition under which an arm of this kind is entered. */
        @CheckForNull
        /* pp */ MacroCondition condition(@CheckForNull String macro) {
            switch (this) {
                case IFDEF:
                case ELSIF:
                    return new MacroCondition(macro, true);
                case IFNDEF:
                    return new MacroCondition(macro, false);
                default:
                    return null;
            }
        }
    }

    private final Kind kind;
    @CheckForNull
    private final String macro;
    @CheckForNull
    private final Token directive;
    private final List<FlowNode> body;
    private final List<MacroCondition> conditions;

    /* pp */ Alternative(@Nonnull Kind kind, @CheckForNull String macro, @CheckForNull Token directive,
            @Nonnull List<FlowNode> body, @Nonnull List<MacroCondition> conditions) {
        this.kind = kind;
        this.macro = macro;
        this.directive = directive;
        this.body = Collections.unmodifiableList(body);
        this.conditions = Collections.unmodifiableList(conditions);
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the macro tested by this arm, or null for an
     * <code>`else</code> arm.
     */
    @CheckForNull
    public String getMacro() {
        return macro;
    }

    /**
     * Returns the directive which opened this arm, or null if this is
     * the implicit <code>`else</code> of a group which has none.
     */
    @CheckForNull
    public Token getDirective() {
        return directive;
    }

    public boolean isImplicit() {
        return directive == null;
    }

    @Nonnull
    public List<FlowNode> getBody() {
        return body;
    }

    /**
     * Returns the constraints which select this arm, in order.
     */
    @Nonnull
    public List<MacroCondition> getConditions() {
        return conditions;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append(kind);
        if (macro != null)
            buf.append(' ').append(macro);
        buf.append(' ').append(conditions);
        return buf.toString();
    }
}

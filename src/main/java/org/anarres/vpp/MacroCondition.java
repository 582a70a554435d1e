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

import javax.annotation.Nonnull;

/**
 * A constraint on the definedness of one macro.
 */
public final class MacroCondition {

    private final String macro;
    private final boolean defined;

    public MacroCondition(@Nonnull String macro, boolean defined) {
        this.macro = macro;
        this.defined = defined;
    }

    @Nonnull
    public String getMacro() {
        return macro;
    }

    /**
     * Returns true if the macro is required to be defined.
     */
    public boolean isDefined() {
        return defined;
    }

    @Nonnull
    public MacroCondition negate() {
        return new MacroCondition(macro, !defined);
    }

    @Override
    public int hashCode() {
        return macro.hashCode() * 2 + (defined ? 1 : 0);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof MacroCondition) {
            MacroCondition other = (MacroCondition) obj;
            return other.macro.equals(macro) && other.defined == defined;
        }
        return false;
    }

    @Override
    public String toString() {
        return (defined ? "" : "!") + macro;
    }
}

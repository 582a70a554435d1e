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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/* One open conditional group. Immutable; transitions return a new State. */
/* pp */ class State {

    private final boolean parent;
    private final boolean active;
    private final boolean taken;
    private final boolean sawElse;
    @CheckForNull
    private final Token opener;

    /* The root state, which is always active. */
    /* pp */ State() {
        this(true, true, true, false, null);
    }

    private State(boolean parent, boolean active, boolean taken, boolean sawElse, @CheckForNull Token opener) {
        this.parent = parent;
        this.active = active;
        this.taken = taken;
        this.sawElse = sawElse;
        this.opener = opener;
    }

    /* Opens a group within the given state. */
    /* pp */ State(@Nonnull State parent, @Nonnull Token opener, boolean condition) {
        this.parent = parent.isActive();
        this.active = this.parent && condition;
        this.taken = this.active;
        this.sawElse = false;
        this.opener = opener;
    }

    /* pp */ boolean isActive() {
        return active;
    }

    /* True unless this whole group is being skipped. */
    /* pp */ boolean isParentActive() {
        return parent;
    }

    /* pp */ boolean sawElse() {
        return sawElse;
    }

    @CheckForNull
    /* pp */ Token getOpener() {
        return opener;
    }

    /* An `elsif arm is taken if no earlier arm was. */
    @Nonnull
    State withArm(boolean condition) {
        boolean a = parent && !taken && condition;
        return new State(parent, a, taken || a, false, opener);
    }

    @Nonnull
    State withElse() {
        boolean a = parent && !taken;
        return new State(parent, a, true, true, opener);
    }

    @Override
    public String toString() {
        return "parent=" + parent
                + ", active=" + active
                + ", taken=" + taken
                + ", sawelse=" + sawElse;
    }
}

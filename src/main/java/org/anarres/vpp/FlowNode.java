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
import javax.annotation.Nonnull;

/**
 * A node in a {@link FlowTree}.
 *
 * The node types are {@link Leaf} and {@link Branch}; no others may be
 * created. Consumers examine nodes through a {@link Visitor}.
 */
public abstract class FlowNode {

    /**
     * Visits each kind of {@link FlowNode}.
     */
    public static interface Visitor<R> {

        R visitLeaf(@Nonnull Leaf leaf);

        R visitBranch(@Nonnull Branch branch);
    }

    /* pp */ FlowNode() {
    }

    public abstract <R> R accept(@Nonnull Visitor<R> visitor);

    /**
     * A run of tokens which contains no conditional directive.
     */
    public static final class Leaf extends FlowNode {

        private final List<Token> tokens;

        /* pp */ Leaf(@Nonnull List<Token> tokens) {
            this.tokens = Collections.unmodifiableList(tokens);
        }

        @Nonnull
        public List<Token> getTokens() {
            return tokens;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLeaf(this);
        }

        @Override
        public String toString() {
            return "Leaf" + tokens;
        }
    }

    /**
     * A conditional group: one {@link Alternative} per arm, in
     * source order, ending with an <code>`else</code> arm.
     */
    public static final class Branch extends FlowNode {

        private final Token opener;
        private final List<Alternative> alternatives;

        /* pp */ Branch(@Nonnull Token opener, @Nonnull List<Alternative> alternatives) {
            this.opener = opener;
            this.alternatives = Collections.unmodifiableList(alternatives);
        }

        /**
         * Returns the <code>`ifdef</code> or <code>`ifndef</code> which opened this group.
         */
        @Nonnull
        public Token getOpener() {
            return opener;
        }

        @Nonnull
        public List<Alternative> getAlternatives() {
            return alternatives;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBranch(this);
        }

        @Override
        public String toString() {
            return "Branch" + alternatives;
        }
    }
}

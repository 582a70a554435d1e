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
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import org.pcollections.ConsPStack;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.pcollections.PStack;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates the variants of a {@link FlowTree}, lazily and in
 * source order.
 *
 * The traversal is depth-first and keeps its own work stack, so the
 * depth of the Java stack does not depend on the nesting of the
 * source. Each pending search state is persistent; exploring one arm
 * of a group never disturbs the state shared with its siblings.
 *
 * A VariantGenerator is single-use.
 */
public class VariantGenerator implements Iterator<Variant> {

    private static final Logger LOG = LoggerFactory.getLogger(VariantGenerator.class);

    /* A position in a sequence of nodes. */
    private static final class Cursor {

        private final List<FlowNode> nodes;
        private final int index;

        Cursor(List<FlowNode> nodes, int index) {
            this.nodes = nodes;
            this.index = index;
        }
    }

    /* A partial traversal: what remains to visit, what has been decided, what has been produced. */
    private static final class SearchState {

        private final PStack<Cursor> continuation;
        private final PMap<String, Boolean> assignment;
        private final PVector<Token> tokens;

        SearchState(PStack<Cursor> continuation, PMap<String, Boolean> assignment, PVector<Token> tokens) {
            this.continuation = continuation;
            this.assignment = assignment;
            this.tokens = tokens;
        }
    }

    private final Deque<SearchState> pending = new ArrayDeque<SearchState>();
    @CheckForNull
    private Variant next;
    private int count;

    /* pp */ VariantGenerator(@Nonnull List<FlowNode> root, @Nonnull Map<String, Boolean> initial) {
        PStack<Cursor> continuation = ConsPStack.singleton(new Cursor(root, 0));
        pending.push(new SearchState(continuation, HashTreePMap.from(initial), TreePVector.<Token>empty()));
    }

    @Override
    public boolean hasNext() {
        if (next == null)
            next = advance();
        return next != null;
    }

    @Override
    public Variant next() {
        if (!hasNext())
            throw new NoSuchElementException();
        Variant v = next;
        next = null;
        return v;
    }

    /**
     * Returns true if no variant remains, without constructing the
     * next one.
     */
    /*
     * The arms of every group partition the assignments, so each
     * pending search state completes at least one variant.
     */
    public boolean isExhausted() {
        return next == null && pending.isEmpty();
    }

    /**
     * Returns the number of variants produced so far.
     */
    public int getCount() {
        return count;
    }

    /**
     * Returns the assignment extended by the conditions, or null if
     * the conditions contradict it or each other.
     */
    @CheckForNull
    private static PMap<String, Boolean> extend(@Nonnull PMap<String, Boolean> assignment, @Nonnull List<MacroCondition> conditions) {
        for (MacroCondition c : conditions) {
            Boolean bound = assignment.get(c.getMacro());
            if (bound == null)
                assignment = assignment.plus(c.getMacro(), c.isDefined());
            else if (bound.booleanValue() != c.isDefined())
                return null;
        }
        return assignment;
    }

    /* Advances one search state over a node; returns false if the state forked at a branch. */
    private final class Step implements FlowNode.Visitor<Boolean> {

        private final PMap<String, Boolean> assignment;
        private PStack<Cursor> continuation;
        private PVector<Token> tokens;

        Step(SearchState state) {
            this.assignment = state.assignment;
            this.continuation = state.continuation;
            this.tokens = state.tokens;
        }

        @Override
        public Boolean visitLeaf(FlowNode.Leaf leaf) {
            tokens = tokens.plusAll(leaf.getTokens());
            return Boolean.TRUE;
        }

        @Override
        public Boolean visitBranch(FlowNode.Branch branch) {
            /* Push in reverse, so the first arm is explored first. */
            List<Alternative> alternatives = branch.getAlternatives();
            for (int i = alternatives.size() - 1; i >= 0; i--) {
                Alternative alt = alternatives.get(i);
                PMap<String, Boolean> extended = extend(assignment, alt.getConditions());
                if (extended == null)
                    continue;
                pending.push(new SearchState(
                        continuation.plus(new Cursor(alt.getBody(), 0)),
                        extended, tokens));
            }
            return Boolean.FALSE;
        }
    }

    @CheckForNull
    private Variant advance() {
        STATE:
        while (!pending.isEmpty()) {
            Step step = new Step(pending.pop());
            while (!step.continuation.isEmpty()) {
                Cursor cursor = step.continuation.get(0);
                step.continuation = step.continuation.minus(0);
                if (cursor.index >= cursor.nodes.size())
                    continue;
                step.continuation = step.continuation.plus(new Cursor(cursor.nodes, cursor.index + 1));
                if (!cursor.nodes.get(cursor.index).accept(step))
                    continue STATE;
            }
            Variant v = new Variant(count++, step.assignment, step.tokens);
            if (LOG.isDebugEnabled())
                LOG.debug("Produced " + v);
            return v;
        }
        return null;
    }

    @Override
    public void remove() {
        throw new UnsupportedOperationException();
    }
}

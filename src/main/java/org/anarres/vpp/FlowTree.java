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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BooleanSupplier;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.anarres.vpp.TokenType.*;

/**
 * The conditional structure of a source, as a tree of
 * {@link FlowNode FlowNodes}, and the enumeration of its variants.
 *
 * A FlowTree is built from the tokens of a source without reference
 * to any macro definitions. It is immutable, and may be enumerated
 * any number of times.
 */
public class FlowTree implements Iterable<Variant> {

    private static final Logger LOG = LoggerFactory.getLogger(FlowTree.class);

    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;
    public static final int DEFAULT_MAX_VARIANTS = 20;

    private final List<FlowNode> root;
    private final Set<String> macros;

    private FlowTree(@Nonnull List<FlowNode> root, @Nonnull Set<String> macros) {
        this.root = Collections.unmodifiableList(root);
        this.macros = Collections.unmodifiableSet(macros);
    }

    /**
     * Builds the tree of the given tokens, with the default nesting limit.
     */
    @Nonnull
    public static FlowTree build(@Nonnull List<Token> tokens) throws FlowTreeException {
        return build(tokens, DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * Builds the tree of the given tokens.
     *
     * Non-significant tokens are ignored. Conditional directives and
     * the macro names they test belong to no leaf; every other token,
     * including <code>`define</code> lines, is kept.
     *
     * @throws FlowTreeException if the conditional directives are not
     * properly nested, or are nested deeper than maxNestingDepth.
     */
    @Nonnull
    public static FlowTree build(@Nonnull List<Token> tokens, @Nonnegative int maxNestingDepth) throws FlowTreeException {
        return new Builder(VerilogLexer.significant(tokens), maxNestingDepth).build();
    }

    /* A sequence of nodes under construction. */
    private static class Sequence {

        private final List<FlowNode> nodes = new ArrayList<FlowNode>();
        private List<Token> leaf = new ArrayList<Token>();

        void flush() {
            if (!leaf.isEmpty()) {
                nodes.add(new FlowNode.Leaf(leaf));
                leaf = new ArrayList<Token>();
            }
        }

        List<FlowNode> close() {
            flush();
            return nodes;
        }
    }

    /* A conditional group under construction. */
    private static class Group {

        private final Token opener;
        private final List<Alternative> alternatives = new ArrayList<Alternative>();
        /* The negations of the tests of the closed arms. */
        private final List<MacroCondition> rejected = new ArrayList<MacroCondition>();
        private Alternative.Kind kind;
        private String macro;
        private Token directive;
        private Sequence body;
        private boolean sawElse;

        Group(Token opener, Alternative.Kind kind, String macro) {
            this.opener = opener;
            open(opener, kind, macro);
        }

        final void open(Token directive, Alternative.Kind kind, String macro) {
            this.directive = directive;
            this.kind = kind;
            this.macro = macro;
            this.body = new Sequence();
            if (kind == Alternative.Kind.ELSE)
                sawElse = true;
        }

        void close() {
            List<MacroCondition> conditions = new ArrayList<MacroCondition>(rejected);
            MacroCondition test = kind.condition(macro);
            if (test != null) {
                conditions.add(test);
                rejected.add(test.negate());
            }
            alternatives.add(new Alternative(kind, macro, directive, body.close(), conditions));
        }

        FlowNode.Branch finish() {
            close();
            if (!sawElse)
                alternatives.add(new Alternative(Alternative.Kind.ELSE, null, null,
                        Collections.<FlowNode>emptyList(), new ArrayList<MacroCondition>(rejected)));
            return new FlowNode.Branch(opener, alternatives);
        }
    }

    private static class Builder {

        private final List<Token> tokens;
        private final int maxNestingDepth;
        private final Deque<Group> groups = new ArrayDeque<Group>();
        private final Sequence top = new Sequence();
        private final Set<String> macros = new LinkedHashSet<String>();
        private int pos;

        Builder(List<Token> tokens, int maxNestingDepth) {
            this.tokens = tokens;
            this.maxNestingDepth = maxNestingDepth;
        }

        private Sequence current() {
            Group group = groups.peek();
            return group == null ? top : group.body;
        }

        private FlowTreeException error(ErrorKind kind, Token tok, String msg) {
            return new FlowTreeException(new PreprocessError(kind, tok, msg));
        }

        @Nonnull
        private String macro_name(@Nonnull Token directive) throws FlowTreeException {
            if (pos < tokens.size()) {
                Token tok = tokens.get(pos);
                if (tok.getType() == IDENTIFIER || tok.getType() == ESCAPED_IDENTIFIER) {
                    pos++;
                    macros.add(tok.getText());
                    return tok.getText();
                }
            }
            throw error(ErrorKind.MALFORMED_CONDITIONAL_NESTING, directive,
                    "Expected identifier after " + directive.getText());
        }

        @Nonnull
        private Group group(@Nonnull Token directive) throws FlowTreeException {
            Group group = groups.peek();
            if (group == null)
                throw error(ErrorKind.MALFORMED_CONDITIONAL_NESTING, directive,
                        directive.getText() + " without `ifdef");
            if (group.sawElse && directive.getType() != PP_ENDIF)
                throw error(ErrorKind.MALFORMED_CONDITIONAL_NESTING, directive,
                        directive.getText() + " after `else");
            return group;
        }

        FlowTree build() throws FlowTreeException {
            while (pos < tokens.size()) {
                Token tok = tokens.get(pos++);
                Group group;
                switch (tok.getType()) {
                    case PP_IFDEF:
                    case PP_IFNDEF:
                        if (groups.size() >= maxNestingDepth)
                            throw error(ErrorKind.CONDITIONAL_NESTING_TOO_DEEP, tok,
                                    "Conditionals nested deeper than " + maxNestingDepth);
                        String name = macro_name(tok);
                        current().flush();
                        groups.push(new Group(tok,
                                tok.getType() == PP_IFDEF ? Alternative.Kind.IFDEF : Alternative.Kind.IFNDEF,
                                name));
                        break;
                    case PP_ELSIF:
                        group = group(tok);
                        group.close();
                        group.open(tok, Alternative.Kind.ELSIF, macro_name(tok));
                        break;
                    case PP_ELSE:
                        group = group(tok);
                        group.close();
                        group.open(tok, Alternative.Kind.ELSE, null);
                        break;
                    case PP_ENDIF:
                        group = group(tok);
                        groups.pop();
                        current().nodes.add(group.finish());
                        break;
                    default:
                        current().leaf.add(tok);
                        break;
                }
            }
            Group open = groups.peek();
            if (open != null)
                throw error(ErrorKind.MALFORMED_CONDITIONAL_NESTING, open.opener,
                        "Unterminated " + open.opener.getText() + " at end of input");
            FlowTree tree = new FlowTree(top.close(), macros);
            if (LOG.isDebugEnabled())
                LOG.debug("Built " + tree);
            return tree;
        }
    }

    /**
     * Returns the top-level nodes of this tree.
     */
    @Nonnull
    public List<FlowNode> getRoot() {
        return root;
    }

    /**
     * Returns the macros tested by conditionals in this tree, in
     * order of first use.
     */
    @Nonnull
    public Set<String> getConditionalMacros() {
        return macros;
    }

    /**
     * Returns a lazy enumeration of every variant of this tree.
     */
    @Override
    public VariantGenerator iterator() {
        return iterator(Collections.<String, Boolean>emptyMap());
    }

    /**
     * Returns a lazy enumeration of the variants consistent with the
     * given assignment of definedness.
     */
    @Nonnull
    public VariantGenerator iterator(@Nonnull Map<String, Boolean> initial) {
        return new VariantGenerator(root, initial);
    }

    /**
     * Enumerates every variant, in order.
     *
     * keepGoing is consulted before each variant is constructed; if it
     * returns false while variants remain, the enumeration ends with
     * {@link GenerationStatus#TRUNCATED}.
     * If the callback returns false the enumeration ends with
     * {@link GenerationStatus#STOPPED}.
     */
    @Nonnull
    public GenerationStatus generateVariants(@Nonnull BooleanSupplier keepGoing, @Nonnull VariantCallback callback) {
        return generateVariants(Collections.<String, Boolean>emptyMap(), keepGoing, callback);
    }

    @Nonnull
    public GenerationStatus generateVariants(@Nonnull Map<String, Boolean> initial,
            @Nonnull BooleanSupplier keepGoing, @Nonnull VariantCallback callback) {
        VariantGenerator it = iterator(initial);
        for (;;) {
            if (it.isExhausted())
                return GenerationStatus.EXHAUSTED;
            if (!keepGoing.getAsBoolean())
                return GenerationStatus.TRUNCATED;
            if (!it.hasNext())
                return GenerationStatus.EXHAUSTED;
            if (!callback.handleVariant(it.next()))
                return GenerationStatus.STOPPED;
        }
    }

    /**
     * Enumerates at most <code>limit</code> variants.
     */
    @Nonnull
    public GenerationStatus generateVariants(@Nonnegative int limit, @Nonnull VariantCallback callback) {
        return generateVariants(Collections.<String, Boolean>emptyMap(), limit, callback);
    }

    @Nonnull
    public GenerationStatus generateVariants(@Nonnull Map<String, Boolean> initial,
            @Nonnegative final int limit, @Nonnull VariantCallback callback) {
        final int[] count = new int[1];
        return generateVariants(initial, new BooleanSupplier() {
            @Override
            public boolean getAsBoolean() {
                return count[0]++ < limit;
            }
        }, callback);
    }

    /**
     * Collects the variants of this tree, at most <code>limit</code> of them.
     */
    @Nonnull
    public List<Variant> getVariants(@Nonnegative int limit) {
        final List<Variant> out = new ArrayList<Variant>();
        generateVariants(limit, new VariantCallback() {
            @Override
            public boolean handleVariant(Variant variant) {
                out.add(variant);
                return true;
            }
        });
        return out;
    }

    @Override
    public String toString() {
        return "FlowTree" + root;
    }
}

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

import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FlowTree construction.
 */
class FlowTreeTest {

    private static FlowTree build(String source) throws FlowTreeException {
        return FlowTree.build(new VerilogLexer(source).tokenize());
    }

    private static PreprocessError failure(String source) {
        try {
            build(source);
        } catch (FlowTreeException e) {
            return e.getError();
        }
        throw new AssertionError("Expected a FlowTreeException for " + source);
    }

    @Test
    void testStraightLineIsOneLeaf() throws Exception {
        FlowTree tree = build("module m;\n// nothing\nendmodule\n");

        List<FlowNode> root = tree.getRoot();
        assertThat(root).hasSize(1);
        assertThat(root.get(0)).isInstanceOf(FlowNode.Leaf.class);
        assertThat(((FlowNode.Leaf) root.get(0)).getTokens()).extracting(Token::getText)
                .containsExactly("module", "m", ";", "endmodule");
    }

    @Test
    void testEmptySource() throws Exception {
        assertThat(build("").getRoot()).isEmpty();
    }

    @Test
    void testGroupStructure() throws Exception {
        FlowTree tree = build("a\n`ifdef A\nb\n`elsif B\nc\n`endif\nd\n");

        List<FlowNode> root = tree.getRoot();
        assertThat(root).hasSize(3);
        FlowNode.Branch branch = (FlowNode.Branch) root.get(1);
        assertThat(branch.getOpener().getType()).isEqualTo(TokenType.PP_IFDEF);

        List<Alternative> alternatives = branch.getAlternatives();
        assertThat(alternatives).extracting(Alternative::getKind)
                .containsExactly(Alternative.Kind.IFDEF, Alternative.Kind.ELSIF, Alternative.Kind.ELSE);
        assertThat(alternatives.get(0).getConditions()).containsExactly(new MacroCondition("A", true));
        assertThat(alternatives.get(1).getConditions())
                .containsExactly(new MacroCondition("A", false), new MacroCondition("B", true));
        assertThat(alternatives.get(2).getConditions())
                .containsExactly(new MacroCondition("A", false), new MacroCondition("B", false));
    }

    @Test
    void testImplicitElse() throws Exception {
        FlowNode.Branch branch = (FlowNode.Branch) build("`ifndef A\nx\n`endif\n").getRoot().get(0);

        List<Alternative> alternatives = branch.getAlternatives();
        assertThat(alternatives).hasSize(2);
        assertThat(alternatives.get(0).getConditions()).containsExactly(new MacroCondition("A", false));
        assertThat(alternatives.get(0).isImplicit()).isFalse();
        Alternative otherwise = alternatives.get(1);
        assertThat(otherwise.getKind()).isEqualTo(Alternative.Kind.ELSE);
        assertThat(otherwise.isImplicit()).isTrue();
        assertThat(otherwise.getBody()).isEmpty();
        assertThat(otherwise.getConditions()).containsExactly(new MacroCondition("A", true));
    }

    @Test
    void testExplicitElse() throws Exception {
        FlowNode.Branch branch = (FlowNode.Branch) build("`ifdef A\nx\n`else\ny\n`endif\n").getRoot().get(0);

        assertThat(branch.getAlternatives()).hasSize(2);
        assertThat(branch.getAlternatives().get(1).isImplicit()).isFalse();
        assertThat(branch.getAlternatives().get(1).getDirective().getType()).isEqualTo(TokenType.PP_ELSE);
    }

    @Test
    void testDefinesStayInLeaves() throws Exception {
        FlowNode.Leaf leaf = (FlowNode.Leaf) build("`define W 1\nx\n").getRoot().get(0);

        assertThat(leaf.getTokens()).extracting(Token::getType)
                .containsExactly(TokenType.PP_DEFINE, TokenType.IDENTIFIER, TokenType.DEFINE_BODY, TokenType.IDENTIFIER);
    }

    @Test
    void testVisitor() throws Exception {
        FlowTree tree = build("a\n`ifdef A\nb\n`endif\n");
        FlowNode.Visitor<String> visitor = new FlowNode.Visitor<String>() {
            @Override
            public String visitLeaf(FlowNode.Leaf leaf) {
                return "leaf";
            }

            @Override
            public String visitBranch(FlowNode.Branch branch) {
                return "branch";
            }
        };

        assertThat(tree.getRoot().get(0).accept(visitor)).isEqualTo("leaf");
        assertThat(tree.getRoot().get(1).accept(visitor)).isEqualTo("branch");
    }

    @Test
    void testConditionalMacrosInFirstUseOrder() throws Exception {
        FlowTree tree = build("`ifdef B\n`ifndef A\n`endif\n`elsif C\n`endif\n`ifdef B\n`endif\n");

        assertThat(tree.getConditionalMacros()).containsExactly("B", "A", "C");
    }

    @Test
    void testStrayEndif() {
        PreprocessError error = failure("a\n`endif\n");

        assertThat(error.getKind()).isEqualTo(ErrorKind.MALFORMED_CONDITIONAL_NESTING);
        assertThat(error.getLine()).isEqualTo(2);
    }

    @Test
    void testStrayElseAndElsif() {
        assertThat(failure("`else\n").getKind()).isEqualTo(ErrorKind.MALFORMED_CONDITIONAL_NESTING);
        assertThat(failure("`elsif A\n").getKind()).isEqualTo(ErrorKind.MALFORMED_CONDITIONAL_NESTING);
    }

    @Test
    void testArmAfterElse() {
        assertThat(failure("`ifdef A\n`else\n`else\n`endif\n").getKind())
                .isEqualTo(ErrorKind.MALFORMED_CONDITIONAL_NESTING);
        assertThat(failure("`ifdef A\n`else\n`elsif B\n`endif\n").getLine()).isEqualTo(3);
    }

    @Test
    void testUnterminatedGroup() {
        PreprocessError error = failure("`ifdef A\n`ifdef B\n`endif\n");

        assertThat(error.getKind()).isEqualTo(ErrorKind.MALFORMED_CONDITIONAL_NESTING);
        assertThat(error.getLine()).isEqualTo(1);
    }

    @Test
    void testMissingMacroName() {
        assertThat(failure("`ifdef\n`endif\n").getKind()).isEqualTo(ErrorKind.MALFORMED_CONDITIONAL_NESTING);
    }

    @Test
    void testNestingLimit() throws Exception {
        StringBuilder buf = new StringBuilder();
        for (int i = 0; i < 5; i++)
            buf.append("`ifdef M").append(i).append('\n');
        for (int i = 0; i < 5; i++)
            buf.append("`endif\n");
        List<Token> tokens = new VerilogLexer(buf.toString()).tokenize();

        assertThat(FlowTree.build(tokens, 5).getConditionalMacros()).hasSize(5);
        try {
            FlowTree.build(tokens, 4);
            fail("Expected the nesting limit to be enforced");
        } catch (FlowTreeException e) {
            assertThat(e.getError().getKind()).isEqualTo(ErrorKind.CONDITIONAL_NESTING_TOO_DEEP);
            assertThat(e.getError().getLine()).isEqualTo(5);
        }
    }

    @Test
    void testDefaultNestingLimit() {
        StringBuilder buf = new StringBuilder();
        for (int i = 0; i <= FlowTree.DEFAULT_MAX_NESTING_DEPTH; i++)
            buf.append("`ifdef M\n");

        assertThat(failure(buf.toString()).getKind()).isEqualTo(ErrorKind.CONDITIONAL_NESTING_TOO_DEEP);
    }
}

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
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for variant enumeration.
 */
class VariantGeneratorTest {

    private static FlowTree build(String source) throws FlowTreeException {
        return FlowTree.build(new VerilogLexer(source).tokenize());
    }

    private static List<String> texts(Variant variant) {
        List<String> out = new ArrayList<String>();
        for (Token tok : variant.getTokens())
            out.add(tok.getText());
        return out;
    }

    private static List<Variant> all(FlowTree tree) {
        List<Variant> out = new ArrayList<Variant>();
        for (Variant v : tree)
            out.add(v);
        return out;
    }

    private static String independent(int n) {
        StringBuilder buf = new StringBuilder();
        for (int i = 0; i < n; i++)
            buf.append("`ifdef M").append(i).append("\nyes").append(i)
                    .append("\n`else\nno").append(i).append("\n`endif\n");
        return buf.toString();
    }

    @Test
    void testNoDirectivesYieldsOneVariant() throws Exception {
        String source = "module m(input a);\n  assign x = a;\nendmodule\n";
        List<Variant> variants = all(build(source));

        assertThat(variants).hasSize(1);
        assertThat(variants.get(0).getTokens()).isEqualTo(new VerilogLexer(source).tokenizeSignificant());
        assertThat(variants.get(0).getAssignment()).isEmpty();
    }

    @Test
    void testIfdefElseYieldsTwoVariantsInOrder() throws Exception {
        List<Variant> variants = all(build("`ifdef X\nA\n`else\nB\n`endif\n"));

        assertThat(variants).hasSize(2);
        assertThat(variants.get(0).getIndex()).isEqualTo(0);
        assertThat(variants.get(0).getAssignment()).containsEntry("X", true).hasSize(1);
        assertThat(texts(variants.get(0))).containsExactly("A");
        assertThat(variants.get(1).getIndex()).isEqualTo(1);
        assertThat(variants.get(1).getAssignment()).containsEntry("X", false).hasSize(1);
        assertThat(texts(variants.get(1))).containsExactly("B");
    }

    @Test
    void testIndependentGroupsMultiply() throws Exception {
        List<Variant> variants = all(build(independent(3)));

        assertThat(variants).hasSize(8);
        assertThat(texts(variants.get(0))).containsExactly("yes0", "yes1", "yes2");
        assertThat(texts(variants.get(1))).containsExactly("yes0", "yes1", "no2");
        assertThat(texts(variants.get(2))).containsExactly("yes0", "no1", "yes2");
        assertThat(texts(variants.get(7))).containsExactly("no0", "no1", "no2");
    }

    @Test
    void testLimit() throws Exception {
        FlowTree tree = build(independent(4));
        final List<Variant> seen = new ArrayList<Variant>();
        GenerationStatus status = tree.generateVariants(5, new VariantCallback() {
            @Override
            public boolean handleVariant(Variant variant) {
                seen.add(variant);
                return true;
            }
        });

        assertThat(status).isEqualTo(GenerationStatus.TRUNCATED);
        assertThat(seen).hasSize(5);
        assertThat(tree.getVariants(100)).hasSize(16);
        assertThat(tree.getVariants(FlowTree.DEFAULT_MAX_VARIANTS)).hasSize(16);
    }

    @Test
    void testLimitEqualToCountIsExhausted() throws Exception {
        FlowTree tree = build(independent(1));
        final int[] count = new int[1];
        GenerationStatus status = tree.generateVariants(2, new VariantCallback() {
            @Override
            public boolean handleVariant(Variant variant) {
                count[0]++;
                return true;
            }
        });

        assertThat(status).isEqualTo(GenerationStatus.EXHAUSTED);
        assertThat(count[0]).isEqualTo(2);
    }

    @Test
    void testKeepGoingIsCheckedBeforeEachVariant() throws Exception {
        FlowTree tree = build(independent(2));
        final int[] checks = new int[1];
        final List<Variant> seen = new ArrayList<Variant>();
        GenerationStatus status = tree.generateVariants(() -> ++checks[0] <= 3, new VariantCallback() {
            @Override
            public boolean handleVariant(Variant variant) {
                seen.add(variant);
                return true;
            }
        });

        assertThat(status).isEqualTo(GenerationStatus.TRUNCATED);
        assertThat(seen).hasSize(3);
        assertThat(checks[0]).isEqualTo(4);
    }

    @Test
    void testCallbackStopsEnumeration() throws Exception {
        FlowTree tree = build(independent(3));
        final List<Variant> seen = new ArrayList<Variant>();
        GenerationStatus status = tree.generateVariants(100, new VariantCallback() {
            @Override
            public boolean handleVariant(Variant variant) {
                seen.add(variant);
                return seen.size() < 2;
            }
        });

        assertThat(status).isEqualTo(GenerationStatus.STOPPED);
        assertThat(seen).hasSize(2);
    }

    @Test
    void testSameMacroNestedIsDecidedOnce() throws Exception {
        List<Variant> variants = all(build("`ifdef X\n`ifdef X\nA\n`else\nB\n`endif\n`endif\n"));

        assertThat(variants).hasSize(2);
        assertThat(variants.get(0).isDefined("X")).isTrue();
        assertThat(texts(variants.get(0))).containsExactly("A");
        assertThat(variants.get(1).isDefined("X")).isFalse();
        assertThat(texts(variants.get(1))).isEmpty();
    }

    @Test
    void testRepeatedTestsAcrossGroupsAreConsistent() throws Exception {
        List<Variant> variants = all(build("`ifdef X\na\n`endif\n`ifndef X\nb\n`else\nc\n`endif\n"));

        assertThat(variants).hasSize(2);
        assertThat(texts(variants.get(0))).containsExactly("a", "c");
        assertThat(texts(variants.get(1))).containsExactly("b");
    }

    @Test
    void testElsifChain() throws Exception {
        List<Variant> variants = all(build("`ifdef A\n1\n`elsif B\n2\n`else\n3\n`endif\n"));

        assertThat(variants).hasSize(3);
        assertThat(texts(variants.get(0))).containsExactly("1");
        assertThat(variants.get(0).getAssignment()).containsOnlyKeys("A");
        assertThat(texts(variants.get(1))).containsExactly("2");
        assertThat(variants.get(1).getAssignment()).containsEntry("A", false).containsEntry("B", true);
        assertThat(texts(variants.get(2))).containsExactly("3");
        assertThat(variants.get(2).getAssignment()).containsEntry("A", false).containsEntry("B", false);
    }

    @Test
    void testContradictoryArmIsSkipped() throws Exception {
        List<Variant> variants = all(build("`ifdef A\n1\n`elsif A\n2\n`else\n3\n`endif\n"));

        assertThat(variants).hasSize(2);
        assertThat(texts(variants.get(0))).containsExactly("1");
        assertThat(texts(variants.get(1))).containsExactly("3");
    }

    @Test
    void testInitialAssignment() throws Exception {
        FlowTree tree = build(independent(2));
        final List<Variant> seen = new ArrayList<Variant>();
        GenerationStatus status = tree.generateVariants(Collections.singletonMap("M0", Boolean.FALSE), 10,
                new VariantCallback() {
                    @Override
                    public boolean handleVariant(Variant variant) {
                        seen.add(variant);
                        return true;
                    }
                });

        assertThat(status).isEqualTo(GenerationStatus.EXHAUSTED);
        assertThat(seen).hasSize(2);
        assertThat(texts(seen.get(0))).containsExactly("no0", "yes1");
        assertThat(texts(seen.get(1))).containsExactly("no0", "no1");
    }

    @Test
    void testIteratorIsLazyAndSingleUse() throws Exception {
        VariantGenerator it = build(independent(10)).iterator();

        assertThat(it.isExhausted()).isFalse();
        assertThat(it.next().getIndex()).isEqualTo(0);
        assertThat(it.getCount()).isEqualTo(1);
        int n = 1;
        while (it.hasNext()) {
            it.next();
            n++;
        }
        assertThat(n).isEqualTo(1024);
        assertThat(it.isExhausted()).isTrue();
        assertThatThrownBy(it::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void testDeepNestingDoesNotRecurse() throws Exception {
        int depth = 5000;
        StringBuilder buf = new StringBuilder();
        for (int i = 0; i < depth; i++)
            buf.append("`ifdef M").append(i).append('\n');
        buf.append("x\n");
        for (int i = 0; i < depth; i++)
            buf.append("`endif\n");
        FlowTree tree = FlowTree.build(new VerilogLexer(buf.toString()).tokenize(), depth);

        List<Variant> variants = tree.getVariants(2);
        assertThat(variants).hasSize(2);
        assertThat(texts(variants.get(0))).containsExactly("x");
        assertThat(variants.get(0).getAssignment()).hasSize(depth);
        assertThat(texts(variants.get(1))).isEmpty();
        assertThat(variants.get(1).isDefined("M" + (depth - 1))).isFalse();
    }

    @Test
    void testJson() throws Exception {
        Variant variant = build("`ifdef B\nx\n`endif\n`ifdef A\n`endif\n").iterator().next();

        assertThat(variant.toJson().toString())
                .isEqualTo("{\"variant\":0,\"defines\":{\"A\":true,\"B\":true},"
                        + "\"tokens\":[{\"type\":\"IDENTIFIER\",\"text\":\"x\",\"line\":2,\"col\":0}]}");
    }
}

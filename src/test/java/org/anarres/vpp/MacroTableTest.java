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
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MacroTable.
 */
class MacroTableTest {

    private MacroTable table;
    private final List<PreprocessError> errors = new ArrayList<PreprocessError>();
    private final PreprocessorListener listener = new PreprocessorListener() {
        @Override
        public void handleWarning(PreprocessError warning) {
            errors.add(warning);
        }

        @Override
        public void handleError(PreprocessError error) {
            errors.add(error);
        }
    };

    @BeforeEach
    void setUp() {
        table = new MacroTable();
        errors.clear();
    }

    private static List<Token> lex(String text) {
        return new VerilogLexer(text).tokenizeSignificant();
    }

    private static List<String> texts(List<Token> tokens) {
        List<String> out = new ArrayList<String>();
        for (Token tok : tokens)
            out.add(tok.getText());
        return out;
    }

    private List<String> expand(String text) {
        return texts(table.expand(lex(text), listener));
    }

    private void define(String name, String body) {
        table.define(new MacroDefinition(name, lex(body), null));
    }

    private void define(String name, List<String> params, String body) {
        table.define(new MacroDefinition(name, params, lex(body), null));
    }

    @Test
    void testObjectMacro() {
        define("WIDTH", "8");

        assertThat(expand("wire [`WIDTH-1:0] x;")).containsExactly("wire", "[", "8", "-", "1", ":", "0", "]", "x", ";");
        assertThat(errors).isEmpty();
    }

    @Test
    void testFunctionMacro() {
        define("ADD", Arrays.asList("a", "b"), "a+b");

        assertThat(expand("`ADD(1,2)")).containsExactly("1", "+", "2");
    }

    @Test
    void testArgumentsSplitAtTopLevelCommas() {
        define("ADD", Arrays.asList("a", "b"), "a+b");

        assertThat(expand("`ADD(f(1,2),{3,4})")).containsExactly("f", "(", "1", ",", "2", ")", "+", "{", "3", ",", "4", "}");
    }

    @Test
    void testStrayCloserIsAnArgumentToken() {
        define("PAIR", Arrays.asList("a", "b"), "a b");

        assertThat(expand("`PAIR(x], y)")).containsExactly("x", "]", "y");
        assertThat(errors).isEmpty();
    }

    @Test
    void testDefaultParameterValues() {
        table.define(new MacroDefinition("M", Arrays.asList("a", "b"),
                Arrays.asList(null, lex("1")), lex("a+b"), null));

        assertThat(expand("`M(2)")).containsExactly("2", "+", "1");
        assertThat(expand("`M(2,)")).containsExactly("2", "+", "1");
        assertThat(expand("`M(2,3)")).containsExactly("2", "+", "3");
        assertThat(errors).isEmpty();
        assertThat(table.lookup("M")).hasToString("M(a, b=1) => a + b");
    }

    @Test
    void testNestedInvocationsAreRescanned() {
        define("ONE", "1");
        define("INC", Arrays.asList("x"), "x + `ONE");

        assertThat(expand("`INC(`INC(0))")).containsExactly("0", "+", "1", "+", "1");
    }

    @Test
    void testEmptyArgumentList() {
        define("NOW", Arrays.<String>asList(), "$time");
        define("ID", Arrays.asList("x"), "[x]");

        assertThat(expand("`NOW()")).containsExactly("$time");
        assertThat(expand("`ID()")).containsExactly("[", "]");
        assertThat(errors).isEmpty();
    }

    @Test
    void testArityMismatch() {
        define("ADD", Arrays.asList("a", "b"), "a+b");

        assertThat(expand("`ADD(1)")).containsExactly("`ADD", "(", "1", ")");
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).getKind()).isEqualTo(ErrorKind.MACRO_ARITY_MISMATCH);
    }

    @Test
    void testMissingArgumentList() {
        define("F", Arrays.asList("a"), "a");

        assertThat(expand("`F ;")).containsExactly("`F", ";");
        assertThat(errors).extracting(PreprocessError::getKind).containsExactly(ErrorKind.MACRO_ARITY_MISMATCH);
    }

    @Test
    void testUnterminatedCall() {
        define("F", Arrays.asList("a"), "a");

        assertThat(expand("`F(1, 2")).containsExactly("`F", "(", "1", ",", "2");
        assertThat(errors).extracting(PreprocessError::getKind).containsExactly(ErrorKind.UNTERMINATED_MACRO_CALL);
    }

    @Test
    void testRecursionIsBounded() {
        table.setMaxRecursionDepth(3);
        define("LOOP", "x `LOOP");

        assertThat(expand("`LOOP")).containsExactly("x", "x", "x", "`LOOP");
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).getKind()).isEqualTo(ErrorKind.RECURSIVE_MACRO_EXPANSION);
    }

    @Test
    void testDefaultRecursionDepth() {
        define("A", "`B");
        define("B", "`A");

        assertThat(table.getMaxRecursionDepth()).isEqualTo(MacroTable.DEFAULT_MAX_RECURSION_DEPTH);
        assertThat(expand("`A")).hasSize(1);
        assertThat(errors).extracting(PreprocessError::getKind).containsExactly(ErrorKind.RECURSIVE_MACRO_EXPANSION);
    }

    @Test
    void testUndefinedMacroPassesThrough() {
        assertThat(expand("`timescale 1ns/1ps")).containsExactly("`timescale", "1ns", "/", "1ps");
        assertThat(errors).isEmpty();
    }

    @Test
    void testTokenPaste() {
        define("CAT", Arrays.asList("a", "b"), "a``b");

        List<Token> out = table.expand(lex("`CAT(data,_in)"), listener);
        assertThat(texts(out)).containsExactly("data_in");
        assertThat(out.get(0).getType()).isEqualTo(TokenType.IDENTIFIER);
    }

    @Test
    void testBuiltins() {
        table.setFileName("top.sv");

        assertThat(expand("\n\n`__LINE__")).containsExactly("3");
        assertThat(expand("`__FILE__")).containsExactly("\"top.sv\"");
    }

    @Test
    void testDefineAndUndef() {
        define("A", "1");
        assertThat(table.isDefined("A")).isTrue();
        assertThat(table.lookup("A").getBody()).extracting(Token::getText).containsExactly("1");

        MacroDefinition previous = table.define(new MacroDefinition("A", lex("2"), null));
        assertThat(texts(previous.getBody())).containsExactly("1");

        assertThat(table.undef("A")).isTrue();
        assertThat(table.undef("A")).isFalse();
        assertThat(table.lookup("A")).isNull();
    }

    @Test
    void testUndefineAll() {
        define("A", "1");
        define("B", "2");
        table.undefineAll();

        assertThat(table.getMacros()).isEmpty();
    }

    @Test
    void testSnapshotIsPersistent() {
        define("A", "1");
        Map<String, MacroDefinition> snapshot = table.getMacros();
        define("B", "2");
        table.undef("A");

        assertThat(snapshot).containsOnlyKeys("A");
        assertThat(table.getMacros()).containsOnlyKeys("B");
    }

    @Test
    void testExternalDefine() {
        table.setExternalDefine("DEPTH", "16");
        table.setExternalDefine("FLAG", "");

        assertThat(expand("`DEPTH")).containsExactly("16");
        assertThat(table.lookup("FLAG").getBody()).isEmpty();
        assertThat(table.lookup("FLAG").getSource()).isNull();
        assertThat(expand("a `FLAG b")).containsExactly("a", "b");
    }

    @Test
    void testDuplicateParameterRejected() {
        assertThatThrownBy(() -> new MacroDefinition("M", Arrays.asList("a", "a"), lex("a"), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testToString() {
        define("B", Arrays.asList("x"), "x");
        define("A", "1");

        assertThat(table.toString()).startsWith("`define A");
    }
}

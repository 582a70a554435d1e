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
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for VerilogLexer.
 */
class VerilogLexerTest {

    private static List<TokenType> types(List<Token> tokens) {
        List<TokenType> out = new ArrayList<TokenType>();
        for (Token tok : tokens)
            out.add(tok.getType());
        return out;
    }

    @Test
    void testTokensReproduceInput() {
        String source = "module m(input a, output b);\n"
                + "  // comment\n"
                + "  assign b = ~a; /* block\n comment */\n"
                + "endmodule\n";

        StringBuilder buf = new StringBuilder();
        for (Token tok : new VerilogLexer(source).tokenize())
            buf.append(tok.getText());

        assertThat(buf.toString()).isEqualTo(source);
    }

    @Test
    void testSignificantTokens() {
        List<Token> tokens = new VerilogLexer("wire  x ; // c\n").tokenizeSignificant();

        assertThat(types(tokens)).containsExactly(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.SEMICOLON);
        for (Token tok : tokens)
            assertThat(tok.isSignificant()).isTrue();
    }

    @Test
    void testLocations() {
        List<Token> tokens = new VerilogLexer("a\n  b").tokenizeSignificant();

        assertThat(tokens.get(0).getLine()).isEqualTo(1);
        assertThat(tokens.get(0).getColumn()).isEqualTo(0);
        assertThat(tokens.get(1).getLine()).isEqualTo(2);
        assertThat(tokens.get(1).getColumn()).isEqualTo(2);
        assertThat(tokens.get(1).getOffset()).isEqualTo(4);
    }

    @Test
    void testNumbers() {
        List<Token> tokens = new VerilogLexer("8'hFF 'b1 12 3.5 10ns").tokenizeSignificant();

        assertThat(types(tokens)).containsOnly(TokenType.NUMBER);
        assertThat(tokens).extracting(Token::getText).containsExactly("8'hFF", "'b1", "12", "3.5", "10ns");
    }

    @Test
    void testIdentifiers() {
        List<Token> tokens = new VerilogLexer("$display \\bus[0] foo_1").tokenizeSignificant();

        assertThat(types(tokens)).containsExactly(TokenType.SYSTEM_IDENTIFIER,
                TokenType.ESCAPED_IDENTIFIER, TokenType.IDENTIFIER);
        assertThat(tokens.get(1).getText()).isEqualTo("\\bus[0]");
    }

    @Test
    void testDirectives() {
        List<Token> tokens = new VerilogLexer("`ifdef A `elsif B `else `endif `ifndef C `undef D `undefineall")
                .tokenizeSignificant();

        assertThat(types(tokens)).containsExactly(
                TokenType.PP_IFDEF, TokenType.IDENTIFIER,
                TokenType.PP_ELSIF, TokenType.IDENTIFIER,
                TokenType.PP_ELSE, TokenType.PP_ENDIF,
                TokenType.PP_IFNDEF, TokenType.IDENTIFIER,
                TokenType.PP_UNDEF, TokenType.IDENTIFIER,
                TokenType.PP_UNDEFINEALL);
    }

    @Test
    void testUnknownDirectiveIsMacroIdentifier() {
        List<Token> tokens = new VerilogLexer("`include \"defs.vh\"\n`timescale 1ns/1ps").tokenizeSignificant();

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.MACRO_IDENTIFIER);
        assertThat(tokens.get(0).getText()).isEqualTo("`include");
        assertThat(tokens.get(1).getType()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(2).getType()).isEqualTo(TokenType.MACRO_IDENTIFIER);
    }

    @Test
    void testDefineLine() {
        List<Token> tokens = new VerilogLexer("`define WIDTH 8\nwire x;").tokenizeSignificant();

        assertThat(types(tokens)).startsWith(TokenType.PP_DEFINE, TokenType.IDENTIFIER, TokenType.DEFINE_BODY,
                TokenType.IDENTIFIER);
        assertThat(tokens.get(1).getText()).isEqualTo("WIDTH");
        assertThat(tokens.get(2).getText()).isEqualTo("8");
    }

    @Test
    void testDefineWithParameters() {
        List<Token> tokens = new VerilogLexer("`define ADD(a, b) a + b // sum\n").tokenize();

        List<Token> significant = VerilogLexer.significant(tokens);
        assertThat(types(significant)).containsExactly(TokenType.PP_DEFINE, TokenType.IDENTIFIER,
                TokenType.LPAREN, TokenType.IDENTIFIER, TokenType.COMMA, TokenType.IDENTIFIER, TokenType.RPAREN,
                TokenType.DEFINE_BODY);
        assertThat(significant.get(7).getText()).isEqualTo("a + b ");
        assertThat(types(tokens)).contains(TokenType.COMMENT);
    }

    @Test
    void testEmptyDefineBody() {
        List<Token> tokens = new VerilogLexer("`define FLAG\n").tokenizeSignificant();

        assertThat(types(tokens)).containsExactly(TokenType.PP_DEFINE, TokenType.IDENTIFIER, TokenType.DEFINE_BODY);
        assertThat(tokens.get(2).getText()).isEmpty();
    }

    @Test
    void testDefineContinuation() {
        List<Token> tokens = new VerilogLexer("`define TWO 1 \\\n + 1\nx").tokenizeSignificant();

        assertThat(tokens.get(2).getType()).isEqualTo(TokenType.DEFINE_BODY);
        assertThat(tokens.get(2).getText()).isEqualTo("1 \\\n + 1");
        assertThat(tokens.get(3).getText()).isEqualTo("x");
        assertThat(tokens.get(3).getLine()).isEqualTo(3);
    }

    @Test
    void testMalformedInput() {
        assertThat(new VerilogLexer("/* never closed").tokenize().get(0).getType()).isEqualTo(TokenType.INVALID);
        assertThat(new VerilogLexer("\"no end\n").tokenize().get(0).getType()).isEqualTo(TokenType.INVALID);
    }

    @Test
    void testEofToken() {
        VerilogLexer lexer = new VerilogLexer("x");
        assertThat(lexer.token().getType()).isEqualTo(TokenType.IDENTIFIER);
        assertThat(lexer.token().getType()).isEqualTo(TokenType.EOF);
        assertThat(lexer.token().getType()).isEqualTo(TokenType.EOF);
    }

    @Test
    void testTokenTypeClassification() {
        assertThat(TokenType.PP_DEFINE.isDirective()).isTrue();
        assertThat(TokenType.COMMENT.isWhite()).isTrue();
        assertThat(TokenType.IDENTIFIER.isWhite()).isFalse();
    }
}

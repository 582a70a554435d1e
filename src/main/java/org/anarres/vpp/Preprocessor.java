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
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.Stack;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.anarres.vpp.TokenType.*;

/**
 * A Verilog directive preprocessor.
 *
 * The Preprocessor interprets the conditional directives
 * <code>`ifdef</code>, <code>`ifndef</code>, <code>`elsif</code>,
 * <code>`else</code> and <code>`endif</code>, maintains the macros
 * defined by <code>`define</code> and <code>`undef</code>, and
 * expands macro invocations in active code. The output is the stream
 * of significant tokens, with no directives, together with the
 * diagnostics reported along the way.
 *
 * Processing is best-effort: a malformed directive is reported and
 * then ignored, and the rest of the input is still processed.
 *
 * A Preprocessor processes exactly one input; its macros are not
 * carried over to any other run.
 */
/*
 * The conditional state is a stack of States. A token is active iff
 * the top State is active, and a State can only be active if its
 * parent is, so the top State summarizes the whole stack.
 *
 * Tokens are read from a stack of Sources: the input at the bottom,
 * and above it the bodies of the macros currently being expanded.
 * Expanded text passes through the directive switch like any other.
 */
public class Preprocessor {

    private static final Logger LOG = LoggerFactory.getLogger(Preprocessor.class);

    private final MacroTable macros;
    private final Set<Feature> features;
    private final Set<Warning> warnings;
    @CheckForNull
    private PreprocessorListener listener;

    /* The fundamental engine. */
    private final Stack<State> states;
    private final Stack<Source> sources;
    @CheckForNull
    private MacroTable.Expansion expansion;
    private boolean used;

    /* Results. */
    private final List<PreprocessedToken> output;
    private final List<PreprocessError> errors;
    private final List<PreprocessError> warningList;

    /* Receives diagnostics from the MacroTable as well as our own. */
    private final PreprocessorListener collector = new PreprocessorListener() {
        @Override
        public void handleWarning(@Nonnull PreprocessError warning) {
            warningList.add(warning);
            if (listener != null)
                listener.handleWarning(warning);
        }

        @Override
        public void handleError(@Nonnull PreprocessError error) {
            errors.add(error);
            if (listener != null)
                listener.handleError(error);
        }
    };

    public Preprocessor() {
        this.macros = new MacroTable();
        this.features = EnumSet.noneOf(Feature.class);
        this.warnings = EnumSet.noneOf(Warning.class);
        this.listener = null;
        this.states = new Stack<State>();
        states.push(new State());
        this.sources = new Stack<Source>();
        this.output = new ArrayList<PreprocessedToken>();
        this.errors = new ArrayList<PreprocessError>();
        this.warningList = new ArrayList<PreprocessError>();
    }

    /**
     * Sets the PreprocessorListener which is notified of every
     * warning and error as it is reported.
     */
    public void setListener(@Nonnull PreprocessorListener listener) {
        this.listener = listener;
    }

    @CheckForNull
    public PreprocessorListener getListener() {
        return listener;
    }

    /**
     * Returns the feature-set for this Preprocessor.
     *
     * This set may be freely modified by user code.
     */
    @Nonnull
    public Set<Feature> getFeatures() {
        return features;
    }

    /**
     * Adds a feature to the feature-set of this Preprocessor.
     */
    public void addFeature(@Nonnull Feature f) {
        features.add(f);
    }

    /**
     * Returns true if the given feature is in
     * the feature-set of this Preprocessor.
     */
    public boolean getFeature(@Nonnull Feature f) {
        return features.contains(f);
    }

    /**
     * Returns the warning-set for this Preprocessor.
     *
     * This set may be freely modified by user code.
     */
    @Nonnull
    public Set<Warning> getWarnings() {
        return warnings;
    }

    /**
     * Adds a warning to the warning-set of this Preprocessor.
     */
    public void addWarning(@Nonnull Warning w) {
        warnings.add(w);
    }

    /**
     * Returns true if the given warning is in
     * the warning-set of this Preprocessor.
     */
    public boolean getWarning(@Nonnull Warning w) {
        return warnings.contains(w);
    }

    /**
     * Returns the MacroTable of this Preprocessor.
     */
    @Nonnull
    public MacroTable getMacroTable() {
        return macros;
    }

    /**
     * Defines the given name as a macro, as if by
     * <code>+define+name=value</code>. Must be called before
     * {@link #process(List)}.
     */
    public void addMacro(@Nonnull String name, @Nonnull String value) {
        macros.setExternalDefine(name, value);
    }

    /**
     * Defines the given name as a macro with an empty body.
     */
    public void addMacro(@Nonnull String name) {
        addMacro(name, "");
    }

    /**
     * Sets the maximum nesting of macro expansions.
     *
     * @see MacroTable#setMaxRecursionDepth(int)
     */
    public void setMaxMacroRecursionDepth(@Nonnegative int depth) {
        macros.setMaxRecursionDepth(depth);
    }

    /**
     * Sets the file name used by <code>`__FILE__</code>.
     */
    public void setFileName(@Nonnull String name) {
        macros.setFileName(name);
    }

    /**
     * Lexes and preprocesses the given source text.
     */
    @Nonnull
    public PreprocessorResult process(@Nonnull String source) {
        return process(new VerilogLexer(source).tokenize());
    }

    /**
     * Preprocesses the given token sequence.
     *
     * Non-significant tokens in the input are ignored.
     *
     * @throws IllegalStateException if this Preprocessor has already been run.
     */
    @Nonnull
    public PreprocessorResult process(@Nonnull List<Token> input) {
        if (used)
            throw new IllegalStateException("Preprocessor has already been run");
        used = true;
        sources.push(new Source(VerilogLexer.significant(input)));

        for (;;) {
            Token tok = source_token();
            if (tok.getType() == EOF)
                break;
            _token(tok);
        }

        while (states.size() > 1) {
            State s = states.pop();
            Token opener = s.getOpener();
            error(ErrorKind.UNTERMINATED_CONDITIONAL_AT_EOF, opener,
                    "Unterminated " + opener.getText() + " at end of input");
        }

        return new PreprocessorResult(output, errors, warningList, macros.getMacros());
    }

    /* Diagnostics */
    private void error(@Nonnull ErrorKind kind, @Nonnull Token tok, @Nonnull String msg) {
        collector.handleError(new PreprocessError(kind, tok, msg));
    }

    private void warning(@Nonnull ErrorKind kind, @Nonnull Token tok, @Nonnull String msg) {
        collector.handleWarning(new PreprocessError(kind, msg, tok.getLine(), tok.getColumn(), true));
    }

    /* States */
    private void push_state(@Nonnull Token opener, boolean condition) {
        State top = states.peek();
        states.push(new State(top, opener, condition));
    }

    private void pop_state(@Nonnull Token tok) {
        if (states.size() == 1) {
            error(ErrorKind.UNMATCHED_DIRECTIVE, tok, "`endif without `ifdef");
            return;
        }
        states.pop();
    }

    private boolean isActive() {
        return states.peek().isActive();
    }

    /* Sources */
    private static final class Source {

        private final List<Token> tokens;
        private int pos;

        Source(@Nonnull List<Token> tokens) {
            this.tokens = tokens;
            this.pos = 0;
        }
    }

    private void push_source(@Nonnull List<Token> tokens) {
        sources.push(new Source(tokens));
    }

    private void pop_source() {
        sources.pop();
        if (sources.size() == 1)
            expansion = null;
    }

    /* Source tokens */
    @Nonnull
    private Token source_token() {
        Token tok = source_peek();
        if (tok.getType() != EOF)
            sources.peek().pos++;
        return tok;
    }

    /* Exhausted expansions are popped; the input itself never is. */
    @Nonnull
    private Token source_peek() {
        for (;;) {
            Source s = sources.peek();
            if (s.pos < s.tokens.size())
                return s.tokens.get(s.pos);
            if (sources.size() == 1)
                return Token.EOF;
            pop_source();
        }
    }

    private void emit(@Nonnull Token tok) {
        boolean active = isActive();
        if (active || !getFeature(Feature.FILTER_BRANCHES)) {
            if (getFeature(Feature.DEBUG))
                LOG.debug("pp: Returning " + tok + (active ? "" : " (inactive)"));
            output.add(new PreprocessedToken(tok, active));
        }
    }

    /*
     * Reads the macro name operand of a directive. Returns null if
     * there is none, reporting it if the directive is not being
     * skipped; the offending token is left in the input.
     */
    @CheckForNull
    private String macro_name(@Nonnull Token directive, boolean report) {
        Token tok = source_peek();
        if (tok.getType() == IDENTIFIER || tok.getType() == ESCAPED_IDENTIFIER) {
            source_token();
            return tok.getText();
        }
        if (report)
            error(ErrorKind.MALFORMED_DIRECTIVE, directive,
                "Expected identifier after " + directive.getText()
                + (tok.getType() == EOF ? "" : ", not " + tok.getText()));
        return null;
    }

    /* Consumes the rest of a `define line. */
    private void skip_define() {
        for (;;) {
            Token tok = source_token();
            if (tok.getType() == DEFINE_BODY || tok.getType() == EOF)
                return;
        }
    }

    /* A `define in a skipped arm is consumed without complaint. */
    private void malformed(@Nonnull Token tok, @Nonnull String msg) {
        if (isActive())
            error(ErrorKind.MALFORMED_DIRECTIVE, tok, msg);
    }

    /*
     * Reads a parameter default value, up to the comma or close
     * parenthesis which ends it. Returns that terminating token.
     */
    @Nonnull
    private Token default_value(@Nonnull List<Token> value) {
        int depth = 0;
        for (;;) {
            Token tok = source_token();
            TokenType type = tok.getType();
            if (type == EOF || type.isDirective())
                return tok;
            switch (type) {
                case COMMA:
                    if (depth == 0)
                        return tok;
                    break;
                case LPAREN:
                case LBRACKET:
                case LBRACE:
                    depth++;
                    break;
                case RPAREN:
                    if (depth == 0)
                        return tok;
                    depth--;
                    break;
                case RBRACKET:
                case RBRACE:
                    if (depth > 0)
                        depth--;
                    break;
                default:
                    break;
            }
            value.add(tok);
        }
    }

    /* processes a `define directive */
    private void define(@Nonnull Token directive) {
        Token name = source_token();
        if (name.getType() != IDENTIFIER && name.getType() != ESCAPED_IDENTIFIER) {
            malformed(directive, "Expected identifier after `define");
            if (name.getType() != DEFINE_BODY)
                skip_define();
            return;
        }

        List<String> args = null;
        List<List<Token>> defaults = null;
        if (source_peek().getType() == LPAREN) {
            source_token();
            args = new ArrayList<String>();
            defaults = new ArrayList<List<Token>>();
            Token tok = source_token();
            if (tok.getType() != RPAREN) {
                ARGS:
                for (;;) {
                    if (tok.getType() != IDENTIFIER) {
                        malformed(tok, "Bad token in parameters of macro " + name.getText() + ": " + tok.getText());
                        if (tok.getType() != DEFINE_BODY)
                            skip_define();
                        return;
                    }
                    if (args.contains(tok.getText())) {
                        malformed(tok, "Duplicate parameter " + tok.getText() + " in macro " + name.getText());
                        skip_define();
                        return;
                    }
                    args.add(tok.getText());
                    List<Token> value = null;
                    tok = source_token();
                    if (tok.getType() == OPERATOR && tok.getText().equals("=")) {
                        value = new ArrayList<Token>();
                        tok = default_value(value);
                    }
                    defaults.add(value);
                    switch (tok.getType()) {
                        case COMMA:
                            tok = source_token();
                            break;
                        case RPAREN:
                            break ARGS;
                        default:
                            malformed(tok, "Unterminated parameters of macro " + name.getText());
                            if (tok.getType() != DEFINE_BODY)
                                skip_define();
                            return;
                    }
                }
            }
        }

        Token body = source_peek();
        if (body.getType() == DEFINE_BODY) {
            source_token();
        } else {
            /* Not from our lexer; there is no body. */
            body = new Token(DEFINE_BODY, "", name.getLine(), name.getColumn(), name.getOffset());
        }

        if (!isActive())
            return;

        List<Token> replacement = new VerilogLexer(body.getText(),
                body.getLine(), body.getColumn(), body.getOffset()).tokenizeSignificant();
        MacroDefinition m = args == null
                ? new MacroDefinition(name.getText(), replacement, name)
                : new MacroDefinition(name.getText(), args, defaults, replacement, name);
        MacroDefinition previous = macros.define(m);
        if (previous != null && getWarning(Warning.REDEFINE) && !previous.isSameDefinition(m))
            warning(ErrorKind.MACRO_REDEFINED, name, "Macro " + name.getText() + " redefined");
    }

    private void _token(@Nonnull Token tok) {
        if (getFeature(Feature.DEBUG) && tok.getType().isDirective())
            LOG.debug("pp: " + tok + " in state " + states.peek());

        State state;
        String name;
        switch (tok.getType()) {
            case PP_IFDEF:
            case PP_IFNDEF:
                name = macro_name(tok, isActive());
                if (name == null) {
                    push_state(tok, false);
                } else {
                    boolean exists = macros.isDefined(name);
                    push_state(tok, tok.getType() == PP_IFDEF ? exists : !exists);
                }
                break;

            case PP_ELSIF:
                state = states.peek();
                if (states.size() == 1) {
                    error(ErrorKind.UNMATCHED_DIRECTIVE, tok, "`elsif without `ifdef");
                    macro_name(tok, true);
                } else if (state.sawElse()) {
                    if (state.isParentActive())
                        error(ErrorKind.UNMATCHED_DIRECTIVE, tok, "`elsif after `else");
                    macro_name(tok, state.isParentActive());
                } else {
                    name = macro_name(tok, state.isParentActive());
                    states.pop();
                    states.push(state.withArm(name != null && macros.isDefined(name)));
                }
                break;

            case PP_ELSE:
                state = states.peek();
                if (states.size() == 1) {
                    error(ErrorKind.UNMATCHED_DIRECTIVE, tok, "`else without `ifdef");
                } else if (state.sawElse()) {
                    if (state.isParentActive())
                        error(ErrorKind.UNMATCHED_DIRECTIVE, tok, "`else after `else");
                } else {
                    states.pop();
                    states.push(state.withElse());
                }
                break;

            case PP_ENDIF:
                pop_state(tok);
                break;

            case PP_DEFINE:
                define(tok);
                break;

            case PP_UNDEF:
                name = macro_name(tok, isActive());
                if (name != null && isActive())
                    macros.undef(name);
                break;

            case PP_UNDEFINEALL:
                if (isActive())
                    macros.undefineAll();
                break;

            case DEFINE_BODY:
                /* Only follows `define, which consumes it. */
                break;

            case MACRO_IDENTIFIER:
                if (!isActive()) {
                    emit(tok);
                    break;
                }
                if (sources.size() == 1)
                    expansion = new MacroTable.Expansion(collector);
                Source source = sources.peek();
                MacroTable.Replacement replacement = macros.replace(source.tokens, source.pos - 1,
                        sources.size() - 1, expansion);
                source.pos = replacement.getEnd();
                if (replacement.isExpanded()) {
                    push_source(replacement.getTokens());
                } else {
                    for (Token t : replacement.getTokens())
                        emit(t);
                }
                break;

            default:
                emit(tok);
                break;
        }
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append("states=").append(states).append("\n");
        buf.append(macros);
        return buf.toString();
    }
}

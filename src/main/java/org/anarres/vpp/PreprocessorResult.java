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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * The output of one {@link Preprocessor} run.
 */
public final class PreprocessorResult {

    private final List<PreprocessedToken> tokens;
    private final List<PreprocessError> errors;
    private final List<PreprocessError> warnings;
    private final Map<String, MacroDefinition> macros;

    /* pp */ PreprocessorResult(@Nonnull List<PreprocessedToken> tokens,
            @Nonnull List<PreprocessError> errors,
            @Nonnull List<PreprocessError> warnings,
            @Nonnull Map<String, MacroDefinition> macros) {
        this.tokens = Collections.unmodifiableList(tokens);
        this.errors = Collections.unmodifiableList(errors);
        this.warnings = Collections.unmodifiableList(warnings);
        this.macros = macros;
    }

    /**
     * Returns the preprocessed token stream, in order.
     */
    @Nonnull
    public List<PreprocessedToken> getTokens() {
        return tokens;
    }

    /**
     * Returns the tokens of the active arms only.
     */
    @Nonnull
    public List<Token> getActiveTokens() {
        List<Token> out = new ArrayList<Token>(tokens.size());
        for (PreprocessedToken tok : tokens)
            if (tok.isActive())
                out.add(tok.getToken());
        return out;
    }

    @Nonnull
    public List<PreprocessError> getErrors() {
        return errors;
    }

    @Nonnull
    public List<PreprocessError> getWarnings() {
        return warnings;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Returns the macros defined at the end of the run.
     */
    @Nonnull
    public Map<String, MacroDefinition> getMacros() {
        return macros;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        JsonArray toks = new JsonArray();
        for (PreprocessedToken tok : tokens)
            toks.add(tok.toJson());
        result.add("tokens", toks);
        JsonArray diags = new JsonArray();
        for (PreprocessError e : errors)
            diags.add(e.toJson());
        for (PreprocessError w : warnings)
            diags.add(w.toJson());
        if (diags.size() > 0)
            result.add("diagnostics", diags);
        return result;
    }
}

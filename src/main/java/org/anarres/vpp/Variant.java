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
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * One version of a source, selected by a consistent assignment of
 * definedness to the macros tested along the way.
 */
public final class Variant {

    private final int index;
    private final Map<String, Boolean> assignment;
    private final List<Token> tokens;

    /* pp */ Variant(@Nonnegative int index, @Nonnull Map<String, Boolean> assignment, @Nonnull List<Token> tokens) {
        this.index = index;
        this.assignment = assignment;
        this.tokens = tokens;
    }

    /**
     * Returns the 0-based position of this variant in the enumeration.
     */
    @Nonnegative
    public int getIndex() {
        return index;
    }

    /**
     * Returns the macros whose definedness selected this variant.
     * Macros which were not tested on the way are absent.
     */
    @Nonnull
    public Map<String, Boolean> getAssignment() {
        return assignment;
    }

    /**
     * Returns the tokens of this variant, without conditional directives.
     */
    @Nonnull
    public List<Token> getTokens() {
        return tokens;
    }

    /**
     * Returns true if the named macro is assigned as defined.
     */
    public boolean isDefined(@Nonnull String macro) {
        return Boolean.TRUE.equals(assignment.get(macro));
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("variant", index);
        JsonObject defines = new JsonObject();
        for (Map.Entry<String, Boolean> e : new TreeMap<String, Boolean>(assignment).entrySet())
            defines.addProperty(e.getKey(), e.getValue());
        result.add("defines", defines);
        JsonArray toks = new JsonArray();
        for (Token tok : tokens)
            toks.add(tok.toJson());
        result.add("tokens", toks);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append("Variant ").append(index).append(' ')
                .append(new TreeMap<String, Boolean>(assignment)).append(':');
        for (Token tok : tokens)
            buf.append(' ').append(tok.getText());
        return buf.toString();
    }
}

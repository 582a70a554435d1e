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

import com.google.gson.JsonObject;
import javax.annotation.Nonnull;

/**
 * A token emitted by the {@link Preprocessor}, marked with whether it
 * lies in an active conditional arm.
 *
 * When {@link Feature#FILTER_BRANCHES} is enabled, every emitted
 * token is active.
 */
public final class PreprocessedToken {

    private final Token token;
    private final boolean active;

    public PreprocessedToken(@Nonnull Token token, boolean active) {
        this.token = token;
        this.active = active;
    }

    @Nonnull
    public Token getToken() {
        return token;
    }

    public boolean isActive() {
        return active;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = token.toJson();
        if (!active)
            result.addProperty("active", false);
        return result;
    }

    @Override
    public int hashCode() {
        return token.hashCode() ^ (active ? 1 : 0);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof PreprocessedToken) {
            PreprocessedToken other = (PreprocessedToken) obj;
            return other.token.equals(token) && other.active == active;
        }
        return false;
    }

    @Override
    public String toString() {
        if (active)
            return token.toString();
        return "(inactive) " + token;
    }
}

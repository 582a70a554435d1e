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
 * A diagnostic reported while preprocessing or building a flow tree.
 *
 * Diagnostics are accumulated; none of them stops the preprocessor.
 */
public final class PreprocessError {

    private final ErrorKind kind;
    private final String message;
    private final int line;
    private final int column;
    private final boolean warning;

    public PreprocessError(@Nonnull ErrorKind kind, @Nonnull String message, int line, int column, boolean warning) {
        this.kind = kind;
        this.message = message;
        this.line = line;
        this.column = column;
        this.warning = warning;
    }

    /* pp */ PreprocessError(@Nonnull ErrorKind kind, @Nonnull Token tok, @Nonnull String message) {
        this(kind, message, tok.getLine(), tok.getColumn(), false);
    }

    @Nonnull
    public ErrorKind getKind() {
        return kind;
    }

    @Nonnull
    public String getMessage() {
        return message;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean isWarning() {
        return warning;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("kind", kind.name());
        result.addProperty("severity", warning ? "warning" : "error");
        result.addProperty("line", line);
        result.addProperty("col", column);
        result.addProperty("msg", message);
        return result;
    }

    @Override
    public String toString() {
        return line + ":" + column + ": " + (warning ? "warning" : "error") + ": " + message;
    }
}

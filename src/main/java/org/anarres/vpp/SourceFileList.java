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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * The files, predefined macros and include directories named on a
 * command line.
 *
 * Arguments are file names, or <code>-</code> for standard input,
 * except for the plusargs <code>+define+NAME[=VALUE][+NAME...]</code>
 * and <code>+incdir+DIR[+DIR...]</code>.
 */
public class SourceFileList {

    /** The file name which stands for standard input. */
    public static final String STDIN = "-";

    private static final String DEFINE = "+define+";
    private static final String INCDIR = "+incdir+";

    private final List<String> files = new ArrayList<String>();
    private final Map<String, String> defines = new LinkedHashMap<String, String>();
    private final List<String> includeDirs = new ArrayList<String>();

    @Nonnull
    public static SourceFileList parse(@Nonnull List<String> args) throws UsageException {
        SourceFileList list = new SourceFileList();
        for (String arg : args) {
            if (arg.startsWith(DEFINE)) {
                for (String define : split(arg.substring(DEFINE.length()))) {
                    int idx = define.indexOf('=');
                    if (idx == 0)
                        throw new UsageException("Missing macro name in " + arg);
                    if (idx == -1)
                        list.defines.put(define, "");
                    else
                        list.defines.put(define.substring(0, idx), define.substring(idx + 1));
                }
            } else if (arg.startsWith(INCDIR)) {
                list.includeDirs.addAll(split(arg.substring(INCDIR.length())));
            } else if (arg.startsWith("+")) {
                throw new UsageException("Unsupported option: " + arg);
            } else {
                list.files.add(arg);
            }
        }
        return list;
    }

    /* Empty items, as from a trailing '+', are skipped. */
    @Nonnull
    private static List<String> split(@Nonnull String text) {
        List<String> out = new ArrayList<String>();
        for (String item : text.split("\\+"))
            if (!item.isEmpty())
                out.add(item);
        return out;
    }

    @Nonnull
    public List<String> getFiles() {
        return Collections.unmodifiableList(files);
    }

    /**
     * Returns the predefined macros, by name, in command-line order.
     * A macro given without a value maps to the empty string.
     */
    @Nonnull
    public Map<String, String> getDefines() {
        return Collections.unmodifiableMap(defines);
    }

    @Nonnull
    public List<String> getIncludeDirs() {
        return Collections.unmodifiableList(includeDirs);
    }

    @Override
    public String toString() {
        return "files=" + files + ", defines=" + defines + ", incdirs=" + includeDirs;
    }
}

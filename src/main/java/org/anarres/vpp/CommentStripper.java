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

import javax.annotation.Nonnull;

/**
 * Removes or blanks the comments of Verilog source text.
 *
 * Newlines are always kept, so line numbers are unchanged.
 */
public class CommentStripper {

    /** The replacement which deletes comments entirely. */
    public static final char DELETE = '\0';

    private CommentStripper() {
    }

    /**
     * Strips the comments from the given text.
     *
     * A replacement of a space blanks each comment, delimiters
     * included. {@link #DELETE} deletes each comment. Any other
     * character replaces the contents of each comment, keeping its
     * delimiters.
     */
    @Nonnull
    public static String strip(@Nonnull String text, char replacement) {
        StringBuilder buf = new StringBuilder(text.length());
        for (Token tok : new VerilogLexer(text).tokenize()) {
            switch (tok.getType()) {
                case COMMENT:
                    comment(buf, tok.getText(), replacement);
                    break;
                case DEFINE_BODY:
                    buf.append(strip(tok.getText(), replacement));
                    break;
                default:
                    buf.append(tok.getText());
                    break;
            }
        }
        return buf.toString();
    }

    private static void comment(@Nonnull StringBuilder buf, @Nonnull String text, char replacement) {
        int start = 0;
        int end = text.length();
        if (replacement != ' ' && replacement != DELETE) {
            /* Keep the delimiters. */
            start = 2;
            if (text.startsWith("/*"))
                end -= 2;
            buf.append(text, 0, start);
        }
        for (int i = start; i < end; i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r')
                buf.append(c);
            else if (replacement != DELETE)
                buf.append(replacement);
        }
        buf.append(text, end, text.length());
    }
}

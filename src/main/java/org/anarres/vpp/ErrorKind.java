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

/**
 * The kinds of {@link PreprocessError}.
 */
public enum ErrorKind {

    /** A stray <code>`elsif</code>, <code>`else</code> or <code>`endif</code>. */
    UNMATCHED_DIRECTIVE,
    /** A conditional group still open at the end of the input. */
    UNTERMINATED_CONDITIONAL_AT_EOF,
    /** A macro invoked with the wrong number of arguments. */
    MACRO_ARITY_MISMATCH,
    /** Macro expansion nested beyond the recursion bound. */
    RECURSIVE_MACRO_EXPANSION,
    /** A macro argument list which reaches the end of the input. */
    UNTERMINATED_MACRO_CALL,
    /** A directive missing its operand, or with a malformed parameter list. */
    MALFORMED_DIRECTIVE,
    /** Conditional nesting which cannot be built into a flow tree. */
    MALFORMED_CONDITIONAL_NESTING,
    /** Conditional nesting deeper than the flow tree allows. */
    CONDITIONAL_NESTING_TOO_DEEP,
    /** A macro redefined with a different definition. Only ever a warning. */
    MACRO_REDEFINED;
}

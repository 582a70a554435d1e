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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nonnull;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The command-line driver.
 *
 * <pre>
 * jvpp [options] strip-comments file [replacement-char]
 * jvpp [options] multiple-compilation-unit file...
 * jvpp [options] generate-variants file
 * jvpp [options] list-defines file...
 * </pre>
 */
public class Main {

    private static final String USAGE
            = "usage: jvpp [options] command args...\n"
            + "available commands:\n"
            + "  strip-comments file [replacement-char]\n"
            + "    Prints the file with // and /**/ comments blanked out. Use '-' for stdin.\n"
            + "    An empty replacement deletes comments; any other single character\n"
            + "    replaces their contents. Newlines are kept.\n"
            + "  multiple-compilation-unit file...\n"
            + "    Preprocesses each file separately, printing the tokens and errors.\n"
            + "  generate-variants file\n"
            + "    Prints every variant of the file selected by its conditional\n"
            + "    directives, up to --limit-variants (20 by default).\n"
            + "  list-defines file...\n"
            + "    Prints the macros tested by conditional directives.\n"
            + "File arguments may include +define+NAME[=VALUE] and +incdir+DIR.\n";

    private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    /* Created after --debug is applied, since slf4j-simple reads its level once. */
    private Logger log;
    private PrintStream out;
    private PrintStream err;
    private InputStream in;
    private boolean debug;
    private boolean json;
    private int limitVariants = FlowTree.DEFAULT_MAX_VARIANTS;
    private final Set<Warning> warnings = EnumSet.noneOf(Warning.class);

    @Nonnull
    private static CharSequence getWarnings() {
        StringBuilder buf = new StringBuilder();
        for (Warning w : Warning.values()) {
            if (buf.length() > 0)
                buf.append(", ");
            String name = w.name().toLowerCase();
            buf.append(name.replace('_', '-'));
        }
        return buf;
    }

    public static void main(String[] args) throws Exception {
        System.exit(new Main().run(args, System.in, System.out, System.err));
    }

    /**
     * Runs one command.
     *
     * @return the exit status: 0 on success, 1 on any failure.
     */
    public int run(@Nonnull String[] args, @Nonnull InputStream in, @Nonnull PrintStream out, @Nonnull PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;

        OptionParser parser = new OptionParser();
        parser.posixlyCorrect(true);
        OptionSpec<?> helpOption = parser.accepts("help",
                "Displays command-line help.")
                .forHelp();
        OptionSpec<?> debugOption = parser.acceptsAll(Arrays.asList("debug"),
                "Enables debug output.");
        OptionSpec<?> jsonOption = parser.acceptsAll(Arrays.asList("json"),
                "Prints tokens, diagnostics and variants as JSON, one object per line.");
        OptionSpec<Integer> limitOption = parser.acceptsAll(Arrays.asList("limit-variants", "limit_variants"),
                "Maximum number of variants printed.")
                .withRequiredArg().ofType(Integer.class).describedAs("number")
                .defaultsTo(FlowTree.DEFAULT_MAX_VARIANTS);
        OptionSpec<String> warningOption = parser.acceptsAll(Arrays.asList("warning", "W"),
                "Enables the named warning class (" + getWarnings() + ").")
                .withRequiredArg().ofType(String.class).describedAs("warning");
        OptionSpec<String> argsOption = parser.nonOptions()
                .ofType(String.class).describedAs("command args...");

        OptionSet options;
        try {
            options = parser.parse(args);
        } catch (OptionException e) {
            err.println(e.getMessage());
            err.print(USAGE);
            return 1;
        }

        if (options.has(helpOption)) {
            out.print(USAGE);
            try {
                parser.printHelpOn(out);
            } catch (IOException e) {
                err.println(e.getMessage());
                return 1;
            }
            return 0;
        }

        this.debug = options.has(debugOption);
        if (debug)
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        this.log = LoggerFactory.getLogger(Main.class);
        this.json = options.has(jsonOption);
        this.limitVariants = options.valueOf(limitOption);
        if (limitVariants < 0) {
            err.println("--limit-variants must not be negative.");
            return 1;
        }

        for (String warning : options.valuesOf(warningOption)) {
            warning = warning.toUpperCase();
            warning = warning.replace('-', '_');
            try {
                if (warning.equals("ALL"))
                    warnings.addAll(EnumSet.allOf(Warning.class));
                else
                    warnings.add(Enum.valueOf(Warning.class, warning));
            } catch (IllegalArgumentException e) {
                err.println("Unknown warning: " + warning + " (expected one of " + getWarnings() + ")");
                return 1;
            }
        }

        List<String> words = options.valuesOf(argsOption);
        if (words.isEmpty()) {
            err.print(USAGE);
            return 1;
        }
        String command = words.get(0);
        List<String> rest = words.subList(1, words.size());
        if (debug)
            log.debug("Running " + command + " " + rest);

        try {
            if ("strip-comments".equals(command))
                stripComments(rest);
            else if ("multiple-compilation-unit".equals(command))
                multipleCompilationUnit(rest);
            else if ("generate-variants".equals(command))
                generateVariants(rest);
            else if ("list-defines".equals(command))
                listDefines(rest);
            else
                throw new UsageException("Unknown command: " + command + "\n" + USAGE);
            return 0;
        } catch (UsageException e) {
            err.println(e.getMessage());
            return 1;
        } catch (FlowTreeException e) {
            err.println(e.getMessage());
            return 1;
        } catch (IOException e) {
            log.debug("I/O failure", e);
            err.println(e.getMessage());
            return 1;
        }
    }

    @Nonnull
    private String read(@Nonnull String file) throws IOException {
        if (SourceFileList.STDIN.equals(file))
            return IOUtils.toString(in, StandardCharsets.UTF_8);
        return FileUtils.readFileToString(new File(file), StandardCharsets.UTF_8);
    }

    private void print(@Nonnull JsonElement element) {
        out.println(gson.toJson(element));
    }

    private void stripComments(@Nonnull List<String> args) throws UsageException, IOException {
        if (args.isEmpty())
            throw new UsageException("Missing file argument.  Use '-' for stdin.");
        if (args.size() > 2)
            throw new UsageException("Too many arguments.");
        char replacement = ' ';
        if (args.size() == 2) {
            String text = args.get(1);
            if (text.isEmpty())
                replacement = CommentStripper.DELETE;
            else if (text.length() == 1)
                replacement = text.charAt(0);
            else
                throw new UsageException("Replacement must be a single character.");
        }
        out.print(CommentStripper.strip(read(args.get(0)), replacement));
        out.flush();
    }

    /* Each compilation unit starts from the command-line macros alone. */
    @Nonnull
    /* pp */ Preprocessor newPreprocessor(@Nonnull String file, @Nonnull Map<String, String> defines) {
        Preprocessor pp = new Preprocessor();
        pp.addFeature(Feature.FILTER_BRANCHES);
        if (debug)
            pp.addFeature(Feature.DEBUG);
        pp.getWarnings().addAll(warnings);
        pp.setListener(new DefaultPreprocessorListener(file));
        pp.setFileName(file);
        for (Map.Entry<String, String> e : defines.entrySet())
            pp.addMacro(e.getKey(), e.getValue());
        return pp;
    }

    private void multipleCompilationUnit(@Nonnull List<String> args) throws UsageException, IOException {
        SourceFileList list = SourceFileList.parse(args);
        if (list.getFiles().isEmpty())
            throw new UsageException("ERROR: Missing file argument.");
        for (String file : list.getFiles()) {
            err.println(file + ":");
            String source = read(file);

            Preprocessor pp = newPreprocessor(file, list.getDefines());
            PreprocessorResult result = pp.process(source);
            if (json) {
                JsonObject object = result.toJson();
                object.addProperty("file", file);
                print(object);
            } else {
                for (PreprocessedToken tok : result.getTokens())
                    out.println(tok.getToken().getText());
                for (PreprocessError e : result.getErrors())
                    out.println(e);
                for (PreprocessError w : result.getWarnings())
                    out.println(w);
                out.println();
            }
        }
        out.flush();
    }

    @Nonnull
    private FlowTree tree(@Nonnull String file) throws IOException, FlowTreeException {
        try {
            return FlowTree.build(new VerilogLexer(read(file)).tokenize());
        } catch (FlowTreeException e) {
            err.print(file + ":");
            throw e;
        }
    }

    private void generateVariants(@Nonnull List<String> args) throws UsageException, IOException, FlowTreeException {
        SourceFileList list = SourceFileList.parse(args);
        if (list.getFiles().isEmpty())
            throw new UsageException("ERROR: Missing file argument.");
        if (list.getFiles().size() > 1)
            throw new UsageException("ERROR: generate-variants only works on one file.");
        FlowTree tree = tree(list.getFiles().get(0));

        /* The +define+ macros are fixed as defined. */
        Map<String, Boolean> initial = new LinkedHashMap<String, Boolean>();
        for (String name : list.getDefines().keySet())
            initial.put(name, Boolean.TRUE);

        GenerationStatus status = tree.generateVariants(initial, limitVariants, new VariantCallback() {
            @Override
            public boolean handleVariant(Variant variant) {
                if (json) {
                    print(variant.toJson());
                    return true;
                }
                err.println("Variant number " + (variant.getIndex() + 1) + ":");
                err.flush();
                for (Token tok : variant.getTokens())
                    out.println(tok.getText());
                out.flush();
                return true;
            }
        });
        if (debug)
            log.debug("Enumeration " + status);
    }

    private void listDefines(@Nonnull List<String> args) throws UsageException, IOException, FlowTreeException {
        SourceFileList list = SourceFileList.parse(args);
        if (list.getFiles().isEmpty())
            throw new UsageException("ERROR: Missing file argument.");
        for (String file : list.getFiles()) {
            Set<String> macros = tree(file).getConditionalMacros();
            if (json) {
                JsonObject object = new JsonObject();
                object.addProperty("file", file);
                JsonArray array = new JsonArray();
                for (String macro : macros)
                    array.add(macro);
                object.add("defines", array);
                print(object);
            } else {
                for (String macro : macros)
                    out.println(macro);
            }
        }
        out.flush();
    }
}

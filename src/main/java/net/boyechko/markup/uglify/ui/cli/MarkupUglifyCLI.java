/*
 * Markup-Uglify - HTML Minification and Text Extraction
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.markup.uglify.ui.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.Set;
import net.boyechko.markup.uglify.core.MarkupService;
import net.boyechko.markup.uglify.core.OutputMode;
import net.boyechko.markup.uglify.core.VerbosityLevel;
import net.boyechko.markup.uglify.ui.LoggingSetup;
import net.boyechko.markup.uglify.writer.HtmlMinifySettings;
import net.boyechko.markup.uglify.writer.HtmlToTextOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MarkupUglifyCLI {
    private static final String TEXT_SUFFIX = ".txt";
    private static final String MINIFIED_SUFFIX = ".min.html";

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path inputPath,
            Path outputPath,
            OutputMode mode,
            Set<HtmlToTextOption> textOptions,
            HtmlMinifySettings minifySettings,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (inputPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if (mode == null) {
                throw new IllegalArgumentException("Output mode is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
            textOptions = textOptions.isEmpty() ? Set.of() : Set.copyOf(textOptions);
        }

        /** Standard output is used when no output path was given. */
        public boolean writesToStdout() {
            return outputPath == null;
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments and resolves derived paths. */
    static class CLIConfigBuilder {
        Path inputPath;
        Path outputPath;
        OutputMode mode = OutputMode.MINIFY;
        final Set<HtmlToTextOption> textOptions = EnumSet.noneOf(HtmlToTextOption.class);
        HtmlMinifySettings minifySettings = HtmlMinifySettings.defaults();
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            if (inputPath == null) {
                throw new CLIException("No input file specified");
            }
            if (!Files.exists(inputPath)) {
                throw new CLIException("File not found: " + inputPath);
            }
            if (mode != OutputMode.TEXT && !textOptions.isEmpty()) {
                throw new CLIException("Text options require -t/--text");
            }

            if (outputPath != null && Files.isDirectory(outputPath)) {
                String baseName =
                        inputPath.getFileName().toString().replaceFirst("[.][^.]+$", "");
                String suffix = mode == OutputMode.TEXT ? TEXT_SUFFIX : MINIFIED_SUFFIX;
                outputPath = outputPath.resolve(baseName + suffix);
            }

            return new CLIConfig(
                    inputPath, outputPath, mode, textOptions, minifySettings, verbosity);
        }
    }

    public static void main(String[] args) {
        int exitCode = run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /** Runs the tool and returns the process exit code. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            if (isHelpRequested(args)) {
                out.println(usageMessage());
                return 0;
            }
            CLIConfig config = parseArguments(args);
            LoggingSetup.apply(config.verbosity());
            logger().info(
                            "Starting {} of {} with verbosity level {}",
                            config.mode(),
                            config.inputPath(),
                            config.verbosity());
            processFile(config, out);
            return 0;
        } catch (CLIException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("✗ Failed to process input: " + e.getMessage());
            return 1;
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (String arg : args) {
            switch (arg) {
                case "-t", "--text" -> b.mode = OutputMode.TEXT;
                case "-s", "--keep-structure" -> b.textOptions.add(HtmlToTextOption.KEEP_STRUCTURE);
                case "--keep-formatting" -> b.textOptions.add(HtmlToTextOption.KEEP_FORMATTING);
                case "--keep-escapes" -> b.textOptions.add(HtmlToTextOption.KEEP_HTML_ESCAPE);
                case "--keep-comments" ->
                        b.minifySettings = b.minifySettings.withRemoveComments(false);
                case "--no-collapse" ->
                        b.minifySettings = b.minifySettings.withCollapseWhitespace(false);
                case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                default -> {
                    if (arg.startsWith("-")) {
                        throw new CLIException("Unknown option: " + arg);
                    } else if (b.inputPath == null) {
                        b.inputPath = Paths.get(arg);
                    } else if (b.outputPath == null) {
                        b.outputPath = Paths.get(arg);
                    } else {
                        throw new CLIException("Too many file arguments: " + arg);
                    }
                }
            }
        }

        return b.build();
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(MarkupUglifyCLI.class);
        }
        return logger;
    }

    private static void processFile(CLIConfig config, PrintStream out) throws IOException {
        MarkupService service =
                new MarkupService.MarkupServiceBuilder()
                        .withMode(config.mode())
                        .withTextOptions(config.textOptions())
                        .withMinifySettings(config.minifySettings())
                        .build();

        if (config.writesToStdout()) {
            out.print(service.transform(config.inputPath()));
            out.flush();
        } else {
            service.transform(config.inputPath(), config.outputPath());
        }
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    private static String usageMessage() {
        return "Usage: markup-uglify [-t [-s] [--keep-formatting] [--keep-escapes]] [--keep-comments] [--no-collapse] [-q|-v|-vv] <inputpath> [<outputpath>]\n"
                + "  -h, --help            Show this help message\n"
                + "  -t, --text            Extract plain text from the document body instead of minifying\n"
                + "  -s, --keep-structure  (text) Keep line breaks, tabs and form feeds\n"
                + "  --keep-formatting     (text) Keep inline tags such as <b> and <a>\n"
                + "  --keep-escapes        (text) Leave &lt; &gt; &amp; as written\n"
                + "  --keep-comments       (minify) Keep all comments\n"
                + "  --no-collapse         (minify) Keep whitespace runs in text\n"
                + "  -q, --quiet           Only show errors\n"
                + "  -v, --verbose         Show processing steps\n"
                + "  -vv, --debug          Show all debug information\n"
                + "Without <outputpath> the result is written to standard output.\n"
                + "Examples:\n"
                + "  markup-uglify page.html page.min.html\n"
                + "  markup-uglify -t -s page.html\n"
                + "  markup-uglify -t --keep-formatting page.html out/";
    }
}

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
package net.boyechko.markup.uglify;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import net.boyechko.markup.uglify.core.MarkupService;
import net.boyechko.markup.uglify.core.OutputMode;
import net.boyechko.markup.uglify.writer.HtmlToTextOption;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Runs text extraction over each input fixture and compares the result with its expected file.
 *
 * <p>To add a case, drop an HTML file into {@code fixtures/input}, write the expected text to
 * {@code fixtures/expected} and add a row below. Expected files are compared byte for byte, so
 * they must not end with an editor-added newline.
 */
class FixtureComparisonTest extends FixtureTestBase {

    @ParameterizedTest(name = "{0} [{1}] -> {2}")
    @CsvSource({
        "list.html,       '',              list.txt",
        "list.html,       KEEP_STRUCTURE,  list.structure.txt",
        "formatting.html, KEEP_FORMATTING, formatting.txt",
        "scripted.html,   '',              scripted.txt",
        "scripted.html,   KEEP_STRUCTURE,  scripted.structure.txt",
    })
    void extractedTextMatchesExpected(String input, String options, String expected)
            throws Exception {
        MarkupService service =
                new MarkupService.MarkupServiceBuilder()
                        .withMode(OutputMode.TEXT)
                        .withTextOptions(parseOptions(options))
                        .build();

        Path output = testOutputDir().resolve(expected);
        service.transform(inputFile(input), output);

        assertTrue(Files.exists(output), "Output file should be written");
        assertMatchesExpected(expected, Files.readString(output));
    }

    private static Set<HtmlToTextOption> parseOptions(String options) {
        Set<HtmlToTextOption> parsed = EnumSet.noneOf(HtmlToTextOption.class);
        if (options == null || options.isBlank()) {
            return parsed;
        }
        Arrays.stream(options.split("\\+"))
                .map(String::trim)
                .map(HtmlToTextOption::valueOf)
                .forEach(parsed::add);
        return parsed;
    }
}

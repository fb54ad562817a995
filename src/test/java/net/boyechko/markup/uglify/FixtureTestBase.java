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

import static org.junit.jupiter.api.Assertions.fail;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.junit.jupiter.api.io.TempDir;

/**
 * Base for tests that compare produced output with checked-in expected files. Outputs land in a
 * temp dir, or under {@code -Dmarkup.uglify.testOutputDir} when set so they can be inspected.
 */
public abstract class FixtureTestBase {
    protected static final Path FIXTURES_DIR = Path.of("src/test/resources/fixtures");
    protected static final Path INPUT_DIR = FIXTURES_DIR.resolve("input");
    protected static final Path EXPECTED_DIR = FIXTURES_DIR.resolve("expected");

    @TempDir Path tempDir;
    private Path outputDir;
    private String testClassName;

    @BeforeEach
    void captureTestName(TestInfo testInfo) {
        testClassName =
                testInfo.getTestClass()
                        .map(Class::getSimpleName)
                        .orElse(getClass().getSimpleName());
    }

    /** Returns {baseDir}/{testClassName}/, creating it if needed. */
    protected final Path testOutputDir() {
        if (outputDir != null) {
            return outputDir;
        }
        String configured = System.getProperty("markup.uglify.testOutputDir");
        Path baseDir = configured != null && !configured.isBlank() ? Path.of(configured) : tempDir;
        Path dir = baseDir.resolve(testClassName != null ? testClassName : getClass().getSimpleName());
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create test output dir: " + dir, e);
        }
        outputDir = dir;
        return outputDir;
    }

    protected final Path inputFile(String name) {
        return INPUT_DIR.resolve(name);
    }

    protected static String readExpected(String name) throws IOException {
        return Files.readString(EXPECTED_DIR.resolve(name), StandardCharsets.UTF_8);
    }

    /** Fails with a unified diff when {@code actual} differs from the expected file. */
    protected static void assertMatchesExpected(String expectedName, String actual)
            throws IOException {
        String expected = readExpected(expectedName);
        if (!expected.equals(actual)) {
            fail(
                    "Output does not match "
                            + EXPECTED_DIR.resolve(expectedName)
                            + "\n\n"
                            + unifiedDiff(visible(expected), visible(actual)));
        }
    }

    /** Makes trailing spaces and control characters visible in diffs. */
    private static String visible(String text) {
        return text.replace(" \n", "·\n").replace("\t", "→").replaceAll(" $", "·");
    }

    private static String unifiedDiff(String expected, String actual) {
        List<String> expectedLines = expected.lines().toList();
        List<String> actualLines = actual.lines().toList();
        Patch<String> patch = DiffUtils.diff(expectedLines, actualLines);
        List<String> diff =
                UnifiedDiffUtils.generateUnifiedDiff(
                        "expected", "actual", expectedLines, patch, 2);
        return String.join("\n", diff);
    }
}
